package com.clinicalguard.snapshot;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Safety knowledge could not be loaded. At startup this is fatal: the
 * application refuses to serve evaluations without safety data.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class KnowledgeUnavailableException extends RuntimeException {

    public KnowledgeUnavailableException(String message) {
        super(message);
    }

    public KnowledgeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
