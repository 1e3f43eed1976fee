package com.clinicalguard.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class OverrideRejectedException extends RuntimeException {

    public OverrideRejectedException(String message) {
        super(message);
    }
}
