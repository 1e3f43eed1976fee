package com.clinicalguard.dto;

import com.clinicalguard.entity.AuditLog;
import com.clinicalguard.signal.OverridePolicy;
import com.clinicalguard.signal.SignalColor;
import lombok.*;

import java.time.Instant;
import java.util.List;

public class DecisionDTO {

    public enum DecisionAction {
        ACCEPT,   // follow the signal, e.g. cancel or change the order
        OVERRIDE  // proceed despite the signal
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Request {
        private String signalId;
        private String encounterRef;
        private SignalColor color;
        private OverridePolicy overridePolicy;
        private List<String> findingIds;
        private DecisionAction action;
        private String justification;
        private String supervisorId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private String signalId;
        private DecisionAction action;
        private OverridePolicy overridePolicy;
        private AuditLog.AuditAction recordedAs;
        private Instant recordedAt;
    }
}
