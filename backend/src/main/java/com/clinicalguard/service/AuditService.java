package com.clinicalguard.service;

import com.clinicalguard.entity.AuditLog;
import com.clinicalguard.signal.DecisionSignal;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Instant;

/**
 * Builds audit entries for issued signals and clinician decisions.
 *
 * User and request details are read here, on the request thread, because
 * neither the security context nor the request survives the hop to
 * {@link AuditWriter}.
 */
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditWriter auditWriter;

    public void log(AuditLog.AuditAction action, String entityType, String entityId,
                    String encounterRef, String description) {
        auditWriter.write(baseEntry(action, entityType, entityId, encounterRef, description).build());
    }

    public void logSignal(String signalId, String encounterRef, DecisionSignal signal) {
        AuditLog entry = baseEntry(AuditLog.AuditAction.SIGNAL_ISSUED, "DecisionSignal", signalId, encounterRef,
                "Signal " + signal.getColor() + " with " + signal.getFindings().size() + " findings")
            .signalColor(signal.getColor().name())
            .overridePolicy(signal.getOverridePolicy().name())
            .build();
        auditWriter.write(entry);
    }

    public void logDecision(AuditLog.AuditAction action, String signalId, String encounterRef,
                            String signalColor, String overridePolicy, String justification,
                            String supervisorId, String description) {
        AuditLog entry = baseEntry(action, "DecisionSignal", signalId, encounterRef, description)
            .signalColor(signalColor)
            .overridePolicy(overridePolicy)
            .justification(justification)
            .supervisorId(supervisorId)
            .build();
        auditWriter.write(entry);
    }

    private AuditLog.AuditLogBuilder baseEntry(AuditLog.AuditAction action, String entityType, String entityId,
                                               String encounterRef, String description) {
        AuditLog.AuditLogBuilder builder = AuditLog.builder()
            .action(action)
            .entityType(entityType)
            .entityId(entityId)
            .encounterRef(encounterRef)
            .description(description)
            .occurredAt(Instant.now());

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof Jwt jwt) {
            builder.userId(jwt.getSubject());
            builder.userEmail(jwt.getClaimAsString("email"));
        }

        ServletRequestAttributes attrs =
            (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs != null) {
            HttpServletRequest request = attrs.getRequest();
            builder.ipAddress(getClientIpAddress(request));
            builder.userAgent(request.getHeader("User-Agent"));
        }
        return builder;
    }

    private String getClientIpAddress(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
