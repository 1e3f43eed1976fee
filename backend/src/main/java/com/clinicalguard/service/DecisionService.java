package com.clinicalguard.service;

import java.time.Instant;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import com.clinicalguard.config.GuardProperties;
import com.clinicalguard.dto.DecisionDTO;
import com.clinicalguard.entity.AuditLog;
import com.clinicalguard.entity.AuditLog.AuditAction;
import com.clinicalguard.repository.AuditLogRepository;
import com.clinicalguard.signal.OverridePolicy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Records what the clinician did with a signal.
 *
 * Accepting a signal is always allowed. Overriding follows the signal's
 * policy: BLOCKED is never overridable, REQUIRES_JUSTIFICATION needs a written
 * justification and REQUIRES_SUPERVISOR also needs an approving supervisor
 * other than the clinician.
 * The policy the client declares is checked against the one recorded when the
 * signal was issued and the stricter of the two applies.
 * Rejected overrides are audited before the exception is thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DecisionService {

    private final AuditService auditService;
    private final GuardProperties properties;
    private final AuditLogRepository auditLogRepository;

    public DecisionDTO.Response record(String clinicianId, DecisionDTO.Request request) {
        if (request == null || request.getAction() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Decision action is required");
        }
        OverridePolicy declared = request.getOverridePolicy() != null ? request.getOverridePolicy() : OverridePolicy.NONE;
        OverridePolicy policy = effectivePolicy(request.getSignalId(), declared);

        AuditAction recordedAs;
        if (request.getAction() == DecisionDTO.DecisionAction.ACCEPT || policy == OverridePolicy.NONE) {
            recordedAs = AuditAction.DECISION_ACCEPTED;
        } else {
            String problem = overrideProblem(policy, clinicianId, request);
            if (problem != null) {
                log.warn("Override of signal {} rejected: {}", request.getSignalId(), problem);
                audit(AuditAction.OVERRIDE_REJECTED, request, policy, problem);
                throw new OverrideRejectedException(problem);
            }
            recordedAs = policy == OverridePolicy.REQUIRES_SUPERVISOR
                ? AuditAction.OVERRIDE_SUPERVISED
                : AuditAction.OVERRIDE_JUSTIFIED;
        }

        audit(recordedAs, request, policy, "Decision " + request.getAction() + " on " + policy + " signal");
        log.info("Recorded {} for signal {} by {}", recordedAs, request.getSignalId(), clinicianId);
        return DecisionDTO.Response.builder()
            .signalId(request.getSignalId())
            .action(request.getAction())
            .overridePolicy(policy)
            .recordedAs(recordedAs)
            .recordedAt(Instant.now())
            .build();
    }

    /**
     * Stricter of the declared policy and the one audited with the signal.
     * An unknown signal id keeps the declared policy, the issuing audit row
     * is written asynchronously and may not have landed yet.
     */
    private OverridePolicy effectivePolicy(String signalId, OverridePolicy declared) {
        if (signalId == null || signalId.isBlank()) {
            return declared;
        }
        OverridePolicy recorded = auditLogRepository
            .findFirstByEntityIdAndActionOrderByOccurredAtDesc(signalId, AuditAction.SIGNAL_ISSUED)
            .map(AuditLog::getOverridePolicy)
            .map(DecisionService::parsePolicy)
            .orElse(null);
        if (recorded == null) {
            return declared;
        }
        if (recorded != declared) {
            log.warn("Signal {} declared {} but was issued as {}", signalId, declared, recorded);
        }
        return declared.strictest(recorded);
    }

    private static OverridePolicy parsePolicy(String name) {
        try {
            return OverridePolicy.valueOf(name);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown override policy {} in audit log", name);
            return null;
        }
    }

    private String overrideProblem(OverridePolicy policy, String clinicianId, DecisionDTO.Request request) {
        if (!policy.isOverridable()) {
            return "Signal is blocked and cannot be overridden";
        }
        int minimum = properties.getDecisions().getMinJustificationLength();
        String justification = request.getJustification();
        if (justification == null || justification.trim().length() < minimum) {
            return "Override justification must be at least " + minimum + " characters";
        }
        if (policy == OverridePolicy.REQUIRES_SUPERVISOR
            && (request.getSupervisorId() == null || request.getSupervisorId().isBlank())) {
            return "Override requires supervisor approval";
        }
        if (policy == OverridePolicy.REQUIRES_SUPERVISOR && request.getSupervisorId().equals(clinicianId)) {
            return "Supervisor must be someone other than the prescribing clinician";
        }
        return null;
    }

    private void audit(AuditAction action, DecisionDTO.Request request, OverridePolicy policy, String description) {
        auditService.logDecision(action, request.getSignalId(), request.getEncounterRef(),
            request.getColor() != null ? request.getColor().name() : null, policy.name(),
            request.getJustification(), request.getSupervisorId(), description);
    }
}
