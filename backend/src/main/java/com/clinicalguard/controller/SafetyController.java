package com.clinicalguard.controller;

import com.clinicalguard.dto.SafetyDTO;
import com.clinicalguard.dto.SafetyMapper;
import com.clinicalguard.entity.AuditLog;
import com.clinicalguard.fhir.DetectedIssueMapper;
import com.clinicalguard.service.AuditService;
import com.clinicalguard.service.ClinicalSafetyService;
import com.clinicalguard.service.EvaluationResult;
import com.clinicalguard.snapshot.SafetySnapshot;
import com.clinicalguard.validation.PrescriptionContext;
import ca.uhn.fhir.context.FhirContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.hl7.fhir.r4.model.Bundle;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/safety")
@RequiredArgsConstructor
@Tag(name = "Safety", description = "Prescription and diagnosis safety signals")
public class SafetyController {

    static final String FHIR_JSON = "application/fhir+json";

    private final ClinicalSafetyService safetyService;
    private final SafetyMapper mapper;
    private final AuditService auditService;
    private final DetectedIssueMapper detectedIssueMapper;
    private final FhirContext fhirContext;

    @PostMapping("/evaluate")
    @Operation(summary = "Evaluate captured data and return a traffic-light signal")
    public ResponseEntity<SafetyDTO.SignalResponse> evaluate(@RequestBody SafetyDTO.EvaluateRequest request) {
        String signalId = UUID.randomUUID().toString();
        EvaluationResult result = safetyService.evaluate(request);
        auditService.logSignal(signalId, request != null ? request.getEncounterRef() : null, result.getSignal());
        return ResponseEntity.ok(mapper.toSignalResponse(signalId, result));
    }

    @PostMapping(value = "/evaluate/fhir", produces = FHIR_JSON)
    @Operation(summary = "Evaluate and return the findings as a FHIR R4 Bundle of DetectedIssue")
    public ResponseEntity<String> evaluateAsFhir(@RequestBody SafetyDTO.EvaluateRequest request) {
        String signalId = UUID.randomUUID().toString();
        EvaluationResult result = safetyService.evaluate(request);
        auditService.logSignal(signalId, request != null ? request.getEncounterRef() : null, result.getSignal());
        Bundle bundle = detectedIssueMapper.toBundle(signalId, result.getSignal());
        return ResponseEntity.ok(fhirContext.newJsonParser().encodeResourceToString(bundle));
    }

    @PostMapping("/validate/diagnosis")
    @Operation(summary = "Identify a diagnosis code or name")
    public ResponseEntity<SafetyDTO.DiagnosisResponse> validateDiagnosis(
            @RequestBody SafetyDTO.DiagnosisRequest request) {
        return ResponseEntity.ok(mapper.toDiagnosisResponse(safetyService.validateDiagnosis(request.getText())));
    }

    @PostMapping("/validate/prescription")
    @Operation(summary = "Identify a drug and check it against the given context")
    public ResponseEntity<SafetyDTO.PrescriptionResponse> validatePrescription(
            @RequestBody SafetyDTO.PrescriptionRequest request) {
        PrescriptionContext context = PrescriptionContext.builder()
            .diagnosisIds(orEmpty(request.getDiagnosisIds()))
            .currentMedications(orEmpty(request.getCurrentMedications()))
            .allergies(orEmpty(request.getAllergies()))
            .build();
        return ResponseEntity.ok(mapper.toPrescriptionResponse(
            safetyService.validatePrescription(request.getDrugText(), request.getContextText(), context)));
    }

    @GetMapping("/snapshot")
    @Operation(summary = "Describe the knowledge and rule snapshot currently in use")
    public ResponseEntity<SafetyDTO.SnapshotStatus> getSnapshot() {
        return ResponseEntity.ok(mapper.toSnapshotStatus(safetyService.currentSnapshot()));
    }

    @PostMapping("/snapshot/refresh")
    @Operation(summary = "Reload knowledge and rules now")
    public ResponseEntity<SafetyDTO.SnapshotStatus> refreshSnapshot() {
        SafetySnapshot snapshot = safetyService.refreshSnapshot();
        auditService.log(AuditLog.AuditAction.SNAPSHOT_REFRESHED, "SafetySnapshot",
            String.valueOf(snapshot.getGeneration()), null, "Snapshot refresh requested");
        return ResponseEntity.ok(mapper.toSnapshotStatus(snapshot));
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? values : List.of();
    }
}
