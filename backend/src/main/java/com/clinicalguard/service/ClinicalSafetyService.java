package com.clinicalguard.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.clinicalguard.config.GuardProperties;
import com.clinicalguard.dto.SafetyDTO;
import com.clinicalguard.knowledge.Concept;
import com.clinicalguard.knowledge.KnowledgeBase;
import com.clinicalguard.rules.FactContext;
import com.clinicalguard.rules.RuleEvaluator;
import com.clinicalguard.rules.RuleOutcome;
import com.clinicalguard.signal.DecisionSignal;
import com.clinicalguard.signal.SignalAggregator;
import com.clinicalguard.signal.SignalSummary;
import com.clinicalguard.snapshot.SafetySnapshot;
import com.clinicalguard.snapshot.SnapshotRegistry;
import com.clinicalguard.validation.DeterministicValidator;
import com.clinicalguard.validation.DiagnosisValidation;
import com.clinicalguard.validation.PrescriptionContext;
import com.clinicalguard.validation.PrescriptionValidation;
import com.clinicalguard.validation.ValidationIssue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one safety evaluation: deterministic validation of the captured
 * prescription and diagnosis, rule evaluation over the caller's facts, and
 * aggregation into a single signal.
 *
 * Each call reads the snapshot reference once, so a concurrent refresh never
 * mixes knowledge or rules from two generations in one result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClinicalSafetyService {

    private final SnapshotRegistry snapshotRegistry;
    private final DeterministicValidator validator;
    private final RuleEvaluator ruleEvaluator;
    private final SignalAggregator aggregator;
    private final GuardProperties properties;

    public EvaluationResult evaluate(SafetyDTO.EvaluateRequest request) {
        SafetySnapshot snapshot = snapshotRegistry.current();
        if (request == null) {
            DecisionSignal green = DecisionSignal.green();
            return new EvaluationResult(green, SignalSummary.of(green.getFindings()), null, null,
                snapshot.getGeneration(), snapshot.getRules().size());
        }

        KnowledgeBase knowledge = snapshot.getKnowledge();
        GuardProperties.Fields names = properties.getFields();
        Map<String, String> fields = request.getStructuredFields() != null ? request.getStructuredFields() : Map.of();

        String diagnosisText = fields.get(names.getDiagnosis());
        DiagnosisValidation diagnosis = isBlank(diagnosisText) ? null
            : validator.validateDiagnosis(knowledge, diagnosisText);

        String medicationText = fields.get(names.getMedication());
        PrescriptionValidation prescription = null;
        if (!isBlank(medicationText)) {
            PrescriptionContext context = buildContext(knowledge, fields, names);
            prescription = validator.validatePrescription(knowledge, medicationText, request.getCapturedText(), context);
        }

        List<ValidationIssue> issues = prescription != null ? prescription.getIssues() : List.of();
        List<RuleOutcome> outcomes = ruleEvaluator.evaluate(snapshot.getRules(), FactContext.of(request.getFactContext()));
        DecisionSignal signal = aggregator.aggregate(issues, outcomes);

        log.info("Evaluated on snapshot #{}: {} ({} issues, {} rule findings, policy {})",
            snapshot.getGeneration(), signal.getColor(), issues.size(), outcomes.size(), signal.getOverridePolicy());
        return new EvaluationResult(signal, SignalSummary.of(signal.getFindings()), prescription, diagnosis,
            snapshot.getGeneration(), snapshot.getRules().size());
    }

    public DiagnosisValidation validateDiagnosis(String text) {
        return validator.validateDiagnosis(snapshotRegistry.current().getKnowledge(), text);
    }

    public PrescriptionValidation validatePrescription(String drugText, String contextText, PrescriptionContext context) {
        return validator.validatePrescription(snapshotRegistry.current().getKnowledge(), drugText, contextText, context);
    }

    public SafetySnapshot currentSnapshot() {
        return snapshotRegistry.current();
    }

    public SafetySnapshot refreshSnapshot() {
        return snapshotRegistry.refresh();
    }

    private PrescriptionContext buildContext(KnowledgeBase knowledge, Map<String, String> fields,
                                             GuardProperties.Fields names) {
        Pattern separator = Pattern.compile(names.getListSeparator());
        PrescriptionContext.PrescriptionContextBuilder context = PrescriptionContext.builder();
        for (String entry : split(fields.get(names.getDiagnosis()), separator)) {
            // unresolved diagnosis entries contribute nothing
            knowledge.resolveDiagnosis(entry).map(Concept::getId).ifPresent(context::diagnosisId);
        }
        split(fields.get(names.getCurrentMedications()), separator).forEach(context::currentMedication);
        split(fields.get(names.getAllergies()), separator).forEach(context::allergy);
        return context.build();
    }

    private static List<String> split(String value, Pattern separator) {
        List<String> parts = new ArrayList<>();
        if (isBlank(value)) {
            return parts;
        }
        for (String part : separator.split(value)) {
            if (!part.isBlank()) {
                parts.add(part.trim());
            }
        }
        return parts;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
