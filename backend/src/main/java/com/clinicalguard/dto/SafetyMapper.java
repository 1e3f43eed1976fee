package com.clinicalguard.dto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.clinicalguard.knowledge.Concept;
import com.clinicalguard.service.EvaluationResult;
import com.clinicalguard.signal.DecisionSignal;
import com.clinicalguard.signal.Finding;
import com.clinicalguard.signal.SignalSummary;
import com.clinicalguard.snapshot.SafetySnapshot;
import com.clinicalguard.validation.DiagnosisValidation;
import com.clinicalguard.validation.PrescriptionValidation;
import com.clinicalguard.validation.ValidationIssue;

/**
 * Domain results to response DTOs.
 */
@Component
public class SafetyMapper {

    public SafetyDTO.SignalResponse toSignalResponse(String signalId, EvaluationResult result) {
        DecisionSignal signal = result.getSignal();
        return SafetyDTO.SignalResponse.builder()
            .signalId(signalId)
            .color(signal.getColor())
            .overridePolicy(signal.getOverridePolicy())
            .findings(signal.getFindings().stream().map(this::toFindingResponse).collect(Collectors.toList()))
            .summary(toSummary(result.getSummary()))
            .prescription(result.getPrescription() != null ? toPrescriptionResponse(result.getPrescription()) : null)
            .diagnosis(result.getDiagnosis() != null ? toDiagnosisResponse(result.getDiagnosis()) : null)
            .snapshotGeneration(result.getSnapshotGeneration())
            .rulesEvaluated(result.getRulesEvaluated())
            .evaluatedAt(Instant.now())
            .build();
    }

    public SafetyDTO.FindingResponse toFindingResponse(Finding finding) {
        return SafetyDTO.FindingResponse.builder()
            .sourceId(finding.getSourceId())
            .kind(finding.getSource())
            .category(finding.getCategory())
            .severity(finding.getSeverity())
            .color(finding.getColor())
            .message(finding.getMessage())
            .outcomeTag(finding.getOutcomeTag())
            .blocking(finding.isBlocking())
            .build();
    }

    public SafetyDTO.DiagnosisResponse toDiagnosisResponse(DiagnosisValidation validation) {
        return SafetyDTO.DiagnosisResponse.builder()
            .valid(validation.isValid())
            .confidence(validation.getConfidence())
            .concept(toConceptResponse(validation.getConcept()))
            .build();
    }

    public SafetyDTO.PrescriptionResponse toPrescriptionResponse(PrescriptionValidation validation) {
        return SafetyDTO.PrescriptionResponse.builder()
            .valid(validation.isValid())
            .confidence(validation.getConfidence())
            .fuzzyMatch(validation.isFuzzyMatch())
            .concept(toConceptResponse(validation.getConcept()))
            .issues(validation.getIssues().stream().map(this::toIssueResponse).collect(Collectors.toList()))
            .build();
    }

    public SafetyDTO.SnapshotStatus toSnapshotStatus(SafetySnapshot snapshot) {
        return SafetyDTO.SnapshotStatus.builder()
            .generation(snapshot.getGeneration())
            .loadedAt(snapshot.getLoadedAt())
            .conceptCount(snapshot.getKnowledge().conceptCount())
            .interactionCount(snapshot.getKnowledge().interactionCount())
            .contraindicationCount(snapshot.getKnowledge().contraindicationCount())
            .ruleCount(snapshot.getRules().size())
            .skippedRuleIds(snapshot.getRules().getSkippedRuleIds())
            .build();
    }

    private Map<String, SafetyDTO.SummaryCounts> toSummary(SignalSummary summary) {
        Map<String, SafetyDTO.SummaryCounts> counts = new LinkedHashMap<>();
        if (summary != null) {
            summary.getCategories().forEach((category, c) -> counts.put(category,
                SafetyDTO.SummaryCounts.builder().red(c.getRed()).yellow(c.getYellow()).build()));
        }
        return counts;
    }

    private SafetyDTO.IssueResponse toIssueResponse(ValidationIssue issue) {
        return SafetyDTO.IssueResponse.builder()
            .issueId(issue.getIssueId())
            .kind(issue.getKind())
            .severity(issue.getSeverity())
            .message(issue.getMessage())
            .evidenceConceptIds(new ArrayList<>(issue.getEvidenceConceptIds()))
            .factBacked(issue.isFactBacked())
            .build();
    }

    private SafetyDTO.ConceptResponse toConceptResponse(Concept concept) {
        if (concept == null) {
            return null;
        }
        return SafetyDTO.ConceptResponse.builder()
            .id(concept.getId())
            .displayName(concept.getDisplayName())
            .kind(concept.getKind())
            .active(concept.isActive())
            .build();
    }
}
