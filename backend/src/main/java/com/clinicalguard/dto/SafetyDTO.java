package com.clinicalguard.dto;

import com.clinicalguard.knowledge.ConceptKind;
import com.clinicalguard.knowledge.Severity;
import com.clinicalguard.signal.FindingSource;
import com.clinicalguard.signal.OverridePolicy;
import com.clinicalguard.signal.SignalColor;
import com.clinicalguard.validation.IssueKind;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class SafetyDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EvaluateRequest {
        private String encounterRef;
        private String capturedText;
        private Map<String, String> structuredFields;
        private Map<String, Object> factContext;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DiagnosisRequest {
        private String text;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PrescriptionRequest {
        private String drugText;
        private String contextText;
        private List<String> diagnosisIds;
        private List<String> currentMedications;
        private List<String> allergies;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SignalResponse {
        private String signalId;
        private SignalColor color;
        private OverridePolicy overridePolicy;
        private List<FindingResponse> findings;
        private Map<String, SummaryCounts> summary;
        private PrescriptionResponse prescription;
        private DiagnosisResponse diagnosis;
        private long snapshotGeneration;
        private int rulesEvaluated;
        private Instant evaluatedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SummaryCounts {
        private int red;
        private int yellow;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FindingResponse {
        private String sourceId;
        private FindingSource kind;
        private String category;
        private Severity severity;
        private SignalColor color;
        private String message;
        private String outcomeTag;
        private boolean blocking;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConceptResponse {
        private String id;
        private String displayName;
        private ConceptKind kind;
        private boolean active;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DiagnosisResponse {
        private boolean valid;
        private int confidence;
        private ConceptResponse concept;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PrescriptionResponse {
        private boolean valid;
        private int confidence;
        private boolean fuzzyMatch;
        private ConceptResponse concept;
        private List<IssueResponse> issues;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IssueResponse {
        private String issueId;
        private IssueKind kind;
        private Severity severity;
        private String message;
        private List<String> evidenceConceptIds;
        private boolean factBacked;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SnapshotStatus {
        private long generation;
        private Instant loadedAt;
        private int conceptCount;
        private int interactionCount;
        private int contraindicationCount;
        private int ruleCount;
        private Set<String> skippedRuleIds;
    }
}
