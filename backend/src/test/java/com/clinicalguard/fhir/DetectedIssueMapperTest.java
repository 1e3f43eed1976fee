package com.clinicalguard.fhir;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.DetectedIssue;
import org.hl7.fhir.r4.model.Extension;
import org.hl7.fhir.r4.model.StringType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.clinicalguard.knowledge.Severity;
import com.clinicalguard.signal.DecisionSignal;
import com.clinicalguard.signal.Finding;
import com.clinicalguard.signal.FindingSource;
import com.clinicalguard.signal.OverridePolicy;
import com.clinicalguard.signal.SignalColor;

import ca.uhn.fhir.context.FhirContext;

@DisplayName("DetectedIssueMapper Tests")
class DetectedIssueMapperTest {

    private final DetectedIssueMapper mapper = new DetectedIssueMapper();

    private static Finding finding(String id, FindingSource source, SignalColor color, String tag) {
        return Finding.builder()
            .sourceId(id)
            .source(source)
            .severity(color == SignalColor.RED ? Severity.HIGH : Severity.MODERATE)
            .color(color)
            .message("message for " + id)
            .outcomeTag(tag)
            .build();
    }

    @Test
    @DisplayName("One DetectedIssue per finding, in signal order")
    void shouldMapEveryFinding() {
        DecisionSignal signal = new DecisionSignal(SignalColor.RED, List.of(
            finding("INTERACTION:a:b", FindingSource.INTERACTION, SignalColor.RED, null),
            finding("CONTROLLED-SUBSTANCE", FindingSource.RULE, SignalColor.RED, "REQUIRE_SUPERVISOR_SIGNOFF"),
            finding("CONTRAINDICATION:a:N18.3", FindingSource.CONTRAINDICATION, SignalColor.YELLOW, null)),
            OverridePolicy.REQUIRES_SUPERVISOR);

        Bundle bundle = mapper.toBundle("signal-1", signal);

        assertEquals(Bundle.BundleType.COLLECTION, bundle.getType());
        assertEquals("signal-1", bundle.getIdentifier().getValue());
        assertEquals(3, bundle.getEntry().size());

        DetectedIssue first = (DetectedIssue) bundle.getEntry().get(0).getResource();
        assertEquals("INTERACTION:a:b", first.getIdentifierFirstRep().getValue());
        assertEquals(DetectedIssue.DetectedIssueSeverity.HIGH, first.getSeverity());
        assertEquals("DRG", first.getCode().getCodingFirstRep().getCode());

        DetectedIssue rule = (DetectedIssue) bundle.getEntry().get(1).getResource();
        Coding ruleCode = rule.getCode().getCodingFirstRep();
        assertEquals(DetectedIssueMapper.RULE_CODE_SYSTEM, ruleCode.getSystem());
        assertEquals("REQUIRE_SUPERVISOR_SIGNOFF", ruleCode.getCode());

        DetectedIssue third = (DetectedIssue) bundle.getEntry().get(2).getResource();
        assertEquals(DetectedIssue.DetectedIssueSeverity.MODERATE, third.getSeverity());
        assertEquals("COND", third.getCode().getCodingFirstRep().getCode());
    }

    @Test
    @DisplayName("Each issue carries the override policy")
    void shouldCarryOverridePolicy() {
        DetectedIssue issue = mapper.toDetectedIssue(
            finding("ALLERGY:x:y", FindingSource.ALLERGY, SignalColor.RED, null), OverridePolicy.BLOCKED);

        Extension extension = issue.getExtensionByUrl(DetectedIssueMapper.OVERRIDE_POLICY_EXTENSION);
        assertNotNull(extension);
        assertEquals("BLOCKED", ((StringType) extension.getValue()).getValue());
        assertEquals(DetectedIssue.DetectedIssueStatus.FINAL, issue.getStatus());
        assertEquals("ALGY", issue.getCode().getCodingFirstRep().getCode());
    }

    @Test
    @DisplayName("Entry urls are stable for the same signal and finding")
    void shouldDeriveStableFullUrls() {
        DecisionSignal signal = new DecisionSignal(SignalColor.YELLOW, List.of(
            finding("DUPLICATE_THERAPY:a:b", FindingSource.DUPLICATE_THERAPY, SignalColor.YELLOW, null)),
            OverridePolicy.REQUIRES_JUSTIFICATION);

        String first = mapper.toBundle("signal-9", signal).getEntryFirstRep().getFullUrl();
        String second = mapper.toBundle("signal-9", signal).getEntryFirstRep().getFullUrl();

        assertTrue(first.startsWith("urn:uuid:"));
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Green signal gives an empty bundle that still encodes")
    void shouldEncodeEmptyBundle() {
        Bundle bundle = mapper.toBundle("signal-0", DecisionSignal.green());

        String json = FhirContext.forR4().newJsonParser().encodeResourceToString(bundle);

        assertTrue(bundle.getEntry().isEmpty());
        assertTrue(json.contains("\"resourceType\":\"Bundle\""));
    }
}
