package com.clinicalguard.fhir;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.UUID;

import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.DateTimeType;
import org.hl7.fhir.r4.model.DetectedIssue;
import org.hl7.fhir.r4.model.DetectedIssue.DetectedIssueSeverity;
import org.hl7.fhir.r4.model.DetectedIssue.DetectedIssueStatus;
import org.hl7.fhir.r4.model.Extension;
import org.hl7.fhir.r4.model.StringType;
import org.springframework.stereotype.Component;

import com.clinicalguard.signal.DecisionSignal;
import com.clinicalguard.signal.Finding;
import com.clinicalguard.signal.OverridePolicy;
import com.clinicalguard.signal.SignalColor;

/**
 * Exports a decision signal as a FHIR R4 collection Bundle with one
 * DetectedIssue per finding.
 *
 * Finding kinds map to HL7 v3 ActCode alert codes; fired rules carry their
 * outcome tag under a local code system. Each issue carries the signal's
 * override policy as an extension.
 */
@Component
public class DetectedIssueMapper {

    static final String ACT_CODE_SYSTEM = "http://terminology.hl7.org/CodeSystem/v3-ActCode";
    static final String RULE_CODE_SYSTEM = "urn:clinicalguard:rule-outcome";
    static final String FINDING_ID_SYSTEM = "urn:clinicalguard:finding";
    static final String SIGNAL_ID_SYSTEM = "urn:clinicalguard:signal";
    static final String OVERRIDE_POLICY_EXTENSION = "urn:clinicalguard:extension:override-policy";

    public Bundle toBundle(String signalId, DecisionSignal signal) {
        Bundle bundle = new Bundle();
        bundle.setType(Bundle.BundleType.COLLECTION);
        bundle.getIdentifier().setSystem(SIGNAL_ID_SYSTEM).setValue(signalId);
        bundle.setTimestamp(new Date());

        for (Finding finding : signal.getFindings()) {
            DetectedIssue issue = toDetectedIssue(finding, signal.getOverridePolicy());
            bundle.addEntry()
                .setFullUrl("urn:uuid:" + UUID.nameUUIDFromBytes(
                    (signalId + "/" + finding.getSourceId()).getBytes(StandardCharsets.UTF_8)))
                .setResource(issue);
        }
        return bundle;
    }

    DetectedIssue toDetectedIssue(Finding finding, OverridePolicy policy) {
        DetectedIssue issue = new DetectedIssue();
        issue.setStatus(DetectedIssueStatus.FINAL);
        issue.setSeverity(severityOf(finding.getColor()));
        issue.setCode(codeOf(finding));
        issue.addIdentifier().setSystem(FINDING_ID_SYSTEM).setValue(finding.getSourceId());
        issue.setDetail(finding.getMessage());
        issue.setIdentified(new DateTimeType(new Date()));
        issue.addExtension(new Extension(OVERRIDE_POLICY_EXTENSION, new StringType(policy.name())));
        return issue;
    }

    static DetectedIssueSeverity severityOf(SignalColor color) {
        return switch (color) {
            case RED -> DetectedIssueSeverity.HIGH;
            case YELLOW -> DetectedIssueSeverity.MODERATE;
            case GREEN -> DetectedIssueSeverity.LOW;
        };
    }

    private static CodeableConcept codeOf(Finding finding) {
        CodeableConcept code = new CodeableConcept();
        switch (finding.getSource()) {
            case INTERACTION -> code.addCoding().setSystem(ACT_CODE_SYSTEM).setCode("DRG")
                .setDisplay("Drug Interaction Alert");
            case CONTRAINDICATION -> code.addCoding().setSystem(ACT_CODE_SYSTEM).setCode("COND")
                .setDisplay("Condition Alert");
            case ALLERGY -> code.addCoding().setSystem(ACT_CODE_SYSTEM).setCode("ALGY")
                .setDisplay("Allergy Alert");
            case DUPLICATE_THERAPY -> code.addCoding().setSystem(ACT_CODE_SYSTEM).setCode("DUPTHPY")
                .setDisplay("Duplicate Therapy Alert");
            case RULE -> code.addCoding().setSystem(RULE_CODE_SYSTEM).setCode(finding.getOutcomeTag());
        }
        code.setText(finding.getSource().name());
        return code;
    }
}
