package com.clinicalguard.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.springframework.stereotype.Component;

import com.clinicalguard.knowledge.Concept;
import com.clinicalguard.knowledge.ConceptMatch;
import com.clinicalguard.knowledge.ConditionKeyword;
import com.clinicalguard.knowledge.ContraindicationFact;
import com.clinicalguard.knowledge.InteractionFact;
import com.clinicalguard.knowledge.KnowledgeBase;
import com.clinicalguard.knowledge.PairTrigger;
import com.clinicalguard.knowledge.Severity;
import com.clinicalguard.knowledge.TextNormalizer;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps captured text to knowledge concepts and raises safety issues.
 *
 * Drug identification fails open: an unknown drug is never blocked, only
 * reported with zero confidence. Known-dangerous pairs fail closed: a pair
 * trigger whose keywords are present always yields a red issue, whatever the
 * identification outcome.
 */
@Component
@Slf4j
public class DeterministicValidator {

    public DiagnosisValidation validateDiagnosis(KnowledgeBase knowledge, String text) {
        return knowledge.resolveDiagnosis(text)
            .map(DiagnosisValidation::resolved)
            .orElseGet(DiagnosisValidation::unresolved);
    }

    public PrescriptionValidation validatePrescription(KnowledgeBase knowledge, String drugText, String contextText) {
        return validatePrescription(knowledge, drugText, contextText, PrescriptionContext.empty());
    }

    public PrescriptionValidation validatePrescription(KnowledgeBase knowledge, String drugText,
                                                       String contextText, PrescriptionContext context) {
        if (TextNormalizer.normalize(drugText).isEmpty()) {
            return new PrescriptionValidation(true, 0, null, false, List.of());
        }
        PrescriptionContext structured = context != null ? context : PrescriptionContext.empty();

        Optional<ConceptMatch> match = knowledge.resolveDrug(drugText);
        Concept drug = match.map(ConceptMatch::getConcept).orElse(null);
        Set<String> drugIngredients = drug != null ? knowledge.ingredientsOf(drug.getId()) : Set.of();

        Map<String, ValidationIssue> issues = new LinkedHashMap<>();

        if (drug != null) {
            Set<String> conditions = new TreeSet<>(inferConditions(knowledge, contextText));
            for (String diagnosisId : structured.getDiagnosisIds()) {
                if (diagnosisId != null) {
                    conditions.add(diagnosisId);
                }
            }
            checkContraindications(knowledge, drug, drugIngredients, conditions, issues);
        } else {
            log.debug("Drug text did not resolve, continuing with zero confidence");
        }

        checkPairTriggers(knowledge, drugText, contextText, drugIngredients, issues);

        if (drug != null) {
            checkCurrentMedications(knowledge, drug, drugIngredients, structured.getCurrentMedications(), issues);
            checkAllergies(knowledge, drug, drugIngredients, structured.getAllergies(), issues);
        }

        List<ValidationIssue> result = List.copyOf(issues.values());
        return new PrescriptionValidation(result.isEmpty(), drug != null ? 100 : 0, drug,
            match.map(ConceptMatch::isFuzzy).orElse(false), result);
    }

    /**
     * Diagnosis ids implied by keywords in free text, in id order.
     * Keywords pointing at unknown diagnoses are ignored.
     */
    public Set<String> inferConditions(KnowledgeBase knowledge, String contextText) {
        Set<String> conditions = new TreeSet<>();
        if (TextNormalizer.normalize(contextText).isEmpty()) {
            return conditions;
        }
        for (ConditionKeyword keyword : knowledge.getConditionKeywords()) {
            if (TextNormalizer.containsWordPrefix(contextText, keyword.getKeyword())) {
                if (knowledge.findConcept(keyword.getDiagnosisId()).isPresent()) {
                    conditions.add(keyword.getDiagnosisId());
                } else {
                    log.warn("Condition keyword '{}' points at unknown diagnosis {}",
                        keyword.getKeyword(), keyword.getDiagnosisId());
                }
            }
        }
        return conditions;
    }

    private void checkContraindications(KnowledgeBase knowledge, Concept drug, Set<String> drugIngredients,
                                        Set<String> conditions, Map<String, ValidationIssue> issues) {
        for (String diagnosisId : conditions) {
            for (String ingredientId : drugIngredients) {
                Optional<ContraindicationFact> fact = knowledge.findContraindication(ingredientId, diagnosisId);
                if (fact.isEmpty()) {
                    continue;
                }
                ContraindicationFact hit = fact.get();
                String issueId = "CONTRAINDICATION:" + ingredientId + ":" + diagnosisId;
                issues.putIfAbsent(issueId, ValidationIssue.builder()
                    .issueId(issueId)
                    .kind(IssueKind.CONTRAINDICATION)
                    .severity(hit.getSeverity())
                    .message(nameOf(knowledge, ingredientId) + " is contraindicated with "
                        + nameOf(knowledge, diagnosisId) + ": " + hit.getReason())
                    .evidenceConceptId(drug.getId())
                    .evidenceConceptId(diagnosisId)
                    .factBacked(true)
                    .build());
            }
        }
    }

    private void checkPairTriggers(KnowledgeBase knowledge, String drugText, String contextText,
                                   Set<String> drugIngredients, Map<String, ValidationIssue> issues) {
        if (TextNormalizer.normalize(contextText).isEmpty()) {
            return;
        }
        for (PairTrigger trigger : knowledge.getPairTriggers()) {
            boolean drugSide = TextNormalizer.containsWordPrefix(drugText, trigger.getDrugKeyword())
                || drugIngredients.contains(trigger.getPrimaryDrugId());
            if (!drugSide || !TextNormalizer.containsWordPrefix(contextText, trigger.getContextKeyword())) {
                continue;
            }

            Set<String> primaries = new LinkedHashSet<>(drugIngredients);
            primaries.add(trigger.getPrimaryDrugId());
            Optional<InteractionFact> fact = strongestInteraction(knowledge, primaries,
                knowledge.ingredientsOf(trigger.getSecondaryDrugId()));

            // a detected pair is never reported below HIGH, even over a milder fact
            Severity floor = Severity.max(trigger.getFallbackSeverity() != null
                ? trigger.getFallbackSeverity() : Severity.HIGH, Severity.HIGH);
            if (fact.isPresent()) {
                addInteraction(knowledge, fact.get(), floor, issues);
            } else {
                String issueId = "INTERACTION:" + trigger.getTriggerId();
                log.warn("Pair trigger {} matched without a curated interaction fact", trigger.getTriggerId());
                issues.putIfAbsent(issueId, ValidationIssue.builder()
                    .issueId(issueId)
                    .kind(IssueKind.INTERACTION)
                    .severity(floor)
                    .message(trigger.getMessage())
                    .evidenceConceptId(trigger.getPrimaryDrugId())
                    .evidenceConceptId(trigger.getSecondaryDrugId())
                    .factBacked(false)
                    .build());
            }
        }
    }

    private void checkCurrentMedications(KnowledgeBase knowledge, Concept drug, Set<String> drugIngredients,
                                         Collection<String> medications, Map<String, ValidationIssue> issues) {
        for (String medicationText : medications) {
            Optional<Concept> medication = knowledge.resolveDrug(medicationText).map(ConceptMatch::getConcept);
            if (medication.isEmpty()) {
                continue;
            }
            Concept current = medication.get();
            Set<String> currentIngredients = knowledge.ingredientsOf(current.getId());

            Set<String> shared = new TreeSet<>(drugIngredients);
            shared.retainAll(currentIngredients);
            if (!shared.isEmpty()) {
                String issueId = "DUPLICATE_THERAPY:" + drug.getId() + ":" + current.getId();
                issues.putIfAbsent(issueId, ValidationIssue.builder()
                    .issueId(issueId)
                    .kind(IssueKind.DUPLICATE_THERAPY)
                    .severity(Severity.MODERATE)
                    .message(drug.getDisplayName() + " duplicates current medication "
                        + current.getDisplayName() + " (shared: " + names(knowledge, shared) + ")")
                    .evidenceConceptId(drug.getId())
                    .evidenceConceptId(current.getId())
                    .factBacked(true)
                    .build());
            }

            for (String a : drugIngredients) {
                for (String b : currentIngredients) {
                    knowledge.findInteraction(a, b).ifPresent(fact -> addInteraction(knowledge, fact, Severity.LOW, issues));
                }
            }
        }
    }

    private void checkAllergies(KnowledgeBase knowledge, Concept drug, Set<String> drugIngredients,
                                Collection<String> allergies, Map<String, ValidationIssue> issues) {
        for (String allergenText : allergies) {
            Optional<Concept> allergen = knowledge.resolveDrug(allergenText).map(ConceptMatch::getConcept);
            if (allergen.isEmpty()) {
                continue;
            }
            Set<String> shared = new TreeSet<>(drugIngredients);
            shared.retainAll(knowledge.ingredientsOf(allergen.get().getId()));
            if (shared.isEmpty()) {
                continue;
            }
            String issueId = "ALLERGY:" + drug.getId() + ":" + allergen.get().getId();
            issues.putIfAbsent(issueId, ValidationIssue.builder()
                .issueId(issueId)
                .kind(IssueKind.ALLERGY)
                .severity(Severity.CONTRAINDICATED)
                .message("Documented allergy to " + allergen.get().getDisplayName() + ": "
                    + drug.getDisplayName() + " contains " + names(knowledge, shared))
                .evidenceConceptId(drug.getId())
                .evidenceConceptId(allergen.get().getId())
                .factBacked(true)
                .build());
        }
    }

    private Optional<InteractionFact> strongestInteraction(KnowledgeBase knowledge, Collection<String> left,
                                                           Collection<String> right) {
        InteractionFact strongest = null;
        for (String a : left) {
            for (String b : right) {
                Optional<InteractionFact> fact = knowledge.findInteraction(a, b);
                if (fact.isPresent() && (strongest == null
                    || fact.get().getSeverity().compareTo(strongest.getSeverity()) > 0)) {
                    strongest = fact.get();
                }
            }
        }
        return Optional.ofNullable(strongest);
    }

    /**
     * Adds the fact as an issue at no less than {@code floor}. When the same
     * pair was already reported, the more severe issue is kept.
     */
    private void addInteraction(KnowledgeBase knowledge, InteractionFact fact, Severity floor,
                                Map<String, ValidationIssue> issues) {
        String first = fact.getDrugIdA().compareTo(fact.getDrugIdB()) <= 0 ? fact.getDrugIdA() : fact.getDrugIdB();
        String second = first.equals(fact.getDrugIdA()) ? fact.getDrugIdB() : fact.getDrugIdA();
        String issueId = "INTERACTION:" + first + ":" + second;
        issues.merge(issueId, ValidationIssue.builder()
            .issueId(issueId)
            .kind(IssueKind.INTERACTION)
            .severity(Severity.max(fact.getSeverity(), floor))
            .message(nameOf(knowledge, first) + " + " + nameOf(knowledge, second) + ": " + fact.getDescription())
            .evidenceConceptId(first)
            .evidenceConceptId(second)
            .factBacked(true)
            .build(),
            (existing, incoming) -> incoming.getSeverity().compareTo(existing.getSeverity()) > 0 ? incoming : existing);
    }

    private static String nameOf(KnowledgeBase knowledge, String conceptId) {
        return knowledge.findConcept(conceptId).map(Concept::getDisplayName).orElse(conceptId);
    }

    private static String names(KnowledgeBase knowledge, Collection<String> conceptIds) {
        List<String> names = new ArrayList<>();
        conceptIds.forEach(id -> names.add(nameOf(knowledge, id)));
        return String.join(", ", names);
    }
}
