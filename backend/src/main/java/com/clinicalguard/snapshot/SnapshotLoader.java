package com.clinicalguard.snapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import com.clinicalguard.entity.ClinicalRule;
import com.clinicalguard.entity.ConceptRecord;
import com.clinicalguard.entity.ConditionKeywordRecord;
import com.clinicalguard.entity.ContraindicationRecord;
import com.clinicalguard.entity.IngredientLink;
import com.clinicalguard.entity.InteractionRecord;
import com.clinicalguard.entity.PairTriggerRecord;
import com.clinicalguard.knowledge.Concept;
import com.clinicalguard.knowledge.ConceptKind;
import com.clinicalguard.knowledge.ContraindicationFact;
import com.clinicalguard.knowledge.InteractionFact;
import com.clinicalguard.knowledge.KnowledgeBase;
import com.clinicalguard.knowledge.PairTrigger;
import com.clinicalguard.knowledge.Severity;
import com.clinicalguard.repository.ClinicalRuleRepository;
import com.clinicalguard.repository.ConceptRecordRepository;
import com.clinicalguard.repository.ConditionKeywordRepository;
import com.clinicalguard.repository.ContraindicationRecordRepository;
import com.clinicalguard.repository.IngredientLinkRepository;
import com.clinicalguard.repository.InteractionRecordRepository;
import com.clinicalguard.repository.PairTriggerRepository;
import com.clinicalguard.rules.RuleCompiler;
import com.clinicalguard.rules.RuleDefinition;
import com.clinicalguard.rules.RuleSet;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the authoring tables and builds a complete {@link SafetySnapshot}.
 *
 * Concepts are required: if they cannot be read, or there are none, loading
 * fails with {@link KnowledgeUnavailableException}. Every other table is
 * optional; a table that cannot be read is logged and treated as empty, and a
 * row that cannot be interpreted is skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotLoader {

    private final ConceptRecordRepository conceptRepository;
    private final IngredientLinkRepository ingredientLinkRepository;
    private final InteractionRecordRepository interactionRepository;
    private final ContraindicationRecordRepository contraindicationRepository;
    private final ConditionKeywordRepository conditionKeywordRepository;
    private final PairTriggerRepository pairTriggerRepository;
    private final ClinicalRuleRepository clinicalRuleRepository;
    private final RuleCompiler ruleCompiler;

    public SafetySnapshot load(long generation) {
        KnowledgeBase knowledge = loadKnowledge();
        RuleSet rules = ruleCompiler.compile(loadRuleDefinitions());
        log.info("Loaded snapshot #{}: {} concepts, {} interactions, {} contraindications, {} rules",
            generation, knowledge.conceptCount(), knowledge.interactionCount(),
            knowledge.contraindicationCount(), rules.size());
        return new SafetySnapshot(generation, Instant.now(), knowledge, rules);
    }

    KnowledgeBase loadKnowledge() {
        List<ConceptRecord> conceptRecords;
        try {
            conceptRecords = conceptRepository.findAll();
        } catch (DataAccessException e) {
            throw new KnowledgeUnavailableException("Concept table could not be read", e);
        }
        if (conceptRecords.isEmpty()) {
            throw new KnowledgeUnavailableException("Concept table is empty");
        }

        KnowledgeBase.Builder builder = KnowledgeBase.builder();
        for (ConceptRecord record : conceptRecords) {
            Optional<ConceptKind> kind = parseEnum(ConceptKind.class, record.getKind());
            if (kind.isEmpty()) {
                log.warn("Concept {} has unknown kind '{}', skipped", record.getId(), record.getKind());
                continue;
            }
            builder.concept(Concept.builder()
                .id(record.getId())
                .displayName(record.getDisplayName())
                .kind(kind.get())
                .active(record.isActive())
                .build());
        }

        for (IngredientLink link : optionalTable("ingredient_links", ingredientLinkRepository::findByActiveTrue)) {
            builder.ingredient(link.getDrugId(), link.getIngredientId());
        }

        for (InteractionRecord record : optionalTable("interaction_facts", interactionRepository::findByActiveTrue)) {
            Optional<Severity> severity = parseEnum(Severity.class, record.getSeverity());
            if (severity.isEmpty()) {
                log.warn("Interaction fact {} has unknown severity '{}', skipped", record.getId(), record.getSeverity());
                continue;
            }
            builder.interaction(InteractionFact.builder()
                .drugIdA(record.getDrugAId())
                .drugIdB(record.getDrugBId())
                .severity(severity.get())
                .description(record.getDescription())
                .source(record.getSource())
                .build());
        }

        for (ContraindicationRecord record : optionalTable("contraindication_facts",
                contraindicationRepository::findByActiveTrue)) {
            Optional<Severity> severity = parseEnum(Severity.class, record.getSeverity());
            if (severity.isEmpty()) {
                log.warn("Contraindication fact {} has unknown severity '{}', skipped",
                    record.getId(), record.getSeverity());
                continue;
            }
            builder.contraindication(ContraindicationFact.builder()
                .drugId(record.getDrugId())
                .diagnosisId(record.getDiagnosisId())
                .severity(severity.get())
                .reason(record.getReason())
                .build());
        }

        for (ConditionKeywordRecord record : optionalTable("condition_keywords",
                conditionKeywordRepository::findByActiveTrue)) {
            builder.conditionKeyword(record.getKeyword(), record.getDiagnosisId());
        }

        for (PairTriggerRecord record : optionalTable("pair_triggers", pairTriggerRepository::findByActiveTrue)) {
            Optional<Severity> severity = parseEnum(Severity.class, record.getFallbackSeverity());
            builder.pairTrigger(PairTrigger.builder()
                .triggerId(record.getTriggerId())
                .drugKeyword(record.getDrugKeyword())
                .contextKeyword(record.getContextKeyword())
                .primaryDrugId(record.getPrimaryDrugId())
                .secondaryDrugId(record.getSecondaryDrugId())
                .fallbackSeverity(severity.orElse(Severity.HIGH))
                .message(record.getMessage())
                .build());
        }

        return builder.build();
    }

    List<RuleDefinition> loadRuleDefinitions() {
        List<RuleDefinition> definitions = new ArrayList<>();
        for (ClinicalRule rule : optionalTable("clinical_rules", clinicalRuleRepository::findAll)) {
            definitions.add(RuleDefinition.builder()
                .ruleId(rule.getRuleId())
                .name(rule.getName())
                .category(rule.getCategory())
                .priority(rule.getPriority())
                .logic(rule.getLogic())
                .severity(parseEnum(Severity.class, rule.getSeverity()).orElse(null))
                .message(rule.getMessage())
                .active(rule.isActive())
                .version(rule.getVersion())
                .build());
        }
        return definitions;
    }

    private <T> List<T> optionalTable(String table, Supplier<List<T>> reader) {
        try {
            return reader.get();
        } catch (DataAccessException e) {
            log.error("Configuration defect: table {} could not be read, continuing without it: {}",
                table, e.getMessage());
            return List.of();
        }
    }

    private static <E extends Enum<E>> Optional<E> parseEnum(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return Optional.of(constant);
            }
        }
        return Optional.empty();
    }
}
