package com.clinicalguard.snapshot;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import com.clinicalguard.knowledge.KnowledgeBase;
import com.clinicalguard.knowledge.Severity;
import com.clinicalguard.rules.CompiledRule;
import com.clinicalguard.rules.RuleCompiler;

/**
 * Loads a snapshot from the seeded embedded database through the real
 * repositories.
 */
@DataJpaTest
@Import({SnapshotLoader.class, RuleCompiler.class})
@DisplayName("Seeded knowledge tables")
class SeededKnowledgeTest {

    @Autowired
    private SnapshotLoader loader;

    @Test
    @DisplayName("Should load every seeded table")
    void shouldLoadSeededTables() {
        // Act
        SafetySnapshot snapshot = loader.load(1);
        KnowledgeBase knowledge = snapshot.getKnowledge();

        // Assert
        assertEquals(27, knowledge.conceptCount());
        assertEquals(10, knowledge.interactionCount());
        assertEquals(7, knowledge.contraindicationCount());
        assertEquals(8, knowledge.getConditionKeywords().size());
        assertEquals(6, knowledge.getPairTriggers().size());
        assertEquals(5, snapshot.getRules().size());
        assertTrue(snapshot.getRules().getSkippedRuleIds().isEmpty());
    }

    @Test
    @DisplayName("Seeded rules should be in priority order with the retired rule left out")
    void seededRulesShouldBeOrdered() {
        SafetySnapshot snapshot = loader.load(1);

        assertEquals("RISK-SCORE-HIGH", snapshot.getRules().getRules().get(0).getRuleId());
        assertTrue(snapshot.getRules().getRules().stream()
            .map(CompiledRule::getRuleId)
            .noneMatch("LEGACY-AGE-CHECK"::equals));
    }

    @Test
    @DisplayName("Brand products should expand to their ingredients")
    void brandsShouldExpand() {
        KnowledgeBase knowledge = loader.load(1).getKnowledge();

        assertTrue(knowledge.ingredientsOf("BRAND-GLUCOPHAGE").contains("6809"));
        assertEquals(Severity.CONTRAINDICATED,
            knowledge.findContraindication("6809", "N18.5").orElseThrow().getSeverity());
    }
}
