package com.clinicalguard.knowledge;

import static com.clinicalguard.knowledge.KnowledgeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for KnowledgeBase
 *
 * Covers concept resolution (exact and fuzzy), symmetric interaction lookup,
 * directional contraindications and ingredient expansion.
 */
@DisplayName("KnowledgeBase Tests")
class KnowledgeBaseTest {

    private KnowledgeBase knowledge;

    @BeforeEach
    void setUp() {
        knowledge = KnowledgeFixtures.standard();
    }

    @Nested
    @DisplayName("resolveDrug()")
    class ResolveDrugTests {

        @Test
        @DisplayName("Should resolve exact display name regardless of case and spacing")
        void shouldResolveExactNameIgnoringCase() {
            // Act
            Optional<ConceptMatch> match = knowledge.resolveDrug("  SILDENAFIL ");

            // Assert
            assertTrue(match.isPresent());
            assertEquals(SILDENAFIL, match.get().getConcept().getId());
            assertFalse(match.get().isFuzzy());
        }

        @Test
        @DisplayName("Should resolve exact concept id")
        void shouldResolveExactId() {
            Optional<ConceptMatch> match = knowledge.resolveDrug(METFORMIN);

            assertTrue(match.isPresent());
            assertEquals("Metformin", match.get().getConcept().getDisplayName());
        }

        @Test
        @DisplayName("Should fuzzy match a drug name embedded in longer text")
        void shouldFuzzyMatchNameInsideText() {
            Optional<ConceptMatch> match = knowledge.resolveDrug("Sildenafil 50mg tablet");

            assertTrue(match.isPresent());
            assertEquals(SILDENAFIL, match.get().getConcept().getId());
            assertTrue(match.get().isFuzzy());
        }

        @Test
        @DisplayName("Should prefer the longest name found in the text")
        void shouldPreferLongestNameInText() {
            KnowledgeBase kb = KnowledgeBase.builder()
                .concept(drug("1", "Isosorbide"))
                .concept(drug("2", "Isosorbide Mononitrate"))
                .build();

            Optional<ConceptMatch> match = kb.resolveDrug("isosorbide mononitrate 30 mg");

            assertTrue(match.isPresent());
            assertEquals("2", match.get().getConcept().getId());
        }

        @Test
        @DisplayName("Should fuzzy match a partial name of at least three characters")
        void shouldFuzzyMatchPartialName() {
            Optional<ConceptMatch> match = knowledge.resolveDrug("metfor");

            assertTrue(match.isPresent());
            assertEquals(METFORMIN, match.get().getConcept().getId());
            assertTrue(match.get().isFuzzy());
        }

        @Test
        @DisplayName("Should not fuzzy match very short text")
        void shouldNotFuzzyMatchShortText() {
            assertTrue(knowledge.resolveDrug("me").isEmpty());
        }

        @Test
        @DisplayName("Should return empty for unknown drug text")
        void shouldReturnEmptyForUnknownDrug() {
            assertTrue(knowledge.resolveDrug("Xyzal-9000-Unknown").isEmpty());
            assertTrue(knowledge.resolveDrug("").isEmpty());
            assertTrue(knowledge.resolveDrug(null).isEmpty());
        }

        @Test
        @DisplayName("Should resolve inactive drugs by exact name but never fuzzily")
        void shouldResolveInactiveOnlyExactly() {
            Optional<ConceptMatch> exact = knowledge.resolveDrug("zantac");
            Optional<ConceptMatch> fuzzy = knowledge.resolveDrug("zantac 150");

            assertTrue(exact.isPresent());
            assertFalse(exact.get().getConcept().isActive());
            assertTrue(fuzzy.isEmpty());
        }

        @Test
        @DisplayName("Should not resolve a diagnosis as a drug")
        void shouldNotResolveDiagnosisAsDrug() {
            assertTrue(knowledge.resolveDrug(CKD_STAGE_5).isEmpty());
        }
    }

    @Nested
    @DisplayName("resolveDiagnosis()")
    class ResolveDiagnosisTests {

        @Test
        @DisplayName("Should resolve ICD-10 code")
        void shouldResolveCode() {
            Optional<Concept> concept = knowledge.resolveDiagnosis("n18.5");

            assertTrue(concept.isPresent());
            assertEquals(CKD_STAGE_5, concept.get().getId());
            assertTrue(concept.get().isDiagnosis());
        }

        @Test
        @DisplayName("Should resolve exact display name only")
        void shouldResolveExactNameOnly() {
            assertTrue(knowledge.resolveDiagnosis("Chronic kidney disease, stage 3").isPresent());
            assertTrue(knowledge.resolveDiagnosis("kidney disease").isEmpty());
        }
    }

    @Nested
    @DisplayName("Fact lookups")
    class FactLookupTests {

        @Test
        @DisplayName("Interaction lookup should be symmetric")
        void interactionLookupShouldBeSymmetric() {
            Optional<InteractionFact> forward = knowledge.findInteraction(SILDENAFIL, NITROGLYCERIN);
            Optional<InteractionFact> backward = knowledge.findInteraction(NITROGLYCERIN, SILDENAFIL);

            assertTrue(forward.isPresent());
            assertEquals(forward, backward);
            assertEquals(Severity.CONTRAINDICATED, forward.get().getSeverity());
        }

        @Test
        @DisplayName("Duplicate interaction facts should keep the more severe one")
        void duplicateInteractionShouldKeepMoreSevere() {
            KnowledgeBase kb = KnowledgeBase.builder()
                .concept(drug("A", "Alpha"))
                .concept(drug("B", "Beta"))
                .interaction(interaction("A", "B", Severity.MODERATE))
                .interaction(interaction("A", "B", Severity.HIGH))
                .interaction(interaction("A", "B", Severity.LOW))
                .build();

            assertEquals(Severity.HIGH, kb.findInteraction("B", "A").orElseThrow().getSeverity());
            assertEquals(1, kb.interactionCount());
        }

        @Test
        @DisplayName("Both stored orderings of a pair should collapse to the more severe fact")
        void reversedDuplicateShouldKeepMoreSevere() {
            KnowledgeBase kb = KnowledgeBase.builder()
                .concept(drug("A", "Alpha"))
                .concept(drug("B", "Beta"))
                .interaction(interaction("A", "B", Severity.MODERATE))
                .interaction(interaction("B", "A", Severity.CONTRAINDICATED))
                .build();

            Optional<InteractionFact> forward = kb.findInteraction("A", "B");
            Optional<InteractionFact> backward = kb.findInteraction("B", "A");

            assertEquals(forward, backward);
            assertEquals(Severity.CONTRAINDICATED, forward.orElseThrow().getSeverity());
            assertEquals(1, kb.interactionCount());
        }

        @Test
        @DisplayName("Contraindication lookup should be directional")
        void contraindicationShouldBeDirectional() {
            assertTrue(knowledge.findContraindication(METFORMIN, CKD_STAGE_5).isPresent());
            assertTrue(knowledge.findContraindication(CKD_STAGE_5, METFORMIN).isEmpty());
        }

        @Test
        @DisplayName("Null ids should never match")
        void nullIdsShouldNeverMatch() {
            assertTrue(knowledge.findInteraction(null, SILDENAFIL).isEmpty());
            assertTrue(knowledge.findContraindication(METFORMIN, null).isEmpty());
            assertTrue(knowledge.findConcept(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("ingredientsOf()")
    class IngredientTests {

        @Test
        @DisplayName("Should list the product first, then its ingredients in id order")
        void shouldListProductThenIngredients() {
            Set<String> ingredients = knowledge.ingredientsOf(AUGMENTIN);

            assertEquals(List.of(AUGMENTIN, CLAVULANATE, AMOXICILLIN), List.copyOf(ingredients));
        }

        @Test
        @DisplayName("Should return only the drug itself when it has no ingredients")
        void shouldReturnDrugItself() {
            assertEquals(Set.of(ASPIRIN), knowledge.ingredientsOf(ASPIRIN));
        }

        @Test
        @DisplayName("Should not allow modification")
        void shouldBeUnmodifiable() {
            Set<String> ingredients = knowledge.ingredientsOf(VIAGRA);

            assertThrows(UnsupportedOperationException.class, () -> ingredients.add("x"));
        }
    }

    @Test
    @DisplayName("Counts should reflect the loaded facts")
    void countsShouldReflectLoadedFacts() {
        assertEquals(17, knowledge.conceptCount());
        assertEquals(6, knowledge.interactionCount());
        assertEquals(3, knowledge.contraindicationCount());
        assertEquals(3, knowledge.getPairTriggers().size());
        assertEquals(4, knowledge.getConditionKeywords().size());
    }
}
