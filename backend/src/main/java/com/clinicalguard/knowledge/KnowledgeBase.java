package com.clinicalguard.knowledge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import lombok.extern.slf4j.Slf4j;

/**
 * Read-only, in-memory indexed view of the safety knowledge tables.
 *
 * Instances are fully built by {@link #builder()} and never change afterwards;
 * every collection handed out is unmodifiable. A refresh produces a new
 * instance instead of touching this one.
 */
@Slf4j
public final class KnowledgeBase {

    /** Shorter queries are never fuzzy matched. */
    public static final int MIN_FUZZY_QUERY_LENGTH = 3;

    private final Map<String, Concept> conceptsById;
    private final Map<String, List<Concept>> drugsByText;
    private final Map<String, List<Concept>> diagnosesByText;
    private final List<NamedConcept> fuzzyDrugs;
    private final Map<String, Set<String>> ingredients;
    private final Map<String, InteractionFact> interactions;
    private final Map<String, Map<String, ContraindicationFact>> contraindications;
    private final List<ConditionKeyword> conditionKeywords;
    private final List<PairTrigger> pairTriggers;

    private KnowledgeBase(Builder builder) {
        Map<String, Concept> byId = new HashMap<>();
        Map<String, List<Concept>> drugs = new HashMap<>();
        Map<String, List<Concept>> diagnoses = new HashMap<>();
        List<NamedConcept> fuzzy = new ArrayList<>();

        List<Concept> sorted = new ArrayList<>(builder.concepts);
        sorted.sort(Comparator.comparing(Concept::getId));
        for (Concept concept : sorted) {
            if (byId.putIfAbsent(concept.getId(), concept) != null) {
                log.warn("Duplicate concept id {} ignored", concept.getId());
                continue;
            }
            Map<String, List<Concept>> textIndex = concept.isDrug() ? drugs : diagnoses;
            textIndex.computeIfAbsent(TextNormalizer.normalize(concept.getId()), k -> new ArrayList<>()).add(concept);
            String name = TextNormalizer.normalize(concept.getDisplayName());
            if (!name.isEmpty()) {
                textIndex.computeIfAbsent(name, k -> new ArrayList<>()).add(concept);
            }
            if (concept.isDrug() && concept.isActive() && !name.isEmpty()) {
                fuzzy.add(new NamedConcept(name, concept));
            }
        }

        // Active concepts win over inactive ones for the same text, then lowest id.
        Comparator<Concept> preference = Comparator.comparing((Concept c) -> !c.isActive())
            .thenComparing(Concept::getId);
        drugs.replaceAll((k, v) -> sortedCopy(v, preference));
        diagnoses.replaceAll((k, v) -> sortedCopy(v, preference));

        Map<String, Set<String>> ingredientIndex = new HashMap<>();
        builder.ingredientLinks.forEach((drugId, ingredientIds) ->
            ingredientIndex.computeIfAbsent(drugId, k -> new TreeSet<>()).addAll(ingredientIds));
        ingredientIndex.replaceAll((k, v) -> Collections.unmodifiableSet(v));

        Map<String, InteractionFact> interactionIndex = new HashMap<>();
        for (InteractionFact fact : builder.interactions) {
            interactionIndex.merge(pairKey(fact.getDrugIdA(), fact.getDrugIdB()), fact,
                (existing, incoming) -> incoming.getSeverity().compareTo(existing.getSeverity()) > 0 ? incoming : existing);
        }

        Map<String, Map<String, ContraindicationFact>> contraIndex = new HashMap<>();
        for (ContraindicationFact fact : builder.contraindications) {
            contraIndex.computeIfAbsent(fact.getDrugId(), k -> new HashMap<>())
                .merge(fact.getDiagnosisId(), fact,
                    (existing, incoming) -> incoming.getSeverity().compareTo(existing.getSeverity()) > 0 ? incoming : existing);
        }
        contraIndex.replaceAll((k, v) -> Collections.unmodifiableMap(v));

        List<ConditionKeyword> keywords = new ArrayList<>(builder.conditionKeywords);
        keywords.sort(Comparator.comparing(ConditionKeyword::getKeyword).thenComparing(ConditionKeyword::getDiagnosisId));

        List<PairTrigger> triggers = new ArrayList<>(builder.pairTriggers);
        triggers.sort(Comparator.comparing(PairTrigger::getTriggerId));

        this.conceptsById = Collections.unmodifiableMap(byId);
        this.drugsByText = Collections.unmodifiableMap(drugs);
        this.diagnosesByText = Collections.unmodifiableMap(diagnoses);
        this.fuzzyDrugs = List.copyOf(fuzzy);
        this.ingredients = Collections.unmodifiableMap(ingredientIndex);
        this.interactions = Collections.unmodifiableMap(interactionIndex);
        this.contraindications = Collections.unmodifiableMap(contraIndex);
        this.conditionKeywords = List.copyOf(keywords);
        this.pairTriggers = List.copyOf(triggers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolve drug text: exact id or name match first, then the best single
     * fuzzy candidate among active drugs.
     */
    public Optional<ConceptMatch> resolveDrug(String text) {
        String query = TextNormalizer.normalize(text);
        if (query.isEmpty()) {
            return Optional.empty();
        }
        List<Concept> exact = drugsByText.get(query);
        if (exact != null && !exact.isEmpty()) {
            return Optional.of(ConceptMatch.exact(exact.get(0)));
        }
        return fuzzyDrug(query).map(ConceptMatch::fuzzy);
    }

    /**
     * Exact code or display-name match only.
     */
    public Optional<Concept> resolveDiagnosis(String text) {
        String query = TextNormalizer.normalize(text);
        if (query.isEmpty()) {
            return Optional.empty();
        }
        List<Concept> exact = diagnosesByText.get(query);
        return exact == null || exact.isEmpty() ? Optional.empty() : Optional.of(exact.get(0));
    }

    /**
     * Id lookup, inactive concepts included.
     */
    public Optional<Concept> findConcept(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(conceptsById.get(id));
    }

    public Optional<InteractionFact> findInteraction(String drugIdA, String drugIdB) {
        if (drugIdA == null || drugIdB == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(interactions.get(pairKey(drugIdA, drugIdB)));
    }

    public Optional<ContraindicationFact> findContraindication(String drugId, String diagnosisId) {
        if (drugId == null || diagnosisId == null) {
            return Optional.empty();
        }
        Map<String, ContraindicationFact> byDiagnosis = contraindications.get(drugId);
        return byDiagnosis == null ? Optional.empty() : Optional.ofNullable(byDiagnosis.get(diagnosisId));
    }

    /**
     * The drug itself followed by its active ingredients, in id order.
     */
    public Set<String> ingredientsOf(String drugId) {
        Set<String> result = new LinkedHashSet<>();
        if (drugId == null) {
            return result;
        }
        result.add(drugId);
        result.addAll(ingredients.getOrDefault(drugId, Set.of()));
        return Collections.unmodifiableSet(result);
    }

    public List<ConditionKeyword> getConditionKeywords() {
        return conditionKeywords;
    }

    public List<PairTrigger> getPairTriggers() {
        return pairTriggers;
    }

    public int conceptCount() {
        return conceptsById.size();
    }

    public int interactionCount() {
        return interactions.size();
    }

    public int contraindicationCount() {
        return contraindications.values().stream().mapToInt(Map::size).sum();
    }

    private Optional<Concept> fuzzyDrug(String query) {
        NamedConcept best = null;
        int bestRank = Integer.MAX_VALUE;
        for (NamedConcept candidate : fuzzyDrugs) {
            int rank;
            if (TextNormalizer.indexOfWord(query, candidate.name, true) >= 0) {
                // name inside the query: longer names are more specific
                rank = -candidate.name.length();
            } else if (query.length() >= MIN_FUZZY_QUERY_LENGTH && candidate.name.contains(query)) {
                // query inside the name: ranked after every name-in-query hit
                rank = 100_000 + candidate.name.length();
            } else {
                continue;
            }
            // fuzzyDrugs is in id order, so strict comparison keeps the lowest id on ties
            if (rank < bestRank) {
                bestRank = rank;
                best = candidate;
            }
        }
        return best == null ? Optional.empty() : Optional.of(best.concept);
    }

    private static List<Concept> sortedCopy(List<Concept> concepts, Comparator<Concept> order) {
        List<Concept> copy = new ArrayList<>(concepts);
        copy.sort(order);
        return List.copyOf(copy);
    }

    // unordered: the smaller id always comes first
    private static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + '\u0000' + b : b + '\u0000' + a;
    }

    private static final class NamedConcept {
        private final String name;
        private final Concept concept;

        private NamedConcept(String name, Concept concept) {
            this.name = name;
            this.concept = concept;
        }
    }

    public static final class Builder {
        private final List<Concept> concepts = new ArrayList<>();
        private final Map<String, Set<String>> ingredientLinks = new HashMap<>();
        private final List<InteractionFact> interactions = new ArrayList<>();
        private final List<ContraindicationFact> contraindications = new ArrayList<>();
        private final List<ConditionKeyword> conditionKeywords = new ArrayList<>();
        private final List<PairTrigger> pairTriggers = new ArrayList<>();

        private Builder() {
        }

        public Builder concept(Concept concept) {
            concepts.add(concept);
            return this;
        }

        public Builder concepts(Collection<Concept> values) {
            concepts.addAll(values);
            return this;
        }

        public Builder ingredient(String drugId, String ingredientId) {
            ingredientLinks.computeIfAbsent(drugId, k -> new TreeSet<>()).add(ingredientId);
            return this;
        }

        public Builder interaction(InteractionFact fact) {
            interactions.add(fact);
            return this;
        }

        public Builder contraindication(ContraindicationFact fact) {
            contraindications.add(fact);
            return this;
        }

        public Builder conditionKeyword(String keyword, String diagnosisId) {
            conditionKeywords.add(new ConditionKeyword(TextNormalizer.normalize(keyword), diagnosisId));
            return this;
        }

        public Builder pairTrigger(PairTrigger trigger) {
            pairTriggers.add(trigger);
            return this;
        }

        public KnowledgeBase build() {
            return new KnowledgeBase(this);
        }
    }
}
