package com.clinicalguard.knowledge;

import lombok.Value;

/**
 * Result of resolving free text to a concept. A fuzzy match is a best guess
 * and must not be reported with high confidence.
 */
@Value
public class ConceptMatch {
    Concept concept;
    boolean fuzzy;

    public static ConceptMatch exact(Concept concept) {
        return new ConceptMatch(concept, false);
    }

    public static ConceptMatch fuzzy(Concept concept) {
        return new ConceptMatch(concept, true);
    }
}
