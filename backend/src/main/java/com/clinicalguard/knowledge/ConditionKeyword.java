package com.clinicalguard.knowledge;

import lombok.Value;

/**
 * Maps a word seen in surrounding clinical text to a diagnosis concept.
 */
@Value
public class ConditionKeyword {
    String keyword;
    String diagnosisId;
}
