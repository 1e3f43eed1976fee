package com.clinicalguard.knowledge;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextNormalizer Tests")
class TextNormalizerTest {

    @Test
    @DisplayName("Should trim, collapse whitespace and lower-case")
    void shouldNormalize() {
        assertEquals("chronic kidney disease", TextNormalizer.normalize("  Chronic\tKidney \n Disease "));
        assertEquals("", TextNormalizer.normalize(null));
    }

    @Test
    @DisplayName("Word prefix should match at word start only")
    void wordPrefixShouldMatchAtWordStart() {
        assertTrue(TextNormalizer.containsWordPrefix("patient on Nitroglycerin", "nitro"));
        assertTrue(TextNormalizer.containsWordPrefix("sl-nitro spray", "nitro"));
        assertFalse(TextNormalizer.containsWordPrefix("isosorbide dinitrate", "nitro"));
        assertFalse(TextNormalizer.containsWordPrefix("anything", ""));
    }

    @Test
    @DisplayName("Word prefix should find a later word start after an inner match")
    void wordPrefixShouldSkipInnerMatches() {
        assertTrue(TextNormalizer.containsWordPrefix("dinitrate and nitroglycerin", "nitro"));
        assertFalse(TextNormalizer.containsWordPrefix("nit", "nitro"));
    }

    @Test
    @DisplayName("Whole word should not match inside a longer word")
    void wholeWordShouldNotMatchInsideWord() {
        assertTrue(TextNormalizer.indexOfWord("history of heart failure, stable", "heart failure", true) >= 0);
        assertEquals(-1, TextNormalizer.indexOfWord("nitroglycerin", "nitro", true));
    }
}
