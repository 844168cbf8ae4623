package com.roster.matching.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NameNormalizerTest {

    @Test
    @DisplayName("Should lower-case and collapse whitespace")
    void testWhitespace() {
        assertEquals("mary ann", NameNormalizer.normalize("  Mary   Ann "));
        assertEquals("mary ann", NameNormalizer.normalize("Mary Ann"));
        assertEquals("mary ann", NameNormalizer.normalize("Mary\tAnn"));
    }

    @Test
    @DisplayName("Should fold typographic punctuation")
    void testPunctuation() {
        assertEquals("o'brien", NameNormalizer.normalize("O’Brien"));
        assertEquals("smith-jones", NameNormalizer.normalize("Smith–Jones"));
        assertEquals("st john", NameNormalizer.normalize("St. John,"));
    }

    @Test
    @DisplayName("Should apply compatibility normalization")
    void testNfkc() {
        assertEquals("smith", NameNormalizer.normalize("ＳＭＩＴＨ"));
    }

    @Test
    @DisplayName("Null and blank become empty")
    void testBlank() {
        assertEquals("", NameNormalizer.normalize(null));
        assertEquals("", NameNormalizer.normalize("   "));
        assertEquals("", NameNormalizer.collapseWhitespace(null));
    }

    @Test
    @DisplayName("Whitespace collapsing keeps case")
    void testCollapseWhitespace() {
        assertEquals("Lake Forest", NameNormalizer.collapseWhitespace("  Lake   Forest "));
    }
}
