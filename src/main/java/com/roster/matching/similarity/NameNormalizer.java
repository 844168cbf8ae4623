package com.roster.matching.similarity;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical comparison form for person names, clubs and series keys.
 *
 * <p>Applies Unicode NFKC, folds typographic apostrophes and dashes to ASCII,
 * drops periods and commas, collapses every kind of whitespace to a single
 * space, trims, and lower-cases. Diacritics are kept: "Müller" and "Muller"
 * are different last names.</p>
 */
public final class NameNormalizer {

    private static final Pattern APOSTROPHES = Pattern.compile("[\\u2018\\u2019\\u201B\\u02BC\\u0060\\u00B4]");
    private static final Pattern DASHES = Pattern.compile("[\\u2010-\\u2015\\u2212]");
    private static final Pattern DROPPED_PUNCTUATION = Pattern.compile("[.,]");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+");

    private NameNormalizer() {
        // Utility class
    }

    /**
     * Returns the comparison form of a name; null and blank become "".
     */
    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String result = Normalizer.normalize(name, Normalizer.Form.NFKC);
        result = APOSTROPHES.matcher(result).replaceAll("'");
        result = DASHES.matcher(result).replaceAll("-");
        result = DROPPED_PUNCTUATION.matcher(result).replaceAll("");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        return result.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Trims and collapses internal whitespace while keeping display case.
     */
    public static String collapseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }
}
