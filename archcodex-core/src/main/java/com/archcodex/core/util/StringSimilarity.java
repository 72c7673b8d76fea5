package com.archcodex.core.util;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Edit-distance and case-conversion helpers used for "did you mean" suggestions and path templates.
 *
 * @since 1.0.0
 */
public final class StringSimilarity {

    private StringSimilarity() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Levenshtein distance between two strings.
     *
     * @param a first string
     * @param b second string
     * @return number of single-character edits
     */
    public static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Candidates within {@code maxDistance} edits of {@code name}, closest first (ties alphabetical).
     *
     * @param name misspelled name
     * @param candidates known names
     * @param maxDistance maximum edit distance
     * @return up to three suggestions
     */
    public static List<String> closest(String name, Collection<String> candidates, int maxDistance) {
        return candidates.stream()
            .filter(c -> levenshtein(name, c) <= maxDistance)
            .sorted(Comparator.<String>comparingInt(c -> levenshtein(name, c)).thenComparing(Comparator.naturalOrder()))
            .limit(3)
            .toList();
    }

    /**
     * Converts PascalCase or camelCase to kebab-case.
     *
     * @param name identifier
     * @return kebab-case form, e.g. {@code PaymentService} to {@code payment-service}
     */
    public static String toKebabCase(String name) {
        return name
            .replaceAll("([a-z0-9])([A-Z])", "$1-$2")
            .replaceAll("([A-Z])([A-Z][a-z])", "$1-$2")
            .replace('_', '-')
            .toLowerCase(Locale.ROOT);
    }
}
