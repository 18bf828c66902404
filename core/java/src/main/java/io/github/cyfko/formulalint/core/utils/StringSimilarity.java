package io.github.cyfko.formulalint.core.utils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Edit-distance utilities used to build "did you mean" suggestions.
 * <p>
 * Distances are Levenshtein distances (unit cost insertion, deletion and substitution) computed
 * with the classic dynamic-programming table. Characters are compared case-insensitively, so
 * {@code ACTION} is an exact match for {@code action}.
 * </p>
 *
 * <pre>{@code
 * List<SimilarityMatch> matches = StringSimilarity.findSimilar("lesThan", operatorNames, 3);
 * // [SimilarityMatch[value=lessThan, distance=1]]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class StringSimilarity {

    private StringSimilarity() {}

    /**
     * Computes the edit distance between two strings.
     *
     * @param a first string
     * @param b second string
     * @return the minimum number of single-character edits turning {@code a} into {@code b}
     */
    public static int levenshteinDistance(String a, String b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        String left = a.toLowerCase(Locale.ROOT);
        String right = b.toLowerCase(Locale.ROOT);

        int[][] table = new int[left.length() + 1][right.length() + 1];
        for (int i = 0; i <= left.length(); i++) {
            table[i][0] = i;
        }
        for (int j = 0; j <= right.length(); j++) {
            table[0][j] = j;
        }

        for (int i = 1; i <= left.length(); i++) {
            for (int j = 1; j <= right.length(); j++) {
                int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
                table[i][j] = Math.min(
                        Math.min(table[i - 1][j] + 1, table[i][j - 1] + 1),
                        table[i - 1][j - 1] + cost);
            }
        }
        return table[left.length()][right.length()];
    }

    /**
     * Finds the candidates within {@code maxDistance} edits of {@code query}.
     *
     * @param query       the unresolved identifier
     * @param candidates  known identifiers, in preference order
     * @param maxDistance inclusive distance bound
     * @return matches sorted by ascending distance, ties kept in candidate order; empty if none qualify
     */
    public static List<SimilarityMatch> findSimilar(String query, List<String> candidates, int maxDistance) {
        List<SimilarityMatch> matches = new ArrayList<>();
        for (String candidate : candidates) {
            int distance = levenshteinDistance(query, candidate);
            if (distance <= maxDistance) {
                matches.add(new SimilarityMatch(candidate, distance));
            }
        }
        // List.sort is stable
        matches.sort(Comparator.comparingInt(SimilarityMatch::distance));
        return matches;
    }
}
