package io.github.cyfko.formulalint.core.utils;

/**
 * Candidate returned by {@link StringSimilarity#findSimilar(String, java.util.List, int)}.
 *
 * @param value    the candidate
 * @param distance edit distance between the query and the candidate
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SimilarityMatch(String value, int distance) {
}
