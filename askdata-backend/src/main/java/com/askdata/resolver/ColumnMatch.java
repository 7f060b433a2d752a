package com.askdata.resolver;

/**
 * A catalog column matched by a phrase, with its score in {@code [0, 1]}.
 *
 * @param column column name as it appears in the catalog
 * @param score match score
 * @param method strategy that produced the score
 */
public record ColumnMatch(String column, double score, MatchMethod method) {
}
