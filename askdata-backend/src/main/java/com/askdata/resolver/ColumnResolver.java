package com.askdata.resolver;

import com.askdata.model.ColumnCatalog;
import com.askdata.vocabulary.QueryTokens;
import com.askdata.vocabulary.QueryVocabulary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves free-text column references against a {@link ColumnCatalog}.
 *
 * <p>Every column is scored with four strategies and keeps its best score:
 * <ol>
 *     <li>exact case-insensitive name: {@value #EXACT_SCORE}</li>
 *     <li>normalized equality ({@value #NORMALIZED_SCORE}) or substring containment in either
 *     direction, proportional to the overlap</li>
 *     <li>synonym expansion through the vocabulary, discounted by {@value #SYNONYM_PENALTY}</li>
 *     <li>share of the column's {@code _}-delimited tokens present in the phrase</li>
 * </ol>
 * Results below the minimum score are dropped; an empty list means "no column". Ties go to the
 * shorter column name, then lexical order. Instances are stateless and never throw on bad input.
 */
public class ColumnResolver {

    public static final double EXACT_SCORE = 1.0;
    public static final double NORMALIZED_SCORE = 0.95;
    public static final double CONTAINMENT_WEIGHT = 0.9;
    public static final double SYNONYM_PENALTY = 0.8;
    public static final double TOKEN_WEIGHT = 0.85;
    public static final double DEFAULT_MIN_SCORE = 0.3;

    private static final int MIN_CONTAINMENT_LENGTH = 3;
    private static final int MIN_TOKEN_LENGTH = 2;

    private final QueryVocabulary.Compiled vocabulary;
    private final double minScore;

    public ColumnResolver(QueryVocabulary.Compiled vocabulary) {
        this(vocabulary, DEFAULT_MIN_SCORE);
    }

    public ColumnResolver(QueryVocabulary.Compiled vocabulary, double minScore) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        this.minScore = minScore;
    }

    public double getMinScore() {
        return minScore;
    }

    /**
     * Scores every catalog column against a phrase.
     *
     * @param phrase free-text column reference
     * @param catalog catalog to search
     * @return matches at or above the minimum score, best first
     */
    public List<ColumnMatch> resolve(String phrase, ColumnCatalog catalog) {
        if (phrase == null || phrase.isBlank() || catalog == null || catalog.isEmpty()) {
            return List.of();
        }

        String trimmed = phrase.trim();
        String lowered = trimmed.toLowerCase(Locale.ROOT);
        String normalizedPhrase = QueryTokens.normalize(trimmed);
        List<String> phraseTokens = QueryTokens.tokenize(trimmed);
        List<String> synonymCandidates = synonymCandidates(phraseTokens);

        List<ColumnMatch> matches = new ArrayList<>();
        for (String column : catalog.columns()) {
            ColumnMatch best = scoreColumn(column, lowered, normalizedPhrase, phraseTokens, synonymCandidates);
            if (best != null && best.score() >= minScore) {
                matches.add(best);
            }
        }

        matches.sort(Comparator
                .comparingDouble(ColumnMatch::score).reversed()
                .thenComparing(m -> !m.column().equals(trimmed))
                .thenComparingInt(m -> m.column().length())
                .thenComparing(ColumnMatch::column));
        return List.copyOf(matches);
    }

    /**
     * Returns the highest-ranked match.
     *
     * @param phrase free-text column reference
     * @param catalog catalog to search
     * @return best match, empty when nothing clears the minimum score
     */
    public Optional<ColumnMatch> best(String phrase, ColumnCatalog catalog) {
        List<ColumnMatch> matches = resolve(phrase, catalog);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    private ColumnMatch scoreColumn(
            String column,
            String loweredPhrase,
            String normalizedPhrase,
            List<String> phraseTokens,
            List<String> synonymCandidates
    ) {
        String loweredColumn = column.toLowerCase(Locale.ROOT);
        if (loweredColumn.equals(loweredPhrase)) {
            return new ColumnMatch(column, EXACT_SCORE, MatchMethod.EXACT);
        }

        String normalizedColumn = QueryTokens.normalize(column);
        if (!normalizedColumn.isEmpty() && normalizedColumn.equals(normalizedPhrase)) {
            return new ColumnMatch(column, NORMALIZED_SCORE, MatchMethod.NORMALIZED);
        }

        ColumnMatch best = null;

        double containment = containmentScore(normalizedPhrase, normalizedColumn);
        if (containment > 0) {
            best = new ColumnMatch(column, containment, MatchMethod.CONTAINMENT);
        }

        for (String candidate : synonymCandidates) {
            double s = SYNONYM_PENALTY * containmentScore(candidate, normalizedColumn);
            if (s > 0 && (best == null || s > best.score())) {
                best = new ColumnMatch(column, s, MatchMethod.SYNONYM);
            }
        }

        double token = tokenScore(phraseTokens, QueryTokens.columnTokens(column));
        if (token > 0 && (best == null || token > best.score())) {
            best = new ColumnMatch(column, token, MatchMethod.TOKEN);
        }

        return best;
    }

    /**
     * Equal strings score 1.0; otherwise substring containment in either direction scores
     * {@value #CONTAINMENT_WEIGHT} times the length ratio, provided the shorter side has at least
     * three characters.
     */
    static double containmentScore(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        if (shorter.length() < MIN_CONTAINMENT_LENGTH || !longer.contains(shorter)) {
            return 0.0;
        }
        return CONTAINMENT_WEIGHT * shorter.length() / longer.length();
    }

    private static double tokenScore(List<String> phraseTokens, List<String> columnTokens) {
        if (phraseTokens.isEmpty() || columnTokens.isEmpty()) {
            return 0.0;
        }
        int matched = 0;
        for (String columnToken : columnTokens) {
            for (String phraseToken : phraseTokens) {
                if (phraseToken.length() >= MIN_TOKEN_LENGTH && sameWord(phraseToken, columnToken)) {
                    matched++;
                    break;
                }
            }
        }
        return TOKEN_WEIGHT * matched / columnTokens.size();
    }

    private List<String> synonymCandidates(List<String> phraseTokens) {
        Set<String> out = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> entry : vocabulary.synonyms().entrySet()) {
            List<String> termTokens = QueryTokens.tokenize(entry.getKey());
            if (containsPhrase(phraseTokens, termTokens)) {
                out.addAll(entry.getValue());
            }
        }
        return new ArrayList<>(out);
    }

    private static boolean containsPhrase(List<String> tokens, List<String> phrase) {
        if (phrase.isEmpty() || phrase.size() > tokens.size()) {
            return false;
        }
        for (int i = 0; i + phrase.size() <= tokens.size(); i++) {
            boolean match = true;
            for (int j = 0; j < phrase.size(); j++) {
                if (!sameWord(tokens.get(i + j), phrase.get(j))) {
                    match = false;
                    break;
                }
            }
            if (match) {
                return true;
            }
        }
        return false;
    }

    /**
     * Word equality tolerant to a trailing plural {@code s}.
     */
    static boolean sameWord(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        return singular(a).equals(singular(b));
    }

    private static String singular(String word) {
        if (word.length() > 3 && word.endsWith("s") && !word.endsWith("ss")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }
}
