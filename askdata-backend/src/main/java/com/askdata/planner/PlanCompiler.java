package com.askdata.planner;

import com.askdata.model.AggregationMethod;
import com.askdata.model.AnalysisPlan;
import com.askdata.model.ColumnCatalog;
import com.askdata.model.Operation;
import com.askdata.model.PlanFilter;
import com.askdata.model.VisualizationHint;
import com.askdata.resolver.ColumnMatch;
import com.askdata.resolver.ColumnResolver;
import com.askdata.vocabulary.QueryTokens;
import com.askdata.vocabulary.QueryVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a natural-language question into an {@link AnalysisPlan}.
 *
 * <p>Compilation is deterministic and total: for any query string, including null and empty,
 * {@link #compile(String, ColumnCatalog)} returns a plan whose columns exist in the catalog. When
 * nothing in the query can be understood the plan falls back to summary statistics with
 * confidence 0.
 */
public class PlanCompiler {
    private static final Logger log = LoggerFactory.getLogger(PlanCompiler.class);

    private static final List<String> AND = List.of("and");

    private final QueryVocabulary.Compiled vocabulary;
    private final ColumnResolver resolver;

    public PlanCompiler(QueryVocabulary.Compiled vocabulary, ColumnResolver resolver) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Compiles a query against a catalog. Never throws.
     *
     * @param query user question
     * @param catalog catalog of the dataset the plan will run on
     * @return executable plan
     */
    public AnalysisPlan compile(String query, ColumnCatalog catalog) {
        try {
            return doCompile(query, catalog);
        } catch (RuntimeException e) {
            log.warn("Plan compilation failed, using fallback plan: {}", e.getMessage(), e);
            return fallback(query, catalog, new ArrayList<>());
        }
    }

    private AnalysisPlan doCompile(String query, ColumnCatalog catalog) {
        List<String> notes = new ArrayList<>();
        if (catalog == null || catalog.isEmpty()) {
            notes.add("no columns available");
            return fallback(query, catalog, notes);
        }
        List<String> tokens = QueryTokens.tokenize(query);
        if (tokens.isEmpty()) {
            return fallback(query, catalog, notes);
        }

        boolean[] consumed = new boolean[tokens.size()];
        boolean[] keywords = keywordMask(tokens);
        List<Double> scores = new ArrayList<>();

        List<PlanFilter> filters = extractFilters(tokens, consumed, keywords, catalog, scores, notes);

        String groupColumn = null;
        String groupPhrase = extractGroupPhrase(tokens, consumed, keywords);
        if (groupPhrase != null) {
            Optional<ColumnMatch> group = bestMatch(groupPhrase, catalog);
            if (group.isPresent()) {
                groupColumn = group.get().column();
                scores.add(group.get().score());
            } else {
                notes.add("could not resolve grouping '" + groupPhrase + "'");
            }
        }

        Operation keywordOp = matchOperation(tokens, consumed);

        String targetPhrase = targetPhrase(tokens, consumed, keywords);
        ColumnMatch target = targetPhrase.isEmpty() ? null : bestMatch(targetPhrase, catalog).orElse(null);
        if (target != null && target.column().equals(groupColumn)) {
            target = null;
        }

        AnalysisPlan.AnalysisPlanBuilder plan = AnalysisPlan.builder()
                .query(query)
                .filters(filters)
                .datasetVersion(catalog.getDatasetVersion());
        boolean substituted = false;

        if (groupColumn != null || keywordOp == Operation.GROUP_BY) {
            if (groupColumn == null) {
                Optional<String> firstCategorical = catalog.firstCategorical();
                if (firstCategorical.isEmpty()) {
                    notes.add("no categorical column to group by");
                    return fallback(query, catalog, notes);
                }
                groupColumn = firstCategorical.get();
                substituted = true;
            }
            AggregationMethod method = keywordOp == null
                    ? AggregationMethod.MEAN
                    : AggregationMethod.fromOperation(keywordOp).orElse(AggregationMethod.MEAN);
            String targetColumn = target != null ? target.column() : null;
            if (targetColumn == null && method != AggregationMethod.COUNT) {
                Optional<String> numeric = firstNumericOtherThan(catalog, groupColumn);
                if (numeric.isPresent()) {
                    targetColumn = numeric.get();
                    substituted = true;
                } else {
                    method = AggregationMethod.COUNT;
                }
            }
            if (target != null) {
                scores.add(target.score());
            }
            plan.operation(Operation.GROUP_BY)
                    .groupColumn(groupColumn)
                    .targetColumn(targetColumn)
                    .aggregationMethod(method);
        } else if (keywordOp != null) {
            String targetColumn = target != null ? target.column() : null;
            if (target != null) {
                scores.add(target.score());
            } else {
                Optional<String> defaultColumn = defaultColumn(keywordOp, catalog);
                if (defaultColumn.isPresent()) {
                    targetColumn = defaultColumn.get();
                    substituted = true;
                } else if (requiresColumn(keywordOp)) {
                    notes.add("no suitable column for " + keywordOp.getValue());
                    return fallback(query, catalog, notes);
                }
            }
            plan.operation(keywordOp).targetColumn(targetColumn);
        } else if (target != null) {
            scores.add(target.score());
            Operation op = catalog.isNumeric(target.column()) ? Operation.DISTRIBUTION : Operation.VALUE_COUNTS;
            plan.operation(op).targetColumn(target.column());
        } else {
            return fallback(query, catalog, notes);
        }

        double confidence = substituted ? 0.0 : scores.stream().mapToDouble(Double::doubleValue).min().orElse(1.0);
        AnalysisPlan built = plan
                .resolutionConfidence(confidence)
                .lowConfidence(confidence < AnalysisPlan.LOW_CONFIDENCE_THRESHOLD)
                .build();
        built.setVisualizationHint(chartHint(tokens, defaultHint(built.getOperation())));
        built.setDescription(describe(built, notes));
        log.debug("Compiled plan (operation={}, target={}, group={}, confidence={})",
                built.getOperation().getValue(), built.getTargetColumn(), built.getGroupColumn(), confidence);
        return built;
    }

    /**
     * Plan used when the query cannot be understood: summary statistics over every numeric column.
     */
    private AnalysisPlan fallback(String query, ColumnCatalog catalog, List<String> notes) {
        AnalysisPlan plan = AnalysisPlan.builder()
                .query(query)
                .operation(Operation.DESCRIBE)
                .visualizationHint(VisualizationHint.TABLE)
                .resolutionConfidence(0.0)
                .lowConfidence(true)
                .datasetVersion(catalog != null ? catalog.getDatasetVersion() : null)
                .build();
        StringBuilder sb = new StringBuilder("Query not understood; showing summary statistics");
        appendNotes(sb, notes);
        plan.setDescription(sb.toString());
        return plan;
    }

    private List<PlanFilter> extractFilters(
            List<String> tokens,
            boolean[] consumed,
            boolean[] keywords,
            ColumnCatalog catalog,
            List<Double> scores,
            List<String> notes
    ) {
        List<PlanFilter> filters = new ArrayList<>();
        int cursor = 0;
        while (cursor < tokens.size()) {
            int[] connector = findFirst(tokens, vocabulary.filterConnectors(), cursor, consumed);
            if (connector == null) {
                break;
            }
            int clauseStart = connector[0];
            int pos = connector[0] + connector[1];
            boolean first = true;
            while (true) {
                FilterClause clause = parseClause(tokens, pos, keywords);
                if (clause == null) {
                    if (first) {
                        // Connector without a comparison is left for target extraction.
                        cursor = pos;
                    }
                    break;
                }
                for (int i = first ? clauseStart : pos; i < clause.end; i++) {
                    consumed[i] = true;
                }
                first = false;
                String phrase = String.join(" ", clause.phrase);
                Optional<ColumnMatch> column = phrase.isEmpty() ? Optional.empty() : bestMatch(phrase, catalog);
                if (column.isPresent()) {
                    filters.add(PlanFilter.builder()
                            .column(column.get().column())
                            .operator(clause.operator.operator())
                            .value(clause.value)
                            .build());
                    scores.add(column.get().score());
                } else {
                    notes.add("ignored filter on '" + phrase + "'");
                }
                pos = clause.end;
                cursor = pos;
                if (pos < tokens.size() && QueryTokens.indexOf(tokens, AND, pos) == pos) {
                    FilterClause next = parseClause(tokens, pos + 1, keywords);
                    if (next != null) {
                        consumed[pos] = true;
                        pos = pos + 1;
                        continue;
                    }
                }
                break;
            }
        }
        return filters;
    }

    /**
     * Parses {@code <phrase> <comparison> <value>} starting at {@code start}.
     */
    private FilterClause parseClause(List<String> tokens, int start, boolean[] keywords) {
        int limit = clauseLimit(tokens, start);
        for (int i = start; i < limit; i++) {
            for (QueryVocabulary.Compiled.Comparison cmp : vocabulary.comparisons()) {
                if (QueryTokens.indexOf(tokens, cmp.phrase(), i) != i) {
                    continue;
                }
                int valueStart = i + cmp.phrase().size();
                if (valueStart >= limit) {
                    continue;
                }
                int valueEnd = valueStart + 1;
                while (valueEnd < limit
                        && !keywords[valueEnd]
                        && !vocabulary.stopWords().contains(tokens.get(valueEnd))
                        && !tokens.get(valueEnd).equals("and")) {
                    valueEnd++;
                }
                List<String> phrase = new ArrayList<>();
                for (int p = start; p < i; p++) {
                    if (!vocabulary.stopWords().contains(tokens.get(p))) {
                        phrase.add(tokens.get(p));
                    }
                }
                String value = String.join(" ", tokens.subList(valueStart, valueEnd));
                return new FilterClause(phrase, cmp, value, valueEnd);
            }
        }
        return null;
    }

    /**
     * First index at or after {@code start} where a grouping or filter connector begins, or the token count.
     */
    private int clauseLimit(List<String> tokens, int start) {
        int limit = tokens.size();
        int[] group = findFirst(tokens, vocabulary.groupConnectors(), start, null);
        if (group != null) {
            limit = Math.min(limit, group[0]);
        }
        int[] filter = findFirst(tokens, vocabulary.filterConnectors(), start, null);
        if (filter != null) {
            limit = Math.min(limit, filter[0]);
        }
        return limit;
    }

    private String extractGroupPhrase(List<String> tokens, boolean[] consumed, boolean[] keywords) {
        int[] connector = findFirst(tokens, vocabulary.groupConnectors(), 0, consumed);
        if (connector == null) {
            return null;
        }
        int start = connector[0] + connector[1];
        int end = start;
        List<String> words = new ArrayList<>();
        while (end < tokens.size() && !consumed[end] && !keywords[end] && !startsConnector(tokens, end)) {
            if (!vocabulary.stopWords().contains(tokens.get(end))) {
                words.add(tokens.get(end));
            }
            end++;
        }
        for (int i = connector[0]; i < end; i++) {
            consumed[i] = true;
        }
        return words.isEmpty() ? null : String.join(" ", words);
    }

    private Operation matchOperation(List<String> tokens, boolean[] consumed) {
        for (QueryVocabulary.Compiled.OperationGroup group : vocabulary.operations()) {
            for (List<String> keyword : group.keywords()) {
                int from = 0;
                int idx;
                while ((idx = QueryTokens.indexOf(tokens, keyword, from)) >= 0) {
                    if (!anyConsumed(consumed, idx, keyword.size())) {
                        return group.operation();
                    }
                    from = idx + 1;
                }
            }
        }
        return null;
    }

    private String targetPhrase(List<String> tokens, boolean[] consumed, boolean[] keywords) {
        List<String> words = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (consumed[i] || keywords[i] || QueryTokens.isNumber(token) || vocabulary.stopWords().contains(token)) {
                continue;
            }
            if (startsConnector(tokens, i)) {
                continue;
            }
            words.add(token);
        }
        return String.join(" ", words);
    }

    /**
     * Resolves a phrase, also trying its single words and adjacent pairs so that extra words
     * around a column reference do not hide it.
     */
    private Optional<ColumnMatch> bestMatch(String phrase, ColumnCatalog catalog) {
        List<String> words = QueryTokens.tokenize(phrase);
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(phrase);
        for (int i = 0; i + 1 < words.size(); i++) {
            candidates.add(words.get(i) + " " + words.get(i + 1));
        }
        candidates.addAll(words);

        Map<String, ColumnMatch> best = new LinkedHashMap<>();
        for (String candidate : candidates) {
            for (ColumnMatch match : resolver.resolve(candidate, catalog)) {
                ColumnMatch current = best.get(match.column());
                if (current == null || match.score() > current.score()) {
                    best.put(match.column(), match);
                }
            }
        }
        return best.values().stream().min(Comparator
                .comparingDouble(ColumnMatch::score).reversed()
                .thenComparingInt(m -> m.column().length())
                .thenComparing(ColumnMatch::column));
    }

    private boolean[] keywordMask(List<String> tokens) {
        boolean[] mask = new boolean[tokens.size()];
        for (List<String> keyword : vocabulary.allKeywordPhrases()) {
            int from = 0;
            int idx;
            while ((idx = QueryTokens.indexOf(tokens, keyword, from)) >= 0) {
                for (int i = idx; i < idx + keyword.size(); i++) {
                    mask[i] = true;
                }
                from = idx + 1;
            }
        }
        return mask;
    }

    private boolean startsConnector(List<String> tokens, int index) {
        for (List<String> c : vocabulary.groupConnectors()) {
            if (QueryTokens.indexOf(tokens, c, index) == index) {
                return true;
            }
        }
        for (List<String> c : vocabulary.filterConnectors()) {
            if (QueryTokens.indexOf(tokens, c, index) == index) {
                return true;
            }
        }
        return false;
    }

    /**
     * Earliest occurrence of any phrase at or after {@code from}, skipping consumed positions.
     *
     * @return {@code {index, length}} or null
     */
    private static int[] findFirst(List<String> tokens, List<List<String>> phrases, int from, boolean[] consumed) {
        int[] best = null;
        for (List<String> phrase : phrases) {
            int start = from;
            int idx;
            while ((idx = QueryTokens.indexOf(tokens, phrase, start)) >= 0) {
                if (consumed == null || !anyConsumed(consumed, idx, phrase.size())) {
                    if (best == null || idx < best[0] || (idx == best[0] && phrase.size() > best[1])) {
                        best = new int[]{idx, phrase.size()};
                    }
                    break;
                }
                start = idx + 1;
            }
        }
        return best;
    }

    private static boolean anyConsumed(boolean[] consumed, int start, int length) {
        for (int i = start; i < start + length; i++) {
            if (consumed[i]) {
                return true;
            }
        }
        return false;
    }

    private static Optional<String> firstNumericOtherThan(ColumnCatalog catalog, String exclude) {
        return catalog.numericColumns().stream().filter(c -> !c.equals(exclude)).findFirst();
    }

    private static Optional<String> defaultColumn(Operation op, ColumnCatalog catalog) {
        switch (op) {
            case SUM:
            case MEAN:
            case MAX:
            case MIN:
            case DISTRIBUTION:
                return catalog.firstNumeric();
            case UNIQUE_COUNT:
            case VALUE_COUNTS:
                Optional<String> categorical = catalog.firstCategorical();
                return categorical.isPresent() ? categorical : catalog.columns().stream().findFirst();
            default:
                return Optional.empty();
        }
    }

    private static boolean requiresColumn(Operation op) {
        return op != Operation.COUNT && op != Operation.DESCRIBE;
    }

    private static VisualizationHint defaultHint(Operation op) {
        switch (op) {
            case GROUP_BY:
                return VisualizationHint.BAR;
            case DISTRIBUTION:
                return VisualizationHint.HISTOGRAM;
            case VALUE_COUNTS:
                return VisualizationHint.PIE;
            default:
                return VisualizationHint.TABLE;
        }
    }

    private VisualizationHint chartHint(List<String> tokens, VisualizationHint defaultHint) {
        for (QueryVocabulary.Compiled.ChartOverride override : vocabulary.chartOverrides()) {
            for (List<String> keyword : override.keywords()) {
                if (QueryTokens.indexOf(tokens, keyword, 0) >= 0) {
                    return override.hint();
                }
            }
        }
        return defaultHint;
    }

    private static String describe(AnalysisPlan plan, List<String> notes) {
        StringBuilder sb = new StringBuilder();
        String target = plan.getTargetColumn();
        switch (plan.getOperation()) {
            case SUM:
                sb.append("Sum of ").append(target);
                break;
            case MEAN:
                sb.append("Average of ").append(target);
                break;
            case MAX:
                sb.append("Maximum of ").append(target);
                break;
            case MIN:
                sb.append("Minimum of ").append(target);
                break;
            case COUNT:
                sb.append(target == null ? "Count of rows" : "Count of non-empty " + target);
                break;
            case UNIQUE_COUNT:
                sb.append("Number of distinct ").append(target);
                break;
            case VALUE_COUNTS:
                sb.append("Frequency of each ").append(target);
                break;
            case DISTRIBUTION:
                sb.append("Distribution of ").append(target);
                break;
            case GROUP_BY:
                if (plan.getAggregationMethod() == AggregationMethod.COUNT || target == null) {
                    sb.append("Count of rows by ").append(plan.getGroupColumn());
                } else {
                    sb.append(capitalize(plan.getAggregationMethod().getValue()))
                            .append(" of ").append(target)
                            .append(" by ").append(plan.getGroupColumn());
                }
                break;
            default:
                sb.append(target == null ? "Summary statistics" : "Summary statistics of " + target);
                break;
        }
        for (int i = 0; i < plan.getFilters().size(); i++) {
            PlanFilter f = plan.getFilters().get(i);
            sb.append(i == 0 ? " where " : " and ")
                    .append(f.getColumn()).append(' ')
                    .append(f.getOperator().getSymbol()).append(' ')
                    .append(f.getValue());
        }
        appendNotes(sb, notes);
        return sb.toString();
    }

    private static void appendNotes(StringBuilder sb, List<String> notes) {
        if (notes != null && !notes.isEmpty()) {
            sb.append(" (").append(String.join("; ", notes)).append(')');
        }
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private static final class FilterClause {
        private final List<String> phrase;
        private final QueryVocabulary.Compiled.Comparison operator;
        private final String value;
        private final int end;

        private FilterClause(List<String> phrase, QueryVocabulary.Compiled.Comparison operator, String value, int end) {
            this.phrase = phrase;
            this.operator = operator;
            this.value = value;
            this.end = end;
        }
    }
}
