package com.askdata.vocabulary;

import com.askdata.model.FilterOperator;
import com.askdata.model.Operation;
import com.askdata.model.VisualizationHint;
import lombok.Data;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Vocabulary loaded from YAML: synonym table, operation keyword groups, connectors, comparison
 * phrases, chart keywords and stop words.
 *
 * <p>Instances are mutable JavaBeans only while SnakeYAML populates them; {@link #compile()}
 * turns one into the read-only {@link Compiled} view the resolver and compiler use.
 */
@Data
public class QueryVocabulary {

    public static final String DEFAULT_RESOURCE = "/vocabulary/default.yaml";

    private List<OperationKeywords> operations = new ArrayList<>();
    private List<String> groupConnectors = new ArrayList<>();
    private List<String> filterConnectors = new ArrayList<>();
    private List<ComparisonPhrases> comparisons = new ArrayList<>();
    private List<ChartKeywords> chartKeywords = new ArrayList<>();
    private List<String> stopWords = new ArrayList<>();
    private Map<String, List<String>> synonyms = new LinkedHashMap<>();

    @Data
    public static class OperationKeywords {
        private String operation;
        private List<String> keywords = new ArrayList<>();
    }

    @Data
    public static class ComparisonPhrases {
        private String operator;
        private List<String> phrases = new ArrayList<>();
    }

    @Data
    public static class ChartKeywords {
        private String hint;
        private List<String> keywords = new ArrayList<>();
    }

    /**
     * Reads a vocabulary document.
     *
     * @param in YAML input
     * @return compiled vocabulary
     */
    public static Compiled load(InputStream in) {
        QueryVocabulary raw = new Yaml().loadAs(in, QueryVocabulary.class);
        if (raw == null) {
            throw new IllegalArgumentException("vocabulary document is empty");
        }
        return raw.compile();
    }

    /**
     * Reads the vocabulary bundled on the classpath.
     *
     * @return compiled default vocabulary
     */
    public static Compiled loadDefault() {
        try (InputStream in = QueryVocabulary.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException(DEFAULT_RESOURCE + " not found on classpath");
            }
            return load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Validates this document and converts every phrase into token lists.
     *
     * @return read-only vocabulary
     * @throws IllegalArgumentException when an operation, operator or hint name is unknown
     */
    public Compiled compile() {
        List<Compiled.OperationGroup> ops = new ArrayList<>();
        for (OperationKeywords group : nullSafe(operations)) {
            if (group == null || group.getOperation() == null) {
                continue;
            }
            ops.add(new Compiled.OperationGroup(Operation.fromValue(group.getOperation()), phrases(group.getKeywords())));
        }
        if (ops.isEmpty()) {
            throw new IllegalArgumentException("vocabulary defines no operations");
        }

        List<Compiled.Comparison> cmps = new ArrayList<>();
        for (ComparisonPhrases cmp : nullSafe(comparisons)) {
            if (cmp == null || cmp.getOperator() == null) {
                continue;
            }
            FilterOperator op = FilterOperator.fromValue(cmp.getOperator());
            for (List<String> phrase : phrases(cmp.getPhrases())) {
                cmps.add(new Compiled.Comparison(op, phrase));
            }
        }
        // Longest phrase first so "is not" wins over "is".
        cmps.sort((a, b) -> Integer.compare(b.phrase().size(), a.phrase().size()));

        List<Compiled.ChartOverride> charts = new ArrayList<>();
        for (ChartKeywords chart : nullSafe(chartKeywords)) {
            if (chart == null || chart.getHint() == null) {
                continue;
            }
            charts.add(new Compiled.ChartOverride(VisualizationHint.fromValue(chart.getHint()), phrases(chart.getKeywords())));
        }

        Map<String, List<String>> syn = new LinkedHashMap<>();
        if (synonyms != null) {
            for (Map.Entry<String, List<String>> e : synonyms.entrySet()) {
                if (e.getKey() == null || e.getKey().isBlank()) {
                    continue;
                }
                Set<String> candidates = new LinkedHashSet<>();
                for (String c : nullSafe(e.getValue())) {
                    if (c != null && !c.isBlank()) {
                        candidates.add(QueryTokens.normalize(c));
                    }
                }
                syn.put(QueryTokens.normalize(e.getKey()), List.copyOf(candidates));
            }
        }

        Set<String> stops = new LinkedHashSet<>();
        for (String w : nullSafe(stopWords)) {
            stops.addAll(QueryTokens.tokenize(w));
        }

        return new Compiled(
                List.copyOf(ops),
                phrases(groupConnectors),
                phrases(filterConnectors),
                List.copyOf(cmps),
                List.copyOf(charts),
                Set.copyOf(stops),
                Map.copyOf(syn)
        );
    }

    private static List<List<String>> phrases(List<String> raw) {
        List<List<String>> out = new ArrayList<>();
        for (String p : nullSafe(raw)) {
            List<String> tokens = QueryTokens.tokenize(p);
            if (!tokens.isEmpty()) {
                out.add(List.copyOf(tokens));
            }
        }
        return List.copyOf(out);
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }

    /**
     * Read-only, tokenized vocabulary.
     */
    public record Compiled(
            List<OperationGroup> operations,
            List<List<String>> groupConnectors,
            List<List<String>> filterConnectors,
            List<Comparison> comparisons,
            List<ChartOverride> chartOverrides,
            Set<String> stopWords,
            Map<String, List<String>> synonyms
    ) {
        public record OperationGroup(Operation operation, List<List<String>> keywords) {
        }

        public record Comparison(FilterOperator operator, List<String> phrase) {
        }

        public record ChartOverride(VisualizationHint hint, List<List<String>> keywords) {
        }

        /**
         * Every keyword phrase of every operation and chart group, used to strip keywords from the target phrase.
         *
         * @return keyword phrases
         */
        public List<List<String>> allKeywordPhrases() {
            List<List<String>> out = new ArrayList<>();
            for (OperationGroup g : operations) {
                out.addAll(g.keywords());
            }
            for (ChartOverride c : chartOverrides) {
                out.addAll(c.keywords());
            }
            return out;
        }
    }
}
