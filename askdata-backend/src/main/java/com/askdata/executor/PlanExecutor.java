package com.askdata.executor;

import com.askdata.model.AggregationMethod;
import com.askdata.model.AnalysisPlan;
import com.askdata.model.AnalysisResult;
import com.askdata.model.ColumnCatalog;
import com.askdata.model.ColumnType;
import com.askdata.model.Dataset;
import com.askdata.model.FilterOperator;
import com.askdata.model.Operation;
import com.askdata.model.PlanFilter;
import com.askdata.model.ScalarResult;
import com.askdata.model.SeriesPoint;
import com.askdata.model.SeriesResult;
import com.askdata.model.TableResult;
import com.askdata.util.JsonSafe;
import com.askdata.util.ValueFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs an {@link AnalysisPlan} over a {@link Dataset}.
 *
 * <p>Execution only reads the dataset. Filters are applied first, then the plan's operation runs
 * over the remaining rows. Problems the user can act on (type mismatch, non-finite values, empty
 * filter) are attached to the result as notes; problems that make the plan impossible to run
 * raise {@link AnalysisExecutionException}.
 */
public class PlanExecutor {
    private static final Logger log = LoggerFactory.getLogger(PlanExecutor.class);

    public static final int VALUE_COUNTS_LIMIT = 20;
    public static final int DISTRIBUTION_BINS = 10;
    public static final String OTHER_LABEL = "Other";

    /**
     * Executes a plan.
     *
     * @param plan compiled plan
     * @param dataset dataset the plan was compiled for
     * @param catalog catalog of that dataset, used for column types
     * @return typed result
     * @throws AnalysisExecutionException when the dataset is missing or empty, the plan is stale,
     *                                    or a plan column does not exist
     */
    public AnalysisResult execute(AnalysisPlan plan, Dataset dataset, ColumnCatalog catalog) {
        if (plan == null || plan.getOperation() == null) {
            throw new AnalysisExecutionException("No analysis plan to execute");
        }
        if (dataset == null) {
            throw new AnalysisExecutionException("No dataset loaded");
        }
        if (dataset.rowCount() == 0) {
            throw new AnalysisExecutionException("Dataset is empty");
        }
        if (!Objects.equals(plan.getDatasetVersion(), dataset.getVersion())) {
            throw new AnalysisExecutionException("Dataset changed since the query was compiled; please ask again");
        }
        requireColumn(dataset, plan.getTargetColumn());
        requireColumn(dataset, plan.getGroupColumn());
        for (PlanFilter f : filters(plan)) {
            requireColumn(dataset, f.getColumn());
        }

        List<Integer> rows = applyFilters(plan, dataset);
        log.debug("Executing plan (operation={}, rows={}, filtered_rows={})",
                plan.getOperation().getValue(), dataset.rowCount(), rows.size());
        if (rows.isEmpty()) {
            return emptyResult(plan, dataset, catalog);
        }

        switch (plan.getOperation()) {
            case SUM:
            case MEAN:
            case MAX:
            case MIN:
                return aggregate(plan, dataset, catalog, rows);
            case COUNT:
                return count(plan, dataset, rows);
            case UNIQUE_COUNT:
                return uniqueCount(plan, dataset, rows);
            case VALUE_COUNTS:
                return valueCounts(requireTarget(plan), dataset, rows);
            case GROUP_BY:
                return groupBy(plan, dataset, catalog, rows);
            case DISTRIBUTION:
                return distribution(plan, dataset, catalog, rows);
            case DESCRIBE:
            default:
                return describe(plan, dataset, catalog, rows);
        }
    }

    private AnalysisResult aggregate(AnalysisPlan plan, Dataset dataset, ColumnCatalog catalog, List<Integer> rows) {
        String target = requireTarget(plan);
        String label = plan.getOperation().getValue() + "(" + target + ")";
        if (!isNumeric(catalog, dataset, target)) {
            ScalarResult out = ScalarResult.of(label, 0.0);
            out.addNote("Column '" + target + "' is not numeric; " + plan.getOperation().getValue() + " is not defined for it");
            return out;
        }
        NumericSample sample = numeric(dataset, target, rows);
        ScalarResult out;
        switch (plan.getOperation()) {
            case SUM:
                out = ScalarResult.of(label, sample.sum());
                break;
            case MEAN:
                out = sample.isEmpty() ? ScalarResult.undefined(label) : ScalarResult.of(label, sample.mean());
                break;
            case MAX:
                out = sample.isEmpty() ? ScalarResult.undefined(label) : ScalarResult.of(label, sample.max());
                break;
            default:
                out = sample.isEmpty() ? ScalarResult.undefined(label) : ScalarResult.of(label, sample.min());
                break;
        }
        noteDropped(out, target, sample);
        if (sample.isEmpty()) {
            out.addNote("Column '" + target + "' has no numeric values in the selected rows");
        }
        return out;
    }

    private AnalysisResult count(AnalysisPlan plan, Dataset dataset, List<Integer> rows) {
        String target = plan.getTargetColumn();
        if (target == null) {
            return ScalarResult.of("count", rows.size());
        }
        int idx = dataset.columnIndex(target);
        long n = 0;
        for (int r : rows) {
            if (dataset.value(r, idx) != null) {
                n++;
            }
        }
        return ScalarResult.of("count(" + target + ")", n);
    }

    private AnalysisResult uniqueCount(AnalysisPlan plan, Dataset dataset, List<Integer> rows) {
        String target = requireTarget(plan);
        int idx = dataset.columnIndex(target);
        Set<Object> distinct = new HashSet<>();
        for (int r : rows) {
            Object v = dataset.value(r, idx);
            if (v != null) {
                distinct.add(v);
            }
        }
        return ScalarResult.of("unique_count(" + target + ")", distinct.size());
    }

    private SeriesResult valueCounts(String target, Dataset dataset, List<Integer> rows) {
        int idx = dataset.columnIndex(target);
        Map<String, Long> counts = new LinkedHashMap<>();
        int missing = 0;
        for (int r : rows) {
            String label = ValueFormat.label(dataset.value(r, idx));
            if (label == null) {
                missing++;
                continue;
            }
            counts.merge(label, 1L, Long::sum);
        }

        // List.sort is stable, so equal counts keep first-seen order.
        List<Map.Entry<String, Long>> ordered = new ArrayList<>(counts.entrySet());
        ordered.sort(Map.Entry.<String, Long>comparingByValue().reversed());

        SeriesResult out = new SeriesResult(target, "count");
        long other = 0;
        for (int i = 0; i < ordered.size(); i++) {
            Map.Entry<String, Long> e = ordered.get(i);
            if (i < VALUE_COUNTS_LIMIT) {
                out.add(SeriesPoint.of(e.getKey(), e.getValue()));
            } else {
                other += e.getValue();
            }
        }
        if (other > 0) {
            out.add(SeriesPoint.of(OTHER_LABEL, other));
            out.addNote((ordered.size() - VALUE_COUNTS_LIMIT) + " less frequent values grouped as '" + OTHER_LABEL + "'");
        }
        if (missing > 0) {
            out.addNote(missing + " missing values in '" + target + "' ignored");
        }
        if (out.getPoints().isEmpty()) {
            out.setEmpty(true);
        }
        return out;
    }

    private AnalysisResult groupBy(AnalysisPlan plan, Dataset dataset, ColumnCatalog catalog, List<Integer> rows) {
        String group = plan.getGroupColumn();
        if (group == null) {
            throw new AnalysisExecutionException("Grouping column is missing from the plan");
        }
        String target = plan.getTargetColumn();
        AggregationMethod method = plan.getAggregationMethod() != null ? plan.getAggregationMethod() : AggregationMethod.MEAN;
        List<String> notes = new ArrayList<>();
        if (target == null) {
            method = AggregationMethod.COUNT;
        } else if (method != AggregationMethod.COUNT && !isNumeric(catalog, dataset, target)) {
            notes.add("Column '" + target + "' is not numeric; counting rows per " + group + " instead");
            method = AggregationMethod.COUNT;
        }

        int groupIdx = dataset.columnIndex(group);
        Map<Object, List<Integer>> partitions = new LinkedHashMap<>();
        int nullLabels = 0;
        for (int r : rows) {
            Object key = dataset.value(r, groupIdx);
            if (key == null) {
                nullLabels++;
                continue;
            }
            if (key instanceof Double d && d == 0.0) {
                // -0.0 and 0.0 share a label
                key = 0.0;
            }
            partitions.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }
        if (nullLabels > 0) {
            notes.add(nullLabels + " rows with missing '" + group + "' dropped");
        }

        List<Object> keys = new ArrayList<>(partitions.keySet());
        keys.sort(labelOrder(keys));

        String valueName = method == AggregationMethod.COUNT
                ? (target == null ? "count" : "count(" + target + ")")
                : method.getValue() + "(" + target + ")";
        SeriesResult out = new SeriesResult(group, valueName);
        int dropped = 0;
        for (Object key : keys) {
            List<Integer> part = partitions.get(key);
            String label = ValueFormat.label(key);
            if (method == AggregationMethod.COUNT) {
                out.add(SeriesPoint.of(label, countNonNull(dataset, target, part)));
                continue;
            }
            NumericSample sample = numeric(dataset, target, part);
            dropped += sample.dropped();
            out.add(aggregatePoint(label, method, sample));
        }
        if (dropped > 0) {
            notes.add("Dropped " + dropped + " non-finite values from '" + target + "'");
        }
        if (out.getPoints().isEmpty()) {
            out.setEmpty(true);
        }
        notes.forEach(out::addNote);
        return out;
    }

    private AnalysisResult distribution(AnalysisPlan plan, Dataset dataset, ColumnCatalog catalog, List<Integer> rows) {
        String target = requireTarget(plan);
        if (!isNumeric(catalog, dataset, target)) {
            SeriesResult counts = valueCounts(target, dataset, rows);
            counts.addNote("Column '" + target + "' is not numeric; showing value counts instead");
            return counts;
        }
        NumericSample sample = numeric(dataset, target, rows);
        SeriesResult out = new SeriesResult(target, "count");
        noteDropped(out, target, sample);
        if (sample.isEmpty()) {
            out.setEmpty(true);
            out.addNote("Column '" + target + "' has no numeric values in the selected rows");
            return out;
        }

        double min = sample.min();
        double max = sample.max();
        if (min == max) {
            out.add(SeriesPoint.of("[" + ValueFormat.number(min) + ", " + ValueFormat.number(max) + "]", sample.size()));
        } else {
            long[] bins = new long[DISTRIBUTION_BINS];
            double width = (max - min) / DISTRIBUTION_BINS;
            for (double v : sample.values()) {
                int bin = (int) ((v - min) / width);
                bins[Math.min(Math.max(bin, 0), DISTRIBUTION_BINS - 1)]++;
            }
            for (int i = 0; i < DISTRIBUTION_BINS; i++) {
                double lo = min + i * width;
                double hi = i == DISTRIBUTION_BINS - 1 ? max : min + (i + 1) * width;
                String close = i == DISTRIBUTION_BINS - 1 ? "]" : ")";
                out.add(SeriesPoint.of("[" + ValueFormat.number(lo) + ", " + ValueFormat.number(hi) + close, bins[i]));
            }
        }
        out.getMetadata().put("mean", JsonSafe.finiteOrNull(sample.mean()));
        out.getMetadata().put("std", JsonSafe.finiteOrNull(sample.std()));
        out.getMetadata().put("min", JsonSafe.finiteOrNull(min));
        out.getMetadata().put("max", JsonSafe.finiteOrNull(max));
        out.getMetadata().put("count", sample.size());
        return out;
    }

    private AnalysisResult describe(AnalysisPlan plan, Dataset dataset, ColumnCatalog catalog, List<Integer> rows) {
        List<String> columns = describedColumns(plan, dataset, catalog);
        if (columns.isEmpty()) {
            return profile(plan, dataset, catalog, rows);
        }
        TableResult out = new TableResult(List.of("column", "count", "mean", "std", "min", "max"));
        int dropped = 0;
        for (String column : columns) {
            NumericSample sample = numeric(dataset, column, rows);
            dropped += sample.dropped();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("column", column);
            row.put("count", sample.size());
            row.put("mean", JsonSafe.finiteOrNull(sample.mean()));
            row.put("std", JsonSafe.finiteOrNull(sample.std()));
            row.put("min", JsonSafe.finiteOrNull(sample.min()));
            row.put("max", JsonSafe.finiteOrNull(sample.max()));
            out.getRows().add(row);
        }
        if (dropped > 0) {
            out.addNote("Dropped " + dropped + " non-finite values");
        }
        return out;
    }

    /**
     * Per-column profile used by describe when no numeric column is available.
     */
    private TableResult profile(AnalysisPlan plan, Dataset dataset, ColumnCatalog catalog, List<Integer> rows) {
        List<String> columns = plan.getTargetColumn() != null ? List.of(plan.getTargetColumn()) : dataset.getColumns();
        TableResult out = new TableResult(List.of("column", "type", "non_null", "unique"));
        for (String column : columns) {
            int idx = dataset.columnIndex(column);
            long nonNull = 0;
            Set<Object> distinct = new HashSet<>();
            for (int r : rows) {
                Object v = dataset.value(r, idx);
                if (v != null) {
                    nonNull++;
                    distinct.add(v);
                }
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("column", column);
            row.put("type", typeName(catalog, column));
            row.put("non_null", nonNull);
            row.put("unique", distinct.size());
            out.getRows().add(row);
        }
        return out;
    }

    private AnalysisResult emptyResult(AnalysisPlan plan, Dataset dataset, ColumnCatalog catalog) {
        String target = plan.getTargetColumn();
        String note = "No rows match the filters";
        AnalysisResult out;
        switch (plan.getOperation()) {
            case SUM:
                out = ScalarResult.of("sum(" + target + ")", 0.0);
                break;
            case COUNT:
                out = ScalarResult.of(target == null ? "count" : "count(" + target + ")", 0.0);
                break;
            case UNIQUE_COUNT:
                out = ScalarResult.of("unique_count(" + target + ")", 0.0);
                break;
            case MEAN:
            case MAX:
            case MIN:
                out = ScalarResult.undefined(plan.getOperation().getValue() + "(" + target + ")");
                break;
            case GROUP_BY:
                out = new SeriesResult(plan.getGroupColumn(), target == null ? "count" : target);
                break;
            case VALUE_COUNTS:
            case DISTRIBUTION:
                out = new SeriesResult(target, "count");
                break;
            case DESCRIBE:
            default:
                out = describedColumns(plan, dataset, catalog).isEmpty()
                        ? new TableResult(List.of("column", "type", "non_null", "unique"))
                        : new TableResult(List.of("column", "count", "mean", "std", "min", "max"));
                break;
        }
        out.setEmpty(true);
        out.addNote(note);
        return out;
    }

    private List<String> describedColumns(AnalysisPlan plan, Dataset dataset, ColumnCatalog catalog) {
        String target = plan.getTargetColumn();
        if (target != null) {
            return isNumeric(catalog, dataset, target) ? List.of(target) : List.of();
        }
        if (catalog != null) {
            return catalog.numericColumns();
        }
        List<String> out = new ArrayList<>();
        for (String column : dataset.getColumns()) {
            if (isNumeric(null, dataset, column)) {
                out.add(column);
            }
        }
        return out;
    }

    private List<Integer> applyFilters(AnalysisPlan plan, Dataset dataset) {
        List<PlanFilter> filters = filters(plan);
        int[] indexes = new int[filters.size()];
        for (int i = 0; i < filters.size(); i++) {
            indexes[i] = dataset.columnIndex(filters.get(i).getColumn());
        }
        List<Integer> out = new ArrayList<>();
        for (int r = 0; r < dataset.rowCount(); r++) {
            boolean keep = true;
            for (int i = 0; i < filters.size() && keep; i++) {
                keep = matches(dataset.value(r, indexes[i]), filters.get(i));
            }
            if (keep) {
                out.add(r);
            }
        }
        return out;
    }

    /**
     * Numbers compare numerically, everything else case-insensitively as text. Missing cells never match.
     */
    static boolean matches(Object cell, PlanFilter filter) {
        if (cell == null || filter.getOperator() == null || filter.getValue() == null) {
            return false;
        }
        int cmp;
        if (cell instanceof Number n && isParsableNumber(filter.getValue())) {
            cmp = Double.compare(n.doubleValue(), Double.parseDouble(filter.getValue().trim()));
        } else {
            String text = ValueFormat.label(cell).toLowerCase(Locale.ROOT);
            cmp = text.compareTo(filter.getValue().trim().toLowerCase(Locale.ROOT));
        }
        FilterOperator op = filter.getOperator();
        switch (op) {
            case EQ:
                return cmp == 0;
            case NE:
                return cmp != 0;
            case GT:
                return cmp > 0;
            case GTE:
                return cmp >= 0;
            case LT:
                return cmp < 0;
            case LTE:
                return cmp <= 0;
            default:
                return false;
        }
    }

    private static boolean isParsableNumber(String s) {
        try {
            return Double.isFinite(Double.parseDouble(s.trim()));
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static NumericSample numeric(Dataset dataset, String column, List<Integer> rows) {
        int idx = dataset.columnIndex(column);
        double[] buf = new double[rows.size()];
        int n = 0;
        int dropped = 0;
        for (int r : rows) {
            Object v = dataset.value(r, idx);
            if (!(v instanceof Number num)) {
                continue;
            }
            double d = num.doubleValue();
            if (Double.isFinite(d)) {
                buf[n++] = d;
            } else {
                dropped++;
            }
        }
        double[] values = new double[n];
        System.arraycopy(buf, 0, values, 0, n);
        return new NumericSample(values, dropped);
    }

    private static long countNonNull(Dataset dataset, String column, List<Integer> rows) {
        if (column == null) {
            return rows.size();
        }
        int idx = dataset.columnIndex(column);
        long n = 0;
        for (int r : rows) {
            if (dataset.value(r, idx) != null) {
                n++;
            }
        }
        return n;
    }

    private static SeriesPoint aggregatePoint(String label, AggregationMethod method, NumericSample sample) {
        switch (method) {
            case SUM:
                return SeriesPoint.of(label, sample.sum());
            case MAX:
                return sample.isEmpty() ? SeriesPoint.undefined(label) : SeriesPoint.of(label, sample.max());
            case MIN:
                return sample.isEmpty() ? SeriesPoint.undefined(label) : SeriesPoint.of(label, sample.min());
            case MEAN:
            default:
                return sample.isEmpty() ? SeriesPoint.undefined(label) : SeriesPoint.of(label, sample.mean());
        }
    }

    /**
     * Numeric labels sort numerically, anything else by text.
     */
    private static Comparator<Object> labelOrder(List<Object> keys) {
        boolean allNumbers = keys.stream().allMatch(k -> k instanceof Number);
        if (allNumbers) {
            return Comparator.comparingDouble(k -> ((Number) k).doubleValue());
        }
        return Comparator.comparing(ValueFormat::label);
    }

    private static boolean isNumeric(ColumnCatalog catalog, Dataset dataset, String column) {
        if (catalog != null && catalog.contains(column)) {
            return catalog.isNumeric(column);
        }
        int idx = dataset.columnIndex(column);
        boolean seen = false;
        for (List<Object> row : dataset.getRows()) {
            Object v = row.get(idx);
            if (v == null) {
                continue;
            }
            if (!(v instanceof Number)) {
                return false;
            }
            seen = true;
        }
        return seen;
    }

    private static String typeName(ColumnCatalog catalog, String column) {
        if (catalog == null) {
            return ColumnType.TEXT.getValue();
        }
        return catalog.typeOf(column).map(ColumnType::getValue).orElse(ColumnType.TEXT.getValue());
    }

    private static void noteDropped(AnalysisResult out, String column, NumericSample sample) {
        if (sample.dropped() > 0) {
            out.addNote("Dropped " + sample.dropped() + " non-finite values from '" + column + "'");
        }
    }

    private static void requireColumn(Dataset dataset, String column) {
        if (column != null && !dataset.hasColumn(column)) {
            throw new AnalysisExecutionException("Column '" + column + "' not found in dataset");
        }
    }

    private static String requireTarget(AnalysisPlan plan) {
        if (plan.getTargetColumn() == null) {
            throw new AnalysisExecutionException("Operation " + plan.getOperation().getValue() + " needs a target column");
        }
        return plan.getTargetColumn();
    }

    private static List<PlanFilter> filters(AnalysisPlan plan) {
        return plan.getFilters() != null ? plan.getFilters() : List.of();
    }
}
