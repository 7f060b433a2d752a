package com.askdata.viz;

import com.askdata.model.AnalysisPlan;
import com.askdata.model.AnalysisResponse;
import com.askdata.model.AnalysisResult;
import com.askdata.model.ScalarResult;
import com.askdata.model.SeriesPoint;
import com.askdata.model.SeriesResult;
import com.askdata.model.TableResult;
import com.askdata.util.ValueFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a result as a short summary line and a plain-text detail block.
 */
public class ResponseFormatter {
    private static final int MAX_DETAIL_LINES = 50;

    public AnalysisResponse format(String query, AnalysisPlan plan, AnalysisResult result) {
        String description = plan != null && plan.getDescription() != null ? plan.getDescription() : query;
        StringBuilder summary = new StringBuilder(description == null ? "" : description);
        String headline = headline(result);
        if (!headline.isEmpty()) {
            summary.append(": ").append(headline);
        }
        if (plan != null && plan.isLowConfidence()) {
            summary.append(" (low confidence: the question may have been misread)");
        }

        List<String> lines = detailLines(result);
        if (result != null) {
            for (String note : result.getNotes()) {
                lines.add("Note: " + note);
            }
        }
        return new AnalysisResponse(summary.toString(), String.join("\n", lines));
    }

    private static String headline(AnalysisResult result) {
        if (result == null) {
            return "";
        }
        if (result instanceof ScalarResult scalar) {
            if (scalar.isUndefined() || scalar.getValue() == null) {
                return "undefined (no values)";
            }
            return ValueFormat.number(scalar.getValue());
        }
        if (result.isEmpty()) {
            return "no data";
        }
        if (result instanceof SeriesResult series) {
            SeriesPoint top = null;
            for (SeriesPoint p : series.getPoints()) {
                if (!p.isUndefined() && p.getValue() != null && (top == null || p.getValue() > top.getValue())) {
                    top = p;
                }
            }
            String out = series.getPoints().size() + " entries";
            if (top != null) {
                out += ", highest " + top.getLabel() + " (" + ValueFormat.number(top.getValue()) + ")";
            }
            return out;
        }
        if (result instanceof TableResult table) {
            return table.getRows().size() + " rows";
        }
        return "";
    }

    private static List<String> detailLines(AnalysisResult result) {
        List<String> lines = new ArrayList<>();
        if (result instanceof ScalarResult scalar) {
            lines.add(scalar.getLabel() + " = "
                    + (scalar.isUndefined() || scalar.getValue() == null ? "undefined" : ValueFormat.number(scalar.getValue())));
        } else if (result instanceof SeriesResult series) {
            int shown = 0;
            for (SeriesPoint p : series.getPoints()) {
                if (shown++ >= MAX_DETAIL_LINES) {
                    lines.add("... " + (series.getPoints().size() - MAX_DETAIL_LINES) + " more");
                    break;
                }
                lines.add(p.getLabel() + ": " + (p.isUndefined() || p.getValue() == null ? "undefined" : ValueFormat.number(p.getValue())));
            }
        } else if (result instanceof TableResult table) {
            lines.add(String.join(" | ", table.getColumns()));
            int shown = 0;
            for (Map<String, Object> row : table.getRows()) {
                if (shown++ >= MAX_DETAIL_LINES) {
                    lines.add("... " + (table.getRows().size() - MAX_DETAIL_LINES) + " more");
                    break;
                }
                List<String> cells = new ArrayList<>();
                for (String column : table.getColumns()) {
                    Object v = row.get(column);
                    cells.add(v == null ? "" : v instanceof Number n ? ValueFormat.number(n.doubleValue()) : String.valueOf(v));
                }
                lines.add(String.join(" | ", cells));
            }
        }
        return lines;
    }
}
