package com.askdata.viz;

import com.askdata.model.AnalysisPlan;
import com.askdata.model.AnalysisResult;
import com.askdata.model.ChartSpec;
import com.askdata.model.ScalarResult;
import com.askdata.model.SeriesPoint;
import com.askdata.model.SeriesResult;
import com.askdata.model.TableResult;
import com.askdata.model.VisualizationHint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks a chart kind for a result and fills a {@link ChartSpec} with its data.
 */
public class VisualizationSelector {

    /**
     * Pie charts with more slices than this are drawn as bars.
     */
    public static final int MAX_PIE_SLICES = 10;

    public ChartSpec select(AnalysisPlan plan, AnalysisResult result) {
        VisualizationHint hint = plan != null && plan.getVisualizationHint() != null
                ? plan.getVisualizationHint()
                : VisualizationHint.NONE;
        String title = plan != null ? plan.getDescription() : null;

        if (result instanceof SeriesResult series) {
            return forSeries(series, hint, title);
        }
        if (result instanceof ScalarResult scalar) {
            return forScalar(scalar, hint, title);
        }
        if (result instanceof TableResult table) {
            return ChartSpec.builder()
                    .kind(VisualizationHint.TABLE)
                    .title(title)
                    .columns(new ArrayList<>(table.getColumns()))
                    .rows(new ArrayList<>(table.getRows()))
                    .build();
        }
        return ChartSpec.builder().kind(VisualizationHint.NONE).title(title).build();
    }

    private ChartSpec forSeries(SeriesResult series, VisualizationHint hint, String title) {
        List<ChartSpec.Point> points = new ArrayList<>();
        for (SeriesPoint p : series.getPoints()) {
            if (!p.isUndefined() && p.getValue() != null) {
                points.add(new ChartSpec.Point(p.getLabel(), p.getValue()));
            }
        }
        VisualizationHint kind;
        switch (hint) {
            case LINE:
            case HISTOGRAM:
                kind = hint;
                break;
            case PIE:
                kind = points.size() > MAX_PIE_SLICES ? VisualizationHint.BAR : VisualizationHint.PIE;
                break;
            default:
                kind = VisualizationHint.BAR;
                break;
        }
        return ChartSpec.builder()
                .kind(kind)
                .title(title)
                .categoryLabel(series.getLabelName())
                .valueLabel(series.getValueName())
                .series(points)
                .build();
    }

    private ChartSpec forScalar(ScalarResult scalar, VisualizationHint hint, String title) {
        boolean asTable = hint == VisualizationHint.TABLE
                || hint == VisualizationHint.NONE
                || scalar.isUndefined()
                || scalar.getValue() == null;
        if (asTable) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("metric", scalar.getLabel());
            row.put("value", scalar.getValue());
            List<Map<String, Object>> rows = new ArrayList<>();
            rows.add(row);
            return ChartSpec.builder()
                    .kind(VisualizationHint.TABLE)
                    .title(title)
                    .columns(List.of("metric", "value"))
                    .rows(rows)
                    .build();
        }
        List<ChartSpec.Point> points = new ArrayList<>();
        points.add(new ChartSpec.Point(scalar.getLabel(), scalar.getValue()));
        return ChartSpec.builder()
                .kind(VisualizationHint.BAR)
                .title(title)
                .valueLabel(scalar.getLabel())
                .series(points)
                .build();
    }
}
