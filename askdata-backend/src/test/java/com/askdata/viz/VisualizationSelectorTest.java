package com.askdata.viz;

import com.askdata.model.AnalysisPlan;
import com.askdata.model.ChartSpec;
import com.askdata.model.Operation;
import com.askdata.model.ScalarResult;
import com.askdata.model.SeriesPoint;
import com.askdata.model.SeriesResult;
import com.askdata.model.TableResult;
import com.askdata.model.VisualizationHint;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VisualizationSelectorTest {

    private final VisualizationSelector selector = new VisualizationSelector();

    @Test
    void testSeriesFollowsHint() {
        ChartSpec chart = selector.select(plan(VisualizationHint.BAR), series(4));

        assertEquals(VisualizationHint.BAR, chart.getKind());
        assertEquals("region", chart.getCategoryLabel());
        assertEquals("sum(sales)", chart.getValueLabel());
        assertEquals(4, chart.getSeries().size());
        assertEquals("test chart", chart.getTitle());

        assertEquals(VisualizationHint.LINE, selector.select(plan(VisualizationHint.LINE), series(4)).getKind());
        assertEquals(VisualizationHint.HISTOGRAM, selector.select(plan(VisualizationHint.HISTOGRAM), series(4)).getKind());
    }

    @Test
    void testPieDegradesToBarWithManySlices() {
        assertEquals(VisualizationHint.PIE,
                selector.select(plan(VisualizationHint.PIE), series(VisualizationSelector.MAX_PIE_SLICES)).getKind());
        assertEquals(VisualizationHint.BAR,
                selector.select(plan(VisualizationHint.PIE), series(VisualizationSelector.MAX_PIE_SLICES + 1)).getKind());
    }

    @Test
    void testSeriesWithTableHintIsBar() {
        assertEquals(VisualizationHint.BAR, selector.select(plan(VisualizationHint.TABLE), series(3)).getKind());
        assertEquals(VisualizationHint.BAR, selector.select(plan(VisualizationHint.NONE), series(3)).getKind());
    }

    @Test
    void testUndefinedPointsAreOmitted() {
        SeriesResult result = series(3);
        result.add(SeriesPoint.undefined("empty"));

        ChartSpec chart = selector.select(plan(VisualizationHint.BAR), result);
        assertEquals(3, chart.getSeries().size());
        assertTrue(chart.getSeries().stream().noneMatch(p -> p.getName().equals("empty")));
    }

    @Test
    void testScalarAsTableOrBar() {
        ScalarResult total = ScalarResult.of("sum(sales)", 1110.75);

        ChartSpec table = selector.select(plan(VisualizationHint.TABLE), total);
        assertEquals(VisualizationHint.TABLE, table.getKind());
        assertEquals(List.of("metric", "value"), table.getColumns());
        assertEquals(1110.75, (Double) table.getRows().get(0).get("value"), 1e-9);
        assertTrue(table.getSeries().isEmpty());

        ChartSpec bar = selector.select(plan(VisualizationHint.BAR), total);
        assertEquals(VisualizationHint.BAR, bar.getKind());
        assertEquals(1, bar.getSeries().size());
        assertEquals(1110.75, bar.getSeries().get(0).getValue(), 1e-9);
    }

    @Test
    void testUndefinedScalarIsTable() {
        ChartSpec chart = selector.select(plan(VisualizationHint.BAR), ScalarResult.undefined("mean(sales)"));
        assertEquals(VisualizationHint.TABLE, chart.getKind());
        assertNull(chart.getRows().get(0).get("value"));
    }

    @Test
    void testTableResultIsTable() {
        TableResult result = new TableResult(List.of("column", "count"));
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("column", "sales");
        row.put("count", 10);
        result.getRows().add(row);

        ChartSpec chart = selector.select(plan(VisualizationHint.TABLE), result);
        assertEquals(VisualizationHint.TABLE, chart.getKind());
        assertEquals(List.of("column", "count"), chart.getColumns());
        assertEquals(1, chart.getRows().size());
        assertTrue(chart.getSeries().isEmpty());
    }

    private static AnalysisPlan plan(VisualizationHint hint) {
        return AnalysisPlan.builder()
                .operation(Operation.GROUP_BY)
                .visualizationHint(hint)
                .description("test chart")
                .build();
    }

    private static SeriesResult series(int points) {
        SeriesResult result = new SeriesResult("region", "sum(sales)");
        for (int i = 0; i < points; i++) {
            result.add(SeriesPoint.of("r" + i, i + 1));
        }
        return result;
    }
}
