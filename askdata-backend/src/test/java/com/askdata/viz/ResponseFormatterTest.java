package com.askdata.viz;

import com.askdata.model.AnalysisPlan;
import com.askdata.model.AnalysisResponse;
import com.askdata.model.Operation;
import com.askdata.model.ScalarResult;
import com.askdata.model.SeriesPoint;
import com.askdata.model.SeriesResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResponseFormatterTest {

    private final ResponseFormatter formatter = new ResponseFormatter();

    @Test
    void testScalarSummary() {
        AnalysisPlan plan = AnalysisPlan.builder().operation(Operation.SUM).description("Sum of sales").build();
        AnalysisResponse response = formatter.format("total sales", plan, ScalarResult.of("sum(sales)", 1110.75));

        assertEquals("Sum of sales: 1110.75", response.getSummary());
        assertEquals("sum(sales) = 1110.75", response.getDetail());
    }

    @Test
    void testSeriesSummaryNamesHighestEntry() {
        AnalysisPlan plan = AnalysisPlan.builder().operation(Operation.GROUP_BY).description("Mean of sales by region").build();
        SeriesResult result = new SeriesResult("region", "mean(sales)");
        result.add(SeriesPoint.of("east", 105.125));
        result.add(SeriesPoint.of("south", 120));
        result.add(SeriesPoint.undefined("west"));

        AnalysisResponse response = formatter.format("average sales by region", plan, result);
        assertEquals("Mean of sales by region: 3 entries, highest south (120)", response.getSummary());
        assertEquals("east: 105.125\nsouth: 120\nwest: undefined", response.getDetail());
    }

    @Test
    void testLowConfidenceAndNotes() {
        AnalysisPlan plan = AnalysisPlan.builder()
                .operation(Operation.SUM)
                .description("Sum of region")
                .lowConfidence(true)
                .build();
        ScalarResult result = ScalarResult.of("sum(region)", 0.0);
        result.addNote("Column 'region' is not numeric");

        AnalysisResponse response = formatter.format("sum of region", plan, result);
        assertTrue(response.getSummary().contains("low confidence"));
        assertTrue(response.getDetail().endsWith("Note: Column 'region' is not numeric"));
    }

    @Test
    void testUndefinedScalar() {
        AnalysisPlan plan = AnalysisPlan.builder().operation(Operation.MEAN).description("Average of sales").build();
        AnalysisResponse response = formatter.format("average sales", plan, ScalarResult.undefined("mean(sales)"));
        assertEquals("Average of sales: undefined (no values)", response.getSummary());
    }
}
