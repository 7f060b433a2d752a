package com.askdata.planner;

import com.askdata.TestDatasets;
import com.askdata.model.AggregationMethod;
import com.askdata.model.AnalysisPlan;
import com.askdata.model.ColumnCatalog;
import com.askdata.model.FilterOperator;
import com.askdata.model.Operation;
import com.askdata.model.PlanFilter;
import com.askdata.model.VisualizationHint;
import com.askdata.resolver.ColumnResolver;
import com.askdata.vocabulary.QueryVocabulary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanCompilerTest {

    private PlanCompiler compiler;
    private ColumnCatalog catalog;

    @BeforeEach
    void setUp() {
        QueryVocabulary.Compiled vocabulary = QueryVocabulary.loadDefault();
        compiler = new PlanCompiler(vocabulary, new ColumnResolver(vocabulary));
        catalog = TestDatasets.sales().catalog();
    }

    @Test
    void testTotalSales() {
        AnalysisPlan plan = compiler.compile("total sales", catalog);

        assertEquals(Operation.SUM, plan.getOperation());
        assertEquals("sales", plan.getTargetColumn());
        assertNull(plan.getGroupColumn());
        assertEquals(1.0, plan.getResolutionConfidence(), 1e-9);
        assertFalse(plan.isLowConfidence());
        assertEquals("Sum of sales", plan.getDescription());
        assertEquals(VisualizationHint.TABLE, plan.getVisualizationHint());
        assertEquals(catalog.getDatasetVersion(), plan.getDatasetVersion());
    }

    @Test
    void testAverageSalesByRegion() {
        AnalysisPlan plan = compiler.compile("average sales by region", catalog);

        assertEquals(Operation.GROUP_BY, plan.getOperation());
        assertEquals("region", plan.getGroupColumn());
        assertEquals("sales", plan.getTargetColumn());
        assertEquals(AggregationMethod.MEAN, plan.getAggregationMethod());
        assertEquals(VisualizationHint.BAR, plan.getVisualizationHint());
        assertEquals("Mean of sales by region", plan.getDescription());
        assertFalse(plan.isLowConfidence());
    }

    @Test
    void testGroupWithoutTargetUsesCount() {
        AnalysisPlan plan = compiler.compile("how many per region", catalog);

        assertEquals(Operation.GROUP_BY, plan.getOperation());
        assertEquals("region", plan.getGroupColumn());
        assertEquals(AggregationMethod.COUNT, plan.getAggregationMethod());
        assertNull(plan.getTargetColumn());
    }

    @Test
    void testUnrecognizedQueryFallsBackToDescribe() {
        AnalysisPlan plan = compiler.compile("asdkjasd nonsense", catalog);

        assertEquals(Operation.DESCRIBE, plan.getOperation());
        assertNull(plan.getTargetColumn());
        assertEquals(0.0, plan.getResolutionConfidence(), 1e-9);
        assertTrue(plan.isLowConfidence());
        assertTrue(plan.getDescription().startsWith("Query not understood"));
    }

    @Test
    void testCompileIsTotal() {
        List<String> queries = Arrays.asList(null, "", "   ", "?!?", "by", "where", "where sales >",
                "sum by", "sales by by by", "'''", "average of where by per", "12345",
                "éèê", "x".repeat(5000));
        for (String query : queries) {
            AnalysisPlan plan = compiler.compile(query, catalog);
            assertNotNull(plan, "plan for " + query);
            assertNotNull(plan.getOperation(), "operation for " + query);
            assertNotNull(plan.getDescription(), "description for " + query);
            assertColumnsExist(plan);
        }
    }

    @Test
    void testCompileWithoutCatalogFallsBack() {
        AnalysisPlan plan = compiler.compile("total sales", null);
        assertEquals(Operation.DESCRIBE, plan.getOperation());
        assertTrue(plan.isLowConfidence());
    }

    @Test
    void testCompileIsDeterministic() {
        AnalysisPlan first = compiler.compile("maximum quantity by product where region is north", catalog);
        AnalysisPlan second = compiler.compile("maximum quantity by product where region is north", catalog);
        assertEquals(first, second);
    }

    @Test
    void testEqualityFilter() {
        AnalysisPlan plan = compiler.compile("total sales where region is north", catalog);

        assertEquals(Operation.SUM, plan.getOperation());
        assertEquals("sales", plan.getTargetColumn());
        assertEquals(1, plan.getFilters().size());
        PlanFilter filter = plan.getFilters().get(0);
        assertEquals("region", filter.getColumn());
        assertEquals(FilterOperator.EQ, filter.getOperator());
        assertEquals("north", filter.getValue());
        assertEquals("Sum of sales where region = north", plan.getDescription());
    }

    @Test
    void testNumericFilterAndChainedClauses() {
        AnalysisPlan plan = compiler.compile("average sales where quantity > 2 and region is not east", catalog);

        assertEquals(Operation.MEAN, plan.getOperation());
        assertEquals("sales", plan.getTargetColumn());
        assertEquals(2, plan.getFilters().size());
        assertEquals("quantity", plan.getFilters().get(0).getColumn());
        assertEquals(FilterOperator.GT, plan.getFilters().get(0).getOperator());
        assertEquals("2", plan.getFilters().get(0).getValue());
        assertEquals("region", plan.getFilters().get(1).getColumn());
        assertEquals(FilterOperator.NE, plan.getFilters().get(1).getOperator());
        assertEquals("east", plan.getFilters().get(1).getValue());
    }

    @Test
    void testWordComparison() {
        AnalysisPlan plan = compiler.compile("count where quantity at least 4", catalog);

        assertEquals(Operation.COUNT, plan.getOperation());
        assertEquals(1, plan.getFilters().size());
        assertEquals(FilterOperator.GTE, plan.getFilters().get(0).getOperator());
        assertEquals("4", plan.getFilters().get(0).getValue());
    }

    @Test
    void testNoKeywordNumericTargetIsDistribution() {
        AnalysisPlan plan = compiler.compile("sales", catalog);
        assertEquals(Operation.DISTRIBUTION, plan.getOperation());
        assertEquals(VisualizationHint.HISTOGRAM, plan.getVisualizationHint());
    }

    @Test
    void testNoKeywordCategoricalTargetIsValueCounts() {
        AnalysisPlan plan = compiler.compile("product", catalog);
        assertEquals(Operation.VALUE_COUNTS, plan.getOperation());
        assertEquals("product", plan.getTargetColumn());
        assertEquals(VisualizationHint.PIE, plan.getVisualizationHint());
    }

    @Test
    void testSynonymLowersConfidence() {
        AnalysisPlan plan = compiler.compile("total revenue", catalog);
        assertEquals("sales", plan.getTargetColumn());
        assertEquals(ColumnResolver.SYNONYM_PENALTY, plan.getResolutionConfidence(), 1e-9);
        assertFalse(plan.isLowConfidence());
    }

    @Test
    void testDefaultColumnZeroesConfidence() {
        AnalysisPlan plan = compiler.compile("what is the maximum", catalog);

        assertEquals(Operation.MAX, plan.getOperation());
        assertEquals("sales", plan.getTargetColumn());
        assertEquals(0.0, plan.getResolutionConfidence(), 1e-9);
        assertTrue(plan.isLowConfidence());
    }

    @Test
    void testGenericGroupKeywordUsesFirstCategorical() {
        AnalysisPlan plan = compiler.compile("breakdown of sales", catalog);

        assertEquals(Operation.GROUP_BY, plan.getOperation());
        assertEquals("region", plan.getGroupColumn());
        assertEquals("sales", plan.getTargetColumn());
        assertTrue(plan.isLowConfidence());
    }

    @Test
    void testChartKeywordOverridesHint() {
        AnalysisPlan plan = compiler.compile("sum of sales by region as a line", catalog);
        assertEquals(Operation.GROUP_BY, plan.getOperation());
        assertEquals(AggregationMethod.SUM, plan.getAggregationMethod());
        assertEquals(VisualizationHint.LINE, plan.getVisualizationHint());
    }

    @Test
    void testCountOfRowsNeedsNoColumn() {
        AnalysisPlan plan = compiler.compile("how many rows", catalog);

        assertEquals(Operation.COUNT, plan.getOperation());
        assertNull(plan.getTargetColumn());
        assertEquals(1.0, plan.getResolutionConfidence(), 1e-9);
        assertEquals("Count of rows", plan.getDescription());
    }

    private void assertColumnsExist(AnalysisPlan plan) {
        if (plan.getTargetColumn() != null) {
            assertTrue(catalog.contains(plan.getTargetColumn()), plan.getTargetColumn());
        }
        if (plan.getGroupColumn() != null) {
            assertTrue(catalog.contains(plan.getGroupColumn()), plan.getGroupColumn());
        }
        for (PlanFilter f : plan.getFilters()) {
            assertTrue(catalog.contains(f.getColumn()), f.getColumn());
        }
    }
}
