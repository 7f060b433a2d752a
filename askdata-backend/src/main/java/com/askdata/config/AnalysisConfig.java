package com.askdata.config;

import com.askdata.executor.PlanExecutor;
import com.askdata.ingest.CatalogBuilder;
import com.askdata.ingest.CsvDatasetLoader;
import com.askdata.ingest.DatasetLoader;
import com.askdata.job.JobPipeline;
import com.askdata.planner.PlanCompiler;
import com.askdata.resolver.ColumnResolver;
import com.askdata.viz.ResponseFormatter;
import com.askdata.viz.VisualizationSelector;
import com.askdata.vocabulary.VocabularyRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisConfig {

    @Bean
    public ColumnResolver columnResolver(
            VocabularyRegistry vocabularyRegistry,
            @Value("${askdata.resolver.min-score:0.3}") double minScore
    ) {
        return new ColumnResolver(vocabularyRegistry.getVocabulary(), minScore);
    }

    @Bean
    public PlanCompiler planCompiler(VocabularyRegistry vocabularyRegistry, ColumnResolver columnResolver) {
        return new PlanCompiler(vocabularyRegistry.getVocabulary(), columnResolver);
    }

    @Bean
    public PlanExecutor planExecutor() {
        return new PlanExecutor();
    }

    @Bean
    public VisualizationSelector visualizationSelector() {
        return new VisualizationSelector();
    }

    @Bean
    public ResponseFormatter responseFormatter() {
        return new ResponseFormatter();
    }

    @Bean
    public JobPipeline jobPipeline(
            PlanCompiler planCompiler,
            PlanExecutor planExecutor,
            VisualizationSelector visualizationSelector,
            ResponseFormatter responseFormatter
    ) {
        return new JobPipeline(planCompiler, planExecutor, visualizationSelector, responseFormatter);
    }

    @Bean
    public CatalogBuilder catalogBuilder() {
        return new CatalogBuilder();
    }

    @Bean
    public DatasetLoader datasetLoader(
            CatalogBuilder catalogBuilder,
            @Value("${askdata.ingest.max-rows:1000000}") int maxRows
    ) {
        return new CsvDatasetLoader(catalogBuilder, maxRows);
    }
}
