package com.procurement.risk.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.procurement.risk.model.KnowledgeBase;
import com.procurement.risk.model.WeightConfig;
import com.procurement.risk.repository.AwardHistoryProvider;
import com.procurement.risk.repository.HistoricalBaselineProvider;
import com.procurement.risk.repository.InMemoryAwardHistoryProvider;
import com.procurement.risk.repository.InMemoryHistoricalBaselineProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Compiles the externally supplied configuration into the immutable values the
 * pipeline runs with. Malformed configuration fails application startup.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public WeightConfig weightConfig(RiskConfig config) {
        WeightConfig weights = WeightConfig.fromNames(config.getWeights());
        log.info("Loaded pattern weights: {}", weights);
        return weights;
    }

    @Bean
    public KnowledgeBase knowledgeBase(RiskConfig config) {
        RiskConfig.KnowledgeBaseProperties props = config.getKnowledgeBase();
        KnowledgeBase knowledgeBase = KnowledgeBase.compile(
                props.getBrandNames(), props.getRestrictivePatterns(), props.getExemptedCategories());
        log.info("Loaded knowledge base: {} brand names, {} restrictive patterns, {} exempted categories",
                knowledgeBase.getBrandNames().size(), knowledgeBase.getRestrictivePatterns().size(),
                props.getExemptedCategories().size());
        return knowledgeBase;
    }

    @Bean
    public HistoricalBaselineProvider historicalBaselineProvider(RiskConfig config, ResourceLoader resourceLoader,
                                                                 ObjectMapper objectMapper) {
        return InMemoryHistoricalBaselineProvider.fromResource(
                resourceLoader.getResource(config.getData().getBaselinesLocation()), objectMapper);
    }

    @Bean
    public AwardHistoryProvider awardHistoryProvider(RiskConfig config, ResourceLoader resourceLoader,
                                                     ObjectMapper objectMapper) {
        return InMemoryAwardHistoryProvider.fromResource(
                resourceLoader.getResource(config.getData().getAwardHistoryLocation()), objectMapper);
    }

    @Bean
    public Clock analysisClock() {
        return Clock.systemUTC();
    }

    @Bean(name = "detectorExecutor")
    public ThreadPoolTaskExecutor detectorExecutor(RiskConfig config) {
        int poolSize = config.getPipeline().getDetectorPoolSize();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize * 2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("detector-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    // No queue: once every lookup thread is busy further lookups are refused at once,
    // so a hung data source cannot delay the records behind it.
    @Bean(name = "lookupExecutor")
    public ThreadPoolTaskExecutor lookupExecutor(RiskConfig config) {
        int poolSize = config.getPipeline().getLookupPoolSize();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize * 2);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("lookup-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    // Separate from the detector pool so record tasks never wait on their own pool.
    @Bean(name = "batchExecutor")
    public ThreadPoolTaskExecutor batchExecutor(RiskConfig config) {
        int poolSize = config.getPipeline().getBatchPoolSize();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
