package com.procurement.risk.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAnalysis(String riskLevel, double overallScore) {
        Counter.builder("analysis.count")
                .tag("risk_level", riskLevel)
                .register(registry)
                .increment();

        DistributionSummary.builder("analysis.overall_score")
                .tag("risk_level", riskLevel)
                .register(registry)
                .record(overallScore);
    }

    public void recordPatternDetected(String patternType) {
        Counter.builder("pattern.detected.count")
                .tag("pattern_type", patternType)
                .register(registry)
                .increment();
    }

    public void recordAnalysisFailure(String reason) {
        Counter.builder("analysis.failure.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordBaselineUnavailable(String cause) {
        Counter.builder("baseline.unavailable.count")
                .tag("cause", cause)
                .register(registry)
                .increment();
    }
}
