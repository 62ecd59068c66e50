package com.procurement.risk.engine.detectors;

import com.procurement.risk.config.RiskConfig;
import com.procurement.risk.engine.DetectionContext;
import com.procurement.risk.engine.PatternDetector;
import com.procurement.risk.model.HistoricalBaseline;
import com.procurement.risk.model.PatternType;
import com.procurement.risk.model.ProcurementRecord;
import com.procurement.risk.model.RiskPattern;
import com.procurement.risk.report.GeneratedText;
import com.procurement.risk.report.NarrativeTemplate;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Detects bidding windows too short for the tender's size: under 7 days below
 * 5,000,000 in value, under 14 days at or above it.
 *
 * Score = 50 + ((expectedDays - windowDays) / expectedDays) * 50, where the
 * expected window is the category median from the baseline, or the configured
 * default when no usable baseline exists.
 */
@Component
public class CompressedDeadlineDetector implements PatternDetector {

    private final RiskConfig config;

    public CompressedDeadlineDetector(RiskConfig config) {
        this.config = config;
    }

    @Override
    public PatternType getPatternType() {
        return PatternType.COMPRESSED_DEADLINE;
    }

    @Override
    public boolean isApplicable(ProcurementRecord record) {
        return record.getPublicationDate() != null && record.getSubmissionDeadline() != null;
    }

    @Override
    public Optional<RiskPattern> detect(ProcurementRecord record, DetectionContext context) {
        RiskConfig.Detection defaults = config.getDetection();
        long windowDays = ChronoUnit.DAYS.between(record.getPublicationDate(), record.getSubmissionDeadline());

        boolean largeTender = record.getEstimatedBudget() >= defaults.getCompressedDeadlineValueThreshold();
        int minimumDays = largeTender
                ? defaults.getCompressedDeadlineMinDaysLarge()
                : defaults.getCompressedDeadlineMinDaysSmall();
        if (windowDays >= minimumDays) {
            return Optional.empty();
        }

        Optional<HistoricalBaseline> baseline = context.usableBaseline(defaults.getMinBaselineSampleSize())
                .filter(b -> b.getMedianBiddingWindowDays() > 0);
        double expectedDays = baseline
                .map(HistoricalBaseline::getMedianBiddingWindowDays)
                .orElse(defaults.getDefaultExpectedWindowDays());

        double deviationPct = ((expectedDays - windowDays) / expectedDays) * 100.0;
        double score = PatternDetector.clampScore(50.0 + ((expectedDays - windowDays) / expectedDays) * 50.0);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("window_days", windowDays);
        evidence.put("minimum_days", minimumDays);
        evidence.put("expected_days", expectedDays);
        evidence.put("expected_days_source", baseline.isPresent() ? "BASELINE_MEDIAN" : "CONFIGURED_DEFAULT");
        evidence.put("deviation_pct", deviationPct);
        evidence.put("tender_value", record.getEstimatedBudget());

        GeneratedText explanation = GeneratedText.of(NarrativeTemplate.COMPRESSED_DEADLINE,
                windowDays, expectedDays, deviationPct);

        return Optional.of(RiskPattern.builder()
                .patternType(PatternType.COMPRESSED_DEADLINE)
                .score(score)
                .evidence(Collections.unmodifiableMap(evidence))
                .explanation(explanation.getText())
                .templateId(explanation.getTemplateId())
                .build());
    }
}
