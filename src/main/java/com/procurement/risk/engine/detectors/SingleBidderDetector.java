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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flags tenders that attracted exactly one bid.
 *
 * Score = 60 + min(20, valueLakhs / lakhsPerPoint), plus 15 when the tender value
 * exceeds the high-value threshold (1,000,000 by default).
 *
 * Example: a 2,000,000 tender (20 lakhs) with one bid scores 60 + 20 + 15 = 95.
 */
@Component
public class SingleBidderDetector implements PatternDetector {

    private static final double BASE_SCORE = 60.0;
    private static final double MAX_VALUE_COMPONENT = 20.0;
    private static final double HIGH_VALUE_BONUS = 15.0;

    private final RiskConfig config;

    public SingleBidderDetector(RiskConfig config) {
        this.config = config;
    }

    @Override
    public PatternType getPatternType() {
        return PatternType.SINGLE_BIDDER;
    }

    @Override
    public boolean isApplicable(ProcurementRecord record) {
        return record.getBidderCount() != null;
    }

    @Override
    public Optional<RiskPattern> detect(ProcurementRecord record, DetectionContext context) {
        if (record.getBidderCount() != 1) {
            return Optional.empty();
        }

        RiskConfig.Detection defaults = config.getDetection();
        double valueLakhs = record.getEstimatedBudgetLakhs();
        double valueComponent = Math.min(MAX_VALUE_COMPONENT,
                Math.max(0.0, valueLakhs / defaults.getSingleBidderLakhsPerPoint()));
        boolean highValue = record.getEstimatedBudget() > defaults.getSingleBidderHighValueThreshold();
        double score = PatternDetector.clampScore(
                BASE_SCORE + valueComponent + (highValue ? HIGH_VALUE_BONUS : 0.0));

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("bidder_count", record.getBidderCount());
        evidence.put("tender_value", record.getEstimatedBudget());
        evidence.put("tender_value_lakhs", valueLakhs);
        evidence.put("value_component", valueComponent);
        evidence.put("high_value_bonus", highValue ? HIGH_VALUE_BONUS : 0.0);

        Optional<HistoricalBaseline> baseline = context.usableBaseline(defaults.getMinBaselineSampleSize());
        GeneratedText explanation;
        if (baseline.isPresent()) {
            evidence.put("expected_bidder_count", baseline.get().getAverageBidderCount());
            explanation = GeneratedText.of(NarrativeTemplate.SINGLE_BIDDER,
                    valueLakhs, baseline.get().getAverageBidderCount());
        } else {
            evidence.put("baseline_status", "UNAVAILABLE");
            explanation = GeneratedText.of(NarrativeTemplate.SINGLE_BIDDER_NO_BASELINE, valueLakhs);
        }

        return Optional.of(RiskPattern.builder()
                .patternType(PatternType.SINGLE_BIDDER)
                .score(score)
                .evidence(Collections.unmodifiableMap(evidence))
                .explanation(explanation.getText())
                .templateId(explanation.getTemplateId())
                .build());
    }
}
