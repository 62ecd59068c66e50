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
 * Detects awards that overrun the estimated budget by more than 20%.
 *
 * With a usable baseline and an award above mean + 2*stddev, the score scales
 * with the z-score: 65 + min(35, z*10). Otherwise the overrun alone fires the
 * pattern at the base score of 65, and the evidence records why the historical
 * comparison was not used.
 *
 * Example: mean=1,000,000, stddev=100,000, award=1,250,000 gives z=2.5 and score 90.
 */
@Component
public class BudgetAnomalyDetector implements PatternDetector {

    private static final double BASE_SCORE = 65.0;
    private static final double MAX_Z_COMPONENT = 35.0;
    private static final double HIGH_CONFIDENCE_Z = 2.0;

    private final RiskConfig config;

    public BudgetAnomalyDetector(RiskConfig config) {
        this.config = config;
    }

    @Override
    public PatternType getPatternType() {
        return PatternType.BUDGET_ANOMALY;
    }

    @Override
    public boolean isApplicable(ProcurementRecord record) {
        return record.getAwardedAmount() != null;
    }

    @Override
    public Optional<RiskPattern> detect(ProcurementRecord record, DetectionContext context) {
        RiskConfig.Detection defaults = config.getDetection();
        double awarded = record.getAwardedAmount();
        double estimated = record.getEstimatedBudget();
        double overrunThreshold = estimated * defaults.getBudgetOverrunRatio();

        if (awarded <= overrunThreshold) {
            return Optional.empty();
        }

        double overrunPct = estimated > 0 ? ((awarded - estimated) / estimated) * 100.0 : 100.0;

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("awarded_amount", awarded);
        evidence.put("estimated_budget", estimated);
        evidence.put("overrun_threshold", overrunThreshold);
        evidence.put("overrun_pct", overrunPct);

        Optional<HistoricalBaseline> baseline = context.usableBaseline(defaults.getMinBaselineSampleSize())
                .filter(b -> b.getStddevAmount() > 0);

        double score = BASE_SCORE;
        GeneratedText explanation;
        if (baseline.isPresent()) {
            HistoricalBaseline b = baseline.get();
            double z = (awarded - b.getMeanAmount()) / b.getStddevAmount();
            boolean highConfidence = awarded > b.getMeanAmount() + HIGH_CONFIDENCE_Z * b.getStddevAmount();

            evidence.put("baseline_status", "AVAILABLE");
            evidence.put("baseline_mean", b.getMeanAmount());
            evidence.put("baseline_stddev", b.getStddevAmount());
            evidence.put("baseline_sample_size", b.getSampleSize());
            evidence.put("baseline_years", b.getFromYear() + "-" + b.getToYear());
            evidence.put("z_score", z);

            if (highConfidence) {
                score = BASE_SCORE + Math.min(MAX_Z_COMPONENT, z * 10.0);
                evidence.put("confidence", "HIGH");
                explanation = GeneratedText.of(NarrativeTemplate.BUDGET_ANOMALY_BASELINE,
                        awarded, estimated, overrunPct, z);
            } else {
                evidence.put("confidence", "THRESHOLD_ONLY");
                explanation = GeneratedText.of(NarrativeTemplate.BUDGET_ANOMALY_WITHIN_RANGE,
                        awarded, estimated, overrunPct);
            }
        } else {
            evidence.put("baseline_status", "UNAVAILABLE");
            evidence.put("confidence", "THRESHOLD_ONLY");
            explanation = GeneratedText.of(NarrativeTemplate.BUDGET_ANOMALY_NO_BASELINE,
                    awarded, estimated, overrunPct);
        }

        return Optional.of(RiskPattern.builder()
                .patternType(PatternType.BUDGET_ANOMALY)
                .score(PatternDetector.clampScore(score))
                .evidence(Collections.unmodifiableMap(evidence))
                .explanation(explanation.getText())
                .templateId(explanation.getTemplateId())
                .build());
    }
}
