package com.procurement.risk.engine.detectors;

import com.procurement.risk.config.RiskConfig;
import com.procurement.risk.engine.DetectionContext;
import com.procurement.risk.model.ProcurementRecord;
import com.procurement.risk.model.RiskPattern;
import com.procurement.risk.report.NarrativeTemplate;
import com.procurement.risk.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BudgetAnomalyDetectorTest {

    private BudgetAnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new BudgetAnomalyDetector(new RiskConfig());
    }

    private static ProcurementRecord awarded(double estimated, double awarded) {
        return TestDataFactory.cleanRecord("TND-1")
                .estimatedBudget(estimated)
                .awardedAmount(awarded)
                .build();
    }

    private static DetectionContext withBaseline(double mean, double stddev, long samples) {
        return DetectionContext.builder()
                .historicalBaseline(TestDataFactory.createBaseline(mean, stddev, samples))
                .build();
    }

    @Test
    void detect_awardWellAboveBaseline_scoresByZ() {
        RiskPattern pattern = detector.detect(awarded(1_000_000, 1_250_000),
                withBaseline(1_000_000, 100_000, 50)).orElseThrow();

        assertThat(pattern.getScore()).isCloseTo(90.0, within(1e-9));
        assertThat((Double) pattern.getEvidence().get("z_score")).isCloseTo(2.5, within(1e-9));
        assertThat(pattern.getEvidence())
                .containsEntry("baseline_status", "AVAILABLE")
                .containsEntry("confidence", "HIGH");
        assertThat(pattern.getTemplateId()).isEqualTo(NarrativeTemplate.BUDGET_ANOMALY_BASELINE.getId());
    }

    @Test
    void detect_overrunWithinTwoSigma_thresholdOnly() {
        RiskPattern pattern = detector.detect(awarded(1_000_000, 1_250_000),
                withBaseline(1_100_000, 100_000, 50)).orElseThrow();

        assertThat(pattern.getScore()).isEqualTo(65.0);
        assertThat(pattern.getEvidence()).containsEntry("confidence", "THRESHOLD_ONLY");
        assertThat(pattern.getTemplateId()).isEqualTo(NarrativeTemplate.BUDGET_ANOMALY_WITHIN_RANGE.getId());
    }

    @Test
    void detect_noBaseline_firesOnOverrunAlone() {
        RiskPattern pattern = detector.detect(awarded(1_000_000, 1_250_000), DetectionContext.EMPTY).orElseThrow();

        assertThat(pattern.getScore()).isEqualTo(65.0);
        assertThat(pattern.getEvidence())
                .containsEntry("baseline_status", "UNAVAILABLE")
                .doesNotContainKey("z_score");
    }

    @Test
    void detect_baselineBelowMinimumSamples_treatedAsUnavailable() {
        RiskPattern pattern = detector.detect(awarded(1_000_000, 1_250_000),
                withBaseline(1_000_000, 100_000, 9)).orElseThrow();

        assertThat(pattern.getEvidence()).containsEntry("baseline_status", "UNAVAILABLE");
    }

    @Test
    void detect_zeroStddev_treatedAsUnavailable() {
        RiskPattern pattern = detector.detect(awarded(1_000_000, 1_250_000),
                withBaseline(1_000_000, 0.0, 50)).orElseThrow();

        assertThat(pattern.getEvidence()).containsEntry("baseline_status", "UNAVAILABLE");
        assertThat(pattern.getScore()).isEqualTo(65.0);
    }

    @Test
    void detect_overrunAtExactlyTwentyPercent_doesNotFire() {
        assertThat(detector.detect(awarded(1_000_000, 1_200_000), DetectionContext.EMPTY)).isEmpty();
    }

    @Test
    void detect_extremeZ_cappedAt100() {
        RiskPattern pattern = detector.detect(awarded(1_000_000, 9_000_000),
                withBaseline(1_000_000, 100_000, 50)).orElseThrow();

        assertThat(pattern.getScore()).isEqualTo(100.0);
    }

    @Test
    void isApplicable_notAwarded_false() {
        ProcurementRecord record = TestDataFactory.cleanRecord("TND-1").awardedAmount(null).build();

        assertThat(detector.isApplicable(record)).isFalse();
    }
}
