package com.procurement.risk.engine.detectors;

import com.procurement.risk.config.RiskConfig;
import com.procurement.risk.engine.DetectionContext;
import com.procurement.risk.model.HistoricalBaseline;
import com.procurement.risk.model.ProcurementRecord;
import com.procurement.risk.model.RiskPattern;
import com.procurement.risk.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.procurement.risk.testutil.TestDataFactory.PUBLISHED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CompressedDeadlineDetectorTest {

    private CompressedDeadlineDetector detector;

    @BeforeEach
    void setUp() {
        detector = new CompressedDeadlineDetector(new RiskConfig());
    }

    private static ProcurementRecord withWindow(double value, int days) {
        return TestDataFactory.cleanRecord("TND-1")
                .estimatedBudget(value)
                .publicationDate(PUBLISHED)
                .submissionDeadline(PUBLISHED.plusDays(days))
                .build();
    }

    @Test
    void detect_smallTenderUnderSevenDays_usesDefaultExpectation() {
        RiskPattern pattern = detector.detect(withWindow(2_000_000, 3), DetectionContext.EMPTY).orElseThrow();

        // 50 + (21 - 3) / 21 * 50
        assertThat(pattern.getScore()).isCloseTo(92.857, within(0.001));
        assertThat(pattern.getEvidence())
                .containsEntry("window_days", 3L)
                .containsEntry("minimum_days", 7)
                .containsEntry("expected_days_source", "CONFIGURED_DEFAULT");
    }

    @Test
    void detect_smallTenderAtSevenDays_doesNotFire() {
        assertThat(detector.detect(withWindow(2_000_000, 7), DetectionContext.EMPTY)).isEmpty();
    }

    @Test
    void detect_largeTenderUnderFourteenDays_fires() {
        RiskPattern pattern = detector.detect(withWindow(5_000_000, 10), DetectionContext.EMPTY).orElseThrow();

        assertThat(pattern.getEvidence()).containsEntry("minimum_days", 14);
    }

    @Test
    void detect_largeTenderAtFourteenDays_doesNotFire() {
        assertThat(detector.detect(withWindow(8_000_000, 14), DetectionContext.EMPTY)).isEmpty();
    }

    @Test
    void detect_usableBaseline_usesMedianWindow() {
        HistoricalBaseline baseline = TestDataFactory.createBaseline(1_000_000, 100_000, 40).toBuilder()
                .medianBiddingWindowDays(30.0)
                .build();
        DetectionContext context = DetectionContext.builder().historicalBaseline(baseline).build();

        RiskPattern pattern = detector.detect(withWindow(2_000_000, 6), context).orElseThrow();

        // 50 + (30 - 6) / 30 * 50
        assertThat(pattern.getScore()).isCloseTo(90.0, within(1e-9));
        assertThat(pattern.getEvidence()).containsEntry("expected_days_source", "BASELINE_MEDIAN");
    }

    @Test
    void detect_sparseBaseline_fallsBackToDefault() {
        HistoricalBaseline sparse = TestDataFactory.createBaseline(1_000_000, 100_000, 3);
        DetectionContext context = DetectionContext.builder().historicalBaseline(sparse).build();

        RiskPattern pattern = detector.detect(withWindow(2_000_000, 3), context).orElseThrow();

        assertThat(pattern.getEvidence()).containsEntry("expected_days", 21.0);
    }

    @Test
    void detect_windowLongerThanExpected_scoreNeverBelowZero() {
        HistoricalBaseline baseline = TestDataFactory.createBaseline(1_000_000, 100_000, 40).toBuilder()
                .medianBiddingWindowDays(2.0)
                .build();
        DetectionContext context = DetectionContext.builder().historicalBaseline(baseline).build();

        RiskPattern pattern = detector.detect(withWindow(2_000_000, 6), context).orElseThrow();

        assertThat(pattern.getScore()).isBetween(0.0, 100.0);
    }

    @Test
    void isApplicable_missingDeadline_false() {
        ProcurementRecord record = TestDataFactory.cleanRecord("TND-1").submissionDeadline(null).build();

        assertThat(detector.isApplicable(record)).isFalse();
    }
}
