package com.procurement.risk.service;

import com.procurement.risk.config.MetricsConfig;
import com.procurement.risk.engine.AnalysisState;
import com.procurement.risk.exception.AnalysisTimeoutException;
import com.procurement.risk.exception.CapacityExceededException;
import com.procurement.risk.exception.LanguageSafetyViolationException;
import com.procurement.risk.model.BatchAnalysisResult;
import com.procurement.risk.model.ProcurementRecord;
import com.procurement.risk.model.RecordFailure;
import com.procurement.risk.model.RiskAnalysis;
import com.procurement.risk.model.RiskLevel;
import com.procurement.risk.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchAnalysisServiceTest {

    @Mock private RiskAnalysisPipeline pipeline;

    private ExecutorService executor;
    private BatchAnalysisService batchService;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        batchService = new BatchAnalysisService(pipeline, new MetricsConfig(new SimpleMeterRegistry()), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static RiskAnalysis analysisFor(ProcurementRecord record) {
        return RiskAnalysis.builder()
                .procurementId(record.getTenderId())
                .overallRiskScore(0.0)
                .riskLevel(RiskLevel.LOW)
                .riskPatterns(List.of())
                .build();
    }

    @Test
    void analyzeAll_failuresIsolatedPerRecord() {
        ProcurementRecord ok1 = TestDataFactory.cleanRecord("TND-1").build();
        ProcurementRecord unsafe = TestDataFactory.cleanRecord("TND-2").build();
        ProcurementRecord slow = TestDataFactory.cleanRecord("TND-3").build();
        ProcurementRecord ok2 = TestDataFactory.cleanRecord("TND-4").build();

        when(pipeline.analyze(ok1)).thenReturn(analysisFor(ok1));
        when(pipeline.analyze(unsafe)).thenThrow(
                new LanguageSafetyViolationException("TND-2", "summary.single@v2", "guilty of")
                        .failedIn(AnalysisState.VALIDATING));
        when(pipeline.analyze(slow)).thenThrow(
                new AnalysisTimeoutException("TND-3", Duration.ofSeconds(5)).failedIn(AnalysisState.DETECTING));
        when(pipeline.analyze(ok2)).thenReturn(analysisFor(ok2));

        BatchAnalysisResult result = batchService.analyzeAll(List.of(ok1, unsafe, slow, ok2));

        assertThat(result.getAnalyses()).extracting(RiskAnalysis::getProcurementId).containsExactly("TND-1", "TND-4");
        assertThat(result.getFailures()).extracting(RecordFailure::getTenderId).containsExactly("TND-2", "TND-3");
        assertThat(result.getSkippedTenderIds()).isEmpty();
        assertThat(result.getTotal()).isEqualTo(4);

        RecordFailure safety = result.getFailures().get(0);
        assertThat(safety.getReason()).isEqualTo("language_safety");
        assertThat(safety.getTemplateId()).isEqualTo("summary.single@v2");
        assertThat(safety.getFailedState()).isEqualTo(AnalysisState.VALIDATING);
        assertThat(safety.isRetryable()).isFalse();

        RecordFailure timeout = result.getFailures().get(1);
        assertThat(timeout.getReason()).isEqualTo("timeout");
        assertThat(timeout.isRetryable()).isTrue();
    }

    @Test
    void analyzeAll_invalidRecord_recordedAsFailure() {
        ProcurementRecord invalid = TestDataFactory.cleanRecord("TND-1").departmentId(null).build();
        when(pipeline.analyze(invalid)).thenThrow(new IllegalArgumentException("departmentId required"));

        BatchAnalysisResult result = batchService.analyzeAll(List.of(invalid));

        assertThat(result.getFailures()).singleElement()
                .satisfies(f -> assertThat(f.getReason()).isEqualTo("invalid_input"));
    }

    @Test
    void cancel_skipsRecordsNotYetStarted_inFlightComplete() throws Exception {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            BatchAnalysisService serial = new BatchAnalysisService(
                    pipeline, new MetricsConfig(new SimpleMeterRegistry()), single);
            ProcurementRecord first = TestDataFactory.cleanRecord("TND-1").build();
            ProcurementRecord second = TestDataFactory.cleanRecord("TND-2").build();
            ProcurementRecord third = TestDataFactory.cleanRecord("TND-3").build();

            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(pipeline.analyze(first)).thenAnswer(inv -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return analysisFor(first);
            });

            BatchRun run = serial.submit(List.of(first, second, third));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            run.cancel();
            release.countDown();
            BatchAnalysisResult result = run.await();

            assertThat(run.isCancelled()).isTrue();
            assertThat(run.isDone()).isTrue();
            assertThat(run.getBatchId()).isNotBlank();
            assertThat(result.getAnalyses()).extracting(RiskAnalysis::getProcurementId).containsExactly("TND-1");
            assertThat(result.getSkippedTenderIds()).containsExactly("TND-2", "TND-3");
            assertThat(result.isCancelled()).isTrue();
            verify(pipeline, never()).analyze(second);
            verify(pipeline, never()).analyze(third);
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void submit_executorRejects_recordedAsRetryableFailure() {
        executor.shutdown();
        ProcurementRecord record = TestDataFactory.cleanRecord("TND-1").build();

        BatchAnalysisResult result = batchService.analyzeAll(List.of(record));

        assertThat(result.getFailures()).singleElement().satisfies(f -> {
            assertThat(f.getReason()).isEqualTo("rejected");
            assertThat(f.isRetryable()).isTrue();
        });
        verify(pipeline, never()).analyze(any());
    }

    @Test
    void analyzeAll_saturatedPool_recordedAsRetryableRejection() {
        ProcurementRecord record = TestDataFactory.cleanRecord("TND-1").build();
        when(pipeline.analyze(record)).thenThrow(new CapacityExceededException("TND-1", "lookup",
                new RejectedExecutionException("full")));

        BatchAnalysisResult result = batchService.analyzeAll(List.of(record));

        assertThat(result.getFailures()).singleElement().satisfies(f -> {
            assertThat(f.getReason()).isEqualTo("rejected");
            assertThat(f.isRetryable()).isTrue();
        });
    }

    @Test
    void analyzeAll_emptyBatch_emptyResult() {
        BatchAnalysisResult result = batchService.analyzeAll(List.of());

        assertThat(result.getTotal()).isZero();
        assertThat(result.isCancelled()).isFalse();
    }
}
