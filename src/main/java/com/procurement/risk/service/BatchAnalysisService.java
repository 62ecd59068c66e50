package com.procurement.risk.service;

import com.procurement.risk.config.MetricsConfig;
import com.procurement.risk.exception.AnalysisTimeoutException;
import com.procurement.risk.exception.CapacityExceededException;
import com.procurement.risk.exception.LanguageSafetyViolationException;
import com.procurement.risk.exception.RiskAnalysisException;
import com.procurement.risk.model.BatchAnalysisResult;
import com.procurement.risk.model.ProcurementRecord;
import com.procurement.risk.model.RecordFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Analyses a batch of records in parallel. Each record is independent: a
 * failure is recorded against that record and never affects its siblings.
 */
@Service
public class BatchAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(BatchAnalysisService.class);

    private final RiskAnalysisPipeline pipeline;
    private final MetricsConfig metricsConfig;
    private final Executor batchExecutor;

    public BatchAnalysisService(RiskAnalysisPipeline pipeline,
                                MetricsConfig metricsConfig,
                                @Qualifier("batchExecutor") Executor batchExecutor) {
        this.pipeline = pipeline;
        this.metricsConfig = metricsConfig;
        this.batchExecutor = batchExecutor;
    }

    public BatchRun submit(List<ProcurementRecord> records) {
        String batchId = UUID.randomUUID().toString();
        AtomicBoolean cancelled = new AtomicBoolean(false);
        List<CompletableFuture<BatchRun.RecordOutcome>> outcomes = new ArrayList<>(records.size());

        log.info("Batch {} submitted with {} records", batchId, records.size());
        for (ProcurementRecord record : records) {
            String tenderId = record != null ? record.getTenderId() : null;
            try {
                outcomes.add(CompletableFuture.supplyAsync(() -> analyzeOne(record, cancelled), batchExecutor));
            } catch (RejectedExecutionException e) {
                log.error("Batch {} could not dispatch tender {}: {}", batchId, tenderId, e.getMessage());
                metricsConfig.recordAnalysisFailure("rejected");
                outcomes.add(CompletableFuture.completedFuture(BatchRun.RecordOutcome.failed(tenderId,
                        RecordFailure.builder()
                                .tenderId(tenderId)
                                .reason("rejected")
                                .message(e.getMessage())
                                .retryable(true)
                                .build())));
            }
        }
        return new BatchRun(batchId, cancelled, outcomes);
    }

    public BatchAnalysisResult analyzeAll(List<ProcurementRecord> records) {
        return submit(records).await();
    }

    private BatchRun.RecordOutcome analyzeOne(ProcurementRecord record, AtomicBoolean cancelled) {
        String tenderId = record != null ? record.getTenderId() : null;
        if (cancelled.get()) {
            log.debug("Skipping tender {}: batch cancelled", tenderId);
            return BatchRun.RecordOutcome.skipped(tenderId);
        }
        try {
            return BatchRun.RecordOutcome.analysed(tenderId, pipeline.analyze(record));
        } catch (RiskAnalysisException e) {
            return BatchRun.RecordOutcome.failed(tenderId, toFailure(tenderId, e));
        } catch (IllegalArgumentException e) {
            metricsConfig.recordAnalysisFailure("invalid_input");
            log.warn("Rejected tender {}: {}", tenderId, e.getMessage());
            return BatchRun.RecordOutcome.failed(tenderId, RecordFailure.builder()
                    .tenderId(tenderId)
                    .reason("invalid_input")
                    .message(e.getMessage())
                    .retryable(false)
                    .build());
        }
    }

    private static RecordFailure toFailure(String tenderId, RiskAnalysisException e) {
        RecordFailure.RecordFailureBuilder failure = RecordFailure.builder()
                .tenderId(tenderId)
                .message(e.getMessage())
                .retryable(e.isRetryable())
                .failedState(e.getFailedState());
        if (e instanceof LanguageSafetyViolationException) {
            failure.reason("language_safety")
                    .templateId(((LanguageSafetyViolationException) e).getTemplateId());
        } else if (e instanceof AnalysisTimeoutException) {
            failure.reason("timeout");
        } else if (e instanceof CapacityExceededException) {
            failure.reason("rejected");
        } else {
            failure.reason("error");
        }
        return failure.build();
    }
}
