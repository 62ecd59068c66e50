package com.procurement.risk.service;

import com.procurement.risk.model.BatchAnalysisResult;
import com.procurement.risk.model.RecordFailure;
import com.procurement.risk.model.RiskAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on a submitted batch.
 *
 * Cancelling stops records that have not started yet; records already being
 * analysed run to completion or failure on their own.
 */
public class BatchRun {

    private static final Logger log = LoggerFactory.getLogger(BatchRun.class);

    private final String batchId;
    private final AtomicBoolean cancelled;
    private final List<CompletableFuture<RecordOutcome>> outcomes;

    BatchRun(String batchId, AtomicBoolean cancelled, List<CompletableFuture<RecordOutcome>> outcomes) {
        this.batchId = batchId;
        this.cancelled = cancelled;
        this.outcomes = outcomes;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Batch {} cancelled; records not yet started will be skipped", batchId);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return outcomes.stream().allMatch(CompletableFuture::isDone);
    }

    public String getBatchId() {
        return batchId;
    }

    /**
     * Blocks until every record has completed, failed or been skipped.
     */
    public BatchAnalysisResult await() {
        CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0])).join();

        List<RiskAnalysis> analyses = new ArrayList<>();
        List<RecordFailure> failures = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (CompletableFuture<RecordOutcome> future : outcomes) {
            RecordOutcome outcome = future.join();
            if (outcome.analysis != null) {
                analyses.add(outcome.analysis);
            } else if (outcome.failure != null) {
                failures.add(outcome.failure);
            } else {
                skipped.add(outcome.tenderId);
            }
        }

        log.info("Batch {} finished: {} analysed, {} failed, {} skipped",
                batchId, analyses.size(), failures.size(), skipped.size());
        return BatchAnalysisResult.builder()
                .analyses(Collections.unmodifiableList(analyses))
                .failures(Collections.unmodifiableList(failures))
                .skippedTenderIds(Collections.unmodifiableList(skipped))
                .build();
    }

    static final class RecordOutcome {
        final String tenderId;
        final RiskAnalysis analysis;
        final RecordFailure failure;

        private RecordOutcome(String tenderId, RiskAnalysis analysis, RecordFailure failure) {
            this.tenderId = tenderId;
            this.analysis = analysis;
            this.failure = failure;
        }

        static RecordOutcome analysed(String tenderId, RiskAnalysis analysis) {
            return new RecordOutcome(tenderId, analysis, null);
        }

        static RecordOutcome failed(String tenderId, RecordFailure failure) {
            return new RecordOutcome(tenderId, null, failure);
        }

        static RecordOutcome skipped(String tenderId) {
            return new RecordOutcome(tenderId, null, null);
        }
    }
}
