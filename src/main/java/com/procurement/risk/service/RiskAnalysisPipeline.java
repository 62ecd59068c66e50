package com.procurement.risk.service;

import com.procurement.risk.config.MetricsConfig;
import com.procurement.risk.config.RiskConfig;
import com.procurement.risk.engine.AnalysisRun;
import com.procurement.risk.engine.AnalysisState;
import com.procurement.risk.engine.DetectionContext;
import com.procurement.risk.engine.DetectorEngine;
import com.procurement.risk.engine.detectors.VendorRepetitionDetector;
import com.procurement.risk.exception.AnalysisTimeoutException;
import com.procurement.risk.exception.CapacityExceededException;
import com.procurement.risk.exception.LanguageSafetyViolationException;
import com.procurement.risk.exception.RiskAnalysisException;
import com.procurement.risk.model.AwardedContract;
import com.procurement.risk.model.HistoricalBaseline;
import com.procurement.risk.model.ProcurementRecord;
import com.procurement.risk.model.RiskAnalysis;
import com.procurement.risk.model.RiskLevel;
import com.procurement.risk.model.RiskPattern;
import com.procurement.risk.report.ExplainabilityReport;
import com.procurement.risk.repository.AwardHistoryProvider;
import com.procurement.risk.repository.HistoricalBaselineProvider;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Main orchestrator for the analysis of one procurement record.
 *
 * Flow:
 * 1. Look up the historical baseline (bounded wait; a slow, failed or refused
 *    lookup means the baseline is unavailable) and the vendor's award history.
 *    Lookups run on their own pool and are interrupted when abandoned, so a
 *    hung data source never holds detector threads.
 * 2. DETECTING: run every applicable detector within the record's time budget
 * 3. SCORING: combine the patterns into the overall score
 * 4. EXPLAINING: build the report from fixed templates
 * 5. VALIDATING: reject the whole analysis if any text is deny-listed
 *
 * An analysis is all-or-nothing: either a complete {@link RiskAnalysis} is
 * returned or a {@link RiskAnalysisException} is thrown. No state is kept
 * between invocations.
 */
@Service
public class RiskAnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(RiskAnalysisPipeline.class);

    private final HistoricalBaselineProvider baselineProvider;
    private final AwardHistoryProvider awardHistoryProvider;
    private final DetectorEngine detectorEngine;
    private final RiskScoringService riskScoringService;
    private final ExplainabilityReportBuilder reportBuilder;
    private final LanguageSafetyValidator languageSafetyValidator;
    private final RiskConfig config;
    private final MetricsConfig metricsConfig;
    private final AsyncTaskExecutor lookupExecutor;

    public RiskAnalysisPipeline(HistoricalBaselineProvider baselineProvider,
                                AwardHistoryProvider awardHistoryProvider,
                                DetectorEngine detectorEngine,
                                RiskScoringService riskScoringService,
                                ExplainabilityReportBuilder reportBuilder,
                                LanguageSafetyValidator languageSafetyValidator,
                                RiskConfig config,
                                MetricsConfig metricsConfig,
                                @Qualifier("lookupExecutor") AsyncTaskExecutor lookupExecutor) {
        this.baselineProvider = baselineProvider;
        this.awardHistoryProvider = awardHistoryProvider;
        this.detectorEngine = detectorEngine;
        this.riskScoringService = riskScoringService;
        this.reportBuilder = reportBuilder;
        this.languageSafetyValidator = languageSafetyValidator;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.lookupExecutor = lookupExecutor;
    }

    /**
     * Analyse one procurement record.
     *
     * @throws IllegalArgumentException          if a required field is missing
     * @throws LanguageSafetyViolationException  if generated text is deny-listed
     * @throws AnalysisTimeoutException          if the record exceeds its time budget (retryable)
     * @throws RiskAnalysisException             for any other failure of this record
     */
    @Observed(name = "procurement.analyze", contextualName = "analyze-procurement")
    public RiskAnalysis analyze(ProcurementRecord record) {
        if (record == null || record.getTenderId() == null || record.getDepartmentId() == null) {
            throw new IllegalArgumentException("Procurement record requires tenderId and departmentId");
        }

        AnalysisRun run = new AnalysisRun(record.getTenderId());
        long deadlineNanos = System.nanoTime()
                + TimeUnit.MILLISECONDS.toNanos(config.getPipeline().getRecordTimeoutMs());

        try {
            run.advance(AnalysisState.DETECTING);
            DetectionContext context = buildContext(record, deadlineNanos);
            List<RiskPattern> patterns = detectorEngine.detectAll(record, context, remaining(record, deadlineNanos));

            run.advance(AnalysisState.SCORING);
            ScoringOutcome outcome = riskScoringService.score(patterns);

            run.advance(AnalysisState.EXPLAINING);
            ExplainabilityReport report = reportBuilder.build(record, patterns, outcome);

            run.advance(AnalysisState.VALIDATING);
            languageSafetyValidator.validateAll(record.getTenderId(), report.getGeneratedTexts());
            languageSafetyValidator.validateData(report.getAnalysis());

            run.advance(AnalysisState.DONE);
            RiskAnalysis analysis = report.getAnalysis();

            metricsConfig.recordAnalysis(analysis.getRiskLevel().name(), analysis.getOverallRiskScore());
            if (analysis.getRiskLevel() == RiskLevel.HIGH) {
                log.warn("High risk indicators for tender={}, department={}: score={}, patterns={}",
                        record.getTenderId(), record.getDepartmentId(),
                        analysis.getOverallRiskScore(), patterns.size());
            } else {
                log.debug("Analysed tender={}: score={}, level={}",
                        record.getTenderId(), analysis.getOverallRiskScore(), analysis.getRiskLevel());
            }
            return analysis;
        } catch (RiskAnalysisException e) {
            AnalysisState failedIn = run.fail();
            metricsConfig.recordAnalysisFailure(failureReason(e));
            log.error("Analysis of tender {} failed in state {}: {}", record.getTenderId(), failedIn, e.getMessage());
            throw e.failedIn(failedIn);
        } catch (RuntimeException e) {
            AnalysisState failedIn = run.fail();
            metricsConfig.recordAnalysisFailure("unexpected");
            log.error("Analysis of tender {} failed in state {}: {}", record.getTenderId(), failedIn, e.getMessage(), e);
            throw new RiskAnalysisException(record.getTenderId(),
                    "Analysis of tender " + record.getTenderId() + " failed: " + e.getMessage(), e)
                    .failedIn(failedIn);
        }
    }

    private DetectionContext buildContext(ProcurementRecord record, long deadlineNanos) {
        DetectionContext.DetectionContextBuilder builder = DetectionContext.builder()
                .historicalBaseline(lookupBaseline(record));

        if (record.getAwardedVendorId() != null && record.getAwardDate() != null) {
            LocalDate to = record.getAwardDate();
            LocalDate from = VendorRepetitionDetector.windowStart(to,
                    config.getDetection().getVendorRepetitionWindowDays());
            builder.vendorAwards(lookupAwards(record, from, to, deadlineNanos));
        }
        return builder.build();
    }

    private HistoricalBaseline lookupBaseline(ProcurementRecord record) {
        if (record.getCategory() == null || record.getRegion() == null) {
            metricsConfig.recordBaselineUnavailable("missing_key");
            log.debug("No baseline key for tender {}: category or region missing", record.getTenderId());
            return null;
        }

        int toYear = record.getProcurementYear();
        int fromYear = toYear - config.getDetection().getBaselineYearWindow();
        long timeoutMs = config.getPipeline().getBaselineLookupTimeoutMs();

        Future<HistoricalBaseline> lookup;
        try {
            lookup = lookupExecutor.submit(() -> baselineProvider
                    .findBaseline(record.getCategory(), record.getRegion(), fromYear, toYear)
                    .orElse(null));
        } catch (RejectedExecutionException e) {
            metricsConfig.recordBaselineUnavailable("rejected");
            log.warn("Lookup pool saturated; continuing without baseline for tender {}", record.getTenderId());
            return null;
        }
        try {
            HistoricalBaseline baseline = lookup.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (baseline == null) {
                metricsConfig.recordBaselineUnavailable("not_found");
                log.debug("No baseline for {}/{} {}-{}", record.getCategory(), record.getRegion(), fromYear, toYear);
            }
            return baseline;
        } catch (TimeoutException e) {
            lookup.cancel(true);
            metricsConfig.recordBaselineUnavailable("timeout");
            log.warn("Baseline lookup for tender {} exceeded {} ms; continuing without baseline",
                    record.getTenderId(), timeoutMs);
            return null;
        } catch (ExecutionException e) {
            metricsConfig.recordBaselineUnavailable("error");
            log.warn("Baseline lookup for tender {} failed; continuing without baseline: {}",
                    record.getTenderId(), e.getCause().getMessage());
            return null;
        } catch (InterruptedException e) {
            lookup.cancel(true);
            Thread.currentThread().interrupt();
            throw new RiskAnalysisException(record.getTenderId(), "Interrupted during baseline lookup", e);
        }
    }

    private List<AwardedContract> lookupAwards(ProcurementRecord record, LocalDate from, LocalDate to,
                                               long deadlineNanos) {
        Duration budget = remaining(record, deadlineNanos);
        Future<List<AwardedContract>> lookup;
        try {
            lookup = lookupExecutor.submit(() -> awardHistoryProvider
                    .findAwards(record.getAwardedVendorId(), record.getDepartmentId(), from, to));
        } catch (RejectedExecutionException e) {
            throw new CapacityExceededException(record.getTenderId(), "lookup", e);
        }
        try {
            List<AwardedContract> awards = lookup.get(budget.toNanos(), TimeUnit.NANOSECONDS);
            return awards != null ? awards : Collections.emptyList();
        } catch (TimeoutException e) {
            lookup.cancel(true);
            throw new AnalysisTimeoutException(record.getTenderId(),
                    Duration.ofMillis(config.getPipeline().getRecordTimeoutMs()));
        } catch (ExecutionException e) {
            throw new RiskAnalysisException(record.getTenderId(),
                    "Award history lookup failed for tender " + record.getTenderId(), e.getCause());
        } catch (InterruptedException e) {
            lookup.cancel(true);
            Thread.currentThread().interrupt();
            throw new RiskAnalysisException(record.getTenderId(), "Interrupted during award history lookup", e);
        }
    }

    private Duration remaining(ProcurementRecord record, long deadlineNanos) {
        long remainingNanos = deadlineNanos - System.nanoTime();
        if (remainingNanos <= 0) {
            throw new AnalysisTimeoutException(record.getTenderId(),
                    Duration.ofMillis(config.getPipeline().getRecordTimeoutMs()));
        }
        return Duration.ofNanos(remainingNanos);
    }

    private static String failureReason(RiskAnalysisException e) {
        if (e instanceof LanguageSafetyViolationException) return "language_safety";
        if (e instanceof AnalysisTimeoutException) return "timeout";
        if (e instanceof CapacityExceededException) return "rejected";
        return "error";
    }
}
