package com.procurement.risk.engine;

import com.procurement.risk.config.MetricsConfig;
import com.procurement.risk.exception.AnalysisTimeoutException;
import com.procurement.risk.exception.CapacityExceededException;
import com.procurement.risk.exception.ConfigurationException;
import com.procurement.risk.exception.RiskAnalysisException;
import com.procurement.risk.model.PatternType;
import com.procurement.risk.model.ProcurementRecord;
import com.procurement.risk.model.RiskPattern;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every applicable detector for one record.
 *
 * Detectors are fanned out on the detector executor and joined under the
 * record's time budget. Detectors still running when the budget runs out are
 * interrupted so they release their pool threads. The collected patterns are returned in registration
 * order ({@link PatternType} declaration order) whatever order the detectors
 * completed in.
 */
@Component
public class DetectorEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectorEngine.class);

    private final Map<PatternType, PatternDetector> detectorMap;
    private final Executor detectorExecutor;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public DetectorEngine(List<PatternDetector> detectors,
                          @Qualifier("detectorExecutor") Executor detectorExecutor,
                          Tracer tracer, MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(PatternType.class);
        this.detectorExecutor = detectorExecutor;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (PatternDetector detector : detectors) {
            PatternDetector previous = detectorMap.put(detector.getPatternType(), detector);
            if (previous != null) {
                throw new ConfigurationException(String.format("Two detectors registered for %s: %s and %s",
                        detector.getPatternType(), previous.getClass().getSimpleName(),
                        detector.getClass().getSimpleName()));
            }
            log.info("Registered pattern detector: {} -> {}",
                    detector.getPatternType(), detector.getClass().getSimpleName());
        }
        for (PatternType type : PatternType.values()) {
            if (!detectorMap.containsKey(type)) {
                log.warn("No detector registered for pattern type {}", type);
            }
        }
    }

    /**
     * Evaluate all applicable detectors against the record.
     *
     * @param record  the record under analysis
     * @param context baseline and award history for the record
     * @param budget  wall-clock budget for all detectors together
     * @return detected patterns in registration order
     * @throws AnalysisTimeoutException if the detectors do not finish within the budget
     */
    public List<RiskPattern> detectAll(ProcurementRecord record, DetectionContext context, Duration budget) {
        List<Future<Optional<RiskPattern>>> futures = new ArrayList<>();
        long deadlineNanos = System.nanoTime() + budget.toNanos();

        try {
            for (PatternDetector detector : detectorMap.values()) {
                if (!detector.isApplicable(record)) {
                    log.debug("Detector {} not applicable to tender {}", detector.getPatternType(), record.getTenderId());
                    continue;
                }
                FutureTask<Optional<RiskPattern>> task = new FutureTask<>(() -> evaluate(detector, record, context));
                detectorExecutor.execute(task);
                futures.add(task);
            }

            List<RiskPattern> patterns = new ArrayList<>();
            for (Future<Optional<RiskPattern>> future : futures) {
                long remainingNanos = deadlineNanos - System.nanoTime();
                future.get(Math.max(0L, remainingNanos), TimeUnit.NANOSECONDS).ifPresent(patterns::add);
            }
            patterns.sort(Comparator.comparing(RiskPattern::getPatternType));
            return Collections.unmodifiableList(patterns);
        } catch (TimeoutException e) {
            cancelAll(futures);
            throw new AnalysisTimeoutException(record.getTenderId(), budget);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new RiskAnalysisException(record.getTenderId(), "Interrupted while detecting patterns", e);
        } catch (RejectedExecutionException e) {
            cancelAll(futures);
            throw new CapacityExceededException(record.getTenderId(), "detector", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            throw new RiskAnalysisException(record.getTenderId(),
                    "Detector failed for tender " + record.getTenderId() + ": " + cause.getMessage(), cause);
        }
    }

    private static void cancelAll(List<Future<Optional<RiskPattern>>> futures) {
        futures.forEach(f -> f.cancel(true));
    }

    public Map<PatternType, PatternDetector> getDetectors() {
        return Collections.unmodifiableMap(detectorMap);
    }

    private Optional<RiskPattern> evaluate(PatternDetector detector, ProcurementRecord record,
                                           DetectionContext context) {
        Span span = tracer.nextSpan()
                .name("detector.evaluate." + detector.getPatternType())
                .tag("tender.id", record.getTenderId())
                .tag("pattern.type", detector.getPatternType().name())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            Optional<RiskPattern> pattern = detector.detect(record, context);
            span.tag("pattern.detected", String.valueOf(pattern.isPresent()));

            pattern.ifPresent(p -> {
                span.tag("pattern.score", String.valueOf(p.getScore()));
                metricsConfig.recordPatternDetected(p.getPatternType().name());
                log.debug("Pattern detected: {} for tender {}, score={}",
                        p.getPatternType(), record.getTenderId(), p.getScore());
            });
            return pattern;
        } catch (RuntimeException e) {
            span.error(e);
            log.error("Error evaluating detector {} for tender {}: {}",
                    detector.getPatternType(), record.getTenderId(), e.getMessage(), e);
            throw e;
        } finally {
            span.end();
        }
    }
}
