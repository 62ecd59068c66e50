package com.procurement.risk.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.procurement.risk.exception.ConfigurationException;
import com.procurement.risk.model.HistoricalBaseline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Baselines held in memory, one entry per category/region/year. A lookup over
 * several years pools the matching entries: sample-weighted mean, pooled
 * variance, and sample-weighted bidder count and median window.
 */
public class InMemoryHistoricalBaselineProvider implements HistoricalBaselineProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryHistoricalBaselineProvider.class);

    private final Map<String, List<HistoricalBaseline>> entriesByKey;

    public InMemoryHistoricalBaselineProvider(List<HistoricalBaseline> entries) {
        Map<String, List<HistoricalBaseline>> byKey = new HashMap<>();
        for (HistoricalBaseline entry : entries) {
            validate(entry);
            byKey.computeIfAbsent(key(entry.getCategory(), entry.getRegion()), k -> new ArrayList<>()).add(entry);
        }
        byKey.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.entriesByKey = Collections.unmodifiableMap(byKey);
    }

    public static InMemoryHistoricalBaselineProvider fromResource(Resource resource, ObjectMapper objectMapper) {
        if (!resource.exists()) {
            log.warn("Baseline resource {} not found; all baselines will be unavailable", resource);
            return new InMemoryHistoricalBaselineProvider(Collections.emptyList());
        }
        try (InputStream in = resource.getInputStream()) {
            List<HistoricalBaseline> entries = objectMapper.readValue(in, new TypeReference<List<HistoricalBaseline>>() {});
            log.info("Loaded {} historical baseline entries from {}", entries.size(), resource);
            return new InMemoryHistoricalBaselineProvider(entries);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read baselines from " + resource, e);
        }
    }

    @Override
    public Optional<HistoricalBaseline> findBaseline(String category, String region, int fromYear, int toYear) {
        if (category == null || region == null) {
            return Optional.empty();
        }
        List<HistoricalBaseline> matching = entriesByKey.getOrDefault(key(category, region), Collections.emptyList())
                .stream()
                .filter(b -> b.getFromYear() >= fromYear && b.getToYear() <= toYear)
                .toList();
        if (matching.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(pool(category, region, fromYear, toYear, matching));
    }

    private HistoricalBaseline pool(String category, String region, int fromYear, int toYear,
                                    List<HistoricalBaseline> entries) {
        long totalSamples = entries.stream().mapToLong(HistoricalBaseline::getSampleSize).sum();
        HistoricalBaseline.HistoricalBaselineBuilder builder = HistoricalBaseline.builder()
                .category(category)
                .region(region)
                .fromYear(fromYear)
                .toYear(toYear)
                .sampleSize(totalSamples);
        if (totalSamples == 0) {
            return builder.build();
        }

        double mean = 0.0;
        double bidders = 0.0;
        double windowDays = 0.0;
        for (HistoricalBaseline b : entries) {
            double w = (double) b.getSampleSize() / totalSamples;
            mean += w * b.getMeanAmount();
            bidders += w * b.getAverageBidderCount();
            windowDays += w * b.getMedianBiddingWindowDays();
        }

        double variance = 0.0;
        for (HistoricalBaseline b : entries) {
            double w = (double) b.getSampleSize() / totalSamples;
            double meanGap = b.getMeanAmount() - mean;
            variance += w * (b.getStddevAmount() * b.getStddevAmount() + meanGap * meanGap);
        }

        return builder
                .meanAmount(mean)
                .stddevAmount(Math.sqrt(variance))
                .averageBidderCount(bidders)
                .medianBiddingWindowDays(windowDays)
                .build();
    }

    private static void validate(HistoricalBaseline entry) {
        if (entry.getCategory() == null || entry.getRegion() == null) {
            throw new ConfigurationException("Baseline entry without category or region: " + entry);
        }
        if (entry.getSampleSize() < 0 || entry.getStddevAmount() < 0) {
            throw new ConfigurationException("Baseline entry with negative sample size or stddev: " + entry);
        }
        if (entry.getFromYear() > entry.getToYear()) {
            throw new ConfigurationException("Baseline entry with inverted year range: " + entry);
        }
    }

    private static String key(String category, String region) {
        return category.trim().toUpperCase(Locale.ROOT) + "|" + region.trim().toUpperCase(Locale.ROOT);
    }
}
