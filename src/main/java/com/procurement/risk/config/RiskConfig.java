package com.procurement.risk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "risk")
public class RiskConfig {

    // Pattern type name -> weight multiplier. Missing types weigh 1.0.
    private Map<String, Double> weights = new LinkedHashMap<>();

    private Detection detection = new Detection();

    private KnowledgeBaseProperties knowledgeBase = new KnowledgeBaseProperties();

    private LanguageSafety languageSafety = new LanguageSafety();

    private Pipeline pipeline = new Pipeline();

    private DataSources data = new DataSources();

    @Data
    public static class Detection {
        // Single bidder: tender value lakhs per score point (capped at 20 points)
        private double singleBidderLakhsPerPoint = 1.0;
        private double singleBidderHighValueThreshold = 1_000_000.0;

        // Vendor repetition
        private int vendorRepetitionWindowDays = 365;
        private int vendorRepetitionMinContracts = 4;
        private int vendorRepetitionValueWindowDays = 180;
        private double vendorRepetitionValueFloorThreshold = 10_000_000.0;

        // Compressed deadline
        private double compressedDeadlineValueThreshold = 5_000_000.0;
        private int compressedDeadlineMinDaysSmall = 7;
        private int compressedDeadlineMinDaysLarge = 14;
        private double defaultExpectedWindowDays = 21.0;

        // Budget anomaly
        private double budgetOverrunRatio = 1.20;
        private long minBaselineSampleSize = 10;
        private int baselineYearWindow = 2;

        // Restrictive specification
        private int tailoringMinRestrictivePhrases = 3;
        private int tailoringMinBrandReferences = 2;
    }

    @Data
    public static class KnowledgeBaseProperties {
        private List<String> brandNames = new ArrayList<>();
        private List<String> restrictivePatterns = new ArrayList<>(List.of(
                "\\bonly\\b", "\\bmust be\\b", "\\bexclusively\\b", "\\bproprietary\\b"));
        private List<String> exemptedCategories = new ArrayList<>();
    }

    @Data
    public static class LanguageSafety {
        private List<String> denyList = new ArrayList<>(List.of(
                "proves corruption", "guilty of", "fraudulent", "criminal activity", "definitely corrupt"));
    }

    @Data
    public static class Pipeline {
        // Wall-clock budget for all detectors of one record
        private long recordTimeoutMs = 5000;
        // Baseline lookups slower than this are treated as unavailable
        private long baselineLookupTimeoutMs = 500;
        private int detectorPoolSize = 5;
        // Baseline and award-history lookups; saturated lookups are refused, never queued
        private int lookupPoolSize = 8;
        private int batchPoolSize = 4;
    }

    @Data
    public static class DataSources {
        private String baselinesLocation = "classpath:data/baselines.json";
        private String awardHistoryLocation = "classpath:data/award-history.json";
    }
}
