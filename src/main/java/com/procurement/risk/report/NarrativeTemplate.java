package com.procurement.risk.report;

import java.util.Locale;

/**
 * The closed, versioned set of sentences the pipeline may emit. Every generated
 * text is rendered from exactly one entry, so reports can be audited by template
 * id. Bump the version when a sentence changes.
 */
public enum NarrativeTemplate {

    // Per-pattern explanations
    SINGLE_BIDDER("pattern.single-bidder", 1,
            "This tender received a single bid against an estimated value of %.2f lakhs. "
                    + "Comparable tenders in this category and region averaged %.1f bidders."),
    SINGLE_BIDDER_NO_BASELINE("pattern.single-bidder.no-baseline", 1,
            "This tender received a single bid against an estimated value of %.2f lakhs. "
                    + "No historical bidder baseline is available for comparison."),
    VENDOR_REPETITION("pattern.vendor-repetition", 1,
            "Vendor %s received %d contracts from department %s within %d days, totalling %.2f crores. "
                    + "Repeated awards to one vendor can indicate reduced competition."),
    COMPRESSED_DEADLINE("pattern.compressed-deadline", 1,
            "The bidding window was %d days against an expected %.1f days (%.1f%% shorter). "
                    + "Short windows can limit the number of suppliers able to respond."),
    BUDGET_ANOMALY_BASELINE("pattern.budget-anomaly.baseline", 1,
            "The awarded amount of %.2f exceeds the estimated budget of %.2f by %.1f%% "
                    + "and lies %.2f standard deviations above the historical mean for this category and region."),
    BUDGET_ANOMALY_WITHIN_RANGE("pattern.budget-anomaly.within-range", 1,
            "The awarded amount of %.2f exceeds the estimated budget of %.2f by %.1f%%. "
                    + "It remains within two standard deviations of the historical mean for this category and region."),
    BUDGET_ANOMALY_NO_BASELINE("pattern.budget-anomaly.no-baseline", 1,
            "The awarded amount of %.2f exceeds the estimated budget of %.2f by %.1f%%. "
                    + "No sufficient historical baseline is available for comparison."),
    SPEC_TAILORING("pattern.spec-tailoring", 1,
            "The specification contains %d brand reference(s) and %d restrictive phrase(s). "
                    + "Such wording can narrow the set of eligible suppliers."),

    // Interaction effects
    INTERACTION_CO_OCCURRENCE("interaction.co-occurrence", 1,
            "%d patterns co-occur"),
    INTERACTION_DEADLINE_SINGLE_BIDDER("interaction.deadline-single-bidder", 1,
            "%d patterns co-occur, including a compressed bidding window together with a single bid"),

    // Summary sentences
    SUMMARY_NONE("summary.none", 2,
            "No risk indicators were detected for tender %s. Overall risk level: %s (score %s of 100)."),
    SUMMARY_SINGLE("summary.single", 2,
            "One risk indicator was detected for tender %s: %s. Overall risk level: %s (score %s of 100)."),
    SUMMARY_MULTIPLE("summary.multiple", 2,
            "%d risk indicators were detected for tender %s: %s. Overall risk level: %s (score %s of 100)."),
    SUMMARY_INTERACTION("summary.interaction", 1,
            "Their co-occurrence raised the combined score by a factor of %.4f."),
    SUMMARY_INTERACTION_CAPPED("summary.interaction.capped", 1,
            "Their co-occurrence applies a factor of %.4f to the weighted sum of %s, "
                    + "which exceeds the maximum, so the score is capped at 100."),
    SUMMARY_GUIDANCE_LOW("summary.guidance.low", 1,
            "No further review is suggested on the basis of these indicators alone."),
    SUMMARY_GUIDANCE_MEDIUM("summary.guidance.medium", 1,
            "A routine review of the highlighted aspects may be useful."),
    SUMMARY_GUIDANCE_HIGH("summary.guidance.high", 1,
            "A detailed review of the highlighted aspects is recommended."),

    DISCLAIMER("disclaimer", 1,
            "Risk scores are analytical indicators, not evidence of wrongdoing. "
                    + "Further investigation is required before drawing conclusions.");

    private final String key;
    private final int version;
    private final String format;

    NarrativeTemplate(String key, int version, String format) {
        this.key = key;
        this.version = version;
        this.format = format;
    }

    public String getId() {
        return key + "@v" + version;
    }

    public String getFormat() {
        return format;
    }

    public String render(Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}
