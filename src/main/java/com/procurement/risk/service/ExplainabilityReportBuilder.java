package com.procurement.risk.service;

import com.procurement.risk.model.PatternContribution;
import com.procurement.risk.model.ProcurementRecord;
import com.procurement.risk.model.RiskAnalysis;
import com.procurement.risk.model.RiskLevel;
import com.procurement.risk.model.RiskPattern;
import com.procurement.risk.report.ExplainabilityReport;
import com.procurement.risk.report.GeneratedText;
import com.procurement.risk.report.NarrativeTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Assembles the final report from the scoring outcome. Every summary sentence
 * is rendered from {@link NarrativeTemplate}; pattern explanations are taken
 * from the detectors unchanged. Apart from the generation timestamp the output
 * is a pure function of its inputs.
 */
@Service
public class ExplainabilityReportBuilder {

    public static final String DISCLAIMER = NarrativeTemplate.DISCLAIMER.render();

    private final Clock clock;

    public ExplainabilityReportBuilder(Clock clock) {
        this.clock = clock;
    }

    public ExplainabilityReport build(ProcurementRecord record, List<RiskPattern> patterns, ScoringOutcome outcome) {
        List<GeneratedText> texts = new ArrayList<>();
        for (RiskPattern pattern : patterns) {
            texts.add(new GeneratedText(pattern.getTemplateId(), pattern.getExplanation()));
        }
        if (outcome.getInteractionReason() != null) {
            texts.add(outcome.getInteractionReason());
        }

        List<GeneratedText> summary = summarize(record, outcome);
        texts.addAll(summary);

        GeneratedText disclaimer = GeneratedText.of(NarrativeTemplate.DISCLAIMER);
        texts.add(disclaimer);

        RiskAnalysis analysis = RiskAnalysis.builder()
                .procurementId(record.getTenderId())
                .overallRiskScore(outcome.getOverallScore())
                .riskLevel(outcome.getRiskLevel())
                .riskPatterns(outcome.getContributions())
                .interactionEffects(outcome.getInteractionEffect())
                .summaryText(summary.stream().map(GeneratedText::getText).collect(Collectors.joining(" ")))
                .disclaimer(disclaimer.getText())
                .generatedAt(Instant.now(clock))
                .build();

        return new ExplainabilityReport(analysis, Collections.unmodifiableList(texts));
    }

    private List<GeneratedText> summarize(ProcurementRecord record, ScoringOutcome outcome) {
        List<PatternContribution> contributions = outcome.getContributions();
        String tenderId = record.getTenderId();
        String level = outcome.getRiskLevel().name();
        String score = displayScore(outcome.getOverallScore());

        List<GeneratedText> sentences = new ArrayList<>();
        if (contributions.isEmpty()) {
            sentences.add(GeneratedText.of(NarrativeTemplate.SUMMARY_NONE, tenderId, level, score));
        } else if (contributions.size() == 1) {
            sentences.add(GeneratedText.of(NarrativeTemplate.SUMMARY_SINGLE,
                    tenderId, displayNames(contributions), level, score));
        } else {
            sentences.add(GeneratedText.of(NarrativeTemplate.SUMMARY_MULTIPLE,
                    contributions.size(), tenderId, displayNames(contributions), level, score));
            double multiplier = outcome.getInteractionEffect().getMultiplier();
            if (outcome.getOverallScore() < outcome.getWeightedSum() * multiplier) {
                sentences.add(GeneratedText.of(NarrativeTemplate.SUMMARY_INTERACTION_CAPPED,
                        multiplier, displayScore(outcome.getWeightedSum())));
            } else {
                sentences.add(GeneratedText.of(NarrativeTemplate.SUMMARY_INTERACTION, multiplier));
            }
        }
        sentences.add(GeneratedText.of(guidanceFor(outcome.getRiskLevel())));
        return sentences;
    }

    /**
     * Two decimals, or more when two would round the score across a risk level
     * boundary (39.995 must not read as 40.00 next to LOW).
     */
    static String displayScore(double score) {
        RiskLevel level = RiskLevel.fromScore(score);
        for (int decimals = 2; decimals <= 6; decimals++) {
            String text = String.format(Locale.ROOT, "%." + decimals + "f", score);
            if (RiskLevel.fromScore(Double.parseDouble(text)) == level) {
                return text;
            }
        }
        return BigDecimal.valueOf(score).toPlainString();
    }

    private static String displayNames(List<PatternContribution> contributions) {
        return contributions.stream()
                .map(c -> c.getPatternType().getDisplayName().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
    }

    private static NarrativeTemplate guidanceFor(RiskLevel level) {
        switch (level) {
            case HIGH:
                return NarrativeTemplate.SUMMARY_GUIDANCE_HIGH;
            case MEDIUM:
                return NarrativeTemplate.SUMMARY_GUIDANCE_MEDIUM;
            default:
                return NarrativeTemplate.SUMMARY_GUIDANCE_LOW;
        }
    }
}
