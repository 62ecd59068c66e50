package com.procurement.risk.service;

import com.procurement.risk.model.InteractionEffect;
import com.procurement.risk.model.PatternContribution;
import com.procurement.risk.model.PatternType;
import com.procurement.risk.model.RiskLevel;
import com.procurement.risk.model.RiskPattern;
import com.procurement.risk.model.WeightConfig;
import com.procurement.risk.report.GeneratedText;
import com.procurement.risk.report.NarrativeTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Combines detected patterns into one bounded risk score.
 *
 * weightedSum = Σ(score × weight)
 * multiplier  = 1 + 0.05 × (patternCount − 1), × 1.15 when a compressed deadline
 *               and a single bidder co-occur
 * overall     = min(100, weightedSum × multiplier)
 *
 * Each pattern's contribution is its weighted score scaled by overall / weightedSum,
 * so the contributions add up to the overall score.
 */
@Service
public class RiskScoringService {

    static final double PER_PATTERN_INTERACTION = 0.05;
    static final double DEADLINE_SINGLE_BIDDER_INTERACTION = 1.15;

    private final WeightConfig weightConfig;

    public RiskScoringService(WeightConfig weightConfig) {
        this.weightConfig = weightConfig;
    }

    public ScoringOutcome score(List<RiskPattern> detected) {
        if (detected.isEmpty()) {
            return ScoringOutcome.builder()
                    .weightedSum(0.0)
                    .overallScore(0.0)
                    .riskLevel(RiskLevel.LOW)
                    .contributions(Collections.emptyList())
                    .interactionEffect(InteractionEffect.NONE)
                    .build();
        }

        List<RiskPattern> patterns = new ArrayList<>(detected);
        patterns.sort(Comparator.comparing(RiskPattern::getPatternType));

        double weightedSum = 0.0;
        Set<PatternType> types = EnumSet.noneOf(PatternType.class);
        for (RiskPattern pattern : patterns) {
            weightedSum += pattern.getScore() * weightConfig.weightOf(pattern.getPatternType());
            types.add(pattern.getPatternType());
        }

        int patternCount = patterns.size();
        double multiplier = 1.0 + PER_PATTERN_INTERACTION * (patternCount - 1);
        boolean deadlineWithSingleBid = types.contains(PatternType.COMPRESSED_DEADLINE)
                && types.contains(PatternType.SINGLE_BIDDER);
        if (deadlineWithSingleBid) {
            multiplier *= DEADLINE_SINGLE_BIDDER_INTERACTION;
        }

        double overallScore = Math.min(100.0, weightedSum * multiplier);
        double scale = weightedSum > 0 ? overallScore / weightedSum : 0.0;

        List<PatternContribution> contributions = new ArrayList<>();
        for (RiskPattern pattern : patterns) {
            double weight = weightConfig.weightOf(pattern.getPatternType());
            contributions.add(PatternContribution.builder()
                    .patternType(pattern.getPatternType())
                    .subType(pattern.getSubType())
                    .rawScore(pattern.getScore())
                    .weight(weight)
                    .scoreContribution(pattern.getScore() * weight * scale)
                    .evidence(pattern.getEvidence())
                    .explanation(pattern.getExplanation())
                    .build());
        }

        GeneratedText reason = null;
        if (deadlineWithSingleBid) {
            reason = GeneratedText.of(NarrativeTemplate.INTERACTION_DEADLINE_SINGLE_BIDDER, patternCount);
        } else if (patternCount > 1) {
            reason = GeneratedText.of(NarrativeTemplate.INTERACTION_CO_OCCURRENCE, patternCount);
        }

        return ScoringOutcome.builder()
                .weightedSum(weightedSum)
                .overallScore(overallScore)
                .riskLevel(RiskLevel.fromScore(overallScore))
                .contributions(Collections.unmodifiableList(contributions))
                .interactionEffect(new InteractionEffect(multiplier, reason != null ? reason.getText() : null))
                .interactionReason(reason)
                .build();
    }

    public WeightConfig getWeightConfig() {
        return weightConfig;
    }
}
