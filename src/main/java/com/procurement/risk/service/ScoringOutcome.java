package com.procurement.risk.service;

import com.procurement.risk.model.InteractionEffect;
import com.procurement.risk.model.PatternContribution;
import com.procurement.risk.model.RiskLevel;
import com.procurement.risk.report.GeneratedText;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ScoringOutcome {

    double weightedSum;

    double overallScore;

    RiskLevel riskLevel;

    // Registration order; contributions sum to overallScore
    List<PatternContribution> contributions;

    InteractionEffect interactionEffect;

    // Null when no interaction applied
    GeneratedText interactionReason;
}
