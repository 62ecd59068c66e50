package com.procurement.risk.report;

import com.procurement.risk.model.RiskAnalysis;
import lombok.Value;

import java.util.List;

/**
 * A built analysis awaiting language validation, together with every piece of
 * text it contains and the template each came from.
 */
@Value
public class ExplainabilityReport {
    RiskAnalysis analysis;
    List<GeneratedText> generatedTexts;
}
