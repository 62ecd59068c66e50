package com.procurement.risk.service;

import com.procurement.risk.config.RiskConfig;
import com.procurement.risk.exception.ConfigurationException;
import com.procurement.risk.exception.LanguageSafetyViolationException;
import com.procurement.risk.model.IndicatorType;
import com.procurement.risk.model.PatternContribution;
import com.procurement.risk.model.PatternType;
import com.procurement.risk.model.RiskAnalysis;
import com.procurement.risk.model.RiskLevel;
import com.procurement.risk.model.TailoringMatch;
import com.procurement.risk.report.GeneratedText;
import com.procurement.risk.report.NarrativeTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LanguageSafetyValidatorTest {

    private LanguageSafetyValidator validator;

    @BeforeEach
    void setUp() {
        validator = new LanguageSafetyValidator(new RiskConfig());
    }

    @Test
    void constructor_normalisesDenyList() {
        RiskConfig config = new RiskConfig();
        config.getLanguageSafety().setDenyList(List.of("  Guilty Of "));

        assertThat(new LanguageSafetyValidator(config).getDenyList()).containsExactly("guilty of");
    }

    @Test
    void findViolation_caseInsensitiveSubstring() {
        assertThat(validator.findViolation("The vendor is GUILTY OF nothing.")).contains("guilty of");
        assertThat(validator.findViolation("This looks Fraudulently priced")).contains("fraudulent");
        assertThat(validator.findViolation("Further review is recommended.")).isEmpty();
        assertThat(validator.findViolation(null)).isEmpty();
    }

    @Test
    void validate_violation_reportsTemplateAndPhrase() {
        GeneratedText text = new GeneratedText("summary.test@v1", "This proves corruption in the tender.");

        assertThatThrownBy(() -> validator.validate("TND-1", text))
                .isInstanceOf(LanguageSafetyViolationException.class)
                .satisfies(e -> {
                    LanguageSafetyViolationException violation = (LanguageSafetyViolationException) e;
                    assertThat(violation.getTenderId()).isEqualTo("TND-1");
                    assertThat(violation.getTemplateId()).isEqualTo("summary.test@v1");
                    assertThat(violation.getPhrase()).isEqualTo("proves corruption");
                    assertThat(violation.isRetryable()).isFalse();
                });
    }

    @Test
    void everyBuiltInTemplate_passesDefaultDenyList() {
        for (NarrativeTemplate template : NarrativeTemplate.values()) {
            assertThat(validator.findViolation(template.getFormat()))
                    .as("template %s", template.getId())
                    .isEmpty();
        }
    }

    @Test
    void validateAll_cleanTexts_passes() {
        List<GeneratedText> texts = List.of(
                GeneratedText.of(NarrativeTemplate.DISCLAIMER),
                GeneratedText.of(NarrativeTemplate.INTERACTION_CO_OCCURRENCE, 2));

        assertThatCode(() -> validator.validateAll("TND-1", texts)).doesNotThrowAnyException();
    }

    @Test
    void validateData_denyListedPhraseInNestedEvidence_reportsField() {
        RiskAnalysis analysis = analysisWithEvidence(Map.of("matches", List.of(
                TailoringMatch.builder()
                        .phrase("Fraudulent-proof locks")
                        .start(0)
                        .end(22)
                        .indicatorType(IndicatorType.RESTRICTIVE_LANGUAGE)
                        .build())));

        assertThatThrownBy(() -> validator.validateData(analysis))
                .isInstanceOf(LanguageSafetyViolationException.class)
                .satisfies(e -> {
                    LanguageSafetyViolationException violation = (LanguageSafetyViolationException) e;
                    assertThat(violation.getField()).isEqualTo("risk_patterns.SPEC_TAILORING.evidence.matches[0].phrase");
                    assertThat(violation.getTemplateId()).isNull();
                    assertThat(violation.getPhrase()).isEqualTo("fraudulent");
                });
    }

    @Test
    void validateData_cleanEvidence_passes() {
        RiskAnalysis analysis = analysisWithEvidence(Map.of(
                "brand_reference_count", 2,
                "contracts", List.of(Map.of("tender_id", "TND-2024-001"))));

        assertThatCode(() -> validator.validateData(analysis)).doesNotThrowAnyException();
    }

    private static RiskAnalysis analysisWithEvidence(Map<String, Object> evidence) {
        return RiskAnalysis.builder()
                .procurementId("TND-1")
                .overallRiskScore(80.0)
                .riskLevel(RiskLevel.HIGH)
                .riskPatterns(List.of(PatternContribution.builder()
                        .patternType(PatternType.SPEC_TAILORING)
                        .rawScore(80.0)
                        .weight(1.0)
                        .scoreContribution(80.0)
                        .evidence(evidence)
                        .build()))
                .build();
    }

    @Test
    void constructor_blankPhrase_rejected() {
        RiskConfig config = new RiskConfig();
        config.getLanguageSafety().setDenyList(Arrays.asList("guilty of", " "));

        assertThatThrownBy(() -> new LanguageSafetyValidator(config))
                .isInstanceOf(ConfigurationException.class);
    }
}
