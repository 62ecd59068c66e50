package com.procurement.risk.service;

import com.procurement.risk.config.RiskConfig;
import com.procurement.risk.exception.ConfigurationException;
import com.procurement.risk.exception.LanguageSafetyViolationException;
import com.procurement.risk.model.PatternContribution;
import com.procurement.risk.model.RiskAnalysis;
import com.procurement.risk.model.TailoringMatch;
import com.procurement.risk.report.GeneratedText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Rejects output that contains accusatory phrasing, whether rendered from a
 * template or copied from the record into the evidence.
 *
 * Matching is a case-insensitive substring check against the configured
 * deny-list. Offending text is never rewritten: the violation is raised with
 * the template that produced it so the template can be corrected.
 */
@Service
public class LanguageSafetyValidator {

    private static final Logger log = LoggerFactory.getLogger(LanguageSafetyValidator.class);

    private final List<String> denyList;

    public LanguageSafetyValidator(RiskConfig config) {
        List<String> phrases = new ArrayList<>();
        for (String phrase : config.getLanguageSafety().getDenyList()) {
            if (phrase == null || phrase.isBlank()) {
                throw new ConfigurationException("Deny-list phrases must not be blank");
            }
            phrases.add(phrase.trim().toLowerCase(Locale.ROOT));
        }
        this.denyList = Collections.unmodifiableList(phrases);
        log.info("Language safety deny-list loaded with {} phrases", denyList.size());
    }

    /**
     * The first deny-listed phrase contained in the text, if any.
     */
    public Optional<String> findViolation(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        for (String phrase : denyList) {
            if (normalized.contains(phrase)) {
                return Optional.of(phrase);
            }
        }
        return Optional.empty();
    }

    public void validate(String tenderId, GeneratedText text) {
        Optional<String> violation = findViolation(text.getText());
        if (violation.isPresent()) {
            log.error("Language safety violation for tender {}: template {} produced '{}'",
                    tenderId, text.getTemplateId(), violation.get());
            throw new LanguageSafetyViolationException(tenderId, text.getTemplateId(), violation.get());
        }
    }

    public void validateAll(String tenderId, List<GeneratedText> texts) {
        for (GeneratedText text : texts) {
            validate(tenderId, text);
        }
    }

    /**
     * Checks the record data the analysis carries verbatim: the procurement id
     * and every string inside pattern evidence (nested maps, lists and matched
     * phrases included).
     */
    public void validateData(RiskAnalysis analysis) {
        String tenderId = analysis.getProcurementId();
        checkField(tenderId, "procurement_id", tenderId);
        for (PatternContribution pattern : analysis.getRiskPatterns()) {
            if (pattern.getEvidence() != null) {
                checkValue(tenderId, "risk_patterns." + pattern.getPatternType() + ".evidence",
                        pattern.getEvidence());
            }
        }
    }

    private void checkValue(String tenderId, String path, Object value) {
        if (value instanceof String) {
            checkField(tenderId, path, (String) value);
        } else if (value instanceof TailoringMatch) {
            checkField(tenderId, path + ".phrase", ((TailoringMatch) value).getPhrase());
        } else if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                checkValue(tenderId, path + "." + entry.getKey(), entry.getValue());
            }
        } else if (value instanceof Collection) {
            int index = 0;
            for (Object element : (Collection<?>) value) {
                checkValue(tenderId, path + "[" + index++ + "]", element);
            }
        }
    }

    private void checkField(String tenderId, String path, String text) {
        Optional<String> violation = findViolation(text);
        if (violation.isPresent()) {
            log.error("Language safety violation for tender {}: field {} contains '{}'",
                    tenderId, path, violation.get());
            throw LanguageSafetyViolationException.inField(tenderId, path, violation.get());
        }
    }

    public List<String> getDenyList() {
        return denyList;
    }
}
