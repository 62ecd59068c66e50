package com.procurement.risk.exception;

/**
 * Output text contained a deny-listed phrase. When a template produced it the
 * template must be corrected; when it came from record data copied into the
 * evidence, {@link #getField()} names where. The text is never emitted.
 */
public class LanguageSafetyViolationException extends RiskAnalysisException {

    private final String templateId;
    private final String field;
    private final String phrase;

    public LanguageSafetyViolationException(String tenderId, String templateId, String phrase) {
        this(tenderId, templateId, null, phrase, String.format(
                "Template %s produced deny-listed phrase '%s' for tender %s", templateId, phrase, tenderId));
    }

    private LanguageSafetyViolationException(String tenderId, String templateId, String field, String phrase,
                                             String message) {
        super(tenderId, message);
        this.templateId = templateId;
        this.field = field;
        this.phrase = phrase;
    }

    public static LanguageSafetyViolationException inField(String tenderId, String field, String phrase) {
        return new LanguageSafetyViolationException(tenderId, null, field, phrase, String.format(
                "Field %s contains deny-listed phrase '%s' for tender %s", field, phrase, tenderId));
    }

    // Null when the phrase came from record data
    public String getTemplateId() {
        return templateId;
    }

    // Null when the phrase came from a template
    public String getField() {
        return field;
    }

    public String getPhrase() {
        return phrase;
    }
}
