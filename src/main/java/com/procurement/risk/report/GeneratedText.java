package com.procurement.risk.report;

import lombok.Value;

/**
 * A piece of emitted text together with the template it was rendered from.
 */
@Value
public class GeneratedText {
    String templateId;
    String text;

    public static GeneratedText of(NarrativeTemplate template, Object... args) {
        return new GeneratedText(template.getId(), template.render(args));
    }
}
