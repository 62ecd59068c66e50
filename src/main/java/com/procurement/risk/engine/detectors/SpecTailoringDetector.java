package com.procurement.risk.engine.detectors;

import com.procurement.risk.config.RiskConfig;
import com.procurement.risk.engine.DetectionContext;
import com.procurement.risk.engine.PatternDetector;
import com.procurement.risk.model.IndicatorType;
import com.procurement.risk.model.KnowledgeBase;
import com.procurement.risk.model.PatternType;
import com.procurement.risk.model.ProcurementRecord;
import com.procurement.risk.model.RiskPattern;
import com.procurement.risk.model.TailoringMatch;
import com.procurement.risk.model.TailoringSubType;
import com.procurement.risk.report.GeneratedText;
import com.procurement.risk.report.NarrativeTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans the specification text for brand names and restrictive wording that
 * can narrow the supplier pool.
 *
 * Fires with at least 3 restrictive phrases or at least 2 brand references.
 * Brand references are ignored for exempted categories.
 * Score = 70 + min(30, indicatorCount*5).
 */
@Component
public class SpecTailoringDetector implements PatternDetector {

    private static final Comparator<TailoringMatch> BY_OFFSET =
            Comparator.comparingInt(TailoringMatch::getStart)
                    .thenComparingInt(TailoringMatch::getEnd)
                    .thenComparing(TailoringMatch::getIndicatorType);

    private final RiskConfig config;
    private final KnowledgeBase knowledgeBase;

    public SpecTailoringDetector(RiskConfig config, KnowledgeBase knowledgeBase) {
        this.config = config;
        this.knowledgeBase = knowledgeBase;
    }

    @Override
    public PatternType getPatternType() {
        return PatternType.SPEC_TAILORING;
    }

    @Override
    public boolean isApplicable(ProcurementRecord record) {
        return record.getSpecificationText() != null && !record.getSpecificationText().isBlank();
    }

    @Override
    public Optional<RiskPattern> detect(ProcurementRecord record, DetectionContext context) {
        RiskConfig.Detection defaults = config.getDetection();
        String text = record.getSpecificationText();

        boolean brandExempt = knowledgeBase.isBrandExempt(record.getCategory());
        List<TailoringMatch> brandMatches = brandExempt
                ? Collections.emptyList()
                : scan(text, knowledgeBase.getBrandPatterns(), IndicatorType.BRAND_REFERENCE);
        List<TailoringMatch> restrictiveMatches =
                scan(text, knowledgeBase.getRestrictivePatterns(), IndicatorType.RESTRICTIVE_LANGUAGE);

        boolean brandThresholdMet = brandMatches.size() >= defaults.getTailoringMinBrandReferences();
        boolean restrictiveThresholdMet = restrictiveMatches.size() >= defaults.getTailoringMinRestrictivePhrases();
        if (!brandThresholdMet && !restrictiveThresholdMet) {
            return Optional.empty();
        }

        List<TailoringMatch> matches = new ArrayList<>(brandMatches);
        matches.addAll(restrictiveMatches);
        matches.sort(BY_OFFSET);

        int indicatorCount = matches.size();
        double score = PatternDetector.clampScore(70.0 + Math.min(30.0, indicatorCount * 5.0));

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("brand_reference_count", brandMatches.size());
        evidence.put("restrictive_phrase_count", restrictiveMatches.size());
        evidence.put("indicator_count", indicatorCount);
        evidence.put("brand_exempt_category", brandExempt);
        evidence.put("matches", Collections.unmodifiableList(matches));

        GeneratedText explanation = GeneratedText.of(NarrativeTemplate.SPEC_TAILORING,
                brandMatches.size(), restrictiveMatches.size());

        return Optional.of(RiskPattern.builder()
                .patternType(PatternType.SPEC_TAILORING)
                .subType(TailoringSubType.of(brandThresholdMet, restrictiveThresholdMet))
                .score(score)
                .evidence(Collections.unmodifiableMap(evidence))
                .explanation(explanation.getText())
                .templateId(explanation.getTemplateId())
                .build());
    }

    private List<TailoringMatch> scan(String text, List<Pattern> patterns, IndicatorType type) {
        // Keyed by span so overlapping configured patterns do not double count the same text
        Set<String> seenSpans = new LinkedHashSet<>();
        List<TailoringMatch> matches = new ArrayList<>();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                if (matcher.end() == matcher.start()) {
                    continue;
                }
                if (seenSpans.add(matcher.start() + ":" + matcher.end())) {
                    matches.add(TailoringMatch.builder()
                            .phrase(matcher.group())
                            .start(matcher.start())
                            .end(matcher.end())
                            .indicatorType(type)
                            .build());
                }
            }
        }
        matches.sort(BY_OFFSET);
        return matches;
    }
}
