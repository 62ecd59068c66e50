package com.procurement.risk.model;

import com.procurement.risk.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled brand names, restrictive-language patterns and category exemptions
 * used by specification scanning. Immutable once compiled.
 */
public final class KnowledgeBase {

    private final List<String> brandNames;
    private final List<Pattern> brandPatterns;
    private final List<Pattern> restrictivePatterns;
    private final Set<String> exemptedCategories;

    private KnowledgeBase(List<String> brandNames, List<Pattern> brandPatterns,
                          List<Pattern> restrictivePatterns, Set<String> exemptedCategories) {
        this.brandNames = brandNames;
        this.brandPatterns = brandPatterns;
        this.restrictivePatterns = restrictivePatterns;
        this.exemptedCategories = exemptedCategories;
    }

    public static KnowledgeBase compile(Collection<String> brandNames,
                                        Collection<String> restrictivePatterns,
                                        Collection<String> exemptedCategories) {
        List<String> brands = new ArrayList<>();
        List<Pattern> brandPatterns = new ArrayList<>();
        for (String brand : brandNames) {
            if (brand == null || brand.isBlank()) {
                throw new ConfigurationException("Brand names must not be blank");
            }
            brands.add(brand.trim());
            brandPatterns.add(Pattern.compile("\\b" + Pattern.quote(brand.trim()) + "\\b",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }

        List<Pattern> restrictive = new ArrayList<>();
        for (String regex : restrictivePatterns) {
            if (regex == null || regex.isBlank()) {
                throw new ConfigurationException("Restrictive patterns must not be blank");
            }
            try {
                restrictive.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("Invalid restrictive pattern: " + regex, e);
            }
        }

        Set<String> exempted = new LinkedHashSet<>();
        for (String category : exemptedCategories) {
            if (category != null && !category.isBlank()) {
                exempted.add(normalizeCategory(category));
            }
        }

        return new KnowledgeBase(
                Collections.unmodifiableList(brands),
                Collections.unmodifiableList(brandPatterns),
                Collections.unmodifiableList(restrictive),
                Collections.unmodifiableSet(exempted));
    }

    public List<String> getBrandNames() {
        return brandNames;
    }

    public List<Pattern> getBrandPatterns() {
        return brandPatterns;
    }

    public List<Pattern> getRestrictivePatterns() {
        return restrictivePatterns;
    }

    /**
     * Brand references are legitimate for exempted categories (e.g. spares for
     * installed equipment) and are not counted there.
     */
    public boolean isBrandExempt(String category) {
        return category != null && exemptedCategories.contains(normalizeCategory(category));
    }

    private static String normalizeCategory(String category) {
        return category.trim().toUpperCase(Locale.ROOT);
    }
}
