package com.procurement.risk.model;

import com.procurement.risk.exception.ConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-pattern weight multipliers. Types without an explicit weight use 1.0.
 * Built once when the pipeline is constructed.
 */
public final class WeightConfig {

    public static final double DEFAULT_WEIGHT = 1.0;

    private final Map<PatternType, Double> weights;

    private WeightConfig(Map<PatternType, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    public static WeightConfig defaults() {
        return new WeightConfig(new EnumMap<>(PatternType.class));
    }

    public static WeightConfig of(Map<PatternType, Double> weights) {
        EnumMap<PatternType, Double> copy = new EnumMap<>(PatternType.class);
        weights.forEach((type, weight) -> copy.put(type, validate(type.name(), weight)));
        return new WeightConfig(copy);
    }

    /**
     * Builds a configuration from externally supplied pattern type names,
     * e.g. the {@code risk.weights} property map.
     */
    public static WeightConfig fromNames(Map<String, Double> weightsByName) {
        EnumMap<PatternType, Double> copy = new EnumMap<>(PatternType.class);
        weightsByName.forEach((name, weight) -> {
            PatternType type;
            try {
                type = PatternType.valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown pattern type in weight configuration: " + name, e);
            }
            copy.put(type, validate(name, weight));
        });
        return new WeightConfig(copy);
    }

    public double weightOf(PatternType type) {
        return weights.getOrDefault(type, DEFAULT_WEIGHT);
    }

    public Map<PatternType, Double> asMap() {
        return weights;
    }

    private static double validate(String name, Double weight) {
        if (weight == null || weight.isNaN() || weight.isInfinite() || weight <= 0) {
            throw new ConfigurationException("Weight for " + name + " must be a positive number, got " + weight);
        }
        return weight;
    }

    @Override
    public String toString() {
        return "WeightConfig" + weights;
    }
}
