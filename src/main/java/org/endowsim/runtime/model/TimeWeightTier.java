package org.endowsim.runtime.model;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Time-weight multiplier tiers. Holding longer without interruption scales a holder's yield share;
 * there are no lockups, duration alone moves a holder up.
 */
public enum TimeWeightTier {

    NEW("New", 4, 1.00, "Holding < 4 weeks. Base yield share."),
    HOLDER("Holder", 52, 1.15, "Holding 4 weeks to 1 year. 15% boost."),
    LONG_TERM("LongTerm", null, 1.20, "Holding > 1 year. 20% boost.");

    private final String label;
    private final Integer maxWeeks;
    private final double multiplier;
    private final String description;

    TimeWeightTier(String label, Integer maxWeeks, double multiplier, String description) {
        this.label = label;
        this.maxWeeks = maxWeeks;
        this.multiplier = multiplier;
        this.description = description;
    }

    /**
     * Finds the tier for a continuous holding duration. A tier covers durations strictly below its
     * {@code maxWeeks}; the last tier is unbounded.
     *
     * @param weeksHeld continuous weeks held
     * @return the tier applying to that duration
     */
    public static TimeWeightTier forWeeks(int weeksHeld) {
        for (TimeWeightTier tier : values()) {
            if (tier.maxWeeks == null || weeksHeld < tier.maxWeeks) {
                return tier;
            }
        }
        return LONG_TERM;
    }

    /**
     * @param weeksHeld continuous weeks held
     * @return the yield-share multiplier for that duration
     */
    public static double multiplierFor(int weeksHeld) {
        return forWeeks(weeksHeld).multiplier;
    }

    /**
     * Resolves a tier by its label (e.g. {@code "LongTerm"}).
     *
     * @param label the tier label
     * @return the matching tier
     * @throws IllegalArgumentException if the label is unknown, naming the valid labels
     */
    public static TimeWeightTier fromLabel(String label) {
        for (TimeWeightTier tier : values()) {
            if (tier.label.equals(label)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown time-weight tier: " + label + ". Available: " + labels());
    }

    /**
     * @return all tier labels in ascending duration order
     */
    public static List<String> labels() {
        return Arrays.stream(values()).map(TimeWeightTier::label).collect(Collectors.toList());
    }

    public String label() { return label; }

    /**
     * @return exclusive upper bound in weeks, or null for the unbounded last tier
     */
    public Integer maxWeeks() { return maxWeeks; }
    public double multiplier() { return multiplier; }
    public String description() { return description; }
}
