package org.endowsim.runtime.model;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Named behavioural presets for holders.
 * <p>
 * Each archetype carries the sampling ranges for the four behavioural traits, the range of RSC a
 * holder of this kind starts with, and the offset of its personal yield threshold from the
 * configured mean. A holder samples from these once, at creation; afterwards it only reads its
 * own numeric fields.
 * </p>
 */
public enum Archetype {

    BELIEVER("believer", "Believer",
            "Believes in open science. Holds long-term (reaches 1.2x), deploys reliably, low churn.",
            new TraitRange(0.7, 1.0), new TraitRange(0.6, 0.9), new TraitRange(0.0, 0.2), new TraitRange(0.7, 1.0),
            new TraitRange(5_000, 50_000), -0.04),

    YIELD_SEEKER("yield_seeker", "Yield Seeker",
            "Joins when yield > threshold, exits when it falls. Primary self-balancing force.",
            new TraitRange(0.1, 0.4), new TraitRange(0.2, 0.5), new TraitRange(0.7, 1.0), new TraitRange(0.2, 0.5),
            new TraitRange(1_000, 20_000), 0.01),

    INSTITUTION("institution", "Institution",
            "Universities and foundations. Large RSC, very long-term, reaches 1.2x.",
            new TraitRange(0.6, 0.9), new TraitRange(0.4, 0.7), new TraitRange(0.0, 0.15), new TraitRange(0.85, 1.0),
            new TraitRange(100_000, 1_000_000), -0.06),

    SPECULATOR("speculator", "Speculator",
            "Enters on high yield, exits quickly. Amplifies participation rate swings.",
            new TraitRange(0.0, 0.15), new TraitRange(0.05, 0.2), new TraitRange(0.85, 1.0), new TraitRange(0.0, 0.2),
            new TraitRange(500, 15_000), 0.03);

    /**
     * Archetype id reported for holders created with explicit traits.
     */
    public static final String CUSTOM_ID = "custom";

    private final String id;
    private final String displayName;
    private final String description;
    private final TraitRange missionAlignment;
    private final TraitRange engagement;
    private final TraitRange priceSensitivity;
    private final TraitRange holdHorizon;
    private final TraitRange rscRange;
    private final double yieldThresholdOffset;

    Archetype(String id, String displayName, String description,
              TraitRange missionAlignment, TraitRange engagement, TraitRange priceSensitivity, TraitRange holdHorizon,
              TraitRange rscRange, double yieldThresholdOffset) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.missionAlignment = missionAlignment;
        this.engagement = engagement;
        this.priceSensitivity = priceSensitivity;
        this.holdHorizon = holdHorizon;
        this.rscRange = rscRange;
        this.yieldThresholdOffset = yieldThresholdOffset;
    }

    /**
     * Resolves an archetype by its configuration id (e.g. {@code "yield_seeker"}).
     *
     * @param id the archetype id
     * @return the matching archetype
     * @throws IllegalArgumentException if the id is unknown, naming the valid ids
     */
    public static Archetype fromId(String id) {
        for (Archetype archetype : values()) {
            if (archetype.id.equals(id)) {
                return archetype;
            }
        }
        throw new IllegalArgumentException("Unknown archetype: " + id + ". Available: " + ids());
    }

    /**
     * @return all archetype ids in declaration order
     */
    public static List<String> ids() {
        return Arrays.stream(values()).map(Archetype::id).collect(Collectors.toList());
    }

    /**
     * @return true if this archetype starts with a pre-existing holding history
     */
    public boolean hasWarmStart() {
        return this == INSTITUTION;
    }

    public String id() { return id; }
    public String displayName() { return displayName; }
    public String description() { return description; }
    public TraitRange missionAlignment() { return missionAlignment; }
    public TraitRange engagement() { return engagement; }
    public TraitRange priceSensitivity() { return priceSensitivity; }
    public TraitRange holdHorizon() { return holdHorizon; }
    public TraitRange rscRange() { return rscRange; }
    public double yieldThresholdOffset() { return yieldThresholdOffset; }
}
