package org.endowsim.runtime.api;

/**
 * Behavioural aggregates for one archetype. Averages are over active holders, lifetime totals over
 * all holders of the archetype.
 */
public record ArchetypeMetrics(
        int total,
        int active,
        int exited,
        double avgRsc,
        double avgWeeksHeld,
        double avgMultiplier,
        double avgCredits,
        double totalDeployed,
        double totalBurned
) {}
