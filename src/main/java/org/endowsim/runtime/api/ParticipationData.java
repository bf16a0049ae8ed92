package org.endowsim.runtime.api;

import java.util.Map;

/**
 * Participation view with reference APYs at fixed hypothetical participation rates.
 *
 * @param scenarios APY keyed by scenario label ({@code "15pct"}, {@code "30pct"}, {@code "70pct"})
 */
public record ParticipationData(
        double participationRate,
        double currentApy,
        double totalRscHeld,
        double circulatingSupply,
        double annualEmission,
        double year,
        Map<String, Double> scenarios
) {}
