package org.endowsim.runtime.api;

import java.util.Map;

/**
 * One row of the per-step time series. {@code creditsGeneratedStep} is the yield holders earned
 * during the step, which equals the weekly emission whenever anyone holds RSC.
 */
public record MetricsRow(
        long step,
        double year,
        double participationRate,
        double currentApy,
        double totalRscHeld,
        double effectiveRsc,
        double circulatingSupply,
        double weeklyEmission,
        double totalBurned,
        double cumulativeEmissions,
        int activeHolders,
        int exitedHolders,
        int openProposals,
        int fundedProposals,
        int completedProposals,
        int failedProposals,
        Map<String, Double> rscByArchetype,
        Map<String, Integer> holdersByTier,
        int exitsStep,
        int entriesStep,
        double creditsGeneratedStep,
        double creditsDeployedStep
) {}
