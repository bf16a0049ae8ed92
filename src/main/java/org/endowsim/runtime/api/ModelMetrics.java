package org.endowsim.runtime.api;

import java.util.Map;

/**
 * Current headline metrics of a run.
 */
public record ModelMetrics(
        long step,
        double year,
        double participationRate,
        double currentApy,
        double totalRscHeld,
        double circulatingSupply,
        double annualEmission,
        double weeklyEmission,
        double totalCredits,
        double totalBurned,
        double totalCreditsGenerated,
        double totalCreditsDeployed,
        double deploymentRate,
        Map<String, TierDistribution> multiplierDistribution,
        int openProposals,
        int fundedProposals,
        int completedProposals,
        int failedProposals,
        double successRateActual,
        int numHolders,
        int activeHolders,
        int exitedHolders,
        int numProposals
) {}
