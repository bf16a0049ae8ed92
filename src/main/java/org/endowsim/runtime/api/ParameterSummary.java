package org.endowsim.runtime.api;

import org.endowsim.runtime.config.SimulationParameters;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializable view of the run parameters.
 */
public record ParameterSummary(
        int numHolders,
        int numProposals,
        double burnRate,
        double successRate,
        double deployProbability,
        long fundingTargetMin,
        long fundingTargetMax,
        Map<String, Double> archetypeMix,
        double yieldThresholdMean,
        double initialParticipationRate,
        boolean creditExpiryEnabled,
        int creditExpiryWeeks,
        String failureMode,
        double year0Emission,
        double halfLifeYears,
        double year0Circulating,
        double totalSupply
) {

    public static ParameterSummary of(SimulationParameters p) {
        Map<String, Double> mix = new LinkedHashMap<>();
        p.getArchetypeMix().forEach((archetype, fraction) -> mix.put(archetype.id(), fraction));
        return new ParameterSummary(
                p.getNumHolders(),
                p.getNumProposals(),
                p.getBurnRate(),
                p.getSuccessRate(),
                p.getDeployProbability(),
                p.getFundingTargetMin(),
                p.getFundingTargetMax(),
                Collections.unmodifiableMap(mix),
                p.getYieldThresholdMean(),
                p.getInitialParticipationRate(),
                p.isCreditExpiryEnabled(),
                p.getCreditExpiryWeeks(),
                p.getFailureMode().id(),
                p.getEmissionSchedule().getYear0Emission(),
                p.getEmissionSchedule().getHalfLifeYears(),
                p.getEmissionSchedule().getYear0Circulating(),
                p.getEmissionSchedule().getTotalSupply()
        );
    }
}
