package org.endowsim.runtime.api;

import java.util.List;
import java.util.Map;

/**
 * Full state of a run at the current step.
 */
public record SimulationSnapshot(
        ModelMetrics metrics,
        List<HolderRecord> holders,
        List<ProposalRecord> proposals,
        Map<String, Integer> archetypeDistribution,
        Map<String, ArchetypeMetrics> archetypeMetrics,
        ParticipationData participation,
        List<DeploymentRecord> stepDeployments,
        double creditsGeneratedStep,
        double creditsDeployedStep,
        int exitsStep,
        int entriesStep,
        long seed,
        ParameterSummary parameters
) {}
