package org.endowsim.runtime.api;

/**
 * A single credit deployment made during the current step.
 */
public record DeploymentRecord(
        long step,
        int holderId,
        String archetype,
        int proposalId,
        double credits,
        double burned
) {}
