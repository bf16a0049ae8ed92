package org.endowsim.runtime.api;

/**
 * Active holders and their RSC within one time-weight tier.
 */
public record TierDistribution(int count, double rsc, double multiplier) {}
