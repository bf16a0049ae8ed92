package org.endowsim.runtime.model;

import org.endowsim.runtime.spi.IRandomProvider;

/**
 * Behavioural traits of a holder, each in [0, 1] and fixed at creation.
 *
 * @param missionAlignment cares about funded research rather than yield alone
 * @param engagement how actively credits are deployed
 * @param priceSensitivity how strongly exit decisions react to a yield shortfall
 * @param holdHorizon tendency toward long-term holding
 */
public record HolderTraits(double missionAlignment, double engagement, double priceSensitivity, double holdHorizon) {

    public HolderTraits {
        requireUnit("mission_alignment", missionAlignment);
        requireUnit("engagement", engagement);
        requireUnit("price_sensitivity", priceSensitivity);
        requireUnit("hold_horizon", holdHorizon);
    }

    /**
     * Samples each trait uniformly from the archetype's range.
     *
     * @param archetype the preset to sample from
     * @param random the random stream
     * @return sampled traits
     */
    public static HolderTraits sample(Archetype archetype, IRandomProvider random) {
        double mission = archetype.missionAlignment().sample(random);
        double engagement = archetype.engagement().sample(random);
        double price = archetype.priceSensitivity().sample(random);
        double horizon = archetype.holdHorizon().sample(random);
        return new HolderTraits(mission, engagement, price, horizon);
    }

    private static void requireUnit(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got " + value);
        }
    }
}
