package org.endowsim.runtime.model;

/**
 * Aggregate economic state frozen once per step, before any holder acts. Every holder in the
 * step reads the same values, so yield shares and exit pressure do not depend on visiting order.
 *
 * @param step the step being executed
 * @param annualEmission annualized emission rate at this step
 * @param weeklyEmission emission paid out this step
 * @param totalRscHeld RSC held by active holders
 * @param totalEffectiveRsc time-weighted RSC of the holders about to act, each at the multiplier
 *        it earns with this step
 * @param currentApy base (1.0x) annual yield, 0 when nothing is held
 */
public record MarketSnapshot(
        long step,
        double annualEmission,
        double weeklyEmission,
        double totalRscHeld,
        double totalEffectiveRsc,
        double currentApy
) {

    /**
     * @param effectiveRsc a holder's time-weighted RSC
     * @return that holder's share of this step's emission, 0 when nothing is held
     */
    public double yieldShare(double effectiveRsc) {
        if (totalEffectiveRsc <= 0) {
            return 0.0;
        }
        return effectiveRsc / totalEffectiveRsc;
    }
}
