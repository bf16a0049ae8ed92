package org.endowsim.runtime.api;

import org.endowsim.runtime.model.CreditBatch;
import org.endowsim.runtime.model.Holder;
import org.endowsim.runtime.model.HolderTraits;

import java.util.List;

/**
 * Flat, immutable view of a holder.
 */
public record HolderRecord(
        int id,
        String archetype,
        boolean active,
        double missionAlignment,
        double engagement,
        double priceSensitivity,
        double holdHorizon,
        double rscHeld,
        double initialRsc,
        int weeksHeld,
        String tier,
        double multiplier,
        double effectiveApy,
        double yieldThreshold,
        double credits,
        double weeklyRate,
        double totalYieldEarned,
        double totalDeployed,
        double totalBurned,
        double totalExpired,
        double totalRefunded,
        int deploymentsCount,
        int idleSteps,
        List<CreditBatch> creditBatches
) {

    /**
     * @param holder the holder to capture
     * @param currentApy the simulation's base APY, used for the holder's effective APY
     * @return the record
     */
    public static HolderRecord of(Holder holder, double currentApy) {
        HolderTraits traits = holder.getTraits();
        return new HolderRecord(
                holder.getId(),
                holder.getArchetypeId(),
                holder.isActive(),
                traits.missionAlignment(),
                traits.engagement(),
                traits.priceSensitivity(),
                traits.holdHorizon(),
                holder.getRscHeld(),
                holder.getInitialRsc(),
                holder.getWeeksHeld(),
                holder.getTier().label(),
                holder.getTimeWeightMultiplier(),
                currentApy * holder.getTimeWeightMultiplier(),
                holder.getYieldThreshold(),
                holder.getCredits(),
                holder.getWeeklyRate(),
                holder.getTotalYieldEarned(),
                holder.getTotalDeployed(),
                holder.getTotalBurned(),
                holder.getTotalExpired(),
                holder.getTotalRefunded(),
                holder.getDeploymentsCount(),
                holder.getConsecutiveIdleSteps(),
                holder.getCreditBatches()
        );
    }
}
