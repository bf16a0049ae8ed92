package org.endowsim.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A research funding proposal that collects credits from holders.
 * <p>
 * The status only moves forward. The proposal flips to {@link ProposalStatus#FUNDED} the moment the
 * received credits reach the target; credits may still arrive afterwards. Resolution into
 * {@link ProposalStatus#COMPLETED} or {@link ProposalStatus#FAILED} is decided by the simulation,
 * never in the step the proposal got funded.
 * </p>
 */
public class Proposal {

    private final int id;
    private final long fundingTarget;
    private final long stepCreated;
    private final Map<Integer, Double> backers = new LinkedHashMap<>();
    private double creditsReceived = 0.0;
    private ProposalStatus status = ProposalStatus.OPEN;
    private Long stepFunded = null;
    private Long stepResolved = null;

    /**
     * Creates an open proposal.
     *
     * @param id unique proposal id
     * @param fundingTarget credits required, must be positive
     * @param stepCreated the step of creation
     */
    public Proposal(int id, long fundingTarget, long stepCreated) {
        if (fundingTarget <= 0) {
            throw new IllegalArgumentException("Funding target must be positive, got " + fundingTarget);
        }
        this.id = id;
        this.fundingTarget = fundingTarget;
        this.stepCreated = stepCreated;
    }

    /**
     * Books credits from a backer.
     *
     * @param holderId the contributing holder
     * @param amount credits contributed, must be positive
     * @param step the current step
     * @return true if this contribution moved the proposal from open to funded
     */
    public boolean receiveCredits(int holderId, double amount, long step) {
        if (!(amount > 0)) {
            throw new IllegalArgumentException("Contribution must be positive, got " + amount);
        }
        if (status.isResolved()) {
            throw new IllegalStateException("Proposal P" + id + " is already " + status.id());
        }
        creditsReceived += amount;
        backers.merge(holderId, amount, Double::sum);

        if (status == ProposalStatus.OPEN && isTargetReached()) {
            status = ProposalStatus.FUNDED;
            stepFunded = step;
            return true;
        }
        return false;
    }

    /**
     * @param step the current step
     * @return true if the proposal is funded and was funded in an earlier step
     */
    public boolean isResolvable(long step) {
        return status == ProposalStatus.FUNDED && stepFunded != null && step > stepFunded;
    }

    /**
     * Resolves a funded proposal.
     *
     * @param success whether the funded work completed
     * @param step the current step
     */
    public void resolve(boolean success, long step) {
        if (status != ProposalStatus.FUNDED) {
            throw new IllegalStateException("Only funded proposals can be resolved, P" + id + " is " + status.id());
        }
        if (step <= stepFunded) {
            throw new IllegalStateException("P" + id + " was funded in step " + stepFunded + " and cannot resolve in step " + step);
        }
        status = success ? ProposalStatus.COMPLETED : ProposalStatus.FAILED;
        stepResolved = step;
    }

    public boolean isTargetReached() {
        return creditsReceived >= fundingTarget;
    }

    /**
     * @return received credits as a fraction of the target (may exceed 1 once funded)
     */
    public double getFundingFraction() {
        return creditsReceived / fundingTarget;
    }

    public int getId() { return id; }
    public long getFundingTarget() { return fundingTarget; }
    public long getStepCreated() { return stepCreated; }
    public double getCreditsReceived() { return creditsReceived; }
    public ProposalStatus getStatus() { return status; }
    public Long getStepFunded() { return stepFunded; }
    public Long getStepResolved() { return stepResolved; }

    /**
     * @return cumulative credits per backer id
     */
    public Map<Integer, Double> getBackers() {
        return Collections.unmodifiableMap(backers);
    }
}
