package org.endowsim.runtime.api;

import org.endowsim.runtime.model.Proposal;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flat, immutable view of a proposal. {@code stepFunded} and {@code stepResolved} are null until
 * the corresponding transition happened.
 */
public record ProposalRecord(
        int id,
        long fundingTarget,
        double creditsReceived,
        double fundingProgress,
        String status,
        int backerCount,
        Map<Integer, Double> backers,
        long stepCreated,
        Long stepFunded,
        Long stepResolved
) {

    /**
     * @param proposal the proposal to capture
     * @return the record; funding progress is in percent
     */
    public static ProposalRecord of(Proposal proposal) {
        return new ProposalRecord(
                proposal.getId(),
                proposal.getFundingTarget(),
                proposal.getCreditsReceived(),
                proposal.getFundingFraction() * 100.0,
                proposal.getStatus().id(),
                proposal.getBackers().size(),
                Collections.unmodifiableMap(new TreeMap<>(proposal.getBackers())),
                proposal.getStepCreated(),
                proposal.getStepFunded(),
                proposal.getStepResolved()
        );
    }
}
