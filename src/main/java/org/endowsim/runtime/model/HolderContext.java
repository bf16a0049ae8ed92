package org.endowsim.runtime.model;

import org.endowsim.runtime.config.SimulationParameters;
import org.endowsim.runtime.spi.IRandomProvider;

import java.util.List;

/**
 * The narrow view a {@link Holder} gets of the simulation during its step.
 * <p>
 * Holders read aggregates only through the frozen {@link #snapshot()} and never touch shared
 * collections directly: crediting a proposal and logging are handed back to the orchestrator,
 * which owns proposals, the event log and the per-step counters.
 * </p>
 */
public interface HolderContext {

    /**
     * @return aggregates computed before the holder pass of the current step
     */
    MarketSnapshot snapshot();

    /**
     * @return parameters of the run
     */
    SimulationParameters parameters();

    /**
     * @return the run's shared random stream
     */
    IRandomProvider random();

    /**
     * @return proposals open at the moment of the call, in creation order
     */
    List<Proposal> openProposals();

    /**
     * Books a deployment the holder has already debited from its own balance.
     *
     * @param holder the deploying holder
     * @param proposal the chosen proposal
     * @param credits credits moved to the proposal
     * @param burned RSC burned by the deployment
     */
    void recordDeployment(Holder holder, Proposal proposal, double credits, double burned);

    /**
     * Appends an entry to the event log.
     *
     * @param type the event kind
     * @param message description
     */
    void logEvent(EventType type, String message);
}
