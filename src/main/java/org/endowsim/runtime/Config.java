package org.endowsim.runtime;

import java.util.List;

/**
 * Provides centralized behavioural constants for the endowment simulation.
 * This final class contains static constants that shape holder decisions and orchestrator
 * spawning rules. Tunable run parameters (burn rate, success rate, archetype mix, ...) live in
 * {@link org.endowsim.runtime.config.SimulationParameters} and are loaded from HOCON at runtime.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * One simulation step is one week.
     */
    public static final int WEEKS_PER_YEAR = 52;

    // --- Deployment decision ---

    /**
     * Weight of a holder's engagement in its base deployment probability.
     */
    public static final double ENGAGEMENT_DEPLOY_WEIGHT = 0.6;

    /**
     * Maximum boost added to the deployment probability by accumulated, undeployed credits.
     */
    public static final double ACCUMULATION_PRESSURE_BOOST = 0.3;

    /**
     * Number of weeks of yield after which accumulation pressure reaches its midpoint.
     */
    public static final double ACCUMULATION_PRESSURE_WEEKS = 4.0;

    /**
     * Steepness of the logistic accumulation-pressure curve.
     */
    public static final double ACCUMULATION_PRESSURE_STEEPNESS = 2.0;

    /**
     * Upper bound of the per-step deployment probability.
     */
    public static final double MAX_DEPLOY_PROBABILITY = 0.95;

    /**
     * The deploy-probability setting at which the behavioural formula applies unscaled.
     */
    public static final double REFERENCE_DEPLOY_PROBABILITY = 0.3;

    /**
     * Holders with a mission alignment above this value pick proposals by funding progress.
     */
    public static final double MISSION_SELECTION_THRESHOLD = 0.5;

    /**
     * Smallest fraction of held credits deployed at once.
     */
    public static final double MIN_DEPLOY_FRACTION = 0.05;

    /**
     * Largest deployable fraction for a holder with zero engagement.
     */
    public static final double BASE_MAX_DEPLOY_FRACTION = 0.15;

    /**
     * Additional deployable fraction per unit of engagement.
     */
    public static final double ENGAGEMENT_DEPLOY_FRACTION = 0.45;

    /**
     * A single deployment never burns more than this fraction of the holder's current RSC.
     */
    public static final double MAX_BURN_FRACTION = 0.10;

    // --- Exit decision ---

    /**
     * Scale of the per-step exit probability at full yield shortfall and full price sensitivity.
     */
    public static final double EXIT_PRESSURE_SCALE = 0.15;

    /**
     * How strongly a long hold horizon damps exit pressure.
     */
    public static final double HOLD_HORIZON_DAMPING = 0.8;

    // --- Holder creation ---

    /**
     * Standard deviation of the noise added to a holder's yield threshold.
     */
    public static final double YIELD_THRESHOLD_NOISE = 0.01;

    /**
     * Floor of any holder's yield threshold.
     */
    public static final double MIN_YIELD_THRESHOLD = 0.01;

    /**
     * Institutions start with a holding history drawn from [0, this] weeks.
     */
    public static final int MAX_INSTITUTION_WARM_START_WEEKS = 52;

    // --- Orchestrator ---

    /**
     * Re-entrants appear once APY exceeds the mean yield threshold by this factor.
     */
    public static final double REENTRY_THRESHOLD_FACTOR = 1.1;

    /**
     * Per-step spawn probability of re-entrants at full attractiveness.
     */
    public static final double MAX_REENTRY_PROBABILITY = 0.15;

    /**
     * Largest number of re-entrants spawned in a single step.
     */
    public static final int MAX_REENTRANTS_PER_STEP = 3;

    /**
     * New proposals are only considered while fewer than this many are open.
     */
    public static final int MAX_OPEN_PROPOSALS = 5;

    /**
     * Per-step probability of creating a proposal while below {@link #MAX_OPEN_PROPOSALS}.
     */
    public static final double PROPOSAL_SPAWN_PROBABILITY = 0.3;

    /**
     * Share of contributed credits returned to active backers of a failed proposal under partial refund.
     */
    public static final double REFUND_FRACTION = 0.5;

    /**
     * Hypothetical participation rates used for the reference APY scenarios.
     */
    public static final List<Double> REFERENCE_PARTICIPATION_RATES = List.of(0.15, 0.30, 0.70);
}
