package org.endowsim.runtime.model;

import org.endowsim.runtime.Config;
import org.endowsim.runtime.config.SimulationParameters;
import org.endowsim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * A token holder whose RSC sits in the yield-bearing account.
 * <p>
 * Each step an active holder ages its position, lets old credits expire (when enabled), earns
 * its time-weighted share of the weekly emission as credits, may deploy part of its credits to
 * an open proposal (burning a little RSC), and finally weighs whether the current APY is still
 * worth staying for. Exit is terminal: an exited holder is never re-activated, re-entry is a new
 * holder.
 * </p>
 * <p>
 * Behavioural traits and the yield threshold are sampled once at creation. Aggregates are read
 * only from the step's {@link MarketSnapshot}.
 * </p>
 */
public class Holder {
    private static final Logger LOG = LoggerFactory.getLogger(Holder.class);

    private final int id;
    private final Archetype archetype;
    private final HolderTraits traits;
    private final double yieldThreshold;
    private final double initialRsc;
    private final CreditLedger ledger = new CreditLedger();

    private double rscHeld;
    private int weeksHeld;
    private double credits = 0.0;
    private boolean active = true;

    private double weeklyRate = 0.0;
    private double totalYieldEarned = 0.0;
    private double totalDeployed = 0.0;
    private double totalBurned = 0.0;
    private double totalExpired = 0.0;
    private double totalRefunded = 0.0;
    private int deploymentsCount = 0;
    private int consecutiveIdleSteps = 0;

    /**
     * Constructs a holder. Prefer {@link #fromArchetype} or {@link #custom}.
     *
     * @param id unique holder id
     * @param archetype the preset the traits came from, or null for a custom holder
     * @param traits behavioural traits
     * @param rscHeld starting RSC, must be >= 0
     * @param yieldThreshold APY below which the holder feels exit pressure, must be positive
     * @param weeksHeld pre-existing continuous holding duration, must be >= 0
     */
    Holder(int id, Archetype archetype, HolderTraits traits, double rscHeld, double yieldThreshold, int weeksHeld) {
        if (!(rscHeld >= 0) || Double.isInfinite(rscHeld)) {
            throw new IllegalArgumentException("rsc_held must be >= 0, got " + rscHeld);
        }
        if (!(yieldThreshold > 0)) {
            throw new IllegalArgumentException("yield_threshold must be positive, got " + yieldThreshold);
        }
        if (weeksHeld < 0) {
            throw new IllegalArgumentException("weeks_held must be >= 0, got " + weeksHeld);
        }
        this.id = id;
        this.archetype = archetype;
        this.traits = traits;
        this.rscHeld = rscHeld;
        this.initialRsc = rscHeld;
        this.yieldThreshold = yieldThreshold;
        this.weeksHeld = weeksHeld;
    }

    /**
     * Creates a holder by sampling traits, holdings and yield threshold from an archetype.
     * Institutions start with a random holding history of up to a year.
     *
     * @param id unique holder id
     * @param archetype the preset to sample from
     * @param yieldThresholdMean the run's mean yield threshold
     * @param random the run's random stream
     * @return the new holder
     */
    public static Holder fromArchetype(int id, Archetype archetype, double yieldThresholdMean, IRandomProvider random) {
        HolderTraits traits = HolderTraits.sample(archetype, random);
        double rsc = archetype.rscRange().sample(random);
        double threshold = yieldThresholdMean + archetype.yieldThresholdOffset()
                + random.nextGaussian() * Config.YIELD_THRESHOLD_NOISE;
        threshold = Math.max(Config.MIN_YIELD_THRESHOLD, threshold);
        int weeks = archetype.hasWarmStart() ? random.nextInt(Config.MAX_INSTITUTION_WARM_START_WEEKS + 1) : 0;
        return new Holder(id, archetype, traits, rsc, threshold, weeks);
    }

    /**
     * Creates a holder with explicitly supplied traits and no archetype.
     *
     * @param id unique holder id
     * @param traits behavioural traits
     * @param rscHeld starting RSC
     * @param yieldThreshold personal APY threshold
     * @return the new holder
     */
    public static Holder custom(int id, HolderTraits traits, double rscHeld, double yieldThreshold) {
        return new Holder(id, null, traits, rscHeld, yieldThreshold, 0);
    }

    /**
     * Runs this holder's behaviour for one step. Does nothing once the holder has exited.
     *
     * @param context the orchestrator's view for this step
     */
    public void step(HolderContext context) {
        if (!active) {
            return;
        }
        MarketSnapshot snapshot = context.snapshot();
        SimulationParameters parameters = context.parameters();
        IRandomProvider random = context.random();

        weeksHeld++;

        if (parameters.isCreditExpiryEnabled()) {
            expireCredits(snapshot.step(), parameters.getCreditExpiryWeeks());
        }

        earnYield(snapshot, parameters.isCreditExpiryEnabled());

        boolean deployed = false;
        if (shouldDeploy(parameters.getDeployProbability(), random)) {
            Proposal proposal = selectProposal(context.openProposals(), random);
            if (proposal != null) {
                deploy(context, proposal, drawDeployAmount(random));
                deployed = true;
            }
        }
        consecutiveIdleSteps = deployed ? 0 : consecutiveIdleSteps + 1;

        if (considerExit(snapshot.currentApy(), random)) {
            context.logEvent(EventType.EXIT, String.format(Locale.ROOT,
                    "H%d (%s) exited -- APY %.1f%% below threshold %.1f%%",
                    id, getArchetypeId(), snapshot.currentApy() * 100, yieldThreshold * 100));
        }
    }

    /**
     * Removes credit batches older than the expiry window.
     *
     * @param step the current step
     * @param expiryWeeks the expiry window
     * @return the credits removed
     */
    double expireCredits(long step, int expiryWeeks) {
        double expired = ledger.expire(step, expiryWeeks);
        if (expired > 0) {
            credits = Math.max(0.0, credits - expired);
            totalExpired += expired;
        }
        return expired;
    }

    /**
     * Credits this holder with its time-weighted share of the step's emission.
     *
     * @param snapshot the step's aggregates
     * @param trackBatches whether to record the credits as an expirable batch
     * @return the credits earned
     */
    double earnYield(MarketSnapshot snapshot, boolean trackBatches) {
        double share = snapshot.yieldShare(getEffectiveRsc());
        double earned = snapshot.weeklyEmission() * share;
        weeklyRate = earned;
        if (earned > 0) {
            credits += earned;
            totalYieldEarned += earned;
            if (trackBatches) {
                ledger.add(snapshot.step(), earned);
            }
        }
        return earned;
    }

    /**
     * Probability of deploying this step: engagement plus a logistic pressure term that grows
     * once undeployed credits exceed about four weeks of yield, scaled by the run's deploy
     * probability and capped.
     *
     * @param deployProbability the run's deploy-probability setting
     * @return the probability in [0, {@link Config#MAX_DEPLOY_PROBABILITY}], 0 without credits
     */
    double deployProbability(double deployProbability) {
        if (credits <= 0) {
            return 0.0;
        }
        double base = traits.engagement() * Config.ENGAGEMENT_DEPLOY_WEIGHT;
        double weekly = Math.max(weeklyRate, 1.0);
        double accumulationRatio = credits / (weekly * Config.ACCUMULATION_PRESSURE_WEEKS);
        double pressure = 1.0 / (1.0 + Math.exp(-Config.ACCUMULATION_PRESSURE_STEEPNESS * (accumulationRatio - 1.0)));
        double scale = deployProbability / Config.REFERENCE_DEPLOY_PROBABILITY;
        double probability = (base + pressure * Config.ACCUMULATION_PRESSURE_BOOST) * scale;
        return Math.min(probability, Config.MAX_DEPLOY_PROBABILITY);
    }

    private boolean shouldDeploy(double deployProbability, IRandomProvider random) {
        if (credits <= 0) {
            return false;
        }
        return random.nextDouble() < deployProbability(deployProbability);
    }

    /**
     * Mission-aligned holders favour proposals close to their target, with noise that shrinks as
     * alignment grows; everyone else picks uniformly.
     *
     * @param openProposals candidates
     * @param random the random stream
     * @return the chosen proposal, or null if there are no candidates
     */
    Proposal selectProposal(List<Proposal> openProposals, IRandomProvider random) {
        if (openProposals.isEmpty()) {
            return null;
        }
        double alignment = traits.missionAlignment();
        if (alignment > Config.MISSION_SELECTION_THRESHOLD) {
            Proposal best = null;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (Proposal proposal : openProposals) {
                double score = proposal.getFundingFraction() * alignment + random.nextDouble() * (1.0 - alignment);
                if (score > bestScore) {
                    bestScore = score;
                    best = proposal;
                }
            }
            return best;
        }
        return openProposals.get(random.nextInt(openProposals.size()));
    }

    private double drawDeployAmount(IRandomProvider random) {
        double maxFraction = Config.BASE_MAX_DEPLOY_FRACTION + traits.engagement() * Config.ENGAGEMENT_DEPLOY_FRACTION;
        double fraction = random.uniform(Config.MIN_DEPLOY_FRACTION, maxFraction);
        return credits * fraction;
    }

    /**
     * Moves credits to a proposal and burns RSC in proportion to the share of credits deployed.
     * The amount is clamped to the current balance and the burn to a tenth of current holdings.
     *
     * @param context the orchestrator's view, which books the credits on the proposal
     * @param proposal the target proposal
     * @param amount requested credits
     * @return the RSC burned, 0 if nothing was deployed
     */
    public double deploy(HolderContext context, Proposal proposal, double amount) {
        double deployed = Math.min(amount, credits);
        if (!(deployed > 0)) {
            return 0.0;
        }
        double creditsBefore = credits;
        double burn = rscHeld * (deployed / creditsBefore) * context.parameters().getBurnRate();
        burn = Math.min(burn, rscHeld * Config.MAX_BURN_FRACTION);

        credits = Math.max(0.0, credits - deployed);
        if (context.parameters().isCreditExpiryEnabled()) {
            ledger.consume(deployed);
        }
        rscHeld = Math.max(0.0, rscHeld - burn);

        totalDeployed += deployed;
        totalBurned += burn;
        deploymentsCount++;

        context.recordDeployment(this, proposal, deployed, burn);
        return burn;
    }

    /**
     * @param apy the step's base APY
     * @param random the random stream
     * @return true if the holder exited
     */
    boolean considerExit(double apy, IRandomProvider random) {
        double probability = exitProbability(apy);
        if (probability <= 0) {
            return false;
        }
        if (random.nextDouble() < probability) {
            active = false;
            LOG.debug("Holder H{} ({}) exited at APY {} (threshold {})", id, getArchetypeId(), apy, yieldThreshold);
            return true;
        }
        return false;
    }

    /**
     * @param apy the base APY
     * @return per-step exit probability, 0 while the APY meets the holder's threshold
     */
    double exitProbability(double apy) {
        if (apy >= yieldThreshold) {
            return 0.0;
        }
        double gap = Math.min(1.0, (yieldThreshold - apy) / yieldThreshold);
        return gap * traits.priceSensitivity() * Config.EXIT_PRESSURE_SCALE
                * (1.0 - traits.holdHorizon() * Config.HOLD_HORIZON_DAMPING);
    }

    /**
     * Returns credits from a failed proposal. Refunds become a fresh batch when expiry is tracked.
     *
     * @param amount credits returned
     * @param step the current step
     * @param trackBatches whether credit expiry is enabled
     */
    public void receiveRefund(double amount, long step, boolean trackBatches) {
        double refund = Math.max(0.0, amount);
        if (refund <= 0) {
            return;
        }
        credits += refund;
        totalRefunded += refund;
        if (trackBatches) {
            ledger.add(step, refund);
        }
    }

    /**
     * @return the current time-weight tier, evaluated from {@code weeksHeld}
     */
    public TimeWeightTier getTier() {
        return TimeWeightTier.forWeeks(weeksHeld);
    }

    public double getTimeWeightMultiplier() {
        return TimeWeightTier.multiplierFor(weeksHeld);
    }

    /**
     * @return RSC weighted by the current multiplier
     */
    public double getEffectiveRsc() {
        return rscHeld * getTimeWeightMultiplier();
    }

    /**
     * @return RSC weighted by the multiplier this holder earns with in its next step
     */
    public double getNextStepEffectiveRsc() {
        return rscHeld * TimeWeightTier.multiplierFor(weeksHeld + 1);
    }

    /**
     * @return the archetype id, or {@value Archetype#CUSTOM_ID} for custom holders
     */
    public String getArchetypeId() {
        return archetype == null ? Archetype.CUSTOM_ID : archetype.id();
    }

    public int getId() { return id; }

    /**
     * @return the archetype, or null for a custom holder
     */
    public Archetype getArchetype() { return archetype; }
    public HolderTraits getTraits() { return traits; }
    public double getYieldThreshold() { return yieldThreshold; }
    public double getInitialRsc() { return initialRsc; }
    public double getRscHeld() { return rscHeld; }
    public int getWeeksHeld() { return weeksHeld; }
    public double getCredits() { return credits; }
    public boolean isActive() { return active; }
    public double getWeeklyRate() { return weeklyRate; }
    public double getTotalYieldEarned() { return totalYieldEarned; }
    public double getTotalDeployed() { return totalDeployed; }
    public double getTotalBurned() { return totalBurned; }
    public double getTotalExpired() { return totalExpired; }
    public double getTotalRefunded() { return totalRefunded; }
    public int getDeploymentsCount() { return deploymentsCount; }
    public int getConsecutiveIdleSteps() { return consecutiveIdleSteps; }

    /**
     * @return outstanding credit batches, oldest first; empty when expiry is disabled
     */
    public List<CreditBatch> getCreditBatches() {
        return ledger.snapshot();
    }
}
