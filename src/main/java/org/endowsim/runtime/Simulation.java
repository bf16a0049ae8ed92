package org.endowsim.runtime;

import org.endowsim.runtime.api.ArchetypeMetrics;
import org.endowsim.runtime.api.DeploymentRecord;
import org.endowsim.runtime.api.HolderRecord;
import org.endowsim.runtime.api.MetricsRow;
import org.endowsim.runtime.api.ModelMetrics;
import org.endowsim.runtime.api.ParameterSummary;
import org.endowsim.runtime.api.ParticipationData;
import org.endowsim.runtime.api.ProposalRecord;
import org.endowsim.runtime.api.SimulationSnapshot;
import org.endowsim.runtime.api.TierDistribution;
import org.endowsim.runtime.config.FailureMode;
import org.endowsim.runtime.config.SimulationParameters;
import org.endowsim.runtime.emission.EmissionSchedule;
import org.endowsim.runtime.internal.services.SeededRandomProvider;
import org.endowsim.runtime.model.Archetype;
import org.endowsim.runtime.model.EventType;
import org.endowsim.runtime.model.Holder;
import org.endowsim.runtime.model.HolderContext;
import org.endowsim.runtime.model.HolderTraits;
import org.endowsim.runtime.model.MarketSnapshot;
import org.endowsim.runtime.model.Proposal;
import org.endowsim.runtime.model.ProposalStatus;
import org.endowsim.runtime.model.SimulationEvent;
import org.endowsim.runtime.model.TimeWeightTier;
import org.endowsim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Orchestrates the endowment economy one week at a time.
 * <p>
 * The simulation owns the holder and proposal collections, the event log and the metrics
 * history. Each {@link #step()} freezes the aggregate state into a {@link MarketSnapshot}, lets
 * every active holder act in a freshly shuffled order, recomputes the aggregates, pays the
 * week's emission into circulating supply, resolves matured proposals, spawns re-entrants and
 * proposals, and appends one metrics row.
 * </p>
 * <p>
 * All randomness comes from one seeded stream, so two simulations built from equal parameters
 * and seed produce identical populations and outcomes. The class is not thread-safe.
 * </p>
 */
public class Simulation {
    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final SimulationParameters parameters;
    private final EmissionSchedule emissions;
    private final long seed;
    private final IRandomProvider randomProvider;
    private final StepContext holderContext = new StepContext();

    private final List<Holder> holders = new ArrayList<>();
    private final Map<Integer, Holder> holdersById = new HashMap<>();
    private final List<Proposal> proposals = new ArrayList<>();
    private final List<SimulationEvent> events = new ArrayList<>();
    private final List<MetricsRow> history = new ArrayList<>();
    private final List<DeploymentRecord> stepDeployments = new ArrayList<>();

    private long stepCount = 0L;
    private int nextHolderId = 1;
    private int nextProposalId = 1;
    private MarketSnapshot snapshot;

    private double cumulativeEmissions = 0.0;
    private double totalBurned = 0.0;
    private double totalCreditsGenerated = 0.0;
    private double totalCreditsDeployed = 0.0;
    private double totalCreditsExpired = 0.0;

    private double stepCreditsGenerated = 0.0;
    private double stepCreditsDeployed = 0.0;
    private int stepExits = 0;
    private int stepEntries = 0;

    /**
     * Builds the initial population and proposals. A missing seed is replaced by a time-derived
     * one, which is logged and available via {@link #getSeed()}.
     *
     * @param parameters validated run parameters
     */
    public Simulation(SimulationParameters parameters) {
        this.parameters = parameters;
        this.emissions = parameters.getEmissionSchedule();
        this.seed = parameters.getSeed() != null ? parameters.getSeed() : System.currentTimeMillis();
        this.randomProvider = new SeededRandomProvider(seed);

        spawnInitialHolders(parameters.getNumHolders());
        for (int i = 0; i < parameters.getNumProposals(); i++) {
            addProposal();
        }
        this.snapshot = computeSnapshot();
        recordMetrics();

        logEvent(EventType.INIT, String.format(Locale.ROOT,
                "Model initialized: %d holders, %.0f%% participation target, APY=%.1f%%",
                holders.size(), parameters.getInitialParticipationRate() * 100, getCurrentApy() * 100));
        LOG.info("Simulation initialized: holders={}, proposals={}, seed={}, participation={}, apy={}",
                holders.size(), proposals.size(), seed,
                String.format(Locale.ROOT, "%.4f", getParticipationRate()),
                String.format(Locale.ROOT, "%.4f", getCurrentApy()));
    }

    /**
     * Advances the simulation by one week.
     */
    public void step() {
        stepCount++;
        stepCreditsGenerated = 0.0;
        stepCreditsDeployed = 0.0;
        stepExits = 0;
        stepEntries = 0;
        stepDeployments.clear();

        // Aggregates are frozen before any holder acts
        snapshot = computeSnapshot();

        List<Holder> order = holders.stream().filter(Holder::isActive).collect(Collectors.toCollection(ArrayList::new));
        int activeBefore = order.size();
        Collections.shuffle(order, randomProvider.asJavaRandom());
        double earned = 0.0;
        for (Holder holder : order) {
            holder.step(holderContext);
            earned += holder.getWeeklyRate();
        }

        stepExits = Math.max(0, activeBefore - countActiveHolders());
        recomputeTotals();

        double weekly = snapshot.weeklyEmission();
        stepCreditsGenerated = earned;
        totalCreditsGenerated += weekly;
        cumulativeEmissions += weekly;

        resolveFundedProposals();
        maybeSpawnEntrants();
        maybeSpawnProposal();
        recordMetrics();

        if (LOG.isDebugEnabled()) {
            LOG.debug("Step={} participation={} apy={} active={} exits={} entries={} deployed={}",
                    stepCount,
                    String.format(Locale.ROOT, "%.4f", getParticipationRate()),
                    String.format(Locale.ROOT, "%.4f", getCurrentApy()),
                    countActiveHolders(), stepExits, stepEntries,
                    String.format(Locale.ROOT, "%.2f", stepCreditsDeployed));
        }
    }

    /**
     * Calls {@link #step()} {@code n} times.
     *
     * @param n number of weeks to advance, must be >= 0
     */
    public void runSteps(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Number of steps must be >= 0, got " + n);
        }
        for (int i = 0; i < n; i++) {
            step();
        }
    }

    // --- Population ---

    private void spawnInitialHolders(int count) {
        List<Map.Entry<Archetype, Double>> byFraction = new ArrayList<>(parameters.getArchetypeMix().entrySet());
        byFraction.sort(Map.Entry.<Archetype, Double>comparingByValue(Comparator.reverseOrder()));

        Map<Archetype, Integer> counts = new LinkedHashMap<>();
        int remaining = count;
        for (int i = 0; i < byFraction.size() - 1; i++) {
            Map.Entry<Archetype, Double> entry = byFraction.get(i);
            int n = (int) Math.round(count * entry.getValue());
            counts.put(entry.getKey(), n);
            remaining -= n;
        }
        counts.put(byFraction.get(byFraction.size() - 1).getKey(), Math.max(remaining, 0));

        counts.forEach((archetype, n) -> {
            for (int i = 0; i < n; i++) {
                addHolder(Holder.fromArchetype(nextHolderId++, archetype, parameters.getYieldThresholdMean(), randomProvider));
            }
        });
    }

    /**
     * Adds a holder with explicit traits and no archetype. It takes part from the next step on.
     *
     * @param traits behavioural traits
     * @param rscHeld starting RSC
     * @param yieldThreshold personal APY threshold
     * @return the record of the new holder
     */
    public HolderRecord addCustomHolder(HolderTraits traits, double rscHeld, double yieldThreshold) {
        Holder holder = Holder.custom(nextHolderId++, traits, rscHeld, yieldThreshold);
        addHolder(holder);
        return HolderRecord.of(holder, getCurrentApy());
    }

    private void addHolder(Holder holder) {
        holders.add(holder);
        holdersById.put(holder.getId(), holder);
    }

    /**
     * Re-entry: yields above the entry threshold attract one to three new yield seekers, with a
     * probability growing in how far the APY overshoots.
     */
    private void maybeSpawnEntrants() {
        double apy = getCurrentApy();
        double entryThreshold = parameters.getYieldThresholdMean() * Config.REENTRY_THRESHOLD_FACTOR;
        if (apy <= entryThreshold) {
            return;
        }
        double attractiveness = Math.min((apy - entryThreshold) / entryThreshold, 1.0);
        if (randomProvider.nextDouble() < attractiveness * Config.MAX_REENTRY_PROBABILITY) {
            int count = 1 + randomProvider.nextInt(Config.MAX_REENTRANTS_PER_STEP);
            for (int i = 0; i < count; i++) {
                addHolder(Holder.fromArchetype(nextHolderId++, Archetype.YIELD_SEEKER,
                        parameters.getYieldThresholdMean(), randomProvider));
            }
            stepEntries += count;
            logEvent(EventType.ENTRY, String.format(Locale.ROOT,
                    "%d new Yield Seeker(s) entered -- APY %.1f%% > threshold %.1f%%",
                    count, apy * 100, entryThreshold * 100));
            LOG.debug("Step={} spawned {} re-entrant(s) at APY {}", stepCount, count, apy);
        }
    }

    // --- Proposals ---

    /**
     * Creates an open proposal with a target drawn uniformly from the configured bounds.
     *
     * @return the record of the new proposal
     */
    public ProposalRecord addProposal() {
        long target = randomProvider.uniformInclusive(parameters.getFundingTargetMin(), parameters.getFundingTargetMax());
        return addProposal(target);
    }

    /**
     * Creates an open proposal with the given target.
     *
     * @param fundingTarget credits required, must be positive
     * @return the record of the new proposal
     */
    public ProposalRecord addProposal(long fundingTarget) {
        Proposal proposal = new Proposal(nextProposalId++, fundingTarget, stepCount);
        proposals.add(proposal);
        logEvent(EventType.NEW_PROPOSAL, String.format(Locale.ROOT,
                "P%d created (target: %,d credits)", proposal.getId(), proposal.getFundingTarget()));
        return ProposalRecord.of(proposal);
    }

    private void resolveFundedProposals() {
        for (Proposal proposal : proposals) {
            if (!proposal.isResolvable(stepCount)) {
                continue;
            }
            boolean success = randomProvider.nextDouble() < parameters.getSuccessRate();
            proposal.resolve(success, stepCount);
            if (success) {
                logEvent(EventType.COMPLETED, "P" + proposal.getId() + " completed successfully");
            } else {
                logEvent(EventType.FAILED, "P" + proposal.getId() + " failed");
                if (parameters.getFailureMode() == FailureMode.PARTIAL_REFUND) {
                    refundBackers(proposal);
                }
            }
            LOG.debug("Step={} resolved P{} as {}", stepCount, proposal.getId(), proposal.getStatus().id());
        }
    }

    private void refundBackers(Proposal proposal) {
        double refunded = 0.0;
        int refundedBackers = 0;
        for (Map.Entry<Integer, Double> backer : proposal.getBackers().entrySet()) {
            Holder holder = holdersById.get(backer.getKey());
            if (holder == null || !holder.isActive()) {
                continue;
            }
            double refund = Math.max(0.0, backer.getValue() * Config.REFUND_FRACTION);
            holder.receiveRefund(refund, stepCount, parameters.isCreditExpiryEnabled());
            refunded += refund;
            refundedBackers++;
        }
        if (refundedBackers > 0) {
            logEvent(EventType.REFUND, String.format(Locale.ROOT,
                    "P%d refunded %.0f credits to %d backer(s)", proposal.getId(), refunded, refundedBackers));
        }
    }

    private void maybeSpawnProposal() {
        if (countProposals(ProposalStatus.OPEN) < Config.MAX_OPEN_PROPOSALS
                && randomProvider.nextDouble() < Config.PROPOSAL_SPAWN_PROBABILITY) {
            addProposal();
        }
    }

    // --- Aggregates ---

    private MarketSnapshot computeSnapshot() {
        return new MarketSnapshot(
                stepCount,
                emissions.annualEmission(stepCount),
                emissions.weeklyEmission(stepCount),
                getTotalRscHeld(),
                getNextStepEffectiveRsc(),
                getCurrentApy());
    }

    // Each holder's week is counted before it earns
    private double getNextStepEffectiveRsc() {
        double total = 0.0;
        for (Holder holder : holders) {
            if (holder.isActive()) {
                total += holder.getNextStepEffectiveRsc();
            }
        }
        return total;
    }

    private void recomputeTotals() {
        double burned = 0.0;
        double deployed = 0.0;
        double expired = 0.0;
        for (Holder holder : holders) {
            burned += holder.getTotalBurned();
            deployed += holder.getTotalDeployed();
            expired += holder.getTotalExpired();
        }
        double expiredThisStep = expired - totalCreditsExpired;
        if (expiredThisStep > 0) {
            logEvent(EventType.EXPIRY, String.format(Locale.ROOT, "%.0f credits expired", expiredThisStep));
        }
        totalBurned = burned;
        totalCreditsDeployed = deployed;
        totalCreditsExpired = expired;
    }

    /**
     * @return RSC held by active holders
     */
    public double getTotalRscHeld() {
        double total = 0.0;
        for (Holder holder : holders) {
            if (holder.isActive()) {
                total += holder.getRscHeld();
            }
        }
        return total;
    }

    /**
     * @return RSC held by active holders, weighted by each holder's time-weight multiplier
     */
    public double getTotalEffectiveRsc() {
        double total = 0.0;
        for (Holder holder : holders) {
            if (holder.isActive()) {
                total += holder.getEffectiveRsc();
            }
        }
        return total;
    }

    public double getAnnualEmission() {
        return emissions.annualEmission(stepCount);
    }

    public double getWeeklyEmission() {
        return emissions.weeklyEmission(stepCount);
    }

    public double getCirculatingSupply() {
        return emissions.circulatingSupply(cumulativeEmissions);
    }

    /**
     * @return share of circulating supply held by active holders, 0 when supply is not positive
     */
    public double getParticipationRate() {
        double circulating = getCirculatingSupply();
        if (circulating <= 0) {
            return 0.0;
        }
        return getTotalRscHeld() / circulating;
    }

    /**
     * @return base (1.0x) APY: annual emission over RSC held, 0 when nothing is held
     */
    public double getCurrentApy() {
        double total = getTotalRscHeld();
        if (total <= 0) {
            return 0.0;
        }
        return getAnnualEmission() / total;
    }

    private int countActiveHolders() {
        int count = 0;
        for (Holder holder : holders) {
            if (holder.isActive()) {
                count++;
            }
        }
        return count;
    }

    private int countProposals(ProposalStatus status) {
        int count = 0;
        for (Proposal proposal : proposals) {
            if (proposal.getStatus() == status) {
                count++;
            }
        }
        return count;
    }

    // --- Events and metrics ---

    private void logEvent(EventType type, String message) {
        events.add(new SimulationEvent(stepCount, type, message));
    }

    private void recordMetrics() {
        Map<String, Double> rscByArchetype = new LinkedHashMap<>();
        for (Archetype archetype : Archetype.values()) {
            rscByArchetype.put(archetype.id(), 0.0);
        }
        Map<String, Integer> holdersByTier = new LinkedHashMap<>();
        for (TimeWeightTier tier : TimeWeightTier.values()) {
            holdersByTier.put(tier.label(), 0);
        }
        for (Holder holder : holders) {
            if (!holder.isActive()) {
                continue;
            }
            if (holder.getArchetype() != null) {
                rscByArchetype.merge(holder.getArchetype().id(), holder.getRscHeld(), Double::sum);
            }
            holdersByTier.merge(holder.getTier().label(), 1, Integer::sum);
        }
        int active = countActiveHolders();
        history.add(new MetricsRow(
                stepCount,
                EmissionSchedule.yearsElapsed(stepCount),
                getParticipationRate(),
                getCurrentApy(),
                getTotalRscHeld(),
                getTotalEffectiveRsc(),
                getCirculatingSupply(),
                getWeeklyEmission(),
                totalBurned,
                cumulativeEmissions,
                active,
                holders.size() - active,
                countProposals(ProposalStatus.OPEN),
                countProposals(ProposalStatus.FUNDED),
                countProposals(ProposalStatus.COMPLETED),
                countProposals(ProposalStatus.FAILED),
                Collections.unmodifiableMap(rscByArchetype),
                Collections.unmodifiableMap(holdersByTier),
                stepExits,
                stepEntries,
                stepCreditsGenerated,
                stepCreditsDeployed));
    }

    // --- Read-only queries ---

    public long getStepCount() { return stepCount; }

    /**
     * @return the seed the random stream was created with
     */
    public long getSeed() { return seed; }

    public SimulationParameters getParameters() { return parameters; }

    public double getCumulativeEmissions() { return cumulativeEmissions; }
    public double getTotalBurned() { return totalBurned; }
    public double getTotalCreditsGenerated() { return totalCreditsGenerated; }
    public double getTotalCreditsDeployed() { return totalCreditsDeployed; }

    /**
     * @return every holder ever created, in creation order, including exited ones
     */
    public List<HolderRecord> getHolders() {
        double apy = getCurrentApy();
        return holders.stream().map(h -> HolderRecord.of(h, apy)).collect(Collectors.toUnmodifiableList());
    }

    public Optional<HolderRecord> getHolder(int id) {
        Holder holder = holdersById.get(id);
        return holder == null ? Optional.empty() : Optional.of(HolderRecord.of(holder, getCurrentApy()));
    }

    /**
     * @return every proposal ever created, in creation order
     */
    public List<ProposalRecord> getProposals() {
        return proposals.stream().map(ProposalRecord::of).collect(Collectors.toUnmodifiableList());
    }

    public Optional<ProposalRecord> getProposal(int id) {
        return proposals.stream().filter(p -> p.getId() == id).findFirst().map(ProposalRecord::of);
    }

    /**
     * @return all metrics rows, starting with the row recorded at initialization
     */
    public List<MetricsRow> getHistory() {
        return List.copyOf(history);
    }

    /**
     * @param limit maximum number of events
     * @return the newest events, newest first; empty for a non-positive limit
     */
    public List<SimulationEvent> getEvents(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        int from = Math.max(0, events.size() - limit);
        List<SimulationEvent> newest = new ArrayList<>(events.subList(from, events.size()));
        Collections.reverse(newest);
        return Collections.unmodifiableList(newest);
    }

    /**
     * @return deployments made during the most recent step
     */
    public List<DeploymentRecord> getStepDeployments() {
        return List.copyOf(stepDeployments);
    }

    /**
     * @return active holder count per archetype id ({@value Archetype#CUSTOM_ID} for custom holders)
     */
    public Map<String, Integer> getArchetypeDistribution() {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (Holder holder : holders) {
            if (holder.isActive()) {
                distribution.merge(holder.getArchetypeId(), 1, Integer::sum);
            }
        }
        return Collections.unmodifiableMap(distribution);
    }

    /**
     * @return behavioural aggregates per archetype that has at least one holder
     */
    public Map<String, ArchetypeMetrics> getArchetypeMetrics() {
        Map<String, ArchetypeMetrics> metrics = new LinkedHashMap<>();
        for (Archetype archetype : Archetype.values()) {
            List<Holder> group = holders.stream().filter(h -> h.getArchetype() == archetype).collect(Collectors.toList());
            if (group.isEmpty()) {
                continue;
            }
            List<Holder> active = group.stream().filter(Holder::isActive).collect(Collectors.toList());
            int divisor = Math.max(active.size(), 1);
            metrics.put(archetype.id(), new ArchetypeMetrics(
                    group.size(),
                    active.size(),
                    group.size() - active.size(),
                    active.stream().mapToDouble(Holder::getRscHeld).sum() / divisor,
                    active.stream().mapToDouble(Holder::getWeeksHeld).sum() / divisor,
                    active.stream().mapToDouble(Holder::getTimeWeightMultiplier).sum() / divisor,
                    active.stream().mapToDouble(Holder::getCredits).sum() / divisor,
                    group.stream().mapToDouble(Holder::getTotalDeployed).sum(),
                    group.stream().mapToDouble(Holder::getTotalBurned).sum()));
        }
        return Collections.unmodifiableMap(metrics);
    }

    /**
     * @return active holder count and RSC per time-weight tier label
     */
    public Map<String, TierDistribution> getMultiplierDistribution() {
        Map<String, TierDistribution> distribution = new LinkedHashMap<>();
        for (TimeWeightTier tier : TimeWeightTier.values()) {
            int count = 0;
            double rsc = 0.0;
            for (Holder holder : holders) {
                if (holder.isActive() && holder.getTier() == tier) {
                    count++;
                    rsc += holder.getRscHeld();
                }
            }
            distribution.put(tier.label(), new TierDistribution(count, rsc, tier.multiplier()));
        }
        return Collections.unmodifiableMap(distribution);
    }

    /**
     * @return participation figures plus APYs at the fixed reference participation rates
     */
    public ParticipationData getParticipationData() {
        double annual = getAnnualEmission();
        double circulating = getCirculatingSupply();
        Map<String, Double> scenarios = new LinkedHashMap<>();
        for (double rate : Config.REFERENCE_PARTICIPATION_RATES) {
            String label = Math.round(rate * 100) + "pct";
            scenarios.put(label, circulating > 0 ? annual / (circulating * rate) : 0.0);
        }
        return new ParticipationData(
                getParticipationRate(),
                getCurrentApy(),
                getTotalRscHeld(),
                circulating,
                annual,
                EmissionSchedule.yearsElapsed(stepCount),
                Collections.unmodifiableMap(scenarios));
    }

    /**
     * @return headline metrics at the current step
     */
    public ModelMetrics getMetrics() {
        int active = countActiveHolders();
        double totalCredits = 0.0;
        for (Holder holder : holders) {
            if (holder.isActive()) {
                totalCredits += holder.getCredits();
            }
        }
        int completed = countProposals(ProposalStatus.COMPLETED);
        int failed = countProposals(ProposalStatus.FAILED);
        int resolved = completed + failed;
        return new ModelMetrics(
                stepCount,
                EmissionSchedule.yearsElapsed(stepCount),
                getParticipationRate(),
                getCurrentApy(),
                getTotalRscHeld(),
                getCirculatingSupply(),
                getAnnualEmission(),
                getWeeklyEmission(),
                totalCredits,
                totalBurned,
                totalCreditsGenerated,
                totalCreditsDeployed,
                totalCreditsDeployed / Math.max(stepCount, 1),
                getMultiplierDistribution(),
                countProposals(ProposalStatus.OPEN),
                countProposals(ProposalStatus.FUNDED),
                completed,
                failed,
                resolved > 0 ? (double) completed / resolved : 0.0,
                holders.size(),
                active,
                holders.size() - active,
                proposals.size());
    }

    /**
     * @return the complete state of the run
     */
    public SimulationSnapshot getState() {
        return new SimulationSnapshot(
                getMetrics(),
                getHolders(),
                getProposals(),
                getArchetypeDistribution(),
                getArchetypeMetrics(),
                getParticipationData(),
                getStepDeployments(),
                stepCreditsGenerated,
                stepCreditsDeployed,
                stepExits,
                stepEntries,
                seed,
                ParameterSummary.of(parameters));
    }

    /**
     * The holder-facing view of this simulation.
     */
    private final class StepContext implements HolderContext {

        @Override
        public MarketSnapshot snapshot() {
            return snapshot;
        }

        @Override
        public SimulationParameters parameters() {
            return parameters;
        }

        @Override
        public IRandomProvider random() {
            return randomProvider;
        }

        @Override
        public List<Proposal> openProposals() {
            List<Proposal> open = new ArrayList<>();
            for (Proposal proposal : proposals) {
                if (proposal.getStatus() == ProposalStatus.OPEN) {
                    open.add(proposal);
                }
            }
            return open;
        }

        @Override
        public void recordDeployment(Holder holder, Proposal proposal, double credits, double burned) {
            boolean fundedNow = proposal.receiveCredits(holder.getId(), credits, stepCount);
            stepCreditsDeployed += credits;
            stepDeployments.add(new DeploymentRecord(stepCount, holder.getId(), holder.getArchetypeId(),
                    proposal.getId(), credits, burned));
            if (fundedNow) {
                logEvent(EventType.FUNDED, String.format(Locale.ROOT,
                        "P%d reached funding target (%.0f/%d)",
                        proposal.getId(), proposal.getCreditsReceived(), proposal.getFundingTarget()));
                LOG.debug("Step={} P{} funded by H{}", stepCount, proposal.getId(), holder.getId());
            }
        }

        @Override
        public void logEvent(EventType type, String message) {
            Simulation.this.logEvent(type, message);
        }
    }
}
