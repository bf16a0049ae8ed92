package org.endowsim.runtime.config;

import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.endowsim.runtime.emission.EmissionSchedule;
import org.endowsim.runtime.model.Archetype;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable set of parameters fixed for the lifetime of one simulation run.
 * <p>
 * Instances come from {@link #builder()}, {@link #defaults()} or {@link #fromConfig(com.typesafe.config.Config)}.
 * All validation happens in {@link Builder#build()}: an invalid value fails there, naming the
 * offending value, so a simulation is never constructed from a partially valid configuration.
 * </p>
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * endowment {
 *   simulation {
 *     num-holders = 100
 *     burn-rate = 0.02
 *     archetype-mix { believer = 0.25, yield_seeker = 0.35, institution = 0.15, speculator = 0.25 }
 *     failure-mode = "nothing"
 *     # seed = 42
 *   }
 *   emission { year0-emission = 9500000, half-life-years = 64, ... }
 * }
 * </pre>
 */
public final class SimulationParameters {

    private static final Logger LOG = LoggerFactory.getLogger(SimulationParameters.class);

    public static final String SIMULATION_PATH = "endowment.simulation";
    public static final String EMISSION_PATH = "endowment.emission";

    private static final double MIX_TOLERANCE = 1e-6;

    private final int numHolders;
    private final int numProposals;
    private final double burnRate;
    private final double successRate;
    private final long fundingTargetMin;
    private final long fundingTargetMax;
    private final double deployProbability;
    private final Map<Archetype, Double> archetypeMix;
    private final double yieldThresholdMean;
    private final double initialParticipationRate;
    private final Long seed;
    private final boolean creditExpiryEnabled;
    private final int creditExpiryWeeks;
    private final FailureMode failureMode;
    private final EmissionSchedule emissionSchedule;

    private SimulationParameters(Builder b, Map<Archetype, Double> mix) {
        this.numHolders = b.numHolders;
        this.numProposals = b.numProposals;
        this.burnRate = b.burnRate;
        this.successRate = b.successRate;
        this.fundingTargetMin = b.fundingTargetMin;
        this.fundingTargetMax = b.fundingTargetMax;
        this.deployProbability = b.deployProbability;
        this.archetypeMix = Collections.unmodifiableMap(mix);
        this.yieldThresholdMean = b.yieldThresholdMean;
        this.initialParticipationRate = b.initialParticipationRate;
        this.seed = b.seed;
        this.creditExpiryEnabled = b.creditExpiryEnabled;
        this.creditExpiryWeeks = b.creditExpiryWeeks;
        this.failureMode = b.failureMode;
        this.emissionSchedule = b.emissionSchedule;
    }

    /**
     * @return parameters equal to the shipped {@code reference.conf}
     */
    public static SimulationParameters defaults() {
        return builder().build();
    }

    /**
     * @return a builder pre-filled with the default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the default archetype mix: believer 25%, yield seeker 35%, institution 15%, speculator 25%
     */
    public static Map<String, Double> defaultArchetypeMix() {
        Map<String, Double> mix = new LinkedHashMap<>();
        mix.put(Archetype.BELIEVER.id(), 0.25);
        mix.put(Archetype.YIELD_SEEKER.id(), 0.35);
        mix.put(Archetype.INSTITUTION.id(), 0.15);
        mix.put(Archetype.SPECULATOR.id(), 0.25);
        return mix;
    }

    /**
     * Binds the {@code endowment.simulation} and {@code endowment.emission} blocks. Missing keys
     * fall back to the classpath {@code reference.conf}.
     *
     * @param config the application configuration
     * @return validated parameters
     * @throws com.typesafe.config.ConfigException if a value has the wrong type
     * @throws IllegalArgumentException if a value is out of range or names an unknown archetype / mode
     */
    public static SimulationParameters fromConfig(com.typesafe.config.Config config) {
        com.typesafe.config.Config merged = config.withFallback(ConfigFactory.defaultReference()).resolve();
        com.typesafe.config.Config sim = merged.getConfig(SIMULATION_PATH);

        Builder builder = builder()
                .numHolders(sim.getInt("num-holders"))
                .numProposals(sim.getInt("num-proposals"))
                .burnRate(sim.getDouble("burn-rate"))
                .successRate(sim.getDouble("success-rate"))
                .fundingTargetRange(sim.getLong("funding-target-min"), sim.getLong("funding-target-max"))
                .deployProbability(sim.getDouble("deploy-probability"))
                .yieldThresholdMean(sim.getDouble("yield-threshold-mean"))
                .initialParticipationRate(sim.getDouble("initial-participation-rate"))
                .creditExpiryEnabled(sim.getBoolean("credit-expiry-enabled"))
                .creditExpiryWeeks(sim.getInt("credit-expiry-weeks"))
                .failureMode(FailureMode.fromId(sim.getString("failure-mode")))
                .emissionSchedule(new EmissionSchedule(merged.getConfig(EMISSION_PATH)));

        if (sim.hasPath("seed")) {
            builder.seed(sim.getLong("seed"));
        }

        if (!sim.hasPath("archetype-mix")) {
            return builder.build();
        }
        // Ids such as yield_seeker are read as object keys, not dotted paths
        Map<String, Double> mix = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : sim.getObject("archetype-mix").entrySet()) {
            Object value = entry.getValue().unwrapped();
            if (!(value instanceof Number)) {
                throw new IllegalArgumentException("Archetype mix fraction for '" + entry.getKey() + "' must be a number, got " + value);
            }
            mix.put(entry.getKey(), ((Number) value).doubleValue());
        }
        builder.archetypeMix(mix);

        return builder.build();
    }

    /**
     * @return a builder initialised with this instance's values
     */
    public Builder toBuilder() {
        Map<String, Double> mix = new LinkedHashMap<>();
        archetypeMix.forEach((archetype, fraction) -> mix.put(archetype.id(), fraction));
        Builder b = builder()
                .numHolders(numHolders)
                .numProposals(numProposals)
                .burnRate(burnRate)
                .successRate(successRate)
                .fundingTargetRange(fundingTargetMin, fundingTargetMax)
                .deployProbability(deployProbability)
                .archetypeMix(mix)
                .yieldThresholdMean(yieldThresholdMean)
                .initialParticipationRate(initialParticipationRate)
                .creditExpiryEnabled(creditExpiryEnabled)
                .creditExpiryWeeks(creditExpiryWeeks)
                .failureMode(failureMode)
                .emissionSchedule(emissionSchedule);
        b.seed = seed;
        return b;
    }

    public int getNumHolders() { return numHolders; }
    public int getNumProposals() { return numProposals; }
    public double getBurnRate() { return burnRate; }
    public double getSuccessRate() { return successRate; }
    public long getFundingTargetMin() { return fundingTargetMin; }
    public long getFundingTargetMax() { return fundingTargetMax; }
    public double getDeployProbability() { return deployProbability; }

    /**
     * @return archetype population fractions in configuration order
     */
    public Map<Archetype, Double> getArchetypeMix() { return archetypeMix; }
    public double getYieldThresholdMean() { return yieldThresholdMean; }

    /**
     * @return informational participation target; not enforced by the simulation
     */
    public double getInitialParticipationRate() { return initialParticipationRate; }

    /**
     * @return the configured seed, or null if the run should pick a time-derived seed
     */
    public Long getSeed() { return seed; }
    public boolean isCreditExpiryEnabled() { return creditExpiryEnabled; }
    public int getCreditExpiryWeeks() { return creditExpiryWeeks; }
    public FailureMode getFailureMode() { return failureMode; }
    public EmissionSchedule getEmissionSchedule() { return emissionSchedule; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimulationParameters)) return false;
        SimulationParameters that = (SimulationParameters) o;
        return numHolders == that.numHolders
                && numProposals == that.numProposals
                && Double.compare(burnRate, that.burnRate) == 0
                && Double.compare(successRate, that.successRate) == 0
                && fundingTargetMin == that.fundingTargetMin
                && fundingTargetMax == that.fundingTargetMax
                && Double.compare(deployProbability, that.deployProbability) == 0
                && Double.compare(yieldThresholdMean, that.yieldThresholdMean) == 0
                && Double.compare(initialParticipationRate, that.initialParticipationRate) == 0
                && creditExpiryEnabled == that.creditExpiryEnabled
                && creditExpiryWeeks == that.creditExpiryWeeks
                && archetypeMix.equals(that.archetypeMix)
                && Objects.equals(seed, that.seed)
                && failureMode == that.failureMode
                && emissionSchedule.equals(that.emissionSchedule);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numHolders, numProposals, burnRate, successRate, fundingTargetMin, fundingTargetMax,
                deployProbability, archetypeMix, yieldThresholdMean, initialParticipationRate, seed,
                creditExpiryEnabled, creditExpiryWeeks, failureMode, emissionSchedule);
    }

    @Override
    public String toString() {
        return "SimulationParameters{numHolders=" + numHolders + ", numProposals=" + numProposals
                + ", burnRate=" + burnRate + ", successRate=" + successRate
                + ", fundingTarget=[" + fundingTargetMin + ", " + fundingTargetMax + "]"
                + ", deployProbability=" + deployProbability + ", archetypeMix=" + archetypeMix
                + ", yieldThresholdMean=" + yieldThresholdMean + ", seed=" + seed
                + ", creditExpiry=" + (creditExpiryEnabled ? creditExpiryWeeks + "w" : "off")
                + ", failureMode=" + failureMode.id() + "}";
    }

    /**
     * Mutable builder for {@link SimulationParameters}, pre-filled with the defaults.
     */
    public static final class Builder {
        private int numHolders = 100;
        private int numProposals = 10;
        private double burnRate = 0.02;
        private double successRate = 0.80;
        private long fundingTargetMin = 1000;
        private long fundingTargetMax = 10000;
        private double deployProbability = 0.3;
        private Map<String, Double> archetypeMix = defaultArchetypeMix();
        private double yieldThresholdMean = 0.08;
        private double initialParticipationRate = 0.30;
        private Long seed = null;
        private boolean creditExpiryEnabled = false;
        private int creditExpiryWeeks = 8;
        private FailureMode failureMode = FailureMode.NOTHING;
        private EmissionSchedule emissionSchedule = EmissionSchedule.defaults();

        private Builder() {}

        public Builder numHolders(int numHolders) { this.numHolders = numHolders; return this; }
        public Builder numProposals(int numProposals) { this.numProposals = numProposals; return this; }
        public Builder burnRate(double burnRate) { this.burnRate = burnRate; return this; }
        public Builder successRate(double successRate) { this.successRate = successRate; return this; }

        public Builder fundingTargetRange(long min, long max) {
            this.fundingTargetMin = min;
            this.fundingTargetMax = max;
            return this;
        }

        public Builder deployProbability(double deployProbability) { this.deployProbability = deployProbability; return this; }

        /**
         * @param archetypeMix archetype id to population fraction; iteration order is kept
         * @return this builder
         */
        public Builder archetypeMix(Map<String, Double> archetypeMix) {
            this.archetypeMix = new LinkedHashMap<>(Objects.requireNonNull(archetypeMix, "archetypeMix"));
            return this;
        }

        public Builder yieldThresholdMean(double yieldThresholdMean) { this.yieldThresholdMean = yieldThresholdMean; return this; }
        public Builder initialParticipationRate(double rate) { this.initialParticipationRate = rate; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }
        public Builder creditExpiryEnabled(boolean enabled) { this.creditExpiryEnabled = enabled; return this; }
        public Builder creditExpiryWeeks(int weeks) { this.creditExpiryWeeks = weeks; return this; }
        public Builder failureMode(FailureMode failureMode) { this.failureMode = Objects.requireNonNull(failureMode, "failureMode"); return this; }
        public Builder emissionSchedule(EmissionSchedule schedule) { this.emissionSchedule = Objects.requireNonNull(schedule, "emissionSchedule"); return this; }

        /**
         * Validates and freezes the parameters.
         *
         * @return the immutable parameters
         * @throws IllegalArgumentException naming the first invalid value
         */
        public SimulationParameters build() {
            if (numHolders < 0) throw new IllegalArgumentException("num-holders must be >= 0, got " + numHolders);
            if (numProposals < 0) throw new IllegalArgumentException("num-proposals must be >= 0, got " + numProposals);
            requireUnitInterval("burn-rate", burnRate);
            requireUnitInterval("success-rate", successRate);
            requireUnitInterval("initial-participation-rate", initialParticipationRate);
            if (!(deployProbability >= 0) || Double.isInfinite(deployProbability)) {
                throw new IllegalArgumentException("deploy-probability must be >= 0, got " + deployProbability);
            }
            if (fundingTargetMin <= 0) {
                throw new IllegalArgumentException("funding-target-min must be positive, got " + fundingTargetMin);
            }
            if (fundingTargetMax < fundingTargetMin) {
                throw new IllegalArgumentException("funding-target-max (" + fundingTargetMax
                        + ") must be >= funding-target-min (" + fundingTargetMin + ")");
            }
            if (!(yieldThresholdMean > 0) || Double.isInfinite(yieldThresholdMean)) {
                throw new IllegalArgumentException("yield-threshold-mean must be positive, got " + yieldThresholdMean);
            }
            if (creditExpiryWeeks < 1) {
                throw new IllegalArgumentException("credit-expiry-weeks must be >= 1, got " + creditExpiryWeeks);
            }
            return new SimulationParameters(this, resolveMix());
        }

        private Map<Archetype, Double> resolveMix() {
            if (archetypeMix.isEmpty()) {
                throw new IllegalArgumentException("archetype-mix must name at least one archetype. Available: " + Archetype.ids());
            }
            Map<Archetype, Double> byArchetype = new EnumMap<>(Archetype.class);
            double sum = 0.0;
            for (Map.Entry<String, Double> entry : archetypeMix.entrySet()) {
                Archetype archetype = Archetype.fromId(entry.getKey());
                Double fraction = entry.getValue();
                if (fraction == null || !(fraction >= 0) || Double.isInfinite(fraction)) {
                    throw new IllegalArgumentException("Archetype mix fraction for '" + entry.getKey() + "' must be >= 0, got " + fraction);
                }
                byArchetype.put(archetype, fraction);
                sum += fraction;
            }
            // Declaration order regardless of input order
            Map<Archetype, Double> resolved = new LinkedHashMap<>(byArchetype);
            if (Math.abs(sum - 1.0) > MIX_TOLERANCE) {
                LOG.warn("Archetype mix fractions sum to {} instead of 1.0; the last archetype absorbs the difference", sum);
            }
            return resolved;
        }

        private static void requireUnitInterval(String name, double value) {
            if (!(value >= 0.0 && value <= 1.0)) {
                throw new IllegalArgumentException(name + " must be within [0, 1], got " + value);
            }
        }
    }
}
