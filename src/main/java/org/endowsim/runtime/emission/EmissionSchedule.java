package org.endowsim.runtime.emission;

import org.endowsim.runtime.Config;

/**
 * Time-decaying token issuance: {@code E(t) = year0Emission / 2^(t_years / halfLifeYears)} RSC per
 * year, paid out weekly. Pure and deterministic; callable for any step index.
 * <p>
 * Circulating supply is genesis supply plus the running sum of weekly emissions kept by the
 * simulation. It is deliberately not derived by integrating the decay curve, so the supply always
 * matches exactly what was handed out step by step.
 * </p>
 */
public final class EmissionSchedule {

    public static final double DEFAULT_YEAR0_EMISSION = 9_500_000;
    public static final double DEFAULT_HALF_LIFE_YEARS = 64;
    public static final double DEFAULT_YEAR0_CIRCULATING = 134_157_343;
    public static final double DEFAULT_TOTAL_SUPPLY = 1_000_000_000;

    private static final EmissionSchedule DEFAULTS = new EmissionSchedule(
            DEFAULT_YEAR0_EMISSION, DEFAULT_HALF_LIFE_YEARS, DEFAULT_YEAR0_CIRCULATING, DEFAULT_TOTAL_SUPPLY);

    private final double year0Emission;
    private final double halfLifeYears;
    private final double year0Circulating;
    private final double totalSupply;

    /**
     * Creates an emission schedule.
     *
     * @param year0Emission RSC emitted per year at genesis
     * @param halfLifeYears years after which the annual emission halves
     * @param year0Circulating RSC in circulation at genesis
     * @param totalSupply hard cap, informational only
     */
    public EmissionSchedule(double year0Emission, double halfLifeYears, double year0Circulating, double totalSupply) {
        requirePositive("year0-emission", year0Emission);
        requirePositive("half-life-years", halfLifeYears);
        if (!(year0Circulating >= 0)) {
            throw new IllegalArgumentException("year0-circulating must be >= 0, got " + year0Circulating);
        }
        requirePositive("total-supply", totalSupply);
        this.year0Emission = year0Emission;
        this.halfLifeYears = halfLifeYears;
        this.year0Circulating = year0Circulating;
        this.totalSupply = totalSupply;
    }

    /**
     * Config-based constructor reading the {@code endowment.emission} block.
     * @param config Configuration object containing the emission constants.
     */
    public EmissionSchedule(com.typesafe.config.Config config) {
        this(
            config.getDouble("year0-emission"),
            config.getDouble("half-life-years"),
            config.getDouble("year0-circulating"),
            config.getDouble("total-supply")
        );
    }

    /**
     * @return the schedule with the documented genesis constants
     */
    public static EmissionSchedule defaults() {
        return DEFAULTS;
    }

    /**
     * @param step elapsed weekly steps
     * @return elapsed time in years
     */
    public static double yearsElapsed(long step) {
        return step / (double) Config.WEEKS_PER_YEAR;
    }

    /**
     * @param step elapsed weekly steps
     * @return instantaneous annualized emission rate
     */
    public double annualEmission(long step) {
        return year0Emission / Math.pow(2.0, yearsElapsed(step) / halfLifeYears);
    }

    /**
     * @param step elapsed weekly steps
     * @return emission paid out in one week at that step
     */
    public double weeklyEmission(long step) {
        return annualEmission(step) / Config.WEEKS_PER_YEAR;
    }

    /**
     * @param cumulativeEmissions running sum of weekly emissions since genesis
     * @return circulating supply
     */
    public double circulatingSupply(double cumulativeEmissions) {
        return year0Circulating + cumulativeEmissions;
    }

    public double getYear0Emission() { return year0Emission; }
    public double getHalfLifeYears() { return halfLifeYears; }
    public double getYear0Circulating() { return year0Circulating; }
    public double getTotalSupply() { return totalSupply; }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive finite number, got " + value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmissionSchedule)) return false;
        EmissionSchedule that = (EmissionSchedule) o;
        return Double.compare(year0Emission, that.year0Emission) == 0
                && Double.compare(halfLifeYears, that.halfLifeYears) == 0
                && Double.compare(year0Circulating, that.year0Circulating) == 0
                && Double.compare(totalSupply, that.totalSupply) == 0;
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(year0Emission, halfLifeYears, year0Circulating, totalSupply);
    }

    @Override
    public String toString() {
        return "EmissionSchedule{year0Emission=" + year0Emission + ", halfLifeYears=" + halfLifeYears
                + ", year0Circulating=" + year0Circulating + ", totalSupply=" + totalSupply + "}";
    }
}
