package org.endowsim.runtime.model;

import org.endowsim.runtime.config.SimulationParameters;
import org.endowsim.runtime.internal.services.SeededRandomProvider;
import org.endowsim.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@Tag("unit")
class HolderTest {

    private static final HolderTraits NEUTRAL = new HolderTraits(0.2, 0.5, 1.0, 0.0);

    private HolderContext context;
    private IRandomProvider random;

    @BeforeEach
    void setUp() {
        context = mock(HolderContext.class);
        random = mock(IRandomProvider.class);
        when(context.random()).thenReturn(random);
        when(context.parameters()).thenReturn(SimulationParameters.defaults());
    }

    private static MarketSnapshot snapshot(long step, double weeklyEmission, double totalEffectiveRsc, double apy) {
        return new MarketSnapshot(step, weeklyEmission * 52, weeklyEmission, totalEffectiveRsc, totalEffectiveRsc, apy);
    }

    @Test
    void earnsTimeWeightedShareOfWeeklyEmission() {
        Holder newHolder = new Holder(1, null, NEUTRAL, 1_000, 0.05, 0);
        Holder longTermHolder = new Holder(2, null, NEUTRAL, 1_000, 0.05, 60);
        MarketSnapshot market = snapshot(1, 520.0, 10_000.0, 0.1);

        double earnedNew = newHolder.earnYield(market, false);
        double earnedLongTerm = longTermHolder.earnYield(market, false);

        assertThat(earnedNew).isCloseTo(52.0, within(1e-9));
        assertThat(earnedLongTerm).isCloseTo(52.0 * 1.2, within(1e-9));
        assertThat(newHolder.getCredits()).isEqualTo(earnedNew);
        assertThat(newHolder.getWeeklyRate()).isEqualTo(earnedNew);
        assertThat(newHolder.getTotalYieldEarned()).isEqualTo(earnedNew);
    }

    @Test
    void earnsNothingWhenNobodyHoldsRsc() {
        Holder holder = new Holder(1, null, NEUTRAL, 0, 0.05, 0);
        assertThat(holder.earnYield(snapshot(1, 520.0, 0.0, 0.0), false)).isZero();
        assertThat(holder.getCredits()).isZero();
    }

    /**
     * Burn never exceeds a tenth of current holdings, whatever the requested amount.
     */
    @Test
    void burnIsCappedAtTenPercentOfHoldingsForEveryAmount() {
        when(context.parameters()).thenReturn(SimulationParameters.builder().burnRate(1.0).build());
        Proposal proposal = new Proposal(1, 1_000_000, 0);

        for (int amount = 1; amount <= 100; amount++) {
            Holder holder = new Holder(1, null, NEUTRAL, 1_000, 0.05, 0);
            holder.earnYield(snapshot(1, 100.0, 1_000.0, 0.1), false);
            double rscBefore = holder.getRscHeld();

            double burned = holder.deploy(context, proposal, amount);

            assertThat(burned).isLessThanOrEqualTo(rscBefore * 0.10 + 1e-9);
            assertThat(burned).isCloseTo(Math.min(rscBefore * amount / 100.0, rscBefore * 0.10), within(1e-9));
            assertThat(holder.getRscHeld()).isCloseTo(rscBefore - burned, within(1e-9));
            assertThat(holder.getCredits()).isCloseTo(100.0 - amount, within(1e-9));
        }
    }

    @Test
    void deployClampsToAvailableCreditsAndReportsToContext() {
        Holder holder = new Holder(3, null, NEUTRAL, 1_000, 0.05, 0);
        holder.earnYield(snapshot(1, 40.0, 1_000.0, 0.1), false);
        Proposal proposal = new Proposal(9, 5_000, 0);

        double burned = holder.deploy(context, proposal, 500.0);

        ArgumentCaptor<Double> credits = ArgumentCaptor.forClass(Double.class);
        verify(context).recordDeployment(eq(holder), eq(proposal), credits.capture(), eq(burned));
        assertThat(credits.getValue()).isCloseTo(40.0, within(1e-9));
        assertThat(holder.getCredits()).isZero();
        assertThat(holder.getTotalDeployed()).isCloseTo(40.0, within(1e-9));
        assertThat(holder.getDeploymentsCount()).isEqualTo(1);
        // full balance at burn-rate 0.02
        assertThat(burned).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void deployWithoutCreditsDoesNothing() {
        Holder holder = new Holder(3, null, NEUTRAL, 1_000, 0.05, 0);

        assertThat(holder.deploy(context, new Proposal(1, 10, 0), 5.0)).isZero();
        verify(context, never()).recordDeployment(any(), any(), anyDouble(), anyDouble());
        assertThat(holder.getRscHeld()).isEqualTo(1_000.0);
    }

    @Test
    void exitProbabilityFollowsYieldGap() {
        Holder holder = Holder.custom(1, new HolderTraits(0.5, 0.5, 1.0, 0.0), 1_000, 0.10);

        assertThat(holder.exitProbability(0.10)).isZero();
        assertThat(holder.exitProbability(0.20)).isZero();
        assertThat(holder.exitProbability(0.0)).isCloseTo(0.15, within(1e-12));
        assertThat(holder.exitProbability(0.05)).isCloseTo(0.075, within(1e-12));

        Holder patient = Holder.custom(2, new HolderTraits(0.5, 0.5, 1.0, 1.0), 1_000, 0.10);
        assertThat(patient.exitProbability(0.0)).isCloseTo(0.15 * 0.2, within(1e-12));
    }

    @Test
    void exitedHolderIgnoresFurtherSteps() {
        Holder holder = Holder.custom(1, new HolderTraits(0.5, 0.5, 1.0, 0.0), 1_000, 0.10);
        when(random.nextDouble()).thenReturn(0.0);

        assertThat(holder.considerExit(0.01, random)).isTrue();
        assertThat(holder.isActive()).isFalse();

        HolderContext untouched = mock(HolderContext.class);
        holder.step(untouched);
        verifyNoInteractions(untouched);
        assertThat(holder.getWeeksHeld()).isZero();
    }

    @Test
    void stepAgesEarnsAndStaysIdleWhenNotDeploying() {
        Holder holder = new Holder(5, null, NEUTRAL, 1_000, 0.05, 3);
        when(context.snapshot()).thenReturn(snapshot(1, 520.0, 10_000.0, 0.2));
        when(random.nextDouble()).thenReturn(0.99);

        holder.step(context);

        assertThat(holder.getWeeksHeld()).isEqualTo(4);
        assertThat(holder.getTier()).isEqualTo(TimeWeightTier.HOLDER);
        // share is computed with the multiplier after ageing
        assertThat(holder.getCredits()).isCloseTo(520.0 * 1_150.0 / 10_000.0, within(1e-9));
        assertThat(holder.getConsecutiveIdleSteps()).isEqualTo(1);
        assertThat(holder.isActive()).isTrue();
        verify(context, never()).recordDeployment(any(), any(), anyDouble(), anyDouble());
    }

    @Test
    void soleHolderCrossingTierBoundaryEarnsExactlyTheWeeklyEmission() {
        Holder holder = new Holder(5, null, NEUTRAL, 1_000, 0.05, 3);
        assertThat(holder.getEffectiveRsc()).isCloseTo(1_000.0, within(1e-9));
        assertThat(holder.getNextStepEffectiveRsc()).isCloseTo(1_150.0, within(1e-9));

        when(context.snapshot()).thenReturn(snapshot(1, 520.0, holder.getNextStepEffectiveRsc(), 0.2));
        when(random.nextDouble()).thenReturn(0.99);

        holder.step(context);

        assertThat(holder.getWeeklyRate()).isCloseTo(520.0, within(1e-9));
    }

    @Test
    void missionAlignedHolderPrefersNearlyFundedProposal() {
        Holder holder = Holder.custom(1, new HolderTraits(1.0, 0.5, 0.5, 0.5), 1_000, 0.05);
        Proposal barelyFunded = new Proposal(1, 100, 0);
        barelyFunded.receiveCredits(2, 10.0, 0);
        Proposal nearlyFunded = new Proposal(2, 100, 0);
        nearlyFunded.receiveCredits(2, 90.0, 0);
        when(random.nextDouble()).thenReturn(0.5);

        assertThat(holder.selectProposal(List.of(barelyFunded, nearlyFunded), random)).isSameAs(nearlyFunded);
        assertThat(holder.selectProposal(List.of(), random)).isNull();
    }

    @Test
    void deployProbabilityScalesWithSettingAndIsCapped() {
        Holder holder = new Holder(1, null, NEUTRAL, 1_000, 0.05, 0);
        assertThat(holder.deployProbability(0.3)).isZero();

        holder.earnYield(snapshot(1, 100.0, 1_000.0, 0.1), false);
        double reference = holder.deployProbability(0.3);

        assertThat(reference).isPositive();
        assertThat(holder.deployProbability(0.15)).isCloseTo(reference / 2, within(1e-12));
        assertThat(holder.deployProbability(0.0)).isZero();
        assertThat(holder.deployProbability(30.0)).isEqualTo(0.95);
    }

    @Test
    void creditsExpireAfterWindow() {
        Holder holder = new Holder(1, null, NEUTRAL, 1_000, 0.05, 0);
        holder.earnYield(snapshot(1, 100.0, 1_000.0, 0.1), true);
        holder.earnYield(snapshot(5, 100.0, 1_000.0, 0.1), true);

        assertThat(holder.expireCredits(9, 8)).isZero();
        double expired = holder.expireCredits(10, 8);

        assertThat(expired).isCloseTo(100.0, within(1e-9));
        assertThat(holder.getCredits()).isCloseTo(100.0, within(1e-9));
        assertThat(holder.getTotalExpired()).isCloseTo(100.0, within(1e-9));
        assertThat(holder.getCreditBatches()).containsExactly(new CreditBatch(5, 100.0));
    }

    @Test
    void refundAddsCreditsAndFreshBatch() {
        Holder holder = new Holder(1, null, NEUTRAL, 1_000, 0.05, 0);

        holder.receiveRefund(12.5, 7, true);
        holder.receiveRefund(-3.0, 7, true);

        assertThat(holder.getCredits()).isEqualTo(12.5);
        assertThat(holder.getTotalRefunded()).isEqualTo(12.5);
        assertThat(holder.getCreditBatches()).containsExactly(new CreditBatch(7, 12.5));
    }

    @Test
    void institutionsStartWithHistoryAndThresholdIsFloored() {
        IRandomProvider seeded = new SeededRandomProvider(3L);
        for (int id = 1; id <= 100; id++) {
            Holder institution = Holder.fromArchetype(id, Archetype.INSTITUTION, 0.08, seeded);
            assertThat(institution.getWeeksHeld()).isBetween(0, 52);
            assertThat(institution.getYieldThreshold()).isGreaterThanOrEqualTo(0.01);
            assertThat(institution.getArchetypeId()).isEqualTo("institution");

            Holder seeker = Holder.fromArchetype(id, Archetype.YIELD_SEEKER, 0.08, seeded);
            assertThat(seeker.getWeeksHeld()).isZero();
            assertThat(seeker.getInitialRsc()).isEqualTo(seeker.getRscHeld());
        }
        assertThat(Holder.custom(1, NEUTRAL, 10, 0.05).getArchetypeId()).isEqualTo(Archetype.CUSTOM_ID);
    }
}
