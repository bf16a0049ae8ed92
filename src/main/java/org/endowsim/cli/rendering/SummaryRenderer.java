package org.endowsim.cli.rendering;

import org.endowsim.runtime.Simulation;
import org.endowsim.runtime.api.ArchetypeMetrics;
import org.endowsim.runtime.api.ModelMetrics;
import org.endowsim.runtime.api.ParticipationData;
import org.endowsim.runtime.api.TierDistribution;
import org.endowsim.runtime.model.SimulationEvent;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a plain-text report of a simulation's current state.
 * <p>
 * Sections: headline economics, holders, proposals, credit flows, per-archetype behaviour,
 * the time-weight tier distribution, reference APYs and the most recent events.
 */
public class SummaryRenderer {

    private final PrintWriter out;

    /**
     * @param out destination of the report
     */
    public SummaryRenderer(PrintWriter out) {
        this.out = out;
    }

    /**
     * Writes the report.
     *
     * @param simulation the simulation to describe
     * @param eventLimit how many of the newest events to include
     */
    public void render(Simulation simulation, int eventLimit) {
        ModelMetrics metrics = simulation.getMetrics();

        out.println("=== Endowment Simulation Summary ===");
        printf("Seed: %d, Step: %d (year %.2f)%n", simulation.getSeed(), metrics.step(), metrics.year());
        printf("Participation: %.2f%%, APY: %.2f%%%n", metrics.participationRate() * 100, metrics.currentApy() * 100);
        printf("RSC held: %,.0f of %,.0f circulating%n", metrics.totalRscHeld(), metrics.circulatingSupply());
        printf("Emission: %,.0f/year, %,.0f/week%n", metrics.annualEmission(), metrics.weeklyEmission());

        out.println();
        out.println("=== Holders ===");
        printf("Total: %d, Active: %d, Exited: %d%n", metrics.numHolders(), metrics.activeHolders(), metrics.exitedHolders());

        out.println();
        out.println("=== Proposals ===");
        printf("Total: %d, Open: %d, Funded: %d, Completed: %d, Failed: %d%n",
                metrics.numProposals(), metrics.openProposals(), metrics.fundedProposals(),
                metrics.completedProposals(), metrics.failedProposals());
        printf("Actual success rate: %.1f%%%n", metrics.successRateActual() * 100);

        out.println();
        out.println("=== Credits ===");
        printf("Generated: %,.0f, Deployed: %,.0f (%,.1f/week), Held: %,.0f%n",
                metrics.totalCreditsGenerated(), metrics.totalCreditsDeployed(), metrics.deploymentRate(), metrics.totalCredits());
        printf("RSC burned: %,.2f%n", metrics.totalBurned());

        renderArchetypes(simulation.getArchetypeMetrics());
        renderTiers(metrics.multiplierDistribution());
        renderParticipation(simulation.getParticipationData());
        renderEvents(simulation.getEvents(eventLimit));
        out.flush();
    }

    private void renderArchetypes(Map<String, ArchetypeMetrics> archetypes) {
        if (archetypes.isEmpty()) {
            return;
        }
        out.println();
        out.println("=== Archetypes ===");
        archetypes.forEach((id, m) -> printf(
                "  %-13s active %3d/%-3d avg RSC %,10.0f  avg weeks %5.1f  deployed %,10.0f  burned %,8.2f%n",
                id, m.active(), m.total(), m.avgRsc(), m.avgWeeksHeld(), m.totalDeployed(), m.totalBurned()));
    }

    private void renderTiers(Map<String, TierDistribution> tiers) {
        out.println();
        out.println("=== Time-Weight Tiers ===");
        tiers.forEach((label, tier) -> printf("  %-9s %.2fx  holders %3d  RSC %,12.0f%n",
                label, tier.multiplier(), tier.count(), tier.rsc()));
    }

    private void renderParticipation(ParticipationData participation) {
        out.println();
        out.println("=== APY at Reference Participation ===");
        participation.scenarios().forEach((label, apy) -> printf("  %-6s %.2f%%%n", label, apy * 100));
    }

    private void renderEvents(List<SimulationEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        out.println();
        out.println("=== Recent Events ===");
        for (SimulationEvent event : events) {
            printf("  [%4d] %-12s %s%n", event.step(), event.type().name(), event.message());
        }
    }

    private void printf(String format, Object... args) {
        out.printf(Locale.ROOT, format, args);
    }
}
