package org.endowsim.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.endowsim.cli.CommandLineInterface;
import org.endowsim.cli.rendering.SummaryRenderer;
import org.endowsim.runtime.Simulation;
import org.endowsim.runtime.api.MetricsRow;
import org.endowsim.runtime.config.SimulationParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Run the endowment simulation for a number of weeks and print the outcome"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    @Option(
        names = {"-n", "--steps"},
        description = "Number of weekly steps to run (default: ${DEFAULT-VALUE})"
    )
    private int steps = org.endowsim.runtime.Config.WEEKS_PER_YEAR;

    @Option(
        names = {"-s", "--seed"},
        description = "Random seed, overrides endowment.simulation.seed"
    )
    private Long seed;

    @Option(
        names = {"--holders"},
        description = "Initial number of holders, overrides endowment.simulation.num-holders"
    )
    private Integer holders;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: summary, json (default: ${DEFAULT-VALUE})"
    )
    private String format = "summary";

    @Option(
        names = {"-e", "--events"},
        description = "Number of most recent events to print (default: ${DEFAULT-VALUE})"
    )
    private int eventLimit = 10;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final String outputFormat = format.toLowerCase(Locale.ROOT);
        if (!"summary".equals(outputFormat) && !"json".equals(outputFormat)) {
            err.println("Unknown format: " + format + ". Supported formats: summary, json");
            return 1;
        }
        if (steps < 0) {
            err.println("Number of steps must be >= 0, got " + steps);
            return 1;
        }

        final Simulation simulation;
        try {
            simulation = new Simulation(buildParameters(parent.getConfig()));
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        LOG.info("Running {} step(s) with {} holders, seed {}", steps, simulation.getHolders().size(), simulation.getSeed());
        for (int i = 0; i < steps; i++) {
            simulation.step();
            if (simulation.getStepCount() % org.endowsim.runtime.Config.WEEKS_PER_YEAR == 0) {
                logProgress(simulation);
            }
        }
        LOG.info("Finished after {} step(s): participation={}, apy={}",
            simulation.getStepCount(),
            String.format(Locale.ROOT, "%.4f", simulation.getParticipationRate()),
            String.format(Locale.ROOT, "%.4f", simulation.getCurrentApy()));

        if ("json".equals(outputFormat)) {
            final Gson gson = new GsonBuilder()
                .setPrettyPrinting()
                .serializeSpecialFloatingPointValues()
                .create();
            final JsonObject result = new JsonObject();
            result.add("state", gson.toJsonTree(simulation.getState()));
            result.add("events", gson.toJsonTree(simulation.getEvents(eventLimit)));
            out.println(gson.toJson(result));
        } else {
            new SummaryRenderer(out).render(simulation, eventLimit);
        }
        out.flush();
        return 0;
    }

    SimulationParameters buildParameters(final Config config) {
        final SimulationParameters.Builder builder = SimulationParameters.fromConfig(config).toBuilder();
        if (seed != null) {
            builder.seed(seed);
        }
        if (holders != null) {
            builder.numHolders(holders);
        }
        return builder.build();
    }

    private void logProgress(final Simulation simulation) {
        final MetricsRow row = simulation.getHistory().get(simulation.getHistory().size() - 1);
        LOG.info("Year {} complete: participation={}, apy={}, active holders={}, completed proposals={}",
            simulation.getStepCount() / org.endowsim.runtime.Config.WEEKS_PER_YEAR,
            String.format(Locale.ROOT, "%.4f", row.participationRate()),
            String.format(Locale.ROOT, "%.4f", row.currentApy()),
            row.activeHolders(),
            row.completedProposals());
    }
}
