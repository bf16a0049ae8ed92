package org.endowsim.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.endowsim.runtime.api.ReferenceData;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "reference",
    description = "Print archetype definitions, time-weight tiers and default parameters as JSON"
)
public class ReferenceCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final Map<String, Object> reference = new LinkedHashMap<>();
        reference.put("archetypes", ReferenceData.archetypes());
        reference.put("multiplierTiers", ReferenceData.multiplierTiers());
        reference.put("defaultParameters", ReferenceData.defaultParameters());
        reference.put("defaultArchetypeMix", ReferenceData.defaultArchetypeMix());

        final Gson gson = new GsonBuilder().setPrettyPrinting().create();
        spec.commandLine().getOut().println(gson.toJson(reference));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
