package org.endowsim.runtime.api;

import org.endowsim.runtime.config.SimulationParameters;
import org.endowsim.runtime.model.Archetype;
import org.endowsim.runtime.model.TimeWeightTier;
import org.endowsim.runtime.model.TraitRange;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Static reference data, independent of any running simulation.
 */
public final class ReferenceData {

    private ReferenceData() {}

    /**
     * Serializable description of an archetype.
     */
    public record ArchetypeDefinition(
            String id,
            String name,
            String description,
            TraitRange missionAlignment,
            TraitRange engagement,
            TraitRange priceSensitivity,
            TraitRange holdHorizon,
            TraitRange rscRange,
            double yieldThresholdOffset
    ) {
        static ArchetypeDefinition of(Archetype a) {
            return new ArchetypeDefinition(a.id(), a.displayName(), a.description(), a.missionAlignment(),
                    a.engagement(), a.priceSensitivity(), a.holdHorizon(), a.rscRange(), a.yieldThresholdOffset());
        }
    }

    /**
     * Serializable description of a time-weight tier. {@code maxWeeks} is null for the last tier.
     */
    public record TierDefinition(String label, Integer maxWeeks, double multiplier, String description) {
        static TierDefinition of(TimeWeightTier t) {
            return new TierDefinition(t.label(), t.maxWeeks(), t.multiplier(), t.description());
        }
    }

    public static List<ArchetypeDefinition> archetypes() {
        return Arrays.stream(Archetype.values()).map(ArchetypeDefinition::of).collect(Collectors.toUnmodifiableList());
    }

    public static List<TierDefinition> multiplierTiers() {
        return Arrays.stream(TimeWeightTier.values()).map(TierDefinition::of).collect(Collectors.toUnmodifiableList());
    }

    /**
     * @return default run parameters, including the emission constants
     */
    public static ParameterSummary defaultParameters() {
        return ParameterSummary.of(SimulationParameters.defaults());
    }

    public static Map<String, Double> defaultArchetypeMix() {
        return SimulationParameters.defaultArchetypeMix();
    }
}
