package org.endowsim.runtime.api;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ReferenceDataTest {

    @Test
    void describesAllArchetypes() {
        assertThat(ReferenceData.archetypes())
            .extracting(ReferenceData.ArchetypeDefinition::id)
            .containsExactly("believer", "yield_seeker", "institution", "speculator");
        assertThat(ReferenceData.archetypes().get(2).rscRange().max()).isEqualTo(1_000_000.0);
    }

    @Test
    void describesTiersInDurationOrder() {
        assertThat(ReferenceData.multiplierTiers())
            .extracting(ReferenceData.TierDefinition::label)
            .containsExactly("New", "Holder", "LongTerm");
        assertThat(ReferenceData.multiplierTiers().get(2).maxWeeks()).isNull();
    }

    @Test
    void defaultParametersIncludeEmissionConstants() {
        ParameterSummary defaults = ReferenceData.defaultParameters();

        assertThat(defaults.numHolders()).isEqualTo(100);
        assertThat(defaults.failureMode()).isEqualTo("nothing");
        assertThat(defaults.year0Emission()).isEqualTo(9_500_000.0);
        assertThat(defaults.year0Circulating()).isEqualTo(134_157_343.0);
        assertThat(defaults.archetypeMix()).containsEntry("yield_seeker", 0.35);
        assertThat(ReferenceData.defaultArchetypeMix().values().stream().mapToDouble(Double::doubleValue).sum())
            .isCloseTo(1.0, within(1e-12));
    }
}
