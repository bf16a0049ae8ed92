package org.endowsim.runtime.model;

import org.endowsim.runtime.internal.services.SeededRandomProvider;
import org.endowsim.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ArchetypeTest {

    @Test
    void resolvesConfigurationIds() {
        assertThat(Archetype.fromId("yield_seeker")).isEqualTo(Archetype.YIELD_SEEKER);
        assertThat(Archetype.ids()).containsExactly("believer", "yield_seeker", "institution", "speculator");
    }

    @Test
    void unknownIdNamesAvailableIds() {
        assertThatThrownBy(() -> Archetype.fromId("whale"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("whale")
            .hasMessageContaining("believer");
    }

    /**
     * Sampled traits and holdings must stay inside the archetype's ranges.
     */
    @ParameterizedTest
    @EnumSource(Archetype.class)
    void sampledTraitsStayWithinRanges(Archetype archetype) {
        IRandomProvider random = new SeededRandomProvider(7L);
        for (int i = 0; i < 200; i++) {
            HolderTraits traits = HolderTraits.sample(archetype, random);
            assertThat(archetype.missionAlignment().contains(traits.missionAlignment())).isTrue();
            assertThat(archetype.engagement().contains(traits.engagement())).isTrue();
            assertThat(archetype.priceSensitivity().contains(traits.priceSensitivity())).isTrue();
            assertThat(archetype.holdHorizon().contains(traits.holdHorizon())).isTrue();
            assertThat(archetype.rscRange().contains(archetype.rscRange().sample(random))).isTrue();
        }
    }

    @Test
    void onlyInstitutionsStartWithHoldingHistory() {
        assertThat(Archetype.INSTITUTION.hasWarmStart()).isTrue();
        assertThat(Archetype.BELIEVER.hasWarmStart()).isFalse();
        assertThat(Archetype.SPECULATOR.hasWarmStart()).isFalse();
    }

    @Test
    void traitRangeRejectsInvertedBounds() {
        assertThatThrownBy(() -> new TraitRange(0.5, 0.1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void traitsOutsideUnitIntervalAreRejected() {
        assertThatThrownBy(() -> new HolderTraits(1.2, 0.5, 0.5, 0.5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
