package org.calista.neuro.ai.action;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

@Tag("unit")
class RewardShaperTest {

    private final RewardShaper shaper = new RewardShaper();

    @Test
    void goodMoodShouldAmplifyGainsAndSoftenPenalties() {
        assertThat(shaper.shape(0.5, 0.9)).isCloseTo(0.6, offset(1e-9));
        assertThat(shaper.shape(-0.5, 0.9)).isCloseTo(-0.4, offset(1e-9));
    }

    @Test
    void badMoodShouldDampenGainsAndDeepenPenalties() {
        assertThat(shaper.shape(0.5, 0.1)).isCloseTo(0.35, offset(1e-9));
        assertThat(shaper.shape(-0.5, 0.1)).isCloseTo(-0.65, offset(1e-9));
    }

    @Test
    void neutralMoodShouldLeaveRewardUnchanged() {
        assertThat(shaper.shape(0.5, 0.5)).isEqualTo(0.5);
        assertThat(shaper.shape(0.0, 0.9)).isZero();
    }

    @Test
    void constructor_shouldRejectInvertedBands() {
        assertThatThrownBy(() -> new RewardShaper(0.3, 0.7)).isInstanceOf(IllegalArgumentException.class);
    }
}
