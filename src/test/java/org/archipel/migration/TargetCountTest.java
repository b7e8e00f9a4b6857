package org.archipel.migration;

import org.archipel.evolution.ConfigurationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TargetCountTest {

    @Test
    void draw_staysWithinInclusiveRange() {
        TargetCount range = TargetCount.range(1, 3);
        Random random = new Random(42);

        for (int i = 0; i < 200; i++) {
            assertThat(range.draw(random)).isBetween(1, 3);
        }
        assertThat(TargetCount.exactly(2).draw(random)).isEqualTo(2);
    }

    @Test
    void rejectsInvalidBounds() {
        assertThatThrownBy(() -> TargetCount.range(3, 1)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> TargetCount.exactly(-1)).isInstanceOf(ConfigurationException.class);
    }
}
