package org.archipel.runner;

import org.archipel.evolution.ConfigurationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RunOptionsTest {

    @Test
    void splitEvenly_givesEarlierChunksTheRemainder() {
        assertThat(RunOptions.splitEvenly(List.of(1, 2, 3, 4, 5, 6, 7), 3))
            .containsExactly(List.of(1, 2, 3), List.of(4, 5), List.of(6, 7));
        assertThat(RunOptions.splitEvenly(List.of(1), 2)).containsExactly(List.of(1), List.of());
        assertThat(RunOptions.splitEvenly(List.of(1, 2, 3, 4), 2)).containsExactly(List.of(1, 2), List.of(3, 4));
    }

    @Test
    void resolveGroups_defaultsToEvenSplit() {
        assertThat(RunOptions.local().resolveGroups(5, 2)).containsExactly(List.of(0, 1, 2), List.of(3, 4));
    }

    @Test
    void resolveGroups_acceptsExplicitPartition() {
        RunOptions options = RunOptions.local().withPopulationGroups(List.of(List.of(2), List.of(0, 1)));

        assertThat(options.resolveGroups(3, 2)).containsExactly(List.of(2), List.of(0, 1));
    }

    @Test
    void resolveGroups_rejectsDuplicatesAndWrongGroupCount() {
        RunOptions duplicate = RunOptions.local().withPopulationGroups(List.of(List.of(0, 1), List.of(1)));
        RunOptions tooMany = RunOptions.local().withPopulationGroups(List.of(List.of(0), List.of(1), List.of()));

        assertThatThrownBy(() -> duplicate.resolveGroups(2, 2)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> tooMany.resolveGroups(2, 2))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("one per node");
    }
}
