package org.archipel.migration;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TopologiesTest {

    @Test
    void ring() {
        assertThat(Topologies.adjacency(Topologies.RING, 3)).isEqualTo(Map.of(
            0, List.of(1), 1, List.of(2), 2, List.of(0)));
        assertThat(Topologies.adjacency(Topologies.RING, 5)).isEqualTo(Map.of(
            0, List.of(1), 1, List.of(2), 2, List.of(3), 3, List.of(4), 4, List.of(0)));
    }

    @Test
    void mesh2d_withIncompleteLastRow() {
        assertThat(Topologies.adjacency(Topologies.MESH_2D, 3)).isEqualTo(Map.of(
            0, List.of(1, 2), 1, List.of(0), 2, List.of(0)));
        assertThat(Topologies.adjacency(Topologies.MESH_2D, 4)).isEqualTo(Map.of(
            0, List.of(1, 2), 1, List.of(0, 3), 2, List.of(0, 3), 3, List.of(1, 2)));
        assertThat(Topologies.adjacency(Topologies.MESH_2D, 8)).isEqualTo(Map.of(
            0, List.of(1, 3),
            1, List.of(0, 2, 4),
            2, List.of(1, 5),
            3, List.of(0, 4, 6),
            4, List.of(1, 3, 5, 7),
            5, List.of(2, 4),
            6, List.of(3, 7),
            7, List.of(4, 6)));
    }

    @Test
    void mesh3d() {
        Map<Integer, List<Integer>> cube = Topologies.adjacency(Topologies.MESH_3D, 8);
        assertThat(cube.get(0)).containsExactly(1, 2, 4);
        assertThat(cube.get(7)).containsExactly(3, 5, 6);

        Map<Integer, List<Integer>> partial = Topologies.adjacency(Topologies.MESH_3D, 5);
        assertThat(partial.get(1)).containsExactly(0, 3);
        assertThat(partial.get(4)).containsExactly(0);
    }

    @Test
    void fullyConnected() {
        assertThat(Topologies.FULLY_CONNECTED.neighbours(1, 0)).isEmpty();
        assertThat(Topologies.adjacency(Topologies.FULLY_CONNECTED, 4)).isEqualTo(Map.of(
            0, List.of(1, 2, 3), 1, List.of(0, 2, 3), 2, List.of(0, 1, 3), 3, List.of(0, 1, 2)));
    }

    @Test
    void star() {
        assertThat(Topologies.adjacency(Topologies.STAR, 4)).isEqualTo(Map.of(
            0, List.of(1, 2, 3), 1, List.of(0), 2, List.of(0), 3, List.of(0)));
    }

    @Test
    void byName_resolvesBuiltInsAndRejectsUnknown() {
        assertThat(Topologies.byName("Ring")).isSameAs(Topologies.RING);
        assertThat(Topologies.byName("fully_connected")).isSameAs(Topologies.FULLY_CONNECTED);
        assertThatThrownBy(() -> Topologies.byName("torus"))
            .isInstanceOf(InvalidTopologyException.class)
            .hasMessageContaining("torus");
    }

    @Test
    void fromMap_usesGivenAdjacency() {
        ITopology topology = Topologies.fromMap(Map.of(0, List.of(1, 2), 1, List.of(), 2, List.of(0)));

        assertThat(topology.neighbours(3, 0)).containsExactly(1, 2);
        assertThat(topology.neighbours(3, 1)).isEmpty();
        assertThatThrownBy(() -> topology.neighbours(4, 0)).isInstanceOf(InvalidTopologyException.class);
    }

    @Test
    void fromMap_rejectsMissingKeys() {
        assertThatThrownBy(() -> Topologies.fromMap(Map.of(0, List.of(2), 2, List.of(0))))
            .isInstanceOf(InvalidTopologyException.class)
            .hasMessageContaining("keys 0..1");
    }

    @Test
    void fromMap_rejectsNeighboursOutOfRange() {
        assertThatThrownBy(() -> Topologies.fromMap(Map.of(0, List.of(1), 1, List.of(5))))
            .isInstanceOf(InvalidTopologyException.class)
            .hasMessageContaining("range 0..1");
    }
}
