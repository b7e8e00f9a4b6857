package org.archipel.migration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Built-in topologies. All indices are 0-based.
 */
public final class Topologies {

    /**
     * Unidirectional ring: the only neighbour is {@code (selfIndex + 1) mod n}.
     */
    public static final ITopology RING = (n, self) -> List.of((self + 1) % n);

    /**
     * Square grid of side {@code ceil(sqrt(n))}, filled row by row. Neighbours are the
     * existing cells above, below, left and right.
     */
    public static final ITopology MESH_2D = Topologies::mesh2d;

    /**
     * Cubic grid of side {@code ceil(cbrt(n))}. Neighbours are the four in-plane cells plus
     * the cells at the same position in the adjacent layers.
     */
    public static final ITopology MESH_3D = Topologies::mesh3d;

    /**
     * Every population is connected to every other one.
     */
    public static final ITopology FULLY_CONNECTED = (n, self) -> {
        List<Integer> neighbours = new ArrayList<>(n - 1);
        for (int i = 0; i < n; i++) {
            if (i != self) {
                neighbours.add(i);
            }
        }
        return neighbours;
    };

    /**
     * Population 0 is the hub connected to all others, which only see the hub.
     */
    public static final ITopology STAR = (n, self) -> {
        if (self != 0) {
            return List.of(0);
        }
        List<Integer> neighbours = new ArrayList<>(n - 1);
        for (int i = 1; i < n; i++) {
            neighbours.add(i);
        }
        return neighbours;
    };

    private Topologies() {
    }

    /**
     * Resolves a built-in topology by its configuration name: {@code ring}, {@code mesh2d},
     * {@code mesh3d}, {@code fully_connected} or {@code star}.
     *
     * @throws InvalidTopologyException for an unknown name.
     */
    public static ITopology byName(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "ring" -> RING;
            case "mesh2d" -> MESH_2D;
            case "mesh3d" -> MESH_3D;
            case "fully_connected" -> FULLY_CONNECTED;
            case "star" -> STAR;
            default -> throw new InvalidTopologyException(String.format(
                "unknown topology '%s', expected one of: ring, mesh2d, mesh3d, fully_connected, star", name));
        };
    }

    /**
     * Builds a topology from an explicit adjacency map.
     *
     * @param adjacency Neighbour indices per population index; keys must be exactly
     *                  {@code 0..n-1}.
     * @return A topology valid only for {@code n} populations.
     * @throws InvalidTopologyException if the keys or neighbour indices are out of range.
     */
    public static ITopology fromMap(Map<Integer, List<Integer>> adjacency) {
        int n = adjacency.size();
        for (int i = 0; i < n; i++) {
            if (!adjacency.containsKey(i)) {
                throw new InvalidTopologyException(String.format(
                    "expected the topology map to have keys 0..%d, got: %s", n - 1, new TreeSet<>(adjacency.keySet())));
            }
        }
        Map<Integer, List<Integer>> copy = new HashMap<>();
        for (Map.Entry<Integer, List<Integer>> entry : adjacency.entrySet()) {
            for (Integer neighbour : entry.getValue()) {
                if (neighbour == null || neighbour < 0 || neighbour >= n) {
                    throw new InvalidTopologyException(String.format(
                        "expected neighbours of %d to be in range 0..%d, got: %s", entry.getKey(), n - 1, entry.getValue()));
                }
            }
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        return (numPopulations, self) -> {
            if (numPopulations != n) {
                throw new InvalidTopologyException(String.format(
                    "topology is defined for %d populations, but got %d", n, numPopulations));
            }
            return copy.get(self);
        };
    }

    /**
     * Evaluates a topology for every index, mainly for inspection and logging.
     */
    public static Map<Integer, List<Integer>> adjacency(ITopology topology, int numPopulations) {
        Map<Integer, List<Integer>> map = new LinkedHashMap<>();
        for (int i = 0; i < numPopulations; i++) {
            map.put(i, topology.neighbours(numPopulations, i));
        }
        return Collections.unmodifiableMap(map);
    }

    private static List<Integer> mesh2d(int n, int self) {
        int side = ceilRoot(n, 2);
        int row = self / side;
        int col = self % side;
        TreeSet<Integer> neighbours = new TreeSet<>();
        addIfPresent(neighbours, n, row > 0, self - side);
        addIfPresent(neighbours, n, row < side - 1, self + side);
        addIfPresent(neighbours, n, col > 0, self - 1);
        addIfPresent(neighbours, n, col < side - 1, self + 1);
        return new ArrayList<>(neighbours);
    }

    private static List<Integer> mesh3d(int n, int self) {
        int side = ceilRoot(n, 3);
        int plane = side * side;
        int layer = self / plane;
        int row = (self % plane) / side;
        int col = self % side;
        TreeSet<Integer> neighbours = new TreeSet<>();
        addIfPresent(neighbours, n, row > 0, self - side);
        addIfPresent(neighbours, n, row < side - 1, self + side);
        addIfPresent(neighbours, n, col > 0, self - 1);
        addIfPresent(neighbours, n, col < side - 1, self + 1);
        addIfPresent(neighbours, n, layer > 0, self - plane);
        addIfPresent(neighbours, n, layer < side - 1, self + plane);
        return new ArrayList<>(neighbours);
    }

    private static void addIfPresent(TreeSet<Integer> neighbours, int n, boolean inGrid, int index) {
        if (inGrid && index < n) {
            neighbours.add(index);
        }
    }

    // Smallest s with s^dimensions >= n, computed on integers.
    private static int ceilRoot(int n, int dimensions) {
        int side = 1;
        while (Math.pow(side, dimensions) < n) {
            side++;
        }
        return side;
    }
}
