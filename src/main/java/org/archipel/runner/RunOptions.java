package org.archipel.runner;

import org.archipel.evolution.ConfigurationException;
import org.archipel.node.ModelSource;
import org.archipel.node.NodeId;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Placement options of a run.
 *
 * @param nodes            The nodes to run populations on; empty means this process only.
 * @param populationGroups The population indices per node, parallel to {@code nodes};
 *                         {@code null} splits the populations evenly in index order.
 * @param modelSource      How other nodes rebuild the model; required when a node other than
 *                         this process hosts populations.
 */
public record RunOptions(List<NodeId> nodes, List<List<Integer>> populationGroups, ModelSource modelSource) {

    public RunOptions {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        if (populationGroups != null) {
            List<List<Integer>> copy = new ArrayList<>(populationGroups.size());
            populationGroups.forEach(group -> copy.add(List.copyOf(group)));
            populationGroups = List.copyOf(copy);
        }
    }

    public static RunOptions local() {
        return new RunOptions(List.of(), null, null);
    }

    public static RunOptions distributed(List<NodeId> nodes, ModelSource modelSource) {
        return new RunOptions(nodes, null, modelSource);
    }

    public RunOptions withPopulationGroups(List<List<Integer>> groups) {
        return new RunOptions(nodes, groups, modelSource);
    }

    /**
     * Resolves the population indices per node.
     *
     * @param numPopulations The number of populations of the model.
     * @param nodeCount      The number of nodes taking part.
     * @return One group per node.
     * @throws ConfigurationException if explicit groups do not match the node count or do not
     *                                cover every population exactly once.
     */
    public List<List<Integer>> resolveGroups(int numPopulations, int nodeCount) {
        if (populationGroups == null) {
            List<Integer> indices = new ArrayList<>(numPopulations);
            for (int i = 0; i < numPopulations; i++) {
                indices.add(i);
            }
            return splitEvenly(indices, nodeCount);
        }
        if (populationGroups.size() != nodeCount) {
            throw new ConfigurationException(String.format(
                "expected %d population groups, one per node, got %d", nodeCount, populationGroups.size()));
        }
        BitSet seen = new BitSet(numPopulations);
        for (List<Integer> group : populationGroups) {
            for (Integer index : group) {
                if (index == null || index < 0 || index >= numPopulations || seen.get(index)) {
                    throw new ConfigurationException(String.format(
                        "population groups must cover indices 0..%d exactly once, got: %s", numPopulations - 1, populationGroups));
                }
                seen.set(index);
            }
        }
        if (seen.cardinality() != numPopulations) {
            throw new ConfigurationException(String.format(
                "population groups must cover indices 0..%d exactly once, got: %s", numPopulations - 1, populationGroups));
        }
        return populationGroups;
    }

    /**
     * Distributes items into {@code chunks} consecutive groups; earlier groups take
     * {@code ceil(remaining / remainingChunks)} items, so {@code [1..7]} into 3 chunks gives
     * {@code [[1,2,3],[4,5],[6,7]]} and {@code [1]} into 2 gives {@code [[1],[]]}.
     */
    public static <T> List<List<T>> splitEvenly(List<T> items, int chunks) {
        if (chunks < 1) {
            throw new IllegalArgumentException("number of chunks must be at least 1, got: " + chunks);
        }
        List<List<T>> groups = new ArrayList<>(chunks);
        int offset = 0;
        for (int remainingChunks = chunks; remainingChunks > 0; remainingChunks--) {
            int remaining = items.size() - offset;
            int size = (remaining + remainingChunks - 1) / remainingChunks;
            groups.add(List.copyOf(items.subList(offset, offset + size)));
            offset += size;
        }
        return groups;
    }
}
