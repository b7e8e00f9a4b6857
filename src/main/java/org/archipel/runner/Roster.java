package org.archipel.runner;

import java.io.Serializable;
import java.util.List;

/**
 * The ordered addresses of all population workers of a run. Position {@code i} holds the
 * worker of population {@code i}; topologies index into this list.
 *
 * @param runId     The run the roster belongs to.
 * @param addresses The worker addresses by population index.
 */
public record Roster(String runId, List<WorkerAddress> addresses) implements Serializable {

    public Roster {
        addresses = List.copyOf(addresses);
        for (int i = 0; i < addresses.size(); i++) {
            if (addresses.get(i).index() != i) {
                throw new IllegalArgumentException(String.format(
                    "roster position %d holds worker %s", i, addresses.get(i)));
            }
        }
    }

    public int size() {
        return addresses.size();
    }

    public WorkerAddress get(int index) {
        return addresses.get(index);
    }
}
