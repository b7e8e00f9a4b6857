package org.archipel.node;

import org.archipel.runner.IReportSink;
import org.archipel.runner.LocalRun;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * The runs hosted by this node, and the report sinks of runs it coordinates.
 */
public class RunRegistry {

    private final ConcurrentMap<String, LocalRun> runs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, IReportSink> trackers = new ConcurrentHashMap<>();

    public void host(LocalRun run, IReportSink tracker) {
        if (runs.putIfAbsent(run.getRunId(), run) != null) {
            throw new IllegalStateException("run " + run.getRunId() + " is already hosted on this node");
        }
        if (tracker != null) {
            trackers.put(run.getRunId(), tracker);
        }
    }

    public Optional<LocalRun> run(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public Optional<IReportSink> tracker(String runId) {
        return Optional.ofNullable(trackers.get(runId));
    }

    public void release(String runId) {
        runs.remove(runId);
        trackers.remove(runId);
    }

    public int size() {
        return runs.size();
    }
}
