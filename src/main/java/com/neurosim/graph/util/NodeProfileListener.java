package com.neurosim.graph.util;

import com.neurosim.graph.api.ExecutionId;
import com.neurosim.graph.api.ExecutionResult;
import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.SchedulerListener;
import com.neurosim.graph.condition.SchedulingClock;

import java.util.Arrays;

/** Aggregates firing statistics per node: counts, iterations, timings, errors. */
public class NodeProfileListener implements SchedulerListener {

    public static class NodeStats {
        public final String name;
        public long count;
        public long iterations;
        public long unconverged;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;

        public NodeStats(String name) {
            this.name = name;
        }

        void update(ExecutionResult result, long duration) {
            count++;
            iterations += result.iterationsUsed();
            if (!result.converged())
                unconverged++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }

        public double avgIterations() {
            return count == 0 ? 0 : iterations / (double) count;
        }
    }

    // Flat array indexed by NodeId.index(). Eliminates Map hashing overhead.
    private NodeStats[] statsArray = new NodeStats[0];

    /** @return Read-only snapshot of stats array. */
    public NodeStats[] getStatsArray() {
        return statsArray;
    }

    /** Stats of one node, or {@code null} if it never fired or failed. */
    public NodeStats statsOf(NodeId node) {
        return node.index() < statsArray.length ? statsArray[node.index()] : null;
    }

    private NodeStats slot(NodeId node) {
        int idx = node.index();
        if (idx >= statsArray.length) {
            NodeStats[] newArr = new NodeStats[Math.max(idx + 1, statsArray.length * 2)];
            System.arraycopy(statsArray, 0, newArr, 0, statsArray.length);
            statsArray = newArr;
        }
        if (statsArray[idx] == null)
            statsArray[idx] = new NodeStats(node.name());
        return statsArray[idx];
    }

    @Override
    public void onNodeExecuted(ExecutionId id, SchedulingClock clock, NodeId node, ExecutionResult result,
            long durationNanos) {
        slot(node).update(result, durationNanos);
    }

    @Override
    public void onNodeError(ExecutionId id, SchedulingClock clock, NodeId node, Throwable error) {
        slot(node).errors++;
    }

    @Override
    public void onTrialStart(ExecutionId id, SchedulingClock clock) {
        // No-op
    }

    @Override
    public void onPassStart(ExecutionId id, SchedulingClock clock) {
        // No-op
    }

    @Override
    public void onTimeStepStart(ExecutionId id, SchedulingClock clock) {
        // No-op
    }

    @Override
    public void onTimeStepEnd(ExecutionId id, SchedulingClock clock) {
        // No-op
    }

    @Override
    public void onPassEnd(ExecutionId id, SchedulingClock clock) {
        // No-op
    }

    @Override
    public void onTrialEnd(ExecutionId id, SchedulingClock clock) {
        // No-op
    }

    /** Resets all collected statistics. */
    public void reset() {
        for (int i = 0; i < statsArray.length; i++) {
            if (statsArray[i] != null)
                statsArray[i] = new NodeStats(statsArray[i].name);
        }
    }

    /**
     * Returns a formatted table of node statistics, most expensive first.
     */
    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %8s | %10s | %8s | %10s | %10s | %10s%n", "Node Name", "Count",
                "Avg iters", "Unconv", "Avg (us)", "Min (us)", "Max (us)"));
        sb.append(
                "------------------------------------------------------------------------------------------------------\n");

        NodeStats[] validStats = Arrays.stream(statsArray)
                .filter(s -> s != null && s.count > 0)
                .toArray(NodeStats[]::new);

        Arrays.sort(validStats, (s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));

        for (NodeStats s : validStats) {
            sb.append(String.format("%-30s | %8d | %10.2f | %8d | %10.2f | %10.2f | %10.2f%n",
                    truncate(s.name, 30),
                    s.count,
                    s.avgIterations(),
                    s.unconverged,
                    s.avgMicros(),
                    s.minDurationNanos / 1000.0,
                    s.maxDurationNanos / 1000.0));
        }
        return sb.toString();
    }

    private String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
