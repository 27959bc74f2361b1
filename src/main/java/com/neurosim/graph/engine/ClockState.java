package com.neurosim.graph.engine;

import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.TimeScale;
import com.neurosim.graph.condition.SchedulingClock;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable scheduling counters of one execution context.
 */
final class ClockState implements SchedulingClock {
    private final EnumMap<TimeScale, Integer> time = new EnumMap<>(TimeScale.class);
    // calls[node][scale.ordinal()] within the current unit of each scale
    private final Map<NodeId, int[]> calls = new HashMap<>();
    // Firing ticks per node within the current run, for "calls since last run"
    private final Map<NodeId, FiringLog> firings = new HashMap<>();
    private final Map<NodeId, Long> lastFired = new HashMap<>();
    private long tick;
    private final Set<NodeId> finished = new HashSet<>();
    private Set<NodeId> nodes = Collections.emptySet();

    ClockState() {
        for (TimeScale s : TimeScale.values())
            time.put(s, 0);
    }

    ClockState copy() {
        ClockState c = new ClockState();
        c.time.putAll(time);
        for (var e : calls.entrySet())
            c.calls.put(e.getKey(), e.getValue().clone());
        for (var e : firings.entrySet())
            c.firings.put(e.getKey(), e.getValue().copy());
        c.lastFired.putAll(lastFired);
        c.tick = tick;
        c.finished.addAll(finished);
        c.nodes = nodes;
        return c;
    }

    void startRun(Set<NodeId> scheduled) {
        nodes = Collections.unmodifiableSet(new LinkedHashSet<>(scheduled));
        resetCalls(TimeScale.RUN);
        firings.clear();
        lastFired.clear();
    }

    void endRun() {
        advance(TimeScale.RUN);
    }

    void startTrial() {
        time.put(TimeScale.PASS, 0);
        time.put(TimeScale.TIME_STEP, 0);
        resetCalls(TimeScale.TRIAL);
    }

    void endTrial() {
        advance(TimeScale.TRIAL);
    }

    void startPass() {
        time.put(TimeScale.TIME_STEP, 0);
        resetCalls(TimeScale.PASS);
    }

    void endPass() {
        advance(TimeScale.PASS);
    }

    void startTimeStep() {
        resetCalls(TimeScale.TIME_STEP);
    }

    void endTimeStep() {
        advance(TimeScale.TIME_STEP);
    }

    void recordCall(NodeId node, boolean nodeFinished) {
        int[] c = calls.computeIfAbsent(node, k -> new int[TimeScale.values().length]);
        for (int i = 0; i < c.length; i++)
            c[i]++;
        tick++;
        firings.computeIfAbsent(node, k -> new FiringLog()).append(tick);
        lastFired.put(node, tick);
        if (nodeFinished)
            finished.add(node);
        else
            finished.remove(node);
    }

    void forget(NodeId node) {
        calls.remove(node);
        firings.remove(node);
        lastFired.remove(node);
        finished.remove(node);
    }

    private void advance(TimeScale scale) {
        time.merge(scale, 1, Integer::sum);
    }

    private void resetCalls(TimeScale scale) {
        for (int[] c : calls.values())
            c[scale.ordinal()] = 0;
    }

    @Override
    public int time(TimeScale scale) {
        return time.get(scale);
    }

    @Override
    public int calls(NodeId node, TimeScale scale) {
        int[] c = calls.get(node);
        return c == null ? 0 : c[scale.ordinal()];
    }

    @Override
    public int callsSinceLastRun(NodeId owner, NodeId dependency) {
        FiringLog log = firings.get(dependency);
        if (log == null)
            return 0;
        Long since = owner == null ? null : lastFired.get(owner);
        return since == null ? log.size : log.countAfter(since);
    }

    @Override
    public boolean isFinished(NodeId node) {
        return finished.contains(node);
    }

    @Override
    public Set<NodeId> nodes() {
        return nodes;
    }

    @Override
    public String toString() {
        return "trial=" + time(TimeScale.TRIAL) + " pass=" + time(TimeScale.PASS) + " step="
                + time(TimeScale.TIME_STEP);
    }

    /**
     * Ascending firing ticks of one node. Copies share the backing array until
     * one of them appends behind the other's end.
     */
    private static final class FiringLog {
        private Ticks ticks;
        private int size;

        FiringLog() {
            this(new Ticks(new long[8]), 0);
        }

        private FiringLog(Ticks ticks, int size) {
            this.ticks = ticks;
            this.size = size;
        }

        FiringLog copy() {
            return new FiringLog(ticks, size);
        }

        void append(long t) {
            if (size != ticks.length || size == ticks.data.length)
                ticks = new Ticks(Arrays.copyOf(ticks.data, Math.max(8, size * 2)));
            ticks.data[size++] = t;
            ticks.length = size;
        }

        int countAfter(long t) {
            int lo = 0;
            int hi = size;
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (ticks.data[mid] <= t)
                    lo = mid + 1;
                else
                    hi = mid;
            }
            return size - lo;
        }
    }

    private static final class Ticks {
        final long[] data;
        int length;

        Ticks(long[] data) {
            this.data = data;
        }
    }
}
