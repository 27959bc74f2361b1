package com.neurosim.graph.condition;

import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.TimeScale;

import java.util.List;
import java.util.Objects;

/**
 * Factory for the standard conditions.
 *
 * Pass and trial numbers are zero-based. "After N" conditions are
 * inclusive of N completed units, which makes {@code afterNPasses(1)} the
 * usual "one pass per trial" termination.
 */
public final class Conditions {
    private Conditions() {
        // Utility class
    }

    private static final Condition ALWAYS = (owner, clock) -> true;
    private static final Condition NEVER = (owner, clock) -> false;

    public static Condition always() {
        return ALWAYS;
    }

    public static Condition never() {
        return NEVER;
    }

    // --- Time based ---

    public static Condition atPass(int n) {
        return (owner, clock) -> clock.time(TimeScale.PASS) == n;
    }

    /** Strictly after pass n (pass > n). */
    public static Condition afterPass(int n) {
        return (owner, clock) -> clock.time(TimeScale.PASS) > n;
    }

    /** At least n passes of the current trial have completed. */
    public static Condition afterNPasses(int n) {
        return (owner, clock) -> clock.time(TimeScale.PASS) >= n;
    }

    public static Condition everyNPasses(int n) {
        requirePositive(n);
        return (owner, clock) -> clock.time(TimeScale.PASS) % n == 0;
    }

    public static Condition atTrial(int n) {
        return (owner, clock) -> clock.time(TimeScale.TRIAL) == n;
    }

    /** At least n trials have completed on the context. */
    public static Condition afterNTrials(int n) {
        return (owner, clock) -> clock.time(TimeScale.TRIAL) >= n;
    }

    // --- Call counts ---

    /**
     * Satisfied once {@code dependency} has fired n times since the owner
     * last fired.
     */
    public static Condition everyNCalls(NodeId dependency, int n) {
        requirePositive(n);
        Objects.requireNonNull(dependency, "dependency");
        return (owner, clock) -> clock.callsSinceLastRun(owner, dependency) >= n;
    }

    /** {@code dependency} fired at least n times within the current trial. */
    public static Condition afterNCalls(NodeId dependency, int n) {
        return afterNCalls(dependency, n, TimeScale.TRIAL);
    }

    public static Condition afterNCalls(NodeId dependency, int n, TimeScale scale) {
        Objects.requireNonNull(dependency, "dependency");
        return (owner, clock) -> clock.calls(dependency, scale) >= n;
    }

    public static Condition atNCalls(NodeId dependency, int n) {
        Objects.requireNonNull(dependency, "dependency");
        return (owner, clock) -> clock.calls(dependency, TimeScale.TRIAL) == n;
    }

    public static Condition beforeNCalls(NodeId dependency, int n) {
        Objects.requireNonNull(dependency, "dependency");
        return (owner, clock) -> clock.calls(dependency, TimeScale.TRIAL) < n;
    }

    /** Every scheduled node fired at least once within the current trial. */
    public static Condition allHaveRun() {
        return allHaveRun(TimeScale.TRIAL);
    }

    public static Condition allHaveRun(TimeScale scale) {
        return (owner, clock) -> {
            for (NodeId node : clock.nodes()) {
                if (clock.calls(node, scale) == 0)
                    return false;
            }
            return true;
        };
    }

    // --- Convergence ---

    public static Condition whenFinished(NodeId node) {
        Objects.requireNonNull(node, "node");
        return (owner, clock) -> clock.isFinished(node);
    }

    public static Condition whenFinishedAny(NodeId... nodes) {
        List<NodeId> list = List.of(nodes);
        return (owner, clock) -> {
            for (NodeId node : list) {
                if (clock.isFinished(node))
                    return true;
            }
            return false;
        };
    }

    public static Condition whenFinishedAll(NodeId... nodes) {
        List<NodeId> list = List.of(nodes);
        return (owner, clock) -> {
            for (NodeId node : list) {
                if (!clock.isFinished(node))
                    return false;
            }
            return true;
        };
    }

    // --- Composites ---

    public static Condition any(Condition... conditions) {
        List<Condition> list = List.of(conditions);
        return (owner, clock) -> {
            for (Condition c : list) {
                if (c.isSatisfied(owner, clock))
                    return true;
            }
            return false;
        };
    }

    public static Condition all(Condition... conditions) {
        List<Condition> list = List.of(conditions);
        return (owner, clock) -> {
            for (Condition c : list) {
                if (!c.isSatisfied(owner, clock))
                    return false;
            }
            return true;
        };
    }

    public static Condition not(Condition condition) {
        Objects.requireNonNull(condition, "condition");
        return (owner, clock) -> !condition.isSatisfied(owner, clock);
    }

    private static void requirePositive(int n) {
        if (n < 1)
            throw new IllegalArgumentException("n must be >= 1, got " + n);
    }
}
