package com.neurosim.graph.engine;

import com.neurosim.graph.api.ExecutionId;
import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.TimeScale;
import com.neurosim.graph.condition.Condition;
import com.neurosim.graph.condition.Conditions;
import com.neurosim.graph.condition.SchedulingClock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one call to {@link Composition#run(RunRequest)} needs: per-trial
 * inputs of the origin nodes, the number of trials, the execution context,
 * termination conditions, runtime parameter overrides and progress
 * callbacks.
 *
 * <pre>{@code
 * RunRequest request = RunRequest.builder()
 *         .input(a, new double[] { 1.0 })
 *         .numTrials(2)
 *         .build();
 * }</pre>
 */
public final class RunRequest {

    /** Progress callback. */
    @FunctionalInterface
    public interface Callback {
        void call(ExecutionId id, SchedulingClock clock);
    }

    private static final Callback NO_OP = (id, clock) -> {
    };

    private final Map<NodeId, List<double[][]>> inputs;
    private final int numTrials;
    private final ExecutionId executionId;
    private final Map<TimeScale, Condition> termination;
    private final Map<NodeId, Map<String, Double>> runtimeParams;
    private final Callback beforeTrial, afterTrial, beforePass, afterPass, beforeTimeStep, afterTimeStep;

    private RunRequest(Builder b) {
        Map<NodeId, List<double[][]>> in = new LinkedHashMap<>();
        for (var e : b.inputs.entrySet())
            in.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
        this.inputs = Collections.unmodifiableMap(in);
        this.numTrials = b.numTrials;
        this.executionId = b.executionId;
        this.termination = new EnumMap<>(b.termination);
        Map<NodeId, Map<String, Double>> rp = new LinkedHashMap<>();
        for (var e : b.runtimeParams.entrySet())
            rp.put(e.getKey(), Map.copyOf(e.getValue()));
        this.runtimeParams = Collections.unmodifiableMap(rp);
        this.beforeTrial = b.beforeTrial;
        this.afterTrial = b.afterTrial;
        this.beforePass = b.beforePass;
        this.afterPass = b.afterPass;
        this.beforeTimeStep = b.beforeTimeStep;
        this.afterTimeStep = b.afterTimeStep;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<NodeId, List<double[][]>> inputs() {
        return inputs;
    }

    /**
     * Input of a node for a trial. Trials beyond the supplied sequence reuse
     * the last entry.
     *
     * @return the rows, or {@code null} if the node gets no external input
     */
    public double[][] inputFor(NodeId node, int trial) {
        List<double[][]> seq = inputs.get(node);
        if (seq == null || seq.isEmpty())
            return null;
        return seq.get(Math.min(trial, seq.size() - 1));
    }

    /** Explicit trial count, or the longest input sequence (at least 1). */
    public int numTrials() {
        if (numTrials > 0)
            return numTrials;
        int n = 1;
        for (List<double[][]> seq : inputs.values())
            n = Math.max(n, seq.size());
        return n;
    }

    public ExecutionId executionId() {
        return executionId;
    }

    /**
     * Termination condition of a scale. Trials default to one pass; runs
     * default to never (the trial count bounds them).
     */
    public Condition termination(TimeScale scale) {
        Condition c = termination.get(scale);
        if (c != null)
            return c;
        return scale == TimeScale.TRIAL ? Conditions.afterNPasses(1) : Conditions.never();
    }

    public Map<NodeId, Map<String, Double>> runtimeParams() {
        return runtimeParams;
    }

    public Map<String, Double> runtimeParams(NodeId node) {
        return runtimeParams.get(node);
    }

    public Callback beforeTrial() {
        return beforeTrial;
    }

    public Callback afterTrial() {
        return afterTrial;
    }

    public Callback beforePass() {
        return beforePass;
    }

    public Callback afterPass() {
        return afterPass;
    }

    public Callback beforeTimeStep() {
        return beforeTimeStep;
    }

    public Callback afterTimeStep() {
        return afterTimeStep;
    }

    public static final class Builder {
        private final Map<NodeId, List<double[][]>> inputs = new LinkedHashMap<>();
        private int numTrials;
        private ExecutionId executionId = ExecutionId.DEFAULT;
        private final Map<TimeScale, Condition> termination = new EnumMap<>(TimeScale.class);
        private final Map<NodeId, Map<String, Double>> runtimeParams = new LinkedHashMap<>();
        private Callback beforeTrial = NO_OP, afterTrial = NO_OP, beforePass = NO_OP, afterPass = NO_OP,
                beforeTimeStep = NO_OP, afterTimeStep = NO_OP;

        private Builder() {
        }

        /** Per-trial inputs of a node with a single input port. */
        public Builder input(NodeId node, double[]... perTrial) {
            List<double[][]> seq = new ArrayList<>(perTrial.length);
            for (double[] row : perTrial)
                seq.add(new double[][] { row.clone() });
            inputs.put(Objects.requireNonNull(node, "node"), seq);
            return this;
        }

        /** Per-trial inputs of a node, one row per input port. */
        public Builder inputs(NodeId node, List<double[][]> perTrial) {
            List<double[][]> seq = new ArrayList<>(perTrial.size());
            for (double[][] rows : perTrial) {
                double[][] copy = new double[rows.length][];
                for (int i = 0; i < rows.length; i++)
                    copy[i] = rows[i].clone();
                seq.add(copy);
            }
            inputs.put(Objects.requireNonNull(node, "node"), seq);
            return this;
        }

        public Builder numTrials(int numTrials) {
            if (numTrials < 1)
                throw new IllegalArgumentException("numTrials must be >= 1, got " + numTrials);
            this.numTrials = numTrials;
            return this;
        }

        public Builder executionId(ExecutionId executionId) {
            this.executionId = Objects.requireNonNull(executionId, "executionId");
            return this;
        }

        /**
         * Sets the termination condition of the TRIAL or RUN scale.
         *
         * @throws IllegalArgumentException for the other scales
         */
        public Builder termination(TimeScale scale, Condition condition) {
            if (scale != TimeScale.TRIAL && scale != TimeScale.RUN)
                throw new IllegalArgumentException("Termination conditions apply to TRIAL or RUN, not " + scale);
            termination.put(scale, Objects.requireNonNull(condition, "condition"));
            return this;
        }

        /** Overrides base parameter values of a node for every firing in this run. */
        public Builder runtimeParams(NodeId node, Map<String, Double> params) {
            runtimeParams.put(Objects.requireNonNull(node, "node"), new LinkedHashMap<>(params));
            return this;
        }

        public Builder callBeforeTrial(Callback cb) {
            this.beforeTrial = Objects.requireNonNull(cb);
            return this;
        }

        public Builder callAfterTrial(Callback cb) {
            this.afterTrial = Objects.requireNonNull(cb);
            return this;
        }

        public Builder callBeforePass(Callback cb) {
            this.beforePass = Objects.requireNonNull(cb);
            return this;
        }

        public Builder callAfterPass(Callback cb) {
            this.afterPass = Objects.requireNonNull(cb);
            return this;
        }

        public Builder callBeforeTimeStep(Callback cb) {
            this.beforeTimeStep = Objects.requireNonNull(cb);
            return this;
        }

        public Builder callAfterTimeStep(Callback cb) {
            this.afterTimeStep = Objects.requireNonNull(cb);
            return this;
        }

        public RunRequest build() {
            return new RunRequest(this);
        }
    }
}
