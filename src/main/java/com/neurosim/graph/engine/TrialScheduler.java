package com.neurosim.graph.engine;

import com.neurosim.graph.api.ExecutionId;
import com.neurosim.graph.api.ExecutionResult;
import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.NodeRole;
import com.neurosim.graph.api.PortId;
import com.neurosim.graph.api.SchedulerListener;
import com.neurosim.graph.api.ShapeMismatchException;
import com.neurosim.graph.api.TimeScale;
import com.neurosim.graph.api.TrialExecutionException;
import com.neurosim.graph.api.TrialResult;
import com.neurosim.graph.condition.Condition;
import com.neurosim.graph.node.Mechanism;
import com.neurosim.graph.node.MechanismState;
import com.neurosim.graph.node.Projection;
import com.neurosim.graph.util.Arrays2D;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives trials over the consideration queue of a {@link Composition}.
 *
 * Per trial:
 * 1. Start: reset pass counters, reinitialize mechanisms whose
 * reinitialize condition holds, notify listeners.
 * 2. Passes: while the trial termination condition is not met, walk the
 * queue once. Each consideration set becomes one time step in which every
 * node whose condition holds fires exactly once. Sets where no node fires
 * are skipped without consuming a time step.
 * 3. Visibility: a firing writes its outputs to a pending buffer; buffers are
 * committed when the time step ends. Nodes of one set therefore never see
 * each other's new outputs, while later sets see them within the same pass.
 * 4. Termination is checked before each pass and before each time step.
 *
 * Fail fast: an exception from a node aborts the trial. The context is
 * rolled back to its state at trial start and the failure is rethrown as a
 * {@link TrialExecutionException} carrying the trials completed before it.
 */
final class TrialScheduler {
    private static final Logger log = LogManager.getLogger(TrialScheduler.class);

    private final Composition composition;
    private final MechanismExecutor executor;
    private final SchedulerListener listener;
    private final int maxPassesPerTrial;

    TrialScheduler(Composition composition, MechanismExecutor executor, SchedulerListener listener,
            int maxPassesPerTrial) {
        this.composition = composition;
        this.executor = executor;
        this.listener = listener;
        this.maxPassesPerTrial = maxPassesPerTrial;
    }

    RunResult run(ExecutionContext ctx, RunRequest request) {
        ConsiderationQueue queue = composition.considerationQueue();
        Set<NodeId> terminals = composition.nodesByRole(NodeRole.TERMINAL);
        Condition runTermination = request.termination(TimeScale.RUN);
        int numTrials = request.numTrials();

        ctx.clockState().startRun(queue.nodes());
        List<TrialResult> results = new ArrayList<>(numTrials);
        try {
            for (int t = 0; t < numTrials; t++) {
                if (runTermination.isSatisfied(null, ctx.clock())) {
                    log.debug("Run termination met before trial {} of context {}", t, ctx.id());
                    break;
                }
                ExecutionContext.Snapshot snapshot = ctx.snapshot();
                try {
                    results.add(runTrial(ctx, t, queue, terminals, request));
                } catch (RuntimeException e) {
                    ctx.restore(snapshot);
                    log.error("Trial {} of context {} failed, state rolled back: {}", t, ctx.id(), e.getMessage());
                    throw new TrialExecutionException(t, results, e);
                }
            }
        } finally {
            ctx.clockState().endRun();
        }
        return new RunResult(ctx.id(), results);
    }

    private TrialResult runTrial(ExecutionContext ctx, int trialInRun, ConsiderationQueue queue,
            Set<NodeId> terminals, RunRequest request) {
        final ExecutionId id = ctx.id();
        final ClockState clock = ctx.clockState();
        final Condition termination = request.termination(TimeScale.TRIAL);

        clock.startTrial();
        reinitializeWhereDue(ctx, queue);
        listener.onTrialStart(id, clock);
        request.beforeTrial().call(id, clock);

        int passes = 0;
        boolean terminated = false;
        while (!terminated && !termination.isSatisfied(null, clock)) {
            if (passes >= maxPassesPerTrial) {
                log.warn("Trial {} of context {} reached {} passes without meeting its termination condition",
                        clock.time(TimeScale.TRIAL), id, maxPassesPerTrial);
                break;
            }
            clock.startPass();
            listener.onPassStart(id, clock);
            request.beforePass().call(id, clock);

            for (Set<NodeId> set : queue.asList()) {
                if (termination.isSatisfied(null, clock)) {
                    terminated = true;
                    break;
                }
                // Conditions of one set are evaluated together, before any member fires.
                List<NodeId> eligible = new ArrayList<>(set.size());
                for (NodeId node : set) {
                    if (composition.conditionOf(node).isSatisfied(node, clock))
                        eligible.add(node);
                }
                if (eligible.isEmpty())
                    continue;

                clock.startTimeStep();
                listener.onTimeStepStart(id, clock);
                request.beforeTimeStep().call(id, clock);

                for (NodeId node : eligible)
                    fire(ctx, node, trialInRun, request);
                for (NodeId node : eligible)
                    ctx.state(node, composition.mechanism(node)).commitOutputs();

                listener.onTimeStepEnd(id, clock);
                request.afterTimeStep().call(id, clock);
                clock.endTimeStep();
            }

            listener.onPassEnd(id, clock);
            request.afterPass().call(id, clock);
            clock.endPass();
            passes++;
            log.debug("Context {} trial {} pass {} done", id, clock.time(TimeScale.TRIAL), passes - 1);
        }

        Map<NodeId, double[][]> outputs = new LinkedHashMap<>();
        for (NodeId node : terminals)
            outputs.put(node, Arrays2D.copy(ctx.state(node, composition.mechanism(node)).publishedOutputs()));
        TrialResult result = new TrialResult(trialInRun, passes, outputs);

        listener.onTrialEnd(id, clock);
        request.afterTrial().call(id, clock);
        clock.endTrial();
        return result;
    }

    private void fire(ExecutionContext ctx, NodeId node, int trialInRun, RunRequest request) {
        final ClockState clock = ctx.clockState();
        Mechanism m = composition.mechanism(node);
        MechanismState state = ctx.state(node, m);
        long start = System.nanoTime();
        ExecutionResult result;
        try {
            Afferents afferents = afferentsOf(ctx, node, m, request.inputFor(node, trialInRun));
            result = executor.execute(m, state, afferents, request.runtimeParams(node));
        } catch (RuntimeException e) {
            listener.onNodeError(ctx.id(), clock, node, e);
            throw e;
        }
        listener.onNodeExecuted(ctx.id(), clock, node, result, System.nanoTime() - start);
        clock.recordCall(node, result.converged());
    }

    /**
     * Reads the published outputs of the senders in this context, applies
     * the matrices and appends the external input.
     */
    private Afferents afferentsOf(ExecutionContext ctx, NodeId node, Mechanism m, double[][] external) {
        if (external != null && external.length != m.getInputPorts().size())
            throw new ShapeMismatchException(node + " has " + m.getInputPorts().size()
                    + " input ports but its input has " + external.length + " rows");
        return new Afferents() {
            @Override
            public List<double[]> inputContributions(int inputPort) {
                List<double[]> out = new ArrayList<>();
                int size = m.getInputPorts().get(inputPort).size();
                for (Projection p : composition.afferentsOf(PortId.input(node, inputPort)))
                    out.add(p.matrix().apply(senderOutput(ctx, p), size));
                if (external != null)
                    out.add(external[inputPort].clone());
                return out;
            }

            @Override
            public List<ModulatorySignal> modulatorySignals(int parameterPort) {
                List<ModulatorySignal> out = new ArrayList<>();
                for (Projection p : composition.afferentsOf(PortId.parameter(node, parameterPort))) {
                    double[] signal = senderOutput(ctx, p);
                    if (signal.length != 1)
                        throw new ShapeMismatchException("Modulatory signal " + p + " must have one element, got "
                                + signal.length);
                    out.add(new ModulatorySignal(signal[0], p.operator()));
                }
                return out;
            }
        };
    }

    private double[] senderOutput(ExecutionContext ctx, Projection p) {
        NodeId sender = p.sender().node();
        return ctx.state(sender, composition.mechanism(sender)).publishedOutputs()[p.sender().index()];
    }

    private void reinitializeWhereDue(ExecutionContext ctx, ConsiderationQueue queue) {
        for (NodeId node : queue.nodes()) {
            Mechanism m = composition.mechanism(node);
            Condition when = m.getReinitializeWhen();
            if (when != null && when.isSatisfied(node, ctx.clock())) {
                executor.reinitialize(m, ctx.state(node, m), null);
                log.debug("Reinitialized {} at trial {} of context {}", node, ctx.clock().time(TimeScale.TRIAL),
                        ctx.id());
            }
        }
    }
}
