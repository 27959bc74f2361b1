package com.neurosim.graph.engine;

import com.neurosim.graph.api.ConfigurationException;
import com.neurosim.graph.api.ExecutionResult;
import com.neurosim.graph.api.ShapeMismatchException;
import com.neurosim.graph.fn.ModulationOperator;
import com.neurosim.graph.fn.ParameterValues;
import com.neurosim.graph.node.ExecutionPhase;
import com.neurosim.graph.node.InputPort;
import com.neurosim.graph.node.Mechanism;
import com.neurosim.graph.node.MechanismState;
import com.neurosim.graph.node.OutputPort;
import com.neurosim.graph.node.ParameterPort;
import com.neurosim.graph.util.Arrays2D;
import com.neurosim.graph.util.ErrorRateLimiter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.log4j.Log4j2;

/**
 * Runs one firing of a mechanism against its state in one execution context.
 *
 * A firing walks the phases of {@link ExecutionPhase}:
 * 1. Aggregate: combine the contributions of each input port (default
 * variable if none).
 * 2. Modulate: base parameters, then runtime overrides, then modulatory
 * signals.
 * 3. Compute: stateless mechanisms add noise to the variable and apply the
 * function once. Stateful mechanisms feed the variable through the
 * integrator, then the function. Clipping applies to the final result.
 * 4. Check termination and repeat step 3 on the same variable until the
 * mechanism is finished or the iteration ceiling is hit. Mechanisms built
 * with {@code executeUntilFinished(false)} stop after one update.
 * 5. Publish: compute output-port values into the pending buffer.
 *
 * The executor holds no per-context data, so one instance serves every
 * context of a composition.
 */
@Log4j2
public final class MechanismExecutor {
    private final int defaultMaxExecutions;
    private final long warningThrottleMillis;
    private final Map<String, ErrorRateLimiter> ceilingWarnings = new ConcurrentHashMap<>();

    public MechanismExecutor(int defaultMaxExecutions, long warningThrottleMillis) {
        if (defaultMaxExecutions < 1)
            throw new ConfigurationException("Iteration ceiling must be >= 1, got " + defaultMaxExecutions);
        this.defaultMaxExecutions = defaultMaxExecutions;
        this.warningThrottleMillis = warningThrottleMillis;
    }

    /**
     * Fires the mechanism inside a trial. New outputs are left pending; the
     * caller commits them.
     *
     * @throws ShapeMismatchException if a contribution does not fit its port.
     */
    public ExecutionResult execute(Mechanism m, MechanismState s, Afferents afferents,
            Map<String, Double> runtimeParams) {
        try {
            s.setPhase(ExecutionPhase.AGGREGATING_INPUT);
            double[][] variable = aggregate(m, afferents);
            s.setVariable(variable);

            s.setPhase(ExecutionPhase.MODULATING_PARAMETERS);
            ParameterValues params = modulate(m, afferents, runtimeParams);
            s.setEffectiveParameters(params.asMap());

            return iterate(m, s, variable, params);
        } finally {
            s.setPhase(ExecutionPhase.IDLE);
        }
    }

    /**
     * Fires the mechanism on an explicit variable, outside any composition,
     * and publishes the outputs immediately. Runtime parameters apply to
     * this call only.
     */
    public ExecutionResult execute(Mechanism m, MechanismState s, double[][] variable,
            Map<String, Double> runtimeParams) {
        checkShape(m, variable);
        try {
            double[][] copy = new double[variable.length][];
            for (int r = 0; r < copy.length; r++)
                copy[r] = variable[r].clone();
            s.setVariable(copy);
            s.setPhase(ExecutionPhase.MODULATING_PARAMETERS);
            ParameterValues params = modulate(m, Afferents.NONE, runtimeParams);
            s.setEffectiveParameters(params.asMap());
            ExecutionResult result = iterate(m, s, copy, params);
            s.commitOutputs();
            return result;
        } finally {
            s.setPhase(ExecutionPhase.IDLE);
        }
    }

    /** Whether the mechanism's last firing in this state met its termination condition. */
    public boolean isFinished(MechanismState s) {
        return s.isFinished();
    }

    /**
     * Resets the integrator and the value, and republishes the outputs.
     *
     * @param value new integrator state and value; {@code null} restores the
     *              mechanism's initial value (stateful) or zeros (stateless)
     */
    public void reinitialize(Mechanism m, MechanismState s, double[][] value) {
        double[][] reset;
        if (value != null) {
            checkShape(m, value);
            reset = value;
        } else {
            reset = m.isIntegratorMode() ? m.initialValueCopy() : m.defaultValue();
        }
        s.reinitialize(reset, reset, publish(m, reset));
        s.commitOutputs();
        log.debug("{} reinitialized to {}", m.getName(), Arrays2D.toString(reset));
    }

    private ExecutionResult iterate(Mechanism m, MechanismState s, double[][] variable, ParameterValues params) {
        int ceiling = m.getMaxExecutionsBeforeFinished() > 0 ? m.getMaxExecutionsBeforeFinished()
                : defaultMaxExecutions;
        int iterations = 0;
        boolean converged;
        while (true) {
            s.setPreviousValue(Arrays2D.copy(s.value()));
            double[][] value = compute(m, s, variable, params);
            clip(m, value);
            s.setValue(value);
            iterations++;
            if (isFinished(m, s, params)) {
                converged = true;
                break;
            }
            if (!m.isExecuteUntilFinished()) {
                converged = false;
                break;
            }
            if (iterations >= ceiling) {
                converged = false;
                limiter(m).warn(m.getName() + " did not finish within " + ceiling
                        + " executions; keeping last value (measure " + s.terminationMeasureValue() + ")");
                break;
            }
        }
        if (converged && m.hasTerminationThreshold())
            log.debug("{} finished after {} iterations (measure {})", m.getName(), iterations,
                    s.terminationMeasureValue());

        s.setFinished(converged);
        s.setLastIterations(iterations);
        s.incrementExecutionCount();

        s.setPhase(ExecutionPhase.PUBLISHING_OUTPUT);
        double[][] outputs = publish(m, s.value());
        s.setPendingOutputs(outputs);
        return new ExecutionResult(Arrays2D.copy(s.value()), Arrays2D.copy(outputs),
                iterations, converged);
    }

    private double[][] aggregate(Mechanism m, Afferents afferents) {
        List<InputPort> ports = m.getInputPorts();
        double[][] variable = new double[ports.size()][];
        for (int p = 0; p < ports.size(); p++) {
            InputPort port = ports.get(p);
            List<double[]> contributions = afferents.inputContributions(p);
            if (contributions.isEmpty()) {
                variable[p] = port.defaultVariable().clone();
                continue;
            }
            for (double[] c : contributions) {
                if (c.length != port.size())
                    throw new ShapeMismatchException(m.getName() + "." + port.name() + " expects length "
                            + port.size() + " but received " + c.length);
            }
            variable[p] = port.combination().combine(contributions);
        }
        return variable;
    }

    private ParameterValues modulate(Mechanism m, Afferents afferents, Map<String, Double> runtimeParams) {
        Map<String, Double> values = new LinkedHashMap<>();
        List<ParameterPort> ports = m.getParameterPorts();
        for (int i = 0; i < ports.size(); i++) {
            ParameterPort port = ports.get(i);
            double base = port.baseValue();
            if (runtimeParams != null && runtimeParams.containsKey(port.name()))
                base = runtimeParams.get(port.name());
            values.put(port.name(), applySignals(base, afferents.modulatorySignals(i)));
        }
        if (runtimeParams != null) {
            for (String key : runtimeParams.keySet())
                if (!values.containsKey(key))
                    throw new ConfigurationException(m.getName() + " has no parameter " + key);
        }
        return ParameterValues.of(values);
    }

    private static double applySignals(double base, List<ModulatorySignal> signals) {
        if (signals.isEmpty())
            return base;
        Map<ModulationOperator, List<Double>> byOperator = new EnumMap<>(ModulationOperator.class);
        for (ModulatorySignal sig : signals)
            byOperator.computeIfAbsent(sig.operator(), k -> new ArrayList<>()).add(sig.value());
        double v = base;
        for (var e : byOperator.entrySet())
            v = e.getKey().modulate(v, e.getValue());
        return v;
    }

    private double[][] compute(Mechanism m, MechanismState s, double[][] variable, ParameterValues params) {
        double noise = params.get(Mechanism.NOISE);
        double[][] value = new double[variable.length][];
        if (!m.isIntegratorMode()) {
            s.setPhase(ExecutionPhase.COMPUTING);
            for (int r = 0; r < variable.length; r++) {
                double[] in = variable[r].clone();
                for (int i = 0; i < in.length; i++)
                    in[i] += noise + sample(m);
                value[r] = new double[in.length];
                m.getFunction().apply(in, value[r], params);
            }
            return value;
        }

        s.setPhase(ExecutionPhase.INTEGRATING);
        double rate = params.get(Mechanism.INTEGRATION_RATE);
        double[][] previous = s.integratorState();
        double[][] integrated = new double[variable.length][];
        for (int r = 0; r < variable.length; r++) {
            integrated[r] = new double[variable[r].length];
            for (int i = 0; i < variable[r].length; i++)
                integrated[r][i] = m.getIntegrator().integrate(variable[r][i], previous[r][i], rate,
                        noise + sample(m));
        }
        s.setIntegratorState(integrated);

        s.setPhase(ExecutionPhase.COMPUTING);
        for (int r = 0; r < integrated.length; r++) {
            value[r] = new double[integrated[r].length];
            m.getFunction().apply(integrated[r], value[r], params);
        }
        return value;
    }

    private static double sample(Mechanism m) {
        return m.getNoiseSource() == null ? 0.0 : m.getNoiseSource().sample();
    }

    private static void clip(Mechanism m, double[][] value) {
        if (!m.isClipped())
            return;
        for (double[] row : value)
            for (int i = 0; i < row.length; i++)
                row[i] = Math.max(m.getClipMin(), Math.min(m.getClipMax(), row[i]));
    }

    // Stateless mechanisms and mechanisms without a threshold finish after one update.
    private static boolean isFinished(Mechanism m, MechanismState s, ParameterValues params) {
        if (!m.isIntegratorMode() || !m.hasTerminationThreshold()) {
            s.setTerminationMeasureValue(Double.NaN);
            return true;
        }
        double status = m.getTerminationMeasure().measure(s.value(), s.previousValue());
        s.setTerminationMeasureValue(status);
        return m.getTerminationComparison().test(status, params.get(Mechanism.TERMINATION_THRESHOLD));
    }

    private static double[][] publish(Mechanism m, double[][] value) {
        List<OutputPort> ports = m.getOutputPorts();
        double[][] outputs = new double[ports.size()][];
        for (int k = 0; k < ports.size(); k++)
            outputs[k] = ports.get(k).compute(value);
        return outputs;
    }

    private static void checkShape(Mechanism m, double[][] variable) {
        int[] lengths = m.rowLengths();
        if (variable.length != lengths.length)
            throw new ShapeMismatchException(m.getName() + " expects " + lengths.length + " rows but received "
                    + variable.length);
        for (int r = 0; r < lengths.length; r++) {
            if (variable[r].length != lengths[r])
                throw new ShapeMismatchException(m.getName() + " row " + r + " expects length " + lengths[r]
                        + " but received " + variable[r].length);
        }
    }

    private ErrorRateLimiter limiter(Mechanism m) {
        return ceilingWarnings.computeIfAbsent(m.getName(), k -> new ErrorRateLimiter(log, warningThrottleMillis));
    }
}
