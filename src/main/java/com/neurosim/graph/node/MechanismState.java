package com.neurosim.graph.node;

import com.neurosim.graph.util.Arrays2D;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Run-time values of one mechanism in one execution context.
 *
 * New outputs are written to {@code pendingOutputs} and only become
 * {@code publishedOutputs}, the values other mechanisms read, when the
 * scheduler commits them at the end of a time step.
 */
public final class MechanismState {
    private double[][] variable;
    private double[][] value;
    private double[][] previousValue;
    private double[][] integratorState;
    private double[][] publishedOutputs;
    private double[][] pendingOutputs;
    private Map<String, Double> effectiveParameters;
    private boolean finished;
    private double terminationMeasureValue = Double.NaN;
    private int lastIterations;
    private long executionCount;
    private ExecutionPhase phase = ExecutionPhase.IDLE;

    private MechanismState() {
    }

    /** Fresh state: default variable, zero value and outputs, initial integrator state. */
    public static MechanismState initial(Mechanism m) {
        MechanismState s = new MechanismState();
        s.variable = m.defaultVariable();
        s.value = m.defaultValue();
        s.previousValue = m.defaultValue();
        s.integratorState = m.initialValueCopy();
        s.publishedOutputs = new double[m.getOutputPorts().size()][];
        for (int i = 0; i < s.publishedOutputs.length; i++)
            s.publishedOutputs[i] = new double[m.outputSize(i)];
        s.effectiveParameters = m.baseParameters();
        return s;
    }

    /** Deep copy, used for trial snapshots. */
    public MechanismState copy() {
        MechanismState s = new MechanismState();
        s.variable = Arrays2D.copy(variable);
        s.value = Arrays2D.copy(value);
        s.previousValue = Arrays2D.copy(previousValue);
        s.integratorState = Arrays2D.copy(integratorState);
        s.publishedOutputs = Arrays2D.copy(publishedOutputs);
        s.pendingOutputs = Arrays2D.copy(pendingOutputs);
        s.effectiveParameters = new LinkedHashMap<>(effectiveParameters);
        s.finished = finished;
        s.terminationMeasureValue = terminationMeasureValue;
        s.lastIterations = lastIterations;
        s.executionCount = executionCount;
        s.phase = phase;
        return s;
    }

    /** Makes pending outputs visible. No-op if nothing is pending. */
    public void commitOutputs() {
        if (pendingOutputs != null) {
            publishedOutputs = pendingOutputs;
            pendingOutputs = null;
        }
    }

    /**
     * Resets integrator state and value. Outputs are republished from the
     * reset value on the next commit.
     */
    public void reinitialize(double[][] integrator, double[][] newValue, double[][] outputs) {
        integratorState = Arrays2D.copy(integrator);
        value = Arrays2D.copy(newValue);
        previousValue = Arrays2D.copy(newValue);
        pendingOutputs = outputs;
        finished = false;
        terminationMeasureValue = Double.NaN;
    }

    public double[][] variable() {
        return variable;
    }

    public void setVariable(double[][] variable) {
        this.variable = variable;
    }

    public double[][] value() {
        return value;
    }

    public void setValue(double[][] value) {
        this.value = value;
    }

    public double[][] previousValue() {
        return previousValue;
    }

    public void setPreviousValue(double[][] previousValue) {
        this.previousValue = previousValue;
    }

    public double[][] integratorState() {
        return integratorState;
    }

    public void setIntegratorState(double[][] integratorState) {
        this.integratorState = integratorState;
    }

    public double[][] publishedOutputs() {
        return publishedOutputs;
    }

    public double[][] pendingOutputs() {
        return pendingOutputs;
    }

    public void setPendingOutputs(double[][] pendingOutputs) {
        this.pendingOutputs = pendingOutputs;
    }

    public Map<String, Double> effectiveParameters() {
        return effectiveParameters;
    }

    public void setEffectiveParameters(Map<String, Double> effectiveParameters) {
        this.effectiveParameters = effectiveParameters;
    }

    public boolean isFinished() {
        return finished;
    }

    public void setFinished(boolean finished) {
        this.finished = finished;
    }

    public double terminationMeasureValue() {
        return terminationMeasureValue;
    }

    public void setTerminationMeasureValue(double terminationMeasureValue) {
        this.terminationMeasureValue = terminationMeasureValue;
    }

    public int lastIterations() {
        return lastIterations;
    }

    public void setLastIterations(int lastIterations) {
        this.lastIterations = lastIterations;
    }

    public long executionCount() {
        return executionCount;
    }

    public void incrementExecutionCount() {
        executionCount++;
    }

    public ExecutionPhase phase() {
        return phase;
    }

    public void setPhase(ExecutionPhase phase) {
        this.phase = phase;
    }
}
