package com.neurosim.graph.node;

import com.neurosim.graph.api.ConfigurationException;
import com.neurosim.graph.condition.Condition;
import com.neurosim.graph.fn.CombinationRule;
import com.neurosim.graph.fn.ComparisonOperator;
import com.neurosim.graph.fn.IntegratorFunction;
import com.neurosim.graph.fn.Integrators;
import com.neurosim.graph.fn.NoiseSource;
import com.neurosim.graph.fn.OutputFunction;
import com.neurosim.graph.fn.OutputFunctions;
import com.neurosim.graph.fn.TerminationMeasure;
import com.neurosim.graph.fn.TerminationMeasures;
import com.neurosim.graph.fn.TransferFunction;
import com.neurosim.graph.fn.transfer.Linear;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Immutable description of a mechanism: its ports, its function and, in
 * integrator mode, the integrator and termination settings.
 *
 * A mechanism holds no run-time values. Those live in a
 * {@link MechanismState} per execution context, so one description can be
 * evaluated under many contexts.
 *
 * <pre>{@code
 * Mechanism m = Mechanism.builder("decision")
 *         .size(2)
 *         .function(new Logistic())
 *         .integratorMode(true)
 *         .integrationRate(0.5)
 *         .terminationThreshold(0.01)
 *         .build();
 * }</pre>
 */
@Getter
public final class Mechanism {
    public static final String NOISE = "noise";
    public static final String INTEGRATION_RATE = "integrationRate";
    public static final String TERMINATION_THRESHOLD = "terminationThreshold";

    private final String name;
    private final List<InputPort> inputPorts;
    private final TransferFunction function;
    private final List<ParameterPort> parameterPorts;
    private final List<OutputPort> outputPorts;
    private final boolean integratorMode;
    private final IntegratorFunction integrator;
    @Getter(AccessLevel.NONE)
    private final double[][] initialValue;
    private final NoiseSource noiseSource;
    private final double clipMin;
    private final double clipMax;
    private final boolean clipped;
    private final Double terminationThreshold;
    private final TerminationMeasure terminationMeasure;
    private final ComparisonOperator terminationComparison;
    /** 0 means "use the composition default". */
    private final int maxExecutionsBeforeFinished;
    /** When false, each firing runs one update and reports whether it finished. */
    private final boolean executeUntilFinished;
    private final Condition reinitializeWhen;

    private Mechanism(Builder b, List<InputPort> inputs, List<ParameterPort> params, List<OutputPort> outputs,
            double[][] initialValue) {
        this.name = b.name;
        this.inputPorts = Collections.unmodifiableList(inputs);
        this.function = b.function;
        this.parameterPorts = Collections.unmodifiableList(params);
        this.outputPorts = Collections.unmodifiableList(outputs);
        this.integratorMode = b.integratorMode;
        this.integrator = b.integrator;
        this.initialValue = initialValue;
        this.noiseSource = b.noiseSource;
        this.clipMin = b.clipMin;
        this.clipMax = b.clipMax;
        this.clipped = b.clipped;
        this.terminationThreshold = b.terminationThreshold;
        this.terminationMeasure = b.terminationMeasure;
        this.terminationComparison = b.terminationComparison;
        this.maxExecutionsBeforeFinished = b.maxExecutionsBeforeFinished;
        this.executeUntilFinished = b.executeUntilFinished;
        this.reinitializeWhen = b.reinitializeWhen;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Length of each row of the variable (and of the value). */
    public int[] rowLengths() {
        int[] lengths = new int[inputPorts.size()];
        for (int i = 0; i < lengths.length; i++)
            lengths[i] = inputPorts.get(i).size();
        return lengths;
    }

    public double[][] defaultVariable() {
        double[][] v = new double[inputPorts.size()][];
        for (int i = 0; i < v.length; i++)
            v[i] = inputPorts.get(i).defaultVariable().clone();
        return v;
    }

    /** Value before the first execution: zeros in the value's shape. */
    public double[][] defaultValue() {
        int[] lengths = rowLengths();
        double[][] v = new double[lengths.length][];
        for (int i = 0; i < lengths.length; i++)
            v[i] = new double[lengths[i]];
        return v;
    }

    /** Length of each output port's value. */
    public int outputSize(int outputIndex) {
        return outputPorts.get(outputIndex).size(rowLengths());
    }

    /** Returns the index of a parameter port, or -1. */
    public int parameterIndex(String parameter) {
        for (int i = 0; i < parameterPorts.size(); i++) {
            if (parameterPorts.get(i).name().equals(parameter))
                return i;
        }
        return -1;
    }

    public int inputIndex(String port) {
        for (int i = 0; i < inputPorts.size(); i++) {
            if (inputPorts.get(i).name().equals(port))
                return i;
        }
        return -1;
    }

    public int outputIndex(String port) {
        for (int i = 0; i < outputPorts.size(); i++) {
            if (outputPorts.get(i).name().equals(port))
                return i;
        }
        return -1;
    }

    /** Base value of every parameter, in port order. */
    public Map<String, Double> baseParameters() {
        Map<String, Double> m = new LinkedHashMap<>();
        for (ParameterPort p : parameterPorts)
            m.put(p.name(), p.baseValue());
        return m;
    }

    public boolean hasTerminationThreshold() {
        return terminationThreshold != null;
    }

    public double[][] initialValueCopy() {
        double[][] copy = new double[initialValue.length][];
        for (int i = 0; i < copy.length; i++)
            copy[i] = initialValue[i].clone();
        return copy;
    }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder {
        private final String name;
        private final List<String> inputNames = new ArrayList<>();
        private final List<PortSpec[]> inputSpecs = new ArrayList<>();
        private final List<String> outputNames = new ArrayList<>();
        private final List<VariableSpec> outputVariables = new ArrayList<>();
        private final List<OutputFunction> outputFunctions = new ArrayList<>();
        private TransferFunction function = new Linear();
        private boolean integratorMode;
        private IntegratorFunction integrator = Integrators.ADAPTIVE;
        private double integrationRate = 0.5;
        private double[][] initialValue;
        private double initialScalar;
        private double noise;
        private NoiseSource noiseSource;
        private double clipMin = Double.NEGATIVE_INFINITY;
        private double clipMax = Double.POSITIVE_INFINITY;
        private boolean clipped;
        private Double terminationThreshold;
        private TerminationMeasure terminationMeasure = TerminationMeasures.MAX_ABS_DIFF;
        private ComparisonOperator terminationComparison = ComparisonOperator.LESS_THAN_OR_EQUAL;
        private int maxExecutionsBeforeFinished;
        private boolean executeUntilFinished = true;
        private Condition reinitializeWhen;

        private Builder(String name) {
            if (name == null || name.isBlank())
                throw new ConfigurationException("Mechanism name must not be blank");
            this.name = name;
        }

        /** Adds an input port described by the given specs. */
        public Builder inputPort(String portName, PortSpec... specs) {
            inputNames.add(Objects.requireNonNull(portName, "portName"));
            inputSpecs.add(specs.clone());
            return this;
        }

        /** Shorthand for one input port named "InputPort-i" of length n. */
        public Builder size(int n) {
            if (n < 1)
                throw new ConfigurationException("Size must be >= 1, got " + n);
            return inputPort("InputPort-" + inputNames.size(), PortSpec.size(n));
        }

        public Builder function(TransferFunction function) {
            this.function = Objects.requireNonNull(function, "function");
            return this;
        }

        public Builder integratorMode(boolean integratorMode) {
            this.integratorMode = integratorMode;
            return this;
        }

        public Builder integrator(IntegratorFunction integrator) {
            this.integrator = Objects.requireNonNull(integrator, "integrator");
            return this;
        }

        public Builder integrationRate(double rate) {
            this.integrationRate = rate;
            return this;
        }

        /** Integrator starting value, broadcast to every element. */
        public Builder initialValue(double value) {
            this.initialScalar = value;
            this.initialValue = null;
            return this;
        }

        /** Integrator starting value, one row per input port. */
        public Builder initialValue(double[][] value) {
            this.initialValue = value;
            return this;
        }

        /** Constant noise added on every update (modulable). */
        public Builder noise(double noise) {
            this.noise = noise;
            return this;
        }

        /** Noise sampled per element on every update, added to the constant noise. */
        public Builder noiseSource(NoiseSource source) {
            this.noiseSource = source;
            return this;
        }

        public Builder clip(double min, double max) {
            this.clipMin = min;
            this.clipMax = max;
            this.clipped = true;
            return this;
        }

        public Builder terminationThreshold(double threshold) {
            this.terminationThreshold = threshold;
            return this;
        }

        public Builder terminationMeasure(TerminationMeasure measure) {
            this.terminationMeasure = Objects.requireNonNull(measure, "measure");
            return this;
        }

        public Builder terminationComparison(ComparisonOperator comparison) {
            this.terminationComparison = Objects.requireNonNull(comparison, "comparison");
            return this;
        }

        public Builder maxExecutionsBeforeFinished(int max) {
            if (max < 1)
                throw new ConfigurationException("maxExecutionsBeforeFinished must be >= 1, got " + max);
            this.maxExecutionsBeforeFinished = max;
            return this;
        }

        /**
         * With {@code false}, a mechanism with a termination threshold updates
         * once per firing instead of looping until finished, so convergence
         * spreads over passes and can drive {@code whenFinished} conditions.
         */
        public Builder executeUntilFinished(boolean executeUntilFinished) {
            this.executeUntilFinished = executeUntilFinished;
            return this;
        }

        public Builder outputPort(String portName, VariableSpec variable) {
            return outputPort(portName, variable, OutputFunctions.IDENTITY);
        }

        public Builder outputPort(String portName, VariableSpec variable, OutputFunction fn) {
            outputNames.add(Objects.requireNonNull(portName, "portName"));
            outputVariables.add(Objects.requireNonNull(variable, "variable"));
            outputFunctions.add(Objects.requireNonNull(fn, "fn"));
            return this;
        }

        /** Resets integrator state and value at the start of any trial where the condition holds. */
        public Builder reinitializeWhen(Condition condition) {
            this.reinitializeWhen = condition;
            return this;
        }

        /**
         * Resolves the port specs and validates the configuration.
         *
         * @throws ConfigurationException if the settings are inconsistent.
         */
        public Mechanism build() {
            if (inputNames.isEmpty())
                size(1);
            List<InputPort> inputs = resolveInputs();
            int[] rowLengths = new int[inputs.size()];
            for (int i = 0; i < rowLengths.length; i++)
                rowLengths[i] = inputs.get(i).size();

            if (terminationThreshold != null) {
                if (!integratorMode)
                    throw new ConfigurationException(name + ": a termination threshold needs integrator mode");
                if (!Double.isFinite(terminationThreshold))
                    throw new ConfigurationException(name + ": termination threshold must be finite, got "
                            + terminationThreshold);
            }
            if (clipped && !(clipMin <= clipMax))
                throw new ConfigurationException(name + ": clip min " + clipMin + " is above max " + clipMax);
            if (integratorMode && integrator == Integrators.ADAPTIVE
                    && !(integrationRate >= 0.0 && integrationRate <= 1.0))
                throw new ConfigurationException(name + ": adaptive integration rate must be in [0, 1], got "
                        + integrationRate);

            List<ParameterPort> params = resolveParameters();
            List<OutputPort> outputs = resolveOutputs(rowLengths);
            double[][] init = resolveInitialValue(rowLengths);
            return new Mechanism(this, inputs, params, outputs, init);
        }

        private List<InputPort> resolveInputs() {
            List<InputPort> ports = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (int p = 0; p < inputNames.size(); p++) {
                String portName = inputNames.get(p);
                if (!seen.add(portName))
                    throw new ConfigurationException(name + ": duplicate input port " + portName);
                double[] defaultVariable = null;
                CombinationRule rule = CombinationRule.SUM;
                List<PortSpec.ProjectionRef> afferents = new ArrayList<>();
                for (PortSpec spec : inputSpecs.get(p)) {
                    if (spec instanceof PortSpec.Value v) {
                        if (defaultVariable != null)
                            throw new ConfigurationException(name + "." + portName + ": more than one value spec");
                        defaultVariable = v.defaultVariable();
                    } else if (spec instanceof PortSpec.PortRef ref) {
                        afferents.add(new PortSpec.ProjectionRef(ref.sender(), Matrix.identity(), false));
                    } else if (spec instanceof PortSpec.ProjectionRef ref) {
                        afferents.add(ref);
                    } else if (spec instanceof PortSpec.Combinator c) {
                        rule = c.rule();
                    } else {
                        throw new ConfigurationException(name + "." + portName + ": unsupported spec " + spec);
                    }
                }
                if (defaultVariable == null || defaultVariable.length == 0)
                    throw new ConfigurationException(name + "." + portName + ": needs a non-empty value spec");
                ports.add(new InputPort(portName, defaultVariable, rule, List.copyOf(afferents)));
            }
            return ports;
        }

        private List<ParameterPort> resolveParameters() {
            Map<String, Double> values = new LinkedHashMap<>(function.defaultParameters());
            addParameter(values, NOISE, noise);
            if (integratorMode)
                addParameter(values, INTEGRATION_RATE, integrationRate);
            if (terminationThreshold != null)
                addParameter(values, TERMINATION_THRESHOLD, terminationThreshold);
            List<ParameterPort> ports = new ArrayList<>();
            for (var e : values.entrySet())
                ports.add(new ParameterPort(e.getKey(), e.getValue()));
            return ports;
        }

        private void addParameter(Map<String, Double> values, String key, double value) {
            if (values.putIfAbsent(key, value) != null)
                throw new ConfigurationException(name + ": function " + function.name()
                        + " already declares parameter " + key);
        }

        private List<OutputPort> resolveOutputs(int[] rowLengths) {
            List<OutputPort> ports = new ArrayList<>();
            if (outputNames.isEmpty()) {
                for (int r = 0; r < rowLengths.length; r++) {
                    String portName = rowLengths.length == 1 ? "RESULT" : "RESULT-" + r;
                    ports.add(new OutputPort(portName, VariableSpec.row(r), OutputFunctions.IDENTITY));
                }
                return ports;
            }
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < outputNames.size(); i++) {
                String portName = outputNames.get(i);
                if (!seen.add(portName))
                    throw new ConfigurationException(name + ": duplicate output port " + portName);
                VariableSpec spec = outputVariables.get(i);
                if (!spec.isFlattened() && spec.row() >= rowLengths.length)
                    throw new ConfigurationException(name + "." + portName + ": reads row " + spec.row()
                            + " but the value has " + rowLengths.length + " rows");
                ports.add(new OutputPort(portName, spec, outputFunctions.get(i)));
            }
            return ports;
        }

        private double[][] resolveInitialValue(int[] rowLengths) {
            double[][] init = new double[rowLengths.length][];
            if (initialValue == null) {
                for (int r = 0; r < rowLengths.length; r++) {
                    init[r] = new double[rowLengths[r]];
                    Arrays.fill(init[r], initialScalar);
                }
                return init;
            }
            if (initialValue.length != rowLengths.length)
                throw new ConfigurationException(name + ": initial value has " + initialValue.length
                        + " rows, expected " + rowLengths.length);
            for (int r = 0; r < rowLengths.length; r++) {
                if (initialValue[r].length != rowLengths[r])
                    throw new ConfigurationException(name + ": initial value row " + r + " has length "
                            + initialValue[r].length + ", expected " + rowLengths[r]);
                init[r] = initialValue[r].clone();
            }
            return init;
        }
    }
}
