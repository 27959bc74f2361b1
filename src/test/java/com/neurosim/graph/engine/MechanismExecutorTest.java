package com.neurosim.graph.engine;

import com.neurosim.graph.api.ConfigurationException;
import com.neurosim.graph.api.ExecutionResult;
import com.neurosim.graph.api.ShapeMismatchException;
import com.neurosim.graph.fn.CombinationRule;
import com.neurosim.graph.fn.ComparisonOperator;
import com.neurosim.graph.fn.Integrators;
import com.neurosim.graph.fn.ModulationOperator;
import com.neurosim.graph.fn.TerminationMeasures;
import com.neurosim.graph.fn.transfer.Linear;
import com.neurosim.graph.node.ExecutionPhase;
import com.neurosim.graph.node.Mechanism;
import com.neurosim.graph.node.MechanismState;
import com.neurosim.graph.node.PortSpec;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class MechanismExecutorTest {
    private static final double EPS = 1e-12;

    private final MechanismExecutor executor = new MechanismExecutor(1000, 1000);

    /** Fixed afferents: one contribution list per input port, one signal list per parameter port. */
    private static Afferents afferents(Map<Integer, List<double[]>> inputs,
            Map<Integer, List<ModulatorySignal>> signals) {
        return new Afferents() {
            @Override
            public List<double[]> inputContributions(int inputPort) {
                return inputs.getOrDefault(inputPort, List.of());
            }

            @Override
            public List<ModulatorySignal> modulatorySignals(int parameterPort) {
                return signals.getOrDefault(parameterPort, List.of());
            }
        };
    }

    private ExecutionResult fire(Mechanism m, MechanismState s, double... input) {
        return executor.execute(m, s, new double[][] { input }, null);
    }

    @Test
    public void testStatefulConvergenceReportsIterations() {
        Mechanism m = Mechanism.builder("integrator")
                .size(2)
                .integratorMode(true)
                .integrationRate(0.5)
                .terminationThreshold(0.1)
                .build();
        MechanismState s = MechanismState.initial(m);

        ExecutionResult r = fire(m, s, 0.5, 1.0);

        assertEquals(4, r.iterationsUsed());
        assertTrue(r.converged());
        assertArrayEquals(new double[] { 0.46875, 0.9375 }, r.value()[0], EPS);
        assertArrayEquals(new double[] { 0.4375, 0.875 }, s.previousValue()[0], EPS);
        assertEquals(0.0625, s.terminationMeasureValue(), EPS);
        assertTrue(executor.isFinished(s));
    }

    @Test
    public void testSingleUpdatePerFiringReportsFinishedLater() {
        Mechanism m = Mechanism.builder("stepwise")
                .size(2)
                .integratorMode(true)
                .integrationRate(0.5)
                .terminationThreshold(0.1)
                .executeUntilFinished(false)
                .build();
        MechanismState s = MechanismState.initial(m);

        ExecutionResult first = fire(m, s, 0.5, 1.0);
        assertEquals(1, first.iterationsUsed());
        assertFalse(first.converged());
        assertArrayEquals(new double[] { 0.25, 0.5 }, first.value()[0], EPS);
        assertFalse(executor.isFinished(s));

        fire(m, s, 0.5, 1.0);
        assertFalse(fire(m, s, 0.5, 1.0).converged());
        ExecutionResult fourth = fire(m, s, 0.5, 1.0);
        assertTrue(fourth.converged());
        assertEquals(1, fourth.iterationsUsed());
        assertArrayEquals(new double[] { 0.46875, 0.9375 }, fourth.value()[0], EPS);
        assertTrue(executor.isFinished(s));
    }

    @Test
    public void testStatelessIsIdempotent() {
        Mechanism m = Mechanism.builder("lin").size(2).function(new Linear(2.0, 1.0)).build();
        MechanismState s = MechanismState.initial(m);

        ExecutionResult first = fire(m, s, 1.0, 2.0);
        ExecutionResult second = fire(m, s, 1.0, 2.0);

        assertArrayEquals(new double[] { 3.0, 5.0 }, first.value()[0], EPS);
        assertArrayEquals(first.value()[0], second.value()[0], EPS);
        assertEquals(1, second.iterationsUsed());
        assertTrue(second.converged());
    }

    @Test
    public void testIntegratorWithoutThresholdRunsOnce() {
        Mechanism m = Mechanism.builder("leaky").integratorMode(true).integrationRate(0.5).build();
        MechanismState s = MechanismState.initial(m);
        assertEquals(0.5, fire(m, s, 1.0).value()[0][0], EPS);
        assertEquals(0.75, fire(m, s, 1.0).value()[0][0], EPS);
    }

    @Test
    public void testClipAppliesToFinalValueOnly() {
        Mechanism m = Mechanism.builder("clipped")
                .function(new Linear(10.0, 0.0))
                .integratorMode(true)
                .integrationRate(1.0)
                .clip(0.0, 1.0)
                .build();
        MechanismState s = MechanismState.initial(m);

        ExecutionResult r = fire(m, s, 0.5);

        assertEquals(1.0, r.value()[0][0], EPS);
        assertEquals(0.5, s.integratorState()[0][0], EPS);
    }

    @Test
    public void testStatelessClip() {
        Mechanism m = Mechanism.builder("clipped").size(2).function(new Linear(10.0, 0.0)).clip(-1.0, 1.0).build();
        assertArrayEquals(new double[] { 1.0, -1.0 }, fire(m, MechanismState.initial(m), 0.5, -0.5).value()[0], EPS);
    }

    @Test
    public void testNoiseAddedBeforeFunctionWhenStateless() {
        Mechanism m = Mechanism.builder("noisy").function(new Linear(2.0, 0.0)).noise(0.5).build();
        assertEquals(3.0, fire(m, MechanismState.initial(m), 1.0).value()[0][0], EPS);
    }

    @Test
    public void testNoisePassedToIntegratorWhenStateful() {
        Mechanism m = Mechanism.builder("noisy")
                .function(new Linear(2.0, 0.0))
                .integratorMode(true)
                .integrationRate(0.5)
                .noise(0.1)
                .build();
        MechanismState s = MechanismState.initial(m);
        assertEquals(1.2, fire(m, s, 1.0).value()[0][0], EPS);
        assertEquals(0.6, s.integratorState()[0][0], EPS);
    }

    @Test
    public void testInitialValueSeedsIntegrator() {
        Mechanism m = Mechanism.builder("seeded").integratorMode(true).integrationRate(0.5).initialValue(2.0).build();
        assertEquals(1.5, fire(m, MechanismState.initial(m), 1.0).value()[0][0], EPS);
    }

    @Test
    public void testIterationCeilingDegradesToWarning() {
        Mechanism m = Mechanism.builder("slow")
                .integratorMode(true)
                .integrationRate(0.1)
                .terminationThreshold(1e-12)
                .maxExecutionsBeforeFinished(3)
                .build();
        MechanismState s = MechanismState.initial(m);

        ExecutionResult r = fire(m, s, 1.0);

        assertEquals(3, r.iterationsUsed());
        assertFalse(r.converged());
        assertEquals(0.271, r.value()[0][0], EPS);
        assertFalse(s.isFinished());
    }

    @Test
    public void testDefaultCeilingComesFromExecutor() {
        MechanismExecutor strict = new MechanismExecutor(2, 0);
        Mechanism m = Mechanism.builder("slow").integratorMode(true).integrationRate(0.1).terminationThreshold(0.0)
                .build();
        ExecutionResult r = strict.execute(m, MechanismState.initial(m), new double[][] { { 1.0 } }, null);
        assertEquals(2, r.iterationsUsed());
        assertFalse(r.converged());
    }

    @Test
    public void testBoundaryTermination() {
        Mechanism m = Mechanism.builder("accumulator")
                .integratorMode(true)
                .integrator(Integrators.SIMPLE)
                .integrationRate(1.0)
                .terminationMeasure(TerminationMeasures.MAX)
                .terminationComparison(ComparisonOperator.GREATER_THAN_OR_EQUAL)
                .terminationThreshold(3.0)
                .build();

        ExecutionResult r = fire(m, MechanismState.initial(m), 1.0);

        assertEquals(3, r.iterationsUsed());
        assertEquals(3.0, r.value()[0][0], EPS);
    }

    @Test
    public void testRuntimeParamsScopedToOneCall() {
        Mechanism m = Mechanism.builder("lin").build();
        MechanismState s = MechanismState.initial(m);

        ExecutionResult overridden = executor.execute(m, s, new double[][] { { 2.0 } }, Map.of(Linear.SLOPE, 3.0));
        assertEquals(6.0, overridden.value()[0][0], EPS);
        assertEquals(3.0, s.effectiveParameters().get(Linear.SLOPE), EPS);

        assertEquals(2.0, fire(m, s, 2.0).value()[0][0], EPS);
        assertEquals(1.0, m.baseParameters().get(Linear.SLOPE), EPS);
    }

    @Test(expected = ConfigurationException.class)
    public void testUnknownRuntimeParamRejected() {
        Mechanism m = Mechanism.builder("lin").build();
        executor.execute(m, MechanismState.initial(m), new double[][] { { 1.0 } }, Map.of("gain", 2.0));
    }

    @Test
    public void testShapeMismatchOnExplicitVariable() {
        Mechanism m = Mechanism.builder("pair").size(2).build();
        MechanismState s = MechanismState.initial(m);
        try {
            fire(m, s, 1.0, 2.0, 3.0);
            fail("expected ShapeMismatchException");
        } catch (ShapeMismatchException expected) {
            assertEquals(ExecutionPhase.IDLE, s.phase());
            assertEquals(0L, s.executionCount());
        }
    }

    @Test(expected = ShapeMismatchException.class)
    public void testShapeMismatchOnContribution() {
        Mechanism m = Mechanism.builder("pair").size(2).build();
        executor.execute(m, MechanismState.initial(m), afferents(Map.of(0, List.of(new double[] { 1.0 })), Map.of()),
                null);
    }

    @Test
    public void testAggregationCombinesAndFallsBackToDefault() {
        Mechanism m = Mechanism.builder("agg")
                .inputPort("sum", PortSpec.size(2))
                .inputPort("mean", PortSpec.value(0, 0), PortSpec.combine(CombinationRule.MEAN))
                .inputPort("idle", PortSpec.value(7, 8))
                .build();
        Afferents in = afferents(Map.of(
                0, List.of(new double[] { 1, 2 }, new double[] { 10, 20 }),
                1, List.of(new double[] { 1, 2 }, new double[] { 3, 4 })), Map.of());

        ExecutionResult r = executor.execute(m, MechanismState.initial(m), in, null);

        assertArrayEquals(new double[] { 11, 22 }, r.value()[0], EPS);
        assertArrayEquals(new double[] { 2, 3 }, r.value()[1], EPS);
        assertArrayEquals(new double[] { 7, 8 }, r.value()[2], EPS);
        assertEquals(3, r.outputValues().length);
    }

    @Test
    public void testModulationGroupsByOperator() {
        Mechanism m = Mechanism.builder("mod").build();
        int slope = m.parameterIndex(Linear.SLOPE);
        Afferents in = afferents(Map.of(0, List.of(new double[] { 1.0 })), Map.of(slope, List.of(
                new ModulatorySignal(3.0, ModulationOperator.MULTIPLY),
                new ModulatorySignal(2.0, ModulationOperator.ADD))));

        assertEquals(9.0, executor.execute(m, MechanismState.initial(m), in, null).value()[0][0], EPS);
    }

    @Test
    public void testOverrideWinsAndDisableIgnored() {
        Mechanism m = Mechanism.builder("mod").build();
        int slope = m.parameterIndex(Linear.SLOPE);
        Afferents override = afferents(Map.of(0, List.of(new double[] { 1.0 })), Map.of(slope, List.of(
                new ModulatorySignal(5.0, ModulationOperator.OVERRIDE),
                new ModulatorySignal(2.0, ModulationOperator.ADD))));
        Afferents disabled = afferents(Map.of(0, List.of(new double[] { 1.0 })), Map.of(slope, List.of(
                new ModulatorySignal(5.0, ModulationOperator.DISABLE))));

        assertEquals(5.0, executor.execute(m, MechanismState.initial(m), override, null).value()[0][0], EPS);
        assertEquals(1.0, executor.execute(m, MechanismState.initial(m), disabled, null).value()[0][0], EPS);
    }

    @Test
    public void testRuntimeOverrideAppliedBeforeModulation() {
        Mechanism m = Mechanism.builder("mod").build();
        int slope = m.parameterIndex(Linear.SLOPE);
        Afferents in = afferents(Map.of(0, List.of(new double[] { 1.0 })),
                Map.of(slope, List.of(new ModulatorySignal(2.0, ModulationOperator.MULTIPLY))));
        ExecutionResult r = executor.execute(m, MechanismState.initial(m), in, Map.of(Linear.SLOPE, 4.0));
        assertEquals(8.0, r.value()[0][0], EPS);
    }

    @Test
    public void testOutputsStayPendingUntilCommitted() {
        Mechanism m = Mechanism.builder("pending").build();
        MechanismState s = MechanismState.initial(m);
        executor.execute(m, s, afferents(Map.of(0, List.of(new double[] { 4.0 })), Map.of()), null);

        assertEquals(0.0, s.publishedOutputs()[0][0], EPS);
        assertEquals(4.0, s.pendingOutputs()[0][0], EPS);
        s.commitOutputs();
        assertEquals(4.0, s.publishedOutputs()[0][0], EPS);
        assertNull(s.pendingOutputs());
    }

    @Test
    public void testReinitializeRestoresInitialValue() {
        Mechanism m = Mechanism.builder("seeded").integratorMode(true).integrationRate(0.5).initialValue(1.0).build();
        MechanismState s = MechanismState.initial(m);
        fire(m, s, 5.0);
        assertEquals(3.0, s.integratorState()[0][0], EPS);

        executor.reinitialize(m, s, null);

        assertEquals(1.0, s.integratorState()[0][0], EPS);
        assertEquals(1.0, s.value()[0][0], EPS);
        assertEquals(1.0, s.publishedOutputs()[0][0], EPS);

        executor.reinitialize(m, s, new double[][] { { 4.0 } });
        assertEquals(4.0, s.integratorState()[0][0], EPS);
    }
}
