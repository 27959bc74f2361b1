package com.neurosim.graph.node;

import com.neurosim.graph.api.ConfigurationException;
import com.neurosim.graph.fn.CombinationRule;
import com.neurosim.graph.fn.Integrators;
import com.neurosim.graph.fn.OutputFunctions;
import com.neurosim.graph.fn.transfer.Linear;
import com.neurosim.graph.fn.transfer.Logistic;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class MechanismTest {
    private static final double EPS = 1e-12;

    @Test
    public void testDefaults() {
        Mechanism m = Mechanism.builder("m").build();

        assertEquals(1, m.getInputPorts().size());
        assertEquals("InputPort-0", m.getInputPorts().get(0).name());
        assertArrayEquals(new int[] { 1 }, m.rowLengths());
        assertEquals(1, m.getOutputPorts().size());
        assertEquals("RESULT", m.getOutputPorts().get(0).name());
        assertFalse(m.isIntegratorMode());
        assertEquals(List.of(Linear.SLOPE, Linear.INTERCEPT, Mechanism.NOISE),
                List.copyOf(m.baseParameters().keySet()));
    }

    @Test
    public void testParameterPortsFollowConfiguration() {
        Mechanism m = Mechanism.builder("m")
                .function(new Logistic())
                .integratorMode(true)
                .integrationRate(0.2)
                .terminationThreshold(0.01)
                .build();

        assertTrue(m.parameterIndex(Logistic.GAIN) >= 0);
        assertEquals(0.2, m.baseParameters().get(Mechanism.INTEGRATION_RATE), EPS);
        assertEquals(0.01, m.baseParameters().get(Mechanism.TERMINATION_THRESHOLD), EPS);
        assertEquals(-1, m.parameterIndex(Linear.SLOPE));
    }

    @Test
    public void testOneResultPortPerRow() {
        Mechanism m = Mechanism.builder("m").size(2).size(3).build();
        assertEquals("RESULT-0", m.getOutputPorts().get(0).name());
        assertEquals("RESULT-1", m.getOutputPorts().get(1).name());
        assertEquals(3, m.outputSize(1));
        assertEquals(1, m.inputIndex("InputPort-1"));
    }

    @Test
    public void testCustomOutputPorts() {
        Mechanism m = Mechanism.builder("m")
                .size(3)
                .outputPort("all", VariableSpec.flattened())
                .outputPort("mean", VariableSpec.row(0), OutputFunctions.MEAN)
                .build();

        assertEquals(3, m.outputSize(m.outputIndex("all")));
        assertEquals(1, m.outputSize(m.outputIndex("mean")));
        assertArrayEquals(new double[] { 2.0 },
                m.getOutputPorts().get(1).compute(new double[][] { { 1.0, 2.0, 3.0 } }), EPS);
    }

    @Test
    public void testInitialValueBroadcast() {
        Mechanism m = Mechanism.builder("m").size(2).integratorMode(true).initialValue(0.5).build();
        assertArrayEquals(new double[] { 0.5, 0.5 }, m.initialValueCopy()[0], EPS);
    }

    @Test
    public void testInitialValueCannotBeChangedFromOutside() {
        double[][] init = { { 1.0, 2.0 } };
        Mechanism m = Mechanism.builder("m").size(2).integratorMode(true).initialValue(init).build();
        init[0][0] = 9.0;
        m.initialValueCopy()[0][1] = 9.0;
        assertArrayEquals(new double[] { 1.0, 2.0 }, m.initialValueCopy()[0], EPS);
        assertArrayEquals(new double[] { 1.0, 2.0 }, MechanismState.initial(m).integratorState()[0], EPS);
    }

    @Test
    public void testExecuteUntilFinishedDefaultsToTrue() {
        assertTrue(Mechanism.builder("m").build().isExecuteUntilFinished());
        assertFalse(Mechanism.builder("m").executeUntilFinished(false).build().isExecuteUntilFinished());
    }

    @Test
    public void testVariableSpecRejectsNegativeRows() {
        assertTrue(new VariableSpec(-1).isFlattened());
        assertEquals(0, new VariableSpec(0).row());
        try {
            new VariableSpec(-5);
            fail("row -5 accepted");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("-5"));
        }
    }

    @Test(expected = ConfigurationException.class)
    public void testThresholdNeedsIntegratorMode() {
        Mechanism.builder("m").terminationThreshold(0.1).build();
    }

    @Test(expected = ConfigurationException.class)
    public void testThresholdMustBeFinite() {
        Mechanism.builder("m").integratorMode(true).terminationThreshold(Double.NaN).build();
    }

    @Test(expected = ConfigurationException.class)
    public void testClipBoundsOrdered() {
        Mechanism.builder("m").clip(1.0, -1.0).build();
    }

    @Test(expected = ConfigurationException.class)
    public void testAdaptiveRateInUnitInterval() {
        Mechanism.builder("m").integratorMode(true).integrationRate(1.5).build();
    }

    @Test
    public void testSimpleRateUnbounded() {
        Mechanism m = Mechanism.builder("m").integratorMode(true).integrator(Integrators.SIMPLE).integrationRate(2.0)
                .build();
        assertEquals(2.0, m.baseParameters().get(Mechanism.INTEGRATION_RATE), EPS);
    }

    @Test(expected = ConfigurationException.class)
    public void testDuplicateInputPortRejected() {
        Mechanism.builder("m").inputPort("in", PortSpec.size(1)).inputPort("in", PortSpec.size(1)).build();
    }

    @Test(expected = ConfigurationException.class)
    public void testInputPortNeedsValueSpec() {
        Mechanism.builder("m").inputPort("in", PortSpec.combine(CombinationRule.MEAN)).build();
    }

    @Test(expected = ConfigurationException.class)
    public void testOutputRowOutOfRange() {
        Mechanism.builder("m").outputPort("bad", VariableSpec.row(1)).build();
    }

    @Test(expected = ConfigurationException.class)
    public void testInitialValueShapeChecked() {
        Mechanism.builder("m").size(2).integratorMode(true).initialValue(new double[][] { { 1.0 } }).build();
    }

    @Test(expected = ConfigurationException.class)
    public void testBlankNameRejected() {
        Mechanism.builder(" ");
    }

    @Test
    public void testStateCopyIsDeep() {
        Mechanism m = Mechanism.builder("m").build();
        MechanismState s = MechanismState.initial(m);
        MechanismState copy = s.copy();
        s.value()[0][0] = 5.0;
        assertEquals(0.0, copy.value()[0][0], EPS);
        assertEquals(ExecutionPhase.IDLE, copy.phase());
    }
}
