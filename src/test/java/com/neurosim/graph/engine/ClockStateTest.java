package com.neurosim.graph.engine;

import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.TimeScale;
import org.junit.Before;
import org.junit.Test;

import java.util.Set;

import static org.junit.Assert.*;

public class ClockStateTest {

    private final NodeId a = new NodeId(0, "A");
    private final NodeId b = new NodeId(1, "B");
    private ClockState clock;

    @Before
    public void setUp() {
        clock = new ClockState();
        clock.startRun(Set.of(a, b));
        clock.startTrial();
        clock.startPass();
    }

    @Test
    public void testCallsSinceOwnerLastFired() {
        clock.recordCall(a, true);
        clock.recordCall(a, true);
        assertEquals(2, clock.callsSinceLastRun(b, a));
        assertEquals(2, clock.callsSinceLastRun(null, a));

        clock.recordCall(b, true);
        assertEquals(0, clock.callsSinceLastRun(b, a));
        assertEquals(0, clock.callsSinceLastRun(b, b));

        clock.recordCall(a, true);
        assertEquals(1, clock.callsSinceLastRun(b, a));
        assertEquals(3, clock.callsSinceLastRun(null, a));
        assertEquals(0, clock.callsSinceLastRun(a, a));
        assertEquals(1, clock.callsSinceLastRun(a, b));
    }

    @Test
    public void testNewRunStartsFromZero() {
        clock.recordCall(a, true);
        clock.recordCall(b, true);
        clock.recordCall(a, true);
        clock.endRun();

        clock.startRun(Set.of(a, b));
        assertEquals(0, clock.callsSinceLastRun(b, a));
        clock.recordCall(a, true);
        assertEquals(1, clock.callsSinceLastRun(b, a));
        assertEquals(1, clock.time(TimeScale.RUN));
    }

    @Test
    public void testCopyIsUnaffectedByLaterFirings() {
        clock.recordCall(a, true);
        ClockState snapshot = clock.copy();

        clock.recordCall(a, false);
        clock.recordCall(a, false);
        assertEquals(3, clock.callsSinceLastRun(b, a));
        assertFalse(clock.isFinished(a));

        ClockState restored = snapshot.copy();
        assertEquals(1, restored.callsSinceLastRun(b, a));
        assertTrue(restored.isFinished(a));

        restored.recordCall(b, true);
        restored.recordCall(a, true);
        assertEquals(1, restored.callsSinceLastRun(b, a));
        assertEquals(2, restored.callsSinceLastRun(null, a));
        assertEquals(1, snapshot.callsSinceLastRun(b, a));
        assertEquals(3, clock.callsSinceLastRun(b, a));
    }

    @Test
    public void testManyFiringsAreCounted() {
        clock.recordCall(b, true);
        for (int i = 0; i < 1000; i++)
            clock.recordCall(a, true);
        assertEquals(1000, clock.callsSinceLastRun(b, a));
        assertEquals(1000, clock.calls(a, TimeScale.PASS));
    }

    @Test
    public void testForgetDropsHistory() {
        clock.recordCall(a, true);
        clock.forget(a);
        assertEquals(0, clock.callsSinceLastRun(b, a));
        assertEquals(0, clock.calls(a, TimeScale.TRIAL));
        assertFalse(clock.isFinished(a));
    }
}
