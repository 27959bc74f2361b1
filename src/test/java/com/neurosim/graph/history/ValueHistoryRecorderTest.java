package com.neurosim.graph.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.config.CompositionConfig;
import com.neurosim.graph.engine.Composition;
import com.neurosim.graph.engine.RunRequest;
import com.neurosim.graph.node.Matrix;
import com.neurosim.graph.node.Mechanism;
import org.junit.Test;

import java.io.StringWriter;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class ValueHistoryRecorderTest {
    private static final double EPS = 1e-12;

    private static Composition chain() {
        Composition comp = new Composition("history", CompositionConfig.defaults());
        NodeId a = comp.addNode(Mechanism.builder("A").build());
        NodeId b = comp.addNode(Mechanism.builder("B").build());
        comp.addProjection(a, b, Matrix.scalar(2.0), false);
        return comp;
    }

    @Test
    public void testRecordsEveryFiring() throws Exception {
        Composition comp = chain();
        NodeId a = comp.node("A");
        ValueHistoryRecorder history = new ValueHistoryRecorder(16);
        comp.addListener(history);

        comp.run(RunRequest.builder().input(a, new double[] { 1.0 }, new double[] { 3.0 }).build());
        history.close();

        List<HistoryEntry> entries = history.entries();
        assertEquals(4, entries.size());
        List<HistoryEntry> b = history.entriesOf("B");
        assertEquals(2, b.size());
        assertEquals(0, b.get(0).getTrial());
        assertEquals(1, b.get(0).getTimeStep());
        assertEquals(2.0, b.get(0).getValue()[0], EPS);
        assertEquals(1, b.get(1).getTrial());
        assertEquals(6.0, b.get(1).getValue()[0], EPS);
        assertEquals("default", b.get(1).getExecutionId());
    }

    @Test
    public void testStreamsJsonLines() throws Exception {
        Composition comp = chain();
        StringWriter out = new StringWriter();
        ValueHistoryRecorder history = new ValueHistoryRecorder(CompositionConfig.defaults(), out);
        try (history) {
            comp.addListener(history);
            comp.run(RunRequest.builder().input(comp.node("A"), new double[] { 1.0 }).build());
        }

        String[] lines = out.toString().trim().split("\n");
        assertEquals(2, lines.length);
        HistoryEntry last = new ObjectMapper().readValue(lines[1], HistoryEntry.class);
        assertEquals("B", last.getNode());
        assertEquals(0, last.getPort());
        assertEquals(2.0, last.getValue()[0], EPS);
        assertEquals(0, history.failedWrites());
    }

    @Test
    public void testCloseRightAfterRunKeepsEveryEntry() throws Exception {
        Composition comp = new Composition("single", CompositionConfig.defaults());
        NodeId a = comp.addNode(Mechanism.builder("A").build());
        RunRequest request = RunRequest.builder().input(a, new double[] { 1.0 }, new double[] { 2.0 }).build();

        int incomplete = 0;
        for (int i = 0; i < 200; i++) {
            ValueHistoryRecorder history = new ValueHistoryRecorder(16);
            comp.addListener(history);
            comp.run(request);
            history.close();
            comp.removeListener(history);
            if (history.entries().size() != 2)
                incomplete++;
        }
        assertEquals(0, incomplete);
    }

    @Test
    public void testCloseWhileRunningFreezesEntries() throws Exception {
        Composition comp = chain();
        ValueHistoryRecorder history = new ValueHistoryRecorder(64);
        comp.addListener(history);
        RunRequest request = RunRequest.builder().input(comp.node("A"), new double[] { 1.0 }).build();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch started = new CountDownLatch(1);
        Thread runner = new Thread(() -> {
            try {
                for (int i = 0; i < 2000; i++) {
                    comp.run(request);
                    started.countDown();
                }
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        runner.start();
        assertTrue(started.await(10, TimeUnit.SECONDS));

        history.close();
        int atClose = history.entries().size();
        runner.join();

        assertNull(failure.get());
        assertEquals(atClose, history.entries().size());
    }

    @Test
    public void testIgnoresEventsAfterClose() throws Exception {
        Composition comp = chain();
        ValueHistoryRecorder history = new ValueHistoryRecorder(8);
        comp.addListener(history);
        history.close();

        comp.run(RunRequest.builder().input(comp.node("A"), new double[] { 1.0 }).build());

        assertTrue(history.entries().isEmpty());
    }
}
