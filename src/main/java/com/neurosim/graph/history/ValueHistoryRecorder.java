package com.neurosim.graph.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.neurosim.graph.api.ExecutionId;
import com.neurosim.graph.api.ExecutionResult;
import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.SchedulerListener;
import com.neurosim.graph.api.TimeScale;
import com.neurosim.graph.condition.SchedulingClock;
import com.neurosim.graph.config.CompositionConfig;
import com.neurosim.graph.util.ErrorRateLimiter;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;

import lombok.extern.log4j.Log4j2;

/**
 * Append-only log of every output-port value a run produces.
 *
 * The listener side runs on the scheduler thread and only claims a
 * ring-buffer slot and copies the value into it. A single consumer thread
 * turns slots into {@link HistoryEntry} records kept in memory and, when a
 * writer is given, streams them as JSON lines.
 *
 * <pre>{@code
 * try (ValueHistoryRecorder history = new ValueHistoryRecorder(1024, writer)) {
 *     composition.addListener(history);
 *     composition.run(request);
 * }
 * }</pre>
 */
@Log4j2
public final class ValueHistoryRecorder implements SchedulerListener, AutoCloseable {
    private static final long DRAIN_PARK_NANOS = TimeUnit.MICROSECONDS.toNanos(50);

    private final Disruptor<HistoryEvent> disruptor;
    private final RingBuffer<HistoryEvent> ringBuffer;
    private final List<HistoryEntry> entries = new ArrayList<>();
    private final Writer writer;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ErrorRateLimiter writeErrors = new ErrorRateLimiter(log, 1000);
    private final AtomicLong failedWrites = new AtomicLong();
    private final EventHandler<HistoryEvent> handler = this::consume;
    // Producers currently between the closed check and publish.
    private final AtomicInteger publishing = new AtomicInteger();
    private volatile boolean closed;

    public ValueHistoryRecorder(int bufferSize) {
        this(bufferSize, null);
    }

    /** Recorder sized by {@link CompositionConfig#getHistoryBufferSize()}. */
    public ValueHistoryRecorder(CompositionConfig config, Writer writer) {
        this(config.validate().getHistoryBufferSize(), writer);
    }

    /**
     * @param bufferSize ring size, a power of two
     * @param writer     destination for JSON lines, or {@code null} to keep
     *                   entries in memory only
     */
    public ValueHistoryRecorder(int bufferSize, Writer writer) {
        this.writer = writer;
        // Several compositions may share one recorder, so claim slots as a multi-producer.
        this.disruptor = new Disruptor<>(HistoryEvent::new, bufferSize, DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI, new BlockingWaitStrategy());
        disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();
    }

    private void consume(HistoryEvent event, long sequence, boolean endOfBatch) {
        HistoryEntry entry = event.toEntry();
        event.clear();
        synchronized (entries) {
            entries.add(entry);
        }
        if (writer == null)
            return;
        try {
            writer.write(mapper.writeValueAsString(entry));
            writer.write('\n');
            if (endOfBatch)
                writer.flush();
        } catch (IOException e) {
            // Keep the consumer alive; the in-memory log stays complete.
            failedWrites.incrementAndGet();
            writeErrors.error("Failed to write history entry for " + entry.getNode(), e);
        }
    }

    @Override
    public void onNodeExecuted(ExecutionId id, SchedulingClock clock, NodeId node, ExecutionResult result,
            long durationNanos) {
        publishing.incrementAndGet();
        try {
            if (closed)
                return;
            double[][] outputs = result.outputValues();
            for (int port = 0; port < outputs.length; port++) {
                long seq = ringBuffer.next();
                try {
                    ringBuffer.get(seq).set(id.key(), clock.time(TimeScale.TRIAL), clock.time(TimeScale.PASS),
                            clock.time(TimeScale.TIME_STEP), node.name(), port, outputs[port].clone());
                } finally {
                    ringBuffer.publish(seq);
                }
            }
        } finally {
            publishing.decrementAndGet();
        }
    }

    /** Entries consumed so far, in publication order. */
    public List<HistoryEntry> entries() {
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    /** Entries of one node, in publication order. */
    public List<HistoryEntry> entriesOf(String node) {
        List<HistoryEntry> out = new ArrayList<>();
        for (HistoryEntry e : entries())
            if (e.getNode().equals(node))
                out.add(e);
        return out;
    }

    public long failedWrites() {
        return failedWrites.get();
    }

    /**
     * Waits until every published value is consumed, then stops the consumer
     * thread and flushes the writer. Values reported after this call starts
     * are ignored.
     */
    @Override
    public void close() throws IOException {
        if (closed)
            return;
        closed = true;
        while (publishing.get() > 0)
            LockSupport.parkNanos(DRAIN_PARK_NANOS);
        // The consumer sequence exists before its thread starts, so this also
        // covers a consumer that has not run yet.
        long published = ringBuffer.getCursor();
        while (disruptor.getSequenceValueFor(handler) < published)
            LockSupport.parkNanos(DRAIN_PARK_NANOS);
        disruptor.halt();
        if (writer != null)
            writer.flush();
        log.debug("History recorder closed after {} entries", published + 1);
    }

    @Override
    public void onTrialStart(ExecutionId id, SchedulingClock clock) {
        // No-op
    }

    @Override
    public void onPassStart(ExecutionId id, SchedulingClock clock) {
        // No-op
    }

    @Override
    public void onTimeStepStart(ExecutionId id, SchedulingClock clock) {
        // No-op
    }

    @Override
    public void onNodeError(ExecutionId id, SchedulingClock clock, NodeId node, Throwable error) {
        // No-op
    }

    @Override
    public void onTimeStepEnd(ExecutionId id, SchedulingClock clock) {
        // No-op
    }

    @Override
    public void onPassEnd(ExecutionId id, SchedulingClock clock) {
        // No-op
    }

    @Override
    public void onTrialEnd(ExecutionId id, SchedulingClock clock) {
        // No-op
    }
}
