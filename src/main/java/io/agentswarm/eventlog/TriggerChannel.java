package io.agentswarm.eventlog;

import io.agentswarm.model.Trigger;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

public final class TriggerChannel {
    private static final long POLL_SLICE_MS = 100L;

    private final BlockingQueue<Trigger> queue;
    private final long pushTimeoutMs;
    private final AtomicBoolean claimed = new AtomicBoolean(false);
    private final AtomicLong delivered = new AtomicLong();
    private volatile boolean closed;

    public TriggerChannel(int capacity, long pushTimeoutMs) {
        this.queue = new LinkedBlockingQueue<>(Math.max(1, capacity));
        this.pushTimeoutMs = Math.max(0L, pushTimeoutMs);
    }

    boolean push(Trigger trigger) throws InterruptedException {
        if (closed) {
            return false;
        }
        boolean accepted = queue.offer(trigger, pushTimeoutMs, TimeUnit.MILLISECONDS);
        if (accepted) {
            delivered.incrementAndGet();
        }
        return accepted;
    }

    TriggerChannel claim() {
        if (!claimed.compareAndSet(false, true)) {
            throw new IllegalStateException("Trigger channel already has a consumer");
        }
        return this;
    }

    public Trigger take() throws InterruptedException {
        while (!closed) {
            Trigger next = queue.poll(POLL_SLICE_MS, TimeUnit.MILLISECONDS);
            if (next != null) {
                return next;
            }
        }
        return null;
    }

    public Trigger poll(long timeoutMs) throws InterruptedException {
        if (closed) {
            return null;
        }
        return queue.poll(Math.max(0L, timeoutMs), TimeUnit.MILLISECONDS);
    }

    public int pending() {
        return queue.size();
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public boolean isClosed() {
        return closed;
    }

    void close() {
        closed = true;
        queue.clear();
    }
}
