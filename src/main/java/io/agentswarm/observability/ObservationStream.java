package io.agentswarm.observability;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

public final class ObservationStream implements AutoCloseable {
    private final ObserverHub hub;
    private final int capacity;
    private final Deque<Observation> buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    ObservationStream(ObserverHub hub, int capacity) {
        this.hub = hub;
        this.capacity = Math.max(1, capacity);
        this.buffer = new ArrayDeque<>(this.capacity);
    }

    void offer(Observation observation) {
        if (closed) {
            return;
        }
        lock.lock();
        try {
            if (buffer.size() >= capacity) {
                buffer.pollFirst();
                dropped.incrementAndGet();
            }
            buffer.addLast(observation);
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public Observation poll(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout == null ? 0L : timeout.toNanos();
        lock.lock();
        try {
            while (buffer.isEmpty()) {
                if (closed || remainingNanos <= 0L) {
                    return null;
                }
                remainingNanos = notEmpty.awaitNanos(remainingNanos);
            }
            return buffer.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public List<Observation> drain() {
        lock.lock();
        try {
            List<Observation> out = new ArrayList<>(buffer);
            buffer.clear();
            return out;
        } finally {
            lock.unlock();
        }
    }

    public long droppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed;
    }

    void markClosed() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        markClosed();
        hub.detach(this);
    }
}
