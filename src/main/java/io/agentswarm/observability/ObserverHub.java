package io.agentswarm.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

public final class ObserverHub implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ObserverHub.class);

    private final int defaultCapacity;
    private final List<ObservationStream> streams = new CopyOnWriteArrayList<>();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private volatile boolean open;

    public ObserverHub(int defaultCapacity) {
        this.defaultCapacity = Math.max(1, defaultCapacity);
    }

    public ObserverHub init() {
        open = true;
        log.debug("Observer hub opened (defaultCapacity={})", defaultCapacity);
        return this;
    }

    public ObservationStream subscribe() {
        return subscribe(defaultCapacity);
    }

    public ObservationStream subscribe(int capacity) {
        if (!open) {
            throw new IllegalStateException("Observer hub is not open");
        }
        ObservationStream stream = new ObservationStream(this, capacity);
        streams.add(stream);
        return stream;
    }

    public void publish(Observation observation) {
        if (observation == null) {
            return;
        }
        if (!open) {
            discarded.incrementAndGet();
            return;
        }
        published.incrementAndGet();
        for (ObservationStream stream : streams) {
            stream.offer(observation);
        }
    }

    public int subscriberCount() {
        return streams.size();
    }

    public long publishedCount() {
        return published.get();
    }

    public long discardedCount() {
        return discarded.get();
    }

    void detach(ObservationStream stream) {
        streams.remove(stream);
    }

    @Override
    public void close() {
        if (!open) {
            return;
        }
        open = false;
        for (ObservationStream stream : streams) {
            stream.markClosed();
        }
        streams.clear();
        log.debug("Observer hub closed (published={}, discarded={})", published.get(), discarded.get());
    }
}
