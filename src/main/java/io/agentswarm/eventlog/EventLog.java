package io.agentswarm.eventlog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.agentswarm.model.Event;
import io.agentswarm.model.EventPayload;
import io.agentswarm.model.EventType;
import io.agentswarm.model.Trigger;
import io.agentswarm.model.TriggerOutcome;
import io.agentswarm.observability.Observation;
import io.agentswarm.observability.ObserverHub;
import io.agentswarm.storage.Database;
import io.agentswarm.subscription.SubscriptionRegistry;
import io.agentswarm.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Append-only, durable event log that routes each appended event to its subscribers.
 *
 * <p>Appends are serialized: the row is committed, the event is matched against the
 * subscription registry, one {@link Trigger} per matched agent is pushed onto the
 * {@link TriggerChannel} and finally the event is published on the {@link ObserverHub}.
 * Deliveries therefore follow id order. A failed persist throws {@link EventLogException}
 * before anything is delivered; a failed push only affects that one agent.
 *
 * <p>Events appended to the same file by other processes are routed here only after
 * {@link #follow()}, each time {@link #routeExternalAppends()} runs.
 */
public final class EventLog implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventLog.class);
    private static final int REPLAY_PAGE_SIZE = 256;
    private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {
    };

    private static final List<Database.MigrationStep> MIGRATIONS = List.of(
            new Database.MigrationStep(
                    "20261019_001_routing_backfill",
                    "Backfill routing columns for events written before routing fields existed",
                    EventLog::backfillRouting
            ),
            new Database.MigrationStep(
                    "20261019_002_event_indexes",
                    "Index events by graph, type and cascade",
                    conn -> {
                        try (Statement st = conn.createStatement()) {
                            st.execute("CREATE INDEX IF NOT EXISTS idx_events_graph ON events(graph_id, id)");
                            st.execute("CREATE INDEX IF NOT EXISTS idx_events_type ON events(event_type, id)");
                            st.execute("CREATE INDEX IF NOT EXISTS idx_events_correlation ON events(correlation_id)");
                        }
                    }
            )
    );

    private final Database database;
    private final SubscriptionRegistry subscriptions;
    private final ObserverHub observers;
    private final TriggerChannel triggers;
    private final Object appendLock = new Object();
    private final AtomicLong deliveryFailures = new AtomicLong();
    private final Set<Long> localIds = new HashSet<>();
    private long followedId = -1L;
    private volatile boolean closed;

    public EventLog(Database database, SubscriptionRegistry subscriptions, ObserverHub observers,
                    int triggerCapacity, long pushTimeoutMs) {
        this.database = database;
        this.subscriptions = subscriptions;
        this.observers = observers;
        this.triggers = new TriggerChannel(triggerCapacity, pushTimeoutMs);
        database.init(EventLog::createSchema, MIGRATIONS);
    }

    private static void createSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS events (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        graph_id TEXT NOT NULL DEFAULT '',
                        event_type TEXT NOT NULL,
                        payload TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
        }
        Database.ensureColumn(conn, "events", "from_agent", "TEXT");
        Database.ensureColumn(conn, "events", "to_agent", "TEXT");
        Database.ensureColumn(conn, "events", "path", "TEXT");
        Database.ensureColumn(conn, "events", "correlation_id", "TEXT");
        Database.ensureColumn(conn, "events", "tags", "TEXT NOT NULL DEFAULT '[]'");
        Database.ensureColumn(conn, "events", "cascade_depth", "INTEGER NOT NULL DEFAULT 0");
    }

    private static void backfillRouting(Connection conn) throws SQLException {
        List<Long> ids = new ArrayList<>();
        List<Event> decoded = new ArrayList<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT id,event_type,payload FROM events WHERE from_agent IS NULL AND to_agent IS NULL AND path IS NULL")) {
            while (rs.next()) {
                long id = rs.getLong("id");
                try {
                    decoded.add(Event.of(decodePayload(rs.getString("event_type"), rs.getString("payload"))));
                    ids.add(id);
                } catch (IllegalArgumentException e) {
                    log.warn("Event {} has an unreadable payload, routing columns left empty: {}", id, e.getMessage());
                }
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE events SET from_agent=?, to_agent=?, path=? WHERE id=?")) {
            for (int i = 0; i < ids.size(); i++) {
                Event event = decoded.get(i);
                ps.setString(1, event.fromAgent().orElse(null));
                ps.setString(2, event.toAgent().orElse(null));
                ps.setString(3, event.path().orElse(null));
                ps.setLong(4, ids.get(i));
                ps.executeUpdate();
            }
        }
        if (!ids.isEmpty()) {
            log.info("Backfilled routing columns for {} legacy events", ids.size());
        }
    }

    public long append(Event event) {
        return appendAndGet(event).id();
    }

    public Event appendAndGet(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        synchronized (appendLock) {
            if (closed) {
                throw new IllegalStateException("Event log is closed");
            }
            Event stored = persist(event);
            if (followedId >= 0) {
                localIds.add(stored.id());
            }
            route(stored);
            observers.publish(new Observation.Appended(stored));
            return stored;
        }
    }

    private Event persist(Event event) {
        long createdAtMs = event.createdAtMs() > 0 ? event.createdAtMs() : System.currentTimeMillis();
        String sql = """
                INSERT INTO events(graph_id,event_type,payload,created_at_ms,from_agent,to_agent,path,correlation_id,tags,cascade_depth)
                VALUES(?,?,?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection()) {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, event.graphId());
                ps.setString(2, event.eventType().wireName());
                ps.setString(3, Jsons.toCompactJson(event.payload()));
                ps.setLong(4, createdAtMs);
                ps.setString(5, event.fromAgent().orElse(null));
                ps.setString(6, event.toAgent().orElse(null));
                ps.setString(7, event.path().orElse(null));
                ps.setString(8, event.correlationId());
                ps.setString(9, Jsons.toCompactJson(event.tags()));
                ps.setInt(10, event.cascadeDepth());
                ps.executeUpdate();
            }
            long id;
            try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
                if (!rs.next()) {
                    throw new EventLogException("No id assigned to appended " + event.eventType().wireName() + " event");
                }
                id = rs.getLong(1);
            }
            return new Event(id, event.graphId(), event.correlationId(), event.cascadeDepth(), event.tags(),
                    createdAtMs, event.payload());
        } catch (EventLogException e) {
            throw e;
        } catch (SQLException | RuntimeException e) {
            throw new EventLogException("Failed to append " + event.eventType().wireName() + " event", e);
        }
    }

    private void route(Event stored) {
        List<String> agents;
        try {
            agents = subscriptions.getMatchingAgents(stored);
        } catch (RuntimeException e) {
            deliveryFailures.incrementAndGet();
            log.warn("Event {} persisted but subscriber matching failed: {}", stored.id(), e.getMessage(), e);
            return;
        }
        for (String agentId : agents) {
            boolean pushed;
            String reason;
            try {
                pushed = triggers.push(new Trigger(agentId, stored.id(), stored));
                reason = pushed ? "" : (triggers.isClosed() ? "trigger channel closed" : "trigger channel full");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pushed = false;
                reason = "interrupted while delivering";
            }
            if (!pushed) {
                deliveryFailures.incrementAndGet();
                log.warn("Trigger for agent {} on event {} not delivered: {}", agentId, stored.id(), reason);
                observers.publish(new Observation.Decision(agentId, stored.id(), stored.cascadeId(),
                        stored.cascadeDepth(), TriggerOutcome.DELIVERY_FAILED, reason, System.currentTimeMillis()));
            }
        }
    }

    public void follow() {
        synchronized (appendLock) {
            if (closed) {
                throw new IllegalStateException("Event log is closed");
            }
            if (followedId < 0) {
                followedId = lastId();
                log.info("Following event log from id {}", followedId);
            }
        }
    }

    public int routeExternalAppends() {
        synchronized (appendLock) {
            if (closed || followedId < 0) {
                return 0;
            }
            int routed = 0;
            try (Stream<Event> fresh = replay(ReplayFilter.after(followedId))) {
                Iterator<Event> it = fresh.iterator();
                while (it.hasNext()) {
                    Event event = it.next();
                    followedId = event.id();
                    if (localIds.remove(event.id())) {
                        continue;
                    }
                    route(event);
                    observers.publish(new Observation.Appended(event));
                    routed++;
                }
            }
            if (routed > 0) {
                log.debug("Routed {} events appended by other processes (up to id {})", routed, followedId);
            }
            return routed;
        }
    }

    public Stream<Event> replay(long afterId) {
        return replay(ReplayFilter.after(afterId));
    }

    public Stream<Event> replay(long afterId, String graphId) {
        return replay(ReplayFilter.after(afterId).withGraph(graphId));
    }

    public Stream<Event> replay(ReplayFilter filter) {
        ReplayFilter f = filter == null ? ReplayFilter.all() : filter;
        long upperBound = lastId();
        Iterator<Event> pages = new PagedIterator(f, upperBound);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public TriggerChannel triggers() {
        return triggers.claim();
    }

    public long lastId() {
        try (Connection c = database.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COALESCE(MAX(id),0) FROM events")) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new EventLogException("Failed to read last event id", e);
        }
    }

    public long eventCount(String graphId) {
        String sql = graphId == null
                ? "SELECT COUNT(*) FROM events"
                : "SELECT COUNT(*) FROM events WHERE graph_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (graphId != null) {
                ps.setString(1, graphId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new EventLogException("Failed to count events", e);
        }
    }

    public List<GraphSummary> graphSummaries(int limit) {
        String sql = """
                SELECT graph_id, MIN(created_at_ms) AS first_ms, MAX(created_at_ms) AS last_ms, COUNT(*) AS cnt
                FROM events
                GROUP BY graph_id
                ORDER BY last_ms DESC, graph_id
                LIMIT ?
                """;
        List<GraphSummary> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new GraphSummary(
                            rs.getString("graph_id"),
                            rs.getLong("first_ms"),
                            rs.getLong("last_ms"),
                            rs.getLong("cnt")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new EventLogException("Failed to summarize graphs", e);
        }
    }

    public long deliveryFailures() {
        return deliveryFailures.get();
    }

    public boolean isClosed() {
        return closed;
    }

    Database database() {
        return database;
    }

    @Override
    public void close() {
        synchronized (appendLock) {
            if (closed) {
                return;
            }
            closed = true;
            triggers.close();
            database.close();
        }
        log.debug("Event log closed (deliveryFailures={})", deliveryFailures.get());
    }

    private List<Event> page(ReplayFilter f, long afterId, long upperBound) {
        StringBuilder sql = new StringBuilder("""
                SELECT id,graph_id,event_type,payload,created_at_ms,correlation_id,tags,cascade_depth
                FROM events WHERE id > ? AND id <= ?""");
        List<Object> params = new ArrayList<>();
        params.add(afterId);
        params.add(upperBound);
        if (f.graphId() != null) {
            sql.append(" AND graph_id = ?");
            params.add(f.graphId());
        }
        if (!f.eventTypes().isEmpty()) {
            List<EventType> types = new ArrayList<>(f.eventTypes());
            types.sort(Comparator.comparing(EventType::wireName));
            sql.append(" AND event_type IN (");
            for (int i = 0; i < types.size(); i++) {
                sql.append(i == 0 ? "?" : ",?");
                params.add(types.get(i).wireName());
            }
            sql.append(')');
        }
        if (f.sinceMs() != null) {
            sql.append(" AND created_at_ms >= ?");
            params.add(f.sinceMs());
        }
        if (f.untilMs() != null) {
            sql.append(" AND created_at_ms <= ?");
            params.add(f.untilMs());
        }
        sql.append(" ORDER BY id LIMIT ").append(REPLAY_PAGE_SIZE);

        List<Event> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readEvent(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new EventLogException("Failed to replay events after id " + afterId, e);
        }
    }

    private static Event readEvent(ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        EventPayload payload;
        List<String> tags;
        try {
            payload = decodePayload(rs.getString("event_type"), rs.getString("payload"));
            String rawTags = rs.getString("tags");
            tags = rawTags == null || rawTags.isBlank() ? List.of() : Jsons.compact().readValue(rawTags, TAG_LIST);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventLogException("Corrupt event row " + id, e);
        }
        return new Event(
                id,
                rs.getString("graph_id"),
                rs.getString("correlation_id"),
                rs.getInt("cascade_depth"),
                tags,
                rs.getLong("created_at_ms"),
                payload
        );
    }

    private static EventPayload decodePayload(String type, String json) {
        EventType eventType = EventType.fromString(type);
        try {
            return Jsons.compact().readValue(json, eventType.payloadType());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable " + eventType.wireName() + " payload", e);
        }
    }

    private final class PagedIterator implements Iterator<Event> {
        private final ReplayFilter filter;
        private final long upperBound;
        private final Deque<Event> buffer = new ArrayDeque<>();
        private long cursor;
        private boolean exhausted;

        PagedIterator(ReplayFilter filter, long upperBound) {
            this.filter = filter;
            this.upperBound = upperBound;
            this.cursor = filter.afterId();
        }

        @Override
        public boolean hasNext() {
            if (buffer.isEmpty() && !exhausted) {
                List<Event> next = page(filter, cursor, upperBound);
                if (next.size() < REPLAY_PAGE_SIZE) {
                    exhausted = true;
                }
                if (!next.isEmpty()) {
                    cursor = next.get(next.size() - 1).id();
                    buffer.addAll(next);
                }
            }
            return !buffer.isEmpty();
        }

        @Override
        public Event next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.pollFirst();
        }
    }
}
