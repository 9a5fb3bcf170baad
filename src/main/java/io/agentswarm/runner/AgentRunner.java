package io.agentswarm.runner;

import io.agentswarm.agent.AgentExecutor;
import io.agentswarm.agent.ExecutorRegistry;
import io.agentswarm.agent.TurnContext;
import io.agentswarm.agent.TurnResult;
import io.agentswarm.config.SwarmSettings;
import io.agentswarm.eventlog.EventLog;
import io.agentswarm.eventlog.TriggerChannel;
import io.agentswarm.model.Event;
import io.agentswarm.model.EventPayload;
import io.agentswarm.model.Trigger;
import io.agentswarm.model.TriggerOutcome;
import io.agentswarm.observability.Observation;
import io.agentswarm.observability.ObserverHub;
import io.agentswarm.subscription.SubscriptionPattern;
import io.agentswarm.subscription.SubscriptionRegistry;
import io.agentswarm.swarm.AgentState;
import io.agentswarm.swarm.AgentStateStore;
import io.agentswarm.swarm.SwarmRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes triggers from the event log and runs agent turns under three limits: at most
 * {@code maxConcurrency} turns at once, no chained trigger deeper than {@code maxTriggerDepth}
 * hops from its root, and at most one accepted trigger per agent per {@code triggerCooldownMs}.
 *
 * <p>A single dispatch loop pulls and gates triggers; accepted ones wait for a permit and then
 * run on the turn pool. Gate bookkeeping (cooldowns and live cascades) is process-local and
 * starts empty after a restart.
 */
public final class AgentRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);
    private static final long PULL_SLICE_MS = 100L;
    private static final long SHUTDOWN_WAIT_MS = 10_000L;

    private final SwarmSettings settings;
    private final EventLog eventLog;
    private final SubscriptionRegistry subscriptions;
    private final SwarmRegistry swarm;
    private final AgentStateStore states;
    private final ExecutorRegistry executors;
    private final ObserverHub observers;
    private final Clock clock;
    private final TriggerChannel channel;
    private final Semaphore permits;
    private final ExecutorService turnPool;
    private final RunnerStats stats = new RunnerStats();

    private final Object gateLock = new Object();
    private final Map<String, Long> lastAcceptedMs = new HashMap<>();
    private final CascadeTracker cascades = new CascadeTracker();

    private final Object idleMonitor = new Object();
    private final AtomicLong settled = new AtomicLong();
    private final AtomicBoolean loopStarted = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch loopExited = new CountDownLatch(1);
    private volatile boolean running;
    private volatile Thread dispatchThread;

    public AgentRunner(SwarmSettings settings, EventLog eventLog, SubscriptionRegistry subscriptions,
                       SwarmRegistry swarm, AgentStateStore states, ExecutorRegistry executors,
                       ObserverHub observers, Clock clock) {
        this.settings = settings;
        this.eventLog = eventLog;
        this.subscriptions = subscriptions;
        this.swarm = swarm;
        this.states = states;
        this.executors = executors;
        this.observers = observers;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.channel = eventLog.triggers();
        this.permits = new Semaphore(settings.maxConcurrency());
        AtomicInteger seq = new AtomicInteger();
        this.turnPool = Executors.newFixedThreadPool(settings.maxConcurrency(), r -> {
            Thread t = new Thread(r, "swarm-turn-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public AgentRunner start() {
        Thread t = new Thread(this::runForever, "swarm-dispatch");
        t.setDaemon(true);
        t.start();
        return this;
    }

    public void runForever() {
        if (stopped.get()) {
            throw new IllegalStateException("Runner is stopped");
        }
        if (!loopStarted.compareAndSet(false, true)) {
            throw new IllegalStateException("Dispatch loop already running");
        }
        dispatchThread = Thread.currentThread();
        running = true;
        log.info("Agent runner started (maxConcurrency={}, maxTriggerDepth={}, cooldownMs={})",
                settings.maxConcurrency(), settings.maxTriggerDepth(), settings.triggerCooldownMs());
        try {
            while (running) {
                Trigger trigger;
                try {
                    trigger = channel.poll(PULL_SLICE_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (trigger == null) {
                    if (channel.isClosed()) {
                        break;
                    }
                    continue;
                }
                stats.received();
                if (!dispatch(trigger)) {
                    break;
                }
            }
        } finally {
            running = false;
            loopExited.countDown();
            log.info("Agent runner dispatch loop exited");
        }
    }

    private boolean dispatch(Trigger trigger) {
        Event event = trigger.event();
        String cascadeId = event.cascadeId();
        GateDecision gate;
        try {
            gate = gate(trigger);
        } catch (RuntimeException e) {
            log.error("Gate failed for agent {} on event {}", trigger.agentId(), trigger.eventId(), e);
            settle(trigger, TriggerOutcome.FAILED, "gate error: " + e.getMessage());
            return true;
        }
        if (gate.outcome() != TriggerOutcome.ACCEPTED) {
            log.debug("Skipped trigger for {} on event {}: {}", trigger.agentId(), trigger.eventId(), gate.reason());
            if (settings.emitSkipEvents()) {
                appendSkipWarning(trigger, gate.reason());
            }
            settle(trigger, gate.outcome(), gate.reason());
            return true;
        }
        log.debug("Accepted trigger for {} on event {} (cascade={}, depth={})",
                trigger.agentId(), trigger.eventId(), cascadeId, event.cascadeDepth());
        publishDecision(trigger, TriggerOutcome.ACCEPTED, "");
        stats.record(TriggerOutcome.ACCEPTED);

        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseCascade(cascadeId);
            settle(trigger, TriggerOutcome.CANCELLED, "runner stopping");
            return false;
        }
        try {
            turnPool.execute(new TurnTask(trigger));
        } catch (RejectedExecutionException e) {
            permits.release();
            releaseCascade(cascadeId);
            settle(trigger, TriggerOutcome.CANCELLED, "turn pool shut down");
            return false;
        }
        return true;
    }

    private GateDecision gate(Trigger trigger) {
        Event event = trigger.event();
        synchronized (gateLock) {
            if (!event.isRoot() && event.cascadeDepth() > settings.maxTriggerDepth()) {
                return new GateDecision(TriggerOutcome.SKIPPED_DEPTH,
                        "cascade depth " + event.cascadeDepth() + " exceeds limit " + settings.maxTriggerDepth());
            }
            long nowMs = clock.millis();
            Long last = lastAcceptedMs.get(trigger.agentId());
            if (last != null && nowMs - last < settings.triggerCooldownMs()) {
                return new GateDecision(TriggerOutcome.SKIPPED_COOLDOWN,
                        "cooldown active for " + (settings.triggerCooldownMs() - (nowMs - last)) + "ms");
            }
            lastAcceptedMs.put(trigger.agentId(), nowMs);
            cascades.enter(event.cascadeId());
            return new GateDecision(TriggerOutcome.ACCEPTED, "");
        }
    }

    private void appendSkipWarning(Trigger trigger, String reason) {
        Event event = trigger.event();
        try {
            eventLog.append(Event.of(new EventPayload.TriggerSkipped(trigger.agentId(), trigger.eventId(), reason))
                    .withGraphId(settings.swarmId())
                    .inCascade(event.cascadeId(), event.cascadeDepth() + 1));
        } catch (RuntimeException e) {
            log.warn("Could not record skipped trigger for {} on event {}: {}",
                    trigger.agentId(), trigger.eventId(), e.getMessage());
        }
    }

    private void runTurn(Trigger trigger) {
        String agentId = trigger.agentId();
        Event event = trigger.event();
        String cascadeId = event.cascadeId();
        TurnTools tools = new TurnTools(agentId, settings.swarmId(), cascadeId, event.cascadeDepth() + 1,
                eventLog, subscriptions, swarm);
        TriggerOutcome outcome = TriggerOutcome.FAILED;
        String reason = "";
        AgentState state = null;
        try {
            Optional<AgentState> loaded = states.load(agentId);
            if (loaded.isEmpty()) {
                reason = "Agent state not found at " + states.layout().statePath(agentId);
                log.error("No state for agent {}: {}", agentId, reason);
                tools.emit(new EventPayload.AgentFailed(agentId, reason), List.of());
                return;
            }
            state = loaded.get();
            TurnContext context = new TurnContext(state, event, cascadeId, event.cascadeDepth(),
                    state.chatHistory(), tools);
            tools.emit(new EventPayload.AgentStarted(agentId, state.nodeType()), List.of());

            AgentExecutor executor = executors.resolve(state.nodeType());
            TurnResult result;
            try {
                result = executor.execute(context);
                if (result == null) {
                    result = TurnResult.fail("executor " + executor.name() + " returned no result");
                }
            } catch (InterruptedException e) {
                outcome = TriggerOutcome.CANCELLED;
                reason = "cancelled";
                recordFailure(tools, state, "cancelled");
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.warn("Turn for agent {} failed: {}", agentId, message, e);
                result = TurnResult.fail(message);
            }

            if (result.success()) {
                complete(tools, state, event, result);
                outcome = TriggerOutcome.COMPLETED;
            } else {
                reason = result.error() == null ? "" : result.error();
                recordFailure(tools, state, reason);
            }
        } catch (RuntimeException e) {
            reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.error("Turn for agent {} on event {} aborted", agentId, trigger.eventId(), e);
            reportAbort(tools, state, agentId, reason);
        } finally {
            permits.release();
            releaseCascade(cascadeId);
            settle(trigger, outcome, reason);
        }
    }

    private void complete(TurnTools tools, AgentState state, Event trigger, TurnResult result) {
        String agentId = state.agentId();
        for (String artifact : result.changedArtifacts()) {
            tools.emit(EventPayload.ContentChanged.of(artifact), List.of());
        }
        long nowMs = clock.millis();
        List<AgentState.ChatEntry> entries = List.of(
                new AgentState.ChatEntry(AgentState.ChatEntry.TRIGGER, describe(trigger), trigger.id(), nowMs),
                new AgentState.ChatEntry(AgentState.ChatEntry.RESPONSE,
                        truncate(result.response(), settings.summaryMaxChars()), trigger.id(), nowMs)
        );
        AgentState next = state.withChat(entries, settings.chatHistoryLimit())
                .withConnections(result.connections())
                .withOutcome(TriggerOutcome.COMPLETED.name(), null, result.snapshotRef());
        for (SubscriptionPattern pattern : tools.addedSubscriptions()) {
            next = next.withCustomSubscription(pattern);
        }
        states.save(next);
        String summary = result.summary().isBlank() ? result.response() : result.summary();
        tools.emit(new EventPayload.AgentCompleted(agentId, truncate(summary, settings.summaryMaxChars()),
                result.response(), result.changedArtifacts()), List.of());
    }

    private void recordFailure(TurnTools tools, AgentState state, String error) {
        states.save(failed(tools, state, error));
        tools.emit(new EventPayload.AgentFailed(state.agentId(), error), List.of());
    }

    private static AgentState failed(TurnTools tools, AgentState state, String error) {
        AgentState next = state.withOutcome(TriggerOutcome.FAILED.name(), error, null);
        for (SubscriptionPattern pattern : tools.addedSubscriptions()) {
            next = next.withCustomSubscription(pattern);
        }
        return next;
    }

    private void reportAbort(TurnTools tools, AgentState state, String agentId, String reason) {
        if (state != null) {
            try {
                states.save(failed(tools, state, reason));
            } catch (RuntimeException e) {
                log.warn("Could not persist failure of agent {}: {}", agentId, e.getMessage());
            }
        }
        if (eventLog.isClosed()) {
            return;
        }
        try {
            tools.emit(new EventPayload.AgentFailed(agentId, reason), List.of());
        } catch (RuntimeException e) {
            log.warn("Could not record failure of agent {}: {}", agentId, e.getMessage());
        }
    }

    private void releaseCascade(String cascadeId) {
        synchronized (gateLock) {
            cascades.exit(cascadeId);
        }
    }

    private void settle(Trigger trigger, TriggerOutcome outcome, String reason) {
        if (outcome != TriggerOutcome.ACCEPTED) {
            stats.record(outcome);
        }
        publishDecision(trigger, outcome, reason);
        settled.incrementAndGet();
        synchronized (idleMonitor) {
            idleMonitor.notifyAll();
        }
    }

    private void publishDecision(Trigger trigger, TriggerOutcome outcome, String reason) {
        Event event = trigger.event();
        observers.publish(new Observation.Decision(trigger.agentId(), trigger.eventId(), event.cascadeId(),
                event.cascadeDepth(), outcome, reason, clock.millis()));
    }

    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (settled.get() < channel.deliveredCount()) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                idleMonitor.wait(Math.min(remainingMs, PULL_SLICE_MS));
            }
            return true;
        }
    }

    public RunnerStats stats() {
        return stats;
    }

    public int liveCascades() {
        synchronized (gateLock) {
            return cascades.liveCascades();
        }
    }

    public int inFlight(String cascadeId) {
        synchronized (gateLock) {
            return cascades.inFlight(cascadeId);
        }
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    public boolean isRunning() {
        return running;
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        running = false;
        Thread loop = dispatchThread;
        if (loop != null && loop != Thread.currentThread()) {
            loop.interrupt();
            try {
                loopExited.await(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        for (Runnable pending : turnPool.shutdownNow()) {
            if (pending instanceof TurnTask task) {
                permits.release();
                releaseCascade(task.trigger().event().cascadeId());
                settle(task.trigger(), TriggerOutcome.CANCELLED, "runner stopped before the turn started");
            }
        }
        try {
            if (!turnPool.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Turn pool did not terminate within {}ms", SHUTDOWN_WAIT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        synchronized (gateLock) {
            lastAcceptedMs.clear();
            cascades.clear();
        }
        eventLog.close();
        subscriptions.close();
        swarm.close();
        RunnerStats.Snapshot s = stats.snapshot();
        log.info("Agent runner stopped (received={}, completed={}, failed={}, skippedDepth={}, skippedCooldown={}, cancelled={})",
                s.received(), s.completed(), s.failed(), s.skippedDepth(), s.skippedCooldown(), s.cancelled());
    }

    @Override
    public void close() {
        stop();
    }

    private static String describe(Event event) {
        EventPayload payload = event.payload();
        if (payload instanceof EventPayload.AgentMessage message) {
            return "message from " + message.fromAgent() + ": " + message.content();
        }
        if (payload instanceof EventPayload.ManualTrigger manual) {
            return "manual trigger: " + manual.reason();
        }
        return event.eventType().wireName() + event.path().map(p -> " " + p).orElse("");
    }

    private static String truncate(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        if (value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars - 3) + "...";
    }

    private record GateDecision(TriggerOutcome outcome, String reason) {
    }

    private final class TurnTask implements Runnable {
        private final Trigger trigger;

        TurnTask(Trigger trigger) {
            this.trigger = trigger;
        }

        Trigger trigger() {
            return trigger;
        }

        @Override
        public void run() {
            runTurn(trigger);
        }
    }
}
