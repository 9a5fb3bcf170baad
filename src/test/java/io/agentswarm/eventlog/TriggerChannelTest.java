package io.agentswarm.eventlog;

import io.agentswarm.model.Event;
import io.agentswarm.model.EventPayload;
import io.agentswarm.model.Trigger;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class TriggerChannelTest {

    @Test
    void onlyOneConsumerMayClaim() {
        TriggerChannel channel = new TriggerChannel(4, 10L);
        assertSame(channel, channel.claim());
        assertThrows(IllegalStateException.class, channel::claim);
    }

    @Test
    void pushWaitsAtMostTheTimeoutWhenFull() throws Exception {
        TriggerChannel channel = new TriggerChannel(1, 30L);
        assertTrue(channel.push(trigger("a", 1L)));
        long started = System.nanoTime();
        assertFalse(channel.push(trigger("a", 2L)));
        assertTrue(System.nanoTime() - started >= 20_000_000L);
        assertEquals(1L, channel.deliveredCount());
        assertEquals(1L, channel.take().eventId());
    }

    @Test
    void closedChannelRefusesPushesAndEndsTake() throws Exception {
        TriggerChannel channel = new TriggerChannel(4, 10L);
        channel.push(trigger("a", 1L));
        channel.close();
        assertTrue(channel.isClosed());
        assertEquals(0, channel.pending());
        assertFalse(channel.push(trigger("a", 2L)));
        assertNull(channel.take());
        assertNull(channel.poll(10L));
    }

    private static Trigger trigger(String agentId, long eventId) {
        Event event = Event.of(new EventPayload.ManualTrigger(agentId, "test")).withId(eventId);
        return new Trigger(agentId, eventId, event);
    }
}
