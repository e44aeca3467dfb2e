package com.funnelforge.collaborator;

import com.funnelforge.FunnelFixtures;
import com.funnelforge.FunnelFixtures.MutableClock;
import com.funnelforge.core.events.EventBus;
import com.funnelforge.core.events.FunnelEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusLogSinkTest {

    @Test
    @DisplayName("records are republished as log events with message and status")
    void republishes() {
        var eventBus = new EventBus();
        List<FunnelEvent> received = new ArrayList<>();
        eventBus.subscribe("log.", received::add);
        var sink = new EventBusLogSink(eventBus, new MutableClock(FunnelFixtures.START));

        sink.record("ad_spend", "Spend executed: 2.00", "success", Map.of("amount", 2.0));
        sink.record("task_error", "Task failed", "error", null);

        assertEquals(2, received.size());
        FunnelEvent spend = received.get(0);
        assertEquals("log.ad_spend", spend.eventType());
        assertEquals(2.0, spend.payload().get("amount"));
        assertEquals("Spend executed: 2.00", spend.payload().get("message"));
        assertEquals("success", spend.payload().get("status"));
        assertEquals(FunnelFixtures.START, spend.timestamp());
        assertEquals("error", received.get(1).payload().get("status"));
    }
}
