package com.snapkeeper.core.handler;

import com.snapkeeper.core.events.EventBus;
import com.snapkeeper.core.events.WorkerEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BroadcastHandlerTest {

    @Test
    void republishesWorkerEventsOnTheBus() {
        var bus = new EventBus();
        var handler = new BroadcastHandler(bus);
        List<WorkerEvent> received = new ArrayList<>();
        bus.subscribe("cam1", received::add);

        var event = WorkerEvent.captured("cam1", Instant.now(), new byte[]{1, 2});
        handler.handle(event);

        assertEquals(HandlerType.BROADCAST, handler.type());
        assertEquals(List.of(event), received);
    }

    @Test
    void skipsCamerasNobodyWatches() {
        var bus = mock(EventBus.class);
        when(bus.isWatched("cam1")).thenReturn(false);

        new BroadcastHandler(bus).handle(WorkerEvent.configUpdated("cam1", Instant.now()));

        verify(bus, never()).publish(any());
    }
}
