package de.bsommerfeld.htmlview.launcher.event;

import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ViewerEventBusTest {

    @Test
    void post_shouldDeliverToTypedSubscriber() {
        var eventBus = new ViewerEventBus();
        var received = new AtomicReference<ViewerEvents.ViewerLaunchedEvent>();
        var event = new ViewerEvents.ViewerLaunchedEvent(UUID.randomUUID(), 42, true);

        eventBus.register(new Object() {
            @Subscribe
            public void onLaunch(ViewerEvents.ViewerLaunchedEvent e) {
                received.set(e);
            }
        });
        eventBus.post(event);

        assertEquals(event, received.get());
    }

    @Test
    void unregister_shouldStopDelivery() {
        var eventBus = new ViewerEventBus();
        var received = new AtomicReference<Object>();
        Object listener = new Object() {
            @Subscribe
            public void onAck(ViewerEvents.CommandAcknowledgedEvent e) {
                received.set(e);
            }
        };

        eventBus.register(listener);
        eventBus.unregister(listener);
        eventBus.post(new ViewerEvents.CommandAcknowledgedEvent(UUID.randomUUID(), 1));

        assertNull(received.get());
    }

    @Test
    void post_shouldTolerateMissingSubscribers() {
        assertDoesNotThrow(() -> new ViewerEventBus().post(new ViewerEvents.CommandAcknowledgedEvent(UUID.randomUUID(), 3)));
    }
}
