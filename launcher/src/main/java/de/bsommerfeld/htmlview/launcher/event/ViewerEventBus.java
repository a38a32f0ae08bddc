package de.bsommerfeld.htmlview.launcher.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus} through which the launcher
 * announces viewer lifecycle changes. Delivery is synchronous on the thread
 * that posts; subscribing is optional.
 */
@Singleton
public class ViewerEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ViewerEventBus.class);
    private final EventBus eventBus;

    public ViewerEventBus() {
        this.eventBus = new EventBus("HtmlView-EventBus");
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }
}
