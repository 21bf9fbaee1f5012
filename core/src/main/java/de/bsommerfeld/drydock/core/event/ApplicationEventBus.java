package de.bsommerfeld.drydock.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus}. This is the invalidation
 * channel between background work and the render loop: producers post
 * events, subscribers react on the posting thread.
 *
 * <p>
 * Subscriber failures are logged and never propagate back into the poster,
 * so a broken listener cannot take down the sync scheduler.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::logSubscriberFailure);
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

    private static void logSubscriberFailure(Throwable exception, SubscriberExceptionContext context) {
        LOG.error("Listener {} failed on event {}",
                context.getSubscriber().getClass().getName(), context.getEvent(), exception);
    }
}
