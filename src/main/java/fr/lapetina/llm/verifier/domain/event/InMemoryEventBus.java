package fr.lapetina.llm.verifier.domain.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process event bus. Handlers run on the publishing thread, so they should hand
 * off any slow work; a failing handler is logged and does not affect the others.
 */
public final class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    @Override
    public void publish(Event event) {
        log.debug("Event published: type={}, severity={}, source={}",
                event.type(), event.severity(), event.source());
        for (Registration registration : registrations) {
            if (!registration.accepts(event.type())) {
                continue;
            }
            try {
                registration.handler.accept(event);
            } catch (Exception e) {
                log.error("Error notifying event handler: type={}, eventId={}", event.type(), event.id(), e);
            }
        }
    }

    @Override
    public Subscription subscribe(Consumer<Event> handler, Set<EventType> eventTypes) {
        Set<EventType> types = eventTypes == null || eventTypes.isEmpty()
                ? EnumSet.allOf(EventType.class)
                : EnumSet.copyOf(eventTypes);
        Registration registration = new Registration(handler, types);
        registrations.add(registration);
        log.debug("Event handler subscribed: types={}", types);
        return () -> registrations.remove(registration);
    }

    public int subscriberCount() {
        return registrations.size();
    }

    private static final class Registration {
        private final Consumer<Event> handler;
        private final Set<EventType> types;

        private Registration(Consumer<Event> handler, Set<EventType> types) {
            this.handler = handler;
            this.types = types;
        }

        private boolean accepts(EventType type) {
            return types.contains(type);
        }
    }
}
