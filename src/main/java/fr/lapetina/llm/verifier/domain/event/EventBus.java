package fr.lapetina.llm.verifier.domain.event;

import java.util.Set;
import java.util.function.Consumer;

/**
 * Publish/subscribe channel between the orchestrator and downstream consumers.
 */
public interface EventBus {

    void publish(Event event);

    /**
     * Subscribes a handler to the given event types; an empty set means all types.
     */
    Subscription subscribe(Consumer<Event> handler, Set<EventType> eventTypes);

    /**
     * Handle returned by {@link #subscribe}; cancelling stops further deliveries.
     */
    interface Subscription {
        void cancel();
    }
}
