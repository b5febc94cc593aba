package com.liquidity.backend.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Typed publish/subscribe channel. Listeners are invoked synchronously on the publishing thread in
 * registration order; a failing listener is logged and does not stop delivery to the others.
 */
@Slf4j
public class EventChannel<E> {

    private final String name;
    private final List<Consumer<? super E>> listeners = new CopyOnWriteArrayList<>();

    public EventChannel(String name) {
        this.name = name;
    }

    public Subscription subscribe(Consumer<? super E> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(E event) {
        for (Consumer<? super E> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Listener failed channel={} event={}", name, event, e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void clear() {
        listeners.clear();
    }
}
