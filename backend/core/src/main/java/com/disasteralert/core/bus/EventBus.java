package com.disasteralert.core.bus;

import com.disasteralert.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process fan-out of dispatch lifecycle events. Handlers run on the publishing thread, so a
 * dispatch pass sees its journal entries written before it moves on. A handler that throws is
 * reported to the error callback and never reaches the publisher.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<Event>>> handlersByType = new ConcurrentHashMap<>();
    private final List<Consumer<Event>> wildcardHandlers = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Handler for " + event.type() + " failed", ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = Objects.requireNonNull(onHandlerError, "onHandlerError");
    }

    /**
     * @return a handle that removes the handler again
     */
    public <T extends Event> Runnable subscribe(Class<T> type, Consumer<T> handler) {
        Objects.requireNonNull(handler, "handler");
        Consumer<Event> adapter = event -> handler.accept(type.cast(event));
        List<Consumer<Event>> handlers = handlersByType.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>());
        handlers.add(adapter);
        return () -> handlers.remove(adapter);
    }

    /**
     * Registers a handler for every published event, such as the dispatch journal.
     *
     * @return a handle that removes the handler again
     */
    public Runnable subscribeAll(Consumer<Event> handler) {
        Objects.requireNonNull(handler, "handler");
        wildcardHandlers.add(handler);
        return () -> wildcardHandlers.remove(handler);
    }

    public void publish(Event event) {
        Objects.requireNonNull(event, "event");
        deliver(handlersByType.getOrDefault(event.getClass(), List.of()), event);
        deliver(wildcardHandlers, event);
    }

    public int handlerCount() {
        int typed = handlersByType.values().stream().mapToInt(List::size).sum();
        return typed + wildcardHandlers.size();
    }

    private void deliver(List<Consumer<Event>> handlers, Event event) {
        for (Consumer<Event> handler : handlers) {
            try {
                handler.accept(event);
            } catch (Exception ex) {
                onHandlerError.accept(event, ex);
            }
        }
    }
}
