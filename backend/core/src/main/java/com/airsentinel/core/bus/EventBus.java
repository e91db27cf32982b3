package com.airsentinel.core.bus;

import com.airsentinel.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, CopyOnWriteArrayList<Consumer<? super Event>>> byType =
            new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<? super Event>> wildcard = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for type " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> Subscription subscribe(Class<T> type, Consumer<T> handler) {
        Consumer<? super Event> adapter = event -> handler.accept(type.cast(event));
        CopyOnWriteArrayList<Consumer<? super Event>> handlers =
                byType.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>());
        handlers.add(adapter);
        return () -> handlers.remove(adapter);
    }

    public Subscription subscribeAll(Consumer<Event> handler) {
        Consumer<? super Event> adapter = handler::accept;
        wildcard.add(adapter);
        return () -> wildcard.remove(adapter);
    }

    public void publish(Event event) {
        List<Consumer<? super Event>> typed = byType.getOrDefault(event.getClass(), new CopyOnWriteArrayList<>());
        for (Consumer<? super Event> handler : typed) {
            invoke(handler, event);
        }
        for (Consumer<? super Event> handler : wildcard) {
            invoke(handler, event);
        }
    }

    private void invoke(Consumer<? super Event> handler, Event event) {
        try {
            handler.accept(event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
