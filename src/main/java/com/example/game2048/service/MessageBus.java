package com.example.game2048.service;

import com.example.game2048.exception.MissingHandlerException;
import com.example.game2048.model.Message;
import com.example.game2048.model.command.Command;
import com.example.game2048.model.event.Event;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Dispatches commands and events to their handlers.
 *
 * {@link #handle(Message)} processes the message and every event raised
 * while handling it, in FIFO order, before returning. A failing command
 * handler aborts the call; a failing event handler is logged and the other
 * handlers of that event still run.
 */
@Slf4j
public class MessageBus {

    static final String UNKNOWN_MESSAGE_TYPE = "Unexpected message type: ";
    static final String MISSING_COMMAND_HANDLER = "No handler registered for command: ";

    private final UnitOfWork uow;
    private final Map<Class<? extends Command>, MessageHandler<Command>> commandHandlers;
    private final Map<Class<? extends Event>, List<NamedHandler>> eventHandlers;

    private MessageBus(Builder builder) {
        this.uow = builder.uow;
        this.commandHandlers = Collections.unmodifiableMap(new HashMap<>(builder.commandHandlers));
        Map<Class<? extends Event>, List<NamedHandler>> events = new HashMap<>();
        builder.eventHandlers.forEach((type, handlers) -> events.put(type, List.copyOf(handlers)));
        this.eventHandlers = Collections.unmodifiableMap(events);
    }

    public static Builder builder(UnitOfWork uow) {
        return new Builder(uow);
    }

    public UnitOfWork getUnitOfWork() {
        return uow;
    }

    public synchronized void handle(Message message) {
        Deque<Message> queue = new ArrayDeque<>();
        queue.add(message);
        while (!queue.isEmpty()) {
            Message next = queue.poll();
            if (next instanceof Command) {
                handleCommand((Command) next, queue);
            } else if (next instanceof Event) {
                handleEvent((Event) next, queue);
            } else {
                throw new IllegalArgumentException(UNKNOWN_MESSAGE_TYPE + next.getClass().getSimpleName());
            }
        }
    }

    /**
     * Runs a read-only query in its own unit-of-work scope, which is rolled
     * back on exit. Queries are serialized with command handling.
     */
    public synchronized <T> T query(Function<UnitOfWork, T> query) {
        try (UnitOfWork scope = uow.start()) {
            return query.apply(scope);
        }
    }

    private void handleCommand(Command command, Deque<Message> queue) {
        log.debug("Handling command: {}", command);

        MessageHandler<Command> handler = commandHandlers.get(command.getClass());
        if (handler == null) {
            String error = MISSING_COMMAND_HANDLER + command;
            log.error(error);
            throw new MissingHandlerException(error);
        }

        try {
            handler.handle(command);
        } catch (RuntimeException e) {
            log.error("An error occurred while handling command: {}", command, e);
            throw e;
        }

        try {
            queue.addAll(uow.collectNewEvents());
        } catch (RuntimeException e) {
            log.error("An error occurred while collecting events after handling command: {}", command, e);
            throw e;
        }
    }

    private void handleEvent(Event event, Deque<Message> queue) {
        List<NamedHandler> handlers = eventHandlers.getOrDefault(event.getClass(), List.of());
        if (handlers.isEmpty()) {
            log.debug("No handler registered for event: {}", event);
        }

        for (NamedHandler handler : handlers) {
            log.debug("Handling event: {} with handler: {}", event, handler.name());
            try {
                handler.handler().handle(event);
            } catch (RuntimeException e) {
                log.error("An error occurred while handling event: {} in handler: {}", event, handler.name(), e);
                continue;
            }

            try {
                queue.addAll(uow.collectNewEvents());
            } catch (RuntimeException e) {
                log.error("An error occurred while collecting events after handling event: {}", event, e);
            }
        }
    }

    private record NamedHandler(String name, MessageHandler<Event> handler) {
    }

    public static final class Builder {

        private final UnitOfWork uow;
        private final Map<Class<? extends Command>, MessageHandler<Command>> commandHandlers = new HashMap<>();
        private final Map<Class<? extends Event>, List<NamedHandler>> eventHandlers = new HashMap<>();

        private Builder(UnitOfWork uow) {
            this.uow = uow;
        }

        /**
         * Registers the single handler of a command type, replacing any
         * previous one.
         */
        public <C extends Command> Builder command(Class<C> type, MessageHandler<? super C> handler) {
            commandHandlers.put(type, command -> handler.handle(type.cast(command)));
            return this;
        }

        /**
         * Adds a handler for an event type. Handlers run in registration order.
         */
        public <E extends Event> Builder event(Class<E> type, String name, MessageHandler<? super E> handler) {
            eventHandlers.computeIfAbsent(type, key -> new ArrayList<>())
                    .add(new NamedHandler(name, event -> handler.handle(type.cast(event))));
            return this;
        }

        public MessageBus build() {
            return new MessageBus(this);
        }
    }
}
