package com.flyknight.client;

import com.flyknight.protocol.Message;
import com.flyknight.protocol.MessageType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers host messages to the handlers registered for their type.
 *
 * Handlers run on the mirror's receive worker, in registration order. A
 * handler that throws is logged and skipped; the remaining handlers and the
 * worker carry on. Subscribing and unsubscribing is allowed from any thread,
 * including from inside a handler.
 */
public class ClientEventBus {

    private static final Logger logger = LoggerFactory.getLogger(ClientEventBus.class);

    private final Map<MessageType, List<Consumer<Object>>> handlers = new ConcurrentHashMap<>();

    public <P> Subscription subscribe(EventKind<P> kind, Consumer<? super P> handler) {
        Consumer<Object> typed = payload -> handler.accept(kind.payloadType().cast(payload));
        List<Consumer<Object>> registered =
                handlers.computeIfAbsent(kind.messageType(), type -> new CopyOnWriteArrayList<>());
        registered.add(typed);
        return () -> registered.remove(typed);
    }

    /**
     * Invokes every handler registered for the message's type with its payload.
     */
    public void dispatch(Message message) {
        List<Consumer<Object>> registered = handlers.get(message.getType());
        if (registered == null) {
            return;
        }
        for (Consumer<Object> handler : registered) {
            try {
                handler.accept(message.getPayload());
            } catch (RuntimeException e) {
                logger.error("Handler for {} failed", message.getType().tag(), e);
            }
        }
    }

    public int handlerCount(EventKind<?> kind) {
        List<Consumer<Object>> registered = handlers.get(kind.messageType());
        return registered == null ? 0 : registered.size();
    }
}
