package net.javahippie.inflo.event;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process publish/subscribe registry.
 *
 * Publishing invokes every handler of a topic synchronously on the caller's thread, in registration order.
 * A failing handler is logged and recorded in the returned results; it never stops the remaining handlers
 * and never propagates to the publisher. The bus keeps no event history.
 */
@Slf4j
public class EventBus {

    private final ConcurrentHashMap<String, List<Subscription>> subscribers = new ConcurrentHashMap<>();

    /**
     * Register a handler for a topic under an explicit name.
     *
     * @param topic the topic name
     * @param name handler name reported in {@link HandlerResult#getHandler()}
     * @param handler the callback
     */
    public void subscribe(String topic, String name, EventHandler handler) {
        subscribers.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>())
            .add(new Subscription(name, handler));
        log.info("Subscribed handler '{}' to topic '{}'", name, topic);
    }

    /**
     * Register a handler for a topic, named after its class.
     */
    public void subscribe(String topic, EventHandler handler) {
        subscribe(topic, handler.getClass().getSimpleName(), handler);
    }

    /**
     * Remove every registration of the named handler from a topic.
     *
     * @return true if a registration was removed
     */
    public boolean unsubscribe(String topic, String name) {
        List<Subscription> handlers = subscribers.get(topic);
        if (handlers == null) {
            return false;
        }
        boolean removed = handlers.removeIf(s -> s.name().equals(name));
        if (removed) {
            log.info("Unsubscribed handler '{}' from topic '{}'", name, topic);
        }
        return removed;
    }

    /**
     * Deliver a payload to all handlers of a topic.
     *
     * @param topic the topic name
     * @param payload the event payload, passed unchanged to every handler
     * @return one result per handler, in invocation order; empty if nobody subscribed
     */
    public List<HandlerResult> publish(String topic, Map<String, Object> payload) {
        List<Subscription> handlers = subscribers.getOrDefault(topic, Collections.emptyList());
        if (handlers.isEmpty()) {
            log.warn("No subscribers for topic '{}'", topic);
            return new ArrayList<>();
        }

        log.info("Publishing '{}' to {} handlers", topic, handlers.size());
        List<HandlerResult> results = new ArrayList<>(handlers.size());

        for (Subscription subscription : handlers) {
            try {
                Object result = subscription.handler().handle(payload);
                results.add(HandlerResult.success(subscription.name(), result));
                log.debug("Handler '{}' processed '{}'", subscription.name(), topic);
            } catch (Exception e) {
                log.error("Handler '{}' failed on topic '{}'", subscription.name(), topic, e);
                results.add(HandlerResult.failure(subscription.name(), e));
            }
        }

        return results;
    }

    /**
     * Number of handlers currently registered for a topic.
     */
    public int subscriberCount(String topic) {
        return subscribers.getOrDefault(topic, Collections.emptyList()).size();
    }

    private record Subscription(String name, EventHandler handler) {
    }
}
