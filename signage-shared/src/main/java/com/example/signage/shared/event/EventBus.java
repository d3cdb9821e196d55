package com.example.signage.shared.event;

import com.example.signage.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process publish/subscribe keyed by exact topic name.
 * <p>
 * Delivery is synchronous on the publishing thread, in subscription order, so a
 * consumer sees the events of one publisher in the order they were published.
 * A failing handler is logged and counted; the remaining handlers still run.
 * Nothing is persisted or retried.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventBus {

    static final String HANDLER_FAILURES_METRIC = "signage.eventbus.handler.failures";

    private final Map<String, List<EventHandler>> subscriptions = new ConcurrentHashMap<>();

    private final MonitoringConfig.SignageMetricsCollector metricsCollector;

    public void subscribe(String topic, EventHandler handler) {
        subscriptions.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>()).add(handler);
        log.debug("Subscribed handler to topic '{}'", topic);
    }

    /**
     * @return the number of handlers that completed without throwing
     */
    public int publish(String topic, Map<String, Object> payload) {
        List<EventHandler> handlers = subscriptions.get(topic);
        if (handlers == null || handlers.isEmpty()) {
            log.trace("No subscribers for topic '{}'", topic);
            return 0;
        }

        int delivered = 0;
        for (EventHandler handler : handlers) {
            try {
                handler.handle(topic, payload);
                delivered++;
            } catch (Exception e) {
                metricsCollector.incrementCounter(HANDLER_FAILURES_METRIC, "topic", topic);
                log.error("Handler for topic '{}' failed: {}", topic, e.getMessage(), e);
            }
        }
        return delivered;
    }

    public int subscriberCount(String topic) {
        List<EventHandler> handlers = subscriptions.get(topic);
        return handlers == null ? 0 : handlers.size();
    }
}
