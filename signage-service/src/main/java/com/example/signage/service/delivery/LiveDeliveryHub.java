package com.example.signage.service.delivery;

import com.example.signage.shared.config.AppProperties;
import com.example.signage.shared.config.MonitoringConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Registry of open SSE connections and the single place events are pushed to them.
 * <p>
 * Every send is a non-blocking {@code tryEmitNext} into the connection's bounded buffer.
 * A connection whose emit fails (completed, cancelled or overflowing) is dropped on the spot,
 * so one slow or dead client never holds up the others. A keepalive ticker pushes a
 * {@code heartbeat} event to all connections every {@code signage.sse.heartbeat-interval}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LiveDeliveryHub {

    private final Map<String, LiveConnection> connections = new ConcurrentHashMap<>();

    private final SseEventFactory sseEventFactory;
    private final AppProperties appProperties;
    private final Scheduler heartbeatScheduler;
    private final Clock clock;
    private final MonitoringConfig.SignageMetricsCollector metricsCollector;

    private Disposable heartbeatSubscription;

    @PostConstruct
    public void init() {
        startHeartbeat();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Commencing LiveDeliveryHub graceful shutdown...");
        if (heartbeatSubscription != null && !heartbeatSubscription.isDisposed()) {
            heartbeatSubscription.dispose();
            log.info("Keepalive ticker stopped.");
        }

        if (!connections.isEmpty()) {
            log.info("Sending shutdown notice to {} connected clients...", connections.size());
            ServerSentEvent<String> shutdownEvent = sseEventFactory.createShutdownEvent();
            for (LiveConnection connection : new ArrayList<>(connections.values())) {
                if (shutdownEvent != null) {
                    connection.emit(shutdownEvent);
                }
                deregister(connection.getConnectionId());
            }
        }
        log.info("LiveDeliveryHub shutdown complete.");
    }

    /**
     * Opens a stream for the connection. The first event is {@code connected}; the stream
     * stays open until the client goes away or the connection is deregistered.
     * Registering an id that is already live replaces the old stream.
     */
    public Flux<ServerSentEvent<String>> register(String connectionId, Long displayId) {
        Sinks.Many<ServerSentEvent<String>> sink = Sinks.many().multicast()
                .onBackpressureBuffer(appProperties.getSse().getBufferSize(), false);
        LiveConnection connection = new LiveConnection(connectionId, displayId, OffsetDateTime.now(clock), sink);

        LiveConnection previous = connections.put(connectionId, connection);
        if (previous != null) {
            log.info("Connection {} re-registered; completing the previous stream", connectionId);
            previous.complete();
        }

        ServerSentEvent<String> connectedEvent = sseEventFactory.createConnectedEvent(connectionId, displayId);
        if (connectedEvent != null) {
            connection.emit(connectedEvent);
        }
        log.info("Registered connection {} (display: {}). Total connections: {}",
                connectionId, displayId, connections.size());
        metricsCollector.setGauge("signage.sse.connections.active", connections.size());

        return sink.asFlux()
                .doOnCancel(() -> release(connection))
                .doOnError(throwable -> release(connection))
                .doOnTerminate(() -> release(connection));
    }

    /**
     * Removes the connection and completes its stream. Unknown ids are ignored.
     *
     * @return true if a connection was removed
     */
    public boolean deregister(String connectionId) {
        LiveConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return false;
        }
        connection.complete();
        metricsCollector.setGauge("signage.sse.connections.active", connections.size());
        log.info("Deregistered connection {} (display: {}). Total connections: {}",
                connectionId, connection.getDisplayId(), connections.size());
        return true;
    }

    /**
     * @return false if the connection is unknown or the event could not be handed over
     */
    public boolean send(String connectionId, String eventName, Map<String, Object> payload) {
        LiveConnection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        ServerSentEvent<String> event = sseEventFactory.createEvent(eventName, null, payload);
        if (event == null) {
            return false;
        }
        return deliver(connection, event);
    }

    public DeliveryResult broadcast(String eventName, Map<String, Object> payload) {
        return fanOut(eventName, payload, connection -> true);
    }

    public DeliveryResult castToDisplay(Long displayId, String eventName, Map<String, Object> payload) {
        return fanOut(eventName, payload, connection -> connection.isScopedTo(displayId));
    }

    public HubStats getStats() {
        List<LiveConnection> snapshot = new ArrayList<>(connections.values());
        int displayScoped = (int) snapshot.stream().filter(c -> c.getDisplayId() != null).count();
        List<HubStats.ConnectionInfo> infos = snapshot.stream()
                .sorted(Comparator.comparing(LiveConnection::getConnectedAt))
                .map(c -> HubStats.ConnectionInfo.builder()
                        .connectionId(c.getConnectionId())
                        .displayId(c.getDisplayId())
                        .connectedAt(c.getConnectedAt())
                        .lastHeartbeat(c.getLastHeartbeat())
                        .build())
                .collect(Collectors.toList());
        return HubStats.builder()
                .totalConnections(snapshot.size())
                .displayConnections(displayScoped)
                .generalConnections(snapshot.size() - displayScoped)
                .connections(infos)
                .timestamp(OffsetDateTime.now(clock))
                .build();
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public Optional<LiveConnection> getConnection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    private DeliveryResult fanOut(String eventName, Map<String, Object> payload, Predicate<LiveConnection> filter) {
        List<LiveConnection> targets = connections.values().stream()
                .filter(filter)
                .collect(Collectors.toList());
        if (targets.isEmpty()) {
            log.debug("No connections for event {}", eventName);
            return DeliveryResult.NONE;
        }
        ServerSentEvent<String> event = sseEventFactory.createEvent(eventName, null, payload);
        if (event == null) {
            return new DeliveryResult(0, targets.size());
        }

        int success = 0;
        int failure = 0;
        for (LiveConnection connection : targets) {
            if (deliver(connection, event)) {
                success++;
            } else {
                failure++;
            }
        }
        log.debug("Event {} delivered to {} connection(s), {} failed", eventName, success, failure);
        return new DeliveryResult(success, failure);
    }

    private boolean deliver(LiveConnection connection, ServerSentEvent<String> event) {
        Sinks.EmitResult result = connection.emit(event);
        if (result.isSuccess()) {
            metricsCollector.incrementCounter("signage.sse.sends", "status", "success");
            return true;
        }
        metricsCollector.incrementCounter("signage.sse.sends", "status", "failed");
        log.warn("Failed to emit {} to connection {} (display: {}). Result: {}. Dropping connection.",
                event.event(), connection.getConnectionId(), connection.getDisplayId(), result);
        release(connection);
        return false;
    }

    // Only removes the entry if it still belongs to this stream (not a newer re-registration)
    private void release(LiveConnection connection) {
        if (connections.remove(connection.getConnectionId(), connection)) {
            connection.complete();
            metricsCollector.setGauge("signage.sse.connections.active", connections.size());
            log.info("Connection {} closed (display: {}). Total connections: {}",
                    connection.getConnectionId(), connection.getDisplayId(), connections.size());
        }
    }

    private void startHeartbeat() {
        heartbeatSubscription = Flux.interval(Duration.ofMillis(appProperties.getSse().getHeartbeatInterval()), heartbeatScheduler)
            .doOnNext(tick -> {
                try {
                    sendHeartbeats();
                } catch (Exception e) {
                    log.error("Error in keepalive task: {}", e.getMessage());
                }
            })
            .subscribe();
    }

    void sendHeartbeats() {
        if (connections.isEmpty()) {
            return;
        }
        ServerSentEvent<String> heartbeatEvent = sseEventFactory.createHeartbeatEvent();
        if (heartbeatEvent == null) {
            return;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (LiveConnection connection : new ArrayList<>(connections.values())) {
            if (deliver(connection, heartbeatEvent)) {
                connection.markHeartbeat(now);
            }
        }
    }
}
