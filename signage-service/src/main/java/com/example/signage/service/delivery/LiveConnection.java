package com.example.signage.service.delivery;

import lombok.Getter;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Sinks;

import java.time.OffsetDateTime;

/**
 * One open SSE stream. {@code displayId} is null for unscoped (admin or dashboard) clients.
 */
@Getter
public class LiveConnection {

    private final String connectionId;
    private final Long displayId;
    private final OffsetDateTime connectedAt;
    private final Sinks.Many<ServerSentEvent<String>> sink;
    private volatile OffsetDateTime lastHeartbeat;

    LiveConnection(String connectionId, Long displayId, OffsetDateTime connectedAt,
                   Sinks.Many<ServerSentEvent<String>> sink) {
        this.connectionId = connectionId;
        this.displayId = displayId;
        this.connectedAt = connectedAt;
        this.lastHeartbeat = connectedAt;
        this.sink = sink;
    }

    // Publishers and the keepalive ticker emit from different threads; the sink needs serialized calls
    synchronized Sinks.EmitResult emit(ServerSentEvent<String> event) {
        return sink.tryEmitNext(event);
    }

    synchronized void complete() {
        sink.tryEmitComplete();
    }

    void markHeartbeat(OffsetDateTime at) {
        this.lastHeartbeat = at;
    }

    boolean isScopedTo(Long candidateDisplayId) {
        return displayId != null && displayId.equals(candidateDisplayId);
    }
}
