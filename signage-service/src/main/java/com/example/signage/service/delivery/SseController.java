package com.example.signage.service.delivery;

import com.example.signage.shared.exception.ResourceNotFoundException;
import com.example.signage.shared.repository.DisplayRepository;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/sse")
@RequiredArgsConstructor
@Slf4j
public class SseController {

    private final LiveDeliveryHub liveDeliveryHub;
    private final DisplayRepository displayRepository;

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @RateLimiter(name = "sseConnectLimiter", fallbackMethod = "streamFallback")
    public Flux<ServerSentEvent<String>> stream(
            @RequestParam(required = false) String connectionId,
            ServerWebExchange exchange) {
        String id = resolveConnectionId(connectionId);
        log.info("[CONNECT_START] SSE stream request, connectionId='{}', IP='{}'", id, remoteAddress(exchange));
        return liveDeliveryHub.register(id, null);
    }

    @GetMapping(value = "/display/{displayId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @RateLimiter(name = "sseConnectLimiter", fallbackMethod = "displayStreamFallback")
    public Flux<ServerSentEvent<String>> displayStream(
            @PathVariable Long displayId,
            @RequestParam(required = false) String connectionId,
            ServerWebExchange exchange) {
        if (!displayRepository.existsById(displayId)) {
            return Flux.error(new ResourceNotFoundException("Display not found with ID: " + displayId));
        }
        String id = resolveConnectionId(connectionId);
        log.info("[CONNECT_START] SSE display stream request for displayId={}, connectionId='{}', IP='{}'",
                displayId, id, remoteAddress(exchange));
        return liveDeliveryHub.register(id, displayId);
    }

    public Flux<ServerSentEvent<String>> streamFallback(String connectionId, ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("Connection rate limit exceeded. IP: {}. Details: {}", remoteAddress(exchange), ex.getMessage());
        return Flux.error(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Connection rate limit exceeded. Please try again later."));
    }

    public Flux<ServerSentEvent<String>> displayStreamFallback(Long displayId, String connectionId, ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("Connection rate limit exceeded for display {}. IP: {}. Details: {}", displayId, remoteAddress(exchange), ex.getMessage());
        return Flux.error(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Connection rate limit exceeded. Please try again later."));
    }

    @PostMapping("/disconnect")
    public ResponseEntity<Map<String, Object>> disconnect(@RequestParam String connectionId) {
        log.info("Disconnect request for connection: {}", connectionId);
        boolean removed = liveDeliveryHub.deregister(connectionId);
        return ResponseEntity.ok(Map.of("connectionId", connectionId, "disconnected", removed));
    }

    @GetMapping("/stats")
    public ResponseEntity<HubStats> getStats() {
        return ResponseEntity.ok(liveDeliveryHub.getStats());
    }

    private static String resolveConnectionId(String requested) {
        return (requested == null || requested.isBlank()) ? UUID.randomUUID().toString() : requested.trim();
    }

    private static String remoteAddress(ServerWebExchange exchange) {
        return exchange.getRequest().getRemoteAddress() != null
                ? exchange.getRequest().getRemoteAddress().getAddress().getHostAddress()
                : "unknown";
    }
}
