package com.example.signage.service.health;

import com.example.signage.service.health.dto.DisplayHealthResponse;
import com.example.signage.shared.aspect.Monitored;
import com.example.signage.shared.config.AppProperties;
import com.example.signage.shared.dto.ErrorLogEntry;
import com.example.signage.shared.event.EventBus;
import com.example.signage.shared.exception.ResourceNotFoundException;
import com.example.signage.shared.model.Display;
import com.example.signage.shared.repository.DisplayRepository;
import com.example.signage.shared.util.Constants.DisplayStatus;
import com.example.signage.shared.util.Constants.ErrorSeverity;
import com.example.signage.shared.util.Constants.Topics;
import com.example.signage.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks display connectivity and health: heartbeats, the staleness sweep that flips
 * silent displays offline, uptime, the bounded error log and the derived health score.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("health")
public class DisplayHealthService {

    static final double RESOURCE_PRESSURE_THRESHOLD = 80.0;

    private final DisplayRepository displayRepository;
    private final EventBus eventBus;
    private final AppProperties appProperties;
    private final Clock clock;

    /**
     * Records a heartbeat. A display that was offline comes back online and
     * {@code display.online} is published. Metrics that are not a JSON object are ignored.
     */
    @Transactional
    public Display heartbeat(Long displayId, String rawMetrics) {
        Display display = findDisplay(displayId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean cameOnline = !DisplayStatus.ONLINE.name().equals(display.getStatus());

        display.setLastSeen(now);
        display.setTotalHeartbeats(display.getTotalHeartbeats() + 1);
        if (cameOnline) {
            display.setStatus(DisplayStatus.ONLINE.name());
            display.setLastOnlineAt(now);
        }

        Map<String, Object> metrics = JsonUtils.parseObject(rawMetrics);
        if (metrics != null) {
            display.setPerformanceMetrics(JsonUtils.toJson(metrics));
        } else if (rawMetrics != null && !rawMetrics.isBlank()) {
            log.debug("Ignoring malformed metrics from display {}", displayId);
        }

        display.setUptimePercentage(computeUptime(display, now));
        display.setUpdatedAt(now);
        Display saved = displayRepository.save(display);

        if (cameOnline) {
            log.info("Display {} ({}) is online", saved.getId(), saved.getName());
            eventBus.publish(Topics.DISPLAY_ONLINE, statusPayload(saved, now));
        }
        return saved;
    }

    /**
     * Periodic staleness sweep. The SchedulerLock keeps it to one node at a time when several
     * instances share the database.
     */
    @Scheduled(fixedRateString = "${signage.health.sweep-interval:60000}",
               initialDelayString = "${signage.health.sweep-interval:60000}")
    @SchedulerLock(name = "sweepStaleDisplays", lockAtLeastFor = "PT5S", lockAtMostFor = "PT50S")
    @Transactional
    public void runStalenessSweep() {
        sweepStaleDisplays();
    }

    /**
     * Flips every online display whose last heartbeat is older than the stale threshold to
     * offline, counting one missed heartbeat and publishing {@code display.offline} once per flip.
     *
     * @return the number of displays marked offline
     */
    @Transactional
    public int sweepStaleDisplays() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime threshold = now.minus(Duration.ofMillis(appProperties.getHealth().getStaleThreshold()));
        List<Display> stale = displayRepository.findStaleOnlineDisplays(threshold);
        for (Display display : stale) {
            display.setStatus(DisplayStatus.OFFLINE.name());
            display.setLastOfflineAt(now);
            display.setMissedHeartbeats(display.getMissedHeartbeats() + 1);
            display.setUptimePercentage(computeUptime(display, now));
            display.setUpdatedAt(now);
            Display saved = displayRepository.save(display);

            log.warn("Display {} ({}) went offline; last seen {}", saved.getId(), saved.getName(), saved.getLastSeen());
            eventBus.publish(Topics.DISPLAY_OFFLINE, statusPayload(saved, now));
        }
        if (!stale.isEmpty()) {
            log.info("Staleness sweep marked {} display(s) offline", stale.size());
        }
        return stale.size();
    }

    /**
     * Prepends an entry to the display's error log, keeping the newest entries only.
     * HIGH severity errors are published as {@code display.error.high}.
     */
    @Transactional
    public ErrorLogEntry logError(Long displayId, String message, String severity) {
        Display display = findDisplay(displayId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        ErrorSeverity level = severity == null ? ErrorSeverity.MEDIUM : ErrorSeverity.valueOf(severity.toUpperCase());

        ErrorLogEntry entry = new ErrorLogEntry(level.name(), message, now);
        List<ErrorLogEntry> errors = JsonUtils.parseErrorLog(display.getErrorLog());
        errors.add(0, entry);
        int capacity = appProperties.getHealth().getErrorLogCapacity();
        if (errors.size() > capacity) {
            errors = errors.subList(0, capacity);
        }
        display.setErrorLog(JsonUtils.toJson(errors));
        display.setUpdatedAt(now);
        Display saved = displayRepository.save(display);

        log.info("Display {} reported {} error: {}", displayId, level, message);
        if (level == ErrorSeverity.HIGH) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("displayId", saved.getId());
            payload.put("displayName", saved.getName());
            payload.put("message", message);
            payload.put("severity", level.name());
            payload.put("timestamp", now.toString());
            eventBus.publish(Topics.DISPLAY_ERROR_HIGH, payload);
        }
        return entry;
    }

    @Transactional
    public Display setDebug(Long displayId, boolean enabled) {
        Display display = findDisplay(displayId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        display.setDebugEnabled(enabled);
        display.setUpdatedAt(now);
        Display saved = displayRepository.save(display);

        log.info("Debug overlay {} for display {}", enabled ? "enabled" : "disabled", displayId);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("displayId", saved.getId());
        payload.put("enabled", enabled);
        payload.put("timestamp", now.toString());
        eventBus.publish(Topics.DISPLAY_DEBUG, payload);
        return saved;
    }

    @Transactional(readOnly = true)
    public DisplayHealthResponse getHealth(Long displayId) {
        Display display = findDisplay(displayId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<ErrorLogEntry> errors = JsonUtils.parseErrorLog(display.getErrorLog());
        Map<String, Object> metrics = JsonUtils.parseObject(display.getPerformanceMetrics());
        return DisplayHealthResponse.builder()
                .displayId(display.getId())
                .name(display.getName())
                .status(display.getStatus())
                .lastSeen(display.getLastSeen())
                .lastOnlineAt(display.getLastOnlineAt())
                .lastOfflineAt(display.getLastOfflineAt())
                .totalHeartbeats(display.getTotalHeartbeats())
                .missedHeartbeats(display.getMissedHeartbeats())
                .uptimePercentage(display.getUptimePercentage())
                .healthScore(computeHealthScore(display, errors, metrics, now))
                .recentErrors(errors)
                .performanceMetrics(metrics == null ? Map.of() : metrics)
                .debugEnabled(display.isDebugEnabled())
                .build();
    }

    /**
     * Share of the display's lifetime not lost to missed heartbeats, in [0, 100].
     * Each missed heartbeat counts as one assumed heartbeat interval of downtime.
     */
    double computeUptime(Display display, OffsetDateTime now) {
        if (display.getCreatedAt() == null) {
            return 100.0;
        }
        long elapsed = Duration.between(display.getCreatedAt(), now).toMillis();
        if (elapsed <= 0) {
            return 100.0;
        }
        long downtime = display.getMissedHeartbeats() * appProperties.getHealth().getAssumedHeartbeatInterval();
        double uptime = (double) (elapsed - downtime) / elapsed * 100.0;
        return Math.max(0.0, Math.min(100.0, uptime));
    }

    /**
     * 100 minus: 50 when offline, the uptime shortfall below 95, 2 per error in the last
     * 24 hours, and 5 each for CPU or memory usage above 80. Clamped to [0, 100].
     */
    int computeHealthScore(Display display, List<ErrorLogEntry> errors, Map<String, Object> metrics, OffsetDateTime now) {
        double score = 100.0;
        if (!DisplayStatus.ONLINE.name().equals(display.getStatus())) {
            score -= 50;
        }
        if (display.getUptimePercentage() < 95.0) {
            score -= 95.0 - display.getUptimePercentage();
        }
        OffsetDateTime dayAgo = now.minusHours(24);
        long recentErrors = errors.stream()
                .filter(e -> e.getTimestamp() != null && e.getTimestamp().isAfter(dayAgo))
                .count();
        score -= 2.0 * recentErrors;
        if (metrics != null) {
            if (numeric(metrics.get("cpuUsage")) > RESOURCE_PRESSURE_THRESHOLD) {
                score -= 5;
            }
            if (numeric(metrics.get("memoryUsage")) > RESOURCE_PRESSURE_THRESHOLD) {
                score -= 5;
            }
        }
        return (int) Math.round(Math.max(0.0, Math.min(100.0, score)));
    }

    private static double numeric(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }

    private Map<String, Object> statusPayload(Display display, OffsetDateTime now) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("displayId", display.getId());
        payload.put("displayName", display.getName());
        payload.put("status", display.getStatus());
        payload.put("timestamp", now.toString());
        return payload;
    }

    private Display findDisplay(Long displayId) {
        return displayRepository.findById(displayId)
                .orElseThrow(() -> new ResourceNotFoundException("Display not found with ID: " + displayId));
    }
}
