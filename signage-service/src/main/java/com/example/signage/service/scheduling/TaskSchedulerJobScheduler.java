package com.example.signage.service.scheduling;

import com.example.signage.shared.config.AppProperties;
import com.example.signage.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link JobScheduler} on top of Spring's {@link TaskScheduler}. Job state is in-memory only;
 * it is rebuilt from the schedule table on startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskSchedulerJobScheduler implements JobScheduler {

    private final Map<String, LiveJob> jobs = new ConcurrentHashMap<>();
    private final Deque<FailedJob> failures = new ConcurrentLinkedDeque<>();

    private final TaskScheduler taskScheduler;
    private final RecurrencePlanner recurrencePlanner;
    private final ScheduleTriggerPublisher triggerPublisher;
    private final AppProperties appProperties;
    private final MonitoringConfig.SignageMetricsCollector metricsCollector;
    private final Clock clock;

    @Override
    public synchronized void scheduleOnce(String key, Duration delay, ScheduleJobPayload payload) {
        Duration effectiveDelay = delay.isNegative() ? Duration.ZERO : delay;
        LiveJob job = new LiveJob(key, payload, false);
        replace(key, job);

        Instant fireAt = clock.instant().plus(effectiveDelay);
        job.future = taskScheduler.schedule(() -> execute(job), fireAt);
        log.debug("Scheduled one-shot job {} at {}", key, fireAt);
    }

    @Override
    public synchronized void scheduleRepeating(String key, String cronExpression, OffsetDateTime notBefore,
                                               OffsetDateTime until, ScheduleJobPayload payload) {
        // Fail fast on a bad rule before touching the live job under this key
        recurrencePlanner.validate(cronExpression, clock.instant());

        RecurrenceTrigger trigger = new RecurrenceTrigger(cronExpression, recurrencePlanner,
                notBefore != null ? notBefore.toInstant() : null,
                until != null ? until.toInstant() : null);
        LiveJob job = new LiveJob(key, payload, true);
        replace(key, job);

        ScheduledFuture<?> future = taskScheduler.schedule(() -> execute(job), trigger);
        if (future == null) {
            jobs.remove(key, job);
            log.info("Repeating job {} has no occurrence before {}; not registered", key, until);
            return;
        }
        job.future = future;
        log.debug("Registered repeating job {} with rule '{}'", key, cronExpression);
    }

    @Override
    public synchronized boolean cancel(String key) {
        LiveJob job = jobs.remove(key);
        if (job == null) {
            return false;
        }
        job.cancel();
        log.debug("Cancelled job {}", key);
        return true;
    }

    @Override
    public Set<String> liveJobKeys() {
        jobs.entrySet().removeIf(entry -> entry.getValue().isFinished());
        return new TreeSet<>(jobs.keySet());
    }

    @Override
    public List<FailedJob> failedJobs() {
        return new ArrayList<>(failures);
    }

    private void replace(String key, LiveJob job) {
        LiveJob previous = jobs.put(key, job);
        if (previous != null) {
            previous.cancel();
            log.debug("Replaced live job {}", key);
        }
    }

    void execute(LiveJob job) {
        if (jobs.get(job.key) != job) {
            log.debug("Skipping firing of job {}: it was cancelled or replaced", job.key);
            return;
        }
        try {
            triggerPublisher.publish(job.payload);
            metricsCollector.incrementCounter("signage.jobs.fired", "status", "success");
        } catch (Exception e) {
            metricsCollector.incrementCounter("signage.jobs.fired", "status", "failed");
            log.error("Job {} failed for schedule {} and display {}: {}",
                    job.key, job.payload.scheduleId(), job.payload.displayId(), e.getMessage(), e);
            recordFailure(job, e);
        } finally {
            if (!job.repeating) {
                jobs.remove(job.key, job);
            }
        }
    }

    private void recordFailure(LiveJob job, Exception e) {
        failures.addFirst(new FailedJob(job.key, job.payload.scheduleId(), job.payload.displayId(),
                OffsetDateTime.now(clock), e.getMessage()));
        int retention = appProperties.getScheduling().getFailedJobRetention();
        while (failures.size() > retention) {
            failures.pollLast();
        }
    }

    static final class LiveJob {
        private final String key;
        private final ScheduleJobPayload payload;
        private final boolean repeating;
        private volatile ScheduledFuture<?> future;

        LiveJob(String key, ScheduleJobPayload payload, boolean repeating) {
            this.key = key;
            this.payload = payload;
            this.repeating = repeating;
        }

        void cancel() {
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }

        boolean isFinished() {
            ScheduledFuture<?> current = future;
            return current != null && current.isDone();
        }
    }
}
