package com.example.signage.service.scheduling;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;

/**
 * Keyed, cancellable deferred execution of schedule jobs.
 * <p>
 * At most one job is live per key: scheduling under a key that is already live replaces
 * the previous job. A firing whose job was replaced or cancelled in the meantime is skipped.
 * Failed firings are kept for inspection and never retried.
 */
public interface JobScheduler {

    void scheduleOnce(String key, Duration delay, ScheduleJobPayload payload);

    /**
     * Fires at every occurrence of {@code cronExpression} strictly after {@code notBefore} (or now,
     * whichever is later) until {@code until}. Either bound may be null.
     */
    void scheduleRepeating(String key, String cronExpression, OffsetDateTime notBefore, OffsetDateTime until,
                           ScheduleJobPayload payload);

    /**
     * @return true if a live job was cancelled
     */
    boolean cancel(String key);

    Set<String> liveJobKeys();

    /**
     * Retained failures, newest first.
     */
    List<FailedJob> failedJobs();
}
