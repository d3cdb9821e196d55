package com.example.signage.service.scheduling;

import com.example.signage.shared.model.Schedule;
import com.example.signage.shared.repository.DisplayGroupRepository;
import com.example.signage.shared.repository.ScheduleRepository;
import com.example.signage.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns schedules into jobs: one one-shot job per affected display at the schedule's start,
 * plus one repeating job per display when the schedule recurs.
 * <p>
 * Job keys are {@code <scheduleId>-<displayId>} and {@code <scheduleId>-<displayId>-recurring}.
 * Group membership is queried every time a schedule is armed or cancelled.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduleJobDispatcher {

    static final String RECURRING_SUFFIX = "-recurring";

    private final JobScheduler jobScheduler;
    private final ScheduleRepository scheduleRepository;
    private final DisplayGroupRepository displayGroupRepository;
    private final Clock clock;

    public static String oneShotKey(Long scheduleId, Long displayId) {
        return scheduleId + "-" + displayId;
    }

    public static String recurringKey(Long scheduleId, Long displayId) {
        return oneShotKey(scheduleId, displayId) + RECURRING_SUFFIX;
    }

    /**
     * Creates (or replaces) the jobs of an active, unexpired schedule.
     *
     * @return the number of displays jobs were created for
     */
    public int arm(Schedule schedule) {
        if (!schedule.isActive()) {
            log.debug("Schedule {} is inactive; no jobs armed", schedule.getId());
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (schedule.isExpiredAt(now)) {
            log.info("Schedule {} ended at {}; no jobs armed", schedule.getId(), schedule.getEndTime());
            return 0;
        }

        List<Long> displayIds = resolveTargetDisplays(schedule);
        Duration delay = Duration.between(now, schedule.getStartTime());
        if (delay.isNegative()) {
            delay = Duration.ZERO;
        }
        List<Long> contentIds = schedule.getContentIds() != null ? JsonUtils.parseIdList(schedule.getContentIds()) : null;

        for (Long displayId : displayIds) {
            ScheduleJobPayload payload = new ScheduleJobPayload(schedule.getId(), displayId,
                    schedule.getContentId(), contentIds, schedule.getPlaylistId());
            jobScheduler.scheduleOnce(oneShotKey(schedule.getId(), displayId), delay, payload);
            if (schedule.isRecurring()) {
                jobScheduler.scheduleRepeating(recurringKey(schedule.getId(), displayId), schedule.getRecurrenceRule(),
                        schedule.getStartTime(), schedule.getEndTime(), payload);
            }
        }
        log.info("Armed schedule {} for {} display(s), first firing in {}", schedule.getId(), displayIds.size(), delay);
        return displayIds.size();
    }

    /**
     * Cancels every job of the schedule: both keys for each display it currently targets,
     * plus any other live key of the schedule left over from earlier targets or members.
     *
     * @return the number of jobs cancelled
     */
    public int cancel(Schedule schedule) {
        Set<String> keys = new LinkedHashSet<>();
        for (Long displayId : resolveTargetDisplays(schedule)) {
            keys.add(oneShotKey(schedule.getId(), displayId));
            keys.add(recurringKey(schedule.getId(), displayId));
        }
        String prefix = schedule.getId() + "-";
        jobScheduler.liveJobKeys().stream()
                .filter(key -> key.startsWith(prefix))
                .forEach(keys::add);

        int cancelled = 0;
        for (String key : keys) {
            if (jobScheduler.cancel(key)) {
                cancelled++;
            }
        }
        log.debug("Cancelled {} job(s) for schedule {}", cancelled, schedule.getId());
        return cancelled;
    }

    /**
     * Cancel-then-recreate after a schedule changed. {@code previous} supplies the old target.
     */
    public void rearm(Schedule previous, Schedule current) {
        cancel(previous);
        arm(current);
    }

    /**
     * Re-expands every schedule that targets the group, after its membership changed.
     */
    public void reconcileGroup(Long groupId) {
        List<Schedule> schedules = scheduleRepository.findByDisplayGroupId(groupId);
        for (Schedule schedule : schedules) {
            cancel(schedule);
            arm(schedule);
        }
        log.info("Re-armed {} schedule(s) targeting display group {}", schedules.size(), groupId);
    }

    /**
     * Arms every active schedule. One bad schedule does not prevent the others.
     */
    public int armAll() {
        int armed = 0;
        for (Schedule schedule : scheduleRepository.findAllActive()) {
            try {
                if (arm(schedule) > 0) {
                    armed++;
                }
            } catch (Exception e) {
                log.error("Failed to arm schedule {}: {}", schedule.getId(), e.getMessage(), e);
            }
        }
        return armed;
    }

    List<Long> resolveTargetDisplays(Schedule schedule) {
        if (schedule.getDisplayId() != null) {
            return List.of(schedule.getDisplayId());
        }
        Long groupId = schedule.getDisplayGroupId();
        if (groupId == null || !displayGroupRepository.existsById(groupId)) {
            log.warn("Display group {} of schedule {} not found; skipping job creation", groupId, schedule.getId());
            return List.of();
        }
        return displayGroupRepository.findMemberDisplayIds(groupId);
    }
}
