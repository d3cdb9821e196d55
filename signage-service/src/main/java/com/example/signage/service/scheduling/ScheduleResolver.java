package com.example.signage.service.scheduling;

import com.example.signage.shared.aspect.Monitored;
import com.example.signage.shared.model.Schedule;
import com.example.signage.shared.repository.ScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides which schedule is authoritative for a display at a given instant.
 * <p>
 * Candidates are the display's direct schedules plus those of every group it belongs to.
 * A candidate counts when it is active, has started, and its end (if any) is not before
 * the instant. The winner has the highest priority, then the latest start, then the latest
 * creation, then the highest id. Reads only; safe to call from any thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("resolver")
public class ScheduleResolver {

    static final Comparator<Schedule> AUTHORITY_ORDER = Comparator
            .comparingInt(Schedule::getPriority).reversed()
            .thenComparing((Schedule s) -> s.getStartTime().toInstant(), Comparator.reverseOrder())
            .thenComparing((Schedule s) -> s.getCreatedAt() == null ? null : s.getCreatedAt().toInstant(),
                    Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Schedule::getId, Comparator.nullsLast(Comparator.reverseOrder()));

    private final ScheduleRepository scheduleRepository;
    private final Clock clock;

    public Optional<Schedule> resolveActive(Long displayId) {
        return resolveActive(displayId, OffsetDateTime.now(clock));
    }

    public Optional<Schedule> resolveActive(Long displayId, OffsetDateTime now) {
        Optional<Schedule> winner = findActiveForDisplay(displayId, now).stream().findFirst();
        log.debug("Resolved schedule {} for display {} at {}",
                winner.map(Schedule::getId).orElse(null), displayId, now);
        return winner;
    }

    /**
     * All schedules in effect for the display at {@code now}, most authoritative first.
     */
    public List<Schedule> findActiveForDisplay(Long displayId, OffsetDateTime now) {
        Instant instant = now.toInstant();
        return scheduleRepository.findActiveCandidatesForDisplay(displayId).stream()
                .filter(schedule -> isInEffect(schedule, instant))
                .sorted(AUTHORITY_ORDER)
                .collect(Collectors.toList());
    }

    static boolean isInEffect(Schedule schedule, Instant now) {
        if (!schedule.isActive() || schedule.getStartTime() == null) {
            return false;
        }
        if (schedule.getStartTime().toInstant().isAfter(now)) {
            return false;
        }
        return schedule.getEndTime() == null || !schedule.getEndTime().toInstant().isBefore(now);
    }
}
