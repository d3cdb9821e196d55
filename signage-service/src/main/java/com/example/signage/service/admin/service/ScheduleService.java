package com.example.signage.service.admin.service;

import com.example.signage.service.admin.dto.CurrentContentResponse;
import com.example.signage.service.admin.dto.ScheduleRequest;
import com.example.signage.service.admin.dto.ScheduleResponse;
import com.example.signage.service.admin.dto.ScheduleStatsResponse;
import com.example.signage.service.admin.dto.ScheduleUpdateRequest;
import com.example.signage.service.admin.event.ScheduleCreatedEvent;
import com.example.signage.service.admin.event.ScheduleDeletedEvent;
import com.example.signage.service.admin.event.ScheduleUpdatedEvent;
import com.example.signage.service.admin.mapper.ScheduleMapper;
import com.example.signage.service.scheduling.RecurrencePlanner;
import com.example.signage.service.scheduling.ScheduleResolver;
import com.example.signage.shared.aspect.Monitored;
import com.example.signage.shared.exception.ResourceNotFoundException;
import com.example.signage.shared.exception.ScheduleValidationException;
import com.example.signage.shared.model.Display;
import com.example.signage.shared.model.DisplayGroup;
import com.example.signage.shared.model.Schedule;
import com.example.signage.shared.repository.DisplayGroupRepository;
import com.example.signage.shared.repository.DisplayRepository;
import com.example.signage.shared.repository.ScheduleRepository;
import com.example.signage.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Schedule store: validated CRUD over schedules. Every mutation publishes an application
 * event; {@code ScheduleChangeListener} re-derives the jobs and announces the change on the
 * event bus after commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("schedule-service")
public class ScheduleService {

    static final int MIN_PRIORITY = 0;
    static final int MAX_PRIORITY = 999;

    private final ScheduleRepository scheduleRepository;
    private final DisplayRepository displayRepository;
    private final DisplayGroupRepository displayGroupRepository;
    private final ScheduleMapper scheduleMapper;
    private final RecurrencePlanner recurrencePlanner;
    private final ScheduleResolver scheduleResolver;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public ScheduleResponse createSchedule(ScheduleRequest request) {
        log.info("Creating schedule for display {} / group {}", request.getDisplayId(), request.getDisplayGroupId());
        if (request.getContentIds() != null && request.getContentIds().isEmpty()) {
            throw new ScheduleValidationException("contentIds must not be empty");
        }
        Schedule schedule = scheduleMapper.toSchedule(request);
        validate(schedule);

        OffsetDateTime now = OffsetDateTime.now(clock);
        schedule.setCreatedAt(now);
        schedule.setUpdatedAt(now);
        Schedule saved = scheduleRepository.save(schedule);
        log.info("Schedule {} created", saved.getId());

        ScheduleResponse response = toResponse(saved);
        eventPublisher.publishEvent(new ScheduleCreatedEvent(saved, response));
        return response;
    }

    @Transactional
    public ScheduleResponse updateSchedule(Long id, ScheduleUpdateRequest request) {
        log.info("Updating schedule {}", id);
        Schedule existing = findSchedule(id);
        if (request.getContentIds() != null && request.getContentIds().isEmpty()) {
            throw new ScheduleValidationException("contentIds must not be empty");
        }
        Schedule updated = merge(existing, request);
        validate(updated);
        updated.setUpdatedAt(OffsetDateTime.now(clock));
        Schedule saved = scheduleRepository.save(updated);

        ScheduleResponse response = toResponse(saved);
        eventPublisher.publishEvent(new ScheduleUpdatedEvent(existing, saved, response));
        return response;
    }

    @Transactional
    public void deleteSchedule(Long id) {
        Schedule existing = findSchedule(id);
        scheduleRepository.deleteById(id);
        log.info("Schedule {} deleted", id);
        eventPublisher.publishEvent(new ScheduleDeletedEvent(existing));
    }

    @Transactional(readOnly = true)
    public ScheduleResponse getSchedule(Long id) {
        return toResponse(findSchedule(id));
    }

    /**
     * All schedules, or when {@code displayId} is given those assigned to the display
     * directly or through one of its groups. Most authoritative first.
     */
    @Transactional(readOnly = true)
    public List<ScheduleResponse> getSchedules(Long displayId) {
        List<Schedule> schedules = displayId == null
                ? scheduleRepository.findAllOrderedByPriority()
                : scheduleRepository.findAllForDisplay(displayId);
        return schedules.stream().map(this::toResponse).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ScheduleStatsResponse getStats() {
        long active = scheduleRepository.countByActive(true);
        long inactive = scheduleRepository.countByActive(false);
        return new ScheduleStatsResponse(active + inactive, active, inactive);
    }

    /**
     * Schedules in effect for the display right now, the authoritative one first.
     */
    @Transactional(readOnly = true)
    public List<ScheduleResponse> getActiveForDisplay(Long displayId) {
        requireDisplay(displayId);
        return scheduleResolver.findActiveForDisplay(displayId, OffsetDateTime.now(clock)).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public CurrentContentResponse getCurrentForDisplay(Long displayId) {
        requireDisplay(displayId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<Schedule> winner = scheduleResolver.resolveActive(displayId, now);
        return CurrentContentResponse.builder()
                .displayId(displayId)
                .source(winner.isPresent() ? CurrentContentResponse.SOURCE_SCHEDULE : CurrentContentResponse.SOURCE_DEFAULT)
                .schedule(winner.map(this::toResponse).orElse(null))
                .resolvedAt(now)
                .build();
    }

    private Schedule findSchedule(Long id) {
        return scheduleRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule not found with ID: " + id));
    }

    private void requireDisplay(Long displayId) {
        if (!displayRepository.existsById(displayId)) {
            throw new ResourceNotFoundException("Display not found with ID: " + displayId);
        }
    }

    private Schedule merge(Schedule existing, ScheduleUpdateRequest request) {
        Schedule.ScheduleBuilder builder = Schedule.builder()
                .id(existing.getId())
                .displayId(existing.getDisplayId())
                .displayGroupId(existing.getDisplayGroupId())
                .contentId(existing.getContentId())
                .contentIds(existing.getContentIds())
                .playlistId(existing.getPlaylistId())
                .startTime(existing.getStartTime())
                .endTime(existing.getEndTime())
                .recurrenceRule(existing.getRecurrenceRule())
                .priority(existing.getPriority())
                .active(existing.isActive())
                .createdAt(existing.getCreatedAt())
                .updatedAt(existing.getUpdatedAt());

        if (request.hasTarget()) {
            builder.displayId(request.getDisplayId()).displayGroupId(request.getDisplayGroupId());
        }
        if (request.hasPayload()) {
            builder.contentId(request.getContentId())
                    .contentIds(JsonUtils.toJsonArray(request.getContentIds()))
                    .playlistId(request.getPlaylistId());
        }
        if (request.getStartTime() != null) {
            builder.startTime(request.getStartTime());
        }
        if (request.isClearEndTime()) {
            builder.endTime(null);
        } else if (request.getEndTime() != null) {
            builder.endTime(request.getEndTime());
        }
        if (request.isClearRecurrenceRule()) {
            builder.recurrenceRule(null);
        } else if (request.getRecurrenceRule() != null) {
            builder.recurrenceRule(request.getRecurrenceRule());
        }
        if (request.getPriority() != null) {
            builder.priority(request.getPriority());
        }
        if (request.getIsActive() != null) {
            builder.active(request.getIsActive());
        }
        return builder.build();
    }

    void validate(Schedule schedule) {
        boolean hasDisplay = schedule.getDisplayId() != null;
        boolean hasGroup = schedule.getDisplayGroupId() != null;
        if (hasDisplay == hasGroup) {
            throw new ScheduleValidationException("Exactly one of displayId or displayGroupId must be provided");
        }

        int payloads = 0;
        if (schedule.getContentId() != null) {
            payloads++;
        }
        if (schedule.getContentIds() != null) {
            if (JsonUtils.parseIdList(schedule.getContentIds()).isEmpty()) {
                throw new ScheduleValidationException("contentIds must not be empty");
            }
            payloads++;
        }
        if (schedule.getPlaylistId() != null) {
            payloads++;
        }
        if (payloads != 1) {
            throw new ScheduleValidationException("Exactly one of contentId, contentIds or playlistId must be provided");
        }

        if (schedule.getStartTime() == null) {
            throw new ScheduleValidationException("Start time is required");
        }
        if (schedule.getEndTime() != null && !schedule.getEndTime().isAfter(schedule.getStartTime())) {
            throw new ScheduleValidationException("End time must be after start time");
        }
        if (schedule.getPriority() < MIN_PRIORITY || schedule.getPriority() > MAX_PRIORITY) {
            throw new ScheduleValidationException("Priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY);
        }
        if (schedule.getRecurrenceRule() != null && schedule.getRecurrenceRule().isBlank()) {
            schedule.setRecurrenceRule(null);
        }
        if (schedule.isRecurring()) {
            recurrencePlanner.validate(schedule.getRecurrenceRule(), schedule.getStartTime().toInstant());
        }

        if (hasDisplay && !displayRepository.existsById(schedule.getDisplayId())) {
            throw new ScheduleValidationException("Display not found with ID: " + schedule.getDisplayId());
        }
        if (hasGroup && !displayGroupRepository.existsById(schedule.getDisplayGroupId())) {
            throw new ScheduleValidationException("Display group not found with ID: " + schedule.getDisplayGroupId());
        }
    }

    ScheduleResponse toResponse(Schedule schedule) {
        String displayName = null;
        String groupName = null;
        List<Long> members = null;
        if (schedule.getDisplayId() != null) {
            displayName = displayRepository.findById(schedule.getDisplayId()).map(Display::getName).orElse(null);
        } else if (schedule.getDisplayGroupId() != null) {
            groupName = displayGroupRepository.findById(schedule.getDisplayGroupId()).map(DisplayGroup::getName).orElse(null);
            members = displayGroupRepository.findMemberDisplayIds(schedule.getDisplayGroupId());
        }
        return scheduleMapper.toResponse(schedule, displayName, groupName, members);
    }
}
