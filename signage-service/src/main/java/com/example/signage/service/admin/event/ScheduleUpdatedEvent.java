package com.example.signage.service.admin.event;

import com.example.signage.service.admin.dto.ScheduleResponse;
import com.example.signage.shared.model.Schedule;

/**
 * {@code previous} is the schedule as stored before the update; its target decides which
 * jobs are cancelled.
 */
public record ScheduleUpdatedEvent(Schedule previous, Schedule current, ScheduleResponse response) {
}
