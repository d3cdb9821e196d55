package com.example.signage.service.admin.event;

import com.example.signage.service.admin.dto.ScheduleResponse;
import com.example.signage.shared.model.Schedule;

public record ScheduleCreatedEvent(Schedule schedule, ScheduleResponse response) {
}
