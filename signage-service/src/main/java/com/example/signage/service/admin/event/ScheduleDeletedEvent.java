package com.example.signage.service.admin.event;

import com.example.signage.shared.model.Schedule;

public record ScheduleDeletedEvent(Schedule schedule) {
}
