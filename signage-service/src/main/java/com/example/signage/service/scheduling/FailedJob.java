package com.example.signage.service.scheduling;

import java.time.OffsetDateTime;

public record FailedJob(String key, Long scheduleId, Long displayId, OffsetDateTime failedAt, String error) {
}
