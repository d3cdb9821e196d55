package com.example.signage.service.admin.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * What a display should show right now. {@code source} is "schedule" when a schedule is in
 * effect, or "default" when none is and the content library's default applies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentContentResponse {
    public static final String SOURCE_SCHEDULE = "schedule";
    public static final String SOURCE_DEFAULT = "default";

    private Long displayId;
    private String source;
    private ScheduleResponse schedule;
    private OffsetDateTime resolvedAt;
}
