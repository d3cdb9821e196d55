package com.example.signage.service.admin.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Partial update. Absent fields keep their value. Supplying any target field replaces the
 * whole target, and supplying any payload field replaces the whole payload.
 * {@code clearEndTime} and {@code clearRecurrenceRule} remove the optional fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleUpdateRequest {

    private Long displayId;

    private Long displayGroupId;

    private Long contentId;

    @Size(min = 1, message = "contentIds must not be empty")
    private List<Long> contentIds;

    private Long playlistId;

    private OffsetDateTime startTime;

    private OffsetDateTime endTime;

    private boolean clearEndTime;

    @Size(max = 255, message = "Recurrence rule must be at most 255 characters")
    private String recurrenceRule;

    private boolean clearRecurrenceRule;

    @Min(value = 0, message = "Priority must be between 0 and 999")
    @Max(value = 999, message = "Priority must be between 0 and 999")
    private Integer priority;

    private Boolean isActive;

    public boolean hasTarget() {
        return displayId != null || displayGroupId != null;
    }

    public boolean hasPayload() {
        return contentId != null || contentIds != null || playlistId != null;
    }
}
