package com.example.signage.service.admin.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Schedule creation request. Exactly one of {@code displayId}/{@code displayGroupId}
 * and exactly one of {@code contentId}/{@code contentIds}/{@code playlistId} must be set;
 * those cross-field rules are checked by the service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {

    private Long displayId;

    private Long displayGroupId;

    private Long contentId;

    @Size(min = 1, message = "contentIds must not be empty")
    private List<Long> contentIds;

    private Long playlistId;

    @NotNull(message = "Start time is required")
    private OffsetDateTime startTime;

    private OffsetDateTime endTime;

    @Size(max = 255, message = "Recurrence rule must be at most 255 characters")
    private String recurrenceRule;

    @Min(value = 0, message = "Priority must be between 0 and 999")
    @Max(value = 999, message = "Priority must be between 0 and 999")
    private Integer priority;

    private Boolean isActive;
}
