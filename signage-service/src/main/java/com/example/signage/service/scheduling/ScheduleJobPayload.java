package com.example.signage.service.scheduling;

import java.util.List;

/**
 * What a schedule job carries to its firing: the schedule, the one display it was
 * expanded for, and the schedule's payload.
 */
public record ScheduleJobPayload(Long scheduleId, Long displayId, Long contentId, List<Long> contentIds, Long playlistId) {

    /**
     * The content a display should show first: the single content, or the head of the list.
     */
    public Long leadContentId() {
        if (contentId != null) {
            return contentId;
        }
        return contentIds == null || contentIds.isEmpty() ? null : contentIds.get(0);
    }
}
