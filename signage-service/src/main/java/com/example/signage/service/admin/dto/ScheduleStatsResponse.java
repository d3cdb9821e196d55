package com.example.signage.service.admin.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleStatsResponse {
    private long total;
    private long active;
    private long inactive;
}
