package com.example.signage.service.admin.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DisplayStatsResponse {
    private long total;
    private long online;
    private long offline;
}
