package com.example.signage.service.health.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DebugToggleRequest {

    @NotNull(message = "enabled is required")
    private Boolean enabled;
}
