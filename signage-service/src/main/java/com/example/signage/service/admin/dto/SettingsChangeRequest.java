package com.example.signage.service.admin.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A settings mutation announced by the settings service.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SettingsChangeRequest {

    @NotBlank(message = "Setting key is required")
    private String key;

    private String value;
}
