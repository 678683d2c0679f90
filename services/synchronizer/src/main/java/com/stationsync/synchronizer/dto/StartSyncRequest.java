package com.stationsync.synchronizer.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Omitted fields fall back to the configured groups and interval.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartSyncRequest {

    private List<@NotBlank(message = "Group names cannot be blank") String> groups;

    @Min(value = 10, message = "Interval must be at least 10 seconds")
    @Max(value = 3600, message = "Interval cannot exceed 3600 seconds")
    private Integer intervalSeconds;

    @Builder.Default
    private boolean continuous = true;
}
