package com.flagship.ad_escrow.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.time.Duration;

/**
 * Request to create a campaign. The target duration defaults to the engine's configured value.
 */
@Value
public class CreateCampaignRequest {

    @NotBlank(message = "Ad content is required")
    @JsonProperty("ad_content")
    String adContent;

    @NotNull(message = "Budget is required")
    @Positive(message = "Budget must be greater than 0")
    @JsonProperty("budget")
    Long budget;

    @Positive(message = "Target duration must be greater than 0")
    @Max(value = 10080, message = "Target duration cannot exceed 10080 minutes")
    @JsonProperty("target_duration_minutes")
    Long targetDurationMinutes;

    public Duration targetDuration() {
        return targetDurationMinutes == null ? null : Duration.ofMinutes(targetDurationMinutes);
    }
}
