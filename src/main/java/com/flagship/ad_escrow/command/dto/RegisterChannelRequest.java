package com.flagship.ad_escrow.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RegisterChannelRequest {

    @NotBlank(message = "Channel id is required")
    @Size(max = 255, message = "Channel id must be at most 255 characters")
    @JsonProperty("external_id")
    String externalId;

    @Size(max = 255, message = "Title must be at most 255 characters")
    @JsonProperty("title")
    String title;
}
