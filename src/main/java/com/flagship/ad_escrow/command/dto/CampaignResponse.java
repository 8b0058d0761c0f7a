package com.flagship.ad_escrow.command.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ad_escrow.campaign.Campaign;
import com.flagship.ad_escrow.campaign.CampaignStatus;
import com.flagship.ad_escrow.escrow.EscrowHold;
import com.flagship.ad_escrow.escrow.EscrowHoldStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CampaignResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("advertiser_id")
    UUID advertiserId;

    @JsonProperty("ad_content")
    String adContent;

    @JsonProperty("budget")
    long budget;

    @JsonProperty("target_duration_minutes")
    long targetDurationMinutes;

    @JsonProperty("status")
    CampaignStatus status;

    @JsonProperty("channel_id")
    UUID channelId;

    @JsonProperty("placement_ref")
    String placementRef;

    @JsonProperty("posted_at")
    Instant postedAt;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("escrow_status")
    EscrowHoldStatus escrowStatus;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("expires_at")
    Instant expiresAt;

    public static CampaignResponse from(Campaign campaign) {
        return from(campaign, null);
    }

    public static CampaignResponse from(Campaign campaign, EscrowHold hold) {
        return CampaignResponse.builder()
            .id(campaign.getId())
            .advertiserId(campaign.getAdvertiserId())
            .adContent(campaign.getAdContent())
            .budget(campaign.getBudget())
            .targetDurationMinutes(campaign.getTargetDuration().toMinutes())
            .status(campaign.getStatus())
            .channelId(campaign.getChannelId())
            .placementRef(campaign.getPlacementRef())
            .postedAt(campaign.getPostedAt())
            .failureReason(campaign.getFailureReason())
            .escrowStatus(hold != null ? hold.getStatus() : null)
            .createdAt(campaign.getCreatedAt())
            .expiresAt(campaign.getExpiresAt())
            .build();
    }
}
