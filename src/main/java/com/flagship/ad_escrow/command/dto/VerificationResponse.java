package com.flagship.ad_escrow.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ad_escrow.channel.ChannelStatus;
import com.flagship.ad_escrow.channel.VerificationResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class VerificationResponse {

    @JsonProperty("channel_id")
    UUID channelId;

    @JsonProperty("status")
    ChannelStatus status;

    @JsonProperty("verified")
    boolean verified;

    @JsonProperty("subscriber_count")
    int subscriberCount;

    @JsonProperty("trust_score")
    int trustScore;

    @JsonProperty("reason")
    String reason;

    public static VerificationResponse from(VerificationResult result) {
        return VerificationResponse.builder()
            .channelId(result.getChannelId())
            .status(result.getStatus())
            .verified(result.isVerified())
            .subscriberCount(result.getSubscriberCount())
            .trustScore(result.getTrustScore())
            .reason(result.getReason())
            .build();
    }
}
