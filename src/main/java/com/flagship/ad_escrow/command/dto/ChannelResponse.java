package com.flagship.ad_escrow.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ad_escrow.channel.Channel;
import com.flagship.ad_escrow.channel.ChannelStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ChannelResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("external_id")
    String externalId;

    @JsonProperty("title")
    String title;

    @JsonProperty("status")
    ChannelStatus status;

    @JsonProperty("subscriber_count")
    int subscriberCount;

    @JsonProperty("trust_score")
    int trustScore;

    @JsonProperty("last_verified_at")
    Instant lastVerifiedAt;

    public static ChannelResponse from(Channel channel) {
        return ChannelResponse.builder()
            .id(channel.getId())
            .externalId(channel.getExternalId())
            .title(channel.getTitle())
            .status(channel.getStatus())
            .subscriberCount(channel.getSubscriberCount())
            .trustScore(channel.getTrustScore())
            .lastVerifiedAt(channel.getLastVerifiedAt())
            .build();
    }
}
