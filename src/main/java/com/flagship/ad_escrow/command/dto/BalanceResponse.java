package com.flagship.ad_escrow.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class BalanceResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("balance")
    long balance;
}
