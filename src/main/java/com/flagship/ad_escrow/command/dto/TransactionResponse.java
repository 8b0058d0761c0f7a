package com.flagship.ad_escrow.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ad_escrow.ledger.LedgerTransaction;
import com.flagship.ad_escrow.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(LedgerTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .amount(transaction.getAmount())
            .kind(transaction.getKind())
            .reference(transaction.getReference())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
