package com.flagship.ad_escrow.user;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A participant known to the engine, identified externally by its chat platform id.
 *
 * The balance is a cached projection of the user's ledger transactions; it is
 * written only by {@code LedgerService}.
 */
@Value
public class User {
    UUID id;
    long externalId;
    String username;
    UserRole role;
    boolean active;
    long balance;
    Instant createdAt;
    Instant updatedAt;

    public boolean canAdvertise() {
        return active && role.canAdvertise();
    }

    public boolean canOwnChannels() {
        return active && role.canOwnChannels();
    }
}
