package com.example.fundraisingdashboard.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * An operation held by the confirmation gate until it is confirmed, cancelled or expires.
 */
@Getter
@ToString
@AllArgsConstructor
public class PendingOperation {
    private final String id;
    private final Operation operation;
    private final Instant createdAt;
    private final Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
