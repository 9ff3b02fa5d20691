/*
 * Where: Alarm domain model
 * What: Snapshot of a push_subscriptions row
 * Why: Carries the endpoint and the key material needed to encrypt to one device
 */
package com.example.alarm.model;

import java.time.Instant;

public record PushSubscription(
        String endpoint,
        String userId,
        String p256dh,
        String auth,
        Instant createdAt,
        Instant updatedAt) {
}
