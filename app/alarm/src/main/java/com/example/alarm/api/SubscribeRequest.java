/*
 * Where: Alarm API
 * What: Push registration body; the subscription part is the browser PushSubscription JSON as-is
 */
package com.example.alarm.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscribeRequest(
    @NotBlank(message = "user_id is required") String userId,
    @NotNull(message = "subscription is required") @Valid Subscription subscription) {

  public record Subscription(
      @NotBlank(message = "subscription.endpoint is required") String endpoint,
      @NotNull(message = "subscription.keys is required") @Valid Keys keys) {}

  public record Keys(
      @NotBlank(message = "subscription.keys.p256dh is required") String p256dh,
      @NotBlank(message = "subscription.keys.auth is required") String auth) {}
}
