/*
 * Where: Alarm domain model
 * What: Result of sending to a single endpoint plus an optional reason
 * Why: Delivery failures are expected values here, not exceptions
 */
package com.example.alarm.model;

public record DispatchOutcome(DispatchResult result, String reason) {

  public static final String REASON_EXPIRED = "expired";

  private static final DispatchOutcome DELIVERED = new DispatchOutcome(DispatchResult.DELIVERED, null);

  public static DispatchOutcome delivered() {
    return DELIVERED;
  }

  public static DispatchOutcome transientFailure(String reason) {
    return new DispatchOutcome(DispatchResult.TRANSIENT_FAILURE, reason);
  }

  public static DispatchOutcome permanentFailure(String reason) {
    return new DispatchOutcome(DispatchResult.PERMANENT_FAILURE, reason);
  }

  public boolean isDelivered() {
    return result == DispatchResult.DELIVERED;
  }

  public boolean isPermanentFailure() {
    return result == DispatchResult.PERMANENT_FAILURE;
  }
}
