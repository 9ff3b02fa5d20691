/*
 * Where: Alarm domain model
 * What: Sent/failed counts for one user's devices
 */
package com.example.alarm.model;

public record DispatchSummary(int sent, int failed) {

  public static final DispatchSummary EMPTY = new DispatchSummary(0, 0);

  public DispatchSummary plus(DispatchOutcome outcome) {
    return outcome.isDelivered()
        ? new DispatchSummary(sent + 1, failed)
        : new DispatchSummary(sent, failed + 1);
  }

  public DispatchSummary plus(DispatchSummary other) {
    return new DispatchSummary(sent + other.sent, failed + other.failed);
  }
}
