/*
 * Where: Alarm domain model
 * What: Aggregate of one scheduler tick
 * Why: Logged per tick and asserted on in tests
 */
package com.example.alarm.model;

public record TickReport(String minute, int dueUsers, int sent, int failed, int erroredUsers) {

  public static TickReport idle(String minute) {
    return new TickReport(minute, 0, 0, 0, 0);
  }
}
