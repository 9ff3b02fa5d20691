/*
 * Where: Alarm domain model
 * What: Read-only snapshot of one medicines row as seen by the scheduler
 * Why: Matching works on raw stored values so one bad row can be skipped alone
 */
package com.example.alarm.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record DosageScheduleEntry(
    String entryId,
    String userId,
    String medicationName,
    String timing,
    List<String> times,
    List<String> days) {

  public DosageScheduleEntry {
    // List.copyOf rejects null elements; those must reach the matcher to be reported
    times = times == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(times));
    days = days == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(days));
  }

  public boolean everyDay() {
    return days.isEmpty();
  }
}
