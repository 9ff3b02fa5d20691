/*
 * Where: Alarm data access
 * What: Read-only source of active dosage schedules
 * Why: The medicines table belongs to the medicine-management side; the scheduler only reads it
 */
package com.example.alarm.repository;

import com.example.alarm.model.DosageScheduleEntry;
import java.util.List;

public interface ScheduleStore {

  /** Full snapshot of active entries, in stable store order. */
  List<DosageScheduleEntry> listAllActiveEntries();
}
