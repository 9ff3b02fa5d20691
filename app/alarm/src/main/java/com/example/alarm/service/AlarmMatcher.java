/*
 * Where: Alarm service layer
 * What: Selects the schedule entries due at a given minute and groups them by user
 * Why: Kept free of I/O so the same snapshot and instant always give the same grouping
 */
package com.example.alarm.service;

import com.example.alarm.config.AlarmSchedulerProperties;
import com.example.alarm.model.DosageScheduleEntry;
import com.google.common.annotations.VisibleForTesting;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AlarmMatcher {

  private static final Logger logger = LoggerFactory.getLogger(AlarmMatcher.class);
  private static final DateTimeFormatter STORED_TIME = DateTimeFormatter.ofPattern("H:mm[:ss]");
  private static final DateTimeFormatter MINUTE_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

  private final ZoneId zone;

  public AlarmMatcher(AlarmSchedulerProperties properties) {
    this.zone = properties.zoneId();
  }

  /**
   * Returns due entries keyed by user id. Users appear in the order their first due entry appears
   * in {@code entries}, and each user's entries keep their input order.
   */
  public Map<String, List<DosageScheduleEntry>> match(List<DosageScheduleEntry> entries, Instant at) {
    final ZonedDateTime local = at.atZone(zone);
    final LocalTime minute = local.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
    final DayOfWeek weekday = local.getDayOfWeek();

    final Map<String, List<DosageScheduleEntry>> dueByUser = new LinkedHashMap<>();
    for (DosageScheduleEntry entry : entries) {
      try {
        if (isDue(entry, minute, weekday)) {
          dueByUser.computeIfAbsent(entry.userId(), ignored -> new ArrayList<>()).add(entry);
        }
      } catch (MalformedScheduleEntryException ex) {
        logger.warn(
            "alarm schedule entry skipped entryId={} userId={} reason={}",
            entry.entryId(),
            entry.userId(),
            ex.getMessage());
      }
    }
    return dueByUser;
  }

  /** {@code HH:MM} of {@code at} in the configured zone. */
  public String minuteOf(Instant at) {
    return MINUTE_FORMAT.format(at.atZone(zone));
  }

  public ZoneId zone() {
    return zone;
  }

  @VisibleForTesting
  boolean isDue(DosageScheduleEntry entry, LocalTime minute, DayOfWeek weekday) {
    if (entry.userId() == null || entry.userId().isBlank()) {
      throw new MalformedScheduleEntryException("user id is missing");
    }
    // every stored value is parsed so a bad row is reported even when it would not match
    boolean timeMatches = false;
    for (String time : entry.times()) {
      timeMatches |= parseTime(time).equals(minute);
    }
    boolean dayMatches = entry.everyDay();
    for (String day : entry.days()) {
      dayMatches |= WeekdayLabels.parse(day) == weekday;
    }
    return timeMatches && dayMatches;
  }

  private LocalTime parseTime(String time) {
    if (time == null) {
      throw new MalformedScheduleEntryException("time is missing");
    }
    try {
      return LocalTime.parse(time.trim(), STORED_TIME).truncatedTo(ChronoUnit.MINUTES);
    } catch (DateTimeParseException ex) {
      throw new MalformedScheduleEntryException("time is not HH:MM: " + time, ex);
    }
  }
}
