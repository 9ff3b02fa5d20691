/*
 * Where: Alarm service layer
 * What: Maps stored weekday labels onto DayOfWeek
 * Why: The medicines table stores Korean short names; English names are accepted as well
 */
package com.example.alarm.service;

import com.google.common.collect.ImmutableMap;
import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Map;

public final class WeekdayLabels {

  private static final Map<String, DayOfWeek> KOREAN =
      ImmutableMap.<String, DayOfWeek>builder()
          .put("월", DayOfWeek.MONDAY)
          .put("화", DayOfWeek.TUESDAY)
          .put("수", DayOfWeek.WEDNESDAY)
          .put("목", DayOfWeek.THURSDAY)
          .put("금", DayOfWeek.FRIDAY)
          .put("토", DayOfWeek.SATURDAY)
          .put("일", DayOfWeek.SUNDAY)
          .build();

  private static final int SHORT_NAME_LENGTH = 3;

  private WeekdayLabels() {}

  public static DayOfWeek parse(String label) {
    if (label == null || label.isBlank()) {
      throw new MalformedScheduleEntryException("weekday label is blank");
    }
    final String trimmed = label.trim();
    final DayOfWeek korean = KOREAN.get(trimmed);
    if (korean != null) {
      return korean;
    }
    final String upper = trimmed.toUpperCase(Locale.ROOT);
    for (DayOfWeek day : DayOfWeek.values()) {
      if (day.name().equals(upper)
          || (upper.length() == SHORT_NAME_LENGTH && day.name().startsWith(upper))) {
        return day;
      }
    }
    throw new MalformedScheduleEntryException("unknown weekday label: " + trimmed);
  }
}
