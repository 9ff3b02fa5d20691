package com.example.alarm.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.DayOfWeek;
import org.junit.jupiter.api.Test;

class WeekdayLabelsTest {

  @Test
  void parsesKoreanShortNames() {
    assertThat(WeekdayLabels.parse("월")).isEqualTo(DayOfWeek.MONDAY);
    assertThat(WeekdayLabels.parse(" 목 ")).isEqualTo(DayOfWeek.THURSDAY);
    assertThat(WeekdayLabels.parse("일")).isEqualTo(DayOfWeek.SUNDAY);
  }

  @Test
  void parsesEnglishNamesIgnoringCase() {
    assertThat(WeekdayLabels.parse("tue")).isEqualTo(DayOfWeek.TUESDAY);
    assertThat(WeekdayLabels.parse("Saturday")).isEqualTo(DayOfWeek.SATURDAY);
  }

  @Test
  void rejectsUnknownOrBlankLabels() {
    assertThatThrownBy(() -> WeekdayLabels.parse("mo"))
        .isInstanceOf(MalformedScheduleEntryException.class);
    assertThatThrownBy(() -> WeekdayLabels.parse(""))
        .isInstanceOf(MalformedScheduleEntryException.class);
    assertThatThrownBy(() -> WeekdayLabels.parse(null))
        .isInstanceOf(MalformedScheduleEntryException.class);
  }
}
