/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.report;

import static org.assertj.core.api.Assertions.assertThat;

import io.wisetime.jiratime.api.JiraUser;
import io.wisetime.jiratime.query.AggregateResult;
import io.wisetime.jiratime.query.TimeWindow;
import io.wisetime.jiratime.testutils.FakeEntities;
import java.time.LocalDate;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class WorklogReportTest {

  private static final FakeEntities FAKE_ENTITIES = new FakeEntities();
  private static final ZoneId PERTH = ZoneId.of("Australia/Perth");

  @Test
  void of_splits_total_into_hours_minutes_seconds() {
    final JiraUser user = FAKE_ENTITIES.randomUser();
    final TimeWindow window = TimeWindow.ofDates(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31), PERTH);

    final WorklogReport report = WorklogReport.of(user, new AggregateResult(27 * 3600 + 5 * 60 + 9, window), PERTH);

    assertThat(report.getHours())
        .as("hours are not wrapped at a day")
        .isEqualTo(27);
    assertThat(report.getMinutes()).isEqualTo(5);
    assertThat(report.getSeconds()).isEqualTo(9);
    assertThat(report.getTotalSeconds()).isEqualTo(97_509);
    assertThat(report.getUser().getDisplayName()).isEqualTo(user.getDisplayName());
    assertThat(report.getUser().getEmailAddress()).isEqualTo(user.getEmailAddress());
    assertThat(report.getUser().getTimeZone()).isEqualTo("Australia/Perth");
  }

  @Test
  void of_shows_inclusive_dates() {
    final TimeWindow window = TimeWindow.ofDates(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31), PERTH);

    final WorklogReport report = WorklogReport.of(FAKE_ENTITIES.randomUser(), new AggregateResult(0, window), PERTH);

    assertThat(report.getStart()).isEqualTo("2024-03-01");
    assertThat(report.getEnd())
        .as("the last day included, not the exclusive end")
        .isEqualTo("2024-03-31");
  }

  @Test
  void of_open_window_has_no_dates() {
    final WorklogReport report = WorklogReport.of(
        FAKE_ENTITIES.randomUser(), new AggregateResult(59, TimeWindow.open()), PERTH);

    assertThat(report.getStart()).isNull();
    assertThat(report.getEnd()).isNull();
    assertThat(report.getHours()).isZero();
    assertThat(report.getMinutes()).isZero();
    assertThat(report.getSeconds()).isEqualTo(59);
  }
}
