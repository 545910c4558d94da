/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.report;

import io.wisetime.jiratime.api.JiraUser;
import io.wisetime.jiratime.query.AggregateResult;
import io.wisetime.jiratime.query.TimeWindow;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.TimeUnit;
import lombok.Data;
import lombok.experimental.Accessors;

/**
 * The time a user logged within a window, split into hours, minutes and seconds. Field names are the JSON keys.
 *
 * @author jiratime
 */
@Data
@Accessors(chain = true)
public class WorklogReport {

  private static final DateTimeFormatter REPORT_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

  private ReportUser user;
  private String start;
  private String end;
  private long hours;
  private long minutes;
  private long seconds;
  private long totalSeconds;

  /**
   * Builds the report, showing the window as the dates it covers in the given zone. The end date shown is the last
   * day included.
   */
  public static WorklogReport of(final JiraUser user, final AggregateResult result, final ZoneId zone) {
    final TimeWindow window = result.getWindow();
    final long total = result.getTotalSeconds();
    return new WorklogReport()
        .setUser(ReportUser.of(user))
        .setStart(window.getStart()
            .map(start -> start.atZone(zone).toLocalDate().format(REPORT_DATE))
            .orElse(null))
        .setEnd(window.getEnd()
            .map(end -> end.minusNanos(1).atZone(zone).toLocalDate().format(REPORT_DATE))
            .orElse(null))
        .setHours(TimeUnit.SECONDS.toHours(total))
        .setMinutes(Duration.ofSeconds(total).toMinutesPart())
        .setSeconds(Duration.ofSeconds(total).toSecondsPart())
        .setTotalSeconds(total);
  }

  /**
   * The reported user, without the account id.
   */
  @Data
  @Accessors(chain = true)
  public static class ReportUser {

    private String emailAddress;
    private String displayName;
    private String timeZone;

    static ReportUser of(final JiraUser user) {
      return new ReportUser()
          .setEmailAddress(user.getEmailAddress())
          .setDisplayName(user.getDisplayName())
          .setTimeZone(user.getTimeZone());
    }
  }
}
