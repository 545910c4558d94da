/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.query;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.wisetime.jiratime.api.Worklog;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides how much of a worklog counts towards the total: all of it if the target user wrote it and it started within
 * the window, otherwise none.
 *
 * @author jiratime
 */
public class WorklogMatcher {

  private static final Logger log = LoggerFactory.getLogger(WorklogMatcher.class);

  /**
   * Jira's worklog timestamp, e.g. 2021-01-17T12:34:00.000+0000. Fractional seconds are optional and the offset may
   * also be written with a colon.
   */
  private static final DateTimeFormatter JIRA_TIMESTAMP = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
      .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
      .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
      .toFormatter();

  private final String accountId;
  private final TimeWindow window;

  public WorklogMatcher(final String accountId, final TimeWindow window) {
    this.accountId = Preconditions.checkNotNull(accountId);
    this.window = Preconditions.checkNotNull(window);
  }

  /**
   * Seconds this worklog contributes to the total. A worklog whose start time cannot be parsed is logged and
   * contributes nothing.
   */
  public long countedSeconds(final String issueId, final Worklog worklog) {
    final Optional<Instant> started = parseStarted(worklog.getStarted());
    if (started.isEmpty()) {
      log.warn("Skipping worklog on issue {}: failed to parse start time '{}'", issueId, worklog.getStarted());
      return 0;
    }
    if (!accountId.equals(worklog.getAuthorAccountId())) {
      return 0;
    }
    if (!window.contains(started.get())) {
      return 0;
    }
    if (worklog.getTimeSpentSeconds() < 0) {
      log.warn("Skipping worklog on issue {}: negative time spent {}", issueId, worklog.getTimeSpentSeconds());
      return 0;
    }
    return worklog.getTimeSpentSeconds();
  }

  @VisibleForTesting
  static Optional<Instant> parseStarted(final String started) {
    if (StringUtils.isBlank(started)) {
      return Optional.empty();
    }
    try {
      return Optional.of(OffsetDateTime.parse(started.trim(), JIRA_TIMESTAMP).toInstant());
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
