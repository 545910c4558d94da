/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime;

import com.google.common.annotations.VisibleForTesting;
import io.wisetime.jiratime.api.JiraApi;
import io.wisetime.jiratime.api.JiraUser;
import io.wisetime.jiratime.query.AggregateResult;
import io.wisetime.jiratime.query.TimeWindow;
import io.wisetime.jiratime.query.WorklogTimeQuery;
import io.wisetime.jiratime.report.WorklogReport;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import javax.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves who is asking and who is being reported on, turns the requested dates into a window and runs the worklog
 * query.
 *
 * @author jiratime
 */
public class JiraTimeReporter {

  private static final Logger log = LoggerFactory.getLogger(JiraTimeReporter.class);

  private final JiraApi jiraApi;
  private final WorklogTimeQuery worklogTimeQuery;

  @Inject
  public JiraTimeReporter(final JiraApi jiraApi, final WorklogTimeQuery worklogTimeQuery) {
    this.jiraApi = jiraApi;
    this.worklogTimeQuery = worklogTimeQuery;
  }

  public WorklogReport report(final CommandLineArgs args) throws IOException {
    return report(args.getUser().orElse(null), args.getStartDate().orElse(null), args.getEndDate().orElse(null));
  }

  /**
   * @param userEmail user to report on, or null for the calling user
   * @param startDate first day of the report in the reported user's time zone, or null for no lower bound
   * @param endDate last day of the report (inclusive) in the reported user's time zone, or null for no upper bound
   */
  public WorklogReport report(final String userEmail, final LocalDate startDate, final LocalDate endDate)
      throws IOException {
    // The caller is needed even when reporting on someone else: Jira evaluates search dates in the caller's zone
    final JiraUser caller = findCaller();
    final ZoneId callerZone = zoneOf(caller);

    final JiraUser user = userEmail == null ? caller : findUser(userEmail);
    final ZoneId userZone = userEmail == null ? callerZone : zoneOf(user);

    final TimeWindow window = TimeWindow.ofDates(startDate, endDate, userZone);
    log.info("Totalling worklogs by {} within {}", user.getDisplayName(), window);

    final AggregateResult result = worklogTimeQuery.totalSeconds(user.getAccountId(), window, callerZone);
    return WorklogReport.of(user, result, callerZone);
  }

  @VisibleForTesting
  JiraUser findCaller() throws IOException {
    final JiraUser caller = jiraApi.myself();
    if (caller == null || StringUtils.isBlank(caller.getAccountId())) {
      throw new UserLookupException("Could not determine AccountID for the calling user");
    }
    return caller;
  }

  @VisibleForTesting
  JiraUser findUser(final String email) throws IOException {
    final List<JiraUser> users = jiraApi.findUsers(email);
    if (users.isEmpty() || StringUtils.isBlank(users.get(0).getAccountId())) {
      throw new UserLookupException("Could not determine AccountID for " + email);
    }
    final JiraUser user = users.get(0);
    if (StringUtils.isEmpty(user.getEmailAddress())) {
      // Jira hides email addresses depending on the user's privacy settings
      user.setEmailAddress(email);
    }
    return user;
  }

  private static ZoneId zoneOf(final JiraUser user) {
    if (StringUtils.isBlank(user.getTimeZone())) {
      throw new UserLookupException("No time zone available for " + user.getDisplayName());
    }
    try {
      return ZoneId.of(user.getTimeZone());
    } catch (DateTimeException e) {
      throw new UserLookupException(
          String.format("Invalid time zone '%s' for %s", user.getTimeZone(), user.getDisplayName()), e);
    }
  }
}
