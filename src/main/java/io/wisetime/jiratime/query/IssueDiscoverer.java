/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.query;

import com.google.common.annotations.VisibleForTesting;
import io.wisetime.jiratime.api.IssueRef;
import io.wisetime.jiratime.api.JiraApi;
import java.io.IOException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.Callable;
import org.apache.commons.lang3.mutable.MutableInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams the ids of every issue the target user may have logged work on within the window onto the work queue, then
 * closes the queue.
 *
 * <p>The search only narrows the set of issues to scan. {@code worklogDate} compares calendar dates in the calling
 * user's time zone and ignores any time of day, so the date bounds are widened by a day on each side. Which worklogs
 * actually count is decided per worklog by {@link WorklogMatcher}.
 *
 * @author jiratime
 */
public class IssueDiscoverer implements Callable<Void> {

  private static final Logger log = LoggerFactory.getLogger(IssueDiscoverer.class);
  private static final DateTimeFormatter JQL_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

  private final JiraApi jiraApi;
  private final String accountId;
  private final TimeWindow window;
  private final ZoneId callerZone;
  private final ClosableQueue<String> workQueue;

  public IssueDiscoverer(final JiraApi jiraApi,
                         final String accountId,
                         final TimeWindow window,
                         final ZoneId callerZone,
                         final ClosableQueue<String> workQueue) {
    this.jiraApi = jiraApi;
    this.accountId = accountId;
    this.window = window;
    this.callerZone = callerZone;
    this.workQueue = workQueue;
  }

  /**
   * Closes the work queue when done, whether or not discovery succeeded.
   */
  @Override
  public Void call() throws IOException, InterruptedException {
    try {
      final String jql = buildJql(accountId, window, callerZone);
      log.debug("Searching issues: {}", jql);

      final MutableInt discovered = new MutableInt();
      new Pager<IssueRef>((startAt, maxResults) -> jiraApi.searchIssues(jql, startAt, maxResults))
          .forEachPage(issues -> {
            for (IssueRef issue : issues) {
              workQueue.put(issue.getId());
              discovered.increment();
            }
          });

      log.info("Found {} {} with worklogs by the user", discovered.intValue(),
          discovered.intValue() == 1 ? "issue" : "issues");
      return null;
    } finally {
      workQueue.close();
    }
  }

  @VisibleForTesting
  static String buildJql(final String accountId, final TimeWindow window, final ZoneId callerZone) {
    final StringBuilder jql = new StringBuilder("worklogAuthor = ").append(quote(accountId));
    window.getStart().ifPresent(start ->
        jql.append(" AND worklogDate >= ")
            .append(quote(start.atZone(callerZone).toLocalDate().minusDays(1).format(JQL_DATE))));
    // The window end is exclusive, so its date is already one day past the last day of interest
    window.getEnd().ifPresent(end ->
        jql.append(" AND worklogDate <= ")
            .append(quote(end.atZone(callerZone).toLocalDate().format(JQL_DATE))));
    return jql.toString();
  }

  private static String quote(final String value) {
    return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }
}
