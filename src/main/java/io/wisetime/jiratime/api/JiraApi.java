/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.api;

import java.io.IOException;
import java.util.List;

/**
 * Read only access to the Jira Cloud REST API, authenticated as the calling user.
 * Implementations must be safe for concurrent use.
 *
 * @author jiratime
 */
public interface JiraApi {

  /**
   * The account used to authenticate.
   */
  JiraUser myself() throws IOException;

  /**
   * Users matching a query string such as an email address, best match first.
   */
  List<JiraUser> findUsers(String query) throws IOException;

  /**
   * One page of issues matching a JQL expression. Only the issue id is populated.
   */
  Page<IssueRef> searchIssues(String jql, int startAt, int maxResults) throws IOException;

  /**
   * One page of the worklogs recorded against an issue.
   */
  Page<Worklog> issueWorklogs(String issueId, int startAt, int maxResults) throws IOException;
}
