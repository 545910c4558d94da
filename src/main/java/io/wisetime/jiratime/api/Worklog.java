/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.api;

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * Models a Jira Worklog as returned by the issue worklog endpoint.
 *
 * @author jiratime
 */
@Data
@Accessors(chain = true)
public class Worklog {

  private Author author;
  /**
   * Start of the logged work, e.g. 2021-01-17T12:34:00.000+0000
   */
  private String started;
  private long timeSpentSeconds;

  @Data
  @Accessors(chain = true)
  public static class Author {

    private String accountId;
    private String displayName;
  }

  public String getAuthorAccountId() {
    return author == null ? null : author.getAccountId();
  }
}
