/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime;

/**
 * A Jira account, or its time zone, could not be determined.
 *
 * @author jiratime
 */
public class UserLookupException extends RuntimeException {

  public UserLookupException(final String message) {
    super(message);
  }

  public UserLookupException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
