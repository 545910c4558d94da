/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.query;

/**
 * The worklog total could not be computed. No partial total is available when this is thrown.
 *
 * @author jiratime
 */
public class WorklogQueryException extends RuntimeException {

  public WorklogQueryException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
