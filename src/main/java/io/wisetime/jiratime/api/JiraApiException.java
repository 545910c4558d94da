/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.api;

import java.io.IOException;
import java.util.OptionalInt;

/**
 * A Jira REST call returned an error status or a body that could not be decoded.
 *
 * @author jiratime
 */
public class JiraApiException extends IOException {

  private final int statusCode;

  public JiraApiException(final String message, final int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public JiraApiException(final String message, final Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /**
   * HTTP status of the failed call, if the failure was an error response.
   */
  public OptionalInt getStatusCode() {
    return statusCode < 0 ? OptionalInt.empty() : OptionalInt.of(statusCode);
  }

  public boolean isAuthenticationFailure() {
    return statusCode == 401 || statusCode == 403;
  }
}
