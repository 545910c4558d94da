/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime;

/**
 * The command line arguments are invalid.
 *
 * @author jiratime
 */
public class UsageException extends RuntimeException {

  public UsageException(final String message) {
    super(message);
  }
}
