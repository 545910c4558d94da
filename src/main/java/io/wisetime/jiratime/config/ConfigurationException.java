/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.config;

/**
 * Raised when the configuration cannot be loaded or is incomplete.
 *
 * @author jiratime
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(final String message) {
    super(message);
  }

  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
