/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.config;

/**
 * A named configuration value that may be supplied as a system property, an environment variable or a config file entry.
 *
 * @author jiratime
 */
public interface ConfigKey {

  /**
   * Name used for system property and environment variable lookups.
   */
  String getConfigKey();

  /**
   * Name of the entry in the JSON config file.
   */
  String getFileKey();
}
