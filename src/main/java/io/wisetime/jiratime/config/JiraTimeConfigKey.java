/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.config;

/**
 * Configurations specific to jiratime
 *
 * @author jiratime
 */
public enum JiraTimeConfigKey implements ConfigKey {

  BASE_URL("JIRATIME_BASE_URL", "baseurl"),
  USERNAME("JIRATIME_USERNAME", "username"),
  USER_KEY("JIRATIME_USER_KEY", "userkey"),
  WORKERS("JIRATIME_WORKERS", "workers");

  private final String configKey;
  private final String fileKey;

  JiraTimeConfigKey(final String configKey, final String fileKey) {
    this.configKey = configKey;
    this.fileKey = fileKey;
  }

  @Override
  public String getConfigKey() {
    return configKey;
  }

  @Override
  public String getFileKey() {
    return fileKey;
  }
}
