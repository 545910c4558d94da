/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Validated connection settings for the Jira REST API.
 *
 * @author jiratime
 */
@Value
@Builder
public class JiraTimeConfig {

  public static final int DEFAULT_WORKERS = 20;
  private static final String API_PATH = "/rest/api/3";

  String apiBaseUrl;
  String username;
  @ToString.Exclude
  String userKey;
  int workers;

  /**
   * Reads the required settings, failing with the full list of anything that is missing.
   */
  public static JiraTimeConfig from(final RuntimeConfig runtimeConfig) {
    final List<String> undefined = new ArrayList<>();
    final String baseUrl = runtimeConfig.getString(JiraTimeConfigKey.BASE_URL).orElse(null);
    final String username = runtimeConfig.getString(JiraTimeConfigKey.USERNAME).orElse(null);
    final String userKey = runtimeConfig.getString(JiraTimeConfigKey.USER_KEY).orElse(null);

    if (baseUrl == null) {
      undefined.add(JiraTimeConfigKey.BASE_URL.getFileKey());
    }
    if (username == null) {
      undefined.add(JiraTimeConfigKey.USERNAME.getFileKey());
    }
    if (userKey == null) {
      undefined.add(JiraTimeConfigKey.USER_KEY.getFileKey());
    }
    if (!undefined.isEmpty()) {
      throw new ConfigurationException("Not defined in config: " + String.join(",", undefined));
    }

    final int workers = runtimeConfig.getInt(JiraTimeConfigKey.WORKERS)
        .filter(count -> count > 0)
        .orElse(DEFAULT_WORKERS);

    return JiraTimeConfig.builder()
        .apiBaseUrl(StringUtils.removeEnd(baseUrl, "/") + API_PATH)
        .username(username)
        .userKey(userKey)
        .workers(workers)
        .build();
  }
}
