/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.config;

import com.google.common.annotations.VisibleForTesting;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.SystemUtils;

/**
 * Locates the default config file.
 *
 * @author jiratime
 */
public final class ConfigPaths {

  public static final String CONFIG_FILE_NAME = "jiratime.json";

  private ConfigPaths() {
  }

  public static Path defaultConfigFile() {
    return userConfigDir(System.getenv(), SystemUtils.getUserHome().toPath(),
        SystemUtils.IS_OS_WINDOWS, SystemUtils.IS_OS_MAC).resolve(CONFIG_FILE_NAME);
  }

  /**
   * The per user configuration directory: %APPDATA% on Windows, ~/Library/Application Support on macOS and
   * $XDG_CONFIG_HOME or ~/.config elsewhere.
   */
  @VisibleForTesting
  static Path userConfigDir(final Map<String, String> environment, final Path userHome,
                            final boolean windows, final boolean mac) {
    if (windows) {
      final String appData = environment.get("APPDATA");
      if (StringUtils.isNotBlank(appData)) {
        return Paths.get(appData);
      }
      return userHome.resolve("AppData").resolve("Roaming");
    }
    if (mac) {
      return userHome.resolve("Library").resolve("Application Support");
    }
    final String xdgConfigHome = environment.get("XDG_CONFIG_HOME");
    if (StringUtils.isNotBlank(xdgConfigHome)) {
      return Paths.get(xdgConfigHome);
    }
    return userHome.resolve(".config");
  }
}
