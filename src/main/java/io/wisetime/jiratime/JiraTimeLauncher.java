/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.wisetime.jiratime.api.JiraApiException;
import io.wisetime.jiratime.api.JiraRestClient;
import io.wisetime.jiratime.config.JiraTimeConfig;
import io.wisetime.jiratime.config.JiraTimeModule;
import io.wisetime.jiratime.config.RuntimeConfig;
import io.wisetime.jiratime.report.ReportFormatter;
import io.wisetime.jiratime.report.WorklogReport;
import java.io.IOException;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application entry point. The report is written to stdout; diagnostics go to stderr.
 *
 * @author jiratime
 */
public class JiraTimeLauncher {

  private static final Logger log = LoggerFactory.getLogger(JiraTimeLauncher.class);

  public static void main(final String... args) {
    System.exit(run(System.out, System.err, args));
  }

  /**
   * @return the process exit status
   */
  @VisibleForTesting
  static int run(final PrintStream out, final PrintStream err, final String... args) {
    final CommandLineArgs commandLine;
    try {
      commandLine = CommandLineArgs.parse(args);
    } catch (UsageException e) {
      err.println("jiratime: " + e.getMessage());
      err.println(CommandLineArgs.usage());
      return 1;
    }
    if (commandLine.isHelp()) {
      out.println(CommandLineArgs.usage());
      return 0;
    }

    try {
      final JiraTimeConfig config = JiraTimeConfig.from(RuntimeConfig.load(commandLine.getConfigFile()));
      log.debug("Using {}", config);
      final Injector injector = Guice.createInjector(new JiraTimeModule(config));

      try (JiraRestClient ignored = injector.getInstance(JiraRestClient.class)) {
        final WorklogReport report = injector.getInstance(JiraTimeReporter.class).report(commandLine);
        out.println(injector.getInstance(ReportFormatter.class).format(report, commandLine.getFormat()));
      }
      return 0;

    } catch (JiraApiException e) {
      if (e.isAuthenticationFailure()) {
        err.println("jiratime: authentication with Jira failed, check username and userkey: " + e.getMessage());
      } else {
        err.println("jiratime: " + e.getMessage());
      }
      log.debug("Jira request failed", e);
      return 1;
    } catch (IOException | RuntimeException e) {
      err.println("jiratime: " + e.getMessage());
      log.debug("Run failed", e);
      return 1;
    }
  }
}
