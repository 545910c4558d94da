/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime;

import com.google.common.collect.ImmutableSet;
import io.wisetime.jiratime.config.ConfigPaths;
import io.wisetime.jiratime.report.OutputFormat;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Parsed command line. Options take a value, written either as {@code --start 2024-01-01} or
 * {@code --start=2024-01-01}. A single leading dash is accepted as well.
 *
 * @author jiratime
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
public class CommandLineArgs {

  private static final Set<String> VALUE_OPTIONS = ImmutableSet.of("start", "end", "config", "user", "format");

  LocalDate startDate;
  LocalDate endDate;
  Path configFile;
  String user;
  OutputFormat format;
  boolean help;

  public Optional<LocalDate> getStartDate() {
    return Optional.ofNullable(startDate);
  }

  /**
   * Last day of the report, inclusive.
   */
  public Optional<LocalDate> getEndDate() {
    return Optional.ofNullable(endDate);
  }

  /**
   * Email address of the user to report on. Empty means the calling user.
   */
  public Optional<String> getUser() {
    return Optional.ofNullable(user);
  }

  /**
   * @throws UsageException listing every invalid argument
   */
  public static CommandLineArgs parse(final String... args) {
    final Map<String, String> values = new HashMap<>();
    for (int i = 0; i < args.length; i++) {
      final String arg = args[i];
      if (!arg.startsWith("-") || arg.equals("-") || arg.equals("--")) {
        throw new UsageException("Unexpected argument: " + arg);
      }
      final String option = StringUtils.stripStart(arg, "-");
      final String name = StringUtils.substringBefore(option, "=");
      if (name.equals("help") || name.equals("h")) {
        return CommandLineArgs.builder().help(true).format(OutputFormat.TEXT).build();
      }
      if (!VALUE_OPTIONS.contains(name)) {
        throw new UsageException("Unknown option: " + arg);
      }
      if (option.contains("=")) {
        values.put(name, StringUtils.substringAfter(option, "="));
      } else if (i + 1 < args.length) {
        values.put(name, args[++i]);
      } else {
        throw new UsageException("Missing value for option: " + arg);
      }
    }

    final String formatName = values.getOrDefault("format", OutputFormat.TEXT.getFormatName());
    final OutputFormat format = OutputFormat.fromName(formatName)
        .orElseThrow(() -> new UsageException("Unknown output format: " + formatName));

    // Parse both dates before failing so that both can be reported
    final List<String> dateErrors = new ArrayList<>();
    final LocalDate startDate = parseDate("start", values.get("start"), dateErrors);
    final LocalDate endDate = parseDate("end", values.get("end"), dateErrors);
    if (!dateErrors.isEmpty()) {
      throw new UsageException(String.join("; ", dateErrors));
    }

    return CommandLineArgs.builder()
        .startDate(startDate)
        .endDate(endDate)
        .configFile(values.containsKey("config")
            ? Paths.get(values.get("config"))
            : ConfigPaths.defaultConfigFile())
        .user(StringUtils.trimToNull(values.get("user")))
        .format(format)
        .help(false)
        .build();
  }

  public static String usage() {
    return String.join(System.lineSeparator(),
        "Usage: jiratime [options]",
        "  --start YYYY-MM-DD   First day of report",
        "  --end YYYY-MM-DD     Last day of report (inclusive)",
        "  --config PATH        Configuration file (default " + ConfigPaths.defaultConfigFile() + ")",
        "  --user EMAIL         User's email address (default is the calling user)",
        "  --format FORMAT      Output format: " + OutputFormat.names() + " (default text)");
  }

  private static LocalDate parseDate(final String name, final String value, final List<String> errors) {
    if (StringUtils.isEmpty(value)) {
      return null;
    }
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException e) {
      errors.add(String.format("failed to parse %s date: %s", name, e.getMessage()));
      return null;
    }
  }
}
