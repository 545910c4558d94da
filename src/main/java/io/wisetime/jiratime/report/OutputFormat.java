/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.report;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Output formats selectable with --format.
 *
 * @author jiratime
 */
public enum OutputFormat {

  TEXT("text"),
  JSON("json"),
  INDENT("indent"),
  CSV("csv");

  private final String formatName;

  OutputFormat(final String formatName) {
    this.formatName = formatName;
  }

  public String getFormatName() {
    return formatName;
  }

  public static Optional<OutputFormat> fromName(final String name) {
    return Arrays.stream(values())
        .filter(format -> format.formatName.equals(name))
        .findFirst();
  }

  public static String names() {
    return Arrays.stream(values()).map(OutputFormat::getFormatName).collect(Collectors.joining("|"));
  }
}
