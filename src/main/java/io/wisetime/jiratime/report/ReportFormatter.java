/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.report;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.StringWriter;
import javax.inject.Inject;
import org.apache.commons.lang3.StringUtils;

/**
 * Renders a {@link WorklogReport} in one of the {@link OutputFormat}s.
 *
 * @author jiratime
 */
public class ReportFormatter {

  private final Gson gson;

  @Inject
  public ReportFormatter(final Gson gson) {
    this.gson = gson;
  }

  public String format(final WorklogReport report, final OutputFormat format) {
    switch (format) {
      case TEXT:
        return text(report);
      case JSON:
        return gson.toJson(report);
      case INDENT:
        return indentedJson(report);
      case CSV:
        return csv(report);
      default:
        throw new IllegalArgumentException("Unrecognised output format: " + format);
    }
  }

  private static String text(final WorklogReport report) {
    return String.format("%-25s%8s%8s%n%10s - %10s: %8d%8d",
        StringUtils.defaultString(report.getUser().getDisplayName()), "Hours", "Minutes",
        StringUtils.defaultString(report.getStart()), StringUtils.defaultString(report.getEnd()),
        report.getHours(), report.getMinutes());
  }

  private static String csv(final WorklogReport report) {
    return String.format("%s,%s,%s,%s,%s,%d,%d,%d",
        StringUtils.defaultString(report.getUser().getDisplayName()),
        StringUtils.defaultString(report.getUser().getEmailAddress()),
        StringUtils.defaultString(report.getStart()),
        StringUtils.defaultString(report.getEnd()),
        StringUtils.defaultString(report.getUser().getTimeZone()),
        report.getHours(), report.getMinutes(), report.getTotalSeconds());
  }

  private String indentedJson(final WorklogReport report) {
    final StringWriter out = new StringWriter();
    try (JsonWriter writer = gson.newJsonWriter(out)) {
      writer.setIndent("    ");
      gson.toJson(report, WorklogReport.class, writer);
    } catch (IOException e) {
      throw new JsonIOException(e);
    }
    return out.toString();
  }
}
