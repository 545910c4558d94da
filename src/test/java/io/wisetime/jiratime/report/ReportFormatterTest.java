/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

class ReportFormatterTest {

  private final ReportFormatter formatter = new ReportFormatter(new GsonBuilder().disableHtmlEscaping().create());

  @Test
  void format_text() {
    assertThat(formatter.format(report(), OutputFormat.TEXT))
        .isEqualTo(String.format("Mia Krystof                 Hours Minutes%n2024-01-01 - 2024-01-02:        1      30"));
  }

  @Test
  void format_csv() {
    assertThat(formatter.format(report(), OutputFormat.CSV))
        .isEqualTo("Mia Krystof,mia@example.com,2024-01-01,2024-01-02,Australia/Perth,1,30,5430");
  }

  @Test
  void format_csv_open_window() {
    final WorklogReport report = report().setStart(null).setEnd(null);

    assertThat(formatter.format(report, OutputFormat.CSV))
        .isEqualTo("Mia Krystof,mia@example.com,,,Australia/Perth,1,30,5430");
  }

  @Test
  void format_json() {
    final String json = formatter.format(report(), OutputFormat.JSON);

    assertThat(json).doesNotContain("\n");
    final JsonObject parsed = JsonParser.parseString(json).getAsJsonObject();
    assertThat(parsed.getAsJsonObject("user").get("displayName").getAsString()).isEqualTo("Mia Krystof");
    assertThat(parsed.get("start").getAsString()).isEqualTo("2024-01-01");
    assertThat(parsed.get("end").getAsString()).isEqualTo("2024-01-02");
    assertThat(parsed.get("hours").getAsLong()).isEqualTo(1);
    assertThat(parsed.get("minutes").getAsLong()).isEqualTo(30);
    assertThat(parsed.get("seconds").getAsLong()).isEqualTo(30);
    assertThat(parsed.get("totalSeconds").getAsLong()).isEqualTo(5430);
  }

  @Test
  void format_indent() {
    final String json = formatter.format(report(), OutputFormat.INDENT);

    assertThat(json)
        .startsWith("{\n    \"user\": {\n        \"emailAddress\": \"mia@example.com\"")
        .contains("\n    \"totalSeconds\": 5430\n}");
    assertThat(new Gson().fromJson(json, WorklogReport.class)).isEqualTo(report());
  }

  @Test
  void fromName() {
    assertThat(OutputFormat.fromName("indent")).contains(OutputFormat.INDENT);
    assertThat(OutputFormat.fromName("xml")).isEmpty();
    assertThat(OutputFormat.names()).isEqualTo("text|json|indent|csv");
  }

  private static WorklogReport report() {
    return new WorklogReport()
        .setUser(new WorklogReport.ReportUser()
            .setDisplayName("Mia Krystof")
            .setEmailAddress("mia@example.com")
            .setTimeZone("Australia/Perth"))
        .setStart("2024-01-01")
        .setEnd("2024-01-02")
        .setHours(1)
        .setMinutes(30)
        .setSeconds(30)
        .setTotalSeconds(5430);
  }
}
