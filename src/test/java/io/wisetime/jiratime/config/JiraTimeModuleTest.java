/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import io.wisetime.jiratime.JiraTimeReporter;
import io.wisetime.jiratime.api.JiraApi;
import io.wisetime.jiratime.api.JiraRestClient;
import io.wisetime.jiratime.query.WorklogTimeQuery;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class JiraTimeModuleTest {

  private static Injector injector;

  @BeforeAll
  static void setUp() {
    injector = Guice.createInjector(new JiraTimeModule(JiraTimeConfig.builder()
        .apiBaseUrl("https://example.atlassian.net/rest/api/3")
        .username("mia@example.com")
        .userKey("api-token")
        .workers(7)
        .build()));
  }

  @AfterAll
  static void tearDown() throws Exception {
    injector.getInstance(JiraRestClient.class).close();
  }

  @Test
  void jira_client_is_shared() {
    assertThat(injector.getInstance(JiraApi.class))
        .as("the same client serves every Jira call and is closed once")
        .isSameAs(injector.getInstance(JiraRestClient.class));
  }

  @Test
  void worker_count_is_bound() {
    assertThat(injector.getInstance(Key.get(Integer.class, Workers.class))).isEqualTo(7);
    assertThat(injector.getInstance(WorklogTimeQuery.class)).isNotNull();
    assertThat(injector.getInstance(JiraTimeReporter.class)).isNotNull();
  }
}
