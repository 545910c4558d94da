/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.wisetime.jiratime.api.JiraApi;
import io.wisetime.jiratime.api.JiraRestClient;

/**
 * Wire up application dependencies.
 *
 * @author jiratime
 */
public class JiraTimeModule extends AbstractModule {

  private final JiraTimeConfig config;

  public JiraTimeModule(final JiraTimeConfig config) {
    this.config = config;
  }

  @Override
  protected void configure() {
    bind(JiraTimeConfig.class).toInstance(config);

    bind(Integer.class)
        .annotatedWith(Workers.class)
        .toInstance(config.getWorkers());

    bind(Gson.class).toInstance(new GsonBuilder().disableHtmlEscaping().create());

    bind(JiraApi.class).to(JiraRestClient.class);
  }

  @Provides
  @Singleton
  JiraRestClient jiraRestClient(final JiraTimeConfig config, final Gson gson) {
    return new JiraRestClient(config, gson);
  }
}
