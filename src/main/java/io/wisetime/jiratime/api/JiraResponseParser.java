/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.api;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Objects;
import lombok.Data;

/**
 * Decodes Jira REST response bodies.
 *
 * @author jiratime
 */
class JiraResponseParser {

  private static final Type USER_LIST = new TypeToken<List<JiraUser>>() {}.getType();

  private final Gson gson;

  JiraResponseParser(final Gson gson) {
    this.gson = gson;
  }

  JiraUser parseUser(final String body) throws JiraApiException {
    return decode(body, JiraUser.class);
  }

  List<JiraUser> parseUsers(final String body) throws JiraApiException {
    final List<JiraUser> users = decode(body, USER_LIST);
    return nullToEmpty(users);
  }

  Page<IssueRef> parseIssuePage(final String body) throws JiraApiException {
    final SearchResponse response = decode(body, SearchResponse.class);
    requirePaging("search", response.getTotal(), response.getStartAt(), response.getMaxResults());
    return new Page<>(nullToEmpty(response.getIssues()),
        response.getTotal(), response.getStartAt(), response.getMaxResults());
  }

  Page<Worklog> parseWorklogPage(final String body) throws JiraApiException {
    final WorklogResponse response = decode(body, WorklogResponse.class);
    requirePaging("worklog", response.getTotal(), response.getStartAt(), response.getMaxResults());
    return new Page<>(nullToEmpty(response.getWorklogs()),
        response.getTotal(), response.getStartAt(), response.getMaxResults());
  }

  private <T> T decode(final String body, final Type type) throws JiraApiException {
    final T decoded;
    try {
      decoded = gson.fromJson(body, type);
    } catch (JsonParseException e) {
      throw new JiraApiException("Failed to decode response body: " + e.getMessage(), e);
    }
    if (decoded == null) {
      throw new JiraApiException("Failed to decode response body: body was empty", -1);
    }
    return decoded;
  }

  /**
   * Fails unless the page carries all of its counts.
   */
  private static void requirePaging(final String responseName,
                                    final Integer total,
                                    final Integer startAt,
                                    final Integer maxResults) throws JiraApiException {
    if (total == null || startAt == null || maxResults == null) {
      throw new JiraApiException(String.format(
          "Failed to decode response body: %s page is missing total, startAt or maxResults "
              + "(total=%s, startAt=%s, maxResults=%s)", responseName, total, startAt, maxResults), -1);
    }
  }

  private static <T> List<T> nullToEmpty(final List<T> items) {
    // Gson leaves absent arrays null and may include null elements for "[null]"
    return items == null
        ? ImmutableList.of()
        : items.stream().filter(Objects::nonNull).collect(ImmutableList.toImmutableList());
  }

  @Data
  private static class SearchResponse {
    private Integer startAt;
    private Integer maxResults;
    private Integer total;
    private List<IssueRef> issues;
  }

  @Data
  private static class WorklogResponse {
    private Integer startAt;
    private Integer maxResults;
    private Integer total;
    private List<Worklog> worklogs;
  }
}
