/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.api;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.Gson;
import io.wisetime.jiratime.config.JiraTimeConfig;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.net.URIBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jira Cloud REST API v3 client using basic authentication with an API token.
 *
 * @author jiratime
 */
public class JiraRestClient implements JiraApi, Closeable {

  private static final Logger log = LoggerFactory.getLogger(JiraRestClient.class);
  private static final Timeout TIMEOUT = Timeout.ofSeconds(10);

  private final String apiBaseUrl;
  private final String authHeader;
  private final CloseableHttpClient httpClient;
  private final JiraResponseParser parser;

  public JiraRestClient(final JiraTimeConfig config, final Gson gson) {
    // One connection per worker plus one for issue discovery
    this(config, gson, buildHttpClient(config.getWorkers() + 1));
  }

  @VisibleForTesting
  JiraRestClient(final JiraTimeConfig config, final Gson gson, final CloseableHttpClient httpClient) {
    this.apiBaseUrl = config.getApiBaseUrl();
    this.authHeader = basicAuth(config.getUsername(), config.getUserKey());
    this.httpClient = httpClient;
    this.parser = new JiraResponseParser(gson);
  }

  @Override
  public JiraUser myself() throws IOException {
    return parser.parseUser(get(toUri(endpoint("myself"))));
  }

  @Override
  public List<JiraUser> findUsers(final String query) throws IOException {
    return parser.parseUsers(get(toUri(endpoint("user", "search").addParameter("query", query))));
  }

  @Override
  public Page<IssueRef> searchIssues(final String jql, final int startAt, final int maxResults) throws IOException {
    return parser.parseIssuePage(get(searchUri(jql, startAt, maxResults)));
  }

  @Override
  public Page<Worklog> issueWorklogs(final String issueId, final int startAt, final int maxResults) throws IOException {
    return parser.parseWorklogPage(get(worklogUri(issueId, startAt, maxResults)));
  }

  @Override
  public void close() throws IOException {
    httpClient.close();
  }

  @VisibleForTesting
  URI searchUri(final String jql, final int startAt, final int maxResults) throws JiraApiException {
    // Worklogs are not returned by search, so only the issue id is requested
    return toUri(endpoint("search")
        .addParameter("jql", jql)
        .addParameter("fields", "id")
        .addParameter("startAt", String.valueOf(startAt))
        .addParameter("maxResults", String.valueOf(maxResults)));
  }

  @VisibleForTesting
  URI worklogUri(final String issueId, final int startAt, final int maxResults) throws JiraApiException {
    return toUri(endpoint("issue", issueId, "worklog")
        .addParameter("startAt", String.valueOf(startAt))
        .addParameter("maxResults", String.valueOf(maxResults)));
  }

  private URIBuilder endpoint(final String... pathSegments) throws JiraApiException {
    try {
      return new URIBuilder(apiBaseUrl).appendPathSegments(pathSegments);
    } catch (URISyntaxException e) {
      throw new JiraApiException("Invalid Jira base URL: " + apiBaseUrl, e);
    }
  }

  private static URI toUri(final URIBuilder builder) throws JiraApiException {
    try {
      return builder.build();
    } catch (URISyntaxException e) {
      throw new JiraApiException("Invalid Jira request URI: " + e.getMessage(), e);
    }
  }

  private String get(final URI uri) throws IOException {
    final HttpGet request = new HttpGet(uri);
    request.setHeader(HttpHeaders.AUTHORIZATION, authHeader);
    request.setHeader(HttpHeaders.ACCEPT, "application/json");

    log.debug("GET {}", uri);
    return httpClient.execute(request, response -> {
      final String body = response.getEntity() == null
          ? ""
          : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
      if (response.getCode() < 200 || response.getCode() >= 300) {
        throw new JiraApiException(String.format("GET %s failed with status %d: %s",
            uri.getPath(), response.getCode(), StringUtils.abbreviate(body, 200)), response.getCode());
      }
      return body;
    });
  }

  private static CloseableHttpClient buildHttpClient(final int maxConnections) {
    return HttpClients.custom()
        .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
            .setMaxConnTotal(maxConnections)
            .setMaxConnPerRoute(maxConnections)
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(TIMEOUT)
                .setSocketTimeout(TIMEOUT)
                .build())
            .build())
        .setDefaultRequestConfig(RequestConfig.custom()
            .setConnectionRequestTimeout(TIMEOUT)
            .setResponseTimeout(TIMEOUT)
            .build())
        .build();
  }

  private static String basicAuth(final String username, final String userKey) {
    final String auth = username + ":" + userKey;
    return "Basic " + Base64.getEncoder().encodeToString(auth.getBytes(StandardCharsets.ISO_8859_1));
  }
}
