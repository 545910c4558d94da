/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.gson.Gson;
import io.wisetime.jiratime.config.JiraTimeConfig;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.io.HttpClientResponseHandler;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.http.message.BasicClassicHttpResponse;
import org.apache.hc.core5.net.URIBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;

class JiraRestClientTest {

  private static final JiraTimeConfig CONFIG = JiraTimeConfig.builder()
      .apiBaseUrl("https://example.atlassian.net/rest/api/3")
      .username("mia@example.com")
      .userKey("api-token")
      .workers(4)
      .build();

  private final CloseableHttpClient httpClient = mock(CloseableHttpClient.class);
  private final List<ClassicHttpRequest> requests = new ArrayList<>();
  private JiraRestClient client;

  @BeforeEach
  void setUp() {
    client = new JiraRestClient(CONFIG, new Gson(), httpClient);
  }

  @Test
  void searchUri_requests_ids_only() throws Exception {
    final URI uri = client.searchUri("worklogAuthor = \"abc\" AND worklogDate >= \"2023-12-31\"", 200, 100);

    assertThat(uri.getHost()).isEqualTo("example.atlassian.net");
    assertThat(uri.getPath()).isEqualTo("/rest/api/3/search");
    assertThat(queryParams(uri))
        .containsEntry("jql", "worklogAuthor = \"abc\" AND worklogDate >= \"2023-12-31\"")
        .containsEntry("fields", "id")
        .containsEntry("startAt", "200")
        .containsEntry("maxResults", "100");
  }

  @Test
  void worklogUri() throws Exception {
    final URI uri = client.worklogUri("10001", 0, 100);

    assertThat(uri.getPath()).isEqualTo("/rest/api/3/issue/10001/worklog");
    assertThat(queryParams(uri))
        .containsEntry("startAt", "0")
        .containsEntry("maxResults", "100");
  }

  @Test
  void myself_sends_basic_auth() throws Exception {
    respondWith(200, "{\"accountId\":\"abc\",\"timeZone\":\"Australia/Perth\"}");

    final JiraUser user = client.myself();

    assertThat(user.getAccountId()).isEqualTo("abc");
    final ClassicHttpRequest request = requests.get(0);
    assertThat(request.getUri().getPath()).isEqualTo("/rest/api/3/myself");
    assertThat(request.getFirstHeader("Authorization").getValue())
        .isEqualTo("Basic " + Base64.getEncoder()
            .encodeToString("mia@example.com:api-token".getBytes(StandardCharsets.ISO_8859_1)));
    assertThat(request.getFirstHeader("Accept").getValue()).isEqualTo("application/json");
  }

  @Test
  void findUsers_passes_query() throws Exception {
    respondWith(200, "[{\"accountId\":\"abc\",\"emailAddress\":\"mia@example.com\"}]");

    assertThat(client.findUsers("mia@example.com")).extracting(JiraUser::getAccountId).containsExactly("abc");
    assertThat(requests.get(0).getUri().getPath()).isEqualTo("/rest/api/3/user/search");
    assertThat(queryParams(requests.get(0).getUri())).containsEntry("query", "mia@example.com");
  }

  @Test
  void issueWorklogs_decodes_page() throws Exception {
    respondWith(200, "{\"startAt\":0,\"maxResults\":20,\"total\":1,\"worklogs\":[{\"author\":{\"accountId\":\"abc\"},"
        + "\"started\":\"2024-01-01T09:00:00.000+0000\",\"timeSpentSeconds\":3600}]}");

    final Page<Worklog> page = client.issueWorklogs("10001", 0, 100);

    assertThat(page.getMaxResults()).isEqualTo(20);
    assertThat(page.getItems()).extracting(Worklog::getTimeSpentSeconds).containsExactly(3600L);
  }

  @Test
  void error_status_fails_with_status_code() throws Exception {
    respondWith(401, "{\"errorMessages\":[\"Unauthorized\"]}");

    assertThatThrownBy(() -> client.searchIssues("worklogAuthor = \"abc\"", 0, 100))
        .isInstanceOfSatisfying(JiraApiException.class, e -> {
          assertThat(e.getStatusCode()).hasValue(401);
          assertThat(e.isAuthenticationFailure()).isTrue();
        })
        .hasMessageStartingWith("GET /rest/api/3/search failed with status 401");
  }

  @Test
  void close_releases_http_client() throws Exception {
    client.close();

    verify(httpClient).close();
  }

  private void respondWith(final int status, final String body) throws Exception {
    when(httpClient.execute(any(ClassicHttpRequest.class), ArgumentMatchers.<HttpClientResponseHandler<String>>any()))
        .thenAnswer(invocation -> {
          requests.add(invocation.getArgument(0));
          final HttpClientResponseHandler<String> handler = invocation.getArgument(1);
          final BasicClassicHttpResponse response = new BasicClassicHttpResponse(status);
          response.setEntity(new StringEntity(body, ContentType.APPLICATION_JSON));
          return handler.handleResponse(response);
        });
  }

  private static Map<String, String> queryParams(final URI uri) {
    return new URIBuilder(uri).getQueryParams().stream()
        .collect(Collectors.toMap(NameValuePair::getName, NameValuePair::getValue, (first, second) -> second));
  }
}
