/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.api;

import java.util.List;
import lombok.Value;

/**
 * One page of an offset paginated Jira query, with the paging values as reported by the server.
 *
 * @author jiratime
 */
@Value
public class Page<T> {

  List<T> items;
  int total;
  int startAt;
  int maxResults;
}
