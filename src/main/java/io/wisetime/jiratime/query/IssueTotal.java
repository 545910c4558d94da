/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.query;

import lombok.Value;

/**
 * Seconds logged on one issue by the target user within the window. Only emitted when non zero.
 *
 * @author jiratime
 */
@Value
public class IssueTotal {

  String issueId;
  long seconds;
}
