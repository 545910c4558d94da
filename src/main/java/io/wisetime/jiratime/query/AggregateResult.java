/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.query;

import lombok.Value;

/**
 * Total seconds logged by the target user within the window.
 *
 * @author jiratime
 */
@Value
public class AggregateResult {

  long totalSeconds;
  TimeWindow window;
}
