/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.api;

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * A Jira Cloud account.
 *
 * @author jiratime
 */
@Data
@Accessors(chain = true)
public class JiraUser {

  private String accountId;
  private String emailAddress;
  private String displayName;
  /**
   * IANA zone id from the user's profile, e.g. Australia/Perth
   */
  private String timeZone;
}
