/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.config;

import com.google.inject.BindingAnnotation;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;

/**
 * Number of concurrent worklog fetchers.
 *
 * @author jiratime
 */
@Retention(RetentionPolicy.RUNTIME)
@BindingAnnotation
public @interface Workers {
}
