/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.query;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Half open interval of instants, [start, end). Either bound may be absent, in which case the window is unbounded on
 * that side.
 *
 * @author jiratime
 */
@EqualsAndHashCode
@ToString
public final class TimeWindow {

  private static final TimeWindow OPEN = new TimeWindow(null, null);

  private final Instant start;
  private final Instant end;

  private TimeWindow(final Instant start, final Instant end) {
    this.start = start;
    this.end = end;
  }

  public static TimeWindow open() {
    return OPEN;
  }

  /**
   * @param start inclusive lower bound, or null for no lower bound
   * @param end exclusive upper bound, or null for no upper bound
   */
  public static TimeWindow between(final Instant start, final Instant end) {
    return new TimeWindow(start, end);
  }

  /**
   * Window covering whole calendar days in a zone. The end date is inclusive: the window ends at the start of the
   * following day.
   */
  public static TimeWindow ofDates(final LocalDate startDate, final LocalDate endDateInclusive, final ZoneId zone) {
    return new TimeWindow(
        startDate == null ? null : startDate.atStartOfDay(zone).toInstant(),
        endDateInclusive == null ? null : endDateInclusive.plusDays(1).atStartOfDay(zone).toInstant()
    );
  }

  public Optional<Instant> getStart() {
    return Optional.ofNullable(start);
  }

  /**
   * Exclusive upper bound.
   */
  public Optional<Instant> getEnd() {
    return Optional.ofNullable(end);
  }

  public boolean contains(final Instant instant) {
    return (start == null || !instant.isBefore(start))
        && (end == null || instant.isBefore(end));
  }
}
