/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.query;

import com.google.common.base.Preconditions;
import io.wisetime.jiratime.api.JiraApiException;
import io.wisetime.jiratime.api.Page;
import java.io.IOException;
import java.util.List;

/**
 * Drives an offset paginated Jira query from offset zero until the server reports that the last page has been
 * returned.
 *
 * <p>The server may clamp the requested page size, so the page size used to advance the offset and to detect the
 * last page is always the one the server reports, never the one requested. An empty result may report a page size
 * of zero.
 *
 * @author jiratime
 */
public class Pager<T> {

  public static final int DEFAULT_PAGE_SIZE = 100;

  private final PageFetcher<T> fetcher;
  private final int pageSize;

  public Pager(final PageFetcher<T> fetcher) {
    this(fetcher, DEFAULT_PAGE_SIZE);
  }

  public Pager(final PageFetcher<T> fetcher, final int pageSize) {
    Preconditions.checkArgument(pageSize > 0, "Page size must be positive");
    this.fetcher = fetcher;
    this.pageSize = pageSize;
  }

  /**
   * Hands the items of every page to the consumer in page order. Fetch failures are not retried.
   *
   * @throws InterruptedException if the calling thread is interrupted between pages
   */
  public void forEachPage(final PageConsumer<T> consumer) throws IOException, InterruptedException {
    int startAt = 0;
    while (true) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("Paging interrupted at offset " + startAt);
      }

      final Page<T> page = fetcher.fetch(startAt, pageSize);
      consumer.accept(page.getItems());

      if (page.getStartAt() >= page.getTotal()
          || page.getTotal() - page.getStartAt() < page.getMaxResults()) {
        return;
      }
      // Items remain, so the offset has to advance
      if (page.getMaxResults() <= 0) {
        throw new JiraApiException(String.format(
            "Server reported page size %d at offset %d of %d", page.getMaxResults(), page.getStartAt(),
            page.getTotal()), -1);
      }
      startAt = page.getStartAt() + page.getMaxResults();
    }
  }

  /**
   * Fetches one page starting at an offset.
   */
  @FunctionalInterface
  public interface PageFetcher<T> {
    Page<T> fetch(int startAt, int maxResults) throws IOException;
  }

  @FunctionalInterface
  public interface PageConsumer<T> {
    void accept(List<T> items) throws InterruptedException;
  }
}
