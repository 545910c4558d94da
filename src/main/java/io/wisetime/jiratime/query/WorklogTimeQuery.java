/*
 * Copyright (c) 2018 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.jiratime.query;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.wisetime.jiratime.api.JiraApi;
import io.wisetime.jiratime.config.Workers;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Totals the time a user logged within a window across all of their issues.
 *
 * <p>One discoverer feeds issue ids through a bounded work queue to a fixed pool of worklog fetchers. Fetchers put
 * per issue totals on a result queue that the calling thread sums. A coordinating task closes the result queue once
 * every fetcher has finished.
 *
 * <p>The first failure in any task cancels the whole run: both queues are closed, the remaining tasks are interrupted
 * and the failure is rethrown to the caller as a {@link WorklogQueryException}.
 *
 * @author jiratime
 */
public class WorklogTimeQuery {

  private static final Logger log = LoggerFactory.getLogger(WorklogTimeQuery.class);

  @VisibleForTesting
  static final int WORK_QUEUE_CAPACITY = 50;

  private final JiraApi jiraApi;
  private final int workers;

  @Inject
  public WorklogTimeQuery(final JiraApi jiraApi, @Workers final int workers) {
    Preconditions.checkArgument(workers > 0, "At least one worker is required");
    this.jiraApi = jiraApi;
    this.workers = workers;
  }

  /**
   * Blocks until every issue has been scanned.
   *
   * @param accountId the user whose worklogs are totalled
   * @param window only worklogs starting within this window count
   * @param callerZone time zone of the authenticated user, which Jira uses to evaluate dates in searches
   * @throws WorklogQueryException if any Jira call fails or the calling thread is interrupted
   */
  public AggregateResult totalSeconds(final String accountId, final TimeWindow window, final ZoneId callerZone) {
    final ClosableQueue<String> workQueue = new ClosableQueue<>(WORK_QUEUE_CAPACITY);
    // One slot per fetcher so a fetcher never waits on the aggregator under normal throughput
    final ClosableQueue<IssueTotal> results = new ClosableQueue<>(workers);
    final CompletionBarrier barrier = new CompletionBarrier(workers);
    final WorklogMatcher matcher = new WorklogMatcher(accountId, window);
    final ExecutorService executor = Executors.newFixedThreadPool(workers + 2, new ThreadFactoryBuilder()
        .setNameFormat("jiratime-%d")
        .setDaemon(true)
        .build());
    final Cancellation cancellation = new Cancellation(workQueue, results, executor);

    try {
      final List<Future<Void>> tasks = new ArrayList<>();
      tasks.add(executor.submit(cancellation.guard("issue discovery",
          new IssueDiscoverer(jiraApi, accountId, window, callerZone, workQueue))));
      for (int i = 0; i < workers; i++) {
        tasks.add(executor.submit(cancellation.guard("worklog fetcher " + i,
            new WorklogFetcher(jiraApi, matcher, workQueue, results, barrier))));
      }
      executor.submit(cancellation.guard("completion barrier", () -> {
        barrier.await();
        results.close();
        return null;
      }));

      final long totalSeconds = Aggregator.sum(results);

      if (!cancellation.hasFailed()) {
        // Every task has closed its queue by now, but may still be recording how it finished
        for (Future<Void> task : tasks) {
          task.get();
        }
      }
      final Throwable failure = cancellation.failure();
      if (failure != null) {
        throw new WorklogQueryException("Failed to total worklogs: " + failure.getMessage(), failure);
      }

      log.info("Total of {} seconds logged by {} within {}", totalSeconds, accountId, window);
      return new AggregateResult(totalSeconds, window);

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WorklogQueryException("Interrupted while totalling worklogs", e);
    } catch (ExecutionException e) {
      throw new WorklogQueryException("Failed to total worklogs: " + e.getCause().getMessage(), e.getCause());
    } finally {
      cancellation.cancel();
    }
  }

  /**
   * Records the first failure of any task and stops the rest.
   */
  private static class Cancellation {

    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final ClosableQueue<String> workQueue;
    private final ClosableQueue<IssueTotal> results;
    private final ExecutorService executor;

    Cancellation(final ClosableQueue<String> workQueue,
                 final ClosableQueue<IssueTotal> results,
                 final ExecutorService executor) {
      this.workQueue = workQueue;
      this.results = results;
      this.executor = executor;
    }

    Callable<Void> guard(final String taskName, final Callable<Void> task) {
      return () -> {
        try {
          return task.call();
        } catch (Exception e) {
          fail(taskName, e);
          return null;
        }
      };
    }

    void fail(final String taskName, final Exception e) {
      if (failure.compareAndSet(null, e)) {
        log.error("Worklog query failed in {}, cancelling remaining tasks", taskName, e);
        // Wakes the aggregator, which interrupts the remaining tasks on its way out
        closeQueues();
      } else {
        log.debug("{} stopped after cancellation: {}", taskName, e.toString());
      }
    }

    boolean hasFailed() {
      return failure.get() != null;
    }

    Throwable failure() {
      return failure.get();
    }

    void closeQueues() {
      workQueue.close();
      results.close();
    }

    void cancel() {
      closeQueues();
      executor.shutdownNow();
    }
  }
}
