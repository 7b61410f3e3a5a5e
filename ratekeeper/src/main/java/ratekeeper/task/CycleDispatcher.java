/**
 * Copyright 2015-2017 The OpenZipkin Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package ratekeeper.task;

import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ratekeeper.RatekeeperConfig;
import ratekeeper.TenantNotFoundException;
import ratekeeper.TenantSettings;
import ratekeeper.TransientIOException;
import ratekeeper.VolumeSource;

/**
 * Pages through active organizations and runs one unit of work per organization on a bounded pool.
 * A failing organization never stops the others.
 *
 * <ul>
 *   <li>Organizations without dynamic sampling are skipped before any work is done.</li>
 *   <li>A unit failing with {@link TransientIOException} is retried with exponential backoff.</li>
 *   <li>A unit running past the unit deadline is interrupted and counted failed.</li>
 *   <li>Once the soft deadline passed, no further page is dispatched. Its organizations are
 *   deferred to the next cycle.</li>
 *   <li>Nothing is waited for past the cycle deadline: outstanding units are cancelled.</li>
 * </ul>
 */
final class CycleDispatcher implements Closeable {
  final Logger log = LoggerFactory.getLogger(CycleDispatcher.class);

  enum Outcome {
    PROCESSED, SKIPPED, FAILED
  }

  final VolumeSource volumes;
  final TenantSettings settings;
  final Ticker ticker;
  final int pageSize, maxRetries;
  final long retryBackoffMillis, softDeadlineNanos, unitDeadlineNanos, cycleDeadlineNanos;
  final ExecutorService workers;
  final ScheduledExecutorService watchdog;

  CycleDispatcher(VolumeSource volumes, TenantSettings settings, RatekeeperConfig config,
      Ticker ticker) {
    this.volumes = volumes;
    this.settings = settings;
    this.ticker = ticker;
    this.pageSize = config.pageSize;
    this.maxRetries = config.maxRetries;
    this.retryBackoffMillis = config.retryBackoff.toMillis();
    this.softDeadlineNanos = config.softDeadline.toNanos();
    this.unitDeadlineNanos = config.unitDeadline.toNanos();
    this.cycleDeadlineNanos = config.cycleDeadline.toNanos();
    this.workers = Executors.newFixedThreadPool(config.concurrency,
        new ThreadFactoryBuilder().setNameFormat("ratekeeper-worker-%d").setDaemon(true).build());
    this.watchdog = Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder().setNameFormat("ratekeeper-watchdog-%d").setDaemon(true)
            .build());
  }

  CycleResult run(OrgTask task) {
    long start = ticker.read();
    int processed = 0, skipped = 0, failed = 0, deferred = 0;
    boolean complete = true;
    long afterOrgId = 0L;
    while (true) {
      List<Long> page;
      try {
        page = activeOrgs(task, afterOrgId);
      } catch (RuntimeException e) {
        log.warn("{}: couldn't list organizations after {}", task, afterOrgId, e);
        complete = false;
        break;
      }
      if (page.isEmpty()) break;

      long elapsed = ticker.read() - start;
      if (elapsed > softDeadlineNanos) {
        deferred += page.size();
        task.metrics.incrementTenantsDeferred(page.size());
        log.info("{}: soft deadline passed, deferring organizations after {}", task, afterOrgId);
        complete = false;
        break;
      }

      List<Future<Outcome>> futures = new ArrayList<>(page.size());
      for (Long orgId : page) {
        futures.add(workers.submit(() -> runUnit(task, orgId)));
      }

      boolean timedOut = false;
      for (int i = 0; i < futures.size(); i++) {
        long remaining = timedOut ? 0L : cycleDeadlineNanos - (ticker.read() - start);
        Outcome outcome = await(task, page.get(i), futures.get(i), remaining);
        if (outcome == null) {
          timedOut = true;
          outcome = Outcome.FAILED;
        }
        switch (outcome) {
          case PROCESSED:
            processed++;
            task.metrics.incrementTenantsProcessed();
            break;
          case SKIPPED:
            skipped++;
            task.metrics.incrementTenantsSkipped();
            break;
          default:
            failed++;
            task.metrics.incrementTenantsFailed();
        }
      }
      if (timedOut) {
        log.warn("{}: cycle deadline passed, cancelled outstanding organizations", task);
        complete = false;
        break;
      }
      afterOrgId = page.get(page.size() - 1);
    }

    Duration duration = Duration.ofNanos(ticker.read() - start);
    CycleResult result = new CycleResult(task.variant, processed, skipped, failed, deferred,
        complete && failed == 0, duration);
    log.info("{}", result);
    task.afterCycle(result);
    return result;
  }

  List<Long> activeOrgs(OrgTask task, long afterOrgId) {
    for (int attempt = 0; ; attempt++) {
      try {
        return volumes.activeOrgs(afterOrgId, pageSize, task.activityWindowHours());
      } catch (TransientIOException e) {
        if (attempt >= maxRetries || !backoff(task, attempt, e)) throw e;
      }
    }
  }

  /** Returns null if the unit didn't finish before the cycle deadline, after cancelling it. */
  Outcome await(OrgTask task, long orgId, Future<Outcome> future, long remainingNanos) {
    try {
      if (remainingNanos <= 0 && !future.isDone()) throw new TimeoutException();
      return future.get(Math.max(remainingNanos, 0L), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      return null;
    } catch (CancellationException e) {
      return Outcome.FAILED;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      log.warn("{}: interrupted waiting for org {}", task, orgId);
      return Outcome.FAILED;
    } catch (ExecutionException e) {
      log.warn("{}: org {} failed", task, orgId, e.getCause());
      return Outcome.FAILED;
    }
  }

  Outcome runUnit(OrgTask task, long orgId) {
    UnitDeadline unitDeadline = new UnitDeadline(Thread.currentThread());
    ScheduledFuture<?> deadline =
        watchdog.schedule(unitDeadline::expire, unitDeadlineNanos, TimeUnit.NANOSECONDS);
    try {
      for (int attempt = 0; ; attempt++) {
        try {
          if (!settings.dynamicSamplingEnabled(orgId)) {
            log.debug("{}: dynamic sampling is disabled for org {}", task, orgId);
            return Outcome.SKIPPED;
          }
          task.process(orgId);
          if (unitDeadline.expired()) {
            log.warn("{}: org {} exceeded the unit deadline", task, orgId);
            return Outcome.FAILED;
          }
          return Outcome.PROCESSED;
        } catch (TenantNotFoundException e) {
          log.debug("{}: org {} no longer exists", task, orgId);
          return Outcome.SKIPPED;
        } catch (TransientIOException e) {
          if (unitDeadline.expired() || attempt >= maxRetries) {
            log.warn("{}: org {} failed after {} attempts", task, orgId, attempt + 1, e);
            return Outcome.FAILED;
          }
          if (!backoff(task, attempt, e)) return Outcome.FAILED;
        } catch (RuntimeException e) {
          if (unitDeadline.expired()) {
            log.warn("{}: org {} exceeded the unit deadline", task, orgId, e);
          } else {
            log.warn("{}: org {} failed", task, orgId, e);
          }
          return Outcome.FAILED;
        }
      }
    } finally {
      deadline.cancel(false);
      unitDeadline.finish();
    }
  }

  /**
   * Interrupts a worker that runs past the unit deadline. The interrupt and {@link #finish()} are
   * mutually exclusive, so a watchdog firing late never interrupts the worker's next unit.
   */
  static final class UnitDeadline {
    final Thread worker;
    boolean expired, finished; // guarded by this

    UnitDeadline(Thread worker) {
      this.worker = worker;
    }

    synchronized void expire() {
      if (finished) return;
      expired = true;
      worker.interrupt();
    }

    synchronized boolean expired() {
      return expired;
    }

    /** Called by the worker when the unit ends. Clears the interrupt this deadline delivered. */
    synchronized void finish() {
      finished = true;
      if (expired) Thread.interrupted();
    }
  }

  /** Returns false if interrupted while waiting to retry. */
  boolean backoff(OrgTask task, int attempt, TransientIOException cause) {
    task.metrics.incrementRetries();
    long delay = retryBackoffMillis << Math.min(attempt, 20);
    log.debug("{}: retrying in {}ms after {}", task, delay, cause.getMessage());
    try {
      Thread.sleep(delay);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("{}: interrupted before retrying", task, cause);
      return false;
    }
  }

  @Override public void close() {
    workers.shutdownNow();
    watchdog.shutdownNow();
  }
}
