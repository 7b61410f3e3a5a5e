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
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongConsumer;
import org.junit.After;
import org.junit.Test;
import ratekeeper.AlgorithmVariant;
import ratekeeper.InMemorySamplingMetrics;
import ratekeeper.RatekeeperConfig;
import ratekeeper.Tenant;
import ratekeeper.TenantNotFoundException;
import ratekeeper.TransientIOException;

import static org.assertj.core.api.Assertions.assertThat;

public class CycleDispatcherTest {
  FakeVolumeSource volumes = new FakeVolumeSource();
  FakeTenantSettings settings = new FakeTenantSettings();
  InMemorySamplingMetrics metrics = new InMemorySamplingMetrics();
  InMemorySamplingMetrics variantMetrics =
      metrics.forVariant(AlgorithmVariant.SLIDING_WINDOW_PER_ORG);
  RatekeeperConfig.Builder config = RatekeeperConfig.newBuilder()
      .retryBackoff(Duration.ofMillis(1))
      .pageSize(10);
  Ticker ticker = Ticker.systemTicker();

  CycleDispatcher dispatcher;

  @After public void close() {
    if (dispatcher != null) dispatcher.close();
  }

  @Test public void pagesThroughAllOrganizations() {
    activate(25);
    RecordingTask task = new RecordingTask(orgId -> {
    });

    CycleResult result = dispatcher().run(task);

    assertThat(task.processed).hasSize(25);
    assertThat(result.processed()).isEqualTo(25);
    assertThat(result.complete()).isTrue();
    assertThat(volumes.pagesRequested.get()).isEqualTo(4); // 10, 10, 5, then empty
    assertThat(task.afterCycle).containsExactly(result);
    assertThat(variantMetrics.tenantsProcessed()).isEqualTo(25);
  }

  @Test public void noOrganizations() {
    CycleResult result = dispatcher().run(new RecordingTask(orgId -> {
    }));

    assertThat(result.processed()).isZero();
    assertThat(result.complete()).isTrue();
  }

  @Test public void failureOfOneOrgDoesntAffectOthers() {
    activate(5);
    RecordingTask task = new RecordingTask(orgId -> {
      if (orgId == 3) throw new IllegalStateException("bug");
    });

    CycleResult result = dispatcher().run(task);

    assertThat(result.processed()).isEqualTo(4);
    assertThat(result.failed()).isEqualTo(1);
    assertThat(result.complete()).isFalse();
    assertThat(variantMetrics.tenantsFailed()).isOne();
  }

  @Test public void deletedOrgIsSkipped() {
    activate(3);
    RecordingTask task = new RecordingTask(orgId -> {
      if (orgId == 2) throw new TenantNotFoundException(Tenant.organization(orgId));
    });

    CycleResult result = dispatcher().run(task);

    assertThat(result.skipped()).isEqualTo(1);
    assertThat(result.failed()).isZero();
    assertThat(result.complete()).isTrue();
  }

  @Test public void disabledOrgIsSkippedWithoutProcessing() {
    activate(3);
    settings.disable(2L);
    RecordingTask task = new RecordingTask(orgId -> {
    });

    CycleResult result = dispatcher().run(task);

    assertThat(task.processed).containsExactlyInAnyOrder(1L, 3L);
    assertThat(result.processed()).isEqualTo(2);
    assertThat(result.skipped()).isEqualTo(1);
    assertThat(variantMetrics.tenantsSkipped()).isEqualTo(1);
  }

  @Test public void retriesTransientFailures() {
    activate(1);
    AtomicLong attempts = new AtomicLong();
    RecordingTask task = new RecordingTask(orgId -> {
      if (attempts.incrementAndGet() < 3) throw new TransientIOException("timeout");
    });

    CycleResult result = dispatcher().run(task);

    assertThat(result.processed()).isEqualTo(1);
    assertThat(attempts.get()).isEqualTo(3);
    assertThat(variantMetrics.retries()).isEqualTo(2);
  }

  @Test public void givesUpAfterMaxRetries() {
    activate(1);
    config.maxRetries(2);
    AtomicLong attempts = new AtomicLong();
    RecordingTask task = new RecordingTask(orgId -> {
      attempts.incrementAndGet();
      throw new TransientIOException("timeout");
    });

    CycleResult result = dispatcher().run(task);

    assertThat(result.failed()).isEqualTo(1);
    assertThat(attempts.get()).isEqualTo(3);
    assertThat(variantMetrics.retries()).isEqualTo(2);
  }

  @Test public void permanentFailuresArentRetried() {
    activate(1);
    AtomicLong attempts = new AtomicLong();
    RecordingTask task = new RecordingTask(orgId -> {
      attempts.incrementAndGet();
      throw new IllegalArgumentException("bad data");
    });

    dispatcher().run(task);

    assertThat(attempts.get()).isOne();
    assertThat(variantMetrics.retries()).isZero();
  }

  /** Each org takes a minute of fake time, so the third page starts at the soft deadline. */
  @Test public void softDeadlineDefersRemainingPages() {
    activate(40);
    AtomicLong nanos = new AtomicLong();
    ticker = new Ticker() {
      @Override public long read() {
        return nanos.get();
      }
    };
    config.softDeadline(Duration.ofMinutes(20))
        .cycleDeadline(Duration.ofHours(1))
        .concurrency(1);
    RecordingTask task = new RecordingTask(orgId -> nanos.addAndGet(TimeUnit.MINUTES.toNanos(1)));

    CycleResult result = dispatcher().run(task);

    assertThat(result.processed()).isEqualTo(30);
    assertThat(result.deferred()).isEqualTo(10);
    assertThat(result.complete()).isFalse();
    assertThat(variantMetrics.tenantsDeferred()).isEqualTo(10);
  }

  @Test public void unitDeadlineInterruptsSlowOrg() {
    activate(3);
    config.unitDeadline(Duration.ofMillis(100));
    CountDownLatch never = new CountDownLatch(1);
    RecordingTask task = new RecordingTask(orgId -> {
      if (orgId != 2) return;
      try {
        never.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("interrupted", e);
      }
    });

    CycleResult result = dispatcher().run(task);

    assertThat(result.processed()).isEqualTo(2);
    assertThat(result.failed()).isEqualTo(1);
  }

  @Test public void lateDeadlineDoesntInterruptFinishedUnit() {
    CycleDispatcher.UnitDeadline deadline =
        new CycleDispatcher.UnitDeadline(Thread.currentThread());

    deadline.finish();
    deadline.expire();

    assertThat(deadline.expired()).isFalse();
    assertThat(Thread.currentThread().isInterrupted()).isFalse();
  }

  @Test public void expiredUnitClearsItsInterrupt() {
    CycleDispatcher.UnitDeadline deadline =
        new CycleDispatcher.UnitDeadline(Thread.currentThread());

    deadline.expire();
    assertThat(deadline.expired()).isTrue();
    deadline.finish();

    assertThat(Thread.currentThread().isInterrupted()).isFalse();
  }

  @Test public void expiredUnitDoesntInterruptNextOrg() {
    activate(2);
    config.unitDeadline(Duration.ofMillis(50)).concurrency(1);
    Set<Long> interrupted = ConcurrentHashMap.newKeySet();
    RecordingTask task = new RecordingTask(orgId -> {
      if (orgId == 1) {
        long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(150);
        while (System.nanoTime() < until) {
          // ignores the interrupt, like a blocking call that doesn't check it
        }
      } else if (Thread.currentThread().isInterrupted()) {
        interrupted.add(orgId);
      }
    });

    CycleResult result = dispatcher().run(task);

    assertThat(result.failed()).isEqualTo(1);
    assertThat(result.processed()).isEqualTo(1);
    assertThat(interrupted).isEmpty();
  }

  @Test public void cycleDeadlineCancelsOutstandingOrgs() {
    activate(3);
    config.softDeadline(Duration.ofMillis(100)).cycleDeadline(Duration.ofMillis(300));
    CountDownLatch never = new CountDownLatch(1);
    RecordingTask task = new RecordingTask(orgId -> {
      if (orgId != 1) return;
      try {
        never.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("interrupted", e);
      }
    });

    CycleResult result = dispatcher().run(task);

    assertThat(result.failed()).isGreaterThanOrEqualTo(1);
    assertThat(result.complete()).isFalse();
  }

  @Test public void failureToListOrganizationsEndsCycle() {
    activate(3);
    volumes.failListing(10);
    config.maxRetries(1);
    RecordingTask task = new RecordingTask(orgId -> {
    });

    CycleResult result = dispatcher().run(task);

    assertThat(result.complete()).isFalse();
    assertThat(task.processed).isEmpty();
    assertThat(volumes.pagesRequested.get()).isEqualTo(2);
  }

  @Test public void retriesListingOrganizations() {
    activate(3);
    volumes.failListing(1);

    CycleResult result = dispatcher().run(new RecordingTask(orgId -> {
    }));

    assertThat(result.processed()).isEqualTo(3);
    assertThat(result.complete()).isTrue();
  }

  void activate(int count) {
    for (long orgId = 1; orgId <= count; orgId++) volumes.org(orgId, 100);
  }

  CycleDispatcher dispatcher() {
    return dispatcher = new CycleDispatcher(volumes, settings, config.build(), ticker);
  }

  final class RecordingTask extends OrgTask {
    final LongConsumer process;
    final Set<Long> processed = ConcurrentHashMap.newKeySet();
    final List<CycleResult> afterCycle = new CopyOnWriteArrayList<>();

    RecordingTask(LongConsumer process) {
      super(AlgorithmVariant.SLIDING_WINDOW_PER_ORG, CycleDispatcherTest.this.metrics);
      this.process = process;
    }

    @Override int activityWindowHours() {
      return 24;
    }

    @Override void process(long orgId) {
      process.accept(orgId);
      processed.add(orgId);
    }

    @Override void afterCycle(CycleResult result) {
      afterCycle.add(result);
    }
  }
}
