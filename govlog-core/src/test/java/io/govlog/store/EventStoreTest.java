package io.govlog.store;

import io.govlog.AppendOutcome;
import io.govlog.CandidateEvent;
import io.govlog.CommittedEvent;
import io.govlog.event.WorkspaceCreated;
import io.govlog.projection.GovernanceProjection;
import io.govlog.projection.GovernanceState;
import io.govlog.projection.Projection;
import io.govlog.retry.ExponentialBackoffRetryPolicy;
import io.govlog.spi.EventLog;
import io.govlog.spi.EventLogException;
import io.govlog.spi.MetricsExporter;
import io.govlog.time.ManualTimeSource;
import io.govlog.validation.ViolationKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.govlog.GovernanceFixtures.T0;
import static io.govlog.GovernanceFixtures.delegation;
import static io.govlog.GovernanceFixtures.law;
import static io.govlog.GovernanceFixtures.workspace;
import static org.junit.jupiter.api.Assertions.*;

class EventStoreTest {
  private FlakyEventLog log;
  private RecordingMetricsExporter metrics;
  private ManualTimeSource time;
  private EventStore store;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    log = new FlakyEventLog();
    metrics = new RecordingMetricsExporter();
    time = new ManualTimeSource(T0);
    store = newStore(log);
  }

  @AfterEach
  void tearDown() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  private EventStore newStore(EventLog eventLog) {
    return EventStore.builder()
        .eventLog(eventLog)
        .metrics(metrics)
        .timeSource(time)
        .sleeper(millis -> { })
        .retryPolicy(ExponentialBackoffRetryPolicy.builder().maxAttempts(3).build())
        .readPageSize(4)
        .snapshotInterval(5)
        .build();
  }

  private CommittedEvent commit(CandidateEvent candidate) {
    AppendOutcome outcome = store.append(candidate);
    return assertInstanceOf(AppendOutcome.Committed.class, outcome).event();
  }

  private static List<CommittedEvent> toList(Iterable<CommittedEvent> events) {
    List<CommittedEvent> list = new ArrayList<>();
    events.forEach(list::add);
    return list;
  }

  // ── Commit protocol ──────────────────────────────────────────

  @Test
  void exampleScenario() throws Exception {
    // A: valid, committed at position 0
    CommittedEvent a = commit(CandidateEvent.of(workspace("ws-1")));
    assertEquals(0, a.position());

    // B: references a workspace that does not exist
    AppendOutcome b = store.append(CandidateEvent.of(delegation("d-1", "ws-missing", "alice", "bob")));
    assertEquals(ViolationKind.MISSING_REFERENCE,
        assertInstanceOf(AppendOutcome.Rejected.class, b).violation().kind());
    assertEquals(1, store.head());
    assertEquals(1, log.size());

    // C: same payload proposed concurrently by two callers
    executor = Executors.newFixedThreadPool(2);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<AppendOutcome>> futures = new ArrayList<>();
    for (int i = 0; i < 2; i++) {
      futures.add(executor.submit(() -> {
        start.await();
        return store.append(CandidateEvent.of(law("law-1", "ws-1")));
      }));
    }
    start.countDown();

    List<AppendOutcome> outcomes = new ArrayList<>();
    for (Future<AppendOutcome> future : futures) {
      outcomes.add(future.get(10, TimeUnit.SECONDS));
    }
    assertEquals(1, outcomes.stream().filter(AppendOutcome::isCommitted).count());
    AppendOutcome.Rejected rejected = (AppendOutcome.Rejected) outcomes.stream()
        .filter(o -> o instanceof AppendOutcome.Rejected)
        .findFirst()
        .orElseThrow();
    assertEquals(ViolationKind.DUPLICATE_ENTITY, rejected.violation().kind());
    assertEquals(2, store.head());
    assertEquals(2, log.size());
  }

  @Test
  void resubmittingCommittedEventIdIsRejected() {
    CandidateEvent candidate = CandidateEvent.builder(workspace("ws-1")).eventId("evt-fixed").build();
    commit(candidate);

    AppendOutcome again = store.append(
        CandidateEvent.builder(workspace("ws-2")).eventId("evt-fixed").build());

    assertEquals(ViolationKind.DUPLICATE_EVENT,
        assertInstanceOf(AppendOutcome.Rejected.class, again).violation().kind());
    assertEquals(1, store.head());
  }

  @Test
  void rejectionLeavesNoTrace() {
    commit(CandidateEvent.of(workspace("ws-1")));
    GovernanceState before = store.currentState();

    store.append(CandidateEvent.of(new WorkspaceCreated("ws-2", "", null)));

    assertEquals(1, log.size());
    assertEquals(before, store.currentState());
    assertEquals(1, log.writeCalls.get());
  }

  @Test
  void causationMustReferenceCommittedEvent() {
    CommittedEvent ws = commit(CandidateEvent.of(workspace("ws-1")));

    AppendOutcome unknown = store.append(
        CandidateEvent.builder(law("law-1", "ws-1")).causationId("evt-unknown").build());
    CommittedEvent known = commit(CandidateEvent.builder(law("law-1", "ws-1"))
        .causationId(ws.eventId())
        .correlationId("corr-1")
        .actorId("alice")
        .build());

    assertEquals(ViolationKind.MISSING_REFERENCE,
        assertInstanceOf(AppendOutcome.Rejected.class, unknown).violation().kind());
    assertEquals(ws.eventId(), known.causationId());
    assertEquals("corr-1", known.correlationId());
    assertEquals("alice", known.actorId());
  }

  @Test
  void concurrentAppendsProduceGaplessPositions() throws Exception {
    int threads = 8;
    int perThread = 25;
    executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<List<AppendOutcome>>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      int thread = t;
      futures.add(executor.submit(() -> {
        start.await();
        List<AppendOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < perThread; i++) {
          outcomes.add(store.append(CandidateEvent.of(workspace("ws-" + thread + "-" + i))));
        }
        return outcomes;
      }));
    }
    start.countDown();

    Set<Long> positions = new HashSet<>();
    for (Future<List<AppendOutcome>> future : futures) {
      for (AppendOutcome outcome : future.get(30, TimeUnit.SECONDS)) {
        assertTrue(positions.add(assertInstanceOf(AppendOutcome.Committed.class, outcome).event().position()));
      }
    }

    long total = (long) threads * perThread;
    assertEquals(total, store.head());
    assertEquals(total, positions.size());
    List<CommittedEvent> all = toList(store.read(0));
    for (int i = 0; i < all.size(); i++) {
      assertEquals(i, all.get(i).position());
      if (i > 0) {
        assertFalse(all.get(i).occurredAt().isBefore(all.get(i - 1).occurredAt()));
      }
    }
  }

  // ── Time stamping ──────────────────────────────────────────

  @Test
  void stampsWithTimeSource() {
    time.set(T0.plusSeconds(42));

    assertEquals(T0.plusSeconds(42), commit(CandidateEvent.of(workspace("ws-1"))).occurredAt());
  }

  @Test
  void clockSteppingBackwardsKeepsTimestampsNonDecreasing() {
    time.set(T0.plusSeconds(100));
    CommittedEvent first = commit(CandidateEvent.of(workspace("ws-1")));
    time.advance(Duration.ofSeconds(-50));

    CommittedEvent second = commit(CandidateEvent.of(workspace("ws-2")));

    assertEquals(first.occurredAt(), second.occurredAt());
  }

  @Test
  void callerTimestampEarlierThanLogIsRejected() {
    time.set(T0.plusSeconds(100));
    commit(CandidateEvent.of(workspace("ws-1")));

    AppendOutcome outcome = store.append(
        CandidateEvent.builder(workspace("ws-2")).occurredAt(T0).build());

    assertEquals(ViolationKind.TIME_BOUND,
        assertInstanceOf(AppendOutcome.Rejected.class, outcome).violation().kind());
  }

  @Test
  void callerTimestampIsKept() {
    Instant explicit = T0.plusSeconds(500);

    assertEquals(explicit,
        commit(CandidateEvent.builder(workspace("ws-1")).occurredAt(explicit).build()).occurredAt());
  }

  @Test
  void timestampsAreTruncatedToMicroseconds() {
    time.set(T0.plusNanos(1_999));
    CommittedEvent stamped = commit(CandidateEvent.of(workspace("ws-1")));
    CommittedEvent supplied = commit(CandidateEvent.builder(workspace("ws-2"))
        .occurredAt(T0.plusNanos(1_500))
        .build());

    assertEquals(T0.plusNanos(1_000), stamped.occurredAt());
    assertEquals(T0.plusNanos(1_000), supplied.occurredAt());
    assertEquals(T0.plusNanos(1_000), store.currentState().lastOccurredAt());
  }

  // ── Retry ──────────────────────────────────────────

  @Test
  void transientFailuresBelowLimitCommitExactlyOnce() {
    log.failNextWrites(2);

    CommittedEvent event = commit(CandidateEvent.of(workspace("ws-1")));

    assertEquals(0, event.position());
    assertEquals(3, log.writeCalls.get());
    assertEquals(1, log.size());
    assertEquals(1, store.head());
    assertEquals(2, metrics.retries.get());
  }

  @Test
  void transientFailuresAtLimitExhaustRetries() {
    commit(CandidateEvent.of(workspace("ws-1")));
    log.failNextWrites(3);
    EventStream before = store.read(0);

    AppendOutcome outcome = store.append(CandidateEvent.of(workspace("ws-2")));

    AppendOutcome.RetryExhausted exhausted = assertInstanceOf(AppendOutcome.RetryExhausted.class, outcome);
    assertEquals(3, exhausted.attempts());
    assertEquals(1, store.head());
    assertEquals(1, log.size());
    assertEquals(1, toList(store.read(0)).size());
    assertEquals(1, toList(before).size());
    assertFalse(store.currentState().workspaces().containsKey("ws-2"));
    assertEquals(AppendOutcome.Status.RETRY_EXHAUSTED, metrics.appends.get(1));
  }

  @Test
  void storeRecoversAfterExhaustion() {
    log.failNextWrites(3);
    store.append(CandidateEvent.of(workspace("ws-1")));

    CommittedEvent event = commit(CandidateEvent.of(workspace("ws-1")));

    assertEquals(0, event.position());
  }

  @Test
  void fatalStorageFailureIsNotRetried() {
    log.failFatally(new EventLogException("disk full"));

    AppendOutcome outcome = store.append(CandidateEvent.of(workspace("ws-1")));

    assertEquals("disk full", assertInstanceOf(AppendOutcome.Fatal.class, outcome).cause().getMessage());
    assertEquals(1, log.writeCalls.get());
    assertEquals(0, store.head());
    assertEquals(List.of(AppendOutcome.Status.FATAL), metrics.appends);
  }

  @Test
  void writeThatCommittedDespiteFailureIsReportedCommitted() {
    log.commitBeforeFailing(true);
    log.failNextWrites(3);

    AppendOutcome outcome = store.append(CandidateEvent.builder(workspace("ws-1")).eventId("evt-1").build());

    CommittedEvent event = assertInstanceOf(AppendOutcome.Committed.class, outcome).event();
    assertEquals("evt-1", event.eventId());
    assertEquals(0, event.position());
    assertEquals(1, store.head());
    assertTrue(store.currentState().containsEvent("evt-1"));
    assertEquals(List.of(AppendOutcome.Status.COMMITTED), metrics.appends);
    assertEquals(1, commit(CandidateEvent.of(workspace("ws-2"))).position());
  }

  @Test
  void fatalWriteThatCommittedIsReportedCommitted() {
    EventLogException lostAck = new EventLogException("connection reset after commit");
    InMemoryEventLog stored = new InMemoryEventLog();
    EventLog committing = new EventLog() {
      @Override
      public long size() {
        return stored.size();
      }

      @Override
      public void write(CommittedEvent event) {
        stored.write(event);
        throw lostAck;
      }

      @Override
      public List<CommittedEvent> read(long fromPosition, int maxEvents) {
        return stored.read(fromPosition, maxEvents);
      }
    };
    EventStore lossy = newStore(committing);

    AppendOutcome outcome = lossy.append(CandidateEvent.of(workspace("ws-1")));

    assertEquals(0, assertInstanceOf(AppendOutcome.Committed.class, outcome).event().position());
    assertEquals(1, lossy.head());
  }

  // ── Reads ──────────────────────────────────────────

  @Test
  void readerStartedBeforeCommitDoesNotSeeIt() {
    commit(CandidateEvent.of(workspace("ws-1")));
    EventStream early = store.read(0);

    commit(CandidateEvent.of(workspace("ws-2")));
    EventStream late = store.read(0);

    assertEquals(1, toList(early).size());
    assertEquals(2, toList(late).size());
    assertEquals(1, early.toPosition());
  }

  @Test
  void eventStreamIsRestartableAndPaged() {
    for (int i = 0; i < 10; i++) {
      commit(CandidateEvent.of(workspace("ws-" + i)));
    }
    EventStream stream = store.read(3);

    List<CommittedEvent> first = toList(stream);
    List<CommittedEvent> second = toList(stream);

    assertEquals(7, first.size());
    assertEquals(first, second);
    assertEquals(3, first.get(0).position());
    assertEquals(7, stream.stream().count());
  }

  @Test
  void stateAtAndQueryAreBoundedByHead() {
    for (int i = 0; i < 7; i++) {
      commit(CandidateEvent.of(workspace("ws-" + i)));
    }
    Projection<Long> counter = new Projection<>() {
      @Override
      public Long initial() {
        return 0L;
      }

      @Override
      public Long fold(Long prior, CommittedEvent event) {
        return prior + 1;
      }
    };

    assertEquals(3, store.stateAt(3).workspaces().size());
    assertEquals(store.currentState(), store.stateAt(7));
    assertEquals(5L, store.query(counter, 5));
    assertEquals(7L, store.query(counter));
    assertEquals(store.stateAt(4), store.query(GovernanceProjection.INSTANCE, 4));
    assertThrows(IllegalArgumentException.class, () -> store.stateAt(8));
    assertThrows(IllegalArgumentException.class, () -> store.query(counter, -1));
  }

  @Test
  void buildRecoversExistingLog() {
    for (int i = 0; i < 12; i++) {
      commit(CandidateEvent.of(workspace("ws-" + i)));
    }
    GovernanceState expected = store.currentState();

    EventStore reopened = newStore(log);

    assertEquals(12, reopened.head());
    assertEquals(expected, reopened.currentState());
    assertEquals(expected, reopened.stateAt(12));
  }

  // ── Scale ──────────────────────────────────────────

  @Test
  void appendCostDoesNotGrowWithHead() {
    EventStore large = EventStore.builder()
        .eventLog(new InMemoryEventLog())
        .timeSource(time)
        .build();

    assertTimeoutPreemptively(Duration.ofSeconds(30), () -> {
      for (int i = 0; i < 60_000; i++) {
        CandidateEvent candidate = CandidateEvent.builder(workspace("ws-" + i)).eventId("evt-" + i).build();
        assertTrue(large.append(candidate).isCommitted());
      }
    });

    assertEquals(60_000, large.head());
    assertTrue(large.currentState().containsEvent("evt-0"));
    assertEquals(ViolationKind.DUPLICATE_EVENT, assertInstanceOf(AppendOutcome.Rejected.class,
        large.append(CandidateEvent.builder(workspace("ws-new")).eventId("evt-17").build()))
        .violation().kind());
  }

  // ── Metrics ──────────────────────────────────────────

  @Test
  void everyAppendIsReported() {
    commit(CandidateEvent.of(workspace("ws-1")));
    store.append(CandidateEvent.of(workspace("ws-1")));

    assertEquals(List.of(AppendOutcome.Status.COMMITTED, AppendOutcome.Status.REJECTED), metrics.appends);
  }

  @Test
  void failingExporterDoesNotGateCommit() {
    EventStore withBrokenMetrics = EventStore.builder()
        .eventLog(new InMemoryEventLog())
        .metrics(new MetricsExporter() {
          @Override
          public void recordAppend(AppendOutcome.Status status, long durationNanos) {
            throw new IllegalStateException("registry closed");
          }

          @Override
          public void incrementRetry() {
            throw new IllegalStateException("registry closed");
          }
        })
        .build();

    AppendOutcome outcome = withBrokenMetrics.append(CandidateEvent.of(workspace("ws-1")));

    assertTrue(outcome.isCommitted());
    assertEquals(1, withBrokenMetrics.head());
  }

  @Test
  void closeClosesAutoCloseableExporter() {
    AtomicBoolean closed = new AtomicBoolean();
    class ClosingExporter implements MetricsExporter, AutoCloseable {
      @Override
      public void recordAppend(AppendOutcome.Status status, long durationNanos) {
      }

      @Override
      public void incrementRetry() {
      }

      @Override
      public void close() {
        closed.set(true);
      }
    }

    EventStore.builder().eventLog(new InMemoryEventLog()).metrics(new ClosingExporter()).build().close();

    assertTrue(closed.get());
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void eventLogIsRequired() {
    assertThrows(NullPointerException.class, () -> EventStore.builder().build());
  }

  @Test
  void pageSizeMustBePositive() {
    assertThrows(IllegalArgumentException.class,
        () -> EventStore.builder().eventLog(new InMemoryEventLog()).readPageSize(0).build());
  }
}
