package io.govlog;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static io.govlog.GovernanceFixtures.workspace;
import static org.junit.jupiter.api.Assertions.*;

class CandidateEventTest {

  @Test
  void defaultsToUlidAndNoTimestamp() {
    CandidateEvent candidate = CandidateEvent.of(workspace("ws-1"));

    assertEquals(26, candidate.eventId().length());
    assertNull(candidate.occurredAt());
    assertNull(candidate.causationId());
  }

  @Test
  void generatedIdsAreUnique() {
    assertNotEquals(CandidateEvent.of(workspace("a")).eventId(), CandidateEvent.of(workspace("a")).eventId());
  }

  @Test
  void customIdGeneratorIsUsedWhenNoIdIsSet() {
    AtomicInteger seq = new AtomicInteger();
    CandidateEvent generated = CandidateEvent.builder(workspace("ws-1"))
        .idGenerator(() -> "cmd-" + seq.incrementAndGet())
        .build();
    CandidateEvent explicit = CandidateEvent.builder(workspace("ws-1"))
        .idGenerator(() -> "cmd-" + seq.incrementAndGet())
        .eventId("evt-1")
        .build();

    assertEquals("cmd-1", generated.eventId());
    assertEquals("evt-1", explicit.eventId());
    assertEquals(1, seq.get());
    assertThrows(IllegalArgumentException.class,
        () -> CandidateEvent.builder(workspace("ws-1")).idGenerator(() -> null).build());
  }

  @Test
  void rejectsEmptyOrOversizedId() {
    assertThrows(IllegalArgumentException.class,
        () -> CandidateEvent.builder(workspace("ws-1")).eventId("").build());
    assertThrows(IllegalArgumentException.class,
        () -> CandidateEvent.builder(workspace("ws-1")).eventId("x".repeat(37)).build());
  }

  @Test
  void payloadIsRequired() {
    assertThrows(NullPointerException.class, () -> CandidateEvent.builder(null));
  }

  @Test
  void stampingKeepsEverythingElse() {
    CandidateEvent candidate = CandidateEvent.builder(workspace("ws-1"))
        .eventId("evt-1")
        .causationId("evt-0")
        .correlationId("corr")
        .actorId("alice")
        .build();
    Instant at = Instant.parse("2025-03-01T10:00:00Z");

    CommittedEvent committed = candidate.withOccurredAt(at).commitAt(4);

    assertEquals(new CommittedEvent(4, "evt-1", at, workspace("ws-1"), "evt-0", "corr", "alice"), committed);
    assertNull(candidate.occurredAt());
  }

  @Test
  void unstampedCandidateCannotBeCommitted() {
    assertThrows(IllegalStateException.class, () -> CandidateEvent.of(workspace("ws-1")).commitAt(0));
  }
}
