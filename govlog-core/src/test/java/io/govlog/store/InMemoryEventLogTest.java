package io.govlog.store;

import io.govlog.CommittedEvent;
import io.govlog.spi.PositionConflictException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.govlog.GovernanceFixtures.committed;
import static io.govlog.GovernanceFixtures.workspace;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventLogTest {
  private final InMemoryEventLog log = new InMemoryEventLog();
  private final List<CommittedEvent> events = committed(workspace("a"), workspace("b"), workspace("c"));

  @Test
  void writesAndReadsInOrder() {
    events.forEach(log::write);

    assertEquals(3, log.size());
    assertEquals(events, log.read(0, 10));
    assertEquals(events.subList(1, 2), log.read(1, 1));
    assertTrue(log.read(3, 10).isEmpty());
  }

  @Test
  void rewritingSameEventIsIdempotent() {
    log.write(events.get(0));
    log.write(events.get(0));

    assertEquals(1, log.size());
  }

  @Test
  void differentEventAtOccupiedPositionConflicts() {
    log.write(events.get(0));
    CommittedEvent other = new CommittedEvent(0, "other", events.get(1).occurredAt(),
        events.get(1).payload(), null, null, null);

    PositionConflictException ex = assertThrows(PositionConflictException.class, () -> log.write(other));
    assertEquals(0, ex.position());
    assertEquals("evt-0", ex.existingEventId());
  }

  @Test
  void gapIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> log.write(events.get(1)));
  }

  @Test
  void readSnapshotIsUnaffectedByLaterWrites() {
    log.write(events.get(0));
    List<CommittedEvent> page = log.read(0, 10);

    log.write(events.get(1));

    assertEquals(1, page.size());
  }

  @Test
  void growsPastInitialCapacity() {
    for (int i = 0; i < 200; i++) {
      log.write(new CommittedEvent(i, "evt-" + i, events.get(0).occurredAt(), workspace("ws-" + i),
          null, null, null));
    }

    assertEquals(200, log.size());
    List<CommittedEvent> tail = log.read(190, 50);
    assertEquals(10, tail.size());
    assertEquals("evt-199", tail.get(9).eventId());
  }
}
