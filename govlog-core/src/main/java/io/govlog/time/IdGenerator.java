package io.govlog.time;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Generator of event ids, used by {@link io.govlog.CandidateEvent.Builder#idGenerator} when
 * no explicit id is set.
 */
@FunctionalInterface
public interface IdGenerator {

  String newId();

  /**
   * Returns a generator of monotonic ULIDs, lexicographically sortable by creation time.
   */
  static IdGenerator ulid() {
    return Ulid.INSTANCE;
  }

  final class Ulid implements IdGenerator {
    static final Ulid INSTANCE = new Ulid();

    private Ulid() {
    }

    @Override
    public String newId() {
      return UlidCreator.getMonotonicUlid().toString();
    }
  }
}
