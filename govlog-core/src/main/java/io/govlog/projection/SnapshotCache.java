package io.govlog.projection;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Bounded cache of folded states keyed by log position.
 *
 * <p>Only an optimization: {@link ReplayEngine} produces the same result with an empty cache.
 * When full, the snapshot at the lowest position is evicted.
 *
 * @param <S> the state type
 */
public final class SnapshotCache<S> {
  private final ConcurrentNavigableMap<Long, S> snapshots = new ConcurrentSkipListMap<>();
  private final int maxSnapshots;

  public SnapshotCache(int maxSnapshots) {
    if (maxSnapshots <= 0) {
      throw new IllegalArgumentException("maxSnapshots must be > 0, got: " + maxSnapshots);
    }
    this.maxSnapshots = maxSnapshots;
  }

  /**
   * Stores the state folded over positions {@code [0, position)}.
   */
  public void put(long position, S state) {
    snapshots.put(position, state);
    while (snapshots.size() > maxSnapshots) {
      snapshots.pollFirstEntry();
    }
  }

  /**
   * Returns the cached snapshot with the greatest position not above {@code position}.
   */
  public Optional<Map.Entry<Long, S>> floor(long position) {
    return Optional.ofNullable(snapshots.floorEntry(position));
  }

  public Optional<S> get(long position) {
    return Optional.ofNullable(snapshots.get(position));
  }

  public int size() {
    return snapshots.size();
  }

  public void clear() {
    snapshots.clear();
  }
}
