package io.govlog.projection;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Append-only entity history shared by every {@link GovernanceState} folded along one
 * line of the log.
 *
 * <p>Each value is tagged with the state position from which it is visible. A state at
 * position {@code p} sees the newest version tagged {@code <= p}, so folding one more
 * event adds versions for the entities it touches instead of copying every map. Only the
 * state at the {@link #advance tip} may extend a history; folding an older state copies
 * the versions visible to it into a new history first.
 *
 * <p>Versions are immutable and published through concurrent maps, so readers of older
 * states never block the writer extending the tip.
 */
final class StateHistory {
  private final Map<String, Long> eventIds = new ConcurrentHashMap<>();
  final Versions<Workspace> workspaces = new Versions<>();
  final Versions<Delegation> delegations = new Versions<>();
  final Versions<Law> laws = new Versions<>();

  private long tip;

  StateHistory(long tip) {
    this.tip = tip;
  }

  /**
   * Moves the tip from {@code from} to {@code to}.
   *
   * @return {@code false} if {@code from} is not the current tip
   */
  synchronized boolean advance(long from, long to) {
    if (tip != from) {
      return false;
    }
    tip = to;
    return true;
  }

  /**
   * Returns a new history holding exactly what a state at {@code position} sees, with its
   * tip at {@code position}.
   */
  StateHistory copyAt(long position) {
    StateHistory copy = new StateHistory(position);
    eventIds.forEach((id, since) -> {
      if (since <= position) {
        copy.eventIds.put(id, since);
      }
    });
    workspaces.copyTo(copy.workspaces, position);
    delegations.copyTo(copy.delegations, position);
    laws.copyTo(copy.laws, position);
    return copy;
  }

  void recordEvent(String eventId, long since) {
    eventIds.putIfAbsent(eventId, since);
  }

  boolean containsEvent(String eventId, long position) {
    Long since = eventIds.get(eventId);
    return since != null && since <= position;
  }

  Set<String> eventIds(long position) {
    Set<String> visible = new HashSet<>();
    eventIds.forEach((id, since) -> {
      if (since <= position) {
        visible.add(id);
      }
    });
    return Collections.unmodifiableSet(visible);
  }

  /**
   * Version chains for one entity kind, newest first.
   */
  static final class Versions<V> {
    private final Map<String, Version<V>> newest = new ConcurrentHashMap<>();

    V get(String key, long position) {
      Version<V> version = visible(newest.get(key), position);
      return version == null ? null : version.value();
    }

    /**
     * Adds {@code value} at {@code since} unless the key already has a value at {@code before}.
     */
    void putIfAbsent(String key, V value, long before, long since) {
      if (get(key, before) == null) {
        newest.put(key, new Version<>(value, since, newest.get(key)));
      }
    }

    /**
     * Adds the changed value at {@code since} if the key has a value at {@code before}.
     */
    void update(String key, UnaryOperator<V> change, long before, long since) {
      V current = get(key, before);
      if (current != null) {
        newest.put(key, new Version<>(change.apply(current), since, newest.get(key)));
      }
    }

    Map<String, V> view(long position) {
      Map<String, V> visible = new HashMap<>();
      newest.forEach((key, head) -> {
        Version<V> version = visible(head, position);
        if (version != null) {
          visible.put(key, version.value());
        }
      });
      return Collections.unmodifiableMap(visible);
    }

    void copyTo(Versions<V> target, long position) {
      newest.forEach((key, head) -> {
        Version<V> version = visible(head, position);
        if (version != null) {
          target.newest.put(key, new Version<>(version.value(), version.since(), null));
        }
      });
    }

    private static <V> Version<V> visible(Version<V> head, long position) {
      Version<V> version = head;
      while (version != null && version.since() > position) {
        version = version.previous();
      }
      return version;
    }
  }

  private record Version<V>(V value, long since, Version<V> previous) {
  }
}
