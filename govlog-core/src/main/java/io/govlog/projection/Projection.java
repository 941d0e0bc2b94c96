package io.govlog.projection;

import io.govlog.CommittedEvent;

import java.util.List;

/**
 * A deterministic left fold over committed events.
 *
 * <p>Implementations must be pure and total: the same prior state and event always give
 * an equal result, and every event kind is handled. {@link #foldAll} may be overridden
 * for speed but must agree with folding one event at a time.
 *
 * @param <S> the derived state type, expected to be immutable
 */
public interface Projection<S> {

  /**
   * Returns the state before any event has been folded.
   */
  S initial();

  /**
   * Applies one event.
   *
   * @param prior the state before {@code event}
   * @param event the next committed event
   * @return the state after {@code event}
   */
  S fold(S prior, CommittedEvent event);

  /**
   * Applies events in order.
   *
   * @param prior  the state before the first event
   * @param events events in ascending position order
   * @return the state after the last event
   */
  default S foldAll(S prior, List<CommittedEvent> events) {
    S state = prior;
    for (CommittedEvent event : events) {
      state = fold(state, event);
    }
    return state;
  }
}
