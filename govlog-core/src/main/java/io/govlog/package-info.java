/**
 * Event-sourced governance kernel.
 *
 * <p>Callers build a {@link io.govlog.CandidateEvent} and hand it to
 * {@link io.govlog.store.EventStore#append}; admitted events become
 * {@link io.govlog.CommittedEvent}s with a gapless position. All state is derived by
 * folding committed events through a {@link io.govlog.projection.Projection}.
 */
package io.govlog;
