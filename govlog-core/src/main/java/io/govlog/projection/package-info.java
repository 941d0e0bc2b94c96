/**
 * Projections and the replay engine that folds the event log into derived state.
 */
package io.govlog.projection;
