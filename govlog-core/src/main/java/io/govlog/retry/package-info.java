/**
 * Bounded exponential-backoff retry of storage operations, distinguishing transient from fatal failures.
 */
package io.govlog.retry;
