/**
 * The event store: serialized, validated, retried appends and bounded reads.
 */
package io.govlog.store;
