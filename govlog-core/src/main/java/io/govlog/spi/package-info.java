/**
 * Extension points: storage ({@link io.govlog.spi.EventLog}), metrics
 * ({@link io.govlog.spi.MetricsExporter}) and the storage exception hierarchy.
 */
package io.govlog.spi;
