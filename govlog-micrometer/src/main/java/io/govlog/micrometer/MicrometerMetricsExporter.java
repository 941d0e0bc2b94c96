package io.govlog.micrometer;

import io.govlog.AppendOutcome;
import io.govlog.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code govlog.append}, tagged {@code outcome}: finished appends by outcome
 *       ({@code committed}, {@code rejected}, {@code retry_exhausted}, {@code fatal})</li>
 *   <li>{@code govlog.append.retries}: storage retries after transient failures</li>
 *   <li>{@code govlog.replay.events}: events folded during replay</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code govlog.append.duration}, tagged {@code outcome}: time spent in append, lock wait included</li>
 *   <li>{@code govlog.replay.duration}: time spent folding events</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Map<AppendOutcome.Status, Counter> appendCounters =
            new EnumMap<>(AppendOutcome.Status.class);
    private final Map<AppendOutcome.Status, Timer> appendTimers =
            new EnumMap<>(AppendOutcome.Status.class);
    private final Counter retries;
    private final Timer replayDuration;
    private final Counter replayEvents;
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "govlog"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "govlog");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "tenant_a.govlog"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        for (AppendOutcome.Status status : AppendOutcome.Status.values()) {
            appendCounters.put(status, Counter.builder(namePrefix + ".append")
                    .description("Finished appends by outcome")
                    .tag("outcome", status.tag())
                    .register(registry));
            appendTimers.put(status, Timer.builder(namePrefix + ".append.duration")
                    .description("Time spent appending, including lock wait")
                    .tag("outcome", status.tag())
                    .register(registry));
        }
        this.retries = Counter.builder(namePrefix + ".append.retries")
                .description("Storage writes retried after a transient failure")
                .register(registry);
        this.replayDuration = Timer.builder(namePrefix + ".replay.duration")
                .description("Time spent folding events during replay")
                .register(registry);
        this.replayEvents = Counter.builder(namePrefix + ".replay.events")
                .description("Events folded during replay")
                .register(registry);
    }

    @Override
    public void recordAppend(AppendOutcome.Status status, long durationNanos) {
        if (closed) return;
        Objects.requireNonNull(status, "status");
        appendCounters.get(status).increment();
        appendTimers.get(status).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void incrementRetry() {
        if (closed) return;
        retries.increment();
    }

    @Override
    public void recordReplay(long events, long durationNanos) {
        if (closed) return;
        replayEvents.increment(events);
        replayDuration.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>{@link io.govlog.store.EventStore#close()} calls this.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>();
        meters.addAll(appendCounters.values());
        meters.addAll(appendTimers.values());
        meters.add(retries);
        meters.add(replayDuration);
        meters.add(replayEvents);
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
