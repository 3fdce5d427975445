package wasteland.micrometer;

import wasteland.spi.MetricsExporter;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code wasteland.mutation} (tags {@code transition}, {@code mode}): committed mutations</li>
 *   <li>{@code wasteland.mutation.rejected} (tag {@code transition}): failed preconditions</li>
 *   <li>{@code wasteland.replay.suppressed}: pr-mode calls answered from an existing branch</li>
 *   <li>{@code wasteland.branch.cleanup}: branches deleted after reverting to main</li>
 *   <li>{@code wasteland.pr.submitted}: pull requests opened</li>
 *   <li>{@code wasteland.pr.failed}: pull request submissions that failed</li>
 *   <li>{@code wasteland.push.failed}: pushes that failed</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code wasteland.mutation.duration} (tag {@code transition}): wall time of mutating calls</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter replaySuppressed;
  private final Counter branchCleanup;
  private final Counter prSubmitted;
  private final Counter prFailed;
  private final Counter pushFailed;
  private final Map<String, Meter> tagged = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "wasteland"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "wasteland");
  }

  /**
   * Creates an exporter with a custom metric name prefix, e.g. one per commons.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "hop.wasteland"})
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
    this.namePrefix = namePrefix;
    this.replaySuppressed = Counter.builder(namePrefix + ".replay.suppressed")
        .description("PR-mode mutations answered from an existing branch")
        .register(registry);
    this.branchCleanup = Counter.builder(namePrefix + ".branch.cleanup")
        .description("Branches deleted because they matched main again")
        .register(registry);
    this.prSubmitted = Counter.builder(namePrefix + ".pr.submitted")
        .description("Pull requests opened")
        .register(registry);
    this.prFailed = Counter.builder(namePrefix + ".pr.failed")
        .description("Pull request submissions that failed")
        .register(registry);
    this.pushFailed = Counter.builder(namePrefix + ".push.failed")
        .description("Pushes that failed")
        .register(registry);
  }

  @Override
  public void incrementMutation(String transition, String mode) {
    if (closed) return;
    Counter counter = (Counter) tagged.computeIfAbsent("mutation|" + transition + "|" + mode,
        k -> Counter.builder(namePrefix + ".mutation")
            .description("Committed mutations")
            .tag("transition", transition)
            .tag("mode", mode)
            .register(registry));
    counter.increment();
  }

  @Override
  public void incrementMutationRejected(String transition) {
    if (closed) return;
    Counter counter = (Counter) tagged.computeIfAbsent("rejected|" + transition,
        k -> Counter.builder(namePrefix + ".mutation.rejected")
            .description("Mutations whose precondition did not hold")
            .tag("transition", transition)
            .register(registry));
    counter.increment();
  }

  @Override
  public void incrementReplaySuppressed() {
    if (closed) return;
    replaySuppressed.increment();
  }

  @Override
  public void incrementBranchCleanup() {
    if (closed) return;
    branchCleanup.increment();
  }

  @Override
  public void incrementPrSubmitted() {
    if (closed) return;
    prSubmitted.increment();
  }

  @Override
  public void incrementPrFailed() {
    if (closed) return;
    prFailed.increment();
  }

  @Override
  public void incrementPushFailed() {
    if (closed) return;
    pushFailed.increment();
  }

  @Override
  public void recordMutationDurationMs(String transition, long durationMs) {
    if (closed) return;
    Timer timer = (Timer) tagged.computeIfAbsent("duration|" + transition,
        k -> Timer.builder(namePrefix + ".mutation.duration")
            .description("Wall time of mutating calls")
            .tag("transition", transition)
            .register(registry));
    timer.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the client is discarded, e.g. when its upstream is removed from the
   * workspace.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(replaySuppressed, branchCleanup, prSubmitted, prFailed, pushFailed));
    meters.addAll(tagged.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    tagged.clear();
    if (first != null) throw first;
  }
}
