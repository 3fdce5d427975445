package wasteland.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementMutationTagsTransitionAndMode() {
    exporter.incrementMutation("claim", "pr");
    exporter.incrementMutation("claim", "pr");
    exporter.incrementMutation("claim", "wild-west");
    exporter.incrementMutation("done", "pr");

    assertEquals(2.0, registry.get("wasteland.mutation").tag("transition", "claim").tag("mode", "pr")
        .counter().count());
    assertEquals(1.0, registry.get("wasteland.mutation").tag("transition", "claim").tag("mode", "wild-west")
        .counter().count());
    assertEquals(1.0, registry.get("wasteland.mutation").tag("transition", "done").counter().count());
  }

  @Test
  void incrementMutationRejected() {
    exporter.incrementMutationRejected("claim");
    assertEquals(1.0, registry.get("wasteland.mutation.rejected").tag("transition", "claim").counter().count());
  }

  @Test
  void incrementReplaySuppressed() {
    exporter.incrementReplaySuppressed();
    exporter.incrementReplaySuppressed();
    assertEquals(2.0, counter("wasteland.replay.suppressed").count());
  }

  @Test
  void incrementBranchCleanup() {
    exporter.incrementBranchCleanup();
    assertEquals(1.0, counter("wasteland.branch.cleanup").count());
  }

  @Test
  void incrementPullRequestOutcomes() {
    exporter.incrementPrSubmitted();
    exporter.incrementPrFailed();
    exporter.incrementPrFailed();
    assertEquals(1.0, counter("wasteland.pr.submitted").count());
    assertEquals(2.0, counter("wasteland.pr.failed").count());
  }

  @Test
  void incrementPushFailed() {
    exporter.incrementPushFailed();
    assertEquals(1.0, counter("wasteland.push.failed").count());
  }

  @Test
  void recordMutationDuration() {
    exporter.recordMutationDurationMs("claim", 40);
    exporter.recordMutationDurationMs("claim", 60);

    Timer timer = registry.get("wasteland.mutation.duration").tag("transition", "claim").timer();
    assertEquals(2, timer.count());
    assertEquals(100.0, timer.totalTime(TimeUnit.MILLISECONDS));
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "hop.wasteland");
    custom.incrementPushFailed();
    custom.incrementMutation("post", "wild-west");

    assertEquals(1.0, counter("hop.wasteland.push.failed").count());
    assertEquals(1.0, registry.get("hop.wasteland.mutation").tag("transition", "post").counter().count());
  }

  @Test
  void closeRemovesMetersAndStopsRecording() {
    exporter.incrementMutation("claim", "pr");
    exporter.recordMutationDurationMs("claim", 5);

    exporter.close();
    exporter.incrementPushFailed();
    exporter.incrementMutation("claim", "pr");

    assertNull(registry.find("wasteland.push.failed").counter());
    assertNull(registry.find("wasteland.mutation").counter());
    assertNull(registry.find("wasteland.mutation.duration").timer());
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "wasteland."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }
}
