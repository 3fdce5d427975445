package wasteland;

import wasteland.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

class RecordingMetrics implements MetricsExporter {
  final List<String> mutations = new ArrayList<>();
  final List<String> rejected = new ArrayList<>();
  final AtomicInteger replays = new AtomicInteger();
  final AtomicInteger cleanups = new AtomicInteger();
  final AtomicInteger prSubmitted = new AtomicInteger();
  final AtomicInteger prFailed = new AtomicInteger();
  final AtomicInteger pushFailed = new AtomicInteger();

  @Override
  public void incrementMutation(String transition, String mode) {
    mutations.add(transition + "@" + mode);
  }

  @Override
  public void incrementMutationRejected(String transition) {
    rejected.add(transition);
  }

  @Override
  public void incrementReplaySuppressed() {
    replays.incrementAndGet();
  }

  @Override
  public void incrementBranchCleanup() {
    cleanups.incrementAndGet();
  }

  @Override
  public void incrementPrSubmitted() {
    prSubmitted.incrementAndGet();
  }

  @Override
  public void incrementPrFailed() {
    prFailed.incrementAndGet();
  }

  @Override
  public void incrementPushFailed() {
    pushFailed.incrementAndGet();
  }
}
