package wasteland.spi;

/**
 * Observability hook for exporting mutation counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of committed mutations.
   *
   * @param transition transition name, e.g. {@code claim}
   * @param mode       {@code wild-west} or {@code pr}
   */
  void incrementMutation(String transition, String mode);

  /**
   * Increments the count of mutations rejected because a precondition did not hold.
   */
  void incrementMutationRejected(String transition);

  /**
   * Increments the count of pr-mode mutations answered from an existing branch
   * without committing.
   */
  void incrementReplaySuppressed();

  /**
   * Increments the count of branches deleted because the mutation reverted them to main.
   */
  void incrementBranchCleanup();

  void incrementPrSubmitted();

  void incrementPrFailed();

  void incrementPushFailed();

  /**
   * Records the wall time of one mutating call, lock wait included.
   *
   * @param transition transition name
   * @param durationMs duration in milliseconds (always non-negative)
   */
  default void recordMutationDurationMs(String transition, long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementMutation(String transition, String mode) {
    }

    @Override
    public void incrementMutationRejected(String transition) {
    }

    @Override
    public void incrementReplaySuppressed() {
    }

    @Override
    public void incrementBranchCleanup() {
    }

    @Override
    public void incrementPrSubmitted() {
    }

    @Override
    public void incrementPrFailed() {
    }

    @Override
    public void incrementPushFailed() {
    }
  }
}
