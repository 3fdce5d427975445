package wasteland;

import wasteland.retry.ExponentialBackoffRetryPolicy;
import wasteland.retry.RetryPolicy;
import wasteland.spi.CommonsStore;
import wasteland.spi.MetricsExporter;

import java.time.Clock;
import java.util.Objects;

/**
 * Settings of a {@link WastelandClient}.
 *
 * <pre>{@code
 * ClientConfig config = ClientConfig.builder()
 *     .store(JdbcCommonsStores.detect(dataSource))
 *     .rigHandle("alice")
 *     .mode(Mode.PR)
 *     .build();
 * }</pre>
 */
public final class ClientConfig {
  private final CommonsStore store;
  private final String rigHandle;
  private final Mode mode;
  private final boolean signing;
  private final String hopUri;
  private final Capabilities capabilities;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final RetryPolicy prRetryPolicy;

  private ClientConfig(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.rigHandle = Objects.requireNonNull(builder.rigHandle, "rigHandle");
    if (rigHandle.isEmpty() || rigHandle.contains("/")) {
      throw new IllegalArgumentException("rigHandle must be non-empty and contain no '/': " + rigHandle);
    }
    this.mode = builder.mode;
    this.signing = builder.signing;
    this.hopUri = builder.hopUri;
    this.capabilities = builder.capabilities;
    this.metrics = builder.metrics;
    this.clock = builder.clock;
    this.prRetryPolicy = builder.prRetryPolicy;
  }

  public static Builder builder() {
    return new Builder();
  }

  public CommonsStore store() {
    return store;
  }

  public String rigHandle() {
    return rigHandle;
  }

  public Mode mode() {
    return mode;
  }

  public boolean signing() {
    return signing;
  }

  public String hopUri() {
    return hopUri;
  }

  public Capabilities capabilities() {
    return capabilities;
  }

  public MetricsExporter metrics() {
    return metrics;
  }

  public Clock clock() {
    return clock;
  }

  public RetryPolicy prRetryPolicy() {
    return prRetryPolicy;
  }

  public static final class Builder {
    private CommonsStore store;
    private String rigHandle;
    private Mode mode = Mode.WILD_WEST;
    private boolean signing;
    private String hopUri = "";
    private Capabilities capabilities = Capabilities.none();
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private Clock clock = Clock.systemUTC();
    private RetryPolicy prRetryPolicy = new ExponentialBackoffRetryPolicy();

    private Builder() {
    }

    public Builder store(CommonsStore store) {
      this.store = store;
      return this;
    }

    public Builder rigHandle(String rigHandle) {
      this.rigHandle = rigHandle;
      return this;
    }

    public Builder mode(Mode mode) {
      this.mode = Objects.requireNonNull(mode, "mode");
      return this;
    }

    public Builder signing(boolean signing) {
      this.signing = signing;
      return this;
    }

    public Builder hopUri(String hopUri) {
      this.hopUri = hopUri == null ? "" : hopUri;
      return this;
    }

    public Builder capabilities(Capabilities capabilities) {
      this.capabilities = capabilities == null ? Capabilities.none() : capabilities;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Backoff applied to automatic pull-request submission after a failure.
     */
    public Builder prRetryPolicy(RetryPolicy prRetryPolicy) {
      this.prRetryPolicy = Objects.requireNonNull(prRetryPolicy, "prRetryPolicy");
      return this;
    }

    public ClientConfig build() {
      return new ClientConfig(this);
    }
  }
}
