package wasteland.spring.boot;

import wasteland.Capabilities;
import wasteland.ClientConfig;
import wasteland.UpstreamInfo;
import wasteland.WastelandClient;
import wasteland.Workspace;
import wasteland.jdbc.ConnectionProvider;
import wasteland.jdbc.DataSourceConnectionProvider;
import wasteland.jdbc.store.CommonsStoreProvider;
import wasteland.jdbc.store.DoltCommonsStore;
import wasteland.jdbc.store.H2CommonsStore;
import wasteland.jdbc.store.JdbcCommonsStores;
import wasteland.retry.ExponentialBackoffRetryPolicy;
import wasteland.spi.CommonsStore;
import wasteland.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the wanted-board client.
 *
 * <p>Wires a {@link CommonsStore} from a {@link DataSource}, and a {@link WastelandClient}
 * and {@link Workspace} from {@link WastelandProperties}. Optional {@link MetricsExporter}
 * and {@link Capabilities} beans are picked up when present.
 *
 * @see WastelandProperties
 * @see WastelandMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(WastelandClient.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(WastelandProperties.class)
public class WastelandAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public CommonsStore commonsStore(DataSource dataSource, ConnectionProvider connectionProvider,
      WastelandProperties props) {
    WastelandProperties.Store store = props.getStore();
    CommonsStoreProvider provider = store.getType() == null || store.getType().isEmpty()
        ? JdbcCommonsStores.detect(dataSource)
        : JdbcCommonsStores.get(store.getType());
    return switch (provider.name()) {
      case "dolt" -> DoltCommonsStore.builder(connectionProvider)
          .originRemote(store.getOriginRemote())
          .upstreamRemote(store.getUpstreamRemote())
          .wildWest(store.isWildWest())
          .resetMainOnSync(store.isResetMainOnSync())
          .build();
      case "h2" -> new H2CommonsStore(connectionProvider, store.isWildWest()).initialize();
      default -> provider.create(connectionProvider);
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public WastelandClient wastelandClient(WastelandProperties props,
      CommonsStore commonsStore,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<Capabilities> capabilitiesProvider) {
    if (props.getRigHandle() == null || props.getRigHandle().isEmpty()) {
      throw new IllegalStateException("wasteland.rig-handle must be set");
    }
    return new WastelandClient(ClientConfig.builder()
        .store(commonsStore)
        .rigHandle(props.getRigHandle())
        .mode(props.getMode())
        .signing(props.isSigning())
        .hopUri(props.getHopUri())
        .capabilities(capabilitiesProvider.getIfAvailable(Capabilities::none))
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .prRetryPolicy(new ExponentialBackoffRetryPolicy(
            props.getPrRetry().getBaseDelayMs(), props.getPrRetry().getMaxDelayMs()))
        .build());
  }

  /**
   * Workspace holding the configured client under {@code wasteland.upstream.name}, or
   * empty when no upstream is named.
   */
  @Bean
  @ConditionalOnMissingBean
  public Workspace workspace(WastelandProperties props, WastelandClient wastelandClient) {
    Workspace workspace = new Workspace(props.getRigHandle());
    WastelandProperties.Upstream upstream = props.getUpstream();
    if (upstream.getName() != null && !upstream.getName().isEmpty()) {
      workspace.add(new UpstreamInfo(upstream.getName(), upstream.getForkOrg(), upstream.getForkDb(),
          props.getMode()), wastelandClient);
    }
    return workspace;
  }
}
