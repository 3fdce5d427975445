package wasteland.jdbc.store;

import wasteland.jdbc.ConnectionProvider;
import wasteland.spi.CommonsStore;

import java.util.List;

/**
 * Provides {@link H2CommonsStore}; the commons tables are created on first use.
 */
public final class H2CommonsStoreProvider implements CommonsStoreProvider {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public CommonsStore create(ConnectionProvider connectionProvider) {
    return new H2CommonsStore(connectionProvider).initialize();
  }
}
