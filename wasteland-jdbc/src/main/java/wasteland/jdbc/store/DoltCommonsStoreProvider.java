package wasteland.jdbc.store;

import wasteland.jdbc.ConnectionProvider;
import wasteland.spi.CommonsStore;

import java.util.List;

/**
 * Provides {@link DoltCommonsStore} with default remotes. Dolt sql-server speaks the
 * MySQL protocol.
 */
public final class DoltCommonsStoreProvider implements CommonsStoreProvider {

  @Override
  public String name() {
    return "dolt";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public CommonsStore create(ConnectionProvider connectionProvider) {
    return DoltCommonsStore.builder(connectionProvider).build();
  }
}
