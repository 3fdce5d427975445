package wasteland.jdbc.store;

import wasteland.jdbc.ConnectionProvider;
import wasteland.spi.CommonsStore;

import java.util.List;

/**
 * Factory for a JDBC commons store, discovered through {@link java.util.ServiceLoader}.
 */
public interface CommonsStoreProvider {

  /**
   * Unique identifier of the store (e.g., "dolt", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes the store handles (e.g., "jdbc:mysql:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * Creates a ready-to-use store over the given connections.
   */
  CommonsStore create(ConnectionProvider connectionProvider);
}
