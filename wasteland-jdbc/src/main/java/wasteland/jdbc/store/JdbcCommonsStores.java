package wasteland.jdbc.store;

import wasteland.jdbc.DataSourceConnectionProvider;
import wasteland.spi.CommonsStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import javax.sql.DataSource;

/**
 * Registry for JDBC commons stores with auto-detection support.
 *
 * <p>Providers are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/wasteland.jdbc.store.CommonsStoreProvider}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect and create from a DataSource
 * CommonsStore store = JdbcCommonsStores.create(dataSource);
 *
 * // Auto-detect from JDBC URL
 * CommonsStoreProvider provider = JdbcCommonsStores.detect("jdbc:mysql://localhost:3306/wl_commons");
 *
 * // Get by name
 * CommonsStoreProvider h2 = JdbcCommonsStores.get("h2");
 * }</pre>
 */
public final class JdbcCommonsStores {

  private static final List<CommonsStoreProvider> PROVIDERS;
  private static final Map<String, CommonsStoreProvider> BY_NAME = new ConcurrentHashMap<>();

  static {
    PROVIDERS = ServiceLoader.load(CommonsStoreProvider.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (CommonsStoreProvider provider : PROVIDERS) {
      BY_NAME.put(provider.name().toLowerCase(Locale.ROOT), provider);
    }
  }

  private JdbcCommonsStores() {
  }

  /**
   * Returns all registered providers.
   */
  public static List<CommonsStoreProvider> all() {
    return PROVIDERS;
  }

  /**
   * Gets a provider by name.
   *
   * @param name store name (case-insensitive)
   * @return the provider
   * @throws IllegalArgumentException if no provider is registered under that name
   */
  public static CommonsStoreProvider get(String name) {
    CommonsStoreProvider provider = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (provider == null) {
      throw new IllegalArgumentException("Unknown commons store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return provider;
  }

  /**
   * Detects the provider for a DataSource and creates its store.
   *
   * @throws IllegalStateException if detection fails
   */
  public static CommonsStore create(DataSource dataSource) {
    return detect(dataSource).create(new DataSourceConnectionProvider(dataSource));
  }

  /**
   * Auto-detects the provider from a DataSource.
   *
   * @throws IllegalStateException if the connection URL cannot be read or matches no provider
   */
  public static CommonsStoreProvider detect(DataSource dataSource) {
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect commons store from DataSource", e);
    }
    try {
      return detect(url);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(e.getMessage(), e);
    }
  }

  /**
   * Auto-detects the provider from a JDBC URL.
   *
   * @throws IllegalArgumentException if no provider handles the URL
   */
  public static CommonsStoreProvider detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (CommonsStoreProvider provider : PROVIDERS) {
      for (String prefix : provider.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return provider;
        }
      }
    }

    throw new IllegalArgumentException("No commons store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return PROVIDERS.stream()
        .flatMap(p -> p.jdbcUrlPrefixes().stream())
        .toList();
  }
}
