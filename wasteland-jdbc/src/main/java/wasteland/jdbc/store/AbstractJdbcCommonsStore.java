package wasteland.jdbc.store;

import wasteland.PreconditionFailedException;
import wasteland.jdbc.ConnectionProvider;
import wasteland.jdbc.JdbcTemplate;
import wasteland.spi.CommonsStore;
import wasteland.spi.Statement;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC commons store: connection handling and guarded statement execution.
 *
 * <p>Subclasses map refs, commits and remotes onto their database. Register a custom
 * implementation through a {@link CommonsStoreProvider} in
 * {@code META-INF/services/wasteland.jdbc.store.CommonsStoreProvider}.
 *
 * @see JdbcCommonsStores
 */
public abstract class AbstractJdbcCommonsStore implements CommonsStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcCommonsStore.class.getName());

  /** Failure message of a commit that changed nothing. */
  public static final String NOTHING_TO_COMMIT = "nothing to commit";

  private final ConnectionProvider connectionProvider;

  protected AbstractJdbcCommonsStore(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Unique identifier for this store (e.g., "dolt", "h2").
   */
  public abstract String name();

  protected ConnectionProvider connectionProvider() {
    return connectionProvider;
  }

  /**
   * Runs statements in order, failing on the first guarded statement that changes no row.
   *
   * @return total rows changed
   * @throws PreconditionFailedException if a guard did not hold
   */
  protected static int applyStatements(Connection conn, List<Statement> statements) {
    int total = 0;
    for (Statement statement : statements) {
      int affected = JdbcTemplate.update(conn, statement.sql(), statement.params().toArray());
      if (statement.guarded() && affected == 0) {
        throw new PreconditionFailedException(statement.failureMessage());
      }
      total += affected;
    }
    return total;
  }

  /**
   * Rolls back after {@code failure}; a rollback error is attached to it as suppressed.
   */
  protected static void rollback(Connection conn, Throwable failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Rollback failed", e);
      failure.addSuppressed(e);
    }
  }

  protected static String describe(String ref) {
    return ref == null || ref.isEmpty() ? "main" : "branch " + ref;
  }
}
