package wasteland.jdbc;

import wasteland.spi.CommonsStoreException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Bootstraps the commons tables ({@code wanted}, {@code completions}, {@code stamps}).
 *
 * <p>The DDL is read from the classpath resource {@value #SCHEMA_RESOURCE}. Every
 * statement is idempotent.
 */
public final class CommonsSchema {
  private static final Logger logger = Logger.getLogger(CommonsSchema.class.getName());

  public static final String SCHEMA_RESOURCE = "wasteland/schema-h2.sql";

  private CommonsSchema() {
  }

  /**
   * Creates the commons tables in the connection's current schema.
   */
  public static void create(ConnectionProvider connectionProvider) {
    try (Connection conn = connectionProvider.getConnection()) {
      create(conn);
    } catch (SQLException e) {
      throw new CommonsStoreException("Failed to create commons schema", e);
    }
  }

  /**
   * Creates the commons tables in the connection's current schema, using the caller's
   * connection.
   */
  public static void create(Connection conn) throws SQLException {
    List<String> statements = statements();
    try (Statement st = conn.createStatement()) {
      for (String sql : statements) {
        st.execute(sql);
      }
    }
    logger.fine("Commons schema ready (" + statements.size() + " statements)");
  }

  static List<String> statements() {
    String script;
    try (InputStream in = CommonsSchema.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
      if (in == null) {
        throw new CommonsStoreException("Schema resource not found: " + SCHEMA_RESOURCE);
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new CommonsStoreException("Failed to read schema resource " + SCHEMA_RESOURCE, e);
    }
    List<String> statements = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String line : script.split("\n")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("--")) {
        continue;
      }
      current.append(trimmed).append(' ');
      if (trimmed.endsWith(";")) {
        String sql = current.toString().trim();
        statements.add(sql.substring(0, sql.length() - 1));
        current.setLength(0);
      }
    }
    return statements;
  }
}
