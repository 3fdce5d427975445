package wasteland.jdbc.store;

import wasteland.CapabilityUnavailableException;
import wasteland.PreconditionFailedException;
import wasteland.jdbc.CommonsSchema;
import wasteland.jdbc.ConnectionProvider;
import wasteland.jdbc.JdbcTemplate;
import wasteland.spi.CommonsStoreException;
import wasteland.spi.Row;
import wasteland.spi.Statement;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Embedded commons store on H2, for offline use and tests.
 *
 * <p>Main is the connection's default schema. Each branch is a schema holding copies of
 * the commons tables plus a {@code base_} snapshot of each, taken when the branch was
 * created. Merging applies the rows the branch changed since its base onto main and
 * fails on rows main changed differently in the meantime.
 *
 * <p>There are no remotes: pushes, remote deletes and syncs only log.
 */
public final class H2CommonsStore extends AbstractJdbcCommonsStore {
  private static final Logger logger = Logger.getLogger(H2CommonsStore.class.getName());

  private static final List<String> TABLES = List.of("wanted", "completions", "stamps");
  private static final String BASE_PREFIX = "base_";
  private static final String NO_REMOTES = "H2 commons store has no remotes";

  private final boolean wildWest;
  private final Object ddlLock = new Object();
  private volatile String mainSchema;

  public H2CommonsStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, true);
  }

  /**
   * @param wildWest whether direct commits to main are allowed
   */
  public H2CommonsStore(ConnectionProvider connectionProvider, boolean wildWest) {
    super(connectionProvider);
    this.wildWest = wildWest;
  }

  @Override
  public String name() {
    return "h2";
  }

  /**
   * Creates the commons tables, the branch registry and the commit log on main.
   * Idempotent.
   *
   * @return this store
   */
  public H2CommonsStore initialize() {
    try (Connection conn = connectionProvider().getConnection()) {
      String main = mainSchema(conn);
      conn.setSchema(main);
      CommonsSchema.create(conn);
      try (java.sql.Statement st = conn.createStatement()) {
        st.execute("CREATE TABLE IF NOT EXISTS wl_branches ("
            + "name VARCHAR(255) PRIMARY KEY,"
            + "schema_name VARCHAR(64) NOT NULL,"
            + "created_at TIMESTAMP NOT NULL)");
        st.execute("CREATE TABLE IF NOT EXISTS wl_commits ("
            + "id BIGINT AUTO_INCREMENT PRIMARY KEY,"
            + "branch VARCHAR(255) NOT NULL,"
            + "message VARCHAR(4000) NOT NULL,"
            + "signed BOOLEAN NOT NULL,"
            + "rows_changed INT NOT NULL,"
            + "committed_at TIMESTAMP NOT NULL)");
      }
    } catch (SQLException e) {
      throw new CommonsStoreException("Failed to initialize H2 commons store", e);
    }
    return this;
  }

  // ---- reads ----

  @Override
  public List<Row> query(String sql, String ref, Object... params) {
    try (Connection conn = connectionProvider().getConnection()) {
      String main = mainSchema(conn);
      conn.setSchema(schemaOf(conn, ref));
      try {
        return JdbcTemplate.queryRows(conn, sql, params);
      } finally {
        conn.setSchema(main);
      }
    } catch (SQLException e) {
      throw new CommonsStoreException("Failed to query " + describe(ref) + ": " + e.getMessage(), e);
    }
  }

  /**
   * Returns the messages of the commits made to a branch ({@code ""} for main), oldest
   * first.
   */
  public List<String> commitMessages(String branch) {
    try (Connection conn = connectionProvider().getConnection()) {
      return JdbcTemplate.query(conn,
          "SELECT message FROM " + qualified(conn, "wl_commits") + " WHERE branch=? ORDER BY id",
          rs -> rs.getString("message"), branch == null ? "" : branch);
    } catch (SQLException e) {
      throw new CommonsStoreException("Failed to read commit log", e);
    }
  }

  // ---- commits ----

  @Override
  public void exec(String branch, String commitMessage, boolean signed, List<Statement> statements) {
    Objects.requireNonNull(statements, "statements");
    String target = branch == null ? "" : branch;
    boolean created = false;
    if (!target.isEmpty() && !branchExists(target)) {
      createBranch(target);
      created = true;
    }
    try {
      commit(target, commitMessage, signed, statements);
    } catch (RuntimeException e) {
      if (created) {
        dropAfterFailedCommit(target, e);
      }
      throw e;
    }
  }

  private void commit(String target, String commitMessage, boolean signed, List<Statement> statements) {
    try (Connection conn = connectionProvider().getConnection()) {
      String main = mainSchema(conn);
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        conn.setSchema(schemaOf(conn, target));
        int changed = applyStatements(conn, statements);
        if (changed == 0) {
          throw new PreconditionFailedException(NOTHING_TO_COMMIT);
        }
        recordCommit(conn, main, target, commitMessage, signed, changed);
        conn.commit();
        logger.log(Level.FINE, "Committed {0} row(s) to {1}: {2}",
            new Object[] {changed, describe(target), commitMessage});
      } catch (RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        conn.setSchema(main);
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new CommonsStoreException("Failed to commit to " + describe(target) + ": " + e.getMessage(), e);
    }
  }

  private void dropAfterFailedCommit(String branch, RuntimeException failure) {
    try {
      deleteBranch(branch);
    } catch (CommonsStoreException e) {
      logger.log(Level.WARNING, "Failed to drop branch " + branch + " after a failed commit", e);
      failure.addSuppressed(e);
    }
  }

  private static void recordCommit(
      Connection conn, String main, String branch, String message, boolean signed, int changed) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + quote(main) + ".wl_commits (branch, message, signed, rows_changed, committed_at)"
            + " VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP)",
        branch, message == null ? "" : message, signed, changed);
  }

  // ---- branches ----

  /**
   * Creates a branch from the current state of main. Does nothing if it already exists.
   */
  public void createBranch(String branch) {
    if (branch == null || branch.isEmpty()) {
      throw new IllegalArgumentException("branch cannot be empty");
    }
    synchronized (ddlLock) {
      try (Connection conn = connectionProvider().getConnection()) {
        String main = mainSchema(conn);
        if (lookupSchema(conn, branch) != null) {
          return;
        }
        String schema = schemaName(branch);
        try (java.sql.Statement st = conn.createStatement()) {
          st.execute("CREATE SCHEMA IF NOT EXISTS " + quote(schema));
        }
        conn.setSchema(schema);
        try {
          CommonsSchema.create(conn);
          try (java.sql.Statement st = conn.createStatement()) {
            for (String table : TABLES) {
              st.execute("INSERT INTO " + table + " SELECT * FROM " + quote(main) + "." + table);
              st.execute("CREATE TABLE " + BASE_PREFIX + table + " AS SELECT * FROM " + table);
            }
          }
        } finally {
          conn.setSchema(main);
        }
        JdbcTemplate.update(conn,
            "INSERT INTO wl_branches (name, schema_name, created_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
            branch, schema);
        logger.log(Level.FINE, "Created branch {0} in schema {1}", new Object[] {branch, schema});
      } catch (SQLException e) {
        throw new CommonsStoreException("Failed to create branch " + branch + ": " + e.getMessage(), e);
      }
    }
  }

  @Override
  public List<String> branches(String prefix) {
    String wanted = prefix == null ? "" : prefix;
    List<String> result = new ArrayList<>();
    try (Connection conn = connectionProvider().getConnection()) {
      List<String> names = JdbcTemplate.query(conn,
          "SELECT name FROM " + qualified(conn, "wl_branches") + " ORDER BY name", rs -> rs.getString("name"));
      for (String name : names) {
        if (name.startsWith(wanted)) {
          result.add(name);
        }
      }
    } catch (SQLException e) {
      throw new CommonsStoreException("Failed to list branches", e);
    }
    return result;
  }

  @Override
  public boolean branchExists(String branch) {
    if (branch == null || branch.isEmpty()) {
      return false;
    }
    try (Connection conn = connectionProvider().getConnection()) {
      return lookupSchema(conn, branch) != null;
    } catch (SQLException e) {
      throw new CommonsStoreException("Failed to look up branch " + branch, e);
    }
  }

  @Override
  public void deleteBranch(String branch) {
    synchronized (ddlLock) {
      try (Connection conn = connectionProvider().getConnection()) {
        String schema = lookupSchema(conn, branch);
        if (schema == null) {
          throw new CommonsStoreException("branch not found: " + branch);
        }
        try (java.sql.Statement st = conn.createStatement()) {
          st.execute("DROP SCHEMA IF EXISTS " + quote(schema) + " CASCADE");
        }
        JdbcTemplate.update(conn, "DELETE FROM " + qualified(conn, "wl_branches") + " WHERE name=?", branch);
        logger.log(Level.FINE, "Deleted branch {0}", branch);
      } catch (SQLException e) {
        throw new CommonsStoreException("Failed to delete branch " + branch + ": " + e.getMessage(), e);
      }
    }
  }

  @Override
  public void deleteRemoteBranch(String branch) {
    logger.log(Level.FINE, "{0}; remote branch {1} not deleted", new Object[] {NO_REMOTES, branch});
  }

  /**
   * Merges the rows a branch changed since its creation into main, in one transaction.
   *
   * @throws CommonsStoreException if main changed one of those rows differently
   */
  @Override
  public void mergeBranch(String branch) {
    try (Connection conn = connectionProvider().getConnection()) {
      String main = mainSchema(conn);
      String schema = lookupSchema(conn, branch);
      if (schema == null) {
        throw new CommonsStoreException("branch not found: " + branch);
      }
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        int changed = 0;
        for (String table : TABLES) {
          changed += mergeTable(conn, main, schema, table, branch);
        }
        if (changed > 0) {
          recordCommit(conn, main, "", "Merge branch '" + branch + "'", false, changed);
        }
        conn.commit();
        logger.log(Level.FINE, "Merged {0} row(s) from {1}", new Object[] {changed, branch});
      } catch (RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new CommonsStoreException("merging branch " + branch + ": " + e.getMessage(), e);
    }
  }

  private static int mergeTable(Connection conn, String main, String schema, String table, String branch) {
    Map<String, Row> base = byId(JdbcTemplate.queryRows(conn,
        "SELECT * FROM " + quote(schema) + "." + BASE_PREFIX + table));
    Map<String, Row> theirs = byId(JdbcTemplate.queryRows(conn, "SELECT * FROM " + quote(schema) + "." + table));
    Map<String, Row> ours = byId(JdbcTemplate.queryRows(conn, "SELECT * FROM " + quote(main) + "." + table));
    String target = quote(main) + "." + table;
    int changed = 0;
    for (Map.Entry<String, Row> entry : theirs.entrySet()) {
      Row before = base.get(entry.getKey());
      Row after = entry.getValue();
      if (sameRow(after, before)) {
        continue;
      }
      Row current = ours.get(entry.getKey());
      if (!sameRow(current, before) && !sameRow(current, after)) {
        throw conflict(branch, table, entry.getKey());
      }
      if (!sameRow(current, after)) {
        upsert(conn, target, after, current != null);
        changed++;
      }
    }
    for (Map.Entry<String, Row> entry : base.entrySet()) {
      if (theirs.containsKey(entry.getKey())) {
        continue;
      }
      Row current = ours.get(entry.getKey());
      if (current == null) {
        continue;
      }
      if (!sameRow(current, entry.getValue())) {
        throw conflict(branch, table, entry.getKey());
      }
      JdbcTemplate.update(conn, "DELETE FROM " + target + " WHERE id=?", entry.getKey());
      changed++;
    }
    return changed;
  }

  private static void upsert(Connection conn, String target, Row row, boolean exists) {
    List<String> columns = new ArrayList<>(row.asMap().keySet());
    List<Object> values = new ArrayList<>();
    StringBuilder sql = new StringBuilder();
    if (exists) {
      sql.append("UPDATE ").append(target).append(" SET ");
      for (int i = 0; i < columns.size(); i++) {
        sql.append(i > 0 ? ", " : "").append(columns.get(i)).append("=?");
        values.add(row.get(columns.get(i)));
      }
      sql.append(" WHERE id=?");
      values.add(row.get("id"));
    } else {
      sql.append("INSERT INTO ").append(target).append(" (").append(String.join(", ", columns)).append(") VALUES (");
      for (int i = 0; i < columns.size(); i++) {
        sql.append(i > 0 ? ", ?" : "?");
        values.add(row.get(columns.get(i)));
      }
      sql.append(')');
    }
    JdbcTemplate.update(conn, sql.toString(), values.toArray());
  }

  private static CommonsStoreException conflict(String branch, String table, String id) {
    return new CommonsStoreException("merge conflict on branch " + branch + " (" + table + " row " + id
        + "): resolve manually or delete the branch");
  }

  private static Map<String, Row> byId(List<Row> rows) {
    Map<String, Row> result = new LinkedHashMap<>();
    for (Row row : rows) {
      result.put(row.getString("id"), row);
    }
    return result;
  }

  private static boolean sameRow(Row a, Row b) {
    if (a == null || b == null) {
      return a == b;
    }
    return a.asMap().equals(b.asMap());
  }

  // ---- remotes ----

  @Override
  public void pushBranch(String branch, Consumer<String> log) {
    if (!branchExists(branch)) {
      throw new CommonsStoreException("branch not found: " + branch);
    }
    log.accept(NO_REMOTES + "; branch " + branch + " kept locally");
  }

  @Override
  public void pushMain(Consumer<String> log) {
    log.accept(NO_REMOTES + "; main kept locally");
  }

  @Override
  public void pushWithSync(Consumer<String> log) {
    log.accept(NO_REMOTES + "; main kept locally");
  }

  @Override
  public void sync() {
    logger.log(Level.FINE, "{0}; nothing to sync", NO_REMOTES);
  }

  @Override
  public void checkWildWest() {
    if (!wildWest) {
      throw new CapabilityUnavailableException(
          "wild-west mode requires direct upstream access; switch to PR mode in settings");
    }
  }

  // ---- schemas ----

  private String mainSchema(Connection conn) throws SQLException {
    String schema = mainSchema;
    if (schema == null) {
      schema = conn.getSchema();
      mainSchema = schema;
    }
    return schema;
  }

  private String qualified(Connection conn, String table) throws SQLException {
    return quote(mainSchema(conn)) + "." + table;
  }

  private String schemaOf(Connection conn, String ref) throws SQLException {
    if (ref == null || ref.isEmpty()) {
      return mainSchema(conn);
    }
    String schema = lookupSchema(conn, ref);
    if (schema == null) {
      throw new CommonsStoreException("branch not found: " + ref);
    }
    return schema;
  }

  private String lookupSchema(Connection conn, String branch) throws SQLException {
    List<String> schemas = JdbcTemplate.query(conn,
        "SELECT schema_name FROM " + qualified(conn, "wl_branches") + " WHERE name=?",
        rs -> rs.getString("schema_name"), branch);
    return schemas.isEmpty() ? null : schemas.get(0);
  }

  static String schemaName(String branch) {
    byte[] digest;
    try {
      digest = MessageDigest.getInstance("SHA-256").digest(branch.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
    StringBuilder sb = new StringBuilder("WL_");
    for (int i = 0; i < 8; i++) {
      sb.append(String.format(Locale.ROOT, "%02X", digest[i]));
    }
    return sb.toString();
  }

  private static String quote(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }
}
