package wasteland.jdbc.store;

import wasteland.CapabilityUnavailableException;
import wasteland.PreconditionFailedException;
import wasteland.jdbc.ConnectionProvider;
import wasteland.jdbc.JdbcTemplate;
import wasteland.spi.CommonsStoreException;
import wasteland.spi.PushFailedException;
import wasteland.spi.Row;
import wasteland.spi.Statement;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Commons store on a Dolt sql-server, reached over the MySQL protocol.
 *
 * <p>Reads on a branch add {@code AS OF 'branch'} to the queried table. Commits check the
 * branch out in the session, run the statements in one SQL transaction and record them
 * with {@code DOLT_COMMIT}. Remote operations use the Dolt stored procedures against the
 * configured {@code origin} (the rig's fork) and {@code upstream} remotes.
 */
public final class DoltCommonsStore extends AbstractJdbcCommonsStore {
  private static final Logger logger = Logger.getLogger(DoltCommonsStore.class.getName());

  private final String mainBranch;
  private final String originRemote;
  private final String upstreamRemote;
  private final boolean wildWest;
  private final boolean resetMainOnSync;

  private DoltCommonsStore(Builder builder) {
    super(builder.connectionProvider);
    this.mainBranch = builder.mainBranch;
    this.originRemote = builder.originRemote;
    this.upstreamRemote = builder.upstreamRemote;
    this.wildWest = builder.wildWest;
    this.resetMainOnSync = builder.resetMainOnSync;
  }

  public static Builder builder(ConnectionProvider connectionProvider) {
    return new Builder(connectionProvider);
  }

  @Override
  public String name() {
    return "dolt";
  }

  // ---- reads ----

  @Override
  public List<Row> query(String sql, String ref, Object... params) {
    String effective = ref == null || ref.isEmpty() ? sql : injectAsOf(sql, ref);
    try (Connection conn = connectionProvider().getConnection()) {
      return JdbcTemplate.queryRows(conn, effective, params);
    } catch (SQLException e) {
      throw new CommonsStoreException("Failed to query " + describe(ref) + ": " + e.getMessage(), e);
    }
  }

  /**
   * Adds an {@code AS OF} clause after the first table reference of a single-table query.
   */
  static String injectAsOf(String sql, String ref) {
    int fromIdx = sql.toUpperCase(Locale.ROOT).indexOf(" FROM ");
    if (fromIdx < 0) {
      return sql;
    }
    int start = fromIdx + 6;
    while (start < sql.length() && Character.isWhitespace(sql.charAt(start))) {
      start++;
    }
    int end = start;
    while (end < sql.length() && !Character.isWhitespace(sql.charAt(end)) && sql.charAt(end) != ';') {
      end++;
    }
    if (end == start) {
      return sql;
    }
    return sql.substring(0, end) + " AS OF " + literal(ref) + sql.substring(end);
  }

  // ---- commits ----

  @Override
  public void exec(String branch, String commitMessage, boolean signed, List<Statement> statements) {
    Objects.requireNonNull(statements, "statements");
    String target = branch == null || branch.isEmpty() ? mainBranch : branch;
    boolean created = false;
    try (Connection conn = connectionProvider().getConnection()) {
      if (!target.equals(mainBranch) && !branchExists(conn, target)) {
        call(conn, "CALL DOLT_BRANCH(?, ?)", target, mainBranch);
        created = true;
      }
      call(conn, "CALL DOLT_CHECKOUT(?)", target);
      try {
        commit(conn, target, commitMessage, signed, statements);
      } catch (RuntimeException | SQLException e) {
        if (created) {
          dropAfterFailedCommit(conn, target, e);
        }
        throw e;
      } finally {
        call(conn, "CALL DOLT_CHECKOUT(?)", mainBranch);
      }
    } catch (SQLException e) {
      throw new CommonsStoreException("Failed to commit to " + describe(branch) + ": " + e.getMessage(), e);
    }
  }

  private void commit(Connection conn, String target, String commitMessage, boolean signed,
      List<Statement> statements) throws SQLException {
    boolean autoCommit = conn.getAutoCommit();
    conn.setAutoCommit(false);
    try {
      applyStatements(conn, statements);
      call(conn, "CALL DOLT_ADD('-A')");
      try {
        if (signed) {
          call(conn, "CALL DOLT_COMMIT('-S', '-m', ?)", commitMessage);
        } else {
          call(conn, "CALL DOLT_COMMIT('-m', ?)", commitMessage);
        }
      } catch (SQLException e) {
        if (isNothingToCommit(e)) {
          throw new PreconditionFailedException(NOTHING_TO_COMMIT, e);
        }
        throw e;
      }
      conn.commit();
      logger.log(Level.FINE, "Committed to {0}: {1}", new Object[] {target, commitMessage});
    } catch (RuntimeException | SQLException e) {
      rollback(conn, e);
      throw e;
    } finally {
      conn.setAutoCommit(autoCommit);
    }
  }

  private void dropAfterFailedCommit(Connection conn, String branch, Exception failure) {
    try {
      call(conn, "CALL DOLT_CHECKOUT(?)", mainBranch);
      call(conn, "CALL DOLT_BRANCH('-D', ?)", branch);
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to drop branch " + branch + " after a failed commit", e);
      failure.addSuppressed(e);
    }
  }

  static boolean isNothingToCommit(SQLException e) {
    String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
    return message.contains("nothing to commit") || message.contains("no changes added");
  }

  // ---- branches ----

  @Override
  public List<String> branches(String prefix) {
    String wanted = prefix == null ? "" : prefix;
    List<String> result = new ArrayList<>();
    try (Connection conn = connectionProvider().getConnection()) {
      for (String name : JdbcTemplate.query(conn, "SELECT name FROM dolt_branches ORDER BY name",
          rs -> rs.getString("name"))) {
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
      return branchExists(conn, branch);
    } catch (SQLException e) {
      throw new CommonsStoreException("Failed to look up branch " + branch, e);
    }
  }

  private static boolean branchExists(Connection conn, String branch) {
    return !JdbcTemplate.queryRows(conn, "SELECT name FROM dolt_branches WHERE name=?", branch).isEmpty();
  }

  @Override
  public void deleteBranch(String branch) {
    run("delete branch " + branch, conn -> call(conn, "CALL DOLT_BRANCH('-D', ?)", branch));
  }

  @Override
  public void deleteRemoteBranch(String branch) {
    run("delete remote branch " + branch, conn -> call(conn, "CALL DOLT_PUSH(?, ?)", originRemote, ":" + branch));
  }

  /**
   * Merges a branch into main; a conflicting merge is aborted.
   */
  @Override
  public void mergeBranch(String branch) {
    try (Connection conn = connectionProvider().getConnection()) {
      call(conn, "CALL DOLT_CHECKOUT(?)", mainBranch);
      try {
        call(conn, "CALL DOLT_MERGE(?)", branch);
      } catch (SQLException e) {
        String message = e.getMessage() == null ? "" : e.getMessage();
        if (message.toLowerCase(Locale.ROOT).contains("conflict")) {
          abortMerge(conn, e);
          throw new CommonsStoreException(
              "merge conflict on branch " + branch + ": resolve manually or delete the branch", e);
        }
        throw new CommonsStoreException("merging branch " + branch + ": " + message, e);
      }
    } catch (SQLException e) {
      throw new CommonsStoreException("merging branch " + branch + ": " + e.getMessage(), e);
    }
  }

  private static void abortMerge(Connection conn, SQLException failure) {
    try {
      call(conn, "CALL DOLT_MERGE('--abort')");
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to abort merge", e);
      failure.addSuppressed(e);
    }
  }

  // ---- remotes ----

  @Override
  public void pushBranch(String branch, Consumer<String> log) {
    try (Connection conn = connectionProvider().getConnection()) {
      report(call(conn, "CALL DOLT_PUSH('--force', ?, ?)", originRemote, branch), log);
    } catch (SQLException e) {
      throw new CommonsStoreException(
          "dolt push " + originRemote + " " + branch + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void pushMain(Consumer<String> log) {
    pushBranch(mainBranch, log);
  }

  /**
   * Pushes main to the upstream and origin remotes. A rejected push is retried once after
   * pulling from that remote.
   *
   * @throws PushFailedException naming the remotes that could not be pushed, with the
   *     sync log as its backend log
   */
  @Override
  public void pushWithSync(Consumer<String> log) {
    List<String> failures = new ArrayList<>();
    List<String> lines = new ArrayList<>();
    SQLException lastFailure = null;
    Consumer<String> out = line -> {
      lines.add(line);
      log.accept(line);
    };
    try (Connection conn = connectionProvider().getConnection()) {
      call(conn, "CALL DOLT_CHECKOUT(?)", mainBranch);
      for (String remote : List.of(upstreamRemote, originRemote)) {
        try {
          call(conn, "CALL DOLT_PUSH(?, ?)", remote, mainBranch);
        } catch (SQLException pushFailure) {
          out.accept("  Syncing with " + remote + "...");
          try {
            call(conn, "CALL DOLT_PULL(?, ?)", remote, mainBranch);
          } catch (SQLException pullFailure) {
            out.accept("  warning: sync from " + remote + " failed: " + pullFailure.getMessage());
            failures.add(remote);
            lastFailure = pullFailure;
            continue;
          }
          try {
            call(conn, "CALL DOLT_PUSH(?, ?)", remote, mainBranch);
          } catch (SQLException retryFailure) {
            out.accept("  warning: push to " + remote + " failed after sync: " + retryFailure.getMessage());
            failures.add(remote);
            lastFailure = retryFailure;
            continue;
          }
        }
        out.accept("  Pushed to " + remote);
      }
    } catch (SQLException e) {
      throw new CommonsStoreException("push main: " + e.getMessage(), e);
    }
    if (!failures.isEmpty()) {
      throw new PushFailedException("push failed for remotes: " + String.join(", ", failures),
          String.join("\n", lines), lastFailure);
    }
  }

  /**
   * Pulls the upstream into main, or resets main to the upstream when configured to.
   */
  @Override
  public void sync() {
    run("sync from " + upstreamRemote, conn -> {
      call(conn, "CALL DOLT_CHECKOUT(?)", mainBranch);
      if (resetMainOnSync) {
        call(conn, "CALL DOLT_FETCH(?)", upstreamRemote);
        call(conn, "CALL DOLT_RESET('--hard', ?)", upstreamRemote + "/" + mainBranch);
      } else {
        call(conn, "CALL DOLT_PULL(?, ?)", upstreamRemote, mainBranch);
      }
    });
  }

  @Override
  public void checkWildWest() {
    if (!wildWest) {
      throw new CapabilityUnavailableException(
          "wild-west mode requires direct upstream access; switch to PR mode in settings");
    }
  }

  // ---- helpers ----

  @FunctionalInterface
  private interface ConnectionCallback {
    void run(Connection conn) throws SQLException;
  }

  private void run(String what, ConnectionCallback callback) {
    try (Connection conn = connectionProvider().getConnection()) {
      callback.run(conn);
    } catch (SQLException e) {
      throw new CommonsStoreException(what + ": " + e.getMessage(), e);
    }
  }

  private static List<Row> call(Connection conn, String sql, Object... params) throws SQLException {
    return JdbcTemplate.call(conn, sql, params);
  }

  private static void report(List<Row> rows, Consumer<String> log) {
    for (Row row : rows) {
      String message = row.getString("message");
      if (!message.isEmpty()) {
        log.accept(message);
      }
    }
  }

  private static String literal(String value) {
    return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
  }

  public static final class Builder {
    private final ConnectionProvider connectionProvider;
    private String mainBranch = "main";
    private String originRemote = "origin";
    private String upstreamRemote = "upstream";
    private boolean wildWest = true;
    private boolean resetMainOnSync;

    private Builder(ConnectionProvider connectionProvider) {
      this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    }

    public Builder mainBranch(String mainBranch) {
      this.mainBranch = requireName(mainBranch, "mainBranch");
      return this;
    }

    /**
     * Remote holding the rig's fork; mutation branches are pushed here.
     */
    public Builder originRemote(String originRemote) {
      this.originRemote = requireName(originRemote, "originRemote");
      return this;
    }

    public Builder upstreamRemote(String upstreamRemote) {
      this.upstreamRemote = requireName(upstreamRemote, "upstreamRemote");
      return this;
    }

    /**
     * Whether this database may push main to the upstream directly. Defaults to {@code true}.
     */
    public Builder wildWest(boolean wildWest) {
      this.wildWest = wildWest;
      return this;
    }

    /**
     * Reset main to the upstream on sync instead of pulling, for pr-mode forks whose main
     * only mirrors the upstream.
     */
    public Builder resetMainOnSync(boolean resetMainOnSync) {
      this.resetMainOnSync = resetMainOnSync;
      return this;
    }

    public DoltCommonsStore build() {
      return new DoltCommonsStore(this);
    }

    private static String requireName(String value, String name) {
      if (value == null || value.isEmpty()) {
        throw new IllegalArgumentException(name + " cannot be empty");
      }
      return value;
    }
  }
}
