package wasteland.jdbc.store;

import wasteland.CapabilityUnavailableException;
import wasteland.PreconditionFailedException;
import wasteland.jdbc.DataSourceConnectionProvider;
import wasteland.spi.CommonsStoreException;
import wasteland.spi.Row;
import wasteland.spi.Statement;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class H2CommonsStoreTest {
  private static final String BRANCH = "wl/bob/w-1";

  private H2CommonsStore store;

  @BeforeEach
  void setup() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    store = new H2CommonsStore(new DataSourceConnectionProvider(ds)).initialize();
    store.exec("", "seed", false, List.of(
        insertItem("w-1", "Fix bug"),
        insertItem("w-2", "Write docs")));
  }

  @Test
  void execCommitsToMainAndRecordsMessage() {
    store.exec("", "wl claim: w-1", false, List.of(claim("w-1", "bob")));

    assertEquals("claimed", status("w-1", ""));
    assertEquals(List.of("seed", "wl claim: w-1"), store.commitMessages(""));
  }

  @Test
  void failedGuardRollsBackEveryStatement() {
    List<Statement> statements = List.of(
        Statement.of("UPDATE wanted SET title='changed' WHERE id=?", "w-2"),
        Statement.guarded("w-1 is not claimed", "UPDATE wanted SET status='open' WHERE id=? AND status='claimed'",
            "w-1"));

    PreconditionFailedException ex = assertThrows(PreconditionFailedException.class,
        () -> store.exec("", "bad", false, statements));

    assertEquals("w-1 is not claimed", ex.getMessage());
    assertEquals("Write docs", store.query("SELECT title FROM wanted WHERE id=?", "", "w-2").get(0).getString("title"));
    assertEquals(List.of("seed"), store.commitMessages(""));
  }

  @Test
  void commitThatChangesNothingFails() {
    PreconditionFailedException ex = assertThrows(PreconditionFailedException.class,
        () -> store.exec("", "noop", false, List.of(Statement.of("DELETE FROM wanted WHERE id=?", "missing"))));

    assertEquals(AbstractJdbcCommonsStore.NOTHING_TO_COMMIT, ex.getMessage());
  }

  @Test
  void branchCommitIsIsolatedFromMain() {
    store.exec(BRANCH, "wl claim: w-1", false, List.of(claim("w-1", "bob")));

    assertTrue(store.branchExists(BRANCH));
    assertEquals("claimed", status("w-1", BRANCH));
    assertEquals("open", status("w-1", ""));
    assertEquals(List.of("wl claim: w-1"), store.commitMessages(BRANCH));
    assertEquals(List.of("seed"), store.commitMessages(""));
  }

  @Test
  void branchSeesMainStateAtCreation() {
    store.createBranch(BRANCH);
    store.exec("", "wl claim: w-2", false, List.of(claim("w-2", "carol")));

    assertEquals(2, store.query("SELECT id FROM wanted", BRANCH).size());
    assertEquals("open", status("w-2", BRANCH));
  }

  @Test
  void failedCommitDropsBranchItCreated() {
    assertThrows(PreconditionFailedException.class,
        () -> store.exec(BRANCH, "wl unclaim: w-1", false, List.of(
            Statement.guarded("not claimed", "UPDATE wanted SET status='open' WHERE id=? AND status='claimed'",
                "w-1"))));

    assertFalse(store.branchExists(BRANCH));
  }

  @Test
  void failedCommitKeepsExistingBranch() {
    store.exec(BRANCH, "wl claim: w-1", false, List.of(claim("w-1", "bob")));

    assertThrows(PreconditionFailedException.class,
        () -> store.exec(BRANCH, "wl claim: w-1", false, List.of(claim("w-1", "carol"))));

    assertTrue(store.branchExists(BRANCH));
    assertEquals("bob", store.query("SELECT claimed_by FROM wanted WHERE id=?", BRANCH, "w-1")
        .get(0).getString("claimed_by"));
  }

  @Test
  void branchesFiltersByPrefix() {
    store.createBranch("wl/bob/w-1");
    store.createBranch("wl/bob/w-2");
    store.createBranch("wl/carol/w-1");

    assertEquals(List.of("wl/bob/w-1", "wl/bob/w-2"), store.branches("wl/bob/"));
    assertEquals(3, store.branches("wl/").size());
    assertEquals(3, store.branches("").size());
  }

  @Test
  void branchExistsIsFalseForMainAndUnknown() {
    assertFalse(store.branchExists(""));
    assertFalse(store.branchExists("wl/nobody/w-9"));
  }

  @Test
  void queryOnUnknownBranchFails() {
    CommonsStoreException ex = assertThrows(CommonsStoreException.class,
        () -> store.query("SELECT id FROM wanted", "wl/nobody/w-9"));
    assertTrue(ex.getMessage().contains("branch not found"));
  }

  @Test
  void deleteBranchRemovesIt() {
    store.createBranch(BRANCH);

    store.deleteBranch(BRANCH);

    assertFalse(store.branchExists(BRANCH));
    assertTrue(store.branches("wl/").isEmpty());
    assertThrows(CommonsStoreException.class, () -> store.deleteBranch(BRANCH));
  }

  @Test
  void mergeAppliesBranchChangesToMain() {
    store.exec(BRANCH, "wl claim: w-1", false, List.of(
        claim("w-1", "bob"),
        Statement.of("INSERT INTO completions (id, wanted_id, completed_by) VALUES (?, ?, ?)", "c-1", "w-1", "bob")));

    store.mergeBranch(BRANCH);

    assertEquals("claimed", status("w-1", ""));
    assertEquals(1, store.query("SELECT id FROM completions WHERE wanted_id=?", "", "w-1").size());
    assertEquals("Merge branch '" + BRANCH + "'", last(store.commitMessages("")));
  }

  @Test
  void mergeKeepsUnrelatedMainChanges() {
    store.exec(BRANCH, "wl claim: w-1", false, List.of(claim("w-1", "bob")));
    store.exec("", "wl claim: w-2", false, List.of(claim("w-2", "carol")));

    store.mergeBranch(BRANCH);

    assertEquals("claimed", status("w-1", ""));
    assertEquals("carol", store.query("SELECT claimed_by FROM wanted WHERE id=?", "", "w-2")
        .get(0).getString("claimed_by"));
  }

  @Test
  void mergeAppliesRowsDeletedOnBranch() {
    store.exec(BRANCH, "wl discard: w-2", false, List.of(Statement.of("DELETE FROM wanted WHERE id=?", "w-2")));

    store.mergeBranch(BRANCH);

    assertTrue(store.query("SELECT id FROM wanted WHERE id=?", "", "w-2").isEmpty());
  }

  @Test
  void conflictingMergeFailsAndLeavesMainUntouched() {
    store.exec(BRANCH, "wl claim: w-1", false, List.of(claim("w-1", "bob")));
    store.exec("", "wl claim: w-1", false, List.of(claim("w-1", "carol")));

    CommonsStoreException ex = assertThrows(CommonsStoreException.class, () -> store.mergeBranch(BRANCH));

    assertTrue(ex.getMessage().startsWith("merge conflict on branch " + BRANCH));
    assertTrue(ex.getMessage().endsWith("resolve manually or delete the branch"));
    assertEquals("carol", store.query("SELECT claimed_by FROM wanted WHERE id=?", "", "w-1")
        .get(0).getString("claimed_by"));
    assertTrue(store.branchExists(BRANCH));
  }

  @Test
  void pushesOnlyLog() {
    List<String> log = new ArrayList<>();
    store.createBranch(BRANCH);

    store.pushBranch(BRANCH, log::add);
    store.pushWithSync(log::add);
    store.sync();

    assertEquals(2, log.size());
    assertTrue(log.get(0).contains("no remotes"));
    assertThrows(CommonsStoreException.class, () -> store.pushBranch("wl/nobody/w-9", log::add));
  }

  @Test
  void wildWestCanBeDisabled() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    H2CommonsStore prOnly = new H2CommonsStore(new DataSourceConnectionProvider(ds), false).initialize();

    store.checkWildWest();
    CapabilityUnavailableException ex = assertThrows(CapabilityUnavailableException.class, prOnly::checkWildWest);
    assertTrue(ex.getMessage().contains("switch to PR mode"));
  }

  @Test
  void schemaNamesAreStablePerBranch() {
    assertEquals(H2CommonsStore.schemaName(BRANCH), H2CommonsStore.schemaName(BRANCH));
    assertNotEquals(H2CommonsStore.schemaName("wl/bob/w-1"), H2CommonsStore.schemaName("wl/bob/w-2"));
    assertTrue(H2CommonsStore.schemaName(BRANCH).matches("WL_[0-9A-F]{16}"));
  }

  private String status(String id, String ref) {
    List<Row> rows = store.query("SELECT status FROM wanted WHERE id=?", ref, id);
    return rows.isEmpty() ? null : rows.get(0).getString("status");
  }

  private static Statement insertItem(String id, String title) {
    return Statement.of("INSERT INTO wanted (id, title, posted_by, status) VALUES (?, ?, 'alice', 'open')", id, title);
  }

  private static Statement claim(String id, String rig) {
    return Statement.guarded(id + " is not open",
        "UPDATE wanted SET claimed_by=?, status='claimed' WHERE id=? AND status='open'", rig, id);
  }

  private static String last(List<String> values) {
    return values.get(values.size() - 1);
  }
}
