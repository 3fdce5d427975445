package wasteland.jdbc;

import wasteland.AcceptInput;
import wasteland.ClientConfig;
import wasteland.DetailResult;
import wasteland.ItemNotFoundException;
import wasteland.Mode;
import wasteland.MutationResult;
import wasteland.PostInput;
import wasteland.PreconditionFailedException;
import wasteland.WastelandClient;
import wasteland.jdbc.store.H2CommonsStore;
import wasteland.lifecycle.Transition;
import wasteland.model.BrowseFilter;
import wasteland.model.WantedStatus;
import wasteland.model.WantedSummary;
import wasteland.model.WantedUpdate;
import wasteland.resolve.BranchAction;
import wasteland.spi.Row;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full item lifecycles through {@link WastelandClient} on an H2 commons.
 */
class WantedBoardAcceptanceTest {
  private H2CommonsStore store;
  private WastelandClient alice;
  private WastelandClient bob;

  @BeforeEach
  void setup() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    store = new H2CommonsStore(new DataSourceConnectionProvider(ds)).initialize();
    alice = client("alice", Mode.WILD_WEST);
    bob = client("bob", Mode.WILD_WEST);
  }

  // ---- wild-west lifecycle ----

  @Test
  void postedItemIsOpenAndBrowsable() {
    MutationResult posted = alice.post(PostInput.builder("Fix bug").project("gastown").type("bug").build());

    DetailResult detail = posted.detail();
    assertEquals(WantedStatus.OPEN, detail.item().status());
    assertEquals("alice", detail.item().postedBy());
    assertEquals("", posted.branch());

    List<WantedSummary> items = alice.browse(BrowseFilter.all()).items();
    assertEquals(1, items.size());
    assertEquals(detail.item().id(), items.get(0).id());
    assertEquals(WantedStatus.OPEN, items.get(0).status());
  }

  @Test
  void claimShowsRoleSpecificActions() {
    String id = postItem();

    MutationResult claimed = bob.claim(id);

    assertEquals(WantedStatus.CLAIMED, claimed.detail().item().status());
    assertEquals("bob", claimed.detail().item().claimedBy());
    assertEquals(List.of(Transition.UNCLAIM), alice.detail(id).actions());
    assertEquals(List.of(Transition.UNCLAIM, Transition.DONE), bob.detail(id).actions());
  }

  @Test
  void doneRecordsCompletionForReview() {
    String id = postItem();
    bob.claim(id);

    MutationResult done = bob.done(id, "https://example.test/pr/7");

    assertEquals(WantedStatus.IN_REVIEW, done.detail().item().status());
    assertNotNull(done.detail().completion());
    assertEquals("bob", done.detail().completion().completedBy());
    assertEquals("https://example.test/pr/7", done.detail().completion().evidence());
    assertEquals(List.of(Transition.ACCEPT, Transition.REJECT, Transition.CLOSE), alice.detail(id).actions());
  }

  @Test
  void acceptIssuesStampForCompleter() {
    String id = postItem();
    bob.claim(id);
    bob.done(id, "https://example.test/pr/7");

    MutationResult accepted = alice.accept(id, AcceptInput.of(5, 5));

    DetailResult detail = accepted.detail();
    assertEquals(WantedStatus.COMPLETED, detail.item().status());
    assertNotNull(detail.stamp());
    assertEquals("alice", detail.stamp().author());
    assertEquals("bob", detail.stamp().subject());
    assertEquals(5, detail.stamp().quality());
    assertEquals("alice", detail.completion().validatedBy());
    assertTrue(detail.actions().isEmpty());
  }

  @Test
  void rejectDropsCompletionAndReturnsToClaimed() {
    String id = postItem();
    bob.claim(id);
    bob.done(id, "https://example.test/pr/7");

    MutationResult rejected = alice.reject(id, "needs work");

    assertEquals(WantedStatus.CLAIMED, rejected.detail().item().status());
    assertEquals("bob", rejected.detail().item().claimedBy());
    assertNull(rejected.detail().completion());
    assertTrue(store.query("SELECT id FROM completions WHERE wanted_id=?", "", id).isEmpty());
    assertEquals("wl reject: " + id + " — needs work", last(store.commitMessages("")));
  }

  @Test
  void failedPreconditionLeavesStatusUnchanged() {
    String id = postItem();
    bob.claim(id);
    int commits = store.commitMessages("").size();

    WastelandClient carol = client("carol", Mode.WILD_WEST);
    PreconditionFailedException ex = assertThrows(PreconditionFailedException.class, () -> carol.claim(id));

    assertTrue(ex.getMessage().contains("is not open"));
    assertEquals("claimed", mainStatus(id));
    assertEquals("bob", store.query("SELECT claimed_by FROM wanted WHERE id=?", "", id).get(0).getString("claimed_by"));
    assertEquals(commits, store.commitMessages("").size());
  }

  @Test
  void selfAcceptIsRejected() {
    String id = postItem();
    alice.claim(id);
    alice.done(id, "https://example.test/pr/8");

    assertThrows(PreconditionFailedException.class, () -> alice.accept(id, AcceptInput.of(5, 5)));
    assertEquals("in_review", mainStatus(id));
  }

  @Test
  void detailOfUnknownItemFails() {
    assertThrows(ItemNotFoundException.class, () -> alice.detail("w-missing"));
  }

  // ---- pr mode ----

  @Test
  void prClaimStaysOnBranchUntilApplied() {
    String id = postItem();
    WastelandClient bobPr = client("bob", Mode.PR);

    MutationResult claimed = bobPr.claim(id);

    String branch = "wl/bob/" + id;
    assertEquals(branch, claimed.branch());
    assertEquals("claim", claimed.detail().delta());
    assertEquals(WantedStatus.OPEN, claimed.detail().mainStatus());
    assertEquals(List.of(BranchAction.SUBMIT_PR, BranchAction.DISCARD), claimed.detail().branchActions());
    assertEquals("open", mainStatus(id));
    assertEquals("claimed", store.query("SELECT status FROM wanted WHERE id=?", branch, id).get(0).getString("status"));

    bobPr.applyBranch(branch);

    assertEquals("claimed", mainStatus(id));
    assertFalse(store.branches("wl/").contains(branch));
    DetailResult after = bobPr.detail(id);
    assertEquals("", after.branch());
    assertEquals(WantedStatus.CLAIMED, after.item().status());
  }

  @Test
  void prMutationNeverTouchesMain() {
    String id = postItem();
    WastelandClient bobPr = client("bob", Mode.PR);
    int commits = store.commitMessages("").size();

    bobPr.claim(id);
    bobPr.done(id, "https://example.test/pr/9");

    assertEquals("open", mainStatus(id));
    assertEquals(commits, store.commitMessages("").size());
    assertTrue(store.query("SELECT id FROM completions WHERE wanted_id=?", "", id).isEmpty());
    assertEquals(WantedStatus.OPEN, alice.detail(id).item().status());
  }

  @Test
  void deltaCountsHopsFromMain() {
    WastelandClient alicePr = client("alice", Mode.PR);
    WastelandClient bobPr = client("bob", Mode.PR);

    MutationResult posted = alicePr.post(PostInput.builder("Branch only").build());
    assertEquals("new", posted.detail().delta());

    String id = postItem();
    bobPr.claim(id);
    MutationResult done = bobPr.done(id, "https://example.test/pr/9");

    assertEquals("changes", done.detail().delta());
    assertEquals(List.of(Transition.CLAIM, Transition.DONE), bobPr.resolve(id).path());
  }

  @Test
  void claimThenUnclaimCleansUpBranch() {
    String id = postItem();
    WastelandClient bobPr = client("bob", Mode.PR);
    bobPr.claim(id);

    MutationResult reverted = bobPr.unclaim(id);

    assertEquals("", reverted.branch());
    assertEquals("", reverted.detail().branch());
    assertEquals("", reverted.detail().delta());
    assertTrue(reverted.detail().branchActions().isEmpty());
    assertEquals("reverted — branch cleaned up", reverted.hint());
    assertTrue(store.branches("wl/").isEmpty());
    assertTrue(bobPr.browse(BrowseFilter.builder().view(BrowseFilter.View.ALL).build()).pendingIds().isEmpty());
  }

  @Test
  void deletingBranchOnlyItemDeletesBranchWithoutCommit() {
    WastelandClient alicePr = client("alice", Mode.PR);
    MutationResult posted = alicePr.post(PostInput.builder("Draft idea").build());
    String id = posted.detail().item().id();
    String branch = posted.branch();
    assertTrue(store.branchExists(branch));
    int branchCommits = store.commitMessages(branch).size();

    MutationResult deleted = alicePr.delete(id);

    assertNull(deleted.detail());
    assertFalse(deleted.hint().isEmpty());
    assertFalse(store.branchExists(branch));
    assertEquals(branchCommits, store.commitMessages(branch).size());
    assertTrue(store.commitMessages("").isEmpty());
  }

  @Test
  void replayedClaimIsNotAppliedTwice() {
    String id = postItem();
    WastelandClient bobPr = client("bob", Mode.PR);

    MutationResult first = bobPr.claim(id);
    MutationResult replay = bobPr.claim(id);

    assertEquals(first.branch(), replay.branch());
    assertEquals(first.detail().item(), replay.detail().item());
    assertEquals("bob", replay.detail().item().claimedBy());
    assertEquals(1, store.commitMessages(first.branch()).size());
  }

  @Test
  void prUpdateOfDraftCommitsOnBranch() {
    WastelandClient alicePr = client("alice", Mode.PR);
    MutationResult posted = alicePr.post(PostInput.builder("Draft").build());
    String id = posted.detail().item().id();

    MutationResult updated = alicePr.update(id, WantedUpdate.builder().title("Renamed").build());

    assertEquals("Renamed", updated.detail().item().title());
    assertEquals("new", updated.detail().delta());
    assertEquals(List.of("wl post: " + id, "wl update: " + id), store.commitMessages(posted.branch()));
  }

  @Test
  void prUpdateAfterUnclaimOnBranchIsApplied() {
    String id = postItem();
    bob.claim(id);
    WastelandClient bobPr = client("bob", Mode.PR);
    bobPr.unclaim(id);

    MutationResult updated = bobPr.update(id, WantedUpdate.builder().title("Renamed").build());

    assertEquals("Renamed", updated.detail().item().title());
    assertEquals(WantedStatus.OPEN, updated.detail().item().status());
    assertEquals("claimed", mainStatus(id));
    assertEquals(2, store.commitMessages(updated.branch()).size());
  }

  @Test
  void prUpdateOfMainItemIsLabeledChanges() {
    String id = postItem();
    WastelandClient alicePr = client("alice", Mode.PR);

    MutationResult updated = alicePr.update(id, WantedUpdate.builder().title("Renamed").build());

    assertEquals("changes", updated.detail().delta());
    assertEquals("Renamed", updated.detail().item().title());
    assertEquals("Renamed", store.query("SELECT title FROM wanted WHERE id=?", updated.branch(), id)
        .get(0).getString("title"));
  }

  @Test
  void browseOverlaysPendingBranchStatus() {
    String id = postItem();
    WastelandClient bobPr = client("bob", Mode.PR);
    bobPr.claim(id);

    List<WantedSummary> mine = bobPr.browse(BrowseFilter.all()).items();
    assertEquals(WantedStatus.CLAIMED, mine.get(0).status());

    List<WantedSummary> open = bobPr.browse(BrowseFilter.builder().status(WantedStatus.OPEN).build()).items();
    assertTrue(open.isEmpty());

    assertEquals(1, (int) alice.browse(BrowseFilter.builder().view(BrowseFilter.View.ALL).build())
        .pendingIds().get(id));
  }

  @Test
  void dashboardFilesBranchItemsUnderBranchStatus() {
    String id = postItem();
    WastelandClient bobPr = client("bob", Mode.PR);
    bobPr.claim(id);

    assertEquals(1, bobPr.dashboard().claimed().size());
    assertTrue(bob.dashboard().claimed().isEmpty());
  }

  @Test
  void discardRemovesBranch() {
    String id = postItem();
    WastelandClient bobPr = client("bob", Mode.PR);
    String branch = bobPr.claim(id).branch();

    bobPr.discardBranch(branch);

    assertFalse(store.branchExists(branch));
    assertEquals("open", mainStatus(id));
    assertEquals("", bobPr.detail(id).branch());
  }

  @Test
  void prAcceptStampsOnlyOnBranch() {
    String id = postItem();
    bob.claim(id);
    bob.done(id, "https://example.test/pr/7");
    WastelandClient alicePr = client("alice", Mode.PR);

    MutationResult accepted = alicePr.accept(id, AcceptInput.of(4, 5));

    assertEquals("accept", accepted.detail().delta());
    assertEquals("bob", accepted.detail().stamp().subject());
    assertEquals("in_review", mainStatus(id));
    assertTrue(store.query("SELECT id FROM stamps", "").isEmpty());
    assertEquals(1, store.query("SELECT id FROM stamps", accepted.branch()).size());
  }

  private WastelandClient client(String rig, Mode mode) {
    return new WastelandClient(ClientConfig.builder()
        .store(store)
        .rigHandle(rig)
        .mode(mode)
        .build());
  }

  private String postItem() {
    return alice.post(PostInput.builder("Fix bug " + UUID.randomUUID()).build()).detail().item().id();
  }

  private String mainStatus(String id) {
    List<Row> rows = store.query("SELECT status FROM wanted WHERE id=?", "", id);
    return rows.isEmpty() ? null : rows.get(0).getString("status");
  }

  private static String last(List<String> values) {
    return values.get(values.size() - 1);
  }
}
