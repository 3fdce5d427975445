package wasteland;

import wasteland.lifecycle.BranchNames;
import wasteland.lifecycle.Deltas;
import wasteland.lifecycle.Ids;
import wasteland.lifecycle.Transition;
import wasteland.lifecycle.TransitionStatements;
import wasteland.lifecycle.Transitions;
import wasteland.model.BrowseFilter;
import wasteland.model.CompletionRecord;
import wasteland.model.DashboardData;
import wasteland.model.Stamp;
import wasteland.model.WantedItem;
import wasteland.model.WantedStatus;
import wasteland.model.WantedSummary;
import wasteland.model.WantedUpdate;
import wasteland.query.CommonsQueries;
import wasteland.query.ItemSnapshot;
import wasteland.resolve.BranchAction;
import wasteland.resolve.BranchActions;
import wasteland.resolve.BranchOverride;
import wasteland.resolve.BranchOverrides;
import wasteland.resolve.BranchStateResolver;
import wasteland.resolve.ResolvedItemState;
import wasteland.retry.RetryPolicy;
import wasteland.spi.CommonsStore;
import wasteland.spi.CommonsStoreException;
import wasteland.spi.MetricsExporter;
import wasteland.spi.PushFailedException;
import wasteland.spi.Statement;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Mode-aware client for the wanted board of one commons.
 *
 * <p>In {@link Mode#WILD_WEST} mode a mutation is committed to main and pushed to every
 * remote. In {@link Mode#PR} mode it is committed to the rig's branch
 * {@code wl/{rig}/{wantedId}}, which is pushed to the rig's fork and optionally submitted
 * as a pull request. A branch whose item ends up identical to main is deleted.
 *
 * <p>Mutating calls are serialized by one lock per client, held across the whole
 * read-modify-write sequence. Reads do not take the lock.
 */
public final class WastelandClient {
  private static final Logger logger = Logger.getLogger(WastelandClient.class.getName());

  static final String HINT_REVERTED = "reverted — branch cleaned up";
  static final String HINT_BRANCH_ONLY_DELETED = "branch-only item — branch deleted";
  static final String HINT_PR_FAILED = "PR creation failed: ";

  private final CommonsStore store;
  private final CommonsQueries queries;
  private final BranchStateResolver resolver;
  private final BranchOverrides overrides;
  private final String rigHandle;
  private final String hopUri;
  private final Capabilities capabilities;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final RetryPolicy prRetryPolicy;

  private final ReentrantLock lock = new ReentrantLock();
  // guarded by lock
  private final Map<String, PrBackoff> prBackoff = new HashMap<>();

  private volatile Mode mode;
  private volatile boolean signing;

  public WastelandClient(ClientConfig config) {
    Objects.requireNonNull(config, "config");
    this.store = config.store();
    this.queries = new CommonsQueries(store);
    this.resolver = new BranchStateResolver(store, queries);
    this.overrides = new BranchOverrides(store, queries);
    this.rigHandle = config.rigHandle();
    this.hopUri = config.hopUri();
    this.capabilities = config.capabilities();
    this.metrics = config.metrics();
    this.clock = config.clock();
    this.prRetryPolicy = config.prRetryPolicy();
    this.mode = config.mode();
    this.signing = config.signing();
  }

  public Mode mode() {
    return mode;
  }

  public String rigHandle() {
    return rigHandle;
  }

  public boolean signing() {
    return signing;
  }

  // ---- mutations ----

  public MutationResult claim(String wantedId) {
    return mutate(wantedId, Transition.CLAIM, "wl claim: " + wantedId,
        () -> TransitionStatements.claim(wantedId, rigHandle));
  }

  public MutationResult unclaim(String wantedId) {
    return mutate(wantedId, Transition.UNCLAIM, "wl unclaim: " + wantedId,
        () -> TransitionStatements.unclaim(wantedId));
  }

  /**
   * Submits completion evidence for an item the rig has claimed.
   */
  public MutationResult done(String wantedId, String evidence) {
    String completionId = Ids.prefixed("c", wantedId, rigHandle);
    return mutate(wantedId, Transition.DONE, "wl done: " + wantedId,
        () -> TransitionStatements.done(completionId, wantedId, rigHandle, evidence, hopUri));
  }

  /**
   * Accepts the item's completion, stamping its completer.
   *
   * <p>The completion is read from the rig's branch when that branch holds the item,
   * otherwise from main.
   *
   * @throws PreconditionFailedException if the item is not in review or has no completion
   */
  public MutationResult accept(String wantedId, AcceptInput input) {
    Objects.requireNonNull(input, "input");
    return mutate(wantedId, Transition.ACCEPT, "wl accept: " + wantedId, () -> {
      String ref = effectiveRef(wantedId);
      Transition.ACCEPT.validate(queries.status(wantedId, ref));
      CompletionRecord completion = queries.completion(wantedId, ref);
      if (completion == null) {
        throw new PreconditionFailedException("no completion found for wanted item \"" + wantedId + "\"");
      }
      Stamp stamp = new Stamp(
          Ids.prefixed("s", wantedId, rigHandle),
          rigHandle,
          completion.completedBy(),
          input.quality(),
          input.reliability(),
          input.severity(),
          completion.id(),
          "completion",
          input.skillTags(),
          input.message());
      return TransitionStatements.accept(wantedId, completion, stamp, hopUri);
    });
  }

  public MutationResult reject(String wantedId, String reason) {
    String message = "wl reject: " + wantedId;
    if (reason != null && !reason.isEmpty()) {
      message += " — " + reason;
    }
    return mutate(wantedId, Transition.REJECT, message,
        () -> TransitionStatements.reject(wantedId));
  }

  public MutationResult close(String wantedId) {
    return mutate(wantedId, Transition.CLOSE, "wl close: " + wantedId,
        () -> TransitionStatements.close(wantedId));
  }

  /**
   * Withdraws an open item. In pr mode an item that exists only on the rig's branch is
   * removed by deleting that branch, without a commit; the result then has no detail.
   */
  public MutationResult delete(String wantedId) {
    lock.lock();
    try {
      if (mode == Mode.PR && queries.status(wantedId, "") == null) {
        String branch = BranchNames.of(rigHandle, wantedId);
        deleteBranchQuietly(branch);
        prBackoff.remove(branch);
        return new MutationResult(null, "", HINT_BRANCH_ONLY_DELETED);
      }
      return mutate(wantedId, Transition.DELETE, "wl delete: " + wantedId,
          () -> TransitionStatements.delete(wantedId));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Posts a new open item authored by this rig.
   */
  public MutationResult post(PostInput input) {
    Objects.requireNonNull(input, "input");
    String id = Ids.wantedId(input.title());
    WantedItem item = new WantedItem(id, input.title(), input.description(), input.project(), input.type(),
        input.priority(), input.tags(), rigHandle, "", WantedStatus.OPEN, input.effortLevel(), null, null);
    List<Statement> statements = TransitionStatements.insert(item);
    return mutate(id, "post", WantedStatus.OPEN, false, "wl post: " + id, () -> statements);
  }

  /**
   * Changes descriptive fields of an open item.
   *
   * @throws IllegalArgumentException if {@code update} carries no fields
   */
  public MutationResult update(String wantedId, WantedUpdate update) {
    List<Statement> statements = TransitionStatements.update(wantedId, update);
    return mutate(wantedId, Transition.UPDATE, "wl update: " + wantedId, () -> statements);
  }

  private MutationResult mutate(
      String wantedId,
      Transition transition,
      String commitMessage,
      Supplier<List<Statement>> statements
  ) {
    // Only a status change can be recognized as already applied on the branch.
    boolean replayable = transition.from() != transition.to();
    return mutate(wantedId, transition.label(), transition.to(), replayable, commitMessage, statements);
  }

  private MutationResult mutate(
      String wantedId,
      String label,
      WantedStatus target,
      boolean replayable,
      String commitMessage,
      Supplier<List<Statement>> statements
  ) {
    long startNanos = System.nanoTime();
    lock.lock();
    try {
      Mode current = mode;
      MutationResult result = current == Mode.PR
          ? mutatePr(wantedId, label, target, replayable, commitMessage, statements)
          : mutateWildWest(wantedId, label, commitMessage, statements);
      return result;
    } finally {
      lock.unlock();
      metrics.recordMutationDurationMs(label, (System.nanoTime() - startNanos) / 1_000_000L);
    }
  }

  private MutationResult mutateWildWest(
      String wantedId,
      String label,
      String commitMessage,
      Supplier<List<Statement>> statements
  ) {
    store.checkWildWest();
    commit("", label, commitMessage, statements);
    metrics.incrementMutation(label, Mode.WILD_WEST.code());
    try {
      store.pushWithSync(line -> logger.log(Level.FINE, "push: {0}", line));
    } catch (CommonsStoreException ex) {
      metrics.incrementPushFailed();
      throw ex;
    }
    return new MutationResult(detailWildWest(wantedId), "", "");
  }

  private MutationResult mutatePr(
      String wantedId,
      String label,
      WantedStatus target,
      boolean replayable,
      String commitMessage,
      Supplier<List<Statement>> statements
  ) {
    String branch = BranchNames.of(rigHandle, wantedId);
    WantedItem mainBefore = queries.item(wantedId, "");
    WantedStatus mainStatus = mainBefore == null ? null : mainBefore.status();

    if (replayable && store.branchExists(branch)) {
      WantedStatus branchStatus = queries.status(wantedId, branch);
      if (branchStatus == target && branchStatus != mainStatus) {
        logger.log(Level.FINE, "Branch {0} already at {1}, skipping {2}", new Object[] {branch, target, label});
        metrics.incrementReplaySuppressed();
        return prResult(wantedId, branch, mainStatus);
      }
    }

    commit(branch, label, commitMessage, statements);
    metrics.incrementMutation(label, Mode.PR.code());
    MutationResult result = prResult(wantedId, branch, mainStatus);

    StringBuilder pushLog = new StringBuilder();
    try {
      store.pushBranch(branch, line -> pushLog.append(line).append('\n'));
    } catch (CommonsStoreException ex) {
      metrics.incrementPushFailed();
      String backendLog = pushLog.toString().trim();
      if (backendLog.isEmpty() && ex instanceof PushFailedException) {
        backendLog = ((PushFailedException) ex).backendLog().trim();
      }
      if (!backendLog.isEmpty()) {
        throw new PushFailedException(backendLog, backendLog, ex);
      }
      throw new PushFailedException("push branch: " + ex.getMessage(), "", ex);
    }

    WantedItem after = result.detail() == null ? null : result.detail().item();
    if (mainBefore != null && after != null && after.sameContent(mainBefore)) {
      deleteBranchQuietly(branch);
      prBackoff.remove(branch);
      metrics.incrementBranchCleanup();
      return new MutationResult(result.detail().withoutBranch(), "", HINT_REVERTED);
    }

    return autoSubmitPr(result);
  }

  private void commit(String branch, String label, String commitMessage, Supplier<List<Statement>> statements) {
    try {
      store.exec(branch, commitMessage, signing, statements.get());
    } catch (PreconditionFailedException ex) {
      metrics.incrementMutationRejected(label);
      throw ex;
    }
  }

  private MutationResult autoSubmitPr(MutationResult result) {
    DetailResult detail = result.detail();
    if (result.branch().isEmpty() || detail == null || !detail.prUrl().isEmpty()
        || !capabilities.canCreatePullRequest()) {
      return result;
    }
    String branch = result.branch();
    PrBackoff backoff = prBackoff.get(branch);
    Instant now = clock.instant();
    if (backoff != null && now.isBefore(backoff.nextAttemptAt)) {
      logger.log(Level.FINE, "Deferring PR creation for {0} until {1}", new Object[] {branch, backoff.nextAttemptAt});
      return result;
    }
    try {
      String url = capabilities.createPullRequest().create(branch);
      metrics.incrementPrSubmitted();
      prBackoff.remove(branch);
      return result.withDetail(detail.withPullRequest(url, branchActions(detail.branch(), detail.delta(), url,
          detail.actions())));
    } catch (Exception ex) {
      metrics.incrementPrFailed();
      int attempts = backoff == null ? 1 : backoff.attempts + 1;
      Instant next = now.plusMillis(prRetryPolicy.computeDelayMs(attempts));
      prBackoff.put(branch, new PrBackoff(attempts, next));
      logger.log(Level.WARNING, "PR creation failed for " + branch + " (attempt " + attempts + ")", ex);
      return result.withHint(HINT_PR_FAILED + ex.getMessage());
    }
  }

  private MutationResult prResult(String wantedId, String branch, WantedStatus mainStatus) {
    ItemSnapshot snapshot = queries.snapshot(wantedId, branch);
    WantedItem item = snapshot.item();
    List<Transition> actions = Transitions.available(item, rigHandle);
    String delta = item == null ? "" : Deltas.compute(mainStatus, item.status(), true);
    String prUrl = capabilities.checkPullRequest(branch);
    DetailResult detail = new DetailResult(item, snapshot.completion(), snapshot.stamp(), branch,
        capabilities.branchWebUrl(branch), mainStatus, prUrl, delta, actions,
        branchActions(branch, delta, prUrl, actions));
    return new MutationResult(detail, branch, "");
  }

  private String effectiveRef(String wantedId) {
    if (mode != Mode.PR) {
      return "";
    }
    String branch = BranchNames.of(rigHandle, wantedId);
    if (store.branchExists(branch) && queries.status(wantedId, branch) != null) {
      return branch;
    }
    return "";
  }

  private List<BranchAction> branchActions(String branch, String delta, String prUrl, List<Transition> actions) {
    return BranchActions.compute(mode, branch, delta, prUrl, actions.contains(Transition.DELETE));
  }

  private void deleteBranchQuietly(String branch) {
    try {
      store.deleteBranch(branch);
    } catch (CommonsStoreException ex) {
      logger.log(Level.WARNING, "Failed to delete local branch " + branch, ex);
    }
    try {
      store.deleteRemoteBranch(branch);
    } catch (CommonsStoreException ex) {
      logger.log(Level.WARNING, "Failed to delete remote branch " + branch, ex);
    }
  }

  // ---- reads ----

  /**
   * Browses the board. In pr mode the rig's pending branch statuses are overlaid on
   * main's results; the {@code all} view also counts every rig's pending branches and
   * the upstream's pending pull requests.
   */
  public BrowseResult browse(BrowseFilter filter) {
    Objects.requireNonNull(filter, "filter");
    List<WantedSummary> items = queries.browse(filter);
    Map<String, Integer> pending = new LinkedHashMap<>();
    if (mode == Mode.PR) {
      List<BranchOverride> detected = overrides.detect(rigHandle);
      items = overrides.apply(items, detected, filter);
      for (BranchOverride override : detected) {
        pending.merge(override.wantedId(), 1, Integer::sum);
      }
    }
    if (filter.view() == BrowseFilter.View.ALL) {
      Map<String, Integer> allBranches = new LinkedHashMap<>();
      for (String branch : store.branches("wl/")) {
        String wantedId = BranchNames.wantedId(branch);
        if (!wantedId.isEmpty()) {
          allBranches.merge(wantedId, 1, Integer::sum);
        }
      }
      pending.putAll(allBranches);
      mergeUpstreamPending(pending);
    }
    return new BrowseResult(items, pending);
  }

  private void mergeUpstreamPending(Map<String, Integer> pending) {
    if (!capabilities.canListPendingItems()) {
      return;
    }
    Map<String, Integer> upstream;
    try {
      upstream = capabilities.listPendingItems().list();
    } catch (Exception ex) {
      logger.log(Level.WARNING, "Failed to list upstream pending items", ex);
      return;
    }
    if (upstream == null) {
      return;
    }
    for (String wantedId : upstream.keySet()) {
      pending.putIfAbsent(wantedId, 1);
    }
  }

  /**
   * Loads an item with its transitions and, in pr mode, the state of the rig's branch.
   *
   * @throws ItemNotFoundException if neither main nor the rig's branch holds the item
   */
  public DetailResult detail(String wantedId) {
    if (mode == Mode.PR) {
      return detailPr(wantedId);
    }
    return detailWildWest(wantedId);
  }

  /**
   * Resolves the item on main and on the rig's branch.
   */
  public ResolvedItemState resolve(String wantedId) {
    return resolver.resolve(wantedId, rigHandle);
  }

  private DetailResult detailPr(String wantedId) {
    ResolvedItemState state = resolver.resolve(wantedId, rigHandle);
    WantedItem effective = state.effective();
    if (effective == null) {
      return detailWildWest(wantedId);
    }
    List<Transition> actions = Transitions.available(effective, rigHandle);
    String branch = state.branchName();
    String prUrl = branch.isEmpty() ? "" : capabilities.checkPullRequest(branch);
    String branchUrl = branch.isEmpty() ? "" : capabilities.branchWebUrl(branch);
    return new DetailResult(effective, state.completion(), state.stamp(), branch, branchUrl,
        branch.isEmpty() ? null : state.mainStatus(), prUrl, state.delta(), actions,
        branchActions(branch, state.delta(), prUrl, actions));
  }

  private DetailResult detailWildWest(String wantedId) {
    ItemSnapshot snapshot = queries.snapshot(wantedId, "");
    if (!snapshot.isPresent()) {
      throw new ItemNotFoundException(wantedId);
    }
    return new DetailResult(snapshot.item(), snapshot.completion(), snapshot.stamp(), "", "", null, "", "",
        Transitions.available(snapshot.item(), rigHandle), List.of());
  }

  /**
   * Builds the rig's dashboard. In pr mode items pending on the rig's branches are
   * filed under their branch status.
   */
  public DashboardData dashboard() {
    DashboardData main = queries.dashboard(rigHandle, "");
    if (mode != Mode.PR) {
      return main;
    }
    List<BranchOverride> detected = overrides.detect(rigHandle);
    if (detected.isEmpty()) {
      return main;
    }
    Map<String, WantedSummary> claimed = byId(main.claimed());
    Map<String, WantedSummary> inReview = byId(main.inReview());
    Map<String, WantedSummary> completed = byId(main.completed());
    for (BranchOverride override : detected) {
      claimed.remove(override.wantedId());
      inReview.remove(override.wantedId());
      completed.remove(override.wantedId());
      WantedItem item = queries.item(override.wantedId(), override.branch());
      if (item == null) {
        continue;
      }
      WantedSummary summary = item.toSummary();
      switch (item.status()) {
        case CLAIMED:
          if (item.isClaimedBy(rigHandle)) {
            claimed.put(item.id(), summary);
          }
          break;
        case IN_REVIEW:
          if (item.isClaimedBy(rigHandle) || item.isPostedBy(rigHandle)) {
            inReview.put(item.id(), summary);
          }
          break;
        case COMPLETED:
          if (item.isClaimedBy(rigHandle)) {
            completed.put(item.id(), summary);
          }
          break;
        default:
          break;
      }
    }
    return new DashboardData(List.copyOf(claimed.values()), List.copyOf(inReview.values()),
        List.copyOf(completed.values()));
  }

  private static Map<String, WantedSummary> byId(List<WantedSummary> items) {
    Map<String, WantedSummary> result = new LinkedHashMap<>();
    for (WantedSummary item : items) {
      result.put(item.id(), item);
    }
    return result;
  }

  // ---- branch lifecycle ----

  /**
   * Merges a mutation branch into main, deletes it and pushes main to the fork.
   */
  public void applyBranch(String branch) {
    lock.lock();
    try {
      store.mergeBranch(branch);
      try {
        store.deleteBranch(branch);
      } catch (CommonsStoreException ex) {
        throw new CommonsStoreException("delete local branch: " + ex.getMessage(), ex);
      }
      prBackoff.remove(branch);
      try {
        store.pushMain(line -> logger.log(Level.FINE, "push: {0}", line));
      } catch (CommonsStoreException ex) {
        metrics.incrementPushFailed();
        throw new PushFailedException("push origin main: " + ex.getMessage(), "", ex);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Abandons a mutation branch: closes its pull request if possible, removes the item's
   * rows from the branch and deletes the branch locally and remotely.
   *
   * <p>Only clearing the rows must succeed; closing and deleting are best-effort.
   */
  public void discardBranch(String branch) {
    lock.lock();
    try {
      if (capabilities.canClosePullRequest()) {
        try {
          capabilities.closePullRequest().close(branch);
        } catch (Exception ex) {
          logger.log(Level.WARNING, "Failed to close PR for " + branch, ex);
        }
      }
      String wantedId = BranchNames.wantedId(branch);
      if (!wantedId.isEmpty() && store.branchExists(branch)) {
        try {
          store.exec(branch, "wl discard: " + wantedId, signing, TransitionStatements.discard(wantedId));
        } catch (PreconditionFailedException ex) {
          logger.log(Level.FINE, "Branch {0} holds no rows for {1}", new Object[] {branch, wantedId});
        }
      }
      deleteBranchQuietly(branch);
      prBackoff.remove(branch);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Opens a pull request for a branch, regardless of any automatic-submission backoff.
   *
   * @return the pull request URL
   * @throws CapabilityUnavailableException if PR creation is not configured
   */
  public String submitPr(String branch) {
    Capabilities.PullRequestCreator creator = capabilities.createPullRequest();
    lock.lock();
    try {
      String url = creator.create(branch);
      metrics.incrementPrSubmitted();
      prBackoff.remove(branch);
      return url;
    } catch (RuntimeException ex) {
      metrics.incrementPrFailed();
      throw ex;
    } catch (Exception ex) {
      metrics.incrementPrFailed();
      throw new WastelandException(ex.getMessage(), ex);
    } finally {
      lock.unlock();
    }
  }

  /**
   * @throws CapabilityUnavailableException if diff loading is not configured
   */
  public String branchDiff(String branch) {
    Capabilities.DiffLoader loader = capabilities.loadDiff();
    try {
      return loader.load(branch);
    } catch (RuntimeException ex) {
      throw ex;
    } catch (Exception ex) {
      throw new WastelandException(ex.getMessage(), ex);
    }
  }

  /**
   * Persists and adopts new mode and signing settings.
   *
   * @throws CapabilityUnavailableException if settings persistence is not configured
   */
  public void saveSettings(Mode newMode, boolean newSigning) {
    Objects.requireNonNull(newMode, "newMode");
    Capabilities.SettingsSaver saver = capabilities.saveSettings();
    lock.lock();
    try {
      saver.save(newMode, newSigning);
      mode = newMode;
      signing = newSigning;
    } catch (RuntimeException ex) {
      throw ex;
    } catch (Exception ex) {
      throw new WastelandException(ex.getMessage(), ex);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Pulls the upstream commons into main.
   */
  public void sync() {
    lock.lock();
    try {
      store.sync();
    } finally {
      lock.unlock();
    }
  }

  private static final class PrBackoff {
    private final int attempts;
    private final Instant nextAttemptAt;

    private PrBackoff(int attempts, Instant nextAttemptAt) {
      this.attempts = attempts;
      this.nextAttemptAt = nextAttemptAt;
    }
  }
}
