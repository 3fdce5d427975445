package wasteland.resolve;

import wasteland.lifecycle.BranchNames;
import wasteland.lifecycle.Deltas;
import wasteland.model.WantedStatus;
import wasteland.query.CommonsQueries;
import wasteland.query.ItemSnapshot;
import wasteland.spi.CommonsStore;

/**
 * Reconciles main's and a rig's branch view of one item.
 */
public final class BranchStateResolver {
  private final CommonsStore store;
  private final CommonsQueries queries;

  public BranchStateResolver(CommonsStore store, CommonsQueries queries) {
    this.store = store;
    this.queries = queries;
  }

  public ResolvedItemState resolve(String wantedId, String rigHandle) {
    String branch = BranchNames.of(rigHandle, wantedId);
    boolean branchExists = store.branchExists(branch);
    ItemSnapshot main = queries.snapshot(wantedId, "");
    ItemSnapshot onBranch = branchExists ? queries.snapshot(wantedId, branch) : ItemSnapshot.EMPTY;
    ItemSnapshot effective = onBranch.isPresent() ? onBranch : main;

    WantedStatus mainStatus = main.isPresent() ? main.item().status() : null;
    WantedStatus branchStatus = onBranch.isPresent() ? onBranch.item().status() : null;
    return new ResolvedItemState(
        main.item(),
        onBranch.item(),
        branchExists ? branch : "",
        effective.completion(),
        effective.stamp(),
        Deltas.compute(mainStatus, branchStatus, branchExists),
        Deltas.path(mainStatus, branchStatus));
  }
}
