package wasteland;

import wasteland.lifecycle.Transition;
import wasteland.model.CompletionRecord;
import wasteland.model.Stamp;
import wasteland.model.WantedItem;
import wasteland.model.WantedStatus;
import wasteland.resolve.BranchAction;

import java.util.List;

/**
 * Everything needed to display one item and the actions the acting rig can take on it.
 *
 * @param item          the effective item
 * @param completion    its completion, if any
 * @param stamp         its stamp, if any
 * @param branch        the rig's mutation branch holding the item, or {@code ""}
 * @param branchUrl     web URL of the branch, or {@code ""}
 * @param mainStatus    status on main while a branch exists, else {@code null}
 * @param prUrl         URL of the branch's pull request, or {@code ""}
 * @param delta         delta label, or {@code ""}
 * @param actions       transitions the acting rig may fire
 * @param branchActions branch operations on offer
 */
public record DetailResult(
    WantedItem item,
    CompletionRecord completion,
    Stamp stamp,
    String branch,
    String branchUrl,
    WantedStatus mainStatus,
    String prUrl,
    String delta,
    List<Transition> actions,
    List<BranchAction> branchActions
) {

  public DetailResult {
    branch = branch == null ? "" : branch;
    branchUrl = branchUrl == null ? "" : branchUrl;
    prUrl = prUrl == null ? "" : prUrl;
    delta = delta == null ? "" : delta;
    actions = actions == null ? List.of() : List.copyOf(actions);
    branchActions = branchActions == null ? List.of() : List.copyOf(branchActions);
  }

  public boolean hasAction(Transition transition) {
    return actions.contains(transition);
  }

  DetailResult withPullRequest(String newPrUrl, List<BranchAction> newBranchActions) {
    return new DetailResult(item, completion, stamp, branch, branchUrl, mainStatus, newPrUrl, delta, actions,
        newBranchActions);
  }

  /**
   * Drops every branch-related field, after the branch was deleted.
   */
  DetailResult withoutBranch() {
    return new DetailResult(item, completion, stamp, "", "", null, "", "", actions, List.of());
  }
}
