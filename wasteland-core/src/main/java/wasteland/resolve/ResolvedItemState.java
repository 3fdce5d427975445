package wasteland.resolve;

import wasteland.lifecycle.Transition;
import wasteland.model.CompletionRecord;
import wasteland.model.Stamp;
import wasteland.model.WantedItem;
import wasteland.model.WantedStatus;

import java.util.List;

/**
 * An item as seen on main and on the acting rig's mutation branch.
 *
 * @param main       main's snapshot, or {@code null} if main lacks the item
 * @param branch     the branch snapshot, or {@code null} without a branch or item on it
 * @param branchName the rig's branch name when that branch exists, else {@code ""}
 * @param completion completion read from the effective ref
 * @param stamp      stamp read from the effective ref
 * @param delta      delta label, see {@link wasteland.lifecycle.Deltas#compute}
 * @param path       transitions leading from main's status to the branch status
 */
public record ResolvedItemState(
    WantedItem main,
    WantedItem branch,
    String branchName,
    CompletionRecord completion,
    Stamp stamp,
    String delta,
    List<Transition> path
) {

  public ResolvedItemState {
    path = path == null ? List.of() : List.copyOf(path);
  }

  /**
   * The branch snapshot when present, otherwise main's.
   */
  public WantedItem effective() {
    return branch != null ? branch : main;
  }

  public WantedStatus mainStatus() {
    return main == null ? null : main.status();
  }

  public boolean hasBranch() {
    return !branchName.isEmpty();
  }
}
