package wasteland.resolve;

import wasteland.Mode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mode-aware branch operations for an item.
 *
 * <ul>
 *   <li>no branch or no delta: none</li>
 *   <li>pr mode without a pull request: {@code submit_pr, discard}</li>
 *   <li>pr mode with a pull request: {@code discard}</li>
 *   <li>wild-west mode: {@code apply, discard}</li>
 * </ul>
 *
 * <p>{@code discard} is withheld when the item's own transitions include {@code delete},
 * since deleting cleans up the branch.
 */
public final class BranchActions {

  private BranchActions() {
  }

  public static List<BranchAction> compute(Mode mode, String branch, String delta, String prUrl, boolean hasDelete) {
    if (isEmpty(branch) || isEmpty(delta)) {
      return Collections.emptyList();
    }
    List<BranchAction> actions = new ArrayList<>(2);
    if (mode == Mode.PR) {
      if (isEmpty(prUrl)) {
        actions.add(BranchAction.SUBMIT_PR);
      }
    } else {
      actions.add(BranchAction.APPLY);
    }
    if (!hasDelete) {
      actions.add(BranchAction.DISCARD);
    }
    return Collections.unmodifiableList(actions);
  }

  private static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }
}
