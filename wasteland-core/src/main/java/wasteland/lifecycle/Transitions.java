package wasteland.lifecycle;

import wasteland.model.WantedItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Role-gated transition table.
 *
 * <pre>
 * status      poster                 claimer        other
 * open        claim, delete          claim          claim
 * claimed     unclaim                unclaim, done  -
 * in_review   accept, reject, close  -              -
 * completed   -                      -              -
 * withdrawn   -                      -              -
 * </pre>
 *
 * <p>A rig that is both poster and claimer gets the union of both columns, except
 * {@code accept}: a stamp's author may never be its subject.
 */
public final class Transitions {

  private Transitions() {
  }

  /**
   * Returns the transitions {@code actor} may fire on {@code item}, in declaration order.
   * A {@code null} item yields an empty list.
   */
  public static List<Transition> available(WantedItem item, String actor) {
    if (item == null || actor == null || actor.isEmpty()) {
      return Collections.emptyList();
    }
    boolean poster = item.isPostedBy(actor);
    boolean claimer = item.isClaimedBy(actor);
    List<Transition> result = new ArrayList<>();
    switch (item.status()) {
      case OPEN:
        result.add(Transition.CLAIM);
        if (poster) {
          result.add(Transition.DELETE);
        }
        break;
      case CLAIMED:
        if (poster || claimer) {
          result.add(Transition.UNCLAIM);
        }
        if (claimer) {
          result.add(Transition.DONE);
        }
        break;
      case IN_REVIEW:
        if (poster) {
          if (!claimer) {
            result.add(Transition.ACCEPT);
          }
          result.add(Transition.REJECT);
          result.add(Transition.CLOSE);
        }
        break;
      case COMPLETED:
      case WITHDRAWN:
        break;
      default:
        throw new IllegalStateException("Unhandled status: " + item.status());
    }
    return Collections.unmodifiableList(result);
  }

  public static boolean isAvailable(WantedItem item, String actor, Transition transition) {
    return available(item, actor).contains(transition);
  }
}
