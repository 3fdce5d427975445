package wasteland.lifecycle;

import wasteland.model.WantedStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Labels describing how an item's state on a mutation branch differs from main.
 */
public final class Deltas {
  public static final String NEW = "new";
  public static final String CHANGES = "changes";
  public static final String NONE = "";

  private Deltas() {
  }

  /**
   * Labels the difference between two known statuses: {@code update} when they are equal,
   * the transition name when exactly one transition leads from {@code main} to
   * {@code branch}, otherwise {@code changes}.
   */
  public static String label(WantedStatus main, WantedStatus branch) {
    if (main == branch) {
      return Transition.UPDATE.label();
    }
    for (Transition transition : Transition.values()) {
      if (transition.from() == main && transition.to() == branch) {
        return transition.label();
      }
    }
    return CHANGES;
  }

  /**
   * Computes the delta label of an item.
   *
   * @param main         status on main, or {@code null} if the item is not on main
   * @param branch       status on the branch, or {@code null} if the branch lacks the item
   * @param branchExists whether the rig's mutation branch exists
   * @return {@code ""} without a branch snapshot, {@code new} without a main snapshot,
   *     {@code changes} when both statuses are equal, otherwise {@link #label}
   */
  public static String compute(WantedStatus main, WantedStatus branch, boolean branchExists) {
    if (!branchExists || branch == null) {
      return NONE;
    }
    if (main == null) {
      return NEW;
    }
    if (main == branch) {
      return CHANGES;
    }
    return label(main, branch);
  }

  /**
   * Shortest sequence of transitions leading from {@code main} to {@code branch}.
   * Returns an empty list when the statuses are equal or no path exists.
   */
  public static List<Transition> path(WantedStatus main, WantedStatus branch) {
    if (main == null || branch == null || main == branch) {
      return Collections.emptyList();
    }
    Map<WantedStatus, Transition> via = new EnumMap<>(WantedStatus.class);
    Deque<WantedStatus> queue = new ArrayDeque<>();
    queue.add(main);
    while (!queue.isEmpty()) {
      WantedStatus current = queue.poll();
      for (Transition transition : Transition.values()) {
        WantedStatus next = transition.to();
        if (transition.from() != current || next == main || via.containsKey(next)) {
          continue;
        }
        via.put(next, transition);
        if (next == branch) {
          return unwind(via, main, branch);
        }
        queue.add(next);
      }
    }
    return Collections.emptyList();
  }

  private static List<Transition> unwind(Map<WantedStatus, Transition> via, WantedStatus main, WantedStatus branch) {
    List<Transition> hops = new ArrayList<>();
    WantedStatus cursor = branch;
    while (cursor != main) {
      Transition hop = via.get(cursor);
      hops.add(hop);
      cursor = hop.from();
    }
    Collections.reverse(hops);
    return Collections.unmodifiableList(hops);
  }
}
