package wasteland.lifecycle;

import wasteland.PreconditionFailedException;
import wasteland.model.WantedStatus;

/**
 * Named, guarded edge of the wanted-item state machine.
 *
 * <p>Declaration order is significant: {@link Transitions#available} reports transitions
 * in this order, and {@link Deltas#label} picks the first matching edge.
 */
public enum Transition {
  CLAIM("claim", WantedStatus.OPEN, WantedStatus.CLAIMED),
  UNCLAIM("unclaim", WantedStatus.CLAIMED, WantedStatus.OPEN),
  DONE("done", WantedStatus.CLAIMED, WantedStatus.IN_REVIEW),
  ACCEPT("accept", WantedStatus.IN_REVIEW, WantedStatus.COMPLETED),
  REJECT("reject", WantedStatus.IN_REVIEW, WantedStatus.CLAIMED),
  CLOSE("close", WantedStatus.IN_REVIEW, WantedStatus.COMPLETED),
  DELETE("delete", WantedStatus.OPEN, WantedStatus.WITHDRAWN),
  UPDATE("update", WantedStatus.OPEN, WantedStatus.OPEN);

  private final String label;
  private final WantedStatus from;
  private final WantedStatus to;

  Transition(String label, WantedStatus from, WantedStatus to) {
    this.label = label;
    this.from = from;
    this.to = to;
  }

  /**
   * Lowercase name used in commit messages, delta labels and metrics.
   */
  public String label() {
    return label;
  }

  public WantedStatus from() {
    return from;
  }

  public WantedStatus to() {
    return to;
  }

  /**
   * Checks that this transition may fire from {@code current}.
   *
   * @return the resulting status
   * @throws PreconditionFailedException if {@code current} is not this transition's source
   */
  public WantedStatus validate(WantedStatus current) {
    if (current != from) {
      throw new PreconditionFailedException(
          "cannot " + label + ": item is " + (current == null ? "missing" : current.code()) + ", not " + from.code());
    }
    return to;
  }

  @Override
  public String toString() {
    return label;
  }
}
