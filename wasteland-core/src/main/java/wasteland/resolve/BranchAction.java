package wasteland.resolve;

/**
 * Operation on a whole mutation branch, offered next to the item's transitions.
 */
public enum BranchAction {
  SUBMIT_PR("submit_pr"),
  APPLY("apply"),
  DISCARD("discard");

  private final String code;

  BranchAction(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  @Override
  public String toString() {
    return code;
  }
}
