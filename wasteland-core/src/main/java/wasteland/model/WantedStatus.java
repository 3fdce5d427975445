package wasteland.model;

/**
 * Lifecycle status of a wanted item, persisted by its lowercase code.
 */
public enum WantedStatus {
  OPEN("open"),
  CLAIMED("claimed"),
  IN_REVIEW("in_review"),
  COMPLETED("completed"),
  WITHDRAWN("withdrawn");

  private final String code;

  WantedStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == WITHDRAWN;
  }

  /**
   * Resolves a stored status code.
   *
   * @param code the stored code, e.g. {@code "in_review"}
   * @return the matching status
   * @throws IllegalArgumentException if the code is unknown
   */
  public static WantedStatus fromCode(String code) {
    for (WantedStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown wanted status: " + code);
  }

  @Override
  public String toString() {
    return code;
  }
}
