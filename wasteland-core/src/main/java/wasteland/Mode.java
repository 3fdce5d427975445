package wasteland;

/**
 * Workflow mode of a client.
 */
public enum Mode {
  /** Mutations are committed to main and pushed upstream directly. */
  WILD_WEST("wild-west"),
  /** Mutations are committed to a per-item branch and submitted for review. */
  PR("pr");

  private final String code;

  Mode(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Resolves a configured mode. {@code null} or empty selects {@link #WILD_WEST}.
   *
   * @throws IllegalArgumentException if the code is unknown
   */
  public static Mode fromCode(String code) {
    if (code == null || code.isEmpty()) {
      return WILD_WEST;
    }
    for (Mode mode : values()) {
      if (mode.code.equals(code)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown mode: " + code);
  }

  @Override
  public String toString() {
    return code;
  }
}
