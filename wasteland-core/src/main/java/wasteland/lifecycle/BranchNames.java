package wasteland.lifecycle;

/**
 * Naming of per-item mutation branches: {@code wl/{rigHandle}/{wantedId}}.
 */
public final class BranchNames {
  private static final String ROOT = "wl";

  private BranchNames() {
  }

  public static String of(String rigHandle, String wantedId) {
    return ROOT + "/" + rigHandle + "/" + wantedId;
  }

  /**
   * Branch-listing prefix for one rig, including the trailing slash.
   */
  public static String prefix(String rigHandle) {
    return ROOT + "/" + rigHandle + "/";
  }

  /**
   * Extracts the wanted id from a branch name, or returns {@code ""} when the name is not
   * of the form {@code wl/{rig}/{id}}.
   */
  public static String wantedId(String branch) {
    if (branch == null) {
      return "";
    }
    String[] parts = branch.split("/", 3);
    if (parts.length == 3 && ROOT.equals(parts[0]) && !parts[1].isEmpty()) {
      return parts[2];
    }
    return "";
  }

  /**
   * Extracts the rig handle from a branch name, or returns {@code ""} when it does not parse.
   */
  public static String rigHandle(String branch) {
    if (wantedId(branch).isEmpty()) {
      return "";
    }
    return branch.split("/", 3)[1];
  }
}
