package wasteland;

import java.util.Map;
import java.util.function.Function;

/**
 * Optional integrations with a fork/pull-request provider and the settings store.
 *
 * <p>Every capability may be absent. Operations that need an absent capability fail with
 * {@link CapabilityUnavailableException}; best-effort uses of it are skipped.
 */
public final class Capabilities {
  private static final Capabilities NONE = builder().build();

  /** Opens a pull request for a branch and returns its URL. */
  @FunctionalInterface
  public interface PullRequestCreator {
    String create(String branch) throws Exception;
  }

  /** Closes the pull request of a branch, if any. */
  @FunctionalInterface
  public interface PullRequestCloser {
    void close(String branch) throws Exception;
  }

  /** Renders a diff of a branch against main. */
  @FunctionalInterface
  public interface DiffLoader {
    String load(String branch) throws Exception;
  }

  /** Persists the client's mode and signing settings. */
  @FunctionalInterface
  public interface SettingsSaver {
    void save(Mode mode, boolean signing) throws Exception;
  }

  /** Lists wanted ids with pending upstream pull requests, mapped to their count. */
  @FunctionalInterface
  public interface PendingItemsLister {
    Map<String, Integer> list() throws Exception;
  }

  private final PullRequestCreator createPullRequest;
  private final Function<String, String> checkPullRequest;
  private final PullRequestCloser closePullRequest;
  private final DiffLoader loadDiff;
  private final Function<String, String> branchWebUrl;
  private final SettingsSaver saveSettings;
  private final PendingItemsLister listPendingItems;

  private Capabilities(Builder builder) {
    this.createPullRequest = builder.createPullRequest;
    this.checkPullRequest = builder.checkPullRequest;
    this.closePullRequest = builder.closePullRequest;
    this.loadDiff = builder.loadDiff;
    this.branchWebUrl = builder.branchWebUrl;
    this.saveSettings = builder.saveSettings;
    this.listPendingItems = builder.listPendingItems;
  }

  public static Capabilities none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean canCreatePullRequest() {
    return createPullRequest != null;
  }

  public boolean canCheckPullRequest() {
    return checkPullRequest != null;
  }

  public boolean canClosePullRequest() {
    return closePullRequest != null;
  }

  public boolean canLoadDiff() {
    return loadDiff != null;
  }

  public boolean canResolveBranchUrl() {
    return branchWebUrl != null;
  }

  public boolean canSaveSettings() {
    return saveSettings != null;
  }

  public boolean canListPendingItems() {
    return listPendingItems != null;
  }

  PullRequestCreator createPullRequest() {
    return require(createPullRequest, "PR creation not available");
  }

  /**
   * Returns the URL of the branch's open pull request, or {@code ""}.
   */
  String checkPullRequest(String branch) {
    if (checkPullRequest == null) {
      return "";
    }
    String url = checkPullRequest.apply(branch);
    return url == null ? "" : url;
  }

  PullRequestCloser closePullRequest() {
    return require(closePullRequest, "PR closing not available");
  }

  DiffLoader loadDiff() {
    return require(loadDiff, "diff loading not available");
  }

  String branchWebUrl(String branch) {
    if (branchWebUrl == null) {
      return "";
    }
    String url = branchWebUrl.apply(branch);
    return url == null ? "" : url;
  }

  SettingsSaver saveSettings() {
    return require(saveSettings, "settings persistence not available");
  }

  PendingItemsLister listPendingItems() {
    return require(listPendingItems, "pending item listing not available");
  }

  private static <T> T require(T capability, String message) {
    if (capability == null) {
      throw new CapabilityUnavailableException(message);
    }
    return capability;
  }

  public static final class Builder {
    private PullRequestCreator createPullRequest;
    private Function<String, String> checkPullRequest;
    private PullRequestCloser closePullRequest;
    private DiffLoader loadDiff;
    private Function<String, String> branchWebUrl;
    private SettingsSaver saveSettings;
    private PendingItemsLister listPendingItems;

    private Builder() {
    }

    public Builder createPullRequest(PullRequestCreator createPullRequest) {
      this.createPullRequest = createPullRequest;
      return this;
    }

    public Builder checkPullRequest(Function<String, String> checkPullRequest) {
      this.checkPullRequest = checkPullRequest;
      return this;
    }

    public Builder closePullRequest(PullRequestCloser closePullRequest) {
      this.closePullRequest = closePullRequest;
      return this;
    }

    public Builder loadDiff(DiffLoader loadDiff) {
      this.loadDiff = loadDiff;
      return this;
    }

    public Builder branchWebUrl(Function<String, String> branchWebUrl) {
      this.branchWebUrl = branchWebUrl;
      return this;
    }

    public Builder saveSettings(SettingsSaver saveSettings) {
      this.saveSettings = saveSettings;
      return this;
    }

    public Builder listPendingItems(PendingItemsLister listPendingItems) {
      this.listPendingItems = listPendingItems;
      return this;
    }

    public Capabilities build() {
      return new Capabilities(this);
    }
  }
}
