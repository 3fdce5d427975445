package wasteland.model;

/**
 * Criteria for browsing the wanted board.
 *
 * <p>Empty strings and a priority of {@code -1} mean "unset". A limit of zero or less
 * falls back to {@link #DEFAULT_LIMIT}.
 */
public final class BrowseFilter {
  public static final int DEFAULT_LIMIT = 50;

  public enum View {
    /** Only the acting rig's pending work is overlaid. */
    MINE,
    /** Pending work of every rig, including upstream pull requests, is reported. */
    ALL
  }

  private final String status;
  private final String project;
  private final String type;
  private final int priority;
  private final String postedBy;
  private final String claimedBy;
  private final String search;
  private final int limit;
  private final View view;

  private BrowseFilter(Builder builder) {
    this.status = builder.status;
    this.project = builder.project;
    this.type = builder.type;
    this.priority = builder.priority;
    this.postedBy = builder.postedBy;
    this.claimedBy = builder.claimedBy;
    this.search = builder.search;
    this.limit = builder.limit <= 0 ? DEFAULT_LIMIT : builder.limit;
    this.view = builder.view;
  }

  public static BrowseFilter all() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String status() {
    return status;
  }

  public String project() {
    return project;
  }

  public String type() {
    return type;
  }

  public int priority() {
    return priority;
  }

  public String postedBy() {
    return postedBy;
  }

  public String claimedBy() {
    return claimedBy;
  }

  public String search() {
    return search;
  }

  public int limit() {
    return limit;
  }

  public View view() {
    return view;
  }

  /**
   * Whether an item with the given status passes the status criterion.
   */
  public boolean acceptsStatus(WantedStatus candidate) {
    return status.isEmpty() || status.equals(candidate.code());
  }

  public Builder toBuilder() {
    return new Builder()
        .status(status)
        .project(project)
        .type(type)
        .priority(priority)
        .postedBy(postedBy)
        .claimedBy(claimedBy)
        .search(search)
        .limit(limit)
        .view(view);
  }

  public static final class Builder {
    private String status = "";
    private String project = "";
    private String type = "";
    private int priority = -1;
    private String postedBy = "";
    private String claimedBy = "";
    private String search = "";
    private int limit;
    private View view = View.MINE;

    private Builder() {
    }

    public Builder status(String status) {
      this.status = status == null ? "" : status;
      return this;
    }

    public Builder status(WantedStatus status) {
      return status(status == null ? "" : status.code());
    }

    public Builder project(String project) {
      this.project = project == null ? "" : project;
      return this;
    }

    public Builder type(String type) {
      this.type = type == null ? "" : type;
      return this;
    }

    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Builder postedBy(String postedBy) {
      this.postedBy = postedBy == null ? "" : postedBy;
      return this;
    }

    public Builder claimedBy(String claimedBy) {
      this.claimedBy = claimedBy == null ? "" : claimedBy;
      return this;
    }

    public Builder search(String search) {
      this.search = search == null ? "" : search;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder view(View view) {
      this.view = view == null ? View.MINE : view;
      return this;
    }

    public BrowseFilter build() {
      return new BrowseFilter(this);
    }
  }
}
