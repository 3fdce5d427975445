package wasteland;

import java.util.List;
import java.util.Objects;

/**
 * A new wanted item to post. Priority defaults to 2 and effort to {@code medium}.
 */
public final class PostInput {
  private final String title;
  private final String description;
  private final String project;
  private final String type;
  private final int priority;
  private final String effortLevel;
  private final List<String> tags;

  private PostInput(Builder builder) {
    this.title = builder.title;
    this.description = builder.description;
    this.project = builder.project;
    this.type = builder.type;
    this.priority = builder.priority;
    this.effortLevel = builder.effortLevel;
    this.tags = List.copyOf(builder.tags);
  }

  public static Builder builder(String title) {
    return new Builder(title);
  }

  public String title() {
    return title;
  }

  public String description() {
    return description;
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

  public String effortLevel() {
    return effortLevel;
  }

  public List<String> tags() {
    return tags;
  }

  public static final class Builder {
    private final String title;
    private String description = "";
    private String project = "";
    private String type = "";
    private int priority = 2;
    private String effortLevel = "medium";
    private List<String> tags = List.of();

    private Builder(String title) {
      this.title = Objects.requireNonNull(title, "title");
    }

    public Builder description(String description) {
      this.description = description == null ? "" : description;
      return this;
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

    public Builder effortLevel(String effortLevel) {
      this.effortLevel = effortLevel == null || effortLevel.isEmpty() ? "medium" : effortLevel;
      return this;
    }

    public Builder tags(List<String> tags) {
      this.tags = tags == null ? List.of() : tags;
      return this;
    }

    public PostInput build() {
      return new PostInput(this);
    }
  }
}
