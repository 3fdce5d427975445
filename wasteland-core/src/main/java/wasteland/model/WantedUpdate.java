package wasteland.model;

import java.util.List;
import java.util.Optional;

/**
 * Partial update of an open wanted item's descriptive fields.
 *
 * <p>Only fields that were set on the builder are written. Tags carry an explicit
 * "set" flag so that an empty list clears them.
 */
public final class WantedUpdate {
  private final String title;
  private final String description;
  private final String project;
  private final String type;
  private final Integer priority;
  private final String effortLevel;
  private final List<String> tags;
  private final boolean tagsSet;

  private WantedUpdate(Builder builder) {
    this.title = builder.title;
    this.description = builder.description;
    this.project = builder.project;
    this.type = builder.type;
    this.priority = builder.priority;
    this.effortLevel = builder.effortLevel;
    this.tags = builder.tags == null ? List.of() : List.copyOf(builder.tags);
    this.tagsSet = builder.tagsSet;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<String> title() {
    return Optional.ofNullable(title);
  }

  public Optional<String> description() {
    return Optional.ofNullable(description);
  }

  public Optional<String> project() {
    return Optional.ofNullable(project);
  }

  public Optional<String> type() {
    return Optional.ofNullable(type);
  }

  public Optional<Integer> priority() {
    return Optional.ofNullable(priority);
  }

  public Optional<String> effortLevel() {
    return Optional.ofNullable(effortLevel);
  }

  public boolean tagsSet() {
    return tagsSet;
  }

  public List<String> tags() {
    return tags;
  }

  public boolean isEmpty() {
    return title == null && description == null && project == null && type == null
        && priority == null && effortLevel == null && !tagsSet;
  }

  public static final class Builder {
    private String title;
    private String description;
    private String project;
    private String type;
    private Integer priority;
    private String effortLevel;
    private List<String> tags;
    private boolean tagsSet;

    private Builder() {
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder project(String project) {
      this.project = project;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Builder effortLevel(String effortLevel) {
      this.effortLevel = effortLevel;
      return this;
    }

    public Builder tags(List<String> tags) {
      this.tags = tags;
      this.tagsSet = true;
      return this;
    }

    public WantedUpdate build() {
      return new WantedUpdate(this);
    }
  }
}
