package wasteland.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A row of the {@code wanted} table.
 *
 * <p>{@code claimedBy} and the optional text columns are empty strings rather than
 * {@code null} when unset, matching the {@code COALESCE} projections in
 * {@link wasteland.query.CommonsQueries}.
 */
public record WantedItem(
    String id,
    String title,
    String description,
    String project,
    String type,
    int priority,
    List<String> tags,
    String postedBy,
    String claimedBy,
    WantedStatus status,
    String effortLevel,
    Instant createdAt,
    Instant updatedAt
) {

  public WantedItem {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(status, "status");
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public boolean isPostedBy(String rigHandle) {
    return !postedBy.isEmpty() && postedBy.equals(rigHandle);
  }

  public boolean isClaimedBy(String rigHandle) {
    return !claimedBy.isEmpty() && claimedBy.equals(rigHandle);
  }

  /**
   * Whether two snapshots agree on everything a transition or update can change.
   * Timestamps are ignored.
   */
  public boolean sameContent(WantedItem other) {
    return other != null
        && id.equals(other.id)
        && status == other.status
        && claimedBy.equals(other.claimedBy)
        && title.equals(other.title)
        && description.equals(other.description)
        && project.equals(other.project)
        && type.equals(other.type)
        && priority == other.priority
        && effortLevel.equals(other.effortLevel)
        && tags.equals(other.tags);
  }

  public WantedSummary toSummary() {
    return new WantedSummary(id, title, project, type, priority, postedBy, claimedBy, status, effortLevel);
  }
}
