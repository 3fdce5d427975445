package wasteland.model;

/**
 * Browse projection of a wanted item.
 */
public record WantedSummary(
    String id,
    String title,
    String project,
    String type,
    int priority,
    String postedBy,
    String claimedBy,
    WantedStatus status,
    String effortLevel
) {

  public WantedSummary withStatus(WantedStatus newStatus) {
    return new WantedSummary(id, title, project, type, priority, postedBy, claimedBy, newStatus, effortLevel);
  }
}
