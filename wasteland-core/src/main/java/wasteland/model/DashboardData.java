package wasteland.model;

import java.util.List;

/**
 * Personal dashboard of one rig.
 *
 * @param claimed   items the rig has claimed and not yet submitted
 * @param inReview  items awaiting review that the rig claimed or posted
 * @param completed items the rig completed
 */
public record DashboardData(
    List<WantedSummary> claimed,
    List<WantedSummary> inReview,
    List<WantedSummary> completed
) {

  public DashboardData {
    claimed = List.copyOf(claimed);
    inReview = List.copyOf(inReview);
    completed = List.copyOf(completed);
  }

  public int size() {
    return claimed.size() + inReview.size() + completed.size();
  }
}
