package wasteland;

import wasteland.model.WantedSummary;

import java.util.List;
import java.util.Map;

/**
 * Browse results with pending-change metadata.
 *
 * @param items      matching items, with branch overrides applied in pr mode
 * @param pendingIds wanted ids with pending branches or pull requests, mapped to their count
 */
public record BrowseResult(List<WantedSummary> items, Map<String, Integer> pendingIds) {

  public BrowseResult {
    items = List.copyOf(items);
    pendingIds = Map.copyOf(pendingIds);
  }
}
