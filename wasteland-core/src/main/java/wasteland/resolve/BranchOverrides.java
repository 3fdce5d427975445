package wasteland.resolve;

import wasteland.lifecycle.BranchNames;
import wasteland.model.BrowseFilter;
import wasteland.model.WantedItem;
import wasteland.model.WantedStatus;
import wasteland.model.WantedSummary;
import wasteland.query.CommonsQueries;
import wasteland.spi.CommonsStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Overlays a rig's pending branch statuses onto main's browse results.
 */
public final class BranchOverrides {
  private final CommonsStore store;
  private final CommonsQueries queries;

  public BranchOverrides(CommonsStore store, CommonsQueries queries) {
    this.store = store;
    this.queries = queries;
  }

  /**
   * Lists the rig's branches whose item status differs from main's.
   */
  public List<BranchOverride> detect(String rigHandle) {
    List<BranchOverride> overrides = new ArrayList<>();
    for (String branch : store.branches(BranchNames.prefix(rigHandle))) {
      String wantedId = BranchNames.wantedId(branch);
      if (wantedId.isEmpty()) {
        continue;
      }
      WantedStatus branchStatus = queries.status(wantedId, branch);
      if (branchStatus == null) {
        continue;
      }
      if (branchStatus != queries.status(wantedId, "")) {
        overrides.add(new BranchOverride(wantedId, branch, branchStatus));
      }
    }
    return overrides;
  }

  /**
   * Applies overrides to browse results. Overridden items that no longer match the status
   * filter are dropped; overridden items main did not return but that now match are added.
   */
  public List<WantedSummary> apply(List<WantedSummary> items, List<BranchOverride> overrides, BrowseFilter filter) {
    if (overrides.isEmpty()) {
      return items;
    }
    Map<String, BranchOverride> byId = new HashMap<>();
    for (BranchOverride override : overrides) {
      byId.put(override.wantedId(), override);
    }
    Set<String> applied = new HashSet<>();
    List<WantedSummary> result = new ArrayList<>(items.size());
    for (WantedSummary item : items) {
      BranchOverride override = byId.get(item.id());
      if (override == null) {
        result.add(item);
        continue;
      }
      applied.add(item.id());
      if (filter.acceptsStatus(override.status())) {
        result.add(item.withStatus(override.status()));
      }
    }
    for (BranchOverride override : overrides) {
      if (applied.contains(override.wantedId()) || !filter.acceptsStatus(override.status())) {
        continue;
      }
      WantedItem item = queries.item(override.wantedId(), override.branch());
      if (item != null) {
        result.add(item.toSummary().withStatus(override.status()));
      }
    }
    return result;
  }
}
