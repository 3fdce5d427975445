package wasteland.query;

import wasteland.model.CompletionRecord;
import wasteland.model.Stamp;
import wasteland.model.WantedItem;

/**
 * An item with its completion and stamp as read from one ref.
 *
 * @param item       the item, or {@code null} if the ref does not hold it
 * @param completion the completion while the item is in review or completed, else {@code null}
 * @param stamp      the stamp of a validated completion, else {@code null}
 */
public record ItemSnapshot(WantedItem item, CompletionRecord completion, Stamp stamp) {

  public static final ItemSnapshot EMPTY = new ItemSnapshot(null, null, null);

  public boolean isPresent() {
    return item != null;
  }
}
