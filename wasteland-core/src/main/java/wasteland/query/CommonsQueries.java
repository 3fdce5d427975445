package wasteland.query;

import wasteland.model.BrowseFilter;
import wasteland.model.CompletionRecord;
import wasteland.model.DashboardData;
import wasteland.model.Stamp;
import wasteland.model.WantedItem;
import wasteland.model.WantedStatus;
import wasteland.model.WantedSummary;
import wasteland.spi.CommonsStore;
import wasteland.spi.Row;
import wasteland.util.JsonCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-side queries against the commons tables, as of a given ref.
 *
 * <p>An empty ref reads main.
 */
public final class CommonsQueries {
  private static final Logger logger = Logger.getLogger(CommonsQueries.class.getName());

  static final String SUMMARY_COLUMNS = "id, title, COALESCE(project,'') AS project, COALESCE(type,'') AS type,"
      + " COALESCE(priority,2) AS priority, COALESCE(posted_by,'') AS posted_by,"
      + " COALESCE(claimed_by,'') AS claimed_by, status, COALESCE(effort_level,'medium') AS effort_level";

  private static final String ITEM_SQL = "SELECT id, title, COALESCE(description,'') AS description,"
      + " COALESCE(project,'') AS project, COALESCE(type,'') AS type, COALESCE(priority,2) AS priority,"
      + " COALESCE(tags,'') AS tags, COALESCE(posted_by,'') AS posted_by, COALESCE(claimed_by,'') AS claimed_by,"
      + " status, COALESCE(effort_level,'medium') AS effort_level, created_at, updated_at"
      + " FROM wanted WHERE id=?";

  private static final String COMPLETION_SQL = "SELECT id, wanted_id, COALESCE(completed_by,'') AS completed_by,"
      + " COALESCE(evidence,'') AS evidence, COALESCE(stamp_id,'') AS stamp_id,"
      + " COALESCE(validated_by,'') AS validated_by"
      + " FROM completions WHERE wanted_id=? ORDER BY completed_at DESC";

  private static final String STAMP_SQL = "SELECT id, author, subject, valence, COALESCE(severity,'leaf') AS severity,"
      + " COALESCE(context_id,'') AS context_id, COALESCE(context_type,'') AS context_type,"
      + " COALESCE(skill_tags,'') AS skill_tags, COALESCE(message,'') AS message"
      + " FROM stamps WHERE id=?";

  private final CommonsStore store;
  private final JsonCodec json;

  public CommonsQueries(CommonsStore store) {
    this(store, JsonCodec.getDefault());
  }

  public CommonsQueries(CommonsStore store, JsonCodec json) {
    this.store = store;
    this.json = json;
  }

  /**
   * Loads an item, or returns {@code null} when the ref does not hold it.
   */
  public WantedItem item(String wantedId, String ref) {
    List<Row> rows = store.query(ITEM_SQL, ref, wantedId);
    return rows.isEmpty() ? null : toItem(rows.get(0));
  }

  /**
   * Returns the item's status, or {@code null} when the ref does not hold it.
   */
  public WantedStatus status(String wantedId, String ref) {
    List<Row> rows = store.query("SELECT status FROM wanted WHERE id=?", ref, wantedId);
    return rows.isEmpty() ? null : WantedStatus.fromCode(rows.get(0).getString("status"));
  }

  /**
   * Loads the most recent completion of an item, or {@code null} if there is none.
   */
  public CompletionRecord completion(String wantedId, String ref) {
    List<Row> rows = store.query(COMPLETION_SQL, ref, wantedId);
    if (rows.isEmpty()) {
      return null;
    }
    Row row = rows.get(0);
    return new CompletionRecord(
        row.getString("id"),
        row.getString("wanted_id"),
        row.getString("completed_by"),
        row.getString("evidence"),
        row.getString("stamp_id"),
        row.getString("validated_by"));
  }

  public Stamp stamp(String stampId, String ref) {
    List<Row> rows = store.query(STAMP_SQL, ref, stampId);
    if (rows.isEmpty()) {
      return null;
    }
    Row row = rows.get(0);
    Map<String, String> valence = parseValence(row.getString("valence"), stampId);
    return new Stamp(
        row.getString("id"),
        row.getString("author"),
        row.getString("subject"),
        valenceScore(valence, "quality", stampId),
        valenceScore(valence, "reliability", stampId),
        row.getString("severity"),
        row.getString("context_id"),
        row.getString("context_type"),
        parseTags(row.getString("skill_tags"), stampId),
        row.getString("message"));
  }

  /**
   * Loads an item with its completion and stamp. The completion is only looked up while
   * the item is in review or completed.
   */
  public ItemSnapshot snapshot(String wantedId, String ref) {
    WantedItem item = item(wantedId, ref);
    if (item == null) {
      return ItemSnapshot.EMPTY;
    }
    CompletionRecord completion = null;
    Stamp stamp = null;
    if (item.status() == WantedStatus.IN_REVIEW || item.status() == WantedStatus.COMPLETED) {
      completion = completion(wantedId, ref);
      if (completion != null && !completion.stampId().isEmpty()) {
        stamp = stamp(completion.stampId(), ref);
      }
    }
    return new ItemSnapshot(item, completion, stamp);
  }

  /**
   * Lists main's items matching the filter, ordered by priority then newest first.
   */
  public List<WantedSummary> browse(BrowseFilter filter) {
    List<String> conditions = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    condition(conditions, params, "status = ?", filter.status());
    condition(conditions, params, "project = ?", filter.project());
    condition(conditions, params, "type = ?", filter.type());
    if (filter.priority() >= 0) {
      conditions.add("priority = ?");
      params.add(filter.priority());
    }
    condition(conditions, params, "posted_by = ?", filter.postedBy());
    condition(conditions, params, "claimed_by = ?", filter.claimedBy());
    if (!filter.search().isEmpty()) {
      conditions.add("title LIKE ?");
      params.add("%" + filter.search() + "%");
    }
    StringBuilder sql = new StringBuilder("SELECT ").append(SUMMARY_COLUMNS).append(" FROM wanted");
    if (!conditions.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", conditions));
    }
    sql.append(" ORDER BY priority ASC, created_at DESC LIMIT ").append(filter.limit());
    return summaries(store.query(sql.toString(), "", params.toArray()));
  }

  /**
   * Builds a rig's dashboard from one ref.
   */
  public DashboardData dashboard(String rigHandle, String ref) {
    String base = "SELECT " + SUMMARY_COLUMNS + " FROM wanted WHERE ";
    String order = " ORDER BY priority ASC, updated_at DESC";
    List<WantedSummary> claimed = summaries(store.query(
        base + "claimed_by=? AND status='claimed'" + order, ref, rigHandle));
    List<WantedSummary> inReview = summaries(store.query(
        base + "status='in_review' AND (claimed_by=? OR posted_by=?)" + order, ref, rigHandle, rigHandle));
    List<WantedSummary> completed = summaries(store.query(
        base + "status='completed' AND claimed_by=?" + order, ref, rigHandle));
    return new DashboardData(claimed, inReview, completed);
  }

  public static List<WantedSummary> summaries(List<Row> rows) {
    List<WantedSummary> result = new ArrayList<>(rows.size());
    for (Row row : rows) {
      result.add(new WantedSummary(
          row.getString("id"),
          row.getString("title"),
          row.getString("project"),
          row.getString("type"),
          row.getInt("priority", 2),
          row.getString("posted_by"),
          row.getString("claimed_by"),
          WantedStatus.fromCode(row.getString("status")),
          row.getString("effort_level")));
    }
    return result;
  }

  private WantedItem toItem(Row row) {
    String id = row.getString("id");
    return new WantedItem(
        id,
        row.getString("title"),
        row.getString("description"),
        row.getString("project"),
        row.getString("type"),
        row.getInt("priority", 2),
        parseTags(row.getString("tags"), id),
        row.getString("posted_by"),
        row.getString("claimed_by"),
        WantedStatus.fromCode(row.getString("status")),
        row.getString("effort_level"),
        row.getInstant("created_at"),
        row.getInstant("updated_at"));
  }

  private List<String> parseTags(String raw, String owner) {
    try {
      return json.parseArray(raw);
    } catch (IllegalArgumentException ex) {
      logger.log(Level.WARNING, "Ignoring malformed tags on " + owner + ": " + raw, ex);
      return List.of();
    }
  }

  private Map<String, String> parseValence(String raw, String stampId) {
    try {
      return json.parseObject(raw);
    } catch (IllegalArgumentException ex) {
      logger.log(Level.WARNING, "Ignoring malformed valence on " + stampId + ": " + raw, ex);
      return Map.of();
    }
  }

  private static int valenceScore(Map<String, String> valence, String key, String stampId) {
    String value = valence.get(key);
    if (value == null) {
      return 0;
    }
    try {
      return (int) Double.parseDouble(value);
    } catch (NumberFormatException ex) {
      logger.log(Level.WARNING, "Ignoring non-numeric " + key + " on " + stampId + ": " + value, ex);
      return 0;
    }
  }

  private static void condition(List<String> conditions, List<Object> params, String clause, String value) {
    if (!value.isEmpty()) {
      conditions.add(clause);
      params.add(value);
    }
  }
}
