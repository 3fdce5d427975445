package wasteland.lifecycle;

import wasteland.PreconditionFailedException;
import wasteland.model.CompletionRecord;
import wasteland.model.Stamp;
import wasteland.model.WantedItem;
import wasteland.model.WantedUpdate;
import wasteland.spi.Statement;
import wasteland.util.JsonCodec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the parameterized statements of each transition.
 *
 * <p>Every transition carries one guarded status change. The other statements run in the
 * same commit and are themselves conditioned on the item's status, so they only take
 * effect when the guard holds. Timestamps use {@code CURRENT_TIMESTAMP}, which both Dolt
 * and H2 accept.
 */
public final class TransitionStatements {
  private static final JsonCodec json = JsonCodec.getDefault();

  private TransitionStatements() {
  }

  public static List<Statement> claim(String wantedId, String rigHandle) {
    return List.of(Statement.guarded(notIn(wantedId, "open"),
        "UPDATE wanted SET claimed_by=?, status='claimed', updated_at=CURRENT_TIMESTAMP"
            + " WHERE id=? AND status='open'",
        rigHandle, wantedId));
  }

  public static List<Statement> unclaim(String wantedId) {
    return List.of(Statement.guarded(notIn(wantedId, "claimed"),
        "UPDATE wanted SET claimed_by=NULL, status='open', updated_at=CURRENT_TIMESTAMP"
            + " WHERE id=? AND status='claimed'",
        wantedId));
  }

  /**
   * Moves a claimed item to review and records the completion. Only the claimer can do this,
   * and an item keeps at most one completion.
   */
  public static List<Statement> done(
      String completionId,
      String wantedId,
      String rigHandle,
      String evidence,
      String hopUri
  ) {
    return List.of(
        Statement.guarded(
            "wanted item " + quote(wantedId) + " is not claimed by " + quote(rigHandle) + " or does not exist",
            "UPDATE wanted SET status='in_review', evidence_url=?, updated_at=CURRENT_TIMESTAMP"
                + " WHERE id=? AND status='claimed' AND claimed_by=?",
            evidence, wantedId, rigHandle),
        Statement.of(
            "INSERT INTO completions (id, wanted_id, completed_by, evidence, hop_uri, completed_at)"
                + " SELECT ?, ?, ?, ?, ?, CURRENT_TIMESTAMP"
                + " FROM wanted WHERE id=? AND status='in_review' AND claimed_by=?"
                + " AND NOT EXISTS (SELECT 1 FROM completions WHERE wanted_id=?)",
            completionId, wantedId, rigHandle, evidence, nullIfEmpty(hopUri), wantedId, rigHandle, wantedId));
  }

  /**
   * Completes a reviewed item, issues the stamp and marks the completion validated.
   *
   * @throws PreconditionFailedException if the stamp's author is its subject
   */
  public static List<Statement> accept(String wantedId, CompletionRecord completion, Stamp stamp, String hopUri) {
    if (stamp.author().equals(stamp.subject())) {
      throw new PreconditionFailedException("stamp author " + quote(stamp.author()) + " cannot stamp their own work");
    }
    Map<String, Object> valence = new LinkedHashMap<>();
    valence.put("quality", stamp.quality());
    valence.put("reliability", stamp.reliability());
    return List.of(
        Statement.of(
            "INSERT INTO stamps (id, author, subject, valence, confidence, severity, context_id, context_type,"
                + " skill_tags, message, hop_uri, created_at)"
                + " SELECT ?, ?, ?, ?, 1.0, ?, ?, 'completion', ?, ?, ?, CURRENT_TIMESTAMP"
                + " FROM wanted WHERE id=? AND status='in_review'",
            stamp.id(), stamp.author(), stamp.subject(), json.toJson(valence), stamp.severity(),
            completion.id(), json.toJsonArray(stamp.skillTags()), nullIfEmpty(stamp.message()),
            nullIfEmpty(hopUri), wantedId),
        Statement.of(
            "UPDATE completions SET validated_by=?, stamp_id=?, validated_at=CURRENT_TIMESTAMP WHERE id=?",
            stamp.author(), stamp.id(), completion.id()),
        completeFromReview(wantedId));
  }

  /**
   * Sends a reviewed item back to its claimer and drops the completion.
   */
  public static List<Statement> reject(String wantedId) {
    return List.of(
        Statement.of("DELETE FROM completions WHERE wanted_id=?"
            + " AND EXISTS (SELECT 1 FROM wanted WHERE id=? AND status='in_review')", wantedId, wantedId),
        Statement.guarded(notIn(wantedId, "in_review"),
            "UPDATE wanted SET status='claimed', updated_at=CURRENT_TIMESTAMP WHERE id=? AND status='in_review'",
            wantedId));
  }

  /**
   * Completes a reviewed item without issuing a stamp.
   */
  public static List<Statement> close(String wantedId) {
    return List.of(completeFromReview(wantedId));
  }

  public static List<Statement> delete(String wantedId) {
    return List.of(Statement.guarded(notIn(wantedId, "open"),
        "UPDATE wanted SET status='withdrawn', updated_at=CURRENT_TIMESTAMP WHERE id=? AND status='open'",
        wantedId));
  }

  /**
   * Inserts a new open item. Empty optional fields are stored as {@code NULL}.
   *
   * @throws IllegalArgumentException if the id or title is empty
   */
  public static List<Statement> insert(WantedItem item) {
    if (item.id().isEmpty()) {
      throw new IllegalArgumentException("wanted item ID cannot be empty");
    }
    if (item.title() == null || item.title().isEmpty()) {
      throw new IllegalArgumentException("wanted item title cannot be empty");
    }
    String effort = item.effortLevel() == null || item.effortLevel().isEmpty() ? "medium" : item.effortLevel();
    return List.of(Statement.guarded("wanted item " + quote(item.id()) + " could not be inserted",
        "INSERT INTO wanted (id, title, description, project, type, priority, tags, posted_by, status,"
            + " effort_level, created_at, updated_at)"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, 'open', ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
        item.id(), item.title(), nullIfEmpty(item.description()), nullIfEmpty(item.project()),
        nullIfEmpty(item.type()), item.priority(), json.toJsonArray(item.tags()), nullIfEmpty(item.postedBy()),
        effort));
  }

  /**
   * Updates the fields present in {@code update} on an open item.
   *
   * @throws IllegalArgumentException if the update carries no fields
   */
  public static List<Statement> update(String wantedId, WantedUpdate update) {
    List<String> setClauses = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    update.title().ifPresent(v -> set(setClauses, params, "title", v));
    update.description().ifPresent(v -> set(setClauses, params, "description", v));
    update.project().ifPresent(v -> set(setClauses, params, "project", v));
    update.type().ifPresent(v -> set(setClauses, params, "type", v));
    update.priority().ifPresent(v -> set(setClauses, params, "priority", v));
    update.effortLevel().ifPresent(v -> set(setClauses, params, "effort_level", v));
    if (update.tagsSet()) {
      set(setClauses, params, "tags", json.toJsonArray(update.tags()));
    }
    if (setClauses.isEmpty()) {
      throw new IllegalArgumentException("no fields to update");
    }
    setClauses.add("updated_at=CURRENT_TIMESTAMP");
    params.add(wantedId);
    return List.of(new Statement(
        "UPDATE wanted SET " + String.join(", ", setClauses) + " WHERE id=? AND status='open'",
        params, true, notIn(wantedId, "open")));
  }

  /**
   * Removes an item and its completion from a branch so the branch no longer differs
   * from main for it.
   */
  public static List<Statement> discard(String wantedId) {
    return List.of(
        Statement.of("DELETE FROM completions WHERE wanted_id=?", wantedId),
        Statement.of("DELETE FROM wanted WHERE id=?", wantedId));
  }

  private static Statement completeFromReview(String wantedId) {
    return Statement.guarded(notIn(wantedId, "in_review"),
        "UPDATE wanted SET status='completed', updated_at=CURRENT_TIMESTAMP WHERE id=? AND status='in_review'",
        wantedId);
  }

  private static void set(List<String> clauses, List<Object> params, String column, Object value) {
    clauses.add(column + "=?");
    params.add(value);
  }

  private static String notIn(String wantedId, String status) {
    return "wanted item " + quote(wantedId) + " is not " + status + " or does not exist";
  }

  static String quote(String value) {
    return "\"" + value + "\"";
  }

  private static Object nullIfEmpty(String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}
