package wasteland.model;

/**
 * A row of the {@code completions} table: evidence submitted for a claimed item.
 */
public record CompletionRecord(
    String id,
    String wantedId,
    String completedBy,
    String evidence,
    String stampId,
    String validatedBy
) {

  public boolean isValidated() {
    return !validatedBy.isEmpty();
  }
}
