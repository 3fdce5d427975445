package wasteland;

/**
 * Outcome of a mutating call.
 *
 * @param detail the item after the mutation, or {@code null} when it no longer exists
 * @param branch the mutation branch in pr mode, or {@code ""}
 * @param hint   a user-facing hint, or {@code ""}
 */
public record MutationResult(DetailResult detail, String branch, String hint) {

  public MutationResult {
    branch = branch == null ? "" : branch;
    hint = hint == null ? "" : hint;
  }

  public MutationResult withDetail(DetailResult newDetail) {
    return new MutationResult(newDetail, branch, hint);
  }

  public MutationResult withHint(String newHint) {
    return new MutationResult(detail, branch, newHint);
  }
}
