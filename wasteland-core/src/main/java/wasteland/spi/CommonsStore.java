package wasteland.spi;

import java.util.List;
import java.util.function.Consumer;

/**
 * Versioned commons database with branch, merge and push primitives.
 *
 * <p>A {@code ref} or {@code branch} argument that is {@code null} or empty addresses the
 * main line. All methods raise unchecked exceptions: {@link CommonsStoreException} for
 * backend failures, {@link wasteland.PreconditionFailedException} when a guarded statement
 * or a commit changes nothing, and {@link wasteland.CapabilityUnavailableException} for
 * features the backend does not offer.
 *
 * @see wasteland.WastelandClient
 */
public interface CommonsStore {

  /**
   * Runs a read-only query as of the given ref.
   *
   * @param sql    SQL text with {@code ?} placeholders
   * @param ref    branch name, or empty for main
   * @param params positional parameters
   * @return result rows, possibly empty
   */
  List<Row> query(String sql, String ref, Object... params);

  /**
   * Applies the statements as one atomic commit. When {@code branch} is not empty and
   * does not exist yet, it is created from main first.
   *
   * @param branch        target branch, or empty for main
   * @param commitMessage commit message recorded with the change
   * @param signed        whether the commit is cryptographically signed
   * @param statements    statements to run in order
   */
  void exec(String branch, String commitMessage, boolean signed, List<Statement> statements);

  /**
   * Lists branch names starting with {@code prefix}, sorted.
   */
  List<String> branches(String prefix);

  boolean branchExists(String branch);

  void deleteBranch(String branch);

  void deleteRemoteBranch(String branch);

  /**
   * Pushes a branch to the rig's fork.
   *
   * @param branch branch to push
   * @param log    receives backend progress output
   * @throws PushFailedException if the push is rejected
   */
  void pushBranch(String branch, Consumer<String> log);

  /**
   * Pushes main to the rig's fork.
   *
   * @throws PushFailedException if the push is rejected
   */
  void pushMain(Consumer<String> log);

  /**
   * Pushes main to every remote, pulling and retrying once for a remote that rejects
   * the push.
   *
   * @throws PushFailedException naming the remotes that still failed
   */
  void pushWithSync(Consumer<String> log);

  /**
   * Pulls the upstream commons into main.
   */
  void sync();

  /**
   * Merges a branch into main.
   */
  void mergeBranch(String branch);

  /**
   * Verifies that direct writes to main are allowed.
   *
   * @throws wasteland.CapabilityUnavailableException if they are not
   */
  void checkWildWest();
}
