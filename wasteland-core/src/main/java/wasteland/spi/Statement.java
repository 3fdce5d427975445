package wasteland.spi;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One parameterized SQL statement of an atomic commit.
 *
 * <p>A guarded statement must change at least one row. When it changes none the store
 * rolls the whole commit back and raises {@link wasteland.PreconditionFailedException}
 * with {@link #failureMessage()}.
 *
 * @param sql            SQL text with {@code ?} placeholders
 * @param params         positional parameters
 * @param guarded        whether zero affected rows is a precondition failure
 * @param failureMessage message reported when a guarded statement affects no rows
 */
public record Statement(String sql, List<Object> params, boolean guarded, String failureMessage) {

  public Statement {
    Objects.requireNonNull(sql, "sql");
    params = params == null ? List.of() : Collections.unmodifiableList(Arrays.asList(params.toArray()));
    failureMessage = failureMessage == null ? "" : failureMessage;
  }

  public static Statement of(String sql, Object... params) {
    return new Statement(sql, Arrays.asList(params), false, null);
  }

  public static Statement guarded(String failureMessage, String sql, Object... params) {
    return new Statement(sql, Arrays.asList(params), true, failureMessage);
  }
}
