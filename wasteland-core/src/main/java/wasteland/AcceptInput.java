package wasteland;

import java.util.List;

/**
 * Reviewer's assessment recorded in the stamp issued by {@code accept}.
 *
 * @param quality     quality score
 * @param reliability reliability score
 * @param severity    stamp severity; empty selects {@code leaf}
 * @param skillTags   skills the work demonstrated
 * @param message     free-form note, may be empty
 */
public record AcceptInput(int quality, int reliability, String severity, List<String> skillTags, String message) {

  public AcceptInput {
    severity = severity == null || severity.isEmpty() ? "leaf" : severity;
    skillTags = skillTags == null ? List.of() : List.copyOf(skillTags);
    message = message == null ? "" : message;
  }

  public static AcceptInput of(int quality, int reliability) {
    return new AcceptInput(quality, reliability, null, null, null);
  }
}
