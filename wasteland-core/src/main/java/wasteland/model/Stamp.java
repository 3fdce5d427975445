package wasteland.model;

import java.util.List;

/**
 * A reputation stamp issued when a completion is accepted. The author is never the subject.
 */
public record Stamp(
    String id,
    String author,
    String subject,
    int quality,
    int reliability,
    String severity,
    String contextId,
    String contextType,
    List<String> skillTags,
    String message
) {

  public Stamp {
    skillTags = skillTags == null ? List.of() : List.copyOf(skillTags);
  }
}
