package wasteland.util;

import java.util.List;
import java.util.Map;

/**
 * Codec for the JSON columns of the commons tables: tag arrays ({@code wanted.tags},
 * {@code stamps.skill_tags}) and flat objects ({@code stamps.valence}).
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) is a lightweight,
 * zero-dependency encoder/decoder. Users who already have Jackson, Gson, or another JSON
 * library on the classpath can implement this interface to delegate to it.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes strings as a JSON array. Returns {@code null} if the list is null or empty,
   * so that an empty tag list is stored as SQL {@code NULL}.
   *
   * @param values the values to encode
   * @return JSON string, or {@code null}
   */
  String toJsonArray(List<String> values);

  /**
   * Parses a JSON array of strings. Returns an empty list for {@code null}, empty,
   * or {@code "null"} input.
   *
   * @param json the JSON string to parse
   * @return parsed values (never {@code null})
   * @throws IllegalArgumentException if the input is not a JSON array of strings
   */
  List<String> parseArray(String json);

  /**
   * Encodes a flat map as a JSON object. Values may be strings, numbers or booleans.
   *
   * @param values the entries to encode, in iteration order
   * @return JSON string (never {@code null}; {@code "{}"} for an empty map)
   */
  String toJson(Map<String, ?> values);

  /**
   * Parses a flat JSON object. String values are unescaped; number, boolean and null
   * literals are returned as their literal text.
   *
   * @param json the JSON string to parse
   * @return parsed map (never {@code null})
   * @throws IllegalArgumentException if the input is not a flat JSON object
   */
  Map<String, String> parseObject(String json);
}
