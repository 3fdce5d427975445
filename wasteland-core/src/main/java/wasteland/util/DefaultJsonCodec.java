package wasteland.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lightweight JSON encoder/decoder for string arrays and flat objects.
 * Has no external dependencies.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJsonArray(List<String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    sb.append('[');
    for (int i = 0; i < values.size(); i++) {
      String value = values.get(i);
      if (value == null) {
        throw new IllegalArgumentException("values cannot contain null");
      }
      if (i > 0) {
        sb.append(',');
      }
      sb.append('"').append(escape(value)).append('"');
    }
    sb.append(']');
    return sb.toString();
  }

  @Override
  public List<String> parseArray(String json) {
    if (json == null) {
      return Collections.emptyList();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equalsIgnoreCase(trimmed)) {
      return Collections.emptyList();
    }
    int len = trimmed.length();
    int idx = skipWhitespace(trimmed, 0);
    if (trimmed.charAt(idx) != '[') {
      throw new IllegalArgumentException("Expected JSON array");
    }
    idx++;
    List<String> result = new ArrayList<>();
    while (true) {
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON array");
      }
      char ch = trimmed.charAt(idx);
      if (ch == ']') {
        return result;
      }
      if (ch != '"') {
        throw new IllegalArgumentException("Expected string element");
      }
      ParseResult element = parseString(trimmed, idx + 1);
      result.add(element.value);
      idx = skipWhitespace(trimmed, element.nextIndex);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON array");
      }
      char next = trimmed.charAt(idx);
      if (next == ',') {
        idx++;
        continue;
      }
      if (next == ']') {
        return result;
      }
      throw new IllegalArgumentException("Expected ',' or ']'");
    }
  }

  @Override
  public String toJson(Map<String, ?> values) {
    StringBuilder sb = new StringBuilder();
    sb.append('{');
    if (values != null) {
      boolean first = true;
      for (Map.Entry<String, ?> entry : values.entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("values cannot contain null keys");
        }
        if (!first) {
          sb.append(", ");
        }
        first = false;
        sb.append('"').append(escape(entry.getKey())).append("\": ");
        Object value = entry.getValue();
        if (value == null) {
          sb.append("null");
        } else if (value instanceof Number || value instanceof Boolean) {
          sb.append(value);
        } else {
          sb.append('"').append(escape(value.toString())).append('"');
        }
      }
    }
    sb.append('}');
    return sb.toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    int len = trimmed.length();
    int idx = skipWhitespace(trimmed, 0);
    if (trimmed.charAt(idx) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    idx++;
    Map<String, String> result = new LinkedHashMap<>();
    while (true) {
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char ch = trimmed.charAt(idx);
      if (ch == '}') {
        return result;
      }
      if (ch != '"') {
        throw new IllegalArgumentException("Expected string key");
      }
      ParseResult key = parseString(trimmed, idx + 1);
      idx = skipWhitespace(trimmed, key.nextIndex);
      if (idx >= len || trimmed.charAt(idx) != ':') {
        throw new IllegalArgumentException("Expected ':' after key");
      }
      idx = skipWhitespace(trimmed, idx + 1);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      if (trimmed.charAt(idx) == '"') {
        ParseResult value = parseString(trimmed, idx + 1);
        result.put(key.value, value.value);
        idx = value.nextIndex;
      } else {
        int end = idx;
        while (end < len && ",} \t\n\r".indexOf(trimmed.charAt(end)) < 0) {
          end++;
        }
        if (end == idx) {
          throw new IllegalArgumentException("Expected value");
        }
        String literal = trimmed.substring(idx, end);
        if (literal.startsWith("{") || literal.startsWith("[")) {
          throw new IllegalArgumentException("Nested values are not supported");
        }
        result.put(key.value, literal);
        idx = end;
      }
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char next = trimmed.charAt(idx);
      if (next == ',') {
        idx++;
        continue;
      }
      if (next == '}') {
        return result;
      }
      throw new IllegalArgumentException("Expected ',' or '}'");
    }
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
        break;
      }
      i++;
    }
    return i;
  }

  private static ParseResult parseString(String input, int startIndex) {
    StringBuilder sb = new StringBuilder();
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new ParseResult(sb.toString(), i + 1);
      }
      if (c != '\\') {
        sb.append(c);
        i++;
        continue;
      }
      if (i + 1 >= input.length()) {
        throw new IllegalArgumentException("Invalid escape sequence");
      }
      char next = input.charAt(i + 1);
      switch (next) {
        case '"':
        case '\\':
        case '/':
          sb.append(next);
          break;
        case 'b':
          sb.append('\b');
          break;
        case 'f':
          sb.append('\f');
          break;
        case 'n':
          sb.append('\n');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 't':
          sb.append('\t');
          break;
        case 'u':
          if (i + 5 >= input.length()) {
            throw new IllegalArgumentException("Invalid unicode escape");
          }
          try {
            sb.append((char) Integer.parseInt(input.substring(i + 2, i + 6), 16));
          } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid unicode escape", ex);
          }
          i += 4;
          break;
        default:
          throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
      }
      i += 2;
    }
    throw new IllegalArgumentException("Unterminated string");
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  private record ParseResult(String value, int nextIndex) {
  }
}
