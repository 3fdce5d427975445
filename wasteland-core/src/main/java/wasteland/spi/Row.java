package wasteland.spi;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One result row of a {@link CommonsStore#query} call. Column labels are case-insensitive.
 */
public final class Row {
  private final Map<String, Object> values;

  public Row(Map<String, ?> values) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      copy.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
    }
    this.values = Collections.unmodifiableMap(copy);
  }

  public static Row of(Object... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("keyValues must be label/value pairs");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put((String) keyValues[i], keyValues[i + 1]);
    }
    return new Row(map);
  }

  public boolean has(String column) {
    return values.containsKey(key(column));
  }

  public Object get(String column) {
    return values.get(key(column));
  }

  /**
   * Returns the column as a string, or {@code ""} when it is null or absent.
   */
  public String getString(String column) {
    Object value = get(column);
    return value == null ? "" : value.toString();
  }

  public int getInt(String column, int defaultValue) {
    Object value = get(column);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException ex) {
      throw new CommonsStoreException("Column " + column + " is not an integer: " + text, ex);
    }
  }

  public long getLong(String column, long defaultValue) {
    Object value = get(column);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    try {
      return new BigDecimal(value.toString().trim()).longValue();
    } catch (NumberFormatException ex) {
      throw new CommonsStoreException("Column " + column + " is not a number: " + value, ex);
    }
  }

  /**
   * Returns the column as an instant, or {@code null} when it is null or absent.
   * Timestamps without an offset are read as UTC.
   */
  public Instant getInstant(String column) {
    Object value = get(column);
    if (value == null) {
      return null;
    }
    if (value instanceof Timestamp) {
      return ((Timestamp) value).toInstant();
    }
    if (value instanceof Instant) {
      return (Instant) value;
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toInstant();
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    return LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
  }

  public Map<String, Object> asMap() {
    return values;
  }

  private static String key(String column) {
    return column.toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return "Row" + values;
  }
}
