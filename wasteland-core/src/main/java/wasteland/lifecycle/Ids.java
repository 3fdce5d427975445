package wasteland.lifecycle;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Generators for wanted, completion and stamp identifiers.
 *
 * <p>Each id is a SHA-256 over the inputs joined by {@code |} plus a monotonic ULID, so
 * two ids generated from the same inputs in the same instant still differ.
 */
public final class Ids {

  private Ids() {
  }

  /**
   * Returns {@code w-} followed by 10 hex characters.
   */
  public static String wantedId(String title) {
    return "w-" + hash(title).substring(0, 10);
  }

  /**
   * Returns {@code prefix-} followed by 16 hex characters, e.g. {@code c-0123456789abcdef}.
   */
  public static String prefixed(String prefix, String... inputs) {
    return prefix + "-" + hash(String.join("|", inputs)).substring(0, 16);
  }

  private static String hash(String data) {
    String seeded = data + "|" + UlidCreator.getMonotonicUlid();
    byte[] digest;
    try {
      digest = MessageDigest.getInstance("SHA-256").digest(seeded.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
    StringBuilder sb = new StringBuilder(digest.length * 2);
    for (byte b : digest) {
      sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
    }
    return sb.toString();
  }
}
