package wasteland.spi;

import wasteland.WastelandException;

/**
 * Unchecked exception wrapping transport and backend errors raised by a {@link CommonsStore}.
 */
public class CommonsStoreException extends WastelandException {
  public CommonsStoreException(String message) {
    super(message);
  }

  public CommonsStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
