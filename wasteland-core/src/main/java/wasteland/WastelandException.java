package wasteland;

/**
 * Base class of the unchecked exceptions raised by the mutation engine and its stores.
 */
public class WastelandException extends RuntimeException {
  public WastelandException(String message) {
    super(message);
  }

  public WastelandException(String message, Throwable cause) {
    super(message, cause);
  }
}
