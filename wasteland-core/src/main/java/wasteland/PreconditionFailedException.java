package wasteland;

/**
 * Raised when a transition's guard does not hold against the stored state, e.g. claiming
 * an item that is no longer open. The stored state is left unchanged.
 */
public class PreconditionFailedException extends WastelandException {
  public PreconditionFailedException(String message) {
    super(message);
  }

  public PreconditionFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
