package wasteland;

/**
 * Raised when an operation depends on an optional capability that was not configured,
 * or on a store feature the backend does not offer.
 *
 * @see Capabilities
 */
public class CapabilityUnavailableException extends WastelandException {
  public CapabilityUnavailableException(String message) {
    super(message);
  }
}
