package wasteland;

/**
 * Raised when a wanted item does not exist on the ref being read.
 */
public class ItemNotFoundException extends WastelandException {
  public ItemNotFoundException(String wantedId) {
    super("wanted item \"" + wantedId + "\" not found");
  }
}
