package wasteland.spi;

/**
 * A push to a remote failed. When the backend produced diagnostic output it is carried
 * in {@link #backendLog()} and preferred as the user-facing message.
 */
public final class PushFailedException extends CommonsStoreException {
  private final String backendLog;

  public PushFailedException(String message, String backendLog, Throwable cause) {
    super(message, cause);
    this.backendLog = backendLog == null ? "" : backendLog;
  }

  public String backendLog() {
    return backendLog;
  }
}
