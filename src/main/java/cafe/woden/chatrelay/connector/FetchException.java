package cafe.woden.chatrelay.connector;

/**
 * Transient failure talking to the pull upstream. Callers log it and keep polling.
 *
 * <p>Terminal conditions are never reported this way; see {@link FetchOutcome.Ended}.
 */
public class FetchException extends ConnectorException {

  private final int status;

  public FetchException(String message) {
    this(message, -1, null);
  }

  public FetchException(String message, Throwable cause) {
    this(message, -1, cause);
  }

  public FetchException(String message, int status, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  /** HTTP status of the failed call, or {@code -1} if the call never produced a response. */
  public int status() {
    return status;
  }
}
