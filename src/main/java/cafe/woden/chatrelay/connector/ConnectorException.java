package cafe.woden.chatrelay.connector;

/**
 * Failure of a single connector operation.
 *
 * <p>Never fatal to the session: the session reports it as a notice and leaves the affected
 * connector detached.
 */
public abstract class ConnectorException extends Exception {

  protected ConnectorException(String message) {
    super(message);
  }

  protected ConnectorException(String message, Throwable cause) {
    super(message, cause);
  }
}
