package cafe.woden.chatrelay.connector;

/** Could not establish (or lost) the upstream connection. */
public class ConnectException extends ConnectorException {

  public ConnectException(String message) {
    super(message);
  }

  public ConnectException(String message, Throwable cause) {
    super(message, cause);
  }
}
