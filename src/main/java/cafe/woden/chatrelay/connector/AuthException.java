package cafe.woden.chatrelay.connector;

/** The upstream rejected our credentials. */
public class AuthException extends ConnectorException {

  public AuthException(String message) {
    super(message);
  }
}
