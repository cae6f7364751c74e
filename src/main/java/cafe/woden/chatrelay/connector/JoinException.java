package cafe.woden.chatrelay.connector;

/** Connected, but the channel could not be joined. */
public class JoinException extends ConnectorException {

  private final String channel;

  public JoinException(String channel, String message) {
    super(message);
    this.channel = channel;
  }

  public String channel() {
    return channel;
  }
}
