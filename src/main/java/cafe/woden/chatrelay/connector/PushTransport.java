package cafe.woden.chatrelay.connector;

/**
 * Boundary to the persistent-connection chat client.
 *
 * <p>Implementations own the socket and the login handshake. All inbound traffic is delivered
 * through the {@link InboundHandler} installed before {@link #connect}.
 */
public interface PushTransport {

  interface InboundHandler {
    void onMessage(RawPushMessage message);

    /** The connection dropped without a local {@link #close()}. */
    void onConnectionLost(String reason);
  }

  void setInboundHandler(InboundHandler handler);

  /** Blocks until the login completes. No-op if already connected. */
  void connect(PushCredentials credentials) throws AuthException, ConnectException;

  boolean isConnected();

  /** Blocks until the server confirms the join. */
  void join(String channel) throws JoinException, ConnectException;

  /** Best-effort; never throws. */
  void part(String channel);

  /** Best-effort; never throws. */
  void close();
}
