package cafe.woden.chatrelay.twitch;

import cafe.woden.chatrelay.config.RelayProperties;
import cafe.woden.chatrelay.connector.AuthException;
import cafe.woden.chatrelay.connector.ConnectException;
import cafe.woden.chatrelay.connector.JoinException;
import cafe.woden.chatrelay.connector.PushCredentials;
import cafe.woden.chatrelay.connector.PushTransport;
import cafe.woden.chatrelay.connector.RawPushMessage;
import cafe.woden.chatrelay.util.RelaySchedulers;
import io.reactivex.rxjava3.core.Scheduler;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.pircbotx.PircBotX;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link PushTransport} over a single PircBotX connection to Twitch chat.
 *
 * <p>{@link PircBotX#startBot()} blocks for the life of the connection, so it runs on the I/O
 * scheduler while {@link #connect} waits for the login handshake.
 */
@Component
public class PircbotxPushTransport implements PushTransport {
  private static final Logger log = LoggerFactory.getLogger(PircbotxPushTransport.class);

  private static final InboundHandler NO_HANDLER =
      new InboundHandler() {
        @Override
        public void onMessage(RawPushMessage message) {}

        @Override
        public void onConnectionLost(String reason) {}
      };

  private final TwitchBotFactory botFactory;
  private final RelayProperties.Twitch settings;
  private final Scheduler ioScheduler;
  private final TwitchConnectionState conn = new TwitchConnectionState();
  private final TwitchBridgeListener listener;
  private volatile InboundHandler handler = NO_HANDLER;

  @Autowired
  public PircbotxPushTransport(TwitchBotFactory botFactory, RelayProperties props) {
    this(botFactory, props, RelaySchedulers.io());
  }

  PircbotxPushTransport(TwitchBotFactory botFactory, RelayProperties props, Scheduler ioScheduler) {
    this.botFactory = Objects.requireNonNull(botFactory, "botFactory");
    this.settings = props.twitch();
    this.ioScheduler = Objects.requireNonNull(ioScheduler, "ioScheduler");
    this.listener = new TwitchBridgeListener(conn, () -> handler);
  }

  @Override
  public void setInboundHandler(InboundHandler handler) {
    this.handler = handler == null ? NO_HANDLER : handler;
  }

  @Override
  public synchronized void connect(PushCredentials credentials)
      throws AuthException, ConnectException {
    if (isConnected()) return;
    if (credentials == null || !credentials.isComplete()) {
      throw new AuthException("Twitch username and oauth token are not configured");
    }

    CompletableFuture<Void> login = conn.resetLogin();
    PircBotX bot = botFactory.build(credentials, listener);
    conn.botRef.set(bot);
    log.info("[chatrelay] connecting to twitch {}:{} as {}", settings.host(), settings.port(),
        credentials.username());

    ioScheduler.scheduleDirect(() -> {
      try {
        bot.startBot();
      } catch (Exception e) {
        login.completeExceptionally(
            new ConnectException("Twitch connection failed: " + describe(e), e));
      } finally {
        conn.botRef.compareAndSet(bot, null);
      }
    });

    try {
      login.get(settings.connectTimeoutMs(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      closeBot(bot);
      Throwable cause = e.getCause();
      if (cause instanceof AuthException auth) throw auth;
      if (cause instanceof ConnectException connect) throw connect;
      throw new ConnectException("Twitch connection failed: " + describe(cause), cause);
    } catch (TimeoutException e) {
      closeBot(bot);
      throw new ConnectException(
          "Timed out after " + settings.connectTimeoutMs() + "ms waiting for Twitch login");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      closeBot(bot);
      throw new ConnectException("Interrupted while connecting to Twitch", e);
    }
  }

  @Override
  public boolean isConnected() {
    return conn.loggedIn();
  }

  @Override
  public void join(String channel) throws JoinException, ConnectException {
    String key = TwitchConnectionState.channelKey(channel);
    if (key.isEmpty()) throw new JoinException(key, "Channel name is blank");

    PircBotX bot = conn.botRef.get();
    if (bot == null || !isConnected()) throw new ConnectException("Not connected to Twitch");

    CompletableFuture<Void> joined = new CompletableFuture<>();
    conn.pendingJoins.put(key, joined);
    bot.sendIRC().joinChannel("#" + key);

    try {
      joined.get(settings.joinTimeoutMs(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof JoinException join) throw join;
      throw new JoinException(key, "Join failed: " + describe(cause));
    } catch (TimeoutException e) {
      conn.pendingJoins.remove(key, joined);
      throw new JoinException(key,
          "No JOIN confirmation for #" + key + " within " + settings.joinTimeoutMs() + "ms");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      conn.pendingJoins.remove(key, joined);
      throw new JoinException(key, "Interrupted while joining #" + key);
    }
  }

  @Override
  public void part(String channel) {
    String key = TwitchConnectionState.channelKey(channel);
    PircBotX bot = conn.botRef.get();
    if (bot == null || key.isEmpty()) return;
    try {
      bot.sendRaw().rawLine("PART #" + key);
      log.info("[chatrelay] parted #{}", key);
    } catch (RuntimeException e) {
      log.debug("[chatrelay] PART #{} failed", key, e);
    }
  }

  @Override
  public void close() {
    PircBotX bot = conn.botRef.get();
    if (bot != null) closeBot(bot);
  }

  private void closeBot(PircBotX bot) {
    conn.closing.set(true);
    try {
      bot.stopBotReconnect();
      if (bot.isConnected()) bot.sendIRC().quitServer("bye");
    } catch (RuntimeException e) {
      log.debug("[chatrelay] twitch QUIT failed", e);
    }
    try {
      bot.close();
    } catch (RuntimeException e) {
      log.debug("[chatrelay] twitch socket close failed", e);
    }
    conn.botRef.compareAndSet(bot, null);
  }

  private static String describe(Throwable t) {
    if (t == null) return "unknown error";
    String msg = t.getMessage();
    return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
  }
}
