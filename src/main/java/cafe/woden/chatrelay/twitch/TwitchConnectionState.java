package cafe.woden.chatrelay.twitch;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.pircbotx.PircBotX;

/** Mutable state of the single Twitch IRC connection, shared by transport and listener. */
final class TwitchConnectionState {
  final AtomicReference<PircBotX> botRef = new AtomicReference<>();

  /** Completes on a successful login, or fails with the login error. */
  final AtomicReference<CompletableFuture<Void>> login =
      new AtomicReference<>(new CompletableFuture<>());

  /** Joins waiting for the server's echo, keyed by lower-case channel without {@code #}. */
  final Map<String, CompletableFuture<Void>> pendingJoins = new ConcurrentHashMap<>();

  /** Set while we are closing the connection ourselves. */
  final AtomicBoolean closing = new AtomicBoolean(false);

  CompletableFuture<Void> resetLogin() {
    CompletableFuture<Void> fresh = new CompletableFuture<>();
    login.set(fresh);
    closing.set(false);
    return fresh;
  }

  boolean loggedIn() {
    CompletableFuture<Void> f = login.get();
    return botRef.get() != null && f.isDone() && !f.isCompletedExceptionally();
  }

  static String channelKey(String channel) {
    String c = channel == null ? "" : channel.trim();
    while (c.startsWith("#")) c = c.substring(1);
    return c.toLowerCase(Locale.ROOT);
  }
}
