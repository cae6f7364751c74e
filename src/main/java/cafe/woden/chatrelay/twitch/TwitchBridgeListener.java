package cafe.woden.chatrelay.twitch;

import cafe.woden.chatrelay.connector.AuthException;
import cafe.woden.chatrelay.connector.ConnectException;
import cafe.woden.chatrelay.connector.JoinException;
import cafe.woden.chatrelay.connector.PushTransport;
import cafe.woden.chatrelay.connector.RawPushMessage;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.pircbotx.Channel;
import org.pircbotx.PircBotX;
import org.pircbotx.User;
import org.pircbotx.hooks.ListenerAdapter;
import org.pircbotx.hooks.events.ActionEvent;
import org.pircbotx.hooks.events.ConnectEvent;
import org.pircbotx.hooks.events.DisconnectEvent;
import org.pircbotx.hooks.events.JoinEvent;
import org.pircbotx.hooks.events.MessageEvent;
import org.pircbotx.hooks.events.NoticeEvent;
import org.pircbotx.hooks.events.ServerResponseEvent;
import org.pircbotx.hooks.events.UnknownEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Translates PircBotX callbacks into login/join completions and inbound chat lines. */
final class TwitchBridgeListener extends ListenerAdapter {
  private static final Logger log = LoggerFactory.getLogger(TwitchBridgeListener.class);

  // Twitch reports bad credentials as a server NOTICE, not a numeric.
  private static final Set<String> AUTH_FAILURE_TEXT =
      Set.of("login authentication failed", "improperly formatted auth", "login unsuccessful");

  // NOTICE msg-id values Twitch sends when a JOIN is refused.
  private static final Set<String> JOIN_REFUSED_MSG_IDS =
      Set.of("msg_channel_suspended", "msg_banned", "msg_channel_blocked", "tos_ban");

  // 403 = ERR_NOSUCHCHANNEL
  // 405 = ERR_TOOMANYCHANNELS
  // 471 = ERR_CHANNELISFULL
  // 473 = ERR_INVITEONLYCHAN
  // 474 = ERR_BANNEDFROMCHAN
  // 475 = ERR_BADCHANNELKEY
  // 476 = ERR_BADCHANMASK
  // 477 = ERR_NEEDREGGEDNICK
  static boolean isJoinFailureNumeric(int code) {
    return code == 403
        || code == 405
        || code == 471
        || code == 473
        || code == 474
        || code == 475
        || code == 476
        || code == 477;
  }

  private final TwitchConnectionState conn;
  private final Supplier<PushTransport.InboundHandler> handler;

  TwitchBridgeListener(
      TwitchConnectionState conn, Supplier<PushTransport.InboundHandler> handler) {
    this.conn = conn;
    this.handler = handler;
  }

  @Override
  public void onConnect(ConnectEvent event) {
    PircBotX bot = event.getBot();
    log.info("[chatrelay] twitch logged in as {}", bot.getNick());
    conn.login.get().complete(null);
  }

  @Override
  public void onDisconnect(DisconnectEvent event) {
    Exception ex = event.getDisconnectException();
    String reason = (ex != null && ex.getMessage() != null) ? ex.getMessage() : "Disconnected";

    // Ignore disconnects from a bot we already replaced.
    if (!conn.botRef.compareAndSet(event.getBot(), null)) return;

    CompletableFuture<Void> login = conn.login.get();
    boolean wasLoggedIn = login.isDone() && !login.isCompletedExceptionally();
    login.completeExceptionally(new ConnectException("Twitch disconnected before login: " + reason));
    failAllPendingJoins(reason);

    if (conn.closing.get()) {
      log.debug("[chatrelay] twitch connection closed");
      return;
    }
    if (wasLoggedIn) {
      log.warn("[chatrelay] twitch connection lost: {}", reason);
      handler.get().onConnectionLost(reason);
    }
  }

  @Override
  public void onMessage(MessageEvent event) {
    Channel channel = event.getChannel();
    User user = event.getUser();
    if (channel == null || user == null) return;
    deliver(toRaw(channel.getName(), user.getNick(), event.getMessage(), TwitchTags.of(event)));
  }

  @Override
  public void onAction(ActionEvent event) {
    // /me lines are chat too.
    Channel channel = event.getChannel();
    User user = event.getUser();
    if (channel == null || user == null) return;
    deliver(toRaw(channel.getName(), user.getNick(), event.getAction(), TwitchTags.of(event)));
  }

  @Override
  public void onNotice(NoticeEvent event) {
    String text = event.getNotice();
    if (isAuthFailure(text)) {
      failLogin(text);
      return;
    }

    String msgId = TwitchTags.value(TwitchTags.of(event), TwitchTags.MSG_ID);
    if (!JOIN_REFUSED_MSG_IDS.contains(msgId)) return;

    Channel channel = event.getChannel();
    String key = channel == null ? null : TwitchConnectionState.channelKey(channel.getName());
    failPendingJoin(key, text);
  }

  @Override
  public void onUnknown(UnknownEvent event) {
    String line = event.getLine();
    if (line != null && line.contains(" NOTICE ") && isAuthFailure(line)) {
      failLogin(line.substring(line.lastIndexOf(':') + 1).trim());
    }
  }

  @Override
  public void onJoin(JoinEvent event) {
    User user = event.getUser();
    Channel channel = event.getChannel();
    if (user == null || channel == null) return;
    if (!user.getNick().equalsIgnoreCase(event.getBot().getNick())) return;

    String key = TwitchConnectionState.channelKey(channel.getName());
    CompletableFuture<Void> pending = conn.pendingJoins.remove(key);
    if (pending != null) pending.complete(null);
    log.info("[chatrelay] joined #{}", key);
  }

  @Override
  public void onServerResponse(ServerResponseEvent event) {
    int code = event.getCode();
    if (!isJoinFailureNumeric(code)) return;
    String line = event.getRawLine();
    String channel = channelFromNumeric(line);
    failPendingJoin(channel == null ? null : TwitchConnectionState.channelKey(channel), line);
  }

  static RawPushMessage toRaw(String channel, String nick, String text, Map<String, String> tags) {
    return new RawPushMessage(
        TwitchTags.value(tags, TwitchTags.ID),
        TwitchConnectionState.channelKey(channel),
        nick == null ? "" : nick.toLowerCase(Locale.ROOT),
        TwitchTags.value(tags, TwitchTags.DISPLAY_NAME),
        text,
        TwitchTags.flag(tags, TwitchTags.SUBSCRIBER),
        TwitchTags.flag(tags, TwitchTags.MOD),
        TwitchTags.value(tags, TwitchTags.COLOR));
  }

  static boolean isAuthFailure(String text) {
    if (text == null) return false;
    String t = text.toLowerCase(Locale.ROOT);
    for (String marker : AUTH_FAILURE_TEXT) {
      if (t.contains(marker)) return true;
    }
    return false;
  }

  /** Shape is {@code :server <code> <nick> <channel> :<message>}; returns the first channel token. */
  static String channelFromNumeric(String rawLine) {
    if (rawLine == null || rawLine.isBlank()) return null;
    String head = rawLine.trim();
    int idx = head.indexOf(" :");
    if (idx >= 0) head = head.substring(0, idx);
    String[] parts = head.split("\\s+");
    int start = parts.length > 0 && parts[0].startsWith(":") ? 3 : 2;
    for (int i = start; i < parts.length; i++) {
      if (parts[i].startsWith("#")) return parts[i];
    }
    return null;
  }

  private void deliver(RawPushMessage raw) {
    try {
      handler.get().onMessage(raw);
    } catch (RuntimeException e) {
      log.warn("[chatrelay] dropping inbound twitch line from #{}", raw.channel(), e);
    }
  }

  private void failLogin(String text) {
    log.warn("[chatrelay] twitch login rejected: {}", text);
    conn.login.get().completeExceptionally(new AuthException("Twitch login rejected: " + text));
  }

  private void failPendingJoin(String key, String reason) {
    if (key == null) {
      // Refusals for channels we never joined may arrive without a resolvable channel;
      // joins are issued one at a time, so a lone pending join is the one refused.
      if (conn.pendingJoins.size() != 1) return;
      key = conn.pendingJoins.keySet().iterator().next();
    }
    CompletableFuture<Void> pending = conn.pendingJoins.remove(key);
    if (pending != null) {
      pending.completeExceptionally(new JoinException(key, "Join refused: " + reason));
    }
  }

  private void failAllPendingJoins(String reason) {
    Iterator<Map.Entry<String, CompletableFuture<Void>>> it = conn.pendingJoins.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, CompletableFuture<Void>> e = it.next();
      it.remove();
      e.getValue().completeExceptionally(new JoinException(e.getKey(), "Disconnected: " + reason));
    }
  }
}
