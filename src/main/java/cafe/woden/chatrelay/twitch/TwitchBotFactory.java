package cafe.woden.chatrelay.twitch;

import cafe.woden.chatrelay.config.RelayProperties;
import cafe.woden.chatrelay.connector.PushCredentials;
import javax.net.SocketFactory;
import javax.net.ssl.SSLSocketFactory;
import org.pircbotx.Configuration;
import org.pircbotx.PircBotX;
import org.pircbotx.cap.EnableCapHandler;
import org.pircbotx.hooks.ListenerAdapter;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link PircBotX} configured for Twitch chat.
 *
 * <p>Keeps {@link PircbotxPushTransport} focused on the connect/join handshake.
 */
@Component
public class TwitchBotFactory {

  static final String OAUTH_PREFIX = "oauth:";

  private final RelayProperties.Twitch settings;

  public TwitchBotFactory(RelayProperties props) {
    this.settings = props.twitch();
  }

  PircBotX build(PushCredentials credentials, ListenerAdapter listener) {
    SocketFactory socketFactory =
        settings.tls() ? SSLSocketFactory.getDefault() : SocketFactory.getDefault();

    Configuration.Builder builder =
        new Configuration.Builder()
            .setName(credentials.username())
            .setLogin(credentials.username())
            .setServerPassword(serverPassword(credentials.token()))
            .addServer(settings.host(), settings.port())
            .setSocketFactory(socketFactory)
            .setCapEnabled(true)
            // Tags carry message ids, display names, badges and colors.
            .addCapHandler(new EnableCapHandler("twitch.tv/tags", true))
            // NOTICE/USERNOTICE with msg-id tags, used to detect refused joins.
            .addCapHandler(new EnableCapHandler("twitch.tv/commands", true))
            // Twitch does not answer WHO.
            .setOnJoinWhoEnabled(false)
            // The nick is the account; a changed nick would be a different identity.
            .setAutoNickChange(false)
            .setAutoReconnect(false)
            .addListener(listener);

    return new PircBotX(builder.buildConfiguration());
  }

  static String serverPassword(String token) {
    String t = token == null ? "" : token.trim();
    if (t.isEmpty() || t.startsWith(OAUTH_PREFIX)) return t;
    return OAUTH_PREFIX + t;
  }
}
