package cafe.woden.chatrelay.config;

import cafe.woden.chatrelay.connector.PushCredentials;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Relay configuration.
 *
 * <p>Example YAML:
 * <pre>
 * relay:
 *   twitch:
 *     username: mybot
 *     oauth-token: ${TWITCH_OAUTH_TOKEN}
 *   youtube:
 *     api-key: ${YOUTUBE_API_KEY}
 *     poll-interval-ms: 10000
 * </pre>
 */
@ConfigurationProperties(prefix = "relay")
public record RelayProperties(Twitch twitch, YouTube youtube, Web web) {

  public record Twitch(
      String host,
      int port,
      Boolean tls,
      String username,
      String oauthToken,
      long connectTimeoutMs,
      long joinTimeoutMs) {

    public Twitch {
      host = Objects.toString(host, "").trim();
      if (host.isEmpty()) host = "irc.chat.twitch.tv";
      if (tls == null) tls = true;
      if (port <= 0 || port > 65535) port = tls ? 6697 : 6667;
      username = Objects.toString(username, "").trim();
      oauthToken = Objects.toString(oauthToken, "").trim();
      if (connectTimeoutMs <= 0) connectTimeoutMs = 15_000;
      if (joinTimeoutMs <= 0) joinTimeoutMs = 10_000;
    }

    public PushCredentials credentials() {
      return new PushCredentials(username, oauthToken);
    }
  }

  public record YouTube(
      String apiKey,
      String baseUrl,
      int batchSize,
      long pollIntervalMs,
      int connectTimeoutSeconds,
      int readTimeoutSeconds,
      Backoff fetchBackoff) {

    public YouTube {
      apiKey = Objects.toString(apiKey, "").trim();
      baseUrl = Objects.toString(baseUrl, "").trim();
      if (baseUrl.isEmpty()) baseUrl = "https://www.googleapis.com/youtube/v3";
      while (baseUrl.endsWith("/")) baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
      // The API caps maxResults at 2000; 200 keeps one poll well inside the quota budget.
      if (batchSize <= 0) batchSize = 200;
      if (batchSize > 2000) batchSize = 2000;
      if (pollIntervalMs <= 0) pollIntervalMs = 10_000;
      if (connectTimeoutSeconds <= 0) connectTimeoutSeconds = 5;
      if (readTimeoutSeconds <= 0) readTimeoutSeconds = 10;
      if (fetchBackoff == null) fetchBackoff = new Backoff(false, 0, 0, 0, 0);
    }
  }

  /**
   * Delay growth after consecutive fetch failures.
   *
   * <p>Disabled, every poll runs on the plain interval.
   */
  public record Backoff(
      boolean enabled, long initialDelayMs, long maxDelayMs, double multiplier, double jitterPct) {
    public Backoff {
      if (initialDelayMs <= 0) initialDelayMs = 10_000;
      if (maxDelayMs <= 0) maxDelayMs = 120_000;
      if (maxDelayMs < initialDelayMs) maxDelayMs = initialDelayMs;
      if (multiplier < 1.1) multiplier = 2.0;
      if (jitterPct < 0) jitterPct = 0;
      if (jitterPct > 0.75) jitterPct = 0.75;
    }
  }

  public record Web(long sseKeepaliveMs) {
    public Web {
      if (sseKeepaliveMs <= 0) sseKeepaliveMs = 15_000;
    }
  }

  public RelayProperties {
    if (twitch == null) twitch = new Twitch(null, 0, null, null, null, 0, 0);
    if (youtube == null) youtube = new YouTube(null, null, 0, 0, 0, 0, null);
    if (web == null) web = new Web(0);
  }
}
