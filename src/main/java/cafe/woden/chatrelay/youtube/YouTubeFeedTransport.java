package cafe.woden.chatrelay.youtube;

import cafe.woden.chatrelay.config.RelayProperties;
import cafe.woden.chatrelay.connector.FeedItem;
import cafe.woden.chatrelay.connector.FeedTransport;
import cafe.woden.chatrelay.connector.FetchException;
import cafe.woden.chatrelay.connector.FetchOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link FeedTransport} over the YouTube Data API v3.
 *
 * <p>The feed id is a video's {@code activeLiveChatId}; batches come from
 * {@code liveChat/messages}. Terminal API errors are classified by their {@code reason} code.
 */
@Component
public class YouTubeFeedTransport implements FeedTransport {
  private static final Logger log = LoggerFactory.getLogger(YouTubeFeedTransport.class);

  private static final ObjectMapper JSON = new ObjectMapper();

  private static final Set<String> FEED_ENDED_REASONS =
      Set.of("liveChatEnded", "liveChatNotFound", "liveChatDisabled");
  private static final Set<String> QUOTA_REASONS =
      Set.of("quotaExceeded", "dailyLimitExceeded", "rateLimitExceeded");

  private final RelayProperties.YouTube settings;
  private final HttpClient client;

  @Autowired
  public YouTubeFeedTransport(RelayProperties props) {
    this(
        props.youtube(),
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(props.youtube().connectTimeoutSeconds()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
  }

  YouTubeFeedTransport(RelayProperties.YouTube settings, HttpClient client) {
    this.settings = settings;
    this.client = client;
  }

  @Override
  public Optional<String> searchActiveFeed(String channelId) throws FetchException {
    Map<String, String> search = new LinkedHashMap<>();
    search.put("part", "snippet");
    search.put("channelId", channelId);
    search.put("eventType", "live");
    search.put("type", "video");
    JsonNode found = get("search", search).body();

    Optional<String> videoId = firstLiveVideoId(found);
    if (videoId.isEmpty()) return Optional.empty();

    Map<String, String> videos = new LinkedHashMap<>();
    videos.put("part", "liveStreamingDetails");
    videos.put("id", videoId.get());
    JsonNode details = get("videos", videos).body();

    Optional<String> chatId = activeLiveChatId(details);
    if (chatId.isEmpty()) {
      log.info("[chatrelay] live video {} of {} has no active chat", videoId.get(), channelId);
    }
    return chatId;
  }

  @Override
  public FetchOutcome fetchBatch(String feedId, int maxResults) throws FetchException {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("liveChatId", feedId);
    params.put("part", "snippet,authorDetails");
    params.put("maxResults", String.valueOf(maxResults));

    ApiResponse response = get("liveChat/messages", params);
    if (response.ok()) return parseBatch(response.body());

    Optional<FetchOutcome.Ended> ended = classifyError(response.body());
    if (ended.isPresent()) return ended.get();
    throw new FetchException(
        "liveChat/messages returned HTTP " + response.status() + ": " + errorMessage(response.body()),
        response.status(),
        null);
  }

  private record ApiResponse(int status, JsonNode body) {
    boolean ok() {
      return status >= 200 && status < 300;
    }
  }

  /** Non-2xx responses from {@code liveChat/messages} are returned for classification. */
  private ApiResponse get(String resource, Map<String, String> params) throws FetchException {
    if (settings.apiKey().isEmpty()) {
      throw new FetchException("YouTube API key is not configured");
    }
    StringBuilder url = new StringBuilder(settings.baseUrl()).append('/').append(resource).append('?');
    for (Map.Entry<String, String> p : params.entrySet()) {
      url.append(encode(p.getKey())).append('=').append(encode(p.getValue())).append('&');
    }
    url.append("key=").append(encode(settings.apiKey()));

    HttpRequest request =
        HttpRequest.newBuilder(URI.create(url.toString()))
            .timeout(Duration.ofSeconds(settings.readTimeoutSeconds()))
            .header("Accept", "application/json")
            .GET()
            .build();

    HttpResponse<String> resp;
    try {
      resp = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new FetchException(resource + " request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException(resource + " request interrupted", e);
    }

    JsonNode body = readJson(resp.body());
    int status = resp.statusCode();
    if ((status < 200 || status >= 300) && !"liveChat/messages".equals(resource)) {
      throw new FetchException(
          resource + " returned HTTP " + status + ": " + errorMessage(body), status, null);
    }
    return new ApiResponse(status, body);
  }

  static Optional<String> firstLiveVideoId(JsonNode searchResponse) {
    JsonNode items = searchResponse.path("items");
    if (!items.isArray() || items.isEmpty()) return Optional.empty();
    return nonBlank(items.get(0).path("id").path("videoId").asText(""));
  }

  static Optional<String> activeLiveChatId(JsonNode videosResponse) {
    JsonNode items = videosResponse.path("items");
    if (!items.isArray() || items.isEmpty()) return Optional.empty();
    return nonBlank(
        items.get(0).path("liveStreamingDetails").path("activeLiveChatId").asText(""));
  }

  static FetchOutcome.Batch parseBatch(JsonNode root) {
    List<FeedItem> out = new ArrayList<>();
    for (JsonNode item : root.path("items")) {
      String id = item.path("id").asText("");
      Instant publishedAt = parseInstant(item.path("snippet").path("publishedAt").asText(""));
      // Items without an id or timestamp cannot be deduped; skip them.
      if (id.isBlank() || publishedAt == null) continue;

      JsonNode author = item.path("authorDetails");
      out.add(
          new FeedItem(
              id,
              author.path("displayName").asText(""),
              item.path("snippet").path("displayMessage").asText(""),
              author.path("isChatSponsor").asBoolean(false),
              publishedAt));
    }
    boolean offline = root.hasNonNull("offlineAt");
    return new FetchOutcome.Batch(out, offline);
  }

  static Optional<FetchOutcome.Ended> classifyError(JsonNode root) {
    for (JsonNode err : root.path("error").path("errors")) {
      String reason = err.path("reason").asText("");
      if (FEED_ENDED_REASONS.contains(reason)) {
        return Optional.of(new FetchOutcome.Ended(FetchOutcome.EndReason.FEED_ENDED, reason));
      }
      if (QUOTA_REASONS.contains(reason)) {
        return Optional.of(new FetchOutcome.Ended(FetchOutcome.EndReason.QUOTA_EXHAUSTED, reason));
      }
    }
    return Optional.empty();
  }

  private static String errorMessage(JsonNode root) {
    String msg = root.path("error").path("message").asText("");
    return msg.isBlank() ? "(no error message)" : msg;
  }

  private static JsonNode readJson(String body) throws FetchException {
    if (body == null || body.isBlank()) return JSON.createObjectNode();
    try {
      return JSON.readTree(body);
    } catch (IOException e) {
      throw new FetchException("Malformed JSON from YouTube: " + e.getMessage(), e);
    }
  }

  private static Instant parseInstant(String s) {
    if (s == null || s.isBlank()) return null;
    try {
      // ISO_INSTANT accepts both "Z" and numeric offsets.
      return Instant.parse(s);
    } catch (DateTimeParseException e) {
      log.debug("[chatrelay] unparseable publishedAt '{}'", s);
      return null;
    }
  }

  private static Optional<String> nonBlank(String s) {
    return (s == null || s.isBlank()) ? Optional.empty() : Optional.of(s.trim());
  }

  private static String encode(String s) {
    return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8);
  }
}
