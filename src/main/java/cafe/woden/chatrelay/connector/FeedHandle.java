package cafe.woden.chatrelay.connector;

import java.util.Objects;

/** A resolved pull feed: the channel that was searched and the live feed it resolved to. */
public record FeedHandle(String channelId, String feedId) {

  public FeedHandle {
    channelId = Objects.requireNonNull(channelId, "channelId").trim();
    feedId = Objects.requireNonNull(feedId, "feedId").trim();
    if (feedId.isEmpty()) throw new IllegalArgumentException("feedId is blank");
  }
}
