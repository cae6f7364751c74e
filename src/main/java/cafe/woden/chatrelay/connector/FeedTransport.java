package cafe.woden.chatrelay.connector;

import java.util.Optional;

/** Boundary to the paginated pull upstream. */
public interface FeedTransport {

  /** The active live feed of {@code channelId}, or empty if nothing is live. */
  Optional<String> searchActiveFeed(String channelId) throws FetchException;

  /** The most recent items of the feed (at most {@code maxResults}), oldest first. */
  FetchOutcome fetchBatch(String feedId, int maxResults) throws FetchException;
}
