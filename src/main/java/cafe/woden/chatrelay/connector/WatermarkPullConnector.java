package cafe.woden.chatrelay.connector;

import cafe.woden.chatrelay.model.MessageSource;
import cafe.woden.chatrelay.model.NormalizedMessage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PullConnector} that dedups overlapping batches by publish time.
 *
 * <p>Each fetch returns the newest {@code batchSize} items, so consecutive batches overlap. An
 * item is forwarded only if it was published strictly after the watermark. The returned
 * watermark is the publish time of the last item in the batch (filtered or not), and never moves
 * backwards. This relies on the feed being ordered and on clock skew between polls being small
 * compared to the batch window.
 */
public final class WatermarkPullConnector implements PullConnector {
  private static final Logger log = LoggerFactory.getLogger(WatermarkPullConnector.class);

  public static final int DEFAULT_BATCH_SIZE = 200;

  private static final Comparator<FeedItem> BY_PUBLISHED =
      Comparator.comparing(FeedItem::publishedAt);

  private final FeedTransport transport;
  private final int batchSize;

  public WatermarkPullConnector(FeedTransport transport, int batchSize) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.batchSize = batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
  }

  @Override
  public Optional<FeedHandle> resolveFeed(String channelId) throws FetchException {
    String id = Objects.toString(channelId, "").trim();
    if (id.isEmpty()) return Optional.empty();

    Optional<String> feedId = transport.searchActiveFeed(id);
    if (feedId.isEmpty() || feedId.get().isBlank()) {
      log.info("[chatrelay] no active feed for pull channel {}", id);
      return Optional.empty();
    }
    return Optional.of(new FeedHandle(id, feedId.get()));
  }

  @Override
  public PollResult poll(FeedHandle feed, Instant watermark) throws FetchException {
    Objects.requireNonNull(feed, "feed");
    FetchOutcome outcome = transport.fetchBatch(feed.feedId(), batchSize);

    if (outcome instanceof FetchOutcome.Ended ended) {
      log.info(
          "[chatrelay] feed {} ended ({}): {}", feed.feedId(), ended.reason(), ended.detail());
      return PollResult.ended(List.of(), watermark, ended.reason());
    }

    FetchOutcome.Batch batch = (FetchOutcome.Batch) outcome;
    List<FeedItem> items = new ArrayList<>(batch.items());
    // Stable sort: a no-op for a well-behaved feed.
    items.sort(BY_PUBLISHED);

    List<NormalizedMessage> fresh = new ArrayList<>(items.size());
    for (FeedItem item : items) {
      if (watermark != null && !item.publishedAt().isAfter(watermark)) continue;
      fresh.add(normalize(item));
    }

    Instant next = advance(watermark, items);
    if (batch.offline()) {
      return PollResult.ended(fresh, next, FetchOutcome.EndReason.FEED_ENDED);
    }
    return PollResult.of(fresh, next);
  }

  static Instant advance(Instant watermark, List<FeedItem> orderedItems) {
    if (orderedItems.isEmpty()) return watermark;
    Instant last = orderedItems.get(orderedItems.size() - 1).publishedAt();
    if (watermark == null || last.isAfter(watermark)) return last;
    return watermark;
  }

  private static NormalizedMessage normalize(FeedItem item) {
    return new NormalizedMessage(
        item.id(), MessageSource.PULL, item.author(), item.text(), item.privileged(), null);
  }
}
