package cafe.woden.chatrelay.connector;

import java.util.List;
import java.util.Objects;

/**
 * Result of one {@link FeedTransport#fetchBatch} call.
 *
 * <p>Terminal conditions are a distinct type instead of an error message to pattern-match.
 */
public sealed interface FetchOutcome permits FetchOutcome.Batch, FetchOutcome.Ended {

  enum EndReason {
    /** The live feed is gone (stream over, chat disabled, feed id no longer valid). */
    FEED_ENDED,
    /** The upstream refuses further calls for this credential. */
    QUOTA_EXHAUSTED
  }

  /**
   * Items ordered by publish time ascending.
   *
   * <p>{@code offline} means the upstream marked the feed as finished; the items are still valid
   * and nothing more will follow.
   */
  record Batch(List<FeedItem> items, boolean offline) implements FetchOutcome {
    public Batch {
      items = items == null ? List.of() : List.copyOf(items);
    }

    public static Batch of(List<FeedItem> items) {
      return new Batch(items, false);
    }
  }

  record Ended(EndReason reason, String detail) implements FetchOutcome {
    public Ended {
      Objects.requireNonNull(reason, "reason");
      detail = Objects.toString(detail, "");
    }
  }
}
