package cafe.woden.chatrelay.connector;

import java.time.Instant;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;

/** Wraps the poll-based source. Stateless between calls: the caller carries the watermark. */
@ApplicationLayer
public interface PullConnector {

  /** Empty when no live feed can be found, which is a normal outcome rather than an error. */
  Optional<FeedHandle> resolveFeed(String channelId) throws FetchException;

  /**
   * Fetches one batch and drops everything published at or before {@code watermark}.
   *
   * @param watermark publish time of the newest item already delivered, or null for none
   * @throws FetchException on a transient failure; the caller keeps polling the same handle
   */
  PollResult poll(FeedHandle feed, Instant watermark) throws FetchException;
}
