package cafe.woden.chatrelay.connector;

import cafe.woden.chatrelay.model.NormalizedMessage;
import java.time.Instant;
import java.util.List;

/**
 * What one poll produced.
 *
 * <p>The connector never applies this itself; the session owns the watermark and decides what
 * {@code terminal} means for its state.
 */
public record PollResult(
    List<NormalizedMessage> messages,
    Instant watermark,
    boolean terminal,
    FetchOutcome.EndReason endReason) {

  public PollResult {
    messages = messages == null ? List.of() : List.copyOf(messages);
    if (!terminal) endReason = null;
  }

  public static PollResult of(List<NormalizedMessage> messages, Instant watermark) {
    return new PollResult(messages, watermark, false, null);
  }

  public static PollResult ended(
      List<NormalizedMessage> messages, Instant watermark, FetchOutcome.EndReason reason) {
    return new PollResult(messages, watermark, true, reason);
  }
}
