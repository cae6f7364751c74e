package cafe.woden.chatrelay.session;

import cafe.woden.chatrelay.config.RelayProperties;
import java.util.concurrent.ThreadLocalRandom;

/** Delay before the next poll, given how many fetches in a row have failed. */
final class PollBackoff {

  private final long intervalMs;
  private final RelayProperties.Backoff backoff;

  PollBackoff(long intervalMs, RelayProperties.Backoff backoff) {
    this.intervalMs = intervalMs;
    this.backoff = backoff;
  }

  long intervalMs() {
    return intervalMs;
  }

  long delayAfterFailures(int consecutiveFailures) {
    if (consecutiveFailures <= 0 || backoff == null || !backoff.enabled()) return intervalMs;

    double mult = Math.pow(backoff.multiplier(), Math.max(0, consecutiveFailures - 1));
    double raw = backoff.initialDelayMs() * mult;
    long capped = (long) Math.min(raw, (double) backoff.maxDelayMs());

    double jitter = backoff.jitterPct();
    if (jitter <= 0) return Math.max(intervalMs, capped);

    double factor = 1.0 + ThreadLocalRandom.current().nextDouble(-jitter, jitter);
    long withJitter = (long) Math.max(0, capped * factor);
    return Math.max(intervalMs, withJitter);
  }
}
