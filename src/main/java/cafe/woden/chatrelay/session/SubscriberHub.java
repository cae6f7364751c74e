package cafe.woden.chatrelay.session;

import cafe.woden.chatrelay.model.RelayEvent;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The set of subscribers of one session.
 *
 * <p>Broadcasts are best-effort: a subscriber that throws is counted and skipped, and every
 * other subscriber still receives the event. Removing the last subscriber synchronously runs the
 * listener installed with {@link #onEmpty(Runnable)}.
 */
public final class SubscriberHub {
  private static final Logger log = LoggerFactory.getLogger(SubscriberHub.class);

  private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
  private final AtomicLong failedDeliveries = new AtomicLong();
  private final Object membershipLock = new Object();
  private volatile Runnable onEmpty = () -> {};

  public void onEmpty(Runnable listener) {
    this.onEmpty = Objects.requireNonNull(listener, "listener");
  }

  public String register(Subscriber subscriber) {
    Objects.requireNonNull(subscriber, "subscriber");
    String id = UUID.randomUUID().toString();
    synchronized (membershipLock) {
      subscribers.put(id, subscriber);
    }
    return id;
  }

  /** Idempotent. Returns whether {@code subscriberId} was registered. */
  public boolean unregister(String subscriberId) {
    if (subscriberId == null) return false;
    boolean nowEmpty;
    synchronized (membershipLock) {
      if (subscribers.remove(subscriberId) == null) return false;
      nowEmpty = subscribers.isEmpty();
    }
    // Outside the lock: the listener may call back into the hub.
    if (nowEmpty) onEmpty.run();
    return true;
  }

  public int currentCount() {
    return subscribers.size();
  }

  /** Total failed deliveries since creation. */
  public long failedDeliveries() {
    return failedDeliveries.get();
  }

  public BroadcastResult broadcast(RelayEvent event) {
    Objects.requireNonNull(event, "event");
    if (subscribers.isEmpty()) return BroadcastResult.NONE;

    int delivered = 0;
    int failed = 0;
    for (Map.Entry<String, Subscriber> e : subscribers.entrySet()) {
      try {
        e.getValue().deliver(event);
        delivered++;
      } catch (Exception ex) {
        failed++;
        log.debug("[chatrelay] delivery of '{}' to subscriber {} failed", event.name(), e.getKey(), ex);
      }
    }
    if (failed > 0) failedDeliveries.addAndGet(failed);
    return new BroadcastResult(delivered, failed);
  }
}
