package cafe.woden.chatrelay.session;

import cafe.woden.chatrelay.config.RelayProperties;
import cafe.woden.chatrelay.connector.PullConnector;
import cafe.woden.chatrelay.connector.PushConnector;
import cafe.woden.chatrelay.model.SessionSnapshot;
import cafe.woden.chatrelay.model.StartRequest;
import cafe.woden.chatrelay.util.NamedThreads;
import cafe.woden.chatrelay.util.RelaySchedulers;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Clock;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Aggregation sessions keyed by session id.
 *
 * <p>Sessions are created by their first subscriber and evicted once they are idle with no
 * subscribers left. Each one gets its own single-threaded control executor.
 */
@Service
@ApplicationLayer
public class SessionRegistry {
  private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

  private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

  /** A session plus the executor its control scheduler runs on (null when externally owned). */
  private record Entry(AggregationSession session, ExecutorService controlExecutor) {}

  private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
  private final Function<String, Entry> factory;

  @Autowired
  public SessionRegistry(PushConnector push, PullConnector pull, RelayProperties props) {
    this.factory = id -> {
      ExecutorService exec = NamedThreads.newSingleThreadExecutor("chatrelay-session-" + id);
      AggregationSession session =
          new AggregationSession(
              id,
              new SubscriberHub(),
              push,
              pull,
              Schedulers.from(exec),
              RelaySchedulers.io(),
              RelaySchedulers.timer(),
              new PollBackoff(props.youtube().pollIntervalMs(), props.youtube().fetchBackoff()),
              Clock.systemUTC());
      return new Entry(session, exec);
    };
  }

  /** Every session shares the given schedulers; used by tests. */
  SessionRegistry(
      PushConnector push,
      PullConnector pull,
      Scheduler control,
      Scheduler io,
      Scheduler timer,
      PollBackoff pollDelays,
      Clock clock) {
    this.factory = id -> new Entry(
        new AggregationSession(
            id, new SubscriberHub(), push, pull, control, io, timer, pollDelays, clock),
        null);
  }

  /** Registers a subscriber with {@code sessionId}, creating the session if needed. */
  public String subscribe(String sessionId, Subscriber subscriber) {
    String id = requireValidId(sessionId);
    Objects.requireNonNull(subscriber, "subscriber");
    String[] subscriberId = new String[1];
    sessions.compute(id, (key, existing) -> {
      Entry entry = existing != null ? existing : create(key);
      subscriberId[0] = entry.session().hub().register(subscriber);
      return entry;
    });
    log.info("[chatrelay] subscriber {} joined session {}", subscriberId[0], id);
    return subscriberId[0];
  }

  /** Idempotent; unknown sessions and subscribers are ignored. */
  public boolean unsubscribe(String sessionId, String subscriberId) {
    Entry entry = sessionId == null ? null : sessions.get(sessionId);
    if (entry == null) return false;
    boolean removed = entry.session().hub().unregister(subscriberId);
    if (removed) {
      log.info("[chatrelay] subscriber {} left session {}", subscriberId, sessionId);
      evictIfUnused(sessionId, entry);
    }
    return removed;
  }

  /**
   * Starts (or extends) the session.
   *
   * @throws IllegalArgumentException if the request names no channel
   * @throws IllegalStateException if the session has no subscribers
   */
  public SessionSnapshot start(String sessionId, StartRequest request) {
    Objects.requireNonNull(request, "request");
    if (request.isEmpty()) {
      throw new IllegalArgumentException("A start request needs a push or a pull channel");
    }
    Entry entry = sessionId == null ? null : sessions.get(sessionId);
    if (entry == null || entry.session().hub().currentCount() == 0) {
      throw new IllegalStateException("Session " + sessionId + " has no subscribers");
    }
    AggregationSession session = entry.session();
    session.start(request).subscribe(
        () -> log.debug("[chatrelay] session {} start finished: {}", sessionId, session.snapshot()),
        err -> log.warn("[chatrelay] session {} start failed", sessionId, err));
    return session.snapshot();
  }

  public Optional<SessionSnapshot> snapshot(String sessionId) {
    Entry entry = sessionId == null ? null : sessions.get(sessionId);
    return entry == null ? Optional.empty() : Optional.of(entry.session().snapshot());
  }

  public SessionSnapshot requireSnapshot(String sessionId) {
    return snapshot(sessionId)
        .orElseThrow(() -> new NoSuchElementException("No session " + sessionId));
  }

  public int size() {
    return sessions.size();
  }

  /** Stops every session. Called once at application shutdown. */
  public void shutdown() {
    for (Map.Entry<String, Entry> e : sessions.entrySet()) {
      Entry entry = e.getValue();
      try {
        entry.session().stop().blockingAwait(5, TimeUnit.SECONDS);
      } catch (RuntimeException ex) {
        log.warn("[chatrelay] session {} did not stop cleanly", e.getKey(), ex);
      }
      if (entry.controlExecutor() != null) entry.controlExecutor().shutdownNow();
    }
    sessions.clear();
    log.info("[chatrelay] session registry shut down");
  }

  private Entry create(String id) {
    Entry entry = factory.apply(id);
    entry.session().onIdle(() -> evictIfUnused(id, entry));
    log.info("[chatrelay] created session {}", id);
    return entry;
  }

  private void evictIfUnused(String id, Entry entry) {
    boolean[] evicted = new boolean[1];
    // Inside computeIfPresent so a concurrent subscribe cannot land on an evicted entry.
    sessions.computeIfPresent(id, (key, current) -> {
      AggregationSession session = current.session();
      if (current != entry || session.hub().currentCount() > 0 || !session.isSettled()) {
        return current;
      }
      evicted[0] = true;
      return null;
    });
    if (evicted[0]) {
      if (entry.controlExecutor() != null) entry.controlExecutor().shutdown();
      log.info("[chatrelay] evicted idle session {}", id);
    }
  }

  static String requireValidId(String sessionId) {
    if (sessionId == null || !SESSION_ID.matcher(sessionId).matches()) {
      throw new IllegalArgumentException("Invalid session id: " + sessionId);
    }
    return sessionId;
  }
}
