package cafe.woden.chatrelay.session;

import cafe.woden.chatrelay.connector.FeedHandle;
import cafe.woden.chatrelay.connector.FetchOutcome;
import cafe.woden.chatrelay.connector.PollResult;
import cafe.woden.chatrelay.connector.PullConnector;
import cafe.woden.chatrelay.connector.PushConnector;
import cafe.woden.chatrelay.connector.PushHandle;
import cafe.woden.chatrelay.model.NoticeKind;
import cafe.woden.chatrelay.model.NormalizedMessage;
import cafe.woden.chatrelay.model.RelayEvent;
import cafe.woden.chatrelay.model.SessionPhase;
import cafe.woden.chatrelay.model.SessionSnapshot;
import cafe.woden.chatrelay.model.StartRequest;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.disposables.SerialDisposable;
import io.reactivex.rxjava3.subjects.CompletableSubject;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One aggregation: at most one push attachment and one pull feed, merged into the session's
 * {@link SubscriberHub}.
 *
 * <p>All state below is confined to the {@code control} scheduler, which must be single
 * threaded. Blocking connector calls run on {@code io}; their results hop back to
 * {@code control} before they touch state. Start sequences are queued, so at most one is in
 * flight.
 */
public final class AggregationSession {
  private static final Logger log = LoggerFactory.getLogger(AggregationSession.class);

  private final String sessionId;
  private final SubscriberHub hub;
  private final PushConnector push;
  private final PullConnector pull;
  private final Scheduler control;
  private final Scheduler io;
  private final Scheduler timer;
  private final PollBackoff pollDelays;
  private final Clock clock;

  // Confined to control.
  private SessionPhase phase = SessionPhase.IDLE;
  private PushHandle pushHandle;
  private Disposable pushStream = Disposable.disposed();
  private FeedHandle feedHandle;
  private Instant watermark;
  private int consecutiveFetchFailures;
  private long generation;
  private long pollEpoch;
  private int attemptsInFlight;
  private Completable startTail = Completable.complete();
  private final SerialDisposable pollTask = new SerialDisposable();

  private volatile SessionSnapshot published;
  private volatile boolean settled = true;
  private volatile Runnable onIdle = () -> {};

  AggregationSession(
      String sessionId,
      SubscriberHub hub,
      PushConnector push,
      PullConnector pull,
      Scheduler control,
      Scheduler io,
      Scheduler timer,
      PollBackoff pollDelays,
      Clock clock) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.hub = Objects.requireNonNull(hub, "hub");
    this.push = Objects.requireNonNull(push, "push");
    this.pull = Objects.requireNonNull(pull, "pull");
    this.control = Objects.requireNonNull(control, "control");
    this.io = Objects.requireNonNull(io, "io");
    this.timer = Objects.requireNonNull(timer, "timer");
    this.pollDelays = Objects.requireNonNull(pollDelays, "pollDelays");
    this.clock = Objects.requireNonNull(clock, "clock");
    publish();
    hub.onEmpty(this::subscribersGone);
  }

  public SubscriberHub hub() {
    return hub;
  }

  /**
   * Runs on {@code control} each time the session settles: {@link SessionPhase#IDLE} with no
   * attach or resolve still running.
   */
  void onIdle(Runnable listener) {
    this.onIdle = Objects.requireNonNull(listener, "listener");
  }

  /** Idle with no connector call in flight, so the control scheduler can be released. */
  boolean isSettled() {
    return settled;
  }

  public SessionSnapshot snapshot() {
    SessionSnapshot s = published;
    return new SessionSnapshot(
        s.sessionId(),
        s.phase(),
        s.pushSourceHandle(),
        s.pullSourceHandle(),
        s.watermark(),
        hub.currentCount());
  }

  /**
   * Attaches whatever the request names that is not attached yet.
   *
   * <p>A channel that is already attached is left alone. A different channel of an attached
   * kind replaces it. Requests made while the session is ending are ignored.
   *
   * @return completes once every attach attempt of this request has finished
   */
  public Completable start(StartRequest request) {
    Objects.requireNonNull(request, "request");
    CompletableSubject done = CompletableSubject.create();
    control.scheduleDirect(() -> {
      Completable sequence =
          startTail.andThen(Completable.defer(() -> startSequence(request))).cache();
      startTail = sequence.onErrorComplete();
      sequence.subscribe(done);
    });
    return done.hide();
  }

  /** Tears the session down regardless of subscribers. Used at shutdown. */
  public Completable stop() {
    return Completable.fromAction(() -> teardown("stopped")).subscribeOn(control);
  }

  private Completable startSequence(StartRequest request) {
    if (phase == SessionPhase.ENDING) {
      log.info("[chatrelay] session {} is ending; ignoring start {}", sessionId, request);
      return Completable.complete();
    }

    long gen = generation;
    List<Completable> attempts = new ArrayList<>(2);

    Optional<String> wantPush = request.push();
    if (wantPush.isPresent()
        && (pushHandle == null || !pushHandle.channel().equals(wantPush.get()))) {
      if (pushHandle != null) detachPush("switching to #" + wantPush.get());
      attempts.add(attachPush(wantPush.get(), gen));
    }

    Optional<String> wantPull = request.pull();
    if (wantPull.isPresent()
        && (feedHandle == null || !feedHandle.channelId().equals(wantPull.get()))) {
      if (feedHandle != null) detachPull("switching to " + wantPull.get());
      attempts.add(resolvePull(wantPull.get(), gen));
    }

    if (attempts.isEmpty()) {
      log.debug("[chatrelay] session {}: start {} changes nothing", sessionId, request);
      return Completable.complete();
    }

    attemptsInFlight += attempts.size();
    if (phase == SessionPhase.IDLE) transition(SessionPhase.STARTING);

    return Completable.merge(attempts)
        .observeOn(control)
        .doOnComplete(() -> {
          if (gen == generation && phase == SessionPhase.STARTING) {
            transition(SessionPhase.ACTIVE);
          }
        });
  }

  // -- push --------------------------------------------------------------------------------

  private Completable attachPush(String channel, long gen) {
    return Single.fromCallable(() -> push.attach(channel))
        .subscribeOn(io)
        .observeOn(control)
        .doOnSuccess(handle -> onPushAttached(handle, gen))
        .doOnError(err -> onPushAttachFailed(channel, gen, err))
        .doFinally(this::attemptFinished)
        .ignoreElement()
        .onErrorComplete();
  }

  private void onPushAttached(PushHandle handle, long gen) {
    if (gen != generation || phase == SessionPhase.ENDING) {
      // Torn down while attaching.
      push.detach(handle);
      return;
    }
    pushHandle = handle;
    pushStream =
        push.messages(handle)
            .subscribe(
                msg -> hub.broadcast(new RelayEvent.ChatMessage(msg)),
                err -> control.scheduleDirect(() -> onPushLost(handle, err)));
    log.info("[chatrelay] session {} attached to #{}", sessionId, handle.channel());
    publish();
  }

  private void onPushAttachFailed(String channel, long gen, Throwable err) {
    log.warn("[chatrelay] session {} could not attach #{}: {}", sessionId, channel, err.toString());
    if (gen != generation) return;
    notice(NoticeKind.CONNECTOR_FAILED,
        "Could not join Twitch channel #" + channel + ": " + describe(err));
  }

  private void onPushLost(PushHandle handle, Throwable err) {
    if (handle != pushHandle) return;
    log.warn("[chatrelay] session {} lost #{}: {}", sessionId, handle.channel(), err.toString());
    notice(NoticeKind.CONNECTION_LOST, "Lost connection to Twitch: " + describe(err));
    detachPush("connection lost");
    endIfNothingAttached();
  }

  private void detachPush(String why) {
    PushHandle h = pushHandle;
    if (h == null) return;
    pushStream.dispose();
    pushStream = Disposable.disposed();
    pushHandle = null;
    push.detach(h);
    log.info("[chatrelay] session {} detached #{} ({})", sessionId, h.channel(), why);
    publish();
  }

  // -- pull --------------------------------------------------------------------------------

  private Completable resolvePull(String channelId, long gen) {
    return Single.fromCallable(() -> pull.resolveFeed(channelId))
        .subscribeOn(io)
        .observeOn(control)
        .doOnSuccess(feed -> onFeedResolved(channelId, feed, gen))
        .doOnError(err -> onFeedResolveFailed(channelId, gen, err))
        .doFinally(this::attemptFinished)
        .ignoreElement()
        .onErrorComplete();
  }

  private void onFeedResolved(String channelId, Optional<FeedHandle> feed, long gen) {
    if (gen != generation || phase == SessionPhase.ENDING) return;
    if (feed.isEmpty()) {
      notice(NoticeKind.FEED_NOT_FOUND,
          "Could not find an active YouTube live stream for channel " + channelId + ".");
      return;
    }
    feedHandle = feed.get();
    // Start from now: the backlog that predates the request is not replayed.
    watermark = clock.instant();
    consecutiveFetchFailures = 0;
    long epoch = ++pollEpoch;
    log.info("[chatrelay] session {} polling feed {} of {}", sessionId, feedHandle.feedId(), channelId);
    publish();
    schedulePoll(epoch, pollDelays.intervalMs());
  }

  private void onFeedResolveFailed(String channelId, long gen, Throwable err) {
    log.warn("[chatrelay] session {} could not resolve {}: {}", sessionId, channelId, err.toString());
    if (gen != generation) return;
    notice(NoticeKind.CONNECTOR_FAILED,
        "Could not look up YouTube channel " + channelId + ": " + describe(err));
  }

  private void schedulePoll(long epoch, long delayMs) {
    FeedHandle feed = feedHandle;
    Instant since = watermark;
    pollTask.set(
        Completable.timer(delayMs, TimeUnit.MILLISECONDS, timer)
            .andThen(Single.fromCallable(() -> pull.poll(feed, since)).subscribeOn(io))
            .observeOn(control)
            .subscribe(
                result -> onPollResult(epoch, result),
                err -> onPollFailed(epoch, err)));
  }

  private void onPollResult(long epoch, PollResult result) {
    if (epoch != pollEpoch || feedHandle == null) return;

    for (NormalizedMessage msg : result.messages()) {
      hub.broadcast(new RelayEvent.ChatMessage(msg));
    }
    if (result.watermark() != null && (watermark == null || result.watermark().isAfter(watermark))) {
      watermark = result.watermark();
    }
    consecutiveFetchFailures = 0;
    publish();

    if (result.terminal()) {
      notice(NoticeKind.FEED_ENDED, endedText(result.endReason()));
      detachPull("feed ended");
      endIfNothingAttached();
      return;
    }
    schedulePoll(epoch, pollDelays.intervalMs());
  }

  private void onPollFailed(long epoch, Throwable err) {
    if (epoch != pollEpoch || feedHandle == null) return;

    consecutiveFetchFailures++;
    long delay = pollDelays.delayAfterFailures(consecutiveFetchFailures);
    log.warn("[chatrelay] session {} fetch failed ({} in a row, next try in {}ms): {}",
        sessionId, consecutiveFetchFailures, delay, err.toString());
    // One notice per failure streak.
    if (consecutiveFetchFailures == 1) {
      notice(NoticeKind.FETCH_ERROR, "Error fetching YouTube live chat: " + describe(err));
    }
    schedulePoll(epoch, delay);
  }

  private void detachPull(String why) {
    FeedHandle f = feedHandle;
    if (f == null) return;
    pollEpoch++;
    pollTask.set(Disposable.disposed());
    feedHandle = null;
    watermark = null;
    consecutiveFetchFailures = 0;
    log.info("[chatrelay] session {} stopped polling feed {} ({})", sessionId, f.feedId(), why);
    publish();
  }

  private static String endedText(FetchOutcome.EndReason reason) {
    if (reason == FetchOutcome.EndReason.QUOTA_EXHAUSTED) {
      return "YouTube API quota exhausted; live chat polling stopped.";
    }
    return "YouTube Live Chat has ended.";
  }

  // -- lifecycle ---------------------------------------------------------------------------

  private void attemptFinished() {
    attemptsInFlight--;
    boolean wasSettled = settled;
    updateSettled();
    // A teardown that ran while this attempt was in flight could not release the session yet.
    if (settled && !wasSettled) onIdle.run();
  }

  private void updateSettled() {
    settled = phase == SessionPhase.IDLE && attemptsInFlight == 0;
  }

  private void subscribersGone() {
    log.info("[chatrelay] session {} has no subscribers left", sessionId);
    control.scheduleDirect(() -> {
      // Someone may have registered again while this was queued.
      if (hub.currentCount() > 0) return;
      teardown("no subscribers");
    });
  }

  private void endIfNothingAttached() {
    if (pushHandle != null || feedHandle != null) return;
    if (phase != SessionPhase.ACTIVE) return;
    teardown("nothing attached");
  }

  private void teardown(String why) {
    if (phase == SessionPhase.IDLE && pushHandle == null && feedHandle == null) return;
    transition(SessionPhase.ENDING);
    generation++;
    detachPush(why);
    detachPull(why);
    consecutiveFetchFailures = 0;
    transition(SessionPhase.IDLE);
    if (settled) onIdle.run();
  }

  private void transition(SessionPhase next) {
    if (phase == next) return;
    log.info("[chatrelay] session {}: {} -> {}", sessionId, phase, next);
    phase = next;
    updateSettled();
    publish();
  }

  private void notice(NoticeKind kind, String text) {
    hub.broadcast(new RelayEvent.Notice(kind, text));
  }

  private void publish() {
    published =
        new SessionSnapshot(
            sessionId,
            phase,
            pushHandle == null ? null : "#" + pushHandle.channel(),
            feedHandle == null ? null : feedHandle.feedId(),
            watermark,
            0);
  }

  private static String describe(Throwable t) {
    String msg = t.getMessage();
    return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
  }
}
