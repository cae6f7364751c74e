package cafe.woden.chatrelay.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.chatrelay.connector.AuthException;
import cafe.woden.chatrelay.connector.ConnectException;
import cafe.woden.chatrelay.connector.FeedItem;
import cafe.woden.chatrelay.connector.FeedTransport;
import cafe.woden.chatrelay.connector.FetchException;
import cafe.woden.chatrelay.connector.FetchOutcome;
import cafe.woden.chatrelay.connector.WatermarkPullConnector;
import cafe.woden.chatrelay.model.MessageSource;
import cafe.woden.chatrelay.model.NoticeKind;
import cafe.woden.chatrelay.model.NormalizedMessage;
import cafe.woden.chatrelay.model.RelayEvent;
import cafe.woden.chatrelay.model.SessionPhase;
import cafe.woden.chatrelay.model.StartRequest;
import io.reactivex.rxjava3.schedulers.Schedulers;
import io.reactivex.rxjava3.schedulers.TestScheduler;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AggregationSessionTest {

  private static final long POLL_MS = 10_000;

  private final TestScheduler timer = new TestScheduler();
  private final FeedTransport feeds = mock(FeedTransport.class);
  private final FakePushConnector push = new FakePushConnector();
  private final SubscriberHub hub = new SubscriberHub();
  private final List<RelayEvent> inbox = new ArrayList<>();
  private AggregationSession session;
  private String viewer;

  @BeforeEach
  void setUp() throws Exception {
    // Feed resolution happens at t=5s, so the first watermark is 5s.
    Clock clock = Clock.fixed(Instant.ofEpochSecond(5), ZoneOffset.UTC);
    session = new AggregationSession(
        "room-1",
        hub,
        push,
        new WatermarkPullConnector(feeds, 200),
        Schedulers.trampoline(),
        Schedulers.trampoline(),
        timer,
        new PollBackoff(POLL_MS, null),
        clock);
    viewer = hub.register(inbox::add);
    when(feeds.searchActiveFeed("UC1")).thenReturn(Optional.of("chat-1"));
  }

  @Test
  void startAttachesBothSourcesAndBecomesActive() {
    assertEquals(SessionPhase.IDLE, session.snapshot().phase());

    session.start(new StartRequest("abc", "UC1")).blockingAwait();

    assertEquals(SessionPhase.ACTIVE, session.snapshot().phase());
    assertEquals("#abc", session.snapshot().pushSourceHandle());
    assertEquals("chat-1", session.snapshot().pullSourceHandle());
    assertEquals(Instant.ofEpochSecond(5), session.snapshot().watermark());
    assertEquals(1, session.snapshot().subscriberCount());
  }

  @Test
  void pushMessagesAreBroadcastInArrivalOrder() {
    session.start(new StartRequest("abc", null)).blockingAwait();

    push.only().onNext(pushMessage("1"));
    push.only().onNext(pushMessage("2"));

    assertThat(chatIds()).containsExactly("1", "2");
  }

  @Test
  void overlappingPollsDeliverEachItemOnce() throws Exception {
    when(feeds.fetchBatch("chat-1", 200))
        .thenReturn(batch(item("a", 10), item("b", 20), item("c", 30)))
        .thenReturn(batch(item("b", 20), item("c", 30), item("d", 40)));
    session.start(new StartRequest(null, "UC1")).blockingAwait();

    timer.advanceTimeBy(POLL_MS, TimeUnit.MILLISECONDS);
    assertThat(chatIds()).containsExactly("a", "b", "c");
    assertEquals(Instant.ofEpochSecond(30), session.snapshot().watermark());

    timer.advanceTimeBy(POLL_MS, TimeUnit.MILLISECONDS);
    assertThat(chatIds()).containsExactly("a", "b", "c", "d");
    assertEquals(Instant.ofEpochSecond(40), session.snapshot().watermark());
  }

  @Test
  void backlogOlderThanTheStartIsNotReplayed() throws Exception {
    when(feeds.fetchBatch("chat-1", 200)).thenReturn(batch(item("old", 3), item("new", 6)));
    session.start(new StartRequest(null, "UC1")).blockingAwait();

    timer.advanceTimeBy(POLL_MS, TimeUnit.MILLISECONDS);

    assertThat(chatIds()).containsExactly("new");
  }

  @Test
  void noPollBeforeTheFirstInterval() throws Exception {
    session.start(new StartRequest(null, "UC1")).blockingAwait();

    timer.advanceTimeBy(POLL_MS - 1, TimeUnit.MILLISECONDS);

    verify(feeds, never()).fetchBatch(anyString(), anyInt());
  }

  @Test
  void feedEndedNoticesOnceStopsPollingAndReturnsToIdle() throws Exception {
    when(feeds.fetchBatch("chat-1", 200))
        .thenReturn(new FetchOutcome.Ended(FetchOutcome.EndReason.FEED_ENDED, "liveChatEnded"));
    session.start(new StartRequest(null, "UC1")).blockingAwait();

    timer.advanceTimeBy(POLL_MS, TimeUnit.MILLISECONDS);
    timer.advanceTimeBy(POLL_MS * 5, TimeUnit.MILLISECONDS);

    assertThat(notices(NoticeKind.FEED_ENDED)).hasSize(1);
    verify(feeds, times(1)).fetchBatch("chat-1", 200);
    assertNull(session.snapshot().pullSourceHandle());
    assertNull(session.snapshot().watermark());
    assertEquals(SessionPhase.IDLE, session.snapshot().phase());
    assertEquals(1, hub.currentCount());
  }

  @Test
  void restartAfterFeedEndedResolvesFromScratch() throws Exception {
    when(feeds.fetchBatch("chat-1", 200))
        .thenReturn(new FetchOutcome.Ended(FetchOutcome.EndReason.FEED_ENDED, "liveChatEnded"));
    session.start(new StartRequest(null, "UC1")).blockingAwait();
    timer.advanceTimeBy(POLL_MS, TimeUnit.MILLISECONDS);

    session.start(new StartRequest(null, "UC1")).blockingAwait();

    verify(feeds, times(2)).searchActiveFeed("UC1");
    assertEquals(SessionPhase.ACTIVE, session.snapshot().phase());
  }

  @Test
  void feedEndedKeepsThePushSourceRunning() throws Exception {
    when(feeds.fetchBatch("chat-1", 200))
        .thenReturn(new FetchOutcome.Ended(FetchOutcome.EndReason.QUOTA_EXHAUSTED, "quotaExceeded"));
    session.start(new StartRequest("abc", "UC1")).blockingAwait();

    timer.advanceTimeBy(POLL_MS, TimeUnit.MILLISECONDS);

    assertEquals(SessionPhase.ACTIVE, session.snapshot().phase());
    assertEquals("#abc", session.snapshot().pushSourceHandle());
    assertThat(notices(NoticeKind.FEED_ENDED)).hasSize(1);
    assertThat(notices(NoticeKind.FEED_ENDED).get(0).text()).contains("quota");
    assertThat(push.detached).isEmpty();
  }

  @Test
  void fetchErrorsAreReportedOncePerStreakAndPollingContinues() throws Exception {
    when(feeds.fetchBatch("chat-1", 200))
        .thenThrow(new FetchException("HTTP 500"))
        .thenThrow(new FetchException("HTTP 503"))
        .thenReturn(batch(item("a", 10)));
    session.start(new StartRequest(null, "UC1")).blockingAwait();

    timer.advanceTimeBy(POLL_MS * 3, TimeUnit.MILLISECONDS);

    assertThat(notices(NoticeKind.FETCH_ERROR)).hasSize(1);
    assertThat(chatIds()).containsExactly("a");
    assertEquals(SessionPhase.ACTIVE, session.snapshot().phase());
  }

  @Test
  void feedNotFoundIsANoticeAndOnlyPushAttaches() throws Exception {
    when(feeds.searchActiveFeed("UCnothing")).thenReturn(Optional.empty());

    session.start(new StartRequest("abc", "UCnothing")).blockingAwait();

    assertThat(notices(NoticeKind.FEED_NOT_FOUND)).hasSize(1);
    assertNull(session.snapshot().pullSourceHandle());
    assertEquals("#abc", session.snapshot().pushSourceHandle());
    assertEquals(SessionPhase.ACTIVE, session.snapshot().phase());
  }

  @Test
  void pushAttachFailureDoesNotStopThePullSource() {
    push.failWith = new AuthException("Login authentication failed");

    session.start(new StartRequest("abc", "UC1")).blockingAwait();

    assertThat(notices(NoticeKind.CONNECTOR_FAILED)).hasSize(1);
    assertThat(notices(NoticeKind.CONNECTOR_FAILED).get(0).text()).contains("#abc");
    assertNull(session.snapshot().pushSourceHandle());
    assertEquals("chat-1", session.snapshot().pullSourceHandle());
    assertEquals(SessionPhase.ACTIVE, session.snapshot().phase());
  }

  @Test
  void bothSourcesFailingStillSettlesActive() throws Exception {
    push.failWith = new ConnectException("refused");
    when(feeds.searchActiveFeed("UC1")).thenThrow(new FetchException("HTTP 403"));

    session.start(new StartRequest("abc", "UC1")).blockingAwait();

    assertThat(notices(NoticeKind.CONNECTOR_FAILED)).hasSize(2);
    assertEquals(SessionPhase.ACTIVE, session.snapshot().phase());
    assertNull(session.snapshot().pushSourceHandle());
    assertNull(session.snapshot().pullSourceHandle());
  }

  @Test
  void repeatedStartDoesNotRejoin() throws Exception {
    session.start(new StartRequest("abc", "UC1")).blockingAwait();
    session.start(new StartRequest("#ABC", "UC1")).blockingAwait();

    assertThat(push.attached).containsExactly("abc");
    verify(feeds, times(1)).searchActiveFeed("UC1");
  }

  @Test
  void laterStartMayAddTheMissingSource() throws Exception {
    session.start(new StartRequest("abc", null)).blockingAwait();
    session.start(new StartRequest("abc", "UC1")).blockingAwait();

    assertThat(push.attached).containsExactly("abc");
    assertEquals("chat-1", session.snapshot().pullSourceHandle());
  }

  @Test
  void differentPushChannelReplacesTheOldOne() {
    session.start(new StartRequest("abc", null)).blockingAwait();
    session.start(new StartRequest("xyz", null)).blockingAwait();

    assertThat(push.attached).containsExactly("abc", "xyz");
    assertThat(push.detached).containsExactly("abc");
    assertEquals("#xyz", session.snapshot().pushSourceHandle());
  }

  @Test
  void onlyTheLastSubscriberLeavingTearsDown() throws Exception {
    String b = hub.register(e -> {});
    String c = hub.register(e -> {});
    session.start(new StartRequest("abc", "UC1")).blockingAwait();

    hub.unregister(viewer);
    assertEquals(SessionPhase.ACTIVE, session.snapshot().phase());
    assertEquals(2, session.snapshot().subscriberCount());

    hub.unregister(b);
    assertEquals(SessionPhase.ACTIVE, session.snapshot().phase());
    assertThat(push.detached).isEmpty();

    hub.unregister(c);
    assertEquals(SessionPhase.IDLE, session.snapshot().phase());
    assertThat(push.detached).containsExactly("abc");
    assertNull(session.snapshot().pushSourceHandle());
    assertNull(session.snapshot().pullSourceHandle());
    assertNull(session.snapshot().watermark());

    timer.advanceTimeBy(POLL_MS * 3, TimeUnit.MILLISECONDS);
    verify(feeds, never()).fetchBatch(anyString(), anyInt());
  }

  @Test
  void connectionLossNoticesAndDetachesThePushSource() {
    session.start(new StartRequest("abc", null)).blockingAwait();

    push.only().onError(new ConnectException("Twitch connection lost: EOF"));

    assertThat(notices(NoticeKind.CONNECTION_LOST)).hasSize(1);
    assertNull(session.snapshot().pushSourceHandle());
    assertEquals(SessionPhase.IDLE, session.snapshot().phase());
  }

  @Test
  void stopTearsDownEvenWithSubscribers() {
    session.start(new StartRequest("abc", "UC1")).blockingAwait();

    session.stop().blockingAwait();

    assertEquals(SessionPhase.IDLE, session.snapshot().phase());
    assertThat(push.detached).containsExactly("abc");
  }

  @Test
  void pushAttachFinishingAfterTheLastSubscriberLeftIsReleased() {
    TestScheduler slowIo = new TestScheduler();
    SubscriberHub ownHub = new SubscriberHub();
    AggregationSession starting = sessionWith(ownHub, slowIo);
    int[] idleSignals = new int[1];
    starting.onIdle(() -> idleSignals[0]++);
    String only = ownHub.register(e -> {});

    starting.start(new StartRequest("abc", null)).subscribe();
    assertEquals(SessionPhase.STARTING, starting.snapshot().phase());

    ownHub.unregister(only);
    assertEquals(SessionPhase.IDLE, starting.snapshot().phase());
    assertFalse(starting.isSettled());
    assertEquals(0, idleSignals[0]);

    slowIo.triggerActions();

    assertThat(push.attached).containsExactly("abc");
    assertThat(push.detached).containsExactly("abc");
    assertNull(starting.snapshot().pushSourceHandle());
    assertEquals(SessionPhase.IDLE, starting.snapshot().phase());
    assertTrue(starting.isSettled());
    assertEquals(1, idleSignals[0]);
  }

  @Test
  void feedResolvedAfterTheLastSubscriberLeftIsNeverPolled() throws Exception {
    TestScheduler slowIo = new TestScheduler();
    SubscriberHub ownHub = new SubscriberHub();
    AggregationSession starting = sessionWith(ownHub, slowIo);
    String only = ownHub.register(e -> {});

    starting.start(new StartRequest(null, "UC1")).subscribe();
    ownHub.unregister(only);
    slowIo.triggerActions();
    timer.advanceTimeBy(POLL_MS * 3, TimeUnit.MILLISECONDS);
    slowIo.triggerActions();

    verify(feeds).searchActiveFeed("UC1");
    verify(feeds, never()).fetchBatch(anyString(), anyInt());
    assertNull(starting.snapshot().pullSourceHandle());
    assertNull(starting.snapshot().watermark());
    assertEquals(SessionPhase.IDLE, starting.snapshot().phase());
    assertTrue(starting.isSettled());
  }

  @Test
  void attachFailingAfterTeardownSendsNoNotice() {
    TestScheduler slowIo = new TestScheduler();
    SubscriberHub ownHub = new SubscriberHub();
    AggregationSession starting = sessionWith(ownHub, slowIo);
    List<RelayEvent> seen = new ArrayList<>();
    String only = ownHub.register(seen::add);
    push.failWith = new ConnectException("refused");

    starting.start(new StartRequest("abc", null)).subscribe();
    ownHub.unregister(only);
    slowIo.triggerActions();

    assertThat(seen).isEmpty();
    assertTrue(starting.isSettled());
  }

  private AggregationSession sessionWith(SubscriberHub ownHub, TestScheduler io) {
    return new AggregationSession(
        "room-2",
        ownHub,
        push,
        new WatermarkPullConnector(feeds, 200),
        Schedulers.trampoline(),
        io,
        timer,
        new PollBackoff(POLL_MS, null),
        Clock.fixed(Instant.ofEpochSecond(5), ZoneOffset.UTC));
  }

  private List<String> chatIds() {
    List<String> ids = new ArrayList<>();
    for (RelayEvent e : inbox) {
      if (e instanceof RelayEvent.ChatMessage chat) ids.add(chat.message().id());
    }
    return ids;
  }

  private List<RelayEvent.Notice> notices(NoticeKind kind) {
    List<RelayEvent.Notice> out = new ArrayList<>();
    for (RelayEvent e : inbox) {
      if (e instanceof RelayEvent.Notice n && n.kind() == kind) out.add(n);
    }
    return out;
  }

  private static NormalizedMessage pushMessage(String id) {
    return new NormalizedMessage(id, MessageSource.PUSH, "viewer", "hi " + id, false, null);
  }

  private static FetchOutcome.Batch batch(FeedItem... items) {
    return FetchOutcome.Batch.of(List.of(items));
  }

  private static FeedItem item(String id, long second) {
    return new FeedItem(id, "author", "text " + id, false, Instant.ofEpochSecond(second));
  }
}
