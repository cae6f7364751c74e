package cafe.woden.chatrelay.twitch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import cafe.woden.chatrelay.connector.AuthException;
import cafe.woden.chatrelay.connector.ConnectException;
import cafe.woden.chatrelay.connector.JoinException;
import cafe.woden.chatrelay.connector.PushCredentials;
import cafe.woden.chatrelay.connector.PushHandle;
import cafe.woden.chatrelay.connector.PushTransport;
import cafe.woden.chatrelay.connector.RawPushMessage;
import cafe.woden.chatrelay.model.MessageSource;
import cafe.woden.chatrelay.model.NormalizedMessage;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class TwitchPushConnectorTest {

  private static final PushCredentials BOT = new PushCredentials("bot", "oauth:secret");

  private final PushTransport transport = mock(PushTransport.class);
  private final TwitchPushConnector connector = new TwitchPushConnector(transport, BOT);

  @Test
  void installsItselfAsInboundHandler() {
    verify(transport).setInboundHandler(connector);
  }

  @Test
  void selfAuthoredLinesAreNeverForwarded() throws Exception {
    PushHandle handle = connector.attach("abc");
    TestSubscriber<NormalizedMessage> messages = connector.messages(handle).test();

    connector.onMessage(raw("1", "abc", "bot", false, false));
    connector.onMessage(raw("2", "abc", "BOT", true, true));

    messages.assertNoValues();
  }

  @Test
  void forwardsOtherAuthorsWithPrivilegeMapping() throws Exception {
    PushHandle handle = connector.attach("#ABC");
    TestSubscriber<NormalizedMessage> messages = connector.messages(handle).test();

    connector.onMessage(raw("1", "abc", "viewer", false, false));
    connector.onMessage(raw("2", "abc", "subber", true, false));
    connector.onMessage(raw("3", "abc", "modder", false, true));

    messages.assertValueCount(3);
    assertFalse(messages.values().get(0).privileged());
    assertTrue(messages.values().get(1).privileged());
    assertTrue(messages.values().get(2).privileged());
    assertEquals(MessageSource.PUSH, messages.values().get(0).source());
    assertEquals("Display-viewer", messages.values().get(0).author());
  }

  @Test
  void linesForOtherChannelsAreIgnored() throws Exception {
    PushHandle handle = connector.attach("abc");
    TestSubscriber<NormalizedMessage> messages = connector.messages(handle).test();

    connector.onMessage(raw("1", "xyz", "viewer", false, false));

    messages.assertNoValues();
  }

  @Test
  void joinsOncePerChannelAndPartsAfterLastDetach() throws Exception {
    PushHandle first = connector.attach("abc");
    PushHandle second = connector.attach("abc");

    assertNotEquals(first, second);
    verify(transport, times(2)).connect(BOT);
    verify(transport, times(1)).join("abc");

    connector.detach(first);
    verify(transport, never()).part(anyString());

    connector.detach(second);
    connector.detach(second);
    verify(transport, times(1)).part("abc");
  }

  @Test
  void detachedHandleStopsReceiving() throws Exception {
    PushHandle handle = connector.attach("abc");
    TestSubscriber<NormalizedMessage> messages = connector.messages(handle).test();

    connector.detach(handle);
    connector.onMessage(raw("1", "abc", "viewer", false, false));

    messages.assertNoValues();
  }

  @Test
  void authFailureSurfacesAndNothingIsJoined() throws Exception {
    doThrow(new AuthException("Login authentication failed")).when(transport).connect(any());

    assertThrows(AuthException.class, () -> connector.attach("abc"));
    verify(transport, never()).join(anyString());
  }

  @Test
  void joinFailureDoesNotLeakARefcount() throws Exception {
    doThrow(new JoinException("abc", "suspended")).doNothing().when(transport).join("abc");

    assertThrows(JoinException.class, () -> connector.attach("abc"));
    connector.attach("abc");

    verify(transport, times(2)).join("abc");
  }

  @Test
  void connectionLossErrorsEveryStreamAndForcesRejoin() throws Exception {
    PushHandle a = connector.attach("abc");
    PushHandle b = connector.attach("xyz");
    TestSubscriber<NormalizedMessage> streamA = connector.messages(a).test();
    TestSubscriber<NormalizedMessage> streamB = connector.messages(b).test();

    connector.onConnectionLost("Connection reset");

    streamA.assertError(ConnectException.class);
    streamB.assertError(ConnectException.class);

    connector.attach("abc");
    verify(transport, times(2)).join("abc");
  }

  @Test
  void detachIsNotBlockedByAnotherAttachStillConnecting() throws Exception {
    PushHandle alpha = connector.attach("alpha");
    CountDownLatch connecting = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    doAnswer(inv -> {
      connecting.countDown();
      release.await(5, TimeUnit.SECONDS);
      return null;
    }).when(transport).connect(BOT);
    ExecutorService other = Executors.newSingleThreadExecutor();
    try {
      Future<PushHandle> beta = other.submit(() -> connector.attach("beta"));
      assertTrue(connecting.await(5, TimeUnit.SECONDS));

      assertTimeoutPreemptively(Duration.ofSeconds(2), () -> connector.detach(alpha));
      verify(transport).part("alpha");

      release.countDown();
      assertEquals("beta", beta.get(5, TimeUnit.SECONDS).channel());
    } finally {
      release.countDown();
      other.shutdownNow();
    }
  }

  @Test
  void concurrentAttachesToOneChannelShareTheJoin() throws Exception {
    CountDownLatch joining = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    doAnswer(inv -> {
      joining.countDown();
      release.await(5, TimeUnit.SECONDS);
      return null;
    }).when(transport).join("abc");
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<PushHandle> first = pool.submit(() -> connector.attach("abc"));
      assertTrue(joining.await(5, TimeUnit.SECONDS));
      Future<PushHandle> second = pool.submit(() -> connector.attach("abc"));

      release.countDown();
      PushHandle a = first.get(5, TimeUnit.SECONDS);
      PushHandle b = second.get(5, TimeUnit.SECONDS);

      verify(transport, times(1)).join("abc");
      connector.detach(a);
      verify(transport, never()).part(anyString());
      connector.detach(b);
      verify(transport).part("abc");
    } finally {
      release.countDown();
      pool.shutdownNow();
    }
  }

  @Test
  void concurrentAttachesAllFailWhenTheJoinFails() throws Exception {
    CountDownLatch joining = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    doAnswer(inv -> {
      joining.countDown();
      release.await(5, TimeUnit.SECONDS);
      throw new JoinException("abc", "suspended");
    }).when(transport).join("abc");
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<PushHandle> first = pool.submit(() -> connector.attach("abc"));
      assertTrue(joining.await(5, TimeUnit.SECONDS));
      Future<PushHandle> second = pool.submit(() -> connector.attach("abc"));

      release.countDown();
      ExecutionException e1 =
          assertThrows(ExecutionException.class, () -> first.get(5, TimeUnit.SECONDS));
      ExecutionException e2 =
          assertThrows(ExecutionException.class, () -> second.get(5, TimeUnit.SECONDS));
      assertThat(e1.getCause()).isInstanceOf(JoinException.class);
      assertThat(e2.getCause()).isInstanceOf(JoinException.class);

      doNothing().when(transport).join("abc");
      connector.attach("abc");
      verify(transport, never()).part(anyString());
    } finally {
      release.countDown();
      pool.shutdownNow();
    }
  }

  @Test
  void missingMessageIdGetsGeneratedOne() {
    NormalizedMessage m = TwitchPushConnector.normalize(raw("", "abc", "viewer", false, false));

    assertThat(m.id()).isNotBlank();
  }

  @Test
  void selfRuleIgnoresCase() {
    assertTrue(PushMessageRules.isSelfAuthored(raw("1", "abc", "Bot", false, false), "bot"));
    assertFalse(PushMessageRules.isSelfAuthored(raw("1", "abc", "viewer", false, false), "bot"));
    assertFalse(PushMessageRules.isSelfAuthored(raw("1", "abc", "viewer", false, false), ""));
  }

  private static RawPushMessage raw(
      String id, String channel, String login, boolean subscriber, boolean moderator) {
    return new RawPushMessage(
        id, channel, login, "Display-" + login, "text " + id, subscriber, moderator, null);
  }
}
