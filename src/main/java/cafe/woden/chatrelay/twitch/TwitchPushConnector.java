package cafe.woden.chatrelay.twitch;

import cafe.woden.chatrelay.config.RelayProperties;
import cafe.woden.chatrelay.connector.ConnectException;
import cafe.woden.chatrelay.connector.ConnectorException;
import cafe.woden.chatrelay.connector.JoinException;
import cafe.woden.chatrelay.connector.PushConnector;
import cafe.woden.chatrelay.connector.PushCredentials;
import cafe.woden.chatrelay.connector.PushHandle;
import cafe.woden.chatrelay.connector.PushTransport;
import cafe.woden.chatrelay.connector.RawPushMessage;
import cafe.woden.chatrelay.model.MessageSource;
import cafe.woden.chatrelay.model.NormalizedMessage;
import cafe.woden.chatrelay.model.StartRequest;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link PushConnector} for Twitch chat.
 *
 * <p>All sessions share one transport connection. Each channel is joined on its first attachment
 * and parted when its last attachment detaches.
 */
@Component
public class TwitchPushConnector implements PushConnector, PushTransport.InboundHandler {
  private static final Logger log = LoggerFactory.getLogger(TwitchPushConnector.class);

  private final PushTransport transport;
  private final PushCredentials credentials;

  private final FlowableProcessor<RawPushMessage> inbound =
      PublishProcessor.<RawPushMessage>create().toSerialized();
  private final FlowableProcessor<String> connectionLost =
      PublishProcessor.<String>create().toSerialized();

  /** One joined (or joining) channel. {@code refs} is guarded by the connector's monitor. */
  private static final class ChannelJoin {
    final CompletableFuture<Void> joined = new CompletableFuture<>();
    int refs;
  }

  // Guarded by "this".
  private final Map<String, ChannelJoin> channels = new HashMap<>();
  private final Set<PushHandle> live = ConcurrentHashMap.newKeySet();
  private final AtomicLong attachmentIds = new AtomicLong();

  @Autowired
  public TwitchPushConnector(PushTransport transport, RelayProperties props) {
    this(transport, props.twitch().credentials());
  }

  TwitchPushConnector(PushTransport transport, PushCredentials credentials) {
    this.transport = transport;
    this.credentials = credentials;
    transport.setInboundHandler(this);
  }

  @Override
  public PushHandle attach(String channel) throws ConnectorException {
    String ch = StartRequest.normalizePushChannel(channel);
    if (ch == null) throw new JoinException("", "Channel name is blank");

    // connect and join block; neither runs under the monitor.
    transport.connect(credentials);

    ChannelJoin join;
    boolean joiner;
    synchronized (this) {
      join = channels.get(ch);
      joiner = join == null;
      if (joiner) {
        join = new ChannelJoin();
        channels.put(ch, join);
      }
      // Counted before joining: a channel still being joined must not be parted.
      join.refs++;
    }

    if (joiner) {
      try {
        transport.join(ch);
        join.joined.complete(null);
      } catch (ConnectorException | RuntimeException e) {
        forget(ch, join);
        join.joined.completeExceptionally(e);
        throw e;
      }
    } else {
      awaitJoin(ch, join);
    }

    PushHandle handle = new PushHandle(ch, attachmentIds.incrementAndGet());
    int refs;
    synchronized (this) {
      if (channels.get(ch) != join) {
        throw new ConnectException("Connection dropped while joining #" + ch);
      }
      live.add(handle);
      refs = join.refs;
    }
    log.debug("[chatrelay] attached {} (#{} now has {} attachment(s))", handle, ch, refs);
    return handle;
  }

  @Override
  public void detach(PushHandle handle) {
    if (handle == null) return;
    String ch = handle.channel();
    synchronized (this) {
      if (!live.remove(handle)) return;
      ChannelJoin join = channels.get(ch);
      if (join == null) return;
      if (--join.refs > 0) return;
      channels.remove(ch);
    }
    transport.part(ch);
  }

  private void awaitJoin(String ch, ChannelJoin join) throws ConnectorException {
    try {
      join.joined.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      release(ch, join);
      throw new ConnectException("Interrupted while joining #" + ch, e);
    } catch (ExecutionException e) {
      // The joiner already dropped the channel entry.
      Throwable cause = e.getCause();
      if (cause instanceof ConnectorException ce) throw ce;
      throw new ConnectException("Could not join #" + ch, cause);
    }
  }

  private synchronized void release(String ch, ChannelJoin join) {
    if (channels.get(ch) == join && --join.refs <= 0) channels.remove(ch);
  }

  private synchronized void forget(String ch, ChannelJoin join) {
    if (channels.get(ch) == join) channels.remove(ch);
  }

  @Override
  public Flowable<NormalizedMessage> messages(PushHandle handle) {
    Flowable<NormalizedMessage> lines =
        inbound
            .onBackpressureBuffer()
            .filter(raw -> live.contains(handle) && raw.channel().equalsIgnoreCase(handle.channel()))
            .filter(raw -> !PushMessageRules.isSelfAuthored(raw, credentials.username()))
            .map(TwitchPushConnector::normalize);

    Flowable<NormalizedMessage> lost =
        connectionLost
            .onBackpressureLatest()
            .filter(reason -> live.contains(handle))
            .take(1)
            .flatMap(reason -> Flowable.error(new ConnectException("Twitch connection lost: " + reason)));

    return Flowable.merge(lines, lost);
  }

  @Override
  public void onMessage(RawPushMessage message) {
    inbound.onNext(message);
  }

  @Override
  public void onConnectionLost(String reason) {
    // Every attachment dies with the connection; the next attach reconnects and rejoins.
    connectionLost.onNext(reason);
    synchronized (this) {
      live.clear();
      channels.clear();
    }
  }

  static NormalizedMessage normalize(RawPushMessage raw) {
    String id = raw.id().isEmpty() ? UUID.randomUUID().toString() : raw.id();
    return new NormalizedMessage(
        id,
        MessageSource.PUSH,
        raw.displayName(),
        raw.text(),
        PushMessageRules.isPrivileged(raw),
        raw.color());
  }
}
