package cafe.woden.chatrelay.web;

import cafe.woden.chatrelay.model.RelayEvent;
import cafe.woden.chatrelay.session.Subscriber;
import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** A {@link Subscriber} that writes events to one Server-Sent Events stream. */
final class SseSubscriber implements Subscriber {
  private static final Logger log = LoggerFactory.getLogger(SseSubscriber.class);

  static final String SUBSCRIBED = "subscribed";

  private final SseEmitter emitter;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile ScheduledFuture<?> keepalive;

  SseSubscriber(SseEmitter emitter) {
    this.emitter = emitter;
  }

  SseEmitter emitter() {
    return emitter;
  }

  @Override
  public void deliver(RelayEvent event) throws IOException {
    if (closed.get()) throw new IOException("stream closed");
    send(SseEmitter.event().name(event.name()).data(event.payload(), MediaType.APPLICATION_JSON));
  }

  void sendSubscribed(Object payload) throws IOException {
    send(SseEmitter.event().name(SUBSCRIBED).data(payload, MediaType.APPLICATION_JSON));
  }

  /** Periodic SSE comment; a failed write closes the stream so the subscriber is dropped. */
  void startKeepalive(ScheduledExecutorService scheduler, long periodMs) {
    keepalive = scheduler.scheduleAtFixedRate(() -> {
      if (closed.get()) return;
      try {
        send(SseEmitter.event().comment("keepalive"));
      } catch (IOException | RuntimeException e) {
        log.debug("[chatrelay] SSE keepalive failed, closing stream: {}", e.toString());
        close();
      }
    }, periodMs, periodMs, TimeUnit.MILLISECONDS);
  }

  /** Idempotent. */
  void close() {
    if (!closed.compareAndSet(false, true)) return;
    stopKeepalive();
    try {
      emitter.complete();
    } catch (RuntimeException e) {
      log.debug("[chatrelay] SSE complete failed: {}", e.toString());
    }
  }

  void stopKeepalive() {
    ScheduledFuture<?> f = keepalive;
    if (f != null) f.cancel(false);
  }

  private synchronized void send(SseEmitter.SseEventBuilder event) throws IOException {
    emitter.send(event);
  }
}
