package cafe.woden.chatrelay.web;

import cafe.woden.chatrelay.config.ExecutorConfig;
import cafe.woden.chatrelay.config.RelayProperties;
import cafe.woden.chatrelay.model.SessionSnapshot;
import cafe.woden.chatrelay.model.StartRequest;
import cafe.woden.chatrelay.session.SessionRegistry;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Subscriber transport: one SSE stream per viewer, plus start/stop/inspect endpoints.
 *
 * <p>The first SSE event on a stream is {@code subscribed}, carrying the subscriber id the
 * viewer needs for an explicit stop.
 */
@RestController
@RequestMapping("/api/sessions")
public class RelayController {
  private static final Logger log = LoggerFactory.getLogger(RelayController.class);

  private final SessionRegistry registry;
  private final ScheduledExecutorService keepaliveScheduler;
  private final long keepaliveMs;
  private final Map<String, SseSubscriber> streams = new ConcurrentHashMap<>();

  public RelayController(
      SessionRegistry registry,
      @Qualifier(ExecutorConfig.SSE_KEEPALIVE_SCHEDULER) ScheduledExecutorService keepaliveScheduler,
      RelayProperties props) {
    this.registry = registry;
    this.keepaliveScheduler = keepaliveScheduler;
    this.keepaliveMs = props.web().sseKeepaliveMs();
  }

  @GetMapping(path = "/{sessionId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter events(@PathVariable String sessionId) {
    // No server-side timeout: the stream lives until the viewer leaves.
    SseSubscriber subscriber = new SseSubscriber(new SseEmitter(0L));
    String subscriberId = registry.subscribe(sessionId, subscriber);
    streams.put(subscriberId, subscriber);

    SseEmitter emitter = subscriber.emitter();
    Runnable cleanup = () -> {
      subscriber.stopKeepalive();
      streams.remove(subscriberId);
      registry.unsubscribe(sessionId, subscriberId);
    };
    emitter.onCompletion(cleanup);
    emitter.onTimeout(cleanup);
    emitter.onError(err -> {
      log.debug("[chatrelay] SSE stream {} errored: {}", subscriberId, err.toString());
      cleanup.run();
    });

    try {
      subscriber.sendSubscribed(Map.of("sessionId", sessionId, "subscriberId", subscriberId));
    } catch (IOException e) {
      log.debug("[chatrelay] SSE stream {} closed before the first event", subscriberId);
      cleanup.run();
      subscriber.close();
      return emitter;
    }
    subscriber.startKeepalive(keepaliveScheduler, keepaliveMs);
    return emitter;
  }

  @PostMapping("/{sessionId}/start")
  public ResponseEntity<SessionSnapshot> start(
      @PathVariable String sessionId, @RequestBody StartRequest request) {
    return ResponseEntity.accepted().body(registry.start(sessionId, request));
  }

  @DeleteMapping("/{sessionId}/subscribers/{subscriberId}")
  public ResponseEntity<Void> stop(
      @PathVariable String sessionId, @PathVariable String subscriberId) {
    SseSubscriber stream = streams.remove(subscriberId);
    registry.unsubscribe(sessionId, subscriberId);
    if (stream != null) stream.close();
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{sessionId}")
  public SessionSnapshot snapshot(@PathVariable String sessionId) {
    return registry.requireSnapshot(sessionId);
  }
}
