package cafe.woden.chatrelay;

import cafe.woden.chatrelay.connector.PushTransport;
import cafe.woden.chatrelay.session.SessionRegistry;
import cafe.woden.chatrelay.util.NamedThreads;
import cafe.woden.chatrelay.util.RelaySchedulers;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ordered shutdown: sessions first (they detach from the connectors), then the shared Twitch
 * connection, then the app-owned schedulers the other two were using.
 */
@Component
public class ApplicationShutdownCoordinator {
  private static final Logger log = LoggerFactory.getLogger(ApplicationShutdownCoordinator.class);

  private final SessionRegistry sessions;
  private final PushTransport pushTransport;
  private final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

  public ApplicationShutdownCoordinator(SessionRegistry sessions, PushTransport pushTransport) {
    this.sessions = sessions;
    this.pushTransport = pushTransport;
  }

  @PreDestroy
  public void shutdown() {
    if (!shutdownStarted.compareAndSet(false, true)) return;

    try {
      sessions.shutdown();
    } catch (RuntimeException e) {
      log.warn("[chatrelay] Error while stopping sessions", e);
    }

    try {
      pushTransport.close();
    } catch (RuntimeException e) {
      log.warn("[chatrelay] Error while closing the Twitch connection", e);
    }

    RelaySchedulers.shutdown();
    int stopped = NamedThreads.shutdownTrackedExecutorsNow();
    log.info("[chatrelay] shutdown complete ({} tracked executor(s) stopped)", stopped);
  }
}
