package cafe.woden.chatrelay.config;

import cafe.woden.chatrelay.util.NamedThreads;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>Per-session control executors are created by the session registry; only shared,
 * process-wide workloads live here.
 */
@Configuration
public class ExecutorConfig {
  public static final String SSE_KEEPALIVE_SCHEDULER = "sseKeepaliveScheduler";

  @Bean(name = SSE_KEEPALIVE_SCHEDULER, destroyMethod = "shutdown")
  public ScheduledExecutorService sseKeepaliveScheduler() {
    return NamedThreads.newSingleThreadScheduledExecutor("chatrelay-sse-keepalive");
  }
}
