package cafe.woden.chatrelay.util;

import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Shared RxJava schedulers backed by app-owned executors.
 *
 * <p>{@link #io()} runs blocking upstream calls (IRC login, HTTP fetches); {@link #timer()}
 * only fires poll ticks and must never block.
 */
public final class RelaySchedulers {
  private static final Object LOCK = new Object();
  private static ExecutorService ioExec;
  private static ScheduledExecutorService timerExec;
  private static Scheduler ioScheduler;
  private static Scheduler timerScheduler;

  private RelaySchedulers() {}

  public static Scheduler io() {
    synchronized (LOCK) {
      ensureInitializedLocked();
      return ioScheduler;
    }
  }

  public static Scheduler timer() {
    synchronized (LOCK) {
      ensureInitializedLocked();
      return timerScheduler;
    }
  }

  public static void shutdown() {
    synchronized (LOCK) {
      if (ioExec != null) ioExec.shutdownNow();
      if (timerExec != null) timerExec.shutdownNow();
      ioExec = null;
      timerExec = null;
      ioScheduler = null;
      timerScheduler = null;
    }
  }

  private static void ensureInitializedLocked() {
    if (ioExec == null || ioExec.isShutdown() || ioExec.isTerminated()) {
      ioExec = NamedThreads.newCachedThreadPool("chatrelay-rx-io");
      ioScheduler = Schedulers.from(ioExec);
    }
    if (timerExec == null || timerExec.isShutdown() || timerExec.isTerminated()) {
      timerExec = NamedThreads.newSingleThreadScheduledExecutor("chatrelay-rx-timer");
      timerScheduler = Schedulers.from(timerExec);
    }
  }
}
