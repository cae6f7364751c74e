package cafe.woden.chatrelay.session;

import cafe.woden.chatrelay.model.RelayEvent;

/** One viewer connection. Implementations may throw; the hub counts the failure and moves on. */
@FunctionalInterface
public interface Subscriber {
  void deliver(RelayEvent event) throws Exception;
}
