package cafe.woden.chatrelay.model;

/** Lifecycle of one aggregation session. */
public enum SessionPhase {
  /** No connector attached and nothing in flight. */
  IDLE,
  /** At least one connector attach attempt is running. */
  STARTING,
  /** Attach attempts finished; the session is live. */
  ACTIVE,
  /** Connectors are being detached and state cleared. */
  ENDING
}
