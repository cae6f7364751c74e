package cafe.woden.chatrelay.model;

/** Operator-visible conditions surfaced to subscribers as {@link RelayEvent.Notice}s. */
public enum NoticeKind {
  CONNECTOR_FAILED,
  FEED_NOT_FOUND,
  FEED_ENDED,
  FETCH_ERROR,
  CONNECTION_LOST
}
