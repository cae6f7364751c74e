package cafe.woden.chatrelay.session;

/** Outcome of one fan-out: how many subscribers received the event and how many failed. */
public record BroadcastResult(int delivered, int failed) {

  public static final BroadcastResult NONE = new BroadcastResult(0, 0);
}
