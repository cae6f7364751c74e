package cafe.woden.chatrelay.model;

/** Which upstream produced a {@link NormalizedMessage}. */
public enum MessageSource {
  /** Persistent streaming connection (Twitch IRC). */
  PUSH("Twitch"),
  /** Periodically polled feed (YouTube live chat). */
  PULL("YouTube");

  private final String platform;

  MessageSource(String platform) {
    this.platform = platform;
  }

  public String platform() {
    return platform;
  }
}
