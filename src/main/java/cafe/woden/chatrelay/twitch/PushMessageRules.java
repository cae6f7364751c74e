package cafe.woden.chatrelay.twitch;

import cafe.woden.chatrelay.connector.RawPushMessage;

/** Mapping rules applied to Twitch lines before they are normalized. */
public final class PushMessageRules {

  private PushMessageRules() {}

  /** Lines sent by the account we are logged in as are never relayed. */
  public static boolean isSelfAuthored(RawPushMessage message, String ownLogin) {
    if (message == null || ownLogin == null || ownLogin.isBlank()) return false;
    return message.authorLogin().equalsIgnoreCase(ownLogin.trim());
  }

  /** Subscribers and moderators are privileged. Broadcaster and VIP badges are not consulted. */
  public static boolean isPrivileged(RawPushMessage message) {
    return message.subscriber() || message.moderator();
  }
}
