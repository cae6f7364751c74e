package cafe.woden.chatrelay.connector;

import java.util.Objects;

/**
 * A chat line as the push transport delivers it, before any mapping rule is applied.
 *
 * <p>{@code authorLogin} is the stable account name (used for self detection);
 * {@code displayName} is what viewers see.
 */
public record RawPushMessage(
    String id,
    String channel,
    String authorLogin,
    String displayName,
    String text,
    boolean subscriber,
    boolean moderator,
    String color) {

  public RawPushMessage {
    id = Objects.toString(id, "").trim();
    channel = Objects.toString(channel, "").trim();
    authorLogin = Objects.toString(authorLogin, "").trim();
    displayName = Objects.toString(displayName, "").trim();
    if (displayName.isEmpty()) displayName = authorLogin;
    text = Objects.toString(text, "");
    if (color != null && color.isBlank()) color = null;
  }
}
