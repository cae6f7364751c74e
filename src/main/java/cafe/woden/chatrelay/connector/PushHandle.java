package cafe.woden.chatrelay.connector;

import java.util.Objects;

/** One attachment to a push channel. Two attachments to the same channel are distinct handles. */
public record PushHandle(String channel, long attachmentId) {

  public PushHandle {
    channel = Objects.requireNonNull(channel, "channel").trim();
    if (channel.isEmpty()) throw new IllegalArgumentException("channel is blank");
  }
}
