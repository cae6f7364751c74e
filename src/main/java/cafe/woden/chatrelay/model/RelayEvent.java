package cafe.woden.chatrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;

/** Everything a subscriber can receive on the unified stream. */
public sealed interface RelayEvent permits RelayEvent.ChatMessage, RelayEvent.Notice {

  String CHAT_MESSAGE = "chat message";
  String NOTICE = "notice";

  /** Wire name of the event kind. */
  @JsonIgnore
  String name();

  /** Object serialized as the event payload. */
  @JsonIgnore
  Object payload();

  record ChatMessage(NormalizedMessage message) implements RelayEvent {
    public ChatMessage {
      Objects.requireNonNull(message, "message");
    }

    @Override
    public String name() {
      return CHAT_MESSAGE;
    }

    @Override
    public Object payload() {
      return message;
    }
  }

  /** A short human-readable line about a connector condition (feed ended, join failed...). */
  record Notice(NoticeKind kind, String text) implements RelayEvent {
    public Notice {
      Objects.requireNonNull(kind, "kind");
      text = Objects.toString(text, "").trim();
    }

    @Override
    public String name() {
      return NOTICE;
    }

    @Override
    public Object payload() {
      return this;
    }
  }
}
