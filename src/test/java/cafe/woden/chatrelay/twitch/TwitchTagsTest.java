package cafe.woden.chatrelay.twitch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TwitchTagsTest {

  @Test
  void parsesTwitchPrivmsgTags() {
    Map<String, String> tags = TwitchTags.parse(
        "@badge-info=;color=#1E90FF;display-name=Some\\sUser;id=b34ccfc7-4977;mod=0;subscriber=1"
            + " :someuser!someuser@someuser.tmi.twitch.tv PRIVMSG #abc :hello");

    assertEquals("#1E90FF", tags.get("color"));
    assertEquals("Some User", tags.get("display-name"));
    assertEquals("b34ccfc7-4977", tags.get("id"));
    assertEquals("", tags.get("badge-info"));
    assertTrue(TwitchTags.flag(tags, TwitchTags.SUBSCRIBER));
    assertFalse(TwitchTags.flag(tags, TwitchTags.MOD));
  }

  @Test
  void untaggedLineHasNoTags() {
    assertTrue(TwitchTags.parse(":tmi.twitch.tv 001 bot :Welcome").isEmpty());
    assertTrue(TwitchTags.parse(null).isEmpty());
    assertTrue(TwitchTags.of(new Object()).isEmpty());
  }

  @Test
  void eventTagsArePreferredOverTheRawLine() {
    Map<String, String> tags = TwitchTags.of(new EventWithTags());

    assertEquals("abc123", tags.get("id"));
    assertEquals("1", tags.get("mod"));
    assertFalse(tags.containsKey("color"));
  }

  @Test
  void eventWithoutTagAccessorUsesItsRawLine() {
    Map<String, String> tags = TwitchTags.of(new EventWithRawLine());

    assertEquals("msg_banned", TwitchTags.value(tags, "msg-id"));
  }

  @Test
  void missingValuesReadAsEmpty() {
    assertEquals("", TwitchTags.value(Map.of(), "id"));
    assertFalse(TwitchTags.flag(Map.of("subscriber", "yes"), "subscriber"));
  }

  static final class EventWithTags {
    public Map<String, String> getTags() {
      LinkedHashMap<String, String> tags = new LinkedHashMap<>();
      tags.put("ID", "abc123");
      tags.put("+mod", "1");
      return tags;
    }

    public String getRawLine() {
      return "@color=#000000 :x PRIVMSG #abc :ignored";
    }
  }

  static final class EventWithRawLine {
    public String getRawLine() {
      return "@msg-id=msg_banned :tmi.twitch.tv NOTICE #abc :You are permanently banned";
    }
  }
}
