package cafe.woden.chatrelay.twitch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.chatrelay.connector.RawPushMessage;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TwitchBridgeListenerTest {

  @Test
  void mapsTagsOntoRawMessage() {
    RawPushMessage raw = TwitchBridgeListener.toRaw(
        "#ABC",
        "SomeUser",
        "hello there",
        Map.of("id", "m-1", "display-name", "Some_User", "mod", "1", "color", "#FF4500"));

    assertEquals("m-1", raw.id());
    assertEquals("abc", raw.channel());
    assertEquals("someuser", raw.authorLogin());
    assertEquals("Some_User", raw.displayName());
    assertEquals("hello there", raw.text());
    assertTrue(raw.moderator());
    assertFalse(raw.subscriber());
    assertEquals("#FF4500", raw.color());
  }

  @Test
  void displayNameFallsBackToLoginAndEmptyColorIsAbsent() {
    RawPushMessage raw =
        TwitchBridgeListener.toRaw("#abc", "viewer", "hi", Map.of("display-name", "", "color", ""));

    assertEquals("viewer", raw.displayName());
    assertNull(raw.color());
  }

  @Test
  void recognizesTwitchLoginFailures() {
    assertTrue(TwitchBridgeListener.isAuthFailure("Login authentication failed"));
    assertTrue(TwitchBridgeListener.isAuthFailure("Improperly formatted auth"));
    assertFalse(TwitchBridgeListener.isAuthFailure("Welcome, GLHF!"));
    assertFalse(TwitchBridgeListener.isAuthFailure(null));
  }

  @Test
  void extractsChannelFromJoinFailureNumeric() {
    assertEquals("#secret",
        TwitchBridgeListener.channelFromNumeric(":tmi.twitch.tv 473 bot #secret :Cannot join channel (+i)"));
    assertNull(TwitchBridgeListener.channelFromNumeric(":tmi.twitch.tv 421 bot WHO :Unknown command"));
  }

  @Test
  void joinFailureNumerics() {
    assertTrue(TwitchBridgeListener.isJoinFailureNumeric(403));
    assertTrue(TwitchBridgeListener.isJoinFailureNumeric(474));
    assertFalse(TwitchBridgeListener.isJoinFailureNumeric(366));
  }
}
