package cafe.woden.chatrelay.twitch;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/** The Twitch IRCv3 tags a chat line or notice carries, keyed in lower case. */
final class TwitchTags {

  static final String ID = "id";
  static final String DISPLAY_NAME = "display-name";
  static final String SUBSCRIBER = "subscriber";
  static final String MOD = "mod";
  static final String COLOR = "color";
  static final String MSG_ID = "msg-id";

  private TwitchTags() {}

  /**
   * Tags of a PircBotX event. Only some event types expose {@code getTags()}, and a few only
   * keep the raw line, so both are looked up by name.
   */
  static Map<String, String> of(Object event) {
    if (event == null) return Map.of();
    if (accessor(event, "getTags") instanceof Map<?, ?> parsed && !parsed.isEmpty()) {
      Map<String, String> out = new HashMap<>();
      parsed.forEach((k, v) -> put(out, String.valueOf(k), v == null ? "" : String.valueOf(v)));
      return Map.copyOf(out);
    }
    return parse(accessor(event, "getRawLine") instanceof String line ? line : null);
  }

  /** Tags from the {@code @k=v;k2=v2 } prefix of a raw line; empty when it has none. */
  static Map<String, String> parse(String line) {
    if (line == null || !line.startsWith("@")) return Map.of();
    int end = line.indexOf(' ');
    if (end < 0) return Map.of();

    Map<String, String> out = new HashMap<>();
    for (String pair : line.substring(1, end).split(";")) {
      int eq = pair.indexOf('=');
      if (eq < 0) {
        put(out, pair, "");
      } else {
        put(out, pair.substring(0, eq), pair.substring(eq + 1));
      }
    }
    return Map.copyOf(out);
  }

  static String value(Map<String, String> tags, String key) {
    String v = tags.get(key);
    return v == null ? "" : v.trim();
  }

  /** Twitch flags are {@code "1"}/{@code "0"}; anything else counts as unset. */
  static boolean flag(Map<String, String> tags, String key) {
    return "1".equals(value(tags, key));
  }

  private static void put(Map<String, String> out, String key, String value) {
    String k = key.trim();
    if (k.startsWith("+")) k = k.substring(1);
    if (k.isEmpty()) return;
    out.put(k.toLowerCase(Locale.ROOT), unescape(value));
  }

  // IRCv3 escapes: \: ; \s space, \\ backslash, \r and \n.
  private static String unescape(String v) {
    if (v.indexOf('\\') < 0) return v;
    StringBuilder sb = new StringBuilder(v.length());
    for (int i = 0; i < v.length(); i++) {
      char c = v.charAt(i);
      if (c != '\\' || i + 1 == v.length()) {
        if (c != '\\') sb.append(c);
        continue;
      }
      char n = v.charAt(++i);
      sb.append(n == ':' ? ';' : n == 's' ? ' ' : n == 'r' ? '\r' : n == 'n' ? '\n' : n);
    }
    return sb.toString();
  }

  private static Object accessor(Object target, String name) {
    try {
      return target.getClass().getMethod(name).invoke(target);
    } catch (ReflectiveOperationException | RuntimeException e) {
      return null;
    }
  }
}
