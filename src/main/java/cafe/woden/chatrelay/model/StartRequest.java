package cafe.woden.chatrelay.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Subscriber-issued request to start (or extend) a session.
 *
 * <p>Either channel may be absent. Push channels are normalized to the bare lower-case login
 * (Twitch channel names are case-insensitive and the leading {@code #} is an IRC detail).
 */
@ValueObject
public record StartRequest(String pushChannel, String pullChannel) {

  public StartRequest {
    pushChannel = normalizePushChannel(pushChannel);
    pullChannel = trimToNull(pullChannel);
  }

  public Optional<String> push() {
    return Optional.ofNullable(pushChannel);
  }

  public Optional<String> pull() {
    return Optional.ofNullable(pullChannel);
  }

  public boolean isEmpty() {
    return pushChannel == null && pullChannel == null;
  }

  public static String normalizePushChannel(String raw) {
    String s = trimToNull(raw);
    if (s == null) return null;
    while (s.startsWith("#")) s = s.substring(1);
    s = s.trim();
    return s.isEmpty() ? null : s.toLowerCase(Locale.ROOT);
  }

  private static String trimToNull(String raw) {
    String s = Objects.toString(raw, "").trim();
    return s.isEmpty() ? null : s;
  }
}
