package cafe.woden.chatrelay.connector;

import java.util.Locale;
import java.util.Objects;

/** Identity the push connector logs in as. */
public record PushCredentials(String username, String token) {

  public PushCredentials {
    username = Objects.toString(username, "").trim().toLowerCase(Locale.ROOT);
    token = Objects.toString(token, "").trim();
  }

  public boolean isComplete() {
    return !username.isEmpty() && !token.isEmpty();
  }

  @Override
  public String toString() {
    return "PushCredentials[username=" + username + ", token=<redacted>]";
  }
}
