package cafe.woden.chatrelay.connector;

import java.time.Instant;
import java.util.Objects;

/** One item of a pull batch, already mapped to the fields the connector needs. */
public record FeedItem(
    String id, String author, String text, boolean privileged, Instant publishedAt) {

  public FeedItem {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(publishedAt, "publishedAt");
    author = Objects.toString(author, "");
    text = Objects.toString(text, "");
  }
}
