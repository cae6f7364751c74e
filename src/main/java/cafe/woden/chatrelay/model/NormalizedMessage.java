package cafe.woden.chatrelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A chat line from either upstream, converted to the one schema every subscriber sees.
 *
 * <p>{@code id} is only unique within its {@link MessageSource}; consumers that need to dedup
 * across sources key on {@code (source, id)}.
 */
@ValueObject
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NormalizedMessage(
    String id,
    MessageSource source,
    String author,
    String text,
    @JsonProperty("isPrivileged") boolean privileged,
    String accentColor) {

  public NormalizedMessage {
    id = Objects.requireNonNull(id, "id").trim();
    if (id.isEmpty()) throw new IllegalArgumentException("id is blank");
    Objects.requireNonNull(source, "source");
    author = Objects.requireNonNull(author, "author").trim();
    // Empty bodies are legal; absent ones are not.
    if (text == null) text = "";
    if (accentColor != null && accentColor.isBlank()) accentColor = null;
  }

  @JsonProperty("platform")
  public String platform() {
    return source.platform();
  }
}
