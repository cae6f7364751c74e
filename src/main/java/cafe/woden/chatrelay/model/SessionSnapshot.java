package cafe.woden.chatrelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** Point-in-time view of a session's state, safe to hand to other threads. */
@ValueObject
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSnapshot(
    String sessionId,
    SessionPhase phase,
    String pushSourceHandle,
    String pullSourceHandle,
    Instant watermark,
    int subscriberCount) {

  public SessionSnapshot {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(phase, "phase");
    if (subscriberCount < 0) subscriberCount = 0;
  }
}
