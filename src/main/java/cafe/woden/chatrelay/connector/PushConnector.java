package cafe.woden.chatrelay.connector;

import cafe.woden.chatrelay.model.NormalizedMessage;
import io.reactivex.rxjava3.core.Flowable;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Wraps the push source: join a channel, then receive its messages as they arrive.
 *
 * <p>Self-authored lines are filtered here, since only the connector knows its own identity.
 */
@ApplicationLayer
public interface PushConnector {

  /** Joins {@code channel} (connecting first if needed). */
  PushHandle attach(String channel) throws ConnectorException;

  /** Idempotent. */
  void detach(PushHandle handle);

  /**
   * Messages for the attachment, in arrival order.
   *
   * <p>The stream errors with {@link ConnectException} if the upstream connection is lost, and
   * simply stops emitting once the handle is detached.
   */
  Flowable<NormalizedMessage> messages(PushHandle handle);
}
