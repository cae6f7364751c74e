package cafe.woden.chatrelay.session;

import cafe.woden.chatrelay.connector.ConnectorException;
import cafe.woden.chatrelay.connector.PushConnector;
import cafe.woden.chatrelay.connector.PushHandle;
import cafe.woden.chatrelay.model.NormalizedMessage;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** In-memory push connector: one processor per live attachment. */
final class FakePushConnector implements PushConnector {
  final Map<PushHandle, PublishProcessor<NormalizedMessage>> streams = new LinkedHashMap<>();
  final List<String> attached = new ArrayList<>();
  final List<String> detached = new ArrayList<>();
  ConnectorException failWith;
  private long seq;

  @Override
  public PushHandle attach(String channel) throws ConnectorException {
    if (failWith != null) throw failWith;
    PushHandle handle = new PushHandle(channel, ++seq);
    streams.put(handle, PublishProcessor.create());
    attached.add(channel);
    return handle;
  }

  @Override
  public void detach(PushHandle handle) {
    if (streams.remove(handle) != null) detached.add(handle.channel());
  }

  @Override
  public Flowable<NormalizedMessage> messages(PushHandle handle) {
    return streams.get(handle);
  }

  PublishProcessor<NormalizedMessage> only() {
    return streams.values().iterator().next();
  }
}
