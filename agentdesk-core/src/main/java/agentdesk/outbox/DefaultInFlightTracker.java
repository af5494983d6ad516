package agentdesk.outbox;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-backed in-flight tracker. An item stays held until
 * {@link #release} is called. This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Set<String> inflight = ConcurrentHashMap.newKeySet();

  @Override
  public boolean tryAcquire(String itemId) {
    return inflight.add(itemId);
  }

  @Override
  public void release(String itemId) {
    inflight.remove(itemId);
  }

  int size() {
    return inflight.size();
  }
}
