package agentdesk.outbox;

/**
 * Guards an outbox item against being delivered by two passes at once.
 */
public interface InFlightTracker {

  /**
   * @return {@code true} if the caller now owns the item, {@code false} if it is held
   */
  boolean tryAcquire(String itemId);

  void release(String itemId);
}
