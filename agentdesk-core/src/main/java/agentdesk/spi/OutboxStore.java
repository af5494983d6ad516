package agentdesk.spi;

import agentdesk.OutboxMessage;
import agentdesk.model.OutboxItem;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for outbox items.
 *
 * <p>The {@code mark*} methods count the attempt they record and only affect items
 * that are still deliverable (not sent, not failed). They return the number of rows
 * changed, so callers can detect an item removed or reset concurrently.
 *
 * @see agentdesk.outbox.DeliveryWorker
 * @see agentdesk.outbox.OutboxAdmin
 */
public interface OutboxStore {

  /**
   * Inserts a new item with {@code attempts=0}, {@code nextAttemptAt=now} and no
   * sent or failed flag.
   *
   * @return the stored item
   */
  OutboxItem insert(OutboxMessage message, Instant now);

  Optional<OutboxItem> find(String id);

  /** All items, oldest first. */
  List<OutboxItem> listAll();

  /**
   * Returns up to {@code limit} deliverable items whose {@code nextAttemptAt} is at or
   * before {@code now}, oldest first.
   */
  List<OutboxItem> pollEligible(Instant now, int limit);

  int markSent(String id, Instant at);

  int markRetry(String id, Instant at, Instant nextAttemptAt, String error);

  int markFailed(String id, Instant at, String error);

  /**
   * Makes an item deliverable again: {@code attempts=0}, {@code nextAttemptAt=now},
   * sent and failed flags and the error cleared.
   */
  int reset(String id, Instant now);

  int delete(String id);

  /** Number of items neither sent nor failed. */
  int countPending();
}
