package agentdesk.outbox;

/**
 * Outcome counts of a single delivery pass.
 *
 * @param sent    items delivered in this pass
 * @param retried items rescheduled after a failed attempt
 * @param failed  items marked permanently failed
 * @param skipped items held by another pass or changed concurrently
 */
public record DeliveryReport(int sent, int retried, int failed, int skipped) {

  public static final DeliveryReport EMPTY = new DeliveryReport(0, 0, 0, 0);

  public int processed() {
    return sent + retried + failed;
  }
}
