package agentdesk.demo.email;

import agentdesk.model.OutboxItem;
import agentdesk.outbox.DeliveryChannel;
import agentdesk.spring.boot.OutboxChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stand-in transport for the {@code email} channel: logs the message instead of
 * sending it. Recipients ending in {@code .invalid} are refused, which exercises the
 * retry and failure path.
 */
@Component
@OutboxChannel(EmailAgent.CHANNEL)
public class LoggingEmailChannel implements DeliveryChannel {

  private static final Logger log = LoggerFactory.getLogger(LoggingEmailChannel.class);

  @Override
  public void deliver(OutboxItem item) {
    for (String recipient : item.recipients()) {
      if (recipient.endsWith(".invalid")) {
        throw new IllegalArgumentException("undeliverable recipient: " + recipient);
      }
    }
    log.info("[Email] id={}, to={}, subject={}, attempt={}",
        item.id(), item.recipients(), item.subject(), item.attempts() + 1);
  }
}
