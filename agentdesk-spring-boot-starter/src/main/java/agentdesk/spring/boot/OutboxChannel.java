package agentdesk.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean implementing {@link agentdesk.outbox.DeliveryChannel} as the
 * transport for outbox items of the named channel.
 *
 * <pre>{@code
 * @Component
 * @OutboxChannel("email")
 * public class SmtpChannel implements DeliveryChannel { ... }
 * }</pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface OutboxChannel {

    /**
     * Channel name, matched against {@code OutboxMessage.channel()}.
     */
    String value();
}
