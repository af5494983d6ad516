package agentdesk.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler of an agent.
 *
 * <p>The annotated bean must implement {@link agentdesk.AgentHandler}.
 *
 * <pre>{@code
 * @Component
 * @AgentCapability(name = "EmailAgent", description = "Drafts and sends email")
 * public class EmailAgent implements AgentHandler {
 *   public AgentResult handle(AgentTask task) { ... }
 * }
 * }</pre>
 *
 * @see AgentCapabilityRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface AgentCapability {

    /**
     * Agent name that tasks address.
     */
    String name();

    String description() default "";
}
