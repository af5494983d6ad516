/**
 * Spring Boot auto-configuration for the agent desk.
 *
 * <p>Handlers are Spring beans annotated with {@link agentdesk.spring.boot.AgentCapability};
 * delivery channels are beans annotated with {@link agentdesk.spring.boot.OutboxChannel}.
 * Settings live under the {@code agentdesk.*} prefix, see
 * {@link agentdesk.spring.boot.AgentDeskProperties}.
 */
package agentdesk.spring.boot;
