package agentdesk.registry;

/**
 * Introspection entry for a registered capability.
 *
 * @param name        the capability name
 * @param description free text, not interpreted
 */
public record AgentDescriptor(String name, String description) {}
