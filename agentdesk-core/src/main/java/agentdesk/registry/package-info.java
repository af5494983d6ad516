/**
 * Capability registry that resolves the agent named on a task to its handler.
 *
 * @see agentdesk.registry.AgentRegistry
 * @see agentdesk.registry.DefaultAgentRegistry
 */
package agentdesk.registry;
