package agentdesk.registry;

import agentdesk.AgentHandler;

import java.util.List;

/**
 * Maps capability names to {@link AgentHandler handlers}.
 *
 * @see DefaultAgentRegistry
 */
public interface AgentRegistry {

  /**
   * Returns the handler registered under {@code name}.
   *
   * @param name the capability name stored on the task
   * @return the handler, or {@code null} if none is registered
   */
  AgentHandler handlerFor(String name);

  /**
   * Returns the registered capabilities in registration order.
   */
  List<AgentDescriptor> listAgents();
}
