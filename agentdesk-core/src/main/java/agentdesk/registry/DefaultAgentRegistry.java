package agentdesk.registry;

import agentdesk.AgentHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Thread-safe registry of agent handlers keyed by capability name.
 *
 * <p>Registering a name twice replaces the earlier handler (last write wins); the
 * capability keeps its original position in {@link #listAgents()}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AgentRegistry registry = new DefaultAgentRegistry()
 *     .register("EmailAgent", "Drafts and sends email", emailAgent)
 *     .register("CalendarAgent", "Creates calendar events", calendarAgent);
 * }</pre>
 *
 * @see AgentHandler
 * @see AgentRegistry
 */
public final class DefaultAgentRegistry implements AgentRegistry {
  private static final Logger logger = Logger.getLogger(DefaultAgentRegistry.class.getName());

  private final Map<String, Entry> agents = new LinkedHashMap<>();

  /**
   * Registers a handler without a description.
   *
   * @param name    capability name
   * @param handler the handler
   * @return this registry for chaining
   */
  public DefaultAgentRegistry register(String name, AgentHandler handler) {
    return register(name, "", handler);
  }

  /**
   * Registers a handler, replacing any handler already registered under {@code name}.
   *
   * @param name        capability name
   * @param description free text shown by {@link #listAgents()}
   * @param handler     the handler
   * @return this registry for chaining
   */
  public DefaultAgentRegistry register(String name, String description, AgentHandler handler) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(handler, "handler");
    if (name.isBlank()) {
      throw new IllegalArgumentException("name cannot be empty");
    }
    Entry previous;
    synchronized (agents) {
      previous = agents.put(name, new Entry(description == null ? "" : description, handler));
    }
    if (previous != null) {
      logger.info("Replaced handler for agent " + name);
    }
    return this;
  }

  @Override
  public AgentHandler handlerFor(String name) {
    if (name == null) {
      return null;
    }
    synchronized (agents) {
      Entry entry = agents.get(name);
      return entry == null ? null : entry.handler;
    }
  }

  @Override
  public List<AgentDescriptor> listAgents() {
    List<AgentDescriptor> result = new ArrayList<>();
    synchronized (agents) {
      agents.forEach((name, entry) -> result.add(new AgentDescriptor(name, entry.description)));
    }
    return Collections.unmodifiableList(result);
  }

  private static final class Entry {
    private final String description;
    private final AgentHandler handler;

    private Entry(String description, AgentHandler handler) {
      this.description = description;
      this.handler = handler;
    }
  }
}
