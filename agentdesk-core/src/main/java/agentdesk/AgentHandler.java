package agentdesk;

/**
 * Capability that executes the actions of one named agent.
 *
 * <p>Handlers receive the full task snapshot and dispatch on {@link AgentTask#action()}.
 * They are invoked synchronously on the thread that runs the task and must not change
 * task state themselves; the worker records the outcome.
 *
 * <h2>Error Handling</h2>
 * <p>Any exception marks the task failed with the exception message as its error.
 * Handlers are never retried automatically.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * registry.register("CalendarAgent", "Creates calendar events", task -> {
 *   if (!"create_event".equals(task.action())) {
 *     throw new IllegalArgumentException("Unsupported action: " + task.action());
 *   }
 *   String eventId = calendar.create(task.payload());
 *   return AgentResult.of("{\"eventId\":\"" + eventId + "\"}", "event " + eventId);
 * });
 * }</pre>
 *
 * @see agentdesk.registry.AgentRegistry
 */
@FunctionalInterface
public interface AgentHandler {

  /**
   * Executes the task.
   *
   * @param task the task in {@code in_progress} status
   * @return the outcome to store on the task
   * @throws Exception if the action fails; the message becomes the task error
   */
  AgentResult handle(AgentTask task) throws Exception;
}
