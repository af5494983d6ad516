package agentdesk.spi;

import agentdesk.AgentTask;
import agentdesk.TaskUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for agent tasks.
 *
 * <p>Implementations must be safe for concurrent callers and must apply
 * {@link #updateTask} as a read-modify-write against the latest persisted state,
 * so that two concurrent updates never lose each other's fields. Infrastructure
 * failures surface as unchecked exceptions to the caller.
 *
 * @see agentdesk.worker.TaskWorker
 */
public interface TaskStore {

  /**
   * Persists a new task.
   *
   * @param task the task to store
   * @throws agentdesk.DuplicateTaskException if a task with the same id exists
   */
  void addTask(AgentTask task);

  Optional<AgentTask> getTask(String taskId);

  /**
   * Returns all tasks in creation order.
   */
  List<AgentTask> listTasks();

  /**
   * Merges {@code update} into the stored task via {@link TaskUpdate#applyTo} and
   * refreshes {@code updatedAt}.
   *
   * @param taskId the task to update
   * @param update the partial update
   * @return the updated task, or empty if no such task exists
   * @throws agentdesk.InvalidTransitionException if the stored task is terminal or
   *     the status change is not allowed; the stored task is left unchanged
   */
  Optional<AgentTask> updateTask(String taskId, TaskUpdate update);
}
