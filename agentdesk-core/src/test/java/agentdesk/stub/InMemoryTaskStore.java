package agentdesk.stub;

import agentdesk.AgentTask;
import agentdesk.DuplicateTaskException;
import agentdesk.TaskUpdate;
import agentdesk.spi.TaskStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TaskStore stub for unit tests that don't need real JDBC.
 */
public class InMemoryTaskStore implements TaskStore {
  private final Map<String, AgentTask> tasks = new LinkedHashMap<>();
  public final AtomicInteger updateCount = new AtomicInteger();

  @Override
  public synchronized void addTask(AgentTask task) {
    if (tasks.containsKey(task.taskId())) {
      throw new DuplicateTaskException(task.taskId());
    }
    tasks.put(task.taskId(), task);
  }

  @Override
  public synchronized Optional<AgentTask> getTask(String taskId) {
    return Optional.ofNullable(tasks.get(taskId));
  }

  @Override
  public synchronized List<AgentTask> listTasks() {
    return new ArrayList<>(tasks.values());
  }

  @Override
  public synchronized Optional<AgentTask> updateTask(String taskId, TaskUpdate update) {
    AgentTask current = tasks.get(taskId);
    if (current == null) {
      return Optional.empty();
    }
    AgentTask updated = update.applyTo(current, Instant.now());
    tasks.put(taskId, updated);
    updateCount.incrementAndGet();
    return Optional.of(updated);
  }
}
