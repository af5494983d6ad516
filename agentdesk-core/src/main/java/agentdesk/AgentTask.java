package agentdesk;

import agentdesk.model.TaskMetadata;
import agentdesk.model.TaskStatus;
import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a unit of work handed to an agent.
 *
 * <p>Each task is assigned a ULID-based {@code taskId} by default. The payload is an
 * opaque string (JSON text by convention) that only the handler interprets. Stored
 * state changes go through {@link agentdesk.spi.TaskStore#updateTask}, which returns
 * a new snapshot; instances are never mutated.
 *
 * @see TaskUpdate
 * @see agentdesk.spi.TaskStore
 */
public final class AgentTask {
    private final String taskId;
    private final String supervisor;
    private final String agent;
    private final String action;
    private final String payload;
    private final TaskMetadata metadata;
    private final TaskStatus status;
    private final String result;
    private final String error;
    private final Instant createdAt;
    private final Instant updatedAt;

    private AgentTask(Builder builder) {
        this.taskId = builder.taskId == null ? newTaskId() : builder.taskId;
        this.agent = Objects.requireNonNull(builder.agent, "agent");
        this.action = Objects.requireNonNull(builder.action, "action");
        if (agent.isBlank()) {
            throw new IllegalArgumentException("agent cannot be empty");
        }
        if (action.isBlank()) {
            throw new IllegalArgumentException("action cannot be empty");
        }
        this.supervisor = builder.supervisor;
        this.payload = builder.payload;
        this.metadata = builder.metadata == null ? TaskMetadata.NONE : builder.metadata;
        this.status = builder.status == null ? TaskStatus.PENDING : builder.status;
        this.result = builder.result;
        this.error = builder.error;
        this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
        this.updatedAt = builder.updatedAt == null ? this.createdAt : builder.updatedAt;
    }

    public static Builder builder(String agent, String action) {
        return new Builder().agent(agent).action(action);
    }

    /** Returns a builder pre-populated with every field of this task. */
    public Builder toBuilder() {
        return new Builder()
                .taskId(taskId)
                .supervisor(supervisor)
                .agent(agent)
                .action(action)
                .payload(payload)
                .metadata(metadata)
                .status(status)
                .result(result)
                .error(error)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    private static String newTaskId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    public String taskId() {
        return taskId;
    }

    public String supervisor() {
        return supervisor;
    }

    public String agent() {
        return agent;
    }

    public String action() {
        return action;
    }

    public String payload() {
        return payload;
    }

    public TaskMetadata metadata() {
        return metadata;
    }

    public TaskStatus status() {
        return status;
    }

    /** Handler output; present only when {@link TaskStatus#COMPLETED}. */
    public String result() {
        return result;
    }

    /** Failure message; present only when {@link TaskStatus#FAILED}. */
    public String error() {
        return error;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AgentTask)) return false;
        AgentTask that = (AgentTask) o;
        return taskId.equals(that.taskId)
                && Objects.equals(supervisor, that.supervisor)
                && agent.equals(that.agent)
                && action.equals(that.action)
                && Objects.equals(payload, that.payload)
                && metadata.equals(that.metadata)
                && status == that.status
                && Objects.equals(result, that.result)
                && Objects.equals(error, that.error)
                && createdAt.equals(that.createdAt)
                && updatedAt.equals(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId, status, updatedAt);
    }

    @Override
    public String toString() {
        return "AgentTask{taskId=" + taskId + ", agent=" + agent + ", action=" + action
                + ", status=" + status.code() + "}";
    }

    public static final class Builder {
        private String taskId;
        private String supervisor;
        private String agent;
        private String action;
        private String payload;
        private TaskMetadata metadata;
        private TaskStatus status;
        private String result;
        private String error;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {}

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder supervisor(String supervisor) {
            this.supervisor = supervisor;
            return this;
        }

        public Builder agent(String agent) {
            this.agent = agent;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder metadata(TaskMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public AgentTask build() {
            return new AgentTask(this);
        }
    }
}
