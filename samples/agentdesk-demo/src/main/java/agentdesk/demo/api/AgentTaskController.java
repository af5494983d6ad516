package agentdesk.demo.api;

import agentdesk.AgentDesk;
import agentdesk.AgentTask;
import agentdesk.TaskRequest;
import agentdesk.model.AuditEvent;
import agentdesk.registry.AgentDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/agent")
public class AgentTaskController {

    private final AgentDesk desk;
    private final ObjectMapper objectMapper;

    public AgentTaskController(AgentDesk desk, ObjectMapper objectMapper) {
        this.desk = desk;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/tasks")
    public ResponseEntity<Map<String, Object>> create(@RequestBody CreateTaskBody body) {
        TaskRequest request = new TaskRequest(
                body.supervisor(),
                body.agent(),
                body.action(),
                body.payload() == null || body.payload().isNull() ? null : body.payload().toString(),
                body.metadata() == null ? null : body.metadata().toTaskMetadata());
        AgentTask task = desk.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "task", view(task)));
    }

    @GetMapping("/tasks")
    public Map<String, Object> list() {
        List<TaskView> tasks = desk.list().stream().map(this::view).toList();
        return Map.of("success", true, "tasks", tasks);
    }

    @GetMapping("/tasks/{id}")
    public Map<String, Object> get(@PathVariable String id) {
        return Map.of("success", true, "task", view(desk.get(id)));
    }

    /**
     * Starts the task in the background. A runnable task still waiting for approval is
     * refused with 403 and left untouched.
     */
    @PostMapping("/tasks/{id}/run")
    public ResponseEntity<Map<String, Object>> run(@PathVariable String id) {
        AgentTask task = desk.worker().checkRunnable(id);
        if (task.metadata().awaitingApproval()) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(Map.of("error", "Task requires user approval before running"));
        }
        desk.runAsync(id);
        return ResponseEntity.ok(Map.of("success", true, "running", true, "taskId", id));
    }

    @PostMapping("/tasks/{id}/approve")
    public Map<String, Object> approve(@PathVariable String id) {
        return Map.of("success", true, "task", view(desk.approve(id)));
    }

    @PostMapping("/tasks/{id}/reject")
    public Map<String, Object> reject(@PathVariable String id,
                                      @RequestBody(required = false) Map<String, String> body) {
        String reason = body == null ? null : body.get("reason");
        return Map.of("success", true, "task", view(desk.reject(id, reason)));
    }

    @DeleteMapping("/tasks/{id}")
    public Map<String, Object> cancel(@PathVariable String id) {
        return Map.of("success", true, "task", view(desk.cancel(id)));
    }

    @GetMapping("/tasks/{id}/audit")
    public Map<String, Object> audit(@PathVariable String id) {
        desk.get(id);
        List<AuditEvent> trail = desk.auditTrail(id);
        return Map.of("success", true, "audit", trail);
    }

    @GetMapping("/registry")
    public Map<String, Object> registry() {
        List<AgentDescriptor> agents = desk.agents();
        return Map.of("success", true, "agents", agents);
    }

    private TaskView view(AgentTask task) {
        return TaskView.of(task, objectMapper);
    }
}
