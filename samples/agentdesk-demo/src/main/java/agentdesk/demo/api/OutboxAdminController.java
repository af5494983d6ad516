package agentdesk.demo.api;

import agentdesk.model.OutboxItem;
import agentdesk.outbox.DeliveryStats;
import agentdesk.outbox.OutboxAdmin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/admin/outbox")
public class OutboxAdminController {

    private static final Logger log = LoggerFactory.getLogger(OutboxAdminController.class);

    private final OutboxAdmin outboxAdmin;
    private final TaskExecutor taskExecutor;

    public OutboxAdminController(OutboxAdmin outboxAdmin, TaskExecutor taskExecutor) {
        this.outboxAdmin = outboxAdmin;
        this.taskExecutor = taskExecutor;
    }

    @GetMapping
    public Map<String, Object> list() {
        List<OutboxItem> outbox = outboxAdmin.list();
        return Map.of("success", true, "outbox", outbox);
    }

    /**
     * Resets the item and triggers a delivery pass in the background.
     */
    @PostMapping("/{id}/resend")
    public ResponseEntity<Map<String, Object>> resend(@PathVariable String id) {
        if (!outboxAdmin.resend(id)) {
            return notFound();
        }
        Optional<OutboxItem> item = outboxAdmin.find(id);
        taskExecutor.execute(() -> {
            try {
                outboxAdmin.deliverNow();
            } catch (RuntimeException e) {
                log.error("Manual delivery pass failed", e);
            }
        });
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("item", item.orElse(null));
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String id) {
        if (!outboxAdmin.delete(id)) {
            return notFound();
        }
        return ResponseEntity.ok(Map.of("success", true));
    }

    @GetMapping("/metrics")
    public Map<String, Object> metrics() {
        DeliveryStats stats = outboxAdmin.stats();
        return Map.of("success", true, "metrics", stats, "pending", outboxAdmin.pendingCount());
    }

    private static ResponseEntity<Map<String, Object>> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Not found"));
    }
}
