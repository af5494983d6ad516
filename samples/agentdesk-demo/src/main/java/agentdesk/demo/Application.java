package agentdesk.demo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Agent desk demo: an embedded H2 database, the starter's auto-configuration, one
 * {@code EmailAgent} and a delivery channel that logs instead of sending mail.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/agentdesk-demo/pom.xml spring-boot:run
 *
 * <p>Endpoints:
 * POST   /api/agent/tasks                  - create a task
 * GET    /api/agent/tasks                  - list tasks
 * GET    /api/agent/tasks/{id}             - read one task
 * POST   /api/agent/tasks/{id}/run         - run in the background
 * POST   /api/agent/tasks/{id}/approve     - approve a gated task
 * POST   /api/agent/tasks/{id}/reject      - reject with {"reason": ...}
 * DELETE /api/agent/tasks/{id}             - cancel
 * GET    /api/agent/tasks/{id}/audit       - audit trail
 * GET    /api/agent/registry               - registered agents
 * GET    /api/admin/outbox                 - outbox items
 * POST   /api/admin/outbox/{id}/resend     - reset and deliver again
 * DELETE /api/admin/outbox/{id}            - drop an item
 * GET    /api/admin/outbox/metrics         - delivery counters
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
