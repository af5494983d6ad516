/**
 * Root API for AgentDesk: a persisted task queue that hands named actions to pluggable
 * agent handlers, gates risky actions behind human approval, audits every transition,
 * and delivers asynchronous side effects through a retrying outbox.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>agentdesk-core</b>: model, SPI, registry, worker, outbox delivery (only depends on ulid-creator)</li>
 *   <li><b>agentdesk-jdbc</b>: JDBC task, audit and outbox stores</li>
 *   <li><b>agentdesk-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>agentdesk-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Task lifecycle</h2>
 * <pre>
 * pending ──run──▶ in_progress ──▶ completed
 *    │                  │
 *    │                  └────────▶ failed ──run──▶ in_progress
 *    └──run (unapproved)────────▶ failed
 * pending | in_progress | failed ──cancel/reject──▶ cancelled
 * </pre>
 *
 * @see agentdesk.AgentDesk
 * @see agentdesk.AgentHandler
 * @see agentdesk.worker.TaskWorker
 * @see agentdesk.outbox.DeliveryWorker
 */
package agentdesk;
