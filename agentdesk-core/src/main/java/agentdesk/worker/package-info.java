/**
 * Task lifecycle execution.
 *
 * <p>{@link agentdesk.worker.TaskWorker} runs tasks through their handlers, enforces the
 * approval gate, and implements approve, reject and cancel. All transitions are written
 * through the {@link agentdesk.spi.TaskStore} and recorded in the {@link agentdesk.spi.AuditLog}.
 */
package agentdesk.worker;
