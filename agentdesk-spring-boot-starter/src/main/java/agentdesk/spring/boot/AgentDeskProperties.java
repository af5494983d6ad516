package agentdesk.spring.boot;

import agentdesk.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the agent desk.
 *
 * @see AgentDeskAutoConfiguration
 */
@ConfigurationProperties(prefix = "agentdesk")
public class AgentDeskProperties {

    /**
     * Whether to create the task, audit and outbox tables on startup if they are missing.
     */
    private boolean initializeSchema = true;

    private final Tables tables = new Tables();
    private final Worker worker = new Worker();
    private final Delivery delivery = new Delivery();
    private final Metrics metrics = new Metrics();

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Tables getTables() {
        return tables;
    }

    public Worker getWorker() {
        return worker;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Tables {
        private String tasks = TableNames.DEFAULT_TASKS;
        private String audit = TableNames.DEFAULT_AUDIT;
        private String outbox = TableNames.DEFAULT_OUTBOX;

        public String getTasks() {
            return tasks;
        }

        public void setTasks(String tasks) {
            this.tasks = tasks;
        }

        public String getAudit() {
            return audit;
        }

        public void setAudit(String audit) {
            this.audit = audit;
        }

        public String getOutbox() {
            return outbox;
        }

        public void setOutbox(String outbox) {
            this.outbox = outbox;
        }

        public TableNames toTableNames() {
            return new TableNames(tasks, audit, outbox);
        }
    }

    public static class Worker {
        /**
         * Threads running tasks started in the background.
         */
        private int asyncThreads = 4;

        public int getAsyncThreads() {
            return asyncThreads;
        }

        public void setAsyncThreads(int asyncThreads) {
            this.asyncThreads = asyncThreads;
        }
    }

    public static class Delivery {
        /**
         * Whether the scheduled delivery loop runs. When disabled, passes run only on
         * demand through the outbox admin.
         */
        private boolean enabled = true;
        private long intervalMs = 60_000;
        private int batchSize = 50;
        private int maxAttempts = 3;
        private long drainTimeoutMs = 5000;
        private final Retry retry = new Retry();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public Retry getRetry() {
            return retry;
        }
    }

    public static class Retry {
        private long baseDelayMs = 60_000;
        private long maxDelayMs = 86_400_000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "agentdesk";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
