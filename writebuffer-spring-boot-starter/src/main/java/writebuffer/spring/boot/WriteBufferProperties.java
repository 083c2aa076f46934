package writebuffer.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the write buffer.
 *
 * @see WriteBufferAutoConfiguration
 */
@ConfigurationProperties(prefix = "writebuffer")
public class WriteBufferProperties {

    /**
     * Whether writes are batched. When false every write is committed on its own.
     */
    private boolean enabled = true;

    /**
     * Buffered records per category that trigger a size flush.
     */
    private int batchSize = 100;

    /**
     * Longest time in milliseconds a non-empty buffer waits before a time flush.
     */
    private long flushIntervalMs = 50;

    /**
     * Maximum buffered records per category.
     */
    private int maxBufferSize = 10_000;

    /**
     * Retries of a failed batch before it is dropped.
     */
    private int maxRetries = 3;

    /**
     * Budget in milliseconds for draining the buffers on shutdown.
     */
    private long shutdownTimeoutMs = 5000;

    /**
     * SQL dialect name ({@code h2}, {@code sqlite}); detected from the DataSource when unset.
     */
    private String dialect;

    private final Retry retry = new Retry();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getFlushIntervalMs() {
        return flushIntervalMs;
    }

    public void setFlushIntervalMs(long flushIntervalMs) {
        this.flushIntervalMs = flushIntervalMs;
    }

    public int getMaxBufferSize() {
        return maxBufferSize;
    }

    public void setMaxBufferSize(int maxBufferSize) {
        this.maxBufferSize = maxBufferSize;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public String getDialect() {
        return dialect;
    }

    public void setDialect(String dialect) {
        this.dialect = dialect;
    }

    public Retry getRetry() {
        return retry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Delay between retries of a failed batch. A base delay of 0 retries on the next
     * flush trigger.
     */
    public static class Retry {
        private long baseDelayMs = 0;
        private long maxDelayMs = 5000;

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
        private String namePrefix = "writebuffer";

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
