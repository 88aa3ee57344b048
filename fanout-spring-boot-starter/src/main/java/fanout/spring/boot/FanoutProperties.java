package fanout.spring.boot;

import fanout.sink.OverflowPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the fan-out engine.
 *
 * @see FanoutAutoConfiguration
 */
@ConfigurationProperties(prefix = "fanout")
public class FanoutProperties {

  /**
   * Database table name for append log records.
   */
  private String tableName = "fanout_record";

  private final Puller puller = new Puller();
  private final Backoff backoff = new Backoff();
  private final Subscription subscription = new Subscription();
  private final Trim trim = new Trim();
  private final Metrics metrics = new Metrics();

  public String getTableName() {
    return tableName;
  }

  public void setTableName(String tableName) {
    this.tableName = tableName;
  }

  public Puller getPuller() {
    return puller;
  }

  public Backoff getBackoff() {
    return backoff;
  }

  public Subscription getSubscription() {
    return subscription;
  }

  public Trim getTrim() {
    return trim;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Puller {
    private long minCycleIntervalMs = 50;
    private long idleIntervalMs = 100;
    private int maxRecordsPerKey = 100;
    private Duration readTimeout = Duration.ofSeconds(5);
    private int maxKeysPerStatement = 1000;

    public long getMinCycleIntervalMs() {
      return minCycleIntervalMs;
    }

    public void setMinCycleIntervalMs(long minCycleIntervalMs) {
      this.minCycleIntervalMs = minCycleIntervalMs;
    }

    public long getIdleIntervalMs() {
      return idleIntervalMs;
    }

    public void setIdleIntervalMs(long idleIntervalMs) {
      this.idleIntervalMs = idleIntervalMs;
    }

    public int getMaxRecordsPerKey() {
      return maxRecordsPerKey;
    }

    public void setMaxRecordsPerKey(int maxRecordsPerKey) {
      this.maxRecordsPerKey = maxRecordsPerKey;
    }

    public Duration getReadTimeout() {
      return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
    }

    public int getMaxKeysPerStatement() {
      return maxKeysPerStatement;
    }

    public void setMaxKeysPerStatement(int maxKeysPerStatement) {
      this.maxKeysPerStatement = maxKeysPerStatement;
    }
  }

  public static class Backoff {
    private long baseDelayMs = 200;
    private long maxDelayMs = 30000;

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

  public static class Subscription {
    private Duration maxLifetime = Duration.ofMinutes(30);
    private int sinkCapacity = 256;
    private OverflowPolicy overflowPolicy = OverflowPolicy.DISCONNECT;

    public Duration getMaxLifetime() {
      return maxLifetime;
    }

    public void setMaxLifetime(Duration maxLifetime) {
      this.maxLifetime = maxLifetime;
    }

    public int getSinkCapacity() {
      return sinkCapacity;
    }

    public void setSinkCapacity(int sinkCapacity) {
      this.sinkCapacity = sinkCapacity;
    }

    public OverflowPolicy getOverflowPolicy() {
      return overflowPolicy;
    }

    public void setOverflowPolicy(OverflowPolicy overflowPolicy) {
      this.overflowPolicy = overflowPolicy;
    }
  }

  public static class Trim {
    private boolean enabled = false;
    private Duration retention = Duration.ofDays(7);
    private int batchSize = 500;
    private long intervalSeconds = 3600;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getRetention() {
      return retention;
    }

    public void setRetention(Duration retention) {
      this.retention = retention;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public long getIntervalSeconds() {
      return intervalSeconds;
    }

    public void setIntervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "fanout";

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
