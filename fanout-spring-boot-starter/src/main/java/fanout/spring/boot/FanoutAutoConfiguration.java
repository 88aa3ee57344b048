package fanout.spring.boot;

import fanout.Fanout;
import fanout.RecordWriter;
import fanout.jdbc.ConnectionProvider;
import fanout.jdbc.DataSourceConnectionProvider;
import fanout.jdbc.JdbcAppendLog;
import fanout.jdbc.TableNames;
import fanout.jdbc.store.AbstractJdbcLogStore;
import fanout.jdbc.store.JdbcLogStores;
import fanout.puller.ExponentialBackoffPolicy;
import fanout.spi.AppendLog;
import fanout.spi.LogTrimmer;
import fanout.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the fan-out engine.
 *
 * <p>Wires up a {@link Fanout} composite over a {@link JdbcAppendLog} from a
 * {@link DataSource} and {@link FanoutProperties}. Any bean of type
 * {@link AppendLog}, {@link AbstractJdbcLogStore} or {@link ConnectionProvider}
 * defined by the application replaces the default.
 *
 * @see FanoutProperties
 * @see FanoutMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Fanout.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(FanoutProperties.class)
public class FanoutAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcLogStore logStore(DataSource dataSource, FanoutProperties props) {
    AbstractJdbcLogStore detected = JdbcLogStores.detect(dataSource);
    String tableName = props.getTableName();
    if (!TableNames.DEFAULT_TABLE.equals(tableName)) {
      return detected.withTableName(tableName);
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(AppendLog.class)
  public JdbcAppendLog appendLog(ConnectionProvider connectionProvider,
      AbstractJdbcLogStore logStore, FanoutProperties props) {
    return JdbcAppendLog.builder()
        .connectionProvider(connectionProvider)
        .store(logStore)
        .readTimeout(props.getPuller().getReadTimeout())
        .maxKeysPerStatement(props.getPuller().getMaxKeysPerStatement())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Fanout fanout(FanoutProperties props,
      AppendLog appendLog,
      AbstractJdbcLogStore logStore,
      ConnectionProvider connectionProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var puller = props.getPuller();
    var subscription = props.getSubscription();
    var builder = Fanout.builder()
        .appendLog(appendLog)
        .backoffPolicy(new ExponentialBackoffPolicy(
            props.getBackoff().getBaseDelayMs(), props.getBackoff().getMaxDelayMs()))
        .minCycleIntervalMs(puller.getMinCycleIntervalMs())
        .idleIntervalMs(puller.getIdleIntervalMs())
        .maxRecordsPerKey(puller.getMaxRecordsPerKey())
        .maxLifetime(subscription.getMaxLifetime())
        .sinkCapacity(subscription.getSinkCapacity())
        .overflowPolicy(subscription.getOverflowPolicy());

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    var trim = props.getTrim();
    if (trim.isEnabled()) {
      LogTrimmer trimmer = logStore.newTrimmer(connectionProvider);
      builder.logTrimmer(trimmer, trim.getRetention())
          .trimBatchSize(trim.getBatchSize())
          .trimIntervalSeconds(trim.getIntervalSeconds());
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public RecordWriter recordWriter(Fanout fanout) {
    return fanout.writer();
  }
}
