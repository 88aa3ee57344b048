/**
 * Spring Boot auto-configuration for the fan-out engine.
 *
 * <p>With a {@link javax.sql.DataSource} in the context, {@link fanout.spring.boot.FanoutAutoConfiguration}
 * exposes a running {@link fanout.Fanout} and its {@link fanout.RecordWriter}. Properties live
 * under {@code fanout.*} ({@link fanout.spring.boot.FanoutProperties}).
 */
package fanout.spring.boot;
