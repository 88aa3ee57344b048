/**
 * Root API of the fan-out engine: keyed records from an append log, served to many
 * long-lived subscribers through one batched read per cycle.
 *
 * <h2>Core Design</h2>
 * <p>Producers append records per key through a {@link fanout.RecordWriter}. Each
 * subscriber {@linkplain fanout.attach.AttachmentPoint attaches} to exactly one key and
 * reads a {@link fanout.attach.StreamSubscription}. A single
 * {@linkplain fanout.puller.Puller puller} thread reads the new records of every key
 * that has a subscriber in one {@link fanout.spi.AppendLog#readBatch} call and pushes
 * each record into the bounded {@linkplain fanout.sink.Sink sink} of every subscriber
 * of its key. Keys with no subscriber cost nothing.
 *
 * <p>Ordering is total per key ({@link fanout.RecordId}) and undefined across keys.
 * A store failure ends every affected subscription with a
 * {@link fanout.StoreUnavailableException}; subscribers reopen from the id after the
 * last record they processed.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>fanout-core</b> &mdash; engine, registry, puller, SPIs</li>
 *   <li><b>fanout-jdbc</b> &mdash; JDBC append logs (H2, MySQL, PostgreSQL) and trimmers</li>
 *   <li><b>fanout-micrometer</b> &mdash; Micrometer metrics bridge</li>
 *   <li><b>fanout-spring-boot-starter</b> &mdash; Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var appendLog = JdbcAppendLog.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .store(JdbcLogStores.detect(dataSource))
 *     .build();
 *
 * try (Fanout fanout = Fanout.builder().appendLog(appendLog).build()) {
 *   RecordId first = fanout.writer().append("order-42", "created");
 *
 *   try (StreamSubscription sub = fanout.open("order-42", first)) {
 *     Record record;
 *     while ((record = sub.poll(Duration.ofSeconds(15))) != null || !sub.isClosed()) {
 *       if (record == null) {
 *         // send heartbeat
 *       } else {
 *         // write record.payload() to the client
 *       }
 *     }
 *   }
 * }
 * }</pre>
 *
 * @see fanout.Fanout
 * @see fanout.RecordWriter
 * @see fanout.attach.StreamSubscription
 */
package fanout;
