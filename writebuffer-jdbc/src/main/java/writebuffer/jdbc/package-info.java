/**
 * JDBC persistence for the write buffer.
 *
 * <p>{@link writebuffer.jdbc.JdbcBatchExecutor} commits each batch in one explicit
 * transaction using the {@linkplain writebuffer.jdbc.InsertStatements insert statements} of a
 * {@linkplain writebuffer.jdbc.spi.Dialect dialect}. The store's tables are expected to
 * exist with the column order of {@link writebuffer.Category#columns()}:
 *
 * <pre>{@code
 * CREATE TABLE messages (
 *   topic TEXT NOT NULL, message_id TEXT NOT NULL, message TEXT,
 *   producer TEXT, timestamp REAL NOT NULL);
 * CREATE TABLE consumptions (
 *   consumer TEXT NOT NULL, topic TEXT NOT NULL, message_id TEXT NOT NULL,
 *   message TEXT, timestamp REAL NOT NULL);
 * CREATE TABLE subscriptions (
 *   sid TEXT NOT NULL, consumer TEXT, topic TEXT NOT NULL, connected_at REAL NOT NULL,
 *   PRIMARY KEY (sid, topic));
 * }</pre>
 *
 * @see writebuffer.jdbc.JdbcBatchExecutor
 * @see writebuffer.jdbc.dialect.Dialects
 */
package writebuffer.jdbc;
