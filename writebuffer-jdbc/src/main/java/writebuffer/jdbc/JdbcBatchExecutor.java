package writebuffer.jdbc;

import writebuffer.Category;
import writebuffer.WriteRecord;
import writebuffer.jdbc.spi.Dialect;
import writebuffer.jdbc.tx.JdbcTransactionManager;
import writebuffer.spi.BatchExecutor;
import writebuffer.spi.BatchResult;
import writebuffer.spi.ConnectionProvider;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BatchExecutor} that commits each batch as one explicit JDBC transaction.
 *
 * <p>Records are inserted in their original order through a single JDBC batch on the
 * category's {@link InsertStatement}. Either every record of the batch is committed or,
 * on any failure, the transaction is rolled back and nothing is visible. Every call
 * borrows its own connection; no transaction outlives a call.
 *
 * <p>Arity is checked for every record before a connection is obtained, so a malformed
 * record fails the batch without touching the store.
 */
public final class JdbcBatchExecutor implements BatchExecutor {
  private static final Logger logger = Logger.getLogger(JdbcBatchExecutor.class.getName());

  private final JdbcTransactionManager txManager;
  private final InsertStatements statements;

  public JdbcBatchExecutor(ConnectionProvider connectionProvider, InsertStatements statements) {
    this.txManager = new JdbcTransactionManager(
        Objects.requireNonNull(connectionProvider, "connectionProvider"));
    this.statements = Objects.requireNonNull(statements, "statements");
  }

  public JdbcBatchExecutor(ConnectionProvider connectionProvider, Dialect dialect) {
    this(connectionProvider, Objects.requireNonNull(dialect, "dialect").insertStatements());
  }

  public InsertStatements statements() {
    return statements;
  }

  @Override
  public BatchResult executeBatch(Category category, List<WriteRecord> records) {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(records, "records");
    if (records.isEmpty()) {
      return BatchResult.committed(0);
    }
    InsertStatement statement = statements.get(category);
    for (WriteRecord record : records) {
      if (record.category() != category) {
        return BatchResult.failed(new IllegalArgumentException(
            "Record of " + record.category() + " in a " + category + " batch"));
      }
      if (record.values().size() != statement.columnCount()) {
        return BatchResult.failed(new IllegalArgumentException(category + " statement binds "
            + statement.columnCount() + " columns, record has " + record.values().size()));
      }
    }

    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      try (PreparedStatement ps = tx.connection().prepareStatement(statement.sql())) {
        for (WriteRecord record : records) {
          bindParams(ps, record.values());
          ps.addBatch();
        }
        ps.executeBatch();
      }
      tx.commit();
      return BatchResult.committed(records.size());
    } catch (SQLException | RuntimeException e) {
      if (logger.isLoggable(Level.FINE)) {
        logger.log(Level.FINE, "Rolled back " + records.size() + " " + category + " records", e);
      }
      return BatchResult.failed(e);
    }
  }

  private static void bindParams(PreparedStatement ps, List<Object> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      Object param = params.get(i);
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Double d) {
        ps.setDouble(i + 1, d);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant));
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }
}
