package writebuffer.jdbc.tx;

import writebuffer.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Opens explicit JDBC transactions: one connection with auto-commit disabled per
 * {@link Transaction}, returned to the provider when the transaction ends.
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     try (var ps = tx.connection().prepareStatement(sql)) {
 *         ...
 *     }
 *     tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransactionManager {
  private final ConnectionProvider connectionProvider;

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Begins a new transaction on a fresh connection.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained or configured
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new Transaction(connection);
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} triggers a rollback automatically.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private boolean completed;

    private Transaction(Connection connection) {
      this.connection = connection;
    }

    /**
     * The transaction's connection. Must not be used after the transaction completes.
     */
    public Connection connection() {
      if (completed) {
        throw new IllegalStateException("Transaction already completed");
      }
      return connection;
    }

    public boolean isCompleted() {
      return completed;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        rollbackQuietly(e);
        release(e);
        throw e;
      }
      release(null);
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } catch (SQLException e) {
        release(e);
        throw e;
      }
      release(null);
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void rollbackQuietly(SQLException cause) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        cause.addSuppressed(e);
      }
    }

    private void release(SQLException pending) throws SQLException {
      completed = true;
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        if (pending == null) {
          pending = e;
        } else {
          pending.addSuppressed(e);
        }
      } finally {
        try {
          connection.close();
        } catch (SQLException e) {
          if (pending == null) {
            pending = e;
          } else {
            pending.addSuppressed(e);
          }
        }
      }
      if (pending != null) {
        throw pending;
      }
    }
  }
}
