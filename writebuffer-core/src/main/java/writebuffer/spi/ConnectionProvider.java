package writebuffer.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the embedded store. Each batch transaction obtains its
 * own connection and closes it when the transaction ends.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see writebuffer.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
