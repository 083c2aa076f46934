/**
 * Explicit JDBC transactions for batch commits.
 *
 * @see writebuffer.jdbc.tx.JdbcTransactionManager
 */
package writebuffer.jdbc.tx;
