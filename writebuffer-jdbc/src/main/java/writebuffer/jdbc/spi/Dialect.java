package writebuffer.jdbc.spi;

import writebuffer.Category;
import writebuffer.jdbc.InsertStatements;

import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the database-specific insert SQL of each category.
 * Register custom dialects via {@code META-INF/services/writebuffer.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: SQLite, H2.
 *
 * @see writebuffer.jdbc.dialect.Dialects
 */
public interface Dialect {

  /**
   * Unique identifier for this dialect (e.g., "sqlite", "h2").
   */
  String name();

  /**
   * JDBC URL prefixes this dialect handles (e.g., "jdbc:sqlite:").
   */
  List<String> jdbcUrlPrefixes();

  /**
   * SQL persisting one record of {@code category}.
   *
   * <p>Parameters are the category columns in {@link Category#columns()} order.
   * The {@link Category#SUBSCRIPTION} statement must replace an existing row with the
   * same {@code (sid, topic)}.
   */
  String insertSql(Category category);

  /**
   * All insert statements of this dialect.
   */
  default InsertStatements insertStatements() {
    return InsertStatements.forDialect(this);
  }
}
