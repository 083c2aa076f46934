package writebuffer.jdbc.dialect;

import writebuffer.Category;
import writebuffer.jdbc.spi.Dialect;

import java.util.Collections;

/**
 * Base dialect with standard {@code INSERT} statements.
 *
 * <p>Subclasses supply the subscription upsert, which has no portable SQL.
 */
public abstract class AbstractDialect implements Dialect {

  @Override
  public String insertSql(Category category) {
    if (category == Category.SUBSCRIPTION) {
      return subscriptionUpsertSql();
    }
    return "INSERT INTO " + category.table() + " (" + columnList(category) + ") VALUES ("
        + placeholders(category) + ")";
  }

  /**
   * Inserts a subscription, replacing the row of the same {@code (sid, topic)}.
   */
  protected abstract String subscriptionUpsertSql();

  protected static String columnList(Category category) {
    return String.join(", ", category.columns());
  }

  protected static String placeholders(Category category) {
    return String.join(", ", Collections.nCopies(category.arity(), "?"));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name() + "]";
  }
}
