package writebuffer.jdbc.dialect;

import writebuffer.Category;

import java.util.List;

/**
 * SQLite dialect.
 */
public final class SqliteDialect extends AbstractDialect {

  @Override
  public String name() {
    return "sqlite";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:sqlite:");
  }

  @Override
  protected String subscriptionUpsertSql() {
    Category c = Category.SUBSCRIPTION;
    return "INSERT OR REPLACE INTO " + c.table() + " (" + columnList(c) + ") VALUES ("
        + placeholders(c) + ")";
  }
}
