package writebuffer.jdbc;

import writebuffer.Category;

import java.util.Objects;

/**
 * Parameterized insert for one category.
 *
 * @param category    the category it persists
 * @param sql         the statement, one {@code ?} per column
 * @param columnCount number of bound parameters; equals the category arity
 */
public record InsertStatement(Category category, String sql, int columnCount) {

  public InsertStatement {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(sql, "sql");
    if (columnCount != category.arity()) {
      throw new IllegalArgumentException(category + " has " + category.arity()
          + " columns but the statement declares " + columnCount);
    }
    int placeholders = countPlaceholders(sql);
    if (placeholders != columnCount) {
      throw new IllegalArgumentException("Statement for " + category + " has " + placeholders
          + " placeholders, expected " + columnCount + ": " + sql);
    }
  }

  /**
   * Creates a statement whose column count is the category arity.
   */
  public static InsertStatement of(Category category, String sql) {
    return new InsertStatement(category, sql, category.arity());
  }

  private static int countPlaceholders(String sql) {
    int count = 0;
    boolean quoted = false;
    for (int i = 0; i < sql.length(); i++) {
      char c = sql.charAt(i);
      if (c == '\'') {
        quoted = !quoted;
      } else if (c == '?' && !quoted) {
        count++;
      }
    }
    return count;
  }
}
