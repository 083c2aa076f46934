package writebuffer.jdbc;

import writebuffer.Category;
import writebuffer.jdbc.spi.Dialect;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Complete, immutable set of insert statements: exactly one per {@link Category}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // From a dialect
 * InsertStatements statements = InsertStatements.forDialect(Dialects.get("sqlite"));
 *
 * // Custom SQL
 * InsertStatements statements = InsertStatements.builder()
 *     .put(Category.MESSAGE, "INSERT INTO audit.messages (...) VALUES (?, ?, ?, ?, ?)")
 *     .put(Category.CONSUMPTION, "...")
 *     .put(Category.SUBSCRIPTION, "...")
 *     .build();
 * }</pre>
 */
public final class InsertStatements {
  private final Map<Category, InsertStatement> statements;

  private InsertStatements(Map<Category, InsertStatement> statements) {
    this.statements = statements;
  }

  /**
   * Builds the statements of a dialect.
   */
  public static InsertStatements forDialect(Dialect dialect) {
    Objects.requireNonNull(dialect, "dialect");
    Builder builder = builder();
    for (Category category : Category.values()) {
      builder.put(category, dialect.insertSql(category));
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public InsertStatement get(Category category) {
    return statements.get(Objects.requireNonNull(category, "category"));
  }

  @Override
  public String toString() {
    return "InsertStatements" + statements.values();
  }

  public static final class Builder {
    private final EnumMap<Category, InsertStatement> statements = new EnumMap<>(Category.class);

    private Builder() {}

    public Builder put(Category category, String sql) {
      return put(InsertStatement.of(category, sql));
    }

    public Builder put(InsertStatement statement) {
      Objects.requireNonNull(statement, "statement");
      statements.put(statement.category(), statement);
      return this;
    }

    /**
     * @throws IllegalStateException if a category has no statement
     */
    public InsertStatements build() {
      for (Category category : Category.values()) {
        if (!statements.containsKey(category)) {
          throw new IllegalStateException("No insert statement for " + category);
        }
      }
      return new InsertStatements(Collections.unmodifiableMap(new EnumMap<>(statements)));
    }
  }
}
