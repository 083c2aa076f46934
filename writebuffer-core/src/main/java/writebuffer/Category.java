package writebuffer;

import java.util.List;

/**
 * Closed set of write categories. Each category maps to exactly one target table
 * whose column order is fixed by the (externally owned) schema.
 *
 * <p>The column lists below define the positional order of {@link WriteRecord#values()}.
 */
public enum Category {
  MESSAGE("messages", List.of("topic", "message_id", "message", "producer", "timestamp")),
  CONSUMPTION("consumptions", List.of("consumer", "topic", "message_id", "message", "timestamp")),
  SUBSCRIPTION("subscriptions", List.of("sid", "consumer", "topic", "connected_at"));

  private final String table;
  private final List<String> columns;

  Category(String table, List<String> columns) {
    this.table = table;
    this.columns = columns;
  }

  /**
   * Target table name.
   */
  public String table() {
    return table;
  }

  /**
   * Column names in insert order.
   */
  public List<String> columns() {
    return columns;
  }

  /**
   * Number of values every record of this category carries.
   */
  public int arity() {
    return columns.size();
  }
}
