package writebuffer;

import writebuffer.util.JsonCodec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single buffered write: a category plus its column values in insert order.
 *
 * <p>Immutable. The number of values must match {@link Category#arity()}; a mismatch is
 * rejected here, at the boundary, so it never reaches a transaction. Values may be
 * {@code null} (bound as SQL NULL).
 *
 * <p>Use the typed factories ({@link #message}, {@link #consumption}, {@link #subscription})
 * rather than {@link #of} when the column values are known individually.
 *
 * @param category   the target category
 * @param values     column values, positionally matching {@link Category#columns()}
 * @param enqueuedAt when the record was created
 */
public record WriteRecord(Category category, List<Object> values, Instant enqueuedAt) {

  public WriteRecord {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(values, "values");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    if (values.size() != category.arity()) {
      throw new IllegalArgumentException(category + " expects " + category.arity()
          + " values " + category.columns() + ", got " + values.size());
    }
    // List.copyOf rejects nulls, which are legal column values here
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  /**
   * Creates a record from raw positional values.
   *
   * @throws IllegalArgumentException if the value count does not match the category arity
   */
  public static WriteRecord of(Category category, Object... values) {
    Objects.requireNonNull(values, "values");
    return new WriteRecord(category, Arrays.asList(values), Instant.now());
  }

  /**
   * A published message. Non-string payloads are encoded as JSON.
   */
  public static WriteRecord message(String topic, String messageId, Object message,
      String producer, Instant timestamp) {
    return of(Category.MESSAGE, topic, messageId, encodePayload(message), producer,
        epochSeconds(timestamp));
  }

  /**
   * A message consumed by a subscriber. Non-string payloads are encoded as JSON.
   */
  public static WriteRecord consumption(String consumer, String topic, String messageId,
      Object message, Instant timestamp) {
    return of(Category.CONSUMPTION, consumer, topic, messageId, encodePayload(message),
        epochSeconds(timestamp));
  }

  /**
   * A subscription of session {@code sid} to {@code topic}.
   */
  public static WriteRecord subscription(String sid, String consumer, String topic,
      Instant connectedAt) {
    return of(Category.SUBSCRIPTION, sid, consumer, topic, epochSeconds(connectedAt));
  }

  /**
   * Converts an instant to fractional epoch seconds, the representation of the
   * {@code REAL} timestamp columns.
   */
  public static double epochSeconds(Instant instant) {
    Objects.requireNonNull(instant, "instant");
    return instant.getEpochSecond() + instant.getNano() / 1_000_000_000d;
  }

  private static String encodePayload(Object message) {
    if (message == null || message instanceof String) {
      return (String) message;
    }
    return JsonCodec.getDefault().encode(message);
  }
}
