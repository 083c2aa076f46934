package writebuffer.spi;

import java.util.Objects;

/**
 * Outcome of {@link BatchExecutor#executeBatch}.
 *
 * <ul>
 *   <li>{@link Committed}: the whole batch was committed in one transaction.</li>
 *   <li>{@link Failed}: the transaction was rolled back; nothing from the batch is
 *       visible in the store.</li>
 * </ul>
 */
public sealed interface BatchResult permits BatchResult.Committed, BatchResult.Failed {

    static Committed committed(int count) {
        return new Committed(count);
    }

    static Failed failed(Throwable cause) {
        return new Failed(cause);
    }

    /**
     * The batch was committed.
     *
     * @param count number of rows written
     */
    record Committed(int count) implements BatchResult {
        public Committed {
            if (count < 0) {
                throw new IllegalArgumentException("count must be >= 0");
            }
        }
    }

    /**
     * The batch was rolled back.
     *
     * @param cause why the transaction failed
     */
    record Failed(Throwable cause) implements BatchResult {
        public Failed {
            Objects.requireNonNull(cause, "cause");
        }
    }
}
