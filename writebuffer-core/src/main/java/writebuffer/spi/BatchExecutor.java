package writebuffer.spi;

import writebuffer.Category;
import writebuffer.WriteRecord;

import java.util.List;

/**
 * Persists one batch of records of a single category as one explicit transaction.
 *
 * <p>Implementations must be all-or-nothing: either every record of the batch is committed
 * in submission order, or the transaction is rolled back and {@link BatchResult.Failed} is
 * returned. Implementations must not throw for store failures; they report them as
 * {@code Failed}. Each invocation opens and closes its own transaction, and may be called
 * concurrently for different categories.
 *
 * @see writebuffer.jdbc.JdbcBatchExecutor
 */
public interface BatchExecutor {

    /**
     * Writes {@code records} to the table of {@code category}.
     *
     * @param category the category all records belong to
     * @param records  the batch, in enqueue order; an empty batch commits nothing
     * @return committed with the row count, or failed with the cause
     */
    BatchResult executeBatch(Category category, List<WriteRecord> records);
}
