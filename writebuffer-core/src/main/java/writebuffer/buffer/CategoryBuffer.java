package writebuffer.buffer;

import writebuffer.Category;
import writebuffer.WriteRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered, thread-safe queue of pending records for one category.
 *
 * <p>The buffer holds two segments, in persistence order:
 * <ol>
 *   <li>an optional <em>retry segment</em>: a batch whose commit failed and that was
 *       returned to the front by the flush path, together with its attempt count;</li>
 *   <li>the <em>fresh</em> records, appended by {@link #enqueue}.</li>
 * </ol>
 *
 * <p>All operations hold one short per-buffer lock and never perform I/O, so enqueues
 * are never blocked by a commit in flight. Snapshots returned by the take operations are
 * owned by the caller; the buffer keeps no reference to them.
 *
 * <p>The flush path (take / return operations) must be serialized per category by the
 * caller; enqueue and {@link #size()} may be called concurrently from any thread.
 */
public final class CategoryBuffer {
  private final Category category;
  private final int capacity;
  private final ReentrantLock lock = new ReentrantLock();

  private ArrayDeque<WriteRecord> records = new ArrayDeque<>();
  private RetrySegment retry;

  /**
   * @param category the category this buffer holds
   * @param capacity maximum number of records (retry segment included)
   */
  public CategoryBuffer(Category category, int capacity) {
    this.category = Objects.requireNonNull(category, "category");
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.capacity = capacity;
  }

  public Category category() {
    return category;
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Appends a record unless the buffer is at capacity.
   *
   * @param record the record to append; must belong to this buffer's category
   * @return {@code true} if appended, {@code false} if the buffer is full and the caller
   *     must flush before retrying
   * @throws IllegalArgumentException if the record belongs to another category
   */
  public boolean enqueue(WriteRecord record) {
    Objects.requireNonNull(record, "record");
    if (record.category() != category) {
      throw new IllegalArgumentException("Record of " + record.category()
          + " offered to the " + category + " buffer");
    }
    lock.lock();
    try {
      if (sizeLocked() >= capacity) {
        return false;
      }
      records.addLast(record);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Swaps out all fresh records and installs an empty deque. Does not touch the retry
   * segment.
   *
   * @return the previous fresh records in enqueue order (possibly empty)
   */
  public List<WriteRecord> takeAll() {
    ArrayDeque<WriteRecord> taken;
    lock.lock();
    try {
      if (records.isEmpty()) {
        return List.of();
      }
      taken = records;
      records = new ArrayDeque<>();
    } finally {
      lock.unlock();
    }
    return new ArrayList<>(taken);
  }

  /**
   * Removes the longest leading run of fresh records whose length is a multiple of
   * {@code batchSize}. Records beyond the last full batch stay buffered.
   *
   * @param batchSize the batch size (&gt; 0)
   * @return the removed records in enqueue order; empty if fewer than {@code batchSize}
   *     fresh records are buffered
   */
  public List<WriteRecord> takeFullBatches(int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    lock.lock();
    try {
      int n = (records.size() / batchSize) * batchSize;
      if (n == 0) {
        return List.of();
      }
      if (n == records.size()) {
        ArrayDeque<WriteRecord> taken = records;
        records = new ArrayDeque<>();
        return new ArrayList<>(taken);
      }
      List<WriteRecord> taken = new ArrayList<>(n);
      for (int i = 0; i < n; i++) {
        taken.add(records.pollFirst());
      }
      return taken;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns the retry segment, if any.
   *
   * @return the retry segment, or {@code null} when there is none
   */
  public RetrySegment takeRetry() {
    lock.lock();
    try {
      RetrySegment taken = retry;
      retry = null;
      return taken;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Puts a batch back in front of every fresh record so it is flushed again before
   * anything enqueued after it.
   *
   * <p>This may transiently push the length above {@link #capacity()} by up to the
   * size of the returned batch; further enqueues are refused until it is flushed.
   *
   * @param segment the batch to return
   * @throws IllegalStateException if a retry segment is already present
   */
  public void returnToFront(RetrySegment segment) {
    Objects.requireNonNull(segment, "segment");
    lock.lock();
    try {
      if (retry != null) {
        throw new IllegalStateException(category + " buffer already holds a retry segment");
      }
      retry = segment;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Current length including the retry segment. A best-effort snapshot under
   * concurrency.
   */
  public int size() {
    lock.lock();
    try {
      return sizeLocked();
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Whether a failed batch is waiting at the front of the buffer.
   */
  public boolean hasRetry() {
    lock.lock();
    try {
      return retry != null;
    } finally {
      lock.unlock();
    }
  }

  private int sizeLocked() {
    return records.size() + (retry == null ? 0 : retry.records().size());
  }

  /**
   * A failed batch waiting for another attempt.
   *
   * @param records      the batch, in enqueue order
   * @param attempts     failed attempts so far (&ge; 1)
   * @param notBeforeNanos {@link System#nanoTime()} value before which scheduled flushes
   *                     must not retry it
   */
  public record RetrySegment(List<WriteRecord> records, int attempts, long notBeforeNanos) {
    public RetrySegment {
      records = List.copyOf(records);
      if (records.isEmpty()) {
        throw new IllegalArgumentException("retry segment must not be empty");
      }
      if (attempts < 1) {
        throw new IllegalArgumentException("attempts must be >= 1");
      }
    }
  }
}
