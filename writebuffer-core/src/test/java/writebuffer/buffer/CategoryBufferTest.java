package writebuffer.buffer;

import org.junit.jupiter.api.Test;
import writebuffer.Category;
import writebuffer.WriteRecord;
import writebuffer.buffer.CategoryBuffer.RetrySegment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CategoryBufferTest {

  private static WriteRecord message(int i) {
    return WriteRecord.of(Category.MESSAGE, "orders", "m-" + i, "payload", "producer", 1.0);
  }

  @Test
  void takeAllReturnsRecordsInEnqueueOrder() {
    CategoryBuffer buffer = new CategoryBuffer(Category.MESSAGE, 10);
    for (int i = 0; i < 3; i++) {
      assertTrue(buffer.enqueue(message(i)));
    }

    List<WriteRecord> taken = buffer.takeAll();

    assertEquals(List.of("m-0", "m-1", "m-2"), messageIds(taken));
    assertEquals(0, buffer.size());
    assertTrue(buffer.isEmpty());
  }

  @Test
  void takeAllOnEmptyBufferReturnsEmptyList() {
    CategoryBuffer buffer = new CategoryBuffer(Category.MESSAGE, 10);
    assertTrue(buffer.takeAll().isEmpty());
  }

  @Test
  void enqueueRefusesWhenAtCapacity() {
    CategoryBuffer buffer = new CategoryBuffer(Category.MESSAGE, 2);
    assertTrue(buffer.enqueue(message(0)));
    assertTrue(buffer.enqueue(message(1)));

    assertFalse(buffer.enqueue(message(2)));
    assertEquals(2, buffer.size());
  }

  @Test
  void enqueueRejectsRecordOfAnotherCategory() {
    CategoryBuffer buffer = new CategoryBuffer(Category.MESSAGE, 10);
    WriteRecord subscription = WriteRecord.of(Category.SUBSCRIPTION, "sid", "c", "t", 1.0);

    assertThrows(IllegalArgumentException.class, () -> buffer.enqueue(subscription));
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new CategoryBuffer(Category.MESSAGE, 0));
  }

  @Test
  void takeFullBatchesLeavesRemainderBuffered() {
    CategoryBuffer buffer = new CategoryBuffer(Category.MESSAGE, 100);
    for (int i = 0; i < 25; i++) {
      buffer.enqueue(message(i));
    }

    List<WriteRecord> taken = buffer.takeFullBatches(10);

    assertEquals(20, taken.size());
    assertEquals("m-0", messageIds(taken).get(0));
    assertEquals("m-19", messageIds(taken).get(19));
    assertEquals(5, buffer.size());
    assertEquals("m-20", messageIds(buffer.takeAll()).get(0));
  }

  @Test
  void takeFullBatchesReturnsEmptyBelowBatchSize() {
    CategoryBuffer buffer = new CategoryBuffer(Category.MESSAGE, 100);
    for (int i = 0; i < 9; i++) {
      buffer.enqueue(message(i));
    }

    assertTrue(buffer.takeFullBatches(10).isEmpty());
    assertEquals(9, buffer.size());
  }

  @Test
  void retrySegmentCountsTowardSizeAndCapacity() {
    CategoryBuffer buffer = new CategoryBuffer(Category.MESSAGE, 5);
    for (int i = 0; i < 5; i++) {
      buffer.enqueue(message(i));
    }
    List<WriteRecord> batch = buffer.takeAll();
    assertTrue(buffer.enqueue(message(5)));

    buffer.returnToFront(new RetrySegment(batch, 1, System.nanoTime()));

    assertEquals(6, buffer.size());
    assertTrue(buffer.hasRetry());
    assertFalse(buffer.enqueue(message(6)));
  }

  @Test
  void takeAllLeavesRetrySegmentInPlace() {
    CategoryBuffer buffer = new CategoryBuffer(Category.MESSAGE, 10);
    buffer.returnToFront(new RetrySegment(List.of(message(0)), 1, 0L));
    buffer.enqueue(message(1));

    assertEquals(List.of("m-1"), messageIds(buffer.takeAll()));
    RetrySegment retry = buffer.takeRetry();
    assertNotNull(retry);
    assertEquals(List.of("m-0"), messageIds(retry.records()));
    assertNull(buffer.takeRetry());
  }

  @Test
  void returnToFrontTwiceThrows() {
    CategoryBuffer buffer = new CategoryBuffer(Category.MESSAGE, 10);
    buffer.returnToFront(new RetrySegment(List.of(message(0)), 1, 0L));

    assertThrows(IllegalStateException.class,
        () -> buffer.returnToFront(new RetrySegment(List.of(message(1)), 1, 0L)));
  }

  @Test
  void retrySegmentValidatesArguments() {
    assertThrows(IllegalArgumentException.class, () -> new RetrySegment(List.of(), 1, 0L));
    assertThrows(IllegalArgumentException.class,
        () -> new RetrySegment(List.of(message(0)), 0, 0L));
  }

  @Test
  void concurrentEnqueuesKeepEveryRecordAndPerThreadOrder() throws Exception {
    int threads = 8;
    int perThread = 1000;
    CategoryBuffer buffer = new CategoryBuffer(Category.MESSAGE, threads * perThread);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    for (int t = 0; t < threads; t++) {
      int thread = t;
      pool.execute(() -> {
        try {
          start.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
        for (int i = 0; i < perThread; i++) {
          buffer.enqueue(WriteRecord.of(Category.MESSAGE, "t" + thread, String.valueOf(i), null,
              null, 1.0));
        }
      });
    }
    start.countDown();
    pool.shutdown();
    assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

    List<WriteRecord> all = buffer.takeAll();
    assertEquals(threads * perThread, all.size());
    Map<Object, Integer> lastSeen = new ConcurrentHashMap<>();
    for (WriteRecord record : all) {
      int seq = Integer.parseInt((String) record.values().get(1));
      Integer previous = lastSeen.put(record.values().get(0), seq);
      assertEquals(previous == null ? 0 : previous + 1, seq);
    }
  }

  private static List<String> messageIds(List<WriteRecord> records) {
    List<String> ids = new ArrayList<>();
    for (WriteRecord record : records) {
      ids.add((String) record.values().get(1));
    }
    return ids;
  }
}
