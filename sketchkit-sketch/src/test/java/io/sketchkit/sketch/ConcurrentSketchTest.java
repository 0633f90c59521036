package io.sketchkit.sketch;

import io.sketchkit.sketch.hll.HyperLogLog;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;

public class ConcurrentSketchTest
{
  private static final int THREADS = 4;
  private static final int ITEMS_PER_THREAD = 25_000;

  @Test
  public void testConcurrentUpdates() throws Exception
  {
    final ConcurrentSketch shared = new ConcurrentSketch(12);
    final HyperLogLog expected = new HyperLogLog(12);
    for (int i = 0; i < THREADS * ITEMS_PER_THREAD; i++) {
      expected.update("item_" + i);
    }

    ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < THREADS; t++) {
        final int offset = t * ITEMS_PER_THREAD;
        futures.add(executor.submit(() -> {
          for (int i = 0; i < ITEMS_PER_THREAD; i++) {
            shared.update("item_" + (offset + i));
          }
        }));
      }
      for (Future<?> future : futures) {
        future.get();
      }
    }
    finally {
      executor.shutdown();
    }

    assertEquals(expected, shared.snapshot());
    assertEquals(expected.estimate(), shared.estimate(), 0.0d);
  }

  @Test
  public void testWorkersMergeIntoAggregator() throws Exception
  {
    final ConcurrentSketch aggregator = new ConcurrentSketch(12);
    final HyperLogLog expected = new HyperLogLog(12);
    for (int i = 0; i < THREADS * ITEMS_PER_THREAD; i++) {
      expected.update("item_" + i);
    }

    ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < THREADS; t++) {
        final int offset = t * ITEMS_PER_THREAD;
        futures.add(executor.submit(() -> {
          HyperLogLog local = new HyperLogLog(12);
          for (int i = 0; i < ITEMS_PER_THREAD; i++) {
            local.update("item_" + (offset + i));
            if (i % 5000 == 4999) {
              aggregator.merge(local);
            }
          }
        }));
      }
      for (Future<?> future : futures) {
        future.get();
      }
    }
    finally {
      executor.shutdown();
    }

    assertEquals(expected, aggregator.snapshot());
  }

  @Test
  public void testSnapshotIsACopy()
  {
    ConcurrentSketch sketch = new ConcurrentSketch(8);
    sketch.update("a");
    HyperLogLog snapshot = sketch.snapshot();
    HyperLogLog other = sketch.snapshot();
    assertNotSame(snapshot, other);
    snapshot.update("b");
    assertEquals(other, sketch.snapshot());
    assertEquals(1, sketch.cardinality());
  }

  @Test
  public void testMergeWrappers()
  {
    ConcurrentSketch left = new ConcurrentSketch(10);
    ConcurrentSketch right = new ConcurrentSketch(10);
    left.update(1L);
    right.update(2L);
    left.merge(right);
    left.merge(left);
    assertEquals(2, left.cardinality());
    assertEquals(HyperLogLog.deserialize(left.serialize()), left.snapshot());
  }

  @Test(expected = IncompatibleSketchException.class)
  public void testMergeMismatchedPrecision()
  {
    new ConcurrentSketch(10).merge(new HyperLogLog(11));
  }
}
