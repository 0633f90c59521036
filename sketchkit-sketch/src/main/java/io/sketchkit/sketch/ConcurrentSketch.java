package io.sketchkit.sketch;

import io.sketchkit.sketch.hll.HyperLogLog;

// A concurrency wrapper for HyperLogLog. Methods are "synchronized" for multi-thread access.
// The usual pattern is one plain sketch per worker, merged periodically into a shared ConcurrentSketch.
//
// When calling merge(), caller must ensure that "that" is also protected from concurrent modification.
public class ConcurrentSketch
{
  private final HyperLogLog sketch;

  public ConcurrentSketch(int precision)
  {
    this(new HyperLogLog(precision));
  }

  public ConcurrentSketch(final HyperLogLog sketch)
  {
    this.sketch = sketch;
  }

  public synchronized void update(byte[] item)
  {
    sketch.update(item);
  }

  public synchronized void update(long item)
  {
    sketch.update(item);
  }

  public synchronized void update(String item)
  {
    sketch.update(item);
  }

  public synchronized double estimate()
  {
    return sketch.estimate();
  }

  public long cardinality()
  {
    return Math.round(estimate());
  }

  // Caller must ensure that "that" is also protected from concurrent modification.
  public synchronized void merge(final HyperLogLog that)
  {
    sketch.merge(that);
  }

  public void merge(final ConcurrentSketch that)
  {
    if (that == this) {
      return;
    }
    // never hold both locks
    merge(that.snapshot());
  }

  public synchronized byte[] serialize()
  {
    return sketch.serialize();
  }

  public synchronized HyperLogLog snapshot()
  {
    return sketch.copy();
  }
}
