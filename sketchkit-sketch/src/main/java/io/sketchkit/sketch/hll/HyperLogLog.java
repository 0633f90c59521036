package io.sketchkit.sketch.hll;

import com.google.common.base.Preconditions;
import io.sketchkit.sketch.MergeableSketch;
import io.sketchkit.sketch.SketchConfigException;

import java.nio.ByteBuffer;
import java.util.PrimitiveIterator;

/**
 * Implements HyperLogLog described in http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf.
 *
 * <p>Uses 64-bit hashes and {@code m = 2^p} registers of 6 bits each, with {@code p} in
 * [{@value #MIN_PRECISION}, {@value #MAX_PRECISION}]. The relative standard error is about
 * {@code 1.04 / sqrt(m)}:
 * <pre>
 * p = 4   =&gt; m = 16,      error 26%
 * p = 10  =&gt; m = 1024,    error 3.25%
 * p = 14  =&gt; m = 16384,   error 0.81%
 * p = 18  =&gt; m = 262144,  error 0.2%
 * </pre>
 *
 * <p>Differences from paper
 * <ul>
 *   <li>the rarity is taken from the trailing zeros of the low {@code 64 - p} bits instead of the
 *   leading zeros
 *   <li>no large range correction, it only matters for 32-bit hashes
 * </ul>
 *
 * <p>Not thread-safe: use one sketch per worker and merge, or wrap it in a
 * {@link io.sketchkit.sketch.ConcurrentSketch}.
 */
public final class HyperLogLog implements MergeableSketch<HyperLogLog>
{
  public static final int MIN_PRECISION = 4;
  public static final int MAX_PRECISION = 18;
  public static final int DEFAULT_PRECISION = 14;

  private final HashRouter router;
  private final RegisterStore registers;

  public HyperLogLog(int precision)
  {
    if (precision < MIN_PRECISION || precision > MAX_PRECISION) {
      throw new SketchConfigException(String.format(
          "invalid precision [%d] : should be in [%d, %d]",
          precision,
          MIN_PRECISION,
          MAX_PRECISION
      ));
    }
    this.router = new HashRouter(precision);
    this.registers = new RegisterStore(precision);
  }

  private HyperLogLog(RegisterStore registers)
  {
    this.router = new HashRouter(registers.precision());
    this.registers = registers;
  }

  /**
   * Restores a sketch written by {@link #serialize()}.
   *
   * @throws io.sketchkit.sketch.SketchFormatException if the payload is malformed
   */
  public static HyperLogLog deserialize(byte[] bytes)
  {
    return new HyperLogLog(HyperLogLogCodec.deserialize(bytes));
  }

  @Override
  public void update(byte[] item)
  {
    Preconditions.checkNotNull(item, "item");
    updateHash(HashRouter.hash(item));
  }

  /**
   * Adds the remaining bytes of {@code item}. Counts as the same item as the equivalent
   * {@code byte[]}; the buffer's position is moved to its limit.
   */
  public void update(ByteBuffer item)
  {
    Preconditions.checkNotNull(item, "item");
    updateHash(HashRouter.hash(item));
  }

  public void updateBatch(byte[]... items)
  {
    for (byte[] item : items) {
      update(item);
    }
  }

  public void updateBatch(String... items)
  {
    for (String item : items) {
      update(item);
    }
  }

  @Override
  public void update(long item)
  {
    updateHash(HashRouter.hashLong(item));
  }

  /**
   * Feeds a pre-computed 64-bit hash. Only hashes from {@link HashRouter#hash(byte[])} or
   * {@link HashRouter#hashLong(long)} keep the sketch mergeable with others.
   */
  public void updateHash(long hash)
  {
    registers.observe(router.index(hash), router.rarity(hash));
  }

  @Override
  public double estimate()
  {
    return HyperLogLogEstimator.estimate(registers);
  }

  @Override
  public void merge(HyperLogLog that)
  {
    RegisterMerger.merge(registers, that.registers);
  }

  @Override
  public byte[] serialize()
  {
    return HyperLogLogCodec.serialize(registers);
  }

  /**
   * Restores a sketch from a dense Redis HyperLogLog string (precision 14).
   *
   * <p>Redis hashes items differently, so the restored registers can be estimated and
   * re-exported but should not be merged with sketches fed through {@link #update(byte[])}.
   *
   * @throws io.sketchkit.sketch.SketchFormatException if the payload is not a dense Redis HyperLogLog
   */
  public static HyperLogLog fromRedisBytes(byte[] bytes)
  {
    return new HyperLogLog(HyperLogLogCodec.fromRedisBytes(bytes));
  }

  /**
   * @throws io.sketchkit.sketch.IncompatibleSketchException unless the precision is 14
   */
  public byte[] toRedisBytes()
  {
    return HyperLogLogCodec.toRedisBytes(registers);
  }

  /**
   * Clears every register, leaving an empty sketch of the same precision.
   */
  public void reset()
  {
    registers.clear();
  }

  @Override
  public boolean isEmpty()
  {
    return registers.isEmpty();
  }

  @Override
  public HyperLogLog copy()
  {
    return new HyperLogLog(registers.copy());
  }

  public int precision()
  {
    return registers.precision();
  }

  public int numRegisters()
  {
    return registers.size();
  }

  public double standardError()
  {
    return HyperLogLogEstimator.standardError(precision());
  }

  public int register(int index)
  {
    return registers.get(index);
  }

  public PrimitiveIterator.OfInt registers()
  {
    return registers.iterator();
  }

  @Override
  public long memoryFootprint()
  {
    return registers.memoryFootprint();
  }

  @Override
  public String name()
  {
    return "hll" + precision();
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HyperLogLog)) {
      return false;
    }
    return registers.equals(((HyperLogLog) o).registers);
  }

  @Override
  public int hashCode()
  {
    return registers.hashCode();
  }

  @Override
  public String toString()
  {
    return name() + "{estimate=" + estimate() + "}";
  }
}
