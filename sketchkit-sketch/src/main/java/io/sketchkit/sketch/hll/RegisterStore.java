package io.sketchkit.sketch.hll;

import com.google.common.base.Preconditions;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Fixed array of {@code m = 2^p} registers, each packed into 6 bits of a byte buffer.
 *
 * <p>Register {@code i} occupies bits {@code [6i, 6i + 6)} of the buffer, counting from the
 * least-significant bit of byte 0, so a register may straddle two bytes. The buffer layout
 * is also the on-wire layout used by {@link HyperLogLogCodec}.
 *
 * <p>Registers only ever grow: {@link #observe(int, int)} keeps the maximum value seen.
 */
public final class RegisterStore
{
  public static final int BITS_PER_REGISTER = 6;
  public static final int MAX_REGISTER_VALUE = (1 << BITS_PER_REGISTER) - 1;

  private static final int REGISTER_MASK = MAX_REGISTER_VALUE;

  private final int p;
  private final int m;
  private final byte[] packed;

  public RegisterStore(int precision)
  {
    this(precision, new byte[packedSize(precision)]);
  }

  private RegisterStore(int precision, byte[] packed)
  {
    this.p = precision;
    this.m = 1 << precision;
    this.packed = packed;
  }

  /**
   * Builds a store over a copy of an already packed buffer.
   */
  public static RegisterStore fromPackedBytes(int precision, byte[] bytes)
  {
    Preconditions.checkArgument(
        bytes.length == packedSize(precision),
        "expected %s packed bytes for precision %s, got %s",
        packedSize(precision),
        precision,
        bytes.length
    );
    return new RegisterStore(precision, bytes.clone());
  }

  public static int packedSize(int precision)
  {
    final long bits = (long) BITS_PER_REGISTER << precision;
    return (int) ((bits + Byte.SIZE - 1) / Byte.SIZE);
  }

  public int precision()
  {
    return p;
  }

  public int size()
  {
    return m;
  }

  public int get(int index)
  {
    Preconditions.checkElementIndex(index, m);
    return read(index);
  }

  /**
   * Raises register {@code index} to {@code value} if it is currently lower.
   *
   * @return true if the register changed
   */
  public boolean observe(int index, int value)
  {
    Preconditions.checkElementIndex(index, m);
    Preconditions.checkArgument(
        value >= 0 && value <= MAX_REGISTER_VALUE,
        "register value [%s] out of range [0, %s]",
        value,
        MAX_REGISTER_VALUE
    );
    if (read(index) >= value) {
      return false;
    }
    write(index, value);
    return true;
  }

  /**
   * Element-wise maximum with {@code that}. Both stores must have the same size, see
   * {@link RegisterMerger} for the checked entry point.
   */
  void mergeFrom(RegisterStore that)
  {
    for (int i = 0; i < m; i++) {
      final int value = that.read(i);
      if (read(i) < value) {
        write(i, value);
      }
    }
  }

  public boolean isEmpty()
  {
    for (byte b : packed) {
      if (b != 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return a fresh read-only pass over all register values, in index order
   */
  public PrimitiveIterator.OfInt iterator()
  {
    return new PrimitiveIterator.OfInt()
    {
      private int next = 0;

      @Override
      public boolean hasNext()
      {
        return next < m;
      }

      @Override
      public int nextInt()
      {
        if (next >= m) {
          throw new NoSuchElementException();
        }
        return read(next++);
      }
    };
  }

  /**
   * Sets every register back to zero.
   */
  public void clear()
  {
    Arrays.fill(packed, (byte) 0);
  }

  public byte[] toByteArray()
  {
    return packed.clone();
  }

  public RegisterStore copy()
  {
    return new RegisterStore(p, packed.clone());
  }

  public long memoryFootprint()
  {
    return packed.length; // not counting object headers
  }

  private int read(int index)
  {
    final int bit = index * BITS_PER_REGISTER;
    final int pos = bit >>> 3;
    final int shift = bit & 7;

    int value = (packed[pos] & 0xff) >>> shift;
    if (shift > Byte.SIZE - BITS_PER_REGISTER) {
      value |= (packed[pos + 1] & 0xff) << (Byte.SIZE - shift);
    }
    return value & REGISTER_MASK;
  }

  private void write(int index, int value)
  {
    final int bit = index * BITS_PER_REGISTER;
    final int pos = bit >>> 3;
    final int shift = bit & 7;

    packed[pos] = (byte) ((packed[pos] & ~(REGISTER_MASK << shift)) | (value << shift));
    if (shift > Byte.SIZE - BITS_PER_REGISTER) {
      // high bits spill into the next byte
      final int spill = Byte.SIZE - shift;
      packed[pos + 1] = (byte) ((packed[pos + 1] & ~(REGISTER_MASK >>> spill)) | (value >>> spill));
    }
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RegisterStore)) {
      return false;
    }
    RegisterStore that = (RegisterStore) o;
    return p == that.p && Arrays.equals(packed, that.packed);
  }

  @Override
  public int hashCode()
  {
    return 31 * p + Arrays.hashCode(packed);
  }
}
