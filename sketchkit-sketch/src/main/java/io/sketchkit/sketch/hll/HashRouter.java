package io.sketchkit.sketch.hll;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.ByteBuffer;

/**
 * Maps an item to a register index and a rarity value.
 *
 * <p>Items are hashed with murmur3_128 (seed 0) truncated to its first 64 bits. The hash
 * is part of the serialized format: sketches built with another hash can't be merged with
 * ours, so this must never change.
 *
 * <ul>
 *   <li>index: the top {@code p} bits of the hash
 *   <li>rarity: 1 + number of trailing zeros of the remaining {@code 64 - p} bits, or
 *   {@code 64 - p + 1} when those bits are all zero, saturated at
 *   {@link RegisterStore#MAX_REGISTER_VALUE}
 * </ul>
 */
public final class HashRouter
{
  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

  private final int p;
  // bit just above the rarity field, so an all-zero field yields 64 - p + 1
  private final long sentinel;

  public HashRouter(int precision)
  {
    Preconditions.checkArgument(
        precision >= HyperLogLog.MIN_PRECISION && precision <= HyperLogLog.MAX_PRECISION,
        "invalid precision [%s]",
        precision
    );
    this.p = precision;
    this.sentinel = 1L << (Long.SIZE - p);
  }

  public static long hash(byte[] item)
  {
    return HASH_FUNCTION.hashBytes(item).asLong();
  }

  /**
   * Hashes the remaining bytes of {@code item}, same value as {@link #hash(byte[])} over those
   * bytes. The buffer's position is moved to its limit.
   */
  public static long hash(ByteBuffer item)
  {
    return HASH_FUNCTION.hashBytes(item).asLong();
  }

  public static long hashLong(long item)
  {
    return HASH_FUNCTION.hashLong(item).asLong();
  }

  public int index(long hash)
  {
    return (int) (hash >>> (Long.SIZE - p));
  }

  public int rarity(long hash)
  {
    final long remaining = (hash & (sentinel - 1)) | sentinel;
    return Math.min(Long.numberOfTrailingZeros(remaining) + 1, RegisterStore.MAX_REGISTER_VALUE);
  }
}
