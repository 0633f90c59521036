package io.sketchkit.sketch.hll;

import io.sketchkit.sketch.IncompatibleSketchException;
import io.sketchkit.sketch.SketchFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Binary format of a {@link HyperLogLog}:
 *
 * <pre>
 * [version: 1 byte][precision: 1 byte][packed registers: 2^precision * 6 / 8 bytes]
 * </pre>
 *
 * <p>The register section is the {@link RegisterStore} buffer as is. Payloads may come from
 * the network or disk, so everything read is validated before use and every failure is
 * reported as a {@link SketchFormatException}. Readers reject versions they don't know.
 *
 * <p>Also reads and writes the dense layout of Redis {@code PFADD} strings:
 *
 * <pre>
 * ["HYLL"][encoding: 1 byte][unused: 3 bytes][cached cardinality: 8 bytes][16384 6-bit registers]
 * </pre>
 *
 * <p>Redis always uses 2^14 registers packed the same way {@link RegisterStore} packs them, so
 * only precision 14 converts. Only the dense encoding is supported. The written cardinality
 * cache is flagged stale so Redis recomputes it.
 */
public final class HyperLogLogCodec
{
  private static final Logger LOG = LoggerFactory.getLogger(HyperLogLogCodec.class);

  public static final byte VERSION = 1;

  static final int HEADER_SIZE = Byte.BYTES // version
      + Byte.BYTES; // precision

  public static final int REDIS_PRECISION = 14;

  static final byte[] REDIS_MAGIC = {'H', 'Y', 'L', 'L'};
  static final byte REDIS_DENSE = 0;
  static final byte REDIS_SPARSE = 1;
  static final int REDIS_HEADER_SIZE = 16;
  // most significant bit of the last cardinality byte marks the cache as stale
  private static final int REDIS_STALE_CACHE_OFFSET = REDIS_HEADER_SIZE - 1;
  private static final byte REDIS_STALE_CACHE_FLAG = (byte) 0x80;

  private HyperLogLogCodec()
  {
  }

  public static int serializedSize(int precision)
  {
    return HEADER_SIZE + RegisterStore.packedSize(precision);
  }

  public static byte[] serialize(RegisterStore registers)
  {
    final int precision = registers.precision();
    final ByteBuffer buffer = ByteBuffer.allocate(serializedSize(precision));
    buffer.put(VERSION);
    buffer.put((byte) precision);
    buffer.put(registers.toByteArray());
    return buffer.array();
  }

  public static RegisterStore deserialize(byte[] bytes)
  {
    if (bytes == null) {
      throw reject("null payload");
    }
    if (bytes.length < HEADER_SIZE) {
      throw reject(String.format("payload too short: %d bytes", bytes.length));
    }

    final ByteBuffer buffer = ByteBuffer.wrap(bytes);
    final byte version = buffer.get();
    if (version != VERSION) {
      throw reject(String.format("unknown format version %d", version & 0xff));
    }

    final int precision = buffer.get() & 0xff;
    if (precision < HyperLogLog.MIN_PRECISION || precision > HyperLogLog.MAX_PRECISION) {
      throw reject(String.format(
          "precision %d out of range [%d, %d]",
          precision,
          HyperLogLog.MIN_PRECISION,
          HyperLogLog.MAX_PRECISION
      ));
    }

    final int expected = serializedSize(precision);
    if (bytes.length != expected) {
      throw reject(String.format(
          "expected %d bytes for precision %d, got %d",
          expected,
          precision,
          bytes.length
      ));
    }

    final byte[] packed = new byte[buffer.remaining()];
    buffer.get(packed);
    return RegisterStore.fromPackedBytes(precision, packed);
  }

  private static SketchFormatException reject(String reason)
  {
    LOG.debug("Rejecting serialized sketch: {}", reason);
    return new SketchFormatException("invalid serialized HyperLogLog: " + reason);
  }

  public static int redisSerializedSize()
  {
    return REDIS_HEADER_SIZE + RegisterStore.packedSize(REDIS_PRECISION);
  }

  /**
   * @throws IncompatibleSketchException if {@code registers} is not at precision 14
   */
  public static byte[] toRedisBytes(RegisterStore registers)
  {
    if (registers.precision() != REDIS_PRECISION) {
      throw new IncompatibleSketchException(String.format(
          "Redis HyperLogLog requires precision %d, got %d",
          REDIS_PRECISION,
          registers.precision()
      ));
    }
    final ByteBuffer buffer = ByteBuffer.allocate(redisSerializedSize());
    buffer.put(REDIS_MAGIC);
    buffer.put(REDIS_DENSE);
    buffer.position(REDIS_HEADER_SIZE);
    buffer.put(registers.toByteArray());

    final byte[] bytes = buffer.array();
    bytes[REDIS_STALE_CACHE_OFFSET] = REDIS_STALE_CACHE_FLAG;
    return bytes;
  }

  public static RegisterStore fromRedisBytes(byte[] bytes)
  {
    if (bytes == null) {
      throw reject("null Redis payload");
    }
    if (bytes.length < REDIS_HEADER_SIZE) {
      throw reject(String.format("Redis payload too short: %d bytes", bytes.length));
    }
    for (int i = 0; i < REDIS_MAGIC.length; i++) {
      if (bytes[i] != REDIS_MAGIC[i]) {
        throw reject("missing HYLL magic");
      }
    }

    final byte encoding = bytes[REDIS_MAGIC.length];
    if (encoding == REDIS_SPARSE) {
      throw reject("sparse Redis encoding is not supported");
    }
    if (encoding != REDIS_DENSE) {
      throw reject(String.format("unknown Redis encoding %d", encoding & 0xff));
    }

    if (bytes.length != redisSerializedSize()) {
      throw reject(String.format(
          "expected %d bytes for a dense Redis HyperLogLog, got %d",
          redisSerializedSize(),
          bytes.length
      ));
    }
    return RegisterStore.fromPackedBytes(
        REDIS_PRECISION,
        Arrays.copyOfRange(bytes, REDIS_HEADER_SIZE, bytes.length)
    );
  }
}
