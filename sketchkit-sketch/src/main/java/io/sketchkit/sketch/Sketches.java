package io.sketchkit.sketch;

import com.google.common.base.CharMatcher;
import com.google.common.base.Supplier;
import io.sketchkit.sketch.hll.HyperLogLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds sketches from names such as {@code hll} or {@code hll12}, so tooling can treat
 * every sketch type uniformly.
 *
 * <p>A bare {@code hll} uses the default precision, taken from the
 * {@value #PRECISION_PROPERTY} system property when set, otherwise
 * {@link HyperLogLog#DEFAULT_PRECISION}.
 */
public final class Sketches
{
  private static final Logger LOG = LoggerFactory.getLogger(Sketches.class);

  public static final String PRECISION_PROPERTY = "sketchkit.hll.precision";

  private static final String HLL_PREFIX = "hll";

  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  private Sketches()
  {
  }

  public static MergeableSketch<?> get(String name)
  {
    if (name.startsWith(HLL_PREFIX)) {
      String pStr = name.substring(HLL_PREFIX.length());
      int precision = pStr.isEmpty() ? defaultPrecision() : parsePrecision(name, pStr);
      return new HyperLogLog(precision);
    }
    throw new SketchConfigException("Unknown sketch : " + name);
  }

  public static Supplier<MergeableSketch<?>> lazyGet(String name)
  {
    // fail fast on bad names instead of on first use
    get(name);
    return () -> get(name);
  }

  public static int defaultPrecision()
  {
    String value = System.getProperty(PRECISION_PROPERTY);
    if (value == null) {
      return HyperLogLog.DEFAULT_PRECISION;
    }
    int precision;
    try {
      precision = Integer.parseInt(value.trim());
    }
    catch (NumberFormatException e) {
      LOG.warn("Ignoring non-numeric {}={}", PRECISION_PROPERTY, value);
      return HyperLogLog.DEFAULT_PRECISION;
    }
    if (precision < HyperLogLog.MIN_PRECISION || precision > HyperLogLog.MAX_PRECISION) {
      LOG.warn("Ignoring out of range {}={}", PRECISION_PROPERTY, value);
      return HyperLogLog.DEFAULT_PRECISION;
    }
    return precision;
  }

  private static int parsePrecision(String name, String pStr)
  {
    // plain decimal without sign or leading zero, so that get(name).name() gives back the same name
    if (!DIGITS.matchesAllOf(pStr) || pStr.length() > 2 || pStr.charAt(0) == '0') {
      throw new SketchConfigException("Invalid precision in sketch name : " + name);
    }
    return Integer.parseInt(pStr);
  }
}
