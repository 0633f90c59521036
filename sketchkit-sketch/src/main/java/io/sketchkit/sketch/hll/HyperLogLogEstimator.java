package io.sketchkit.sketch.hll;

import java.util.PrimitiveIterator;

/**
 * Bias-corrected harmonic-mean estimator from
 * http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf, using the paper's constants.
 *
 * <p>Range corrections:
 * <ul>
 *   <li>small range ({@code E <= 2.5m} with empty registers): linear counting
 *   <li>mid range: the raw estimate
 *   <li>large range: the paper's 2^32 correction compensates for collisions in a 32-bit hash
 *   space. Our registers are fed from 64-bit hashes, so {@link #estimate(RegisterStore)} never
 *   applies it.
 * </ul>
 */
public final class HyperLogLogEstimator
{
  private static final double TWO_TO_THE_THIRTY_TWO = Math.pow(2, 32);
  private static final double HIGH_CORRECTION_THRESHOLD = TWO_TO_THE_THIRTY_TWO / 30.0d;

  // INVERSE_POWERS[r] = 2^-r
  private static final double[] INVERSE_POWERS = new double[RegisterStore.MAX_REGISTER_VALUE + 1];

  static {
    for (int r = 0; r < INVERSE_POWERS.length; r++) {
      INVERSE_POWERS[r] = Math.scalb(1.0d, -r);
    }
  }

  private HyperLogLogEstimator()
  {
  }

  public static double estimate(RegisterStore registers)
  {
    final int m = registers.size();

    double registerSum = 0.0;
    int zeros = 0;
    PrimitiveIterator.OfInt it = registers.iterator();
    while (it.hasNext()) {
      final int r = it.nextInt();
      registerSum += INVERSE_POWERS[r];
      if (r == 0) {
        zeros++;
      }
    }

    if (zeros == m) {
      return 0.0d;
    }

    final double e = alpha(m) * m * m / registerSum;
    if (e <= 2.5d * m && zeros > 0) {
      return linearCounting(m, zeros);
    }
    return e;
  }

  static double alpha(int m)
  {
    switch (m) {
      case 16:
        return 0.673d;
      case 32:
        return 0.697d;
      case 64:
        return 0.709d;
      default:
        return 0.7213d / (1 + 1.079d / m);
    }
  }

  static double linearCounting(int m, int zeros)
  {
    return m * Math.log(m / (double) zeros);
  }

  /**
   * Corrects a raw estimate for saturation of a 32-bit hash space. Estimates at or below
   * 2^32 / 30 are returned unchanged, estimates at or past 2^32 mean the hash space is
   * saturated and yield positive infinity.
   */
  static double largeRangeCorrection(double e)
  {
    if (e <= HIGH_CORRECTION_THRESHOLD) {
      return e;
    }
    if (e >= TWO_TO_THE_THIRTY_TWO) {
      return Double.POSITIVE_INFINITY;
    }
    return -TWO_TO_THE_THIRTY_TWO * Math.log(1 - e / TWO_TO_THE_THIRTY_TWO);
  }

  public static double standardError(int precision)
  {
    return 1.04d / Math.sqrt(1 << precision);
  }
}
