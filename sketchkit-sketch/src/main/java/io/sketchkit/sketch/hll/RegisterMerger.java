package io.sketchkit.sketch.hll;

import io.sketchkit.sketch.IncompatibleSketchException;

/**
 * Merges register stores by element-wise maximum.
 *
 * <p>Since observing a value is itself a max, merging is equivalent to replaying the union of
 * both streams through one sketch. The operation is associative, commutative and idempotent.
 */
public final class RegisterMerger
{
  private RegisterMerger()
  {
  }

  /**
   * Merges {@code source} into {@code target} in place. {@code source} is never modified.
   *
   * @throws IncompatibleSketchException if the precisions differ, in which case {@code target}
   * is left untouched
   */
  public static void merge(RegisterStore target, RegisterStore source)
  {
    if (target.precision() != source.precision()) {
      throw new IncompatibleSketchException(String.format(
          "precision mismatch: %d vs %d",
          target.precision(),
          source.precision()
      ));
    }
    if (target == source) {
      return;
    }
    target.mergeFrom(source);
  }
}
