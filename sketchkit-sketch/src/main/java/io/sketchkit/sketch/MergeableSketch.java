package io.sketchkit.sketch;

import java.nio.charset.StandardCharsets;

/**
 * Lifecycle shared by every sketch type: streaming update, point-in-time estimate,
 * merge with a compatible sketch and binary serialization.
 *
 * <p>Each algorithm family supplies its own implementation. Deserialization lives in a
 * static factory on the concrete type since the payload decides which instance is built.
 *
 * <p>Implementations are not thread-safe, see {@link ConcurrentSketch}.
 */
public interface MergeableSketch<T extends MergeableSketch<T>>
{
  void update(byte[] item);

  void update(long item);

  default void update(String item)
  {
    update(item.getBytes(StandardCharsets.UTF_8));
  }

  double estimate();

  default long cardinality()
  {
    return Math.round(estimate());
  }

  /**
   * Folds {@code that} into this sketch. {@code that} is never modified.
   *
   * @throws IncompatibleSketchException if the two sketches were built with different parameters,
   * in which case this sketch is left untouched
   */
  void merge(T that);

  byte[] serialize();

  boolean isEmpty();

  T copy();

  long memoryFootprint();

  String name();
}
