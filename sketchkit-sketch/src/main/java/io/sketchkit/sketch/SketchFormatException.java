package io.sketchkit.sketch;

/**
 * Thrown when a serialized sketch is malformed, truncated or written in an unknown format version.
 */
public class SketchFormatException extends IllegalArgumentException
{
  public SketchFormatException(String message)
  {
    super(message);
  }
}
