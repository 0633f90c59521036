package io.sketchkit.sketch;

/**
 * Thrown when merging two sketches whose configurations differ.
 */
public class IncompatibleSketchException extends IllegalArgumentException
{
  public IncompatibleSketchException(String message)
  {
    super(message);
  }
}
