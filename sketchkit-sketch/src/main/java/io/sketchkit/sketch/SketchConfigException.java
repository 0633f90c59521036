package io.sketchkit.sketch;

/**
 * Thrown when a sketch is constructed with an invalid parameter. Parameters are never clamped.
 */
public class SketchConfigException extends IllegalArgumentException
{
  public SketchConfigException(String message)
  {
    super(message);
  }

  public SketchConfigException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
