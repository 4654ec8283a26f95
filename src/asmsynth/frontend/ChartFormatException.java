package asmsynth.frontend;

/**
 * Chart file that does not have the shape of a chart description (as opposed to a well-formed description of an invalid
 * chart, which is reported by validation).
 */
public class ChartFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  public ChartFormatException(String message) { super(message); }

  public ChartFormatException(String message, Throwable cause) { super(message, cause); }
}
