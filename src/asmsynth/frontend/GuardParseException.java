package asmsynth.frontend;

/**
 * Syntax error in a guard or output expression.
 */
public class GuardParseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int position;

  public GuardParseException(String message, String text, int position) {
    super(message + " at position " + position + " in '" + text + "'");
    this.position = position;
  }

  public int getPosition() { return position; }
}
