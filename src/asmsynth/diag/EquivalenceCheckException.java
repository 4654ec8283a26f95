package asmsynth.diag;

import java.util.List;

/**
 * A simplified equation differs from the equation it was derived from. Always an internal error.
 */
public class EquivalenceCheckException extends CompileException {
  private static final long serialVersionUID = 1L;

  public EquivalenceCheckException(String equation, String detail) {
    super(Stage.minimize, DiagnosticKind.EquivalenceCheckFailure,
          "Internal error: simplified equation for '" + equation + "' is not equivalent to its source: " + detail, List.of(equation));
  }
}
