package asmsynth.diag;

import java.util.List;

/**
 * Two transitions of one state can fire for the same input and priority does not decide between them.
 */
public class NonDeterminismException extends CompileException {
  private static final long serialVersionUID = 1L;

  public NonDeterminismException(String stateId, String transitionA, String transitionB, String reason) {
    super(Stage.table, DiagnosticKind.NonDeterminismError,
          "State '" + stateId + "': transitions '" + transitionA + "' and '" + transitionB + "' " + reason,
          List.of(stateId, transitionA, transitionB));
  }
}
