package asmsynth.diag;

import java.util.List;

/**
 * Partition refinement did not reach its fixpoint within the iteration fuse. Always an internal error.
 */
public class MinimizationTimeoutException extends CompileException {
  private static final long serialVersionUID = 1L;

  public MinimizationTimeoutException(int rounds, int stateCount) {
    super(Stage.minimize, DiagnosticKind.MinimizationTimeoutError,
          "Internal error: state partition still refining after " + rounds + " rounds for " + stateCount + " states", List.of());
  }
}
