package asmsynth.diag;

public enum DiagnosticKind {
  ValidationError(true),
  NonDeterminismError(true),
  UnreachableStateWarning(false),
  MinimizationTimeoutError(true),
  EquivalenceCheckFailure(true),
  EncodingError(true),
  CodeGenError(true);

  private final boolean fatal;

  private DiagnosticKind(boolean fatal) { this.fatal = fatal; }

  public boolean isFatal() { return fatal; }
}
