package asmsynth.diag;

import java.util.List;

/**
 * Structured compilation diagnostic handed back to the caller instead of source text.
 * @param stage the stage that produced the diagnostic
 * @param kind the diagnostic category
 * @param message human readable description; validation diagnostics list every issue, one per line
 * @param entityIds ids of the offending states, transitions or signals
 */
public record Diagnostic(Stage stage, DiagnosticKind kind, String message, List<String> entityIds) {

  public Diagnostic {
    entityIds = List.copyOf(entityIds);
  }

  public boolean isFatal() { return kind.isFatal(); }

  @Override
  public String toString() {
    String ids = entityIds.isEmpty() ? "" : " " + entityIds;
    return "[" + stage + "] " + kind + ids + ": " + message;
  }
}
