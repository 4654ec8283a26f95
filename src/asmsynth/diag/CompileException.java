package asmsynth.diag;

import java.util.List;

/**
 * Base class of all fatal compilation failures. Each stage throws exactly one of these and the orchestrator turns it
 * into a {@link Diagnostic}.
 */
public abstract class CompileException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Stage stage;
  private final DiagnosticKind kind;
  private final List<String> entityIds;

  protected CompileException(Stage stage, DiagnosticKind kind, String message, List<String> entityIds) {
    super(message);
    this.stage = stage;
    this.kind = kind;
    this.entityIds = List.copyOf(entityIds);
  }

  public Stage getStage() { return stage; }

  public DiagnosticKind getKind() { return kind; }

  public List<String> getEntityIds() { return entityIds; }

  public Diagnostic toDiagnostic() { return new Diagnostic(stage, kind, getMessage(), entityIds); }
}
