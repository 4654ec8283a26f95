package asmsynth.diag;

import java.util.List;

public class CodeGenException extends CompileException {
  private static final long serialVersionUID = 1L;

  public CodeGenException(String message, String... entityIds) {
    super(Stage.emit, DiagnosticKind.CodeGenError, message, List.of(entityIds));
  }
}
