package asmsynth.diag;

import java.util.List;

/** No state code of the requested kind fits the state register. */
public class EncodingException extends CompileException {
  private static final long serialVersionUID = 1L;

  public EncodingException(String message, List<String> stateIds) {
    super(Stage.encode, DiagnosticKind.EncodingError, message, stateIds);
  }
}
