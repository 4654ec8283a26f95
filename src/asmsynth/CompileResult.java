package asmsynth;

import asmsynth.diag.Diagnostic;
import asmsynth.encode.StateEncoding;
import asmsynth.minimize.SynthesizedLogic;
import asmsynth.table.StateTable;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one compilation: generated source and the intermediate results it was built from, or the diagnostic that
 * stopped the pipeline. Warnings are kept either way.
 */
public final class CompileResult {
  private final String entityName;
  private final String source;
  private final StateTable table;
  private final SynthesizedLogic logic;
  private final Diagnostic diagnostic;
  private final List<Diagnostic> warnings;

  private CompileResult(String entityName, String source, StateTable table, SynthesizedLogic logic, Diagnostic diagnostic,
                        List<Diagnostic> warnings) {
    this.entityName = entityName;
    this.source = source;
    this.table = table;
    this.logic = logic;
    this.diagnostic = diagnostic;
    this.warnings = List.copyOf(warnings);
  }

  static CompileResult success(String entityName, String source, StateTable table, SynthesizedLogic logic, List<Diagnostic> warnings) {
    return new CompileResult(entityName, source, table, logic, null, warnings);
  }

  static CompileResult failure(Diagnostic diagnostic, List<Diagnostic> warnings) {
    return new CompileResult(null, null, null, null, diagnostic, warnings);
  }

  public boolean isSuccess() { return diagnostic == null; }

  /** Generated VHDL; empty on failure */
  public Optional<String> getSource() { return Optional.ofNullable(source); }

  public Optional<Diagnostic> getDiagnostic() { return Optional.ofNullable(diagnostic); }

  /** Non-fatal diagnostics, such as dropped unreachable states */
  public List<Diagnostic> getWarnings() { return warnings; }

  public String getEntityName() { return requireSuccess(entityName); }

  /** Reduced state table the code was generated from */
  public StateTable getTable() { return requireSuccess(table); }

  public SynthesizedLogic getLogic() { return requireSuccess(logic); }

  public StateEncoding getEncoding() { return requireSuccess(logic).getEncoding(); }

  public int getStateCount() { return requireSuccess(table).size(); }

  public int getEncodingWidth() { return getEncoding().getWidth(); }

  private <T> T requireSuccess(T value) {
    if (!isSuccess())
      throw new IllegalStateException("Compilation failed: " + diagnostic);
    return value;
  }

  @Override
  public String toString() {
    return isSuccess() ? "CompileResult{" + entityName + ", " + table.size() + " states, " + logic.getEncoding() + "}"
                       : "CompileResult{" + diagnostic + "}";
  }
}
