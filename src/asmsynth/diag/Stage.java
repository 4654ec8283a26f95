package asmsynth.diag;

/**
 * Compilation stages, in pipeline order. The name is reported in diagnostics.
 */
public enum Stage {
  validate,
  table,
  minimize,
  encode,
  emit
}
