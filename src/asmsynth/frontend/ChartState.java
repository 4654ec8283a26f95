package asmsynth.frontend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validated state. The output map is total over the chart's output signals.
 */
public final class ChartState {
  public final String id;
  /** Output name to one expression per bit, LSB first */
  private final Map<String, List<BoolExpr>> outputs;
  /** Outgoing transitions in declaration order */
  private final List<ChartTransition> transitions;

  public ChartState(String id, Map<String, List<BoolExpr>> outputs, List<ChartTransition> transitions) {
    this.id = Objects.requireNonNull(id);
    LinkedHashMap<String, List<BoolExpr>> outputsCopy = new LinkedHashMap<>();
    outputs.forEach((name, bits) -> outputsCopy.put(name, List.copyOf(bits)));
    this.outputs = Collections.unmodifiableMap(outputsCopy);
    this.transitions = List.copyOf(transitions);
  }

  public Map<String, List<BoolExpr>> getOutputs() { return outputs; }

  public List<BoolExpr> getOutput(String signal) { return outputs.get(signal); }

  public List<ChartTransition> getTransitions() { return transitions; }

  @Override
  public String toString() {
    return id;
  }
}
