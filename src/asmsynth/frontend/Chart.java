package asmsynth.frontend;

import asmsynth.diag.Diagnostic;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, immutable chart. Only states reachable from the initial state are kept; the dropped ones are listed in
 * {@link #getWarnings()}.
 */
public final class Chart {
  private final String name;
  private final List<Signal> signals;
  private final Map<String, ChartState> states;
  private final String initialState;
  private final List<Diagnostic> warnings;

  public Chart(String name, List<Signal> signals, List<ChartState> states, String initialState, List<Diagnostic> warnings) {
    this.name = name;
    this.signals = List.copyOf(signals);
    LinkedHashMap<String, ChartState> statesMap = new LinkedHashMap<>();
    states.forEach(state -> statesMap.put(state.id, state));
    this.states = Collections.unmodifiableMap(statesMap);
    this.initialState = initialState;
    this.warnings = List.copyOf(warnings);
    if (!this.states.containsKey(initialState))
      throw new IllegalArgumentException("Initial state " + initialState + " is not part of the chart");
  }

  public String getName() { return name; }

  public List<Signal> getSignals() { return signals; }

  public List<Signal> getInputs() { return signals.stream().filter(Signal::isInput).toList(); }

  public List<Signal> getOutputs() { return signals.stream().filter(Signal::isOutput).toList(); }

  /** Reachable states in description order */
  public Map<String, ChartState> getStates() { return states; }

  public ChartState getState(String id) { return states.get(id); }

  public String getInitialState() { return initialState; }

  public List<Diagnostic> getWarnings() { return warnings; }
}
