package asmsynth.frontend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Raw, unvalidated chart description as handed over by an editor or read by {@link ChartReader}.
 * Nothing here is checked; {@code asmsynth.drc.ChartDRC} turns it into a {@link Chart} or reports every problem.
 */
public class ChartDescription {

  public static class SignalDesc {
    public String name;
    /** "input"/"in" or "output"/"out" */
    public String direction;
    public int width = 1;
    /** Output value in states that do not bind the signal; null means 0 */
    public Long defaultValue;
  }

  public static class StateDesc {
    public String id;
    /** Alternative to {@link ChartDescription#initialState} */
    public boolean initial = false;
    /**
     * Output bindings, in declaration order. The value is an expression over inputs for 1-bit outputs, or an integer
     * constant (decimal, 0b.. or 0x..) for any width.
     */
    public LinkedHashMap<String, String> outputs = new LinkedHashMap<>();
  }

  public static class TransitionDesc {
    public String id;
    public String from;
    public String to;
    /** Null or blank for an unconditional transition */
    public String guard;
    /** Lower value wins */
    public int priority = 0;
    /** 1-bit outputs asserted while this transition is the selected one */
    public List<String> outputs = new ArrayList<>();
  }

  /** Entity name for the generated code; may be empty */
  public String name = "";
  public List<SignalDesc> signals = new ArrayList<>();
  public List<StateDesc> states = new ArrayList<>();
  public List<TransitionDesc> transitions = new ArrayList<>();
  public String initialState;

  public ChartDescription() {}

  public ChartDescription(String name) { this.name = name; }

  //// Fluent construction, mostly for programmatic clients.

  public ChartDescription signal(String name, String direction, int width, Long defaultValue) {
    SignalDesc sig = new SignalDesc();
    sig.name = name;
    sig.direction = direction;
    sig.width = width;
    sig.defaultValue = defaultValue;
    signals.add(sig);
    return this;
  }

  public ChartDescription input(String name) { return signal(name, "input", 1, null); }
  public ChartDescription input(String name, int width) { return signal(name, "input", width, null); }
  public ChartDescription output(String name) { return signal(name, "output", 1, null); }
  public ChartDescription output(String name, int width) { return signal(name, "output", width, null); }

  /**
   * Adds a state.
   * @param bindings entries of the form {@code "signal=expression"}
   */
  public ChartDescription state(String id, String... bindings) {
    StateDesc state = new StateDesc();
    state.id = id;
    for (String binding : bindings) {
      int eq = binding.indexOf('=');
      if (eq < 0)
        throw new IllegalArgumentException("Binding must look like 'signal=expression': " + binding);
      state.outputs.put(binding.substring(0, eq).trim(), binding.substring(eq + 1).trim());
    }
    states.add(state);
    return this;
  }

  public ChartDescription transition(String id, String from, String to, String guard, int priority, String... outputs) {
    TransitionDesc transition = new TransitionDesc();
    transition.id = id;
    transition.from = from;
    transition.to = to;
    transition.guard = guard;
    transition.priority = priority;
    transition.outputs = new ArrayList<>(List.of(outputs));
    transitions.add(transition);
    return this;
  }

  public ChartDescription initial(String stateId) {
    this.initialState = stateId;
    return this;
  }
}
