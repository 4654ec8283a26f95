package asmsynth.drc;

import asmsynth.diag.ChartValidationException;
import asmsynth.diag.Diagnostic;
import asmsynth.diag.DiagnosticKind;
import asmsynth.diag.Stage;
import asmsynth.diag.ValidationIssue;
import asmsynth.frontend.BoolExpr;
import asmsynth.frontend.Chart;
import asmsynth.frontend.ChartDescription;
import asmsynth.frontend.ChartState;
import asmsynth.frontend.ChartTransition;
import asmsynth.frontend.GuardParseException;
import asmsynth.frontend.GuardParser;
import asmsynth.frontend.Signal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Design rule check for chart descriptions. Collects every violation before failing, then builds the immutable
 * {@link Chart} and drops states that cannot be reached from the reset state.
 */
public class ChartDRC {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Pattern identifier = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  /** Names of the state register signals, which equations refer to like inputs */
  private static final Set<String> registerSignals = Set.of("current_state", "next_state");
  /** Constants are kept in a long */
  public static final int maxSignalWidth = 63;

  private final ChartDescription description;
  private final boolean requireExplicitOutputs;

  private final List<ValidationIssue> issues = new ArrayList<>();
  private final LinkedHashMap<String, Signal> signals = new LinkedHashMap<>();
  private final LinkedHashSet<String> stateIds = new LinkedHashSet<>();
  private String initialState = null;
  /** Validated transitions per source state, in description order */
  private final LinkedHashMap<String, List<ChartTransition>> transitionsBySource = new LinkedHashMap<>();
  private final LinkedHashMap<String, Map<String, List<BoolExpr>>> outputsByState = new LinkedHashMap<>();

  /**
   * @param requireExplicitOutputs if set, every state must bind every output; otherwise unbound outputs take the
   *     signal's default value
   */
  public ChartDRC(ChartDescription description, boolean requireExplicitOutputs) {
    this.description = description;
    this.requireExplicitOutputs = requireExplicitOutputs;
  }

  public boolean HasFatalError() { return !issues.isEmpty(); }

  public List<ValidationIssue> GetIssues() { return List.copyOf(issues); }

  /**
   * Runs all checks and builds the chart.
   * @throws ChartValidationException listing every issue, if any check failed
   */
  public Chart Build() throws ChartValidationException {
    issues.clear();
    CheckSignals();
    CheckStates();
    CheckResetState();
    CheckTransitions();
    CheckOutputs();
    if (HasFatalError()) {
      issues.forEach(issue -> logger.error("DRC. {}", issue));
      throw new ChartValidationException(issues);
    }
    return PruneUnreachable();
  }

  private void addIssue(String message, String... entityIds) { issues.add(ValidationIssue.of(message, entityIds)); }

  /** Ids end up in VHDL comments, which a line break or similar would cut short */
  private static boolean hasControlCharacter(String id) { return id.chars().anyMatch(Character::isISOControl); }

  void CheckSignals() {
    signals.clear();
    for (ChartDescription.SignalDesc desc : description.signals) {
      if (desc.name == null || desc.name.isBlank()) {
        addIssue("Signal declaration without a name");
        continue;
      }
      boolean ok = true;
      if (!identifier.matcher(desc.name).matches()) {
        addIssue("Signal name '" + desc.name + "' is not an identifier", desc.name);
        ok = false;
      }
      if (registerSignals.contains(desc.name)) {
        addIssue("Signal name '" + desc.name + "' is reserved for the state register", desc.name);
        ok = false;
      }
      if (signals.containsKey(desc.name)) {
        addIssue("Duplicate signal '" + desc.name + "'", desc.name);
        continue;
      }
      Signal.Direction direction = Signal.Direction.parse(desc.direction);
      if (direction == null) {
        addIssue("Signal '" + desc.name + "' has unknown direction '" + desc.direction + "'", desc.name);
        ok = false;
      }
      if (desc.width < 1 || desc.width > maxSignalWidth) {
        addIssue("Signal '" + desc.name + "' has invalid width " + desc.width, desc.name);
        ok = false;
      }
      long defaultValue = desc.defaultValue == null ? 0 : desc.defaultValue;
      if (ok && direction == Signal.Direction.output && !fitsWidth(defaultValue, desc.width)) {
        addIssue("Default " + defaultValue + " of signal '" + desc.name + "' does not fit in " + desc.width + " bit(s)", desc.name);
        ok = false;
      }
      if (ok && direction == Signal.Direction.input && desc.defaultValue != null)
        logger.warn("DRC. Ignoring default value of input signal '{}'", desc.name);
      if (ok)
        signals.put(desc.name, new Signal(desc.name, direction, desc.width, defaultValue));
    }
  }

  void CheckStates() {
    stateIds.clear();
    for (ChartDescription.StateDesc desc : description.states) {
      if (desc.id == null || desc.id.isBlank())
        addIssue("State without an id");
      else if (!stateIds.add(desc.id))
        addIssue("Duplicate state id '" + desc.id + "'", desc.id);
      else if (hasControlCharacter(desc.id))
        addIssue("State id '" + desc.id + "' contains a control character", desc.id);
    }
  }

  void CheckResetState() {
    initialState = null;
    LinkedHashSet<String> flagged = new LinkedHashSet<>();
    for (ChartDescription.StateDesc desc : description.states)
      if (desc.initial && desc.id != null)
        flagged.add(desc.id);
    String named = description.initialState;
    if (named != null && !stateIds.contains(named)) {
      addIssue("Reset state '" + named + "' is not declared", named);
      return;
    }
    LinkedHashSet<String> candidates = new LinkedHashSet<>();
    if (named != null)
      candidates.add(named);
    candidates.addAll(flagged);
    if (candidates.isEmpty())
      addIssue("Missing reset state");
    else if (candidates.size() > 1)
      addIssue("Multiple reset states " + candidates, candidates.toArray(new String[0]));
    else
      initialState = candidates.iterator().next();
  }

  void CheckTransitions() {
    transitionsBySource.clear();
    HashSet<String> transitionIds = new HashSet<>();
    for (ChartDescription.TransitionDesc desc : description.transitions) {
      if (desc.id == null || desc.id.isBlank()) {
        addIssue("Transition without an id" + (desc.from != null ? " leaving state '" + desc.from + "'" : ""));
        continue;
      }
      boolean ok = true;
      if (!transitionIds.add(desc.id)) {
        addIssue("Duplicate transition id '" + desc.id + "'", desc.id);
        ok = false;
      } else if (hasControlCharacter(desc.id)) {
        addIssue("Transition id '" + desc.id + "' contains a control character", desc.id);
        ok = false;
      }
      if (desc.from == null || !stateIds.contains(desc.from)) {
        addIssue("Transition '" + desc.id + "' leaves undeclared state '" + desc.from + "'", desc.id);
        ok = false;
      }
      if (desc.to == null || !stateIds.contains(desc.to)) {
        addIssue("Transition '" + desc.id + "' targets undeclared state '" + desc.to + "'", desc.id);
        ok = false;
      }
      BoolExpr guard = ParseInputExpression(desc.guard, desc.id, "guard of transition '" + desc.id + "'");
      if (guard == null)
        ok = false;
      LinkedHashSet<String> conditionalOutputs = new LinkedHashSet<>();
      for (String out : desc.outputs) {
        Signal sig = signals.get(out);
        if (sig == null || !sig.isOutput()) {
          addIssue("Transition '" + desc.id + "' asserts undeclared output '" + out + "'", desc.id, out);
          ok = false;
        } else if (sig.width != 1) {
          addIssue("Transition '" + desc.id + "' asserts multi-bit output '" + out + "'", desc.id, out);
          ok = false;
        } else
          conditionalOutputs.add(out);
      }
      if (!ok)
        continue;
      List<ChartTransition> fromList = transitionsBySource.computeIfAbsent(desc.from, id_ -> new ArrayList<>());
      fromList.add(new ChartTransition(desc.id, desc.from, desc.to, guard, desc.priority, fromList.size(),
                                       new ArrayList<>(conditionalOutputs)));
    }
  }

  void CheckOutputs() {
    outputsByState.clear();
    List<Signal> outputs = signals.values().stream().filter(Signal::isOutput).toList();
    for (ChartDescription.StateDesc desc : description.states) {
      if (desc.id == null || outputsByState.containsKey(desc.id))
        continue;
      for (String bound : desc.outputs.keySet()) {
        Signal sig = signals.get(bound);
        if (sig == null)
          addIssue("State '" + desc.id + "' binds undeclared output '" + bound + "'", desc.id, bound);
        else if (!sig.isOutput())
          addIssue("State '" + desc.id + "' binds input signal '" + bound + "'", desc.id, bound);
      }
      LinkedHashMap<String, List<BoolExpr>> bindings = new LinkedHashMap<>();
      for (Signal out : outputs) {
        String text = desc.outputs.get(out.name);
        if (text == null) {
          if (requireExplicitOutputs)
            addIssue("Output '" + out.name + "' is unbound in state '" + desc.id + "'", desc.id, out.name);
          bindings.put(out.name, ConstantBits(out.defaultValue, out.width));
        } else if (out.width == 1) {
          BoolExpr expr = ParseInputExpression(text, desc.id, "output '" + out.name + "' of state '" + desc.id + "'");
          if (expr != null)
            bindings.put(out.name, List.of(expr));
        } else {
          Long value = ParseConstant(text);
          if (value == null)
            addIssue("Multi-bit output '" + out.name + "' in state '" + desc.id + "' needs an integer constant, found '" + text + "'",
                     desc.id, out.name);
          else if (!fitsWidth(value, out.width))
            addIssue("Value " + value + " of output '" + out.name + "' in state '" + desc.id + "' does not fit in " + out.width +
                         " bits",
                     desc.id, out.name);
          else
            bindings.put(out.name, ConstantBits(value, out.width));
        }
      }
      outputsByState.put(desc.id, bindings);
    }
  }

  /**
   * Parses an expression and resolves its literals against the declared inputs. Returns null after recording an issue.
   */
  BoolExpr ParseInputExpression(String text, String ownerId, String what) {
    BoolExpr parsed;
    try {
      parsed = GuardParser.parse(text);
    } catch (GuardParseException e) {
      addIssue("Syntax error in " + what + ": " + e.getMessage(), ownerId);
      return null;
    }
    int issuesBefore = issues.size();
    BoolExpr resolved = parsed.mapLiterals(literal -> {
      Signal sig = signals.get(literal.signal());
      if (sig == null) {
        addIssue("Undeclared signal '" + literal.signal() + "' in " + what, ownerId, literal.signal());
        return literal;
      }
      if (!sig.isInput()) {
        addIssue("Output signal '" + literal.signal() + "' used as input in " + what, ownerId, literal.signal());
        return literal;
      }
      if (literal.bit() < 0) {
        if (sig.width != 1) {
          addIssue("Vector input '" + sig.name + "' needs a bit index in " + what, ownerId, sig.name);
          return literal;
        }
        return sig.bit(0);
      }
      if (literal.bit() >= sig.width) {
        addIssue("Bit " + literal.bit() + " of '" + sig.name + "' is out of range in " + what, ownerId, sig.name);
        return literal;
      }
      return literal;
    });
    return issues.size() == issuesBefore ? resolved : null;
  }

  static Long ParseConstant(String text) {
    String trimmed = text.trim().toLowerCase();
    try {
      if (trimmed.startsWith("0b"))
        return Long.parseLong(trimmed.substring(2), 2);
      if (trimmed.startsWith("0x"))
        return Long.parseLong(trimmed.substring(2), 16);
      return Long.parseLong(trimmed);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  static List<BoolExpr> ConstantBits(long value, int width) {
    List<BoolExpr> bits = new ArrayList<>(width);
    for (int i = 0; i < width; ++i)
      bits.add(BoolExpr.constant(((value >> i) & 1) != 0));
    return bits;
  }

  private static boolean fitsWidth(long value, int width) { return value >= 0 && (value >> width) == 0; }

  /**
   * Breadth-first reachability from the reset state, following transitions in priority order.
   */
  Chart PruneUnreachable() {
    Comparator<ChartTransition> byPriority =
        Comparator.<ChartTransition>comparingInt(t -> t.priority).thenComparingInt(t -> t.declarationIndex);
    Set<String> reached = new HashSet<>();
    ArrayDeque<String> queue = new ArrayDeque<>();
    reached.add(initialState);
    queue.add(initialState);
    while (!queue.isEmpty()) {
      String state = queue.poll();
      transitionsBySource.getOrDefault(state, List.of())
          .stream()
          .sorted(byPriority)
          .map(t -> t.target)
          .filter(reached::add)
          .forEach(queue::add);
    }

    List<ChartState> states = new ArrayList<>();
    List<Diagnostic> warnings = new ArrayList<>();
    for (String id : stateIds) {
      if (!reached.contains(id)) {
        logger.warn("DRC. State '{}' is unreachable from reset state '{}' and will be dropped", id, initialState);
        warnings.add(new Diagnostic(Stage.validate, DiagnosticKind.UnreachableStateWarning,
                                    "State '" + id + "' is unreachable from reset state '" + initialState + "' and was dropped",
                                    List.of(id)));
        continue;
      }
      states.add(new ChartState(id, outputsByState.get(id), transitionsBySource.getOrDefault(id, List.of())));
    }
    String name = description.name == null ? "" : description.name;
    logger.debug("DRC. Chart '{}' validated: {} signals, {} reachable states", name, signals.size(), states.size());
    return new Chart(name, new ArrayList<>(signals.values()), states, initialState, warnings);
  }
}
