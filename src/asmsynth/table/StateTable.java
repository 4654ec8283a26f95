package asmsynth.table;

import asmsynth.diag.Diagnostic;
import asmsynth.frontend.BoolExpr;
import asmsynth.frontend.Signal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Symbolic state table: for every state its prioritized transitions with selection conditions, the hold condition and
 * the effective output function per output bit. Immutable.
 */
public final class StateTable {

  /** One prioritized transition of a row */
  public static final class Entry {
    public final String transitionId;
    public final String target;
    public final int priority;
    public final BoolExpr guard;
    /** Guard and no higher-ranked guard of the same state; at most one entry per row is selected for any input */
    public final BoolExpr selectCondition;

    public Entry(String transitionId, String target, int priority, BoolExpr guard, BoolExpr selectCondition) {
      this.transitionId = Objects.requireNonNull(transitionId);
      this.target = Objects.requireNonNull(target);
      this.priority = priority;
      this.guard = Objects.requireNonNull(guard);
      this.selectCondition = Objects.requireNonNull(selectCondition);
    }

    /** Copy with another target, used when states are merged */
    public Entry withTarget(String newTarget) { return new Entry(transitionId, newTarget, priority, guard, selectCondition); }

    @Override
    public String toString() {
      return transitionId + "(@" + priority + ": " + selectCondition + " -> " + target + ")";
    }
  }

  public static final class Row {
    public final String stateId;
    /** Ordered by priority, then declaration order */
    public final List<Entry> entries;
    /** No guard is true: the state is kept */
    public final BoolExpr holdCondition;
    /** Output name to one function per bit, LSB first, with conditional outputs folded in */
    public final Map<String, List<BoolExpr>> outputs;
    /** Original states this row stands for, the row's own id first */
    public final List<String> members;

    public Row(String stateId, List<Entry> entries, BoolExpr holdCondition, Map<String, List<BoolExpr>> outputs, List<String> members) {
      this.stateId = Objects.requireNonNull(stateId);
      this.entries = List.copyOf(entries);
      this.holdCondition = Objects.requireNonNull(holdCondition);
      LinkedHashMap<String, List<BoolExpr>> outputsCopy = new LinkedHashMap<>();
      outputs.forEach((name, bits) -> outputsCopy.put(name, List.copyOf(bits)));
      this.outputs = Collections.unmodifiableMap(outputsCopy);
      this.members = List.copyOf(members);
    }

    /**
     * Condition under which this row moves to {@code target}, hold included.
     */
    public BoolExpr conditionFor(String target) {
      List<BoolExpr> terms = new ArrayList<>();
      for (Entry entry : entries)
        if (entry.target.equals(target))
          terms.add(entry.selectCondition);
      if (stateId.equals(target))
        terms.add(holdCondition);
      return BoolExpr.or(terms);
    }
  }

  /**
   * Two overlapping guards of a state resolved by priority. Documented in the generated code.
   */
  public record PriorityOverlap(String stateId, String winner, int winnerPriority, String loser, int loserPriority) {}

  private final String name;
  private final List<Signal> inputs;
  private final List<Signal> outputs;
  private final Map<String, Row> rows;
  private final String initialState;
  private final List<PriorityOverlap> overlaps;
  private final List<Diagnostic> warnings;

  public StateTable(String name, List<Signal> inputs, List<Signal> outputs, List<Row> rows, String initialState,
                    List<PriorityOverlap> overlaps, List<Diagnostic> warnings) {
    this.name = name;
    this.inputs = List.copyOf(inputs);
    this.outputs = List.copyOf(outputs);
    LinkedHashMap<String, Row> rowsMap = new LinkedHashMap<>();
    rows.forEach(row -> rowsMap.put(row.stateId, row));
    this.rows = Collections.unmodifiableMap(rowsMap);
    this.initialState = initialState;
    this.overlaps = List.copyOf(overlaps);
    this.warnings = List.copyOf(warnings);
    if (!this.rows.containsKey(initialState))
      throw new IllegalArgumentException("Initial state " + initialState + " has no row");
  }

  public String getName() { return name; }

  public List<Signal> getInputs() { return inputs; }

  public List<Signal> getOutputs() { return outputs; }

  /** Rows in chart order */
  public Map<String, Row> getRows() { return rows; }

  public Row getRow(String stateId) { return rows.get(stateId); }

  public String getInitialState() { return initialState; }

  public List<PriorityOverlap> getOverlaps() { return overlaps; }

  public List<Diagnostic> getWarnings() { return warnings; }

  public int size() { return rows.size(); }

  /** Every input bit, in declaration order and LSB first within a signal */
  public List<BoolExpr.Literal> getInputBits() {
    List<BoolExpr.Literal> ret = new ArrayList<>();
    for (Signal sig : inputs)
      for (int bit = 0; bit < sig.width; ++bit)
        ret.add(new BoolExpr.Literal(sig.name, bit));
    return ret;
  }

  /** Row that the original state {@code stateId} was merged into, or null if it is not part of the table */
  public Row rowFor(String stateId) {
    for (Row row : rows.values())
      if (row.members.contains(stateId))
        return row;
    return null;
  }
}
