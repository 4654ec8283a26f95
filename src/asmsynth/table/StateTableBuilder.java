package asmsynth.table;

import asmsynth.diag.NonDeterminismException;
import asmsynth.frontend.BoolExpr;
import asmsynth.frontend.Chart;
import asmsynth.frontend.ChartState;
import asmsynth.frontend.ChartTransition;
import asmsynth.frontend.Signal;
import asmsynth.logic.EquivalenceChecker;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the {@link StateTable} of a validated chart and checks that every state selects at most one transition per input.
 * <p>
 * Transitions of a state are ranked by priority (lower first), ties broken by declaration order. Overlapping guards with
 * equal priority are always rejected. Overlaps between different priorities are resolved by rank unless
 * {@code requireDisjointGuards} is set.
 */
public class StateTableBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Comparator<ChartTransition> byRank =
      Comparator.<ChartTransition>comparingInt(t -> t.priority).thenComparingInt(t -> t.declarationIndex);

  private final boolean requireDisjointGuards;
  private final EquivalenceChecker checker;

  public StateTableBuilder(boolean requireDisjointGuards, EquivalenceChecker checker) {
    this.requireDisjointGuards = requireDisjointGuards;
    this.checker = checker;
  }

  public StateTable build(Chart chart) throws NonDeterminismException {
    List<StateTable.Row> rows = new ArrayList<>();
    List<StateTable.PriorityOverlap> overlaps = new ArrayList<>();
    for (ChartState state : chart.getStates().values()) {
      List<ChartTransition> ranked = state.getTransitions().stream().sorted(byRank).toList();
      CheckDeterminism(state.id, ranked, overlaps);

      List<StateTable.Entry> entries = new ArrayList<>();
      List<BoolExpr> earlierGuards = new ArrayList<>();
      for (ChartTransition transition : ranked) {
        BoolExpr select = BoolExpr.and(transition.guard, BoolExpr.not(BoolExpr.or(earlierGuards)));
        entries.add(new StateTable.Entry(transition.id, transition.target, transition.priority, transition.guard, select));
        earlierGuards.add(transition.guard);
      }
      BoolExpr hold = BoolExpr.not(BoolExpr.or(earlierGuards));

      LinkedHashMap<String, List<BoolExpr>> outputs = new LinkedHashMap<>();
      for (Signal out : chart.getOutputs()) {
        List<BoolExpr> bits = new ArrayList<>(state.getOutput(out.name));
        if (out.width == 1) {
          List<BoolExpr> terms = new ArrayList<>();
          terms.add(bits.get(0));
          for (int i = 0; i < ranked.size(); ++i)
            if (ranked.get(i).conditionalOutputs.contains(out.name))
              terms.add(entries.get(i).selectCondition);
          bits.set(0, BoolExpr.or(terms));
        }
        outputs.put(out.name, bits);
      }
      rows.add(new StateTable.Row(state.id, entries, hold, outputs, List.of(state.id)));
    }
    for (StateTable.PriorityOverlap overlap : overlaps)
      logger.info("Table. State '{}': '{}' (priority {}) overrides '{}' (priority {}) where both guards hold", overlap.stateId(),
                  overlap.winner(), overlap.winnerPriority(), overlap.loser(), overlap.loserPriority());
    logger.debug("Table. Built {} rows", rows.size());
    return new StateTable(chart.getName(), chart.getInputs(), chart.getOutputs(), rows, chart.getInitialState(), overlaps,
                          chart.getWarnings());
  }

  private void CheckDeterminism(String stateId, List<ChartTransition> ranked, List<StateTable.PriorityOverlap> overlaps)
      throws NonDeterminismException {
    for (int i = 0; i < ranked.size(); ++i) {
      for (int j = i + 1; j < ranked.size(); ++j) {
        ChartTransition a = ranked.get(i), b = ranked.get(j);
        Optional<Map<BoolExpr.Literal, Boolean>> witness = checker.findOverlap(a.guard, b.guard);
        if (witness.isEmpty())
          continue;
        String example = EquivalenceChecker.describe(witness.get());
        if (a.priority == b.priority)
          throw new NonDeterminismException(stateId, a.id, b.id,
                                            "have equal priority " + a.priority + " and can both fire (e.g. " + example + ")");
        if (requireDisjointGuards)
          throw new NonDeterminismException(stateId, a.id, b.id, "can both fire (e.g. " + example + ") but disjoint guards are required");
        overlaps.add(new StateTable.PriorityOverlap(stateId, a.id, a.priority, b.id, b.priority));
      }
    }
  }
}
