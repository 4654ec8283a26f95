package asmsynth.frontend;

import java.util.List;
import java.util.Objects;

/**
 * Validated transition. Owned by the state named {@link #source}.
 */
public final class ChartTransition {
  public final String id;
  public final String source;
  public final String target;
  /** Guard over input bits */
  public final BoolExpr guard;
  /** Lower value wins */
  public final int priority;
  /** Position among the source state's transitions in the description; breaks priority ties */
  public final int declarationIndex;
  /** 1-bit outputs asserted while this transition is selected */
  public final List<String> conditionalOutputs;

  public ChartTransition(String id, String source, String target, BoolExpr guard, int priority, int declarationIndex,
                         List<String> conditionalOutputs) {
    this.id = Objects.requireNonNull(id);
    this.source = Objects.requireNonNull(source);
    this.target = Objects.requireNonNull(target);
    this.guard = Objects.requireNonNull(guard);
    this.priority = priority;
    this.declarationIndex = declarationIndex;
    this.conditionalOutputs = List.copyOf(conditionalOutputs);
  }

  @Override
  public String toString() {
    return id + ": " + source + " --[" + guard + " @" + priority + "]--> " + target;
  }
}
