package asmsynth.logic;

import asmsynth.frontend.BoolExpr;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Satisfiability and equivalence queries on {@link BoolExpr}. Expressions over at most {@code exhaustiveLimit} distinct
 * literals are decided by enumerating the truth table, larger ones with a {@link Bdd}.
 */
public class EquivalenceChecker {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final int exhaustiveLimit;

  public EquivalenceChecker(int exhaustiveLimit) {
    if (exhaustiveLimit < 0 || exhaustiveLimit > 30)
      throw new IllegalArgumentException("Exhaustive variable limit must be in [0,30], is " + exhaustiveLimit);
    this.exhaustiveLimit = exhaustiveLimit;
  }

  public int getExhaustiveLimit() { return exhaustiveLimit; }

  /** An assignment under which both expressions are true, if there is one. */
  public Optional<Map<BoolExpr.Literal, Boolean>> findOverlap(BoolExpr a, BoolExpr b) { return findSatisfying(BoolExpr.and(a, b)); }

  /**
   * An assignment under which {@code a} and {@code b} differ and {@code dontCare} is false, if there is one.
   */
  public Optional<Map<BoolExpr.Literal, Boolean>> findDifference(BoolExpr a, BoolExpr b, BoolExpr dontCare) {
    BoolExpr differs = BoolExpr.or(BoolExpr.and(a, BoolExpr.not(b)), BoolExpr.and(BoolExpr.not(a), b));
    return findSatisfying(BoolExpr.and(differs, BoolExpr.not(dontCare)));
  }

  public boolean isEquivalent(BoolExpr a, BoolExpr b) { return findDifference(a, b, BoolExpr.FALSE).isEmpty(); }

  public Optional<Map<BoolExpr.Literal, Boolean>> findSatisfying(BoolExpr expr) {
    List<BoolExpr.Literal> vars = new ArrayList<>(expr.literals());
    if (vars.size() <= exhaustiveLimit)
      return enumerate(expr, vars);
    logger.trace("EquivalenceChecker. {} variables, using BDD", vars.size());
    Bdd bdd = new Bdd();
    return bdd.anySat(bdd.build(expr));
  }

  private static Optional<Map<BoolExpr.Literal, Boolean>> enumerate(BoolExpr expr, List<BoolExpr.Literal> vars) {
    HashMap<BoolExpr.Literal, Integer> index = new HashMap<>();
    for (int i = 0; i < vars.size(); ++i)
      index.put(vars.get(i), i);
    long count = 1L << vars.size();
    for (long m = 0; m < count; ++m) {
      long m_ = m;
      if (expr.evaluate(lit -> ((m_ >> index.get(lit)) & 1) != 0)) {
        LinkedHashMap<BoolExpr.Literal, Boolean> ret = new LinkedHashMap<>();
        for (int i = 0; i < vars.size(); ++i)
          ret.put(vars.get(i), ((m >> i) & 1) != 0);
        return Optional.of(ret);
      }
    }
    return Optional.empty();
  }

  /** Renders a witness assignment like {@code T1=1, car=0}. */
  public static String describe(Map<BoolExpr.Literal, Boolean> assignment) {
    if (assignment.isEmpty())
      return "any input";
    StringBuilder ret = new StringBuilder();
    assignment.forEach((lit, value) -> {
      if (ret.length() > 0)
        ret.append(", ");
      ret.append(lit).append('=').append(value ? '1' : '0');
    });
    return ret.toString();
  }
}
