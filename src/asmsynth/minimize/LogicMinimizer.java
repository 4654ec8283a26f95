package asmsynth.minimize;

import asmsynth.diag.EquivalenceCheckException;
import asmsynth.encode.StateEncoding;
import asmsynth.frontend.BoolExpr;
import asmsynth.frontend.Signal;
import asmsynth.logic.Bdd;
import asmsynth.logic.EquivalenceChecker;
import asmsynth.table.StateTable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Derives the next-state and output equations of an encoded state table and reduces each one to a small sum of products.
 * <p>
 * Functions over at most {@link EquivalenceChecker#getExhaustiveLimit()} variables are minimized with Quine-McCluskey:
 * all prime implicants, then the essential ones, then a greedy cover. Larger functions, and functions that are
 * don't-care on more than half of their points (as one-hot codes are), are read off a BDD as disjoint cubes, which are
 * expanded against the off-set and made irredundant. Unused state codes are don't-cares.
 * Every result is checked against its source function before it is returned.
 */
public class LogicMinimizer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final EquivalenceChecker checker;

  public LogicMinimizer(EquivalenceChecker checker) { this.checker = checker; }

  public SynthesizedLogic minimize(StateTable table, StateEncoding encoding) throws EquivalenceCheckException {
    int width = encoding.getWidth();
    List<BoolExpr.Literal> order = new ArrayList<>();
    for (int bit = width - 1; bit >= 0; --bit)
      order.add(SynthesizedLogic.stateBit(bit));
    order.addAll(table.getInputBits());

    LinkedHashMap<String, BoolExpr> inState = new LinkedHashMap<>();
    for (String state : table.getRows().keySet())
      inState.put(state, codeTerm(encoding.codeOf(state), width));
    BoolExpr dontCare = BoolExpr.not(BoolExpr.or(new ArrayList<>(inState.values())));

    List<BoolExpr> nextState = new ArrayList<>();
    for (int bit = 0; bit < width; ++bit) {
      List<BoolExpr> terms = new ArrayList<>();
      for (StateTable.Row row : table.getRows().values()) {
        LinkedHashSet<String> targets = new LinkedHashSet<>();
        row.entries.forEach(entry -> targets.add(entry.target));
        targets.add(row.stateId);
        List<BoolExpr> conditions = new ArrayList<>();
        for (String target : targets)
          if (((encoding.codeOf(target) >> bit) & 1) != 0)
            conditions.add(row.conditionFor(target));
        terms.add(BoolExpr.and(inState.get(row.stateId), BoolExpr.or(conditions)));
      }
      nextState.add(simplify("next_state(" + bit + ")", BoolExpr.or(terms), dontCare, order));
    }

    LinkedHashMap<String, List<BoolExpr>> outputs = new LinkedHashMap<>();
    for (Signal out : table.getOutputs()) {
      List<BoolExpr> bits = new ArrayList<>();
      for (int bit = 0; bit < out.width; ++bit) {
        List<BoolExpr> terms = new ArrayList<>();
        for (StateTable.Row row : table.getRows().values())
          terms.add(BoolExpr.and(inState.get(row.stateId), row.outputs.get(out.name).get(bit)));
        String equation = out.width == 1 ? out.name : out.name + "(" + bit + ")";
        bits.add(simplify(equation, BoolExpr.or(terms), dontCare, order));
      }
      outputs.put(out.name, bits);
    }
    return new SynthesizedLogic(encoding, nextState, outputs);
  }

  /** Conjunction of state bit literals that holds exactly when the register contains {@code code} */
  static BoolExpr codeTerm(long code, int width) {
    List<BoolExpr> lits = new ArrayList<>();
    for (int bit = width - 1; bit >= 0; --bit) {
      BoolExpr lit = SynthesizedLogic.stateBit(bit);
      lits.add(((code >> bit) & 1) != 0 ? lit : BoolExpr.not(lit));
    }
    return BoolExpr.and(lits);
  }

  /**
   * Minimal sum of products equal to {@code function} wherever {@code dontCare} is false.
   * @param order variable order of the result; literals missing from it are appended in order of appearance
   */
  public BoolExpr simplify(String equation, BoolExpr function, BoolExpr dontCare, List<BoolExpr.Literal> order)
      throws EquivalenceCheckException {
    if (function instanceof BoolExpr.Const || dontCare.isConst(true))
      return function instanceof BoolExpr.Const ? function : BoolExpr.FALSE;

    LinkedHashSet<BoolExpr.Literal> support = function.literals();
    support.addAll(dontCare.literals());
    List<BoolExpr.Literal> vars = new ArrayList<>();
    for (BoolExpr.Literal lit : order)
      if (support.contains(lit))
        vars.add(lit);
    for (BoolExpr.Literal lit : support)
      if (!vars.contains(lit))
        vars.add(lit);

    List<int[]> cover;
    if (vars.size() <= checker.getExhaustiveLimit()) {
      cover = quineMcCluskey(equation, function, dontCare, vars);
    } else {
      logger.debug("Minimizer. '{}' has {} variables, simplifying by cube expansion", equation, vars.size());
      cover = expandCubes(function, dontCare, vars);
    }
    cover.sort(Implicant::compareKeys);
    BoolExpr ret = toExpression(cover, vars);

    Optional<Map<BoolExpr.Literal, Boolean>> difference = checker.findDifference(ret, function, dontCare);
    if (difference.isPresent())
      throw new EquivalenceCheckException(equation, "differs at " + EquivalenceChecker.describe(difference.get()));
    logger.trace("Minimizer. {} <= {}", equation, ret);
    return ret;
  }

  //// Quine-McCluskey

  private List<int[]> quineMcCluskey(String equation, BoolExpr function, BoolExpr dontCare, List<BoolExpr.Literal> vars) {
    int n = vars.size();
    HashMap<BoolExpr.Literal, Integer> position = new HashMap<>();
    for (int k = 0; k < n; ++k)
      position.put(vars.get(k), n - 1 - k);

    List<Long> on = new ArrayList<>();
    List<Long> dc = new ArrayList<>();
    for (long m = 0; m < (1L << n); ++m) {
      long m_ = m;
      if (dontCare.evaluate(lit -> ((m_ >> position.get(lit)) & 1) != 0))
        dc.add(m);
      else if (function.evaluate(lit -> ((m_ >> position.get(lit)) & 1) != 0))
        on.add(m);
    }
    // Don't-care minterms merge among themselves into a number of implicants exponential in their count
    if (dc.size() > (1L << n) - dc.size()) {
      logger.debug("Minimizer. '{}' has {} don't-care points of {}, simplifying by cube expansion", equation, dc.size(), 1L << n);
      return expandCubes(function, dontCare, vars);
    }
    List<Implicant> primes = primeImplicants(on, dc, n);
    List<int[]> ret = new ArrayList<>();
    for (Implicant imp : selectCover(primes, on))
      ret.add(imp.key());
    return ret;
  }

  static List<Implicant> primeImplicants(List<Long> on, List<Long> dc, int n) {
    LinkedHashSet<Implicant> current = new LinkedHashSet<>();
    on.forEach(m -> current.add(Implicant.minterm(m, n)));
    dc.forEach(m -> current.add(Implicant.minterm(m, n)));
    List<Implicant> primes = new ArrayList<>();
    LinkedHashSet<Implicant> level = current;
    while (!level.isEmpty()) {
      LinkedHashSet<Implicant> next = new LinkedHashSet<>();
      HashSet<Implicant> merged = new HashSet<>();
      for (Implicant imp : level) {
        for (int pos = 0; pos < n; ++pos) {
          long bit = 1L << pos;
          if ((imp.mask & bit) == 0 || (imp.value & bit) != 0)
            continue;
          Implicant partner = new Implicant(imp.value | bit, imp.mask, n);
          if (!level.contains(partner))
            continue;
          next.add(imp.combine(partner));
          merged.add(imp);
          merged.add(partner);
        }
      }
      for (Implicant imp : level)
        if (!merged.contains(imp))
          primes.add(imp);
      level = next;
    }
    primes.sort((a, b) -> Implicant.compareKeys(a.key(), b.key()));
    return primes;
  }

  /**
   * Essential primes, then repeatedly the prime covering most uncovered minterms (fewer literals, then term order on
   * ties), then removal of chosen terms that became redundant.
   */
  static List<Implicant> selectCover(List<Implicant> primes, List<Long> on) {
    LinkedHashSet<Implicant> chosen = new LinkedHashSet<>();
    for (long m : on) {
      Implicant only = null;
      int count = 0;
      for (Implicant prime : primes) {
        if (prime.covers(m)) {
          only = prime;
          ++count;
        }
      }
      if (count == 1)
        chosen.add(only);
    }
    HashSet<Implicant> essential = new HashSet<>(chosen);
    TreeSet<Long> uncovered = new TreeSet<>(on);
    chosen.forEach(imp -> uncovered.removeIf(imp::covers));

    while (!uncovered.isEmpty()) {
      Implicant best = null;
      int bestCount = 0;
      for (Implicant prime : primes) {
        if (chosen.contains(prime))
          continue;
        int count = 0;
        for (long m : uncovered)
          if (prime.covers(m))
            ++count;
        if (count > bestCount || (count == bestCount && count > 0 && prime.literalCount() < best.literalCount())) {
          best = prime;
          bestCount = count;
        }
      }
      if (best == null)
        throw new IllegalStateException("Prime implicants do not cover minterms " + uncovered);
      chosen.add(best);
      Implicant best_ = best;
      uncovered.removeIf(best_::covers);
    }

    List<Implicant> ret = new ArrayList<>(chosen);
    for (int i = ret.size() - 1; i >= 0; --i) {
      Implicant candidate = ret.get(i);
      if (essential.contains(candidate))
        continue;
      boolean redundant = true;
      for (long m : on) {
        if (!candidate.covers(m))
          continue;
        boolean coveredElsewhere = false;
        for (Implicant other : ret)
          if (other != candidate && other.covers(m)) {
            coveredElsewhere = true;
            break;
          }
        if (!coveredElsewhere) {
          redundant = false;
          break;
        }
      }
      if (redundant)
        ret.remove(i);
    }
    return ret;
  }

  //// Cube expansion for functions too wide to enumerate

  private static List<int[]> expandCubes(BoolExpr function, BoolExpr dontCare, List<BoolExpr.Literal> vars) {
    Bdd bdd = new Bdd();
    vars.forEach(bdd::varOf);
    int dc = bdd.build(dontCare);
    int onSet = bdd.and(bdd.build(function), bdd.not(dc));
    int offSet = bdd.and(bdd.not(bdd.build(function)), bdd.not(dc));

    HashMap<BoolExpr.Literal, Integer> index = new HashMap<>();
    for (int k = 0; k < vars.size(); ++k)
      index.put(vars.get(k), k);
    List<int[]> cubes = new ArrayList<>();
    for (Map<BoolExpr.Literal, Boolean> path : bdd.paths(onSet)) {
      int[] cube = new int[vars.size()];
      Arrays.fill(cube, Implicant.absent);
      path.forEach((lit, value) -> cube[index.get(lit)] = value ? Implicant.positive : Implicant.negative);
      cubes.add(cube);
    }

    // Expand: drop every literal whose removal keeps the cube off the off-set
    for (int[] cube : cubes) {
      for (int k = 0; k < cube.length; ++k) {
        if (cube[k] == Implicant.absent)
          continue;
        int saved = cube[k];
        cube[k] = Implicant.absent;
        if (bdd.and(cubeNode(bdd, cube, vars), offSet) != Bdd.FALSE)
          cube[k] = saved;
      }
    }

    // Subsumption, keeping the first of identical cubes
    List<int[]> kept = new ArrayList<>();
    for (int i = 0; i < cubes.size(); ++i) {
      boolean subsumed = false;
      for (int j = 0; j < cubes.size() && !subsumed; ++j) {
        if (i == j)
          continue;
        if (contains(cubes.get(j), cubes.get(i)) && (!Arrays.equals(cubes.get(i), cubes.get(j)) || j < i))
          subsumed = true;
      }
      if (!subsumed)
        kept.add(cubes.get(i));
    }

    // Irredundant: drop cubes whose on-set part the others already cover
    kept.sort(Implicant::compareKeys);
    for (int i = kept.size() - 1; i >= 0; --i) {
      int others = Bdd.FALSE;
      for (int j = 0; j < kept.size(); ++j)
        if (j != i)
          others = bdd.or(others, cubeNode(bdd, kept.get(j), vars));
      int uncovered = bdd.and(bdd.and(cubeNode(bdd, kept.get(i), vars), onSet), bdd.not(others));
      if (uncovered == Bdd.FALSE)
        kept.remove(i);
    }
    return kept;
  }

  /** True if cube {@code outer} contains every point of {@code inner} */
  private static boolean contains(int[] outer, int[] inner) {
    for (int k = 0; k < outer.length; ++k)
      if (outer[k] != Implicant.absent && outer[k] != inner[k])
        return false;
    return true;
  }

  private static int cubeNode(Bdd bdd, int[] cube, List<BoolExpr.Literal> vars) {
    int ret = Bdd.TRUE;
    for (int k = 0; k < cube.length; ++k) {
      if (cube[k] == Implicant.absent)
        continue;
      int v = bdd.variable(vars.get(k));
      ret = bdd.and(ret, cube[k] == Implicant.positive ? v : bdd.not(v));
    }
    return ret;
  }

  private static BoolExpr toExpression(List<int[]> cover, List<BoolExpr.Literal> vars) {
    List<BoolExpr> terms = new ArrayList<>();
    for (int[] cube : cover) {
      List<BoolExpr> lits = new ArrayList<>();
      for (int k = 0; k < cube.length; ++k) {
        if (cube[k] == Implicant.positive)
          lits.add(vars.get(k));
        else if (cube[k] == Implicant.negative)
          lits.add(BoolExpr.not(vars.get(k)));
      }
      terms.add(BoolExpr.and(lits));
    }
    return BoolExpr.or(terms);
  }
}
