package asmsynth.minimize;

import asmsynth.TestCharts;
import asmsynth.drc.ChartDRC;
import asmsynth.encode.EncodingPolicy;
import asmsynth.encode.StateEncoding;
import asmsynth.frontend.BoolExpr;
import asmsynth.logic.EquivalenceChecker;
import asmsynth.table.StateTable;
import asmsynth.table.StateTableBuilder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LogicMinimizerTest {
  static final BoolExpr.Literal a = new BoolExpr.Literal("a", 0);
  static final BoolExpr.Literal b = new BoolExpr.Literal("b", 0);
  static final BoolExpr.Literal c = new BoolExpr.Literal("c", 0);
  static final List<BoolExpr.Literal> abc = List.of(a, b, c);

  private static LogicMinimizer minimizer(int limit) { return new LogicMinimizer(new EquivalenceChecker(limit)); }

  /** Function true on the given minterms; variable 0 is the most significant bit */
  private static BoolExpr minterms(List<BoolExpr.Literal> vars, long... ms) {
    List<BoolExpr> terms = new ArrayList<>();
    for (long m : ms) {
      List<BoolExpr> lits = new ArrayList<>();
      for (int k = 0; k < vars.size(); ++k)
        lits.add(((m >> (vars.size() - 1 - k)) & 1) != 0 ? vars.get(k) : BoolExpr.not(vars.get(k)));
      terms.add(BoolExpr.and(lits));
    }
    return BoolExpr.or(terms);
  }

  private static List<BoolExpr> termsOf(BoolExpr sop) {
    if (sop instanceof BoolExpr.Or)
      return ((BoolExpr.Or)sop).operands();
    return List.of(sop);
  }

  private static List<BoolExpr> factorsOf(BoolExpr term) {
    if (term instanceof BoolExpr.And)
      return ((BoolExpr.And)term).operands();
    return List.of(term);
  }

  private static boolean evaluate(BoolExpr expr, List<BoolExpr.Literal> vars, long m) {
    return expr.evaluate(lit -> ((m >> (vars.size() - 1 - vars.indexOf(lit))) & 1) != 0);
  }

  @Test
  void testAdjacentMerge() throws Exception {
    BoolExpr f = BoolExpr.or(BoolExpr.and(a, b), BoolExpr.and(a, BoolExpr.not(b)));
    Assertions.assertEquals(a, minimizer(16).simplify("f", f, BoolExpr.FALSE, abc));
    Assertions.assertEquals(a, minimizer(0).simplify("f", f, BoolExpr.FALSE, abc));
  }

  @Test
  void testTermOrder() throws Exception {
    // Terms sorted per variable: negated before positive before absent
    BoolExpr f = minterms(abc, 0b111, 0b110, 0b000);
    BoolExpr expected = BoolExpr.or(BoolExpr.and(BoolExpr.not(a), BoolExpr.not(b), BoolExpr.not(c)), BoolExpr.and(a, b));
    Assertions.assertEquals(expected, minimizer(16).simplify("f", f, BoolExpr.FALSE, abc));
  }

  @Test
  void testCyclicCore() throws Exception {
    // Sum of minterms 0,1,2,5,6,7 has six two-literal primes and none of them is essential
    BoolExpr f = minterms(abc, 0, 1, 2, 5, 6, 7);
    BoolExpr ret = minimizer(16).simplify("f", f, BoolExpr.FALSE, abc);
    List<BoolExpr> terms = termsOf(ret);
    for (BoolExpr term : terms)
      Assertions.assertEquals(2, factorsOf(term).size(), ret::toString);
    for (long m = 0; m < 8; ++m)
      Assertions.assertEquals(evaluate(f, abc, m), evaluate(ret, abc, m));
    // No term can be dropped
    for (int i = 0; i < terms.size(); ++i) {
      List<BoolExpr> others = new ArrayList<>(terms);
      others.remove(i);
      BoolExpr without = BoolExpr.or(others);
      boolean changed = false;
      for (long m = 0; m < 8; ++m)
        changed |= evaluate(without, abc, m) != evaluate(f, abc, m);
      Assertions.assertTrue(changed, ret::toString);
    }
  }

  @Test
  void testDontCare() throws Exception {
    // a and b, with a and not b unreachable
    BoolExpr dc = BoolExpr.and(a, BoolExpr.not(b));
    Assertions.assertEquals(a, minimizer(16).simplify("f", BoolExpr.and(a, b), dc, abc));
    Assertions.assertEquals(BoolExpr.FALSE, minimizer(16).simplify("f", BoolExpr.and(a, b), BoolExpr.TRUE, abc));
    Assertions.assertEquals(BoolExpr.TRUE, minimizer(16).simplify("f", BoolExpr.or(a, dc), BoolExpr.not(a), abc));
  }

  @Test
  void testConstants() throws Exception {
    Assertions.assertEquals(BoolExpr.TRUE, minimizer(16).simplify("f", BoolExpr.or(c, BoolExpr.not(c)), BoolExpr.FALSE, abc));
    Assertions.assertEquals(BoolExpr.FALSE, minimizer(16).simplify("f", BoolExpr.and(c, BoolExpr.not(c)), BoolExpr.FALSE, abc));
    Assertions.assertEquals(BoolExpr.TRUE, minimizer(16).simplify("f", BoolExpr.TRUE, BoolExpr.FALSE, abc));
  }

  @Test
  void testCodeTerm() {
    BoolExpr expected = BoolExpr.and(SynthesizedLogic.stateBit(1), BoolExpr.not(SynthesizedLogic.stateBit(0)));
    Assertions.assertEquals(expected, LogicMinimizer.codeTerm(2, 2));
  }

  @Test
  void testPrimeImplicants() {
    // f = sum(1,3,5,7) over 3 variables is the single prime --1
    List<Implicant> primes = LogicMinimizer.primeImplicants(List.of(1L, 3L, 5L, 7L), List.of(), 3);
    Assertions.assertEquals(1, primes.size());
    Assertions.assertEquals("--1", primes.get(0).toString());
    Assertions.assertEquals(List.of(primes.get(0)), LogicMinimizer.selectCover(primes, List.of(1L, 3L, 5L, 7L)));
  }

  @Test
  void testMinimizeTraffic() throws Exception {
    StateTable table = new StateTableBuilder(false, new EquivalenceChecker(16)).build(new ChartDRC(TestCharts.traffic(), false).Build());
    StateEncoding encoding = EncodingPolicy.onehot.createEncoder().encode(table);
    SynthesizedLogic logic = minimizer(16).minimize(table, encoding);
    Assertions.assertEquals(4, logic.getNextState().size());
    Assertions.assertEquals(List.of("main_green", "main_yellow", "side_green", "side_yellow"), List.copyOf(logic.getOutputs().keySet()));
    // In MY the main yellow light is on, nowhere else
    Assertions.assertEquals(SynthesizedLogic.stateBit(1), logic.getOutputs().get("main_yellow").get(0));
  }

  @Test
  void testOneHotRing() throws Exception {
    // 11 state bits and 5 inputs fit the exhaustive limit, but all but 11 of the 2048 codes are don't-cares
    StateTable table = new StateTableBuilder(false, new EquivalenceChecker(16)).build(new ChartDRC(TestCharts.ring(11, 5), false).Build());
    StateEncoding encoding = EncodingPolicy.onehot.createEncoder().encode(table);
    Assertions.assertEquals(11, encoding.getWidth());
    SynthesizedLogic logic = Assertions.assertTimeout(Duration.ofSeconds(20), () -> minimizer(16).minimize(table, encoding));
    Assertions.assertEquals(SynthesizedLogic.stateBit(0), logic.getOutputs().get("home").get(0));
    for (BoolExpr bit : logic.getNextState())
      for (BoolExpr term : termsOf(bit))
        Assertions.assertTrue(factorsOf(term).size() <= 2, bit::toString);
  }

  @RepeatedTest(64)
  void testRandomFunction_random() throws Exception {
    long seed = new Random().nextLong();
    try {
      testRandomFunction(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testRandomFunction with seed " + seed);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {1, 42, 8675309, -4412009873551234L})
  void testRandomFunction(long seed) throws Exception {
    Random rand = new Random(seed);
    int n = 1 + rand.nextInt(6);
    List<BoolExpr.Literal> vars = new ArrayList<>();
    for (int i = 0; i < n; ++i)
      vars.add(new BoolExpr.Literal("x", i));
    List<Long> on = new ArrayList<>(), dc = new ArrayList<>();
    for (long m = 0; m < (1L << n); ++m) {
      int r = rand.nextInt(4);
      if (r == 0)
        dc.add(m);
      else if (r == 1)
        on.add(m);
    }
    BoolExpr f = minterms(vars, on.stream().mapToLong(Long::longValue).toArray());
    BoolExpr dontCare = minterms(vars, dc.stream().mapToLong(Long::longValue).toArray());

    for (int limit : new int[] {16, 0}) {
      BoolExpr ret = minimizer(limit).simplify("f", f, dontCare, vars);
      for (long m = 0; m < (1L << n); ++m)
        if (!dc.contains(m))
          Assertions.assertEquals(on.contains(m), evaluate(ret, vars, m), "limit " + limit + ", minterm " + m + ": " + ret);
      if (ret instanceof BoolExpr.Const)
        continue;
      // Every term is prime: dropping any literal reaches the off-set
      for (BoolExpr term : termsOf(ret)) {
        List<BoolExpr> factors = factorsOf(term);
        for (int i = 0; i < factors.size(); ++i) {
          List<BoolExpr> rest = new ArrayList<>(factors);
          rest.remove(i);
          BoolExpr widened = BoolExpr.and(rest);
          boolean hitsOffSet = false;
          for (long m = 0; m < (1L << n) && !hitsOffSet; ++m)
            hitsOffSet = evaluate(widened, vars, m) && !on.contains(m) && !dc.contains(m);
          Assertions.assertTrue(hitsOffSet, "limit " + limit + ": term " + term + " of " + ret + " is not prime");
        }
      }
    }
  }
}
