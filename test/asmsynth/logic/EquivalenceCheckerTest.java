package asmsynth.logic;

import asmsynth.frontend.BoolExpr;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EquivalenceCheckerTest {
  static final BoolExpr.Literal a = new BoolExpr.Literal("a", 0);
  static final BoolExpr.Literal b = new BoolExpr.Literal("b", 0);
  static final BoolExpr.Literal c = new BoolExpr.Literal("c", 0);

  /** 0 forces the BDD path, 16 the truth table */
  @ParameterizedTest
  @ValueSource(ints = {0, 16})
  void testOverlap(int limit) {
    EquivalenceChecker checker = new EquivalenceChecker(limit);
    Assertions.assertTrue(checker.findOverlap(a, BoolExpr.not(a)).isEmpty());
    Assertions.assertTrue(checker.findOverlap(BoolExpr.and(a, b), BoolExpr.and(BoolExpr.not(b), c)).isEmpty());
    Optional<Map<BoolExpr.Literal, Boolean>> witness = checker.findOverlap(BoolExpr.or(a, c), BoolExpr.and(b, BoolExpr.not(a)));
    Assertions.assertTrue(witness.isPresent());
    Map<BoolExpr.Literal, Boolean> w = witness.get();
    Assertions.assertEquals(false, w.get(a));
    Assertions.assertEquals(true, w.get(b));
    Assertions.assertEquals(true, w.get(c));
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 16})
  void testEquivalence(int limit) {
    EquivalenceChecker checker = new EquivalenceChecker(limit);
    // De Morgan
    Assertions.assertTrue(checker.isEquivalent(BoolExpr.not(BoolExpr.and(a, b)), BoolExpr.or(BoolExpr.not(a), BoolExpr.not(b))));
    Assertions.assertFalse(checker.isEquivalent(BoolExpr.or(a, b), BoolExpr.and(a, b)));
    Assertions.assertTrue(checker.isEquivalent(BoolExpr.TRUE, BoolExpr.or(c, BoolExpr.not(c))));

    // a and b differ only where a != b; excluded by the don't-care set
    BoolExpr dontCare = BoolExpr.or(BoolExpr.and(a, BoolExpr.not(b)), BoolExpr.and(BoolExpr.not(a), b));
    Assertions.assertTrue(checker.findDifference(a, b, dontCare).isEmpty());
    Assertions.assertTrue(checker.findDifference(a, b, BoolExpr.FALSE).isPresent());
  }

  @Test
  void testLimit() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new EquivalenceChecker(-1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new EquivalenceChecker(31));
    Assertions.assertEquals(30, new EquivalenceChecker(30).getExhaustiveLimit());
  }

  @Test
  void testWideExpressions() {
    // 24 variables, decided by BDD: pairwise equality chain against its rewritten form
    EquivalenceChecker checker = new EquivalenceChecker(8);
    BoolExpr chain = BoolExpr.TRUE, rewritten = BoolExpr.TRUE;
    for (int i = 0; i < 12; ++i) {
      BoolExpr x = new BoolExpr.Literal("x", i), y = new BoolExpr.Literal("y", i);
      chain = BoolExpr.and(chain, BoolExpr.or(BoolExpr.and(x, y), BoolExpr.and(BoolExpr.not(x), BoolExpr.not(y))));
      rewritten = BoolExpr.and(rewritten, BoolExpr.and(BoolExpr.or(BoolExpr.not(x), y), BoolExpr.or(x, BoolExpr.not(y))));
    }
    Assertions.assertTrue(checker.isEquivalent(chain, rewritten));
    Assertions.assertTrue(checker.findOverlap(chain, BoolExpr.and(new BoolExpr.Literal("x", 3), BoolExpr.not(new BoolExpr.Literal("y", 3))))
                              .isEmpty());
  }

  @Test
  void testDescribe() {
    LinkedHashMap<BoolExpr.Literal, Boolean> assignment = new LinkedHashMap<>();
    Assertions.assertEquals("any input", EquivalenceChecker.describe(assignment));
    assignment.put(a, true);
    assignment.put(b, false);
    Assertions.assertEquals(a + "=1, " + b + "=0", EquivalenceChecker.describe(assignment));
  }
}
