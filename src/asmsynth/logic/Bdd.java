package asmsynth.logic;

import asmsynth.frontend.BoolExpr;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reduced ordered binary decision diagram. Nodes are integer ids owned by one {@code Bdd} instance; two functions built in
 * the same instance are equivalent iff their ids are equal.
 * <p>
 * Variables are signal bits, numbered in the order they are first seen by {@link #build(BoolExpr)} or
 * {@link #variable(BoolExpr.Literal)}. Not thread-safe; use one instance per compilation.
 */
public class Bdd {
  public static final int FALSE = 0;
  public static final int TRUE = 1;
  private static final int terminalVar = Integer.MAX_VALUE;

  private int[] var = new int[1024];
  private int[] low = new int[1024];
  private int[] high = new int[1024];
  private int size = 2;

  private record Key(int var, int low, int high) {}
  private record OpKey(char op, int a, int b) {}

  private final HashMap<Key, Integer> unique = new HashMap<>();
  private final HashMap<OpKey, Integer> opCache = new HashMap<>();
  private final LinkedHashMap<BoolExpr.Literal, Integer> varIndex = new LinkedHashMap<>();

  public Bdd() {
    var[FALSE] = terminalVar;
    var[TRUE] = terminalVar;
  }

  /** Variable index of a literal, allocating a new one on first use. */
  public int varOf(BoolExpr.Literal literal) {
    Integer idx = varIndex.get(literal);
    if (idx == null) {
      idx = varIndex.size();
      varIndex.put(literal, idx);
    }
    return idx;
  }

  /** Literals in variable order */
  public List<BoolExpr.Literal> getVariables() { return List.copyOf(varIndex.keySet()); }

  public int variable(BoolExpr.Literal literal) { return mk(varOf(literal), FALSE, TRUE); }

  private int mk(int v, int lo, int hi) {
    if (lo == hi)
      return lo;
    Key key = new Key(v, lo, hi);
    Integer existing = unique.get(key);
    if (existing != null)
      return existing;
    if (size == var.length) {
      var = Arrays.copyOf(var, size * 2);
      low = Arrays.copyOf(low, size * 2);
      high = Arrays.copyOf(high, size * 2);
    }
    int node = size++;
    var[node] = v;
    low[node] = lo;
    high[node] = hi;
    unique.put(key, node);
    return node;
  }

  public int not(int a) {
    if (a == FALSE)
      return TRUE;
    if (a == TRUE)
      return FALSE;
    OpKey key = new OpKey('!', a, a);
    Integer cached = opCache.get(key);
    if (cached != null)
      return cached;
    int ret = mk(var[a], not(low[a]), not(high[a]));
    opCache.put(key, ret);
    return ret;
  }

  public int and(int a, int b) {
    if (a == FALSE || b == FALSE)
      return FALSE;
    if (a == TRUE)
      return b;
    if (b == TRUE || a == b)
      return a;
    return apply('&', a, b);
  }

  public int or(int a, int b) {
    if (a == TRUE || b == TRUE)
      return TRUE;
    if (a == FALSE)
      return b;
    if (b == FALSE || a == b)
      return a;
    return apply('|', a, b);
  }

  public int xor(int a, int b) {
    if (a == b)
      return FALSE;
    if (a == FALSE)
      return b;
    if (b == FALSE)
      return a;
    if (a == TRUE)
      return not(b);
    if (b == TRUE)
      return not(a);
    return apply('^', a, b);
  }

  private int apply(char op, int a, int b) {
    OpKey key = new OpKey(op, Math.min(a, b), Math.max(a, b));
    Integer cached = opCache.get(key);
    if (cached != null)
      return cached;
    int v = Math.min(var[a], var[b]);
    int aLow = var[a] == v ? low[a] : a, aHigh = var[a] == v ? high[a] : a;
    int bLow = var[b] == v ? low[b] : b, bHigh = var[b] == v ? high[b] : b;
    int lo, hi;
    switch (op) {
    case '&':
      lo = and(aLow, bLow);
      hi = and(aHigh, bHigh);
      break;
    case '|':
      lo = or(aLow, bLow);
      hi = or(aHigh, bHigh);
      break;
    default:
      lo = xor(aLow, bLow);
      hi = xor(aHigh, bHigh);
    }
    int ret = mk(v, lo, hi);
    opCache.put(key, ret);
    return ret;
  }

  /** Builds the diagram of an expression. */
  public int build(BoolExpr expr) {
    return expr.accept(new BoolExpr.Visitor<Integer>() {
      @Override
      public Integer visitConst(BoolExpr.Const expr) {
        return expr.value() ? TRUE : FALSE;
      }
      @Override
      public Integer visitLiteral(BoolExpr.Literal expr) {
        return variable(expr);
      }
      @Override
      public Integer visitNot(BoolExpr.Not expr) {
        return not(expr.operand().accept(this));
      }
      @Override
      public Integer visitAnd(BoolExpr.And expr) {
        int ret = TRUE;
        for (BoolExpr operand : expr.operands())
          ret = and(ret, operand.accept(this));
        return ret;
      }
      @Override
      public Integer visitOr(BoolExpr.Or expr) {
        int ret = FALSE;
        for (BoolExpr operand : expr.operands())
          ret = or(ret, operand.accept(this));
        return ret;
      }
    });
  }

  /**
   * One satisfying assignment of {@code node}, restricted to the variables on the chosen path.
   * Empty if the node is {@link #FALSE}.
   */
  public Optional<Map<BoolExpr.Literal, Boolean>> anySat(int node) {
    if (node == FALSE)
      return Optional.empty();
    List<BoolExpr.Literal> vars = getVariables();
    LinkedHashMap<BoolExpr.Literal, Boolean> ret = new LinkedHashMap<>();
    while (node != TRUE) {
      boolean takeHigh = low[node] == FALSE;
      ret.put(vars.get(var[node]), takeHigh);
      node = takeHigh ? high[node] : low[node];
    }
    return Optional.of(ret);
  }

  /**
   * Every path from {@code node} to {@link #TRUE}, each as the partial assignment it fixes. The cubes are pairwise disjoint
   * and their union is the function of {@code node}.
   */
  public List<Map<BoolExpr.Literal, Boolean>> paths(int node) {
    List<Map<BoolExpr.Literal, Boolean>> ret = new ArrayList<>();
    collectPaths(node, new LinkedHashMap<>(), getVariables(), ret);
    return ret;
  }

  private void collectPaths(int node, LinkedHashMap<BoolExpr.Literal, Boolean> prefix, List<BoolExpr.Literal> vars,
                            List<Map<BoolExpr.Literal, Boolean>> into) {
    if (node == FALSE)
      return;
    if (node == TRUE) {
      into.add(new LinkedHashMap<>(prefix));
      return;
    }
    BoolExpr.Literal lit = vars.get(var[node]);
    prefix.put(lit, false);
    collectPaths(low[node], prefix, vars, into);
    prefix.put(lit, true);
    collectPaths(high[node], prefix, vars, into);
    prefix.remove(lit);
  }

  /** Number of nodes allocated so far, terminals included. Nodes are never freed. */
  public int nodeCount() { return size; }

  /** Number of nodes reachable from {@code root}, terminals included */
  public int nodeCount(int root) {
    HashSet<Integer> seen = new HashSet<>();
    ArrayDeque<Integer> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      int node = stack.pop();
      if (!seen.add(node) || var[node] == terminalVar)
        continue;
      stack.push(low[node]);
      stack.push(high[node]);
    }
    return seen.size();
  }
}
