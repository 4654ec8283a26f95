package asmsynth.frontend;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Boolean expression over single signal bits: constant, literal, NOT, AND, OR.
 * Values are immutable and compare structurally; use {@code asmsynth.logic.EquivalenceChecker} to decide
 * semantic equivalence.
 */
public interface BoolExpr {

  public static final Const TRUE = new Const(true);
  public static final Const FALSE = new Const(false);

  /** Dispatch over the expression variants. */
  public interface Visitor<R> {
    R visitConst(Const expr);
    R visitLiteral(Literal expr);
    R visitNot(Not expr);
    R visitAnd(And expr);
    R visitOr(Or expr);
  }

  <R> R accept(Visitor<R> visitor);

  /**
   * Evaluates the expression.
   * @param assignment value of each literal
   */
  boolean evaluate(Predicate<Literal> assignment);

  /** Adds all literals to {@code into}, in order of first appearance. */
  void collectLiterals(Collection<Literal> into);

  /** Rebuilds the expression with every literal replaced by {@code replacement.apply(literal)}. */
  BoolExpr mapLiterals(Function<Literal, BoolExpr> replacement);

  default LinkedHashSet<Literal> literals() {
    LinkedHashSet<Literal> ret = new LinkedHashSet<>();
    collectLiterals(ret);
    return ret;
  }

  default boolean isConst(boolean value) { return this instanceof Const && ((Const)this).value() == value; }

  public record Const(boolean value) implements BoolExpr {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitConst(this);
    }
    @Override
    public boolean evaluate(Predicate<Literal> assignment) {
      return value;
    }
    @Override
    public void collectLiterals(Collection<Literal> into) {}
    @Override
    public BoolExpr mapLiterals(Function<Literal, BoolExpr> replacement) {
      return this;
    }
    @Override
    public String toString() {
      return value ? "1" : "0";
    }
  }

  /**
   * One bit of a signal. {@code bit} is -1 for an unindexed reference that has not been resolved against the signal
   * declarations yet.
   */
  public record Literal(String signal, int bit) implements BoolExpr {
    public Literal {
      Objects.requireNonNull(signal);
    }
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLiteral(this);
    }
    @Override
    public boolean evaluate(Predicate<Literal> assignment) {
      return assignment.test(this);
    }
    @Override
    public void collectLiterals(Collection<Literal> into) {
      into.add(this);
    }
    @Override
    public BoolExpr mapLiterals(Function<Literal, BoolExpr> replacement) {
      return replacement.apply(this);
    }
    @Override
    public String toString() {
      return bit < 0 ? signal : signal + "[" + bit + "]";
    }
  }

  public record Not(BoolExpr operand) implements BoolExpr {
    public Not {
      Objects.requireNonNull(operand);
    }
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNot(this);
    }
    @Override
    public boolean evaluate(Predicate<Literal> assignment) {
      return !operand.evaluate(assignment);
    }
    @Override
    public void collectLiterals(Collection<Literal> into) {
      operand.collectLiterals(into);
    }
    @Override
    public BoolExpr mapLiterals(Function<Literal, BoolExpr> replacement) {
      return not(operand.mapLiterals(replacement));
    }
    @Override
    public String toString() {
      boolean simple = operand instanceof Literal || operand instanceof Const || operand instanceof Not;
      return "not " + (simple ? operand.toString() : "(" + operand + ")");
    }
  }

  public record And(List<BoolExpr> operands) implements BoolExpr {
    public And {
      operands = List.copyOf(operands);
    }
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAnd(this);
    }
    @Override
    public boolean evaluate(Predicate<Literal> assignment) {
      for (BoolExpr operand : operands)
        if (!operand.evaluate(assignment))
          return false;
      return true;
    }
    @Override
    public void collectLiterals(Collection<Literal> into) {
      operands.forEach(operand -> operand.collectLiterals(into));
    }
    @Override
    public BoolExpr mapLiterals(Function<Literal, BoolExpr> replacement) {
      return and(operands.stream().map(operand -> operand.mapLiterals(replacement)).toList());
    }
    @Override
    public String toString() {
      return operands.stream()
          .map(operand -> operand instanceof Or ? "(" + operand + ")" : operand.toString())
          .collect(Collectors.joining(" and "));
    }
  }

  public record Or(List<BoolExpr> operands) implements BoolExpr {
    public Or {
      operands = List.copyOf(operands);
    }
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitOr(this);
    }
    @Override
    public boolean evaluate(Predicate<Literal> assignment) {
      for (BoolExpr operand : operands)
        if (operand.evaluate(assignment))
          return true;
      return false;
    }
    @Override
    public void collectLiterals(Collection<Literal> into) {
      operands.forEach(operand -> operand.collectLiterals(into));
    }
    @Override
    public BoolExpr mapLiterals(Function<Literal, BoolExpr> replacement) {
      return or(operands.stream().map(operand -> operand.mapLiterals(replacement)).toList());
    }
    @Override
    public String toString() {
      return operands.stream().map(BoolExpr::toString).collect(Collectors.joining(" or "));
    }
  }

  //// Factories. These fold constants and flatten nested operators, nothing more.

  public static BoolExpr constant(boolean value) { return value ? TRUE : FALSE; }

  public static BoolExpr not(BoolExpr operand) {
    if (operand instanceof Const)
      return constant(!((Const)operand).value());
    if (operand instanceof Not)
      return ((Not)operand).operand();
    return new Not(operand);
  }

  public static BoolExpr and(BoolExpr... operands) { return and(List.of(operands)); }

  public static BoolExpr and(List<BoolExpr> operands) {
    List<BoolExpr> flat = new ArrayList<>();
    for (BoolExpr operand : operands) {
      if (operand.isConst(false))
        return FALSE;
      if (operand.isConst(true))
        continue;
      if (operand instanceof And)
        flat.addAll(((And)operand).operands());
      else
        flat.add(operand);
    }
    if (flat.isEmpty())
      return TRUE;
    if (flat.size() == 1)
      return flat.get(0);
    return new And(flat);
  }

  public static BoolExpr or(BoolExpr... operands) { return or(List.of(operands)); }

  public static BoolExpr or(List<BoolExpr> operands) {
    List<BoolExpr> flat = new ArrayList<>();
    for (BoolExpr operand : operands) {
      if (operand.isConst(true))
        return TRUE;
      if (operand.isConst(false))
        continue;
      if (operand instanceof Or)
        flat.addAll(((Or)operand).operands());
      else
        flat.add(operand);
    }
    if (flat.isEmpty())
      return FALSE;
    if (flat.size() == 1)
      return flat.get(0);
    return new Or(flat);
  }
}
