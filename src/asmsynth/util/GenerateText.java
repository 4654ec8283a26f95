package asmsynth.util;

import asmsynth.frontend.BoolExpr;
import asmsynth.minimize.SynthesizedLogic;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Language-neutral part of code emission. Subclasses fill {@link #dictionary} with the keywords and operators of their
 * language; sum-of-products rendering is done here from those words.
 */
public abstract class GenerateText {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public String clk = "clk";
  public String reset = "reset";
  public String currentState = SynthesizedLogic.stateSignal;
  public String nextState = "next_state";
  public String tab = "    ";

  public enum DictWords {
    module,
    endmodule,
    wire,
    assign_eq,
    logical_or,
    logical_and,
    logical_not,
    bitsselectRight,
    bitsselectLeft,
    bitsRange,
    in,
    out,
    comment,
    True,
    False
  }

  @SuppressWarnings("serial")
  public HashMap<DictWords, String> dictionary = new HashMap<DictWords, String>() {
    {
      put(DictWords.module, "");
      put(DictWords.endmodule, "");
      put(DictWords.wire, "");
      put(DictWords.assign_eq, "");
      put(DictWords.logical_or, "");
      put(DictWords.logical_and, "");
      put(DictWords.logical_not, "");
      put(DictWords.bitsselectRight, "");
      put(DictWords.bitsselectLeft, "");
      put(DictWords.bitsRange, "");
      put(DictWords.in, "");
      put(DictWords.out, "");
      put(DictWords.comment, "");
      put(DictWords.True, "");
      put(DictWords.False, "");
    }
  };

  public String GetDict(DictWords input) { return dictionary.get(input); }

  public String AlignText(String alignment, String text) {
    String newText = alignment + text;
    newText = newText.replaceAll("(\\r\\n|\\n)(?![\\r\\n]|$)", "\n" + alignment); // Keep empty lines and the trailing newline bare
    return newText;
  }

  /** Quoted bit string literal, MSB first */
  public abstract String CreateBitString(String bits);

  /** Name of one bit of {@code signal}; 1-bit signals are named without index. */
  public String CreateBitSelect(String signal, int bit, int width) {
    if (width == 1)
      return signal;
    return signal + GetDict(DictWords.bitsselectLeft) + bit + GetDict(DictWords.bitsselectRight);
  }

  /**
   * Renders a sum of products. Terms with several literals are parenthesized when there is more than one term.
   * @param inputWidths width of every input signal, to decide between {@code x} and {@code x(i)}
   */
  public String CreateSOP(BoolExpr sop, Map<String, Integer> inputWidths) {
    if (sop instanceof BoolExpr.Const)
      return ((BoolExpr.Const)sop).value() ? GetDict(DictWords.True) : GetDict(DictWords.False);
    List<BoolExpr> terms = sop instanceof BoolExpr.Or ? ((BoolExpr.Or)sop).operands() : List.of(sop);
    List<String> rendered = new ArrayList<>();
    for (BoolExpr term : terms) {
      String text = CreateProduct(term, inputWidths);
      if (terms.size() > 1 && term instanceof BoolExpr.And)
        text = "(" + text + ")";
      rendered.add(text);
    }
    return String.join(" " + GetDict(DictWords.logical_or) + " ", rendered);
  }

  private String CreateProduct(BoolExpr term, Map<String, Integer> inputWidths) {
    List<BoolExpr> factors = term instanceof BoolExpr.And ? ((BoolExpr.And)term).operands() : List.of(term);
    List<String> rendered = new ArrayList<>();
    for (BoolExpr factor : factors) {
      if (factor instanceof BoolExpr.Not && ((BoolExpr.Not)factor).operand() instanceof BoolExpr.Literal)
        rendered.add(GetDict(DictWords.logical_not) + " " + CreateLiteral((BoolExpr.Literal)((BoolExpr.Not)factor).operand(), inputWidths));
      else if (factor instanceof BoolExpr.Literal)
        rendered.add(CreateLiteral((BoolExpr.Literal)factor, inputWidths));
      else
        throw new IllegalArgumentException("Not a product of literals: " + term);
    }
    return String.join(" " + GetDict(DictWords.logical_and) + " ", rendered);
  }

  private String CreateLiteral(BoolExpr.Literal literal, Map<String, Integer> inputWidths) {
    if (SynthesizedLogic.isStateBit(literal))
      return currentState + GetDict(DictWords.bitsselectLeft) + literal.bit() + GetDict(DictWords.bitsselectRight);
    return CreateBitSelect(literal.signal(), literal.bit(), inputWidths.getOrDefault(literal.signal(), 1));
  }
}
