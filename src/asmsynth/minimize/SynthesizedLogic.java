package asmsynth.minimize;

import asmsynth.encode.StateEncoding;
import asmsynth.frontend.BoolExpr;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simplified next-state and output equations of an encoded machine. Every equation is a sum of products over
 * {@link #stateBit(int)} literals and input bits.
 */
public final class SynthesizedLogic {
  /** Signal name of the state register in equations */
  public static final String stateSignal = "current_state";

  private final StateEncoding encoding;
  private final List<BoolExpr> nextState;
  private final Map<String, List<BoolExpr>> outputs;

  /**
   * @param nextState one equation per state bit, LSB first
   * @param outputs output name to one equation per bit, LSB first, in declaration order
   */
  public SynthesizedLogic(StateEncoding encoding, List<BoolExpr> nextState, Map<String, List<BoolExpr>> outputs) {
    if (nextState.size() != encoding.getWidth())
      throw new IllegalArgumentException("Expected " + encoding.getWidth() + " next-state equations, got " + nextState.size());
    this.encoding = encoding;
    this.nextState = List.copyOf(nextState);
    LinkedHashMap<String, List<BoolExpr>> outputsCopy = new LinkedHashMap<>();
    outputs.forEach((name, bits) -> outputsCopy.put(name, List.copyOf(bits)));
    this.outputs = Collections.unmodifiableMap(outputsCopy);
  }

  public StateEncoding getEncoding() { return encoding; }

  /** Equation of next_state(i) is at index i */
  public List<BoolExpr> getNextState() { return nextState; }

  public Map<String, List<BoolExpr>> getOutputs() { return outputs; }

  public static BoolExpr.Literal stateBit(int bit) { return new BoolExpr.Literal(stateSignal, bit); }

  public static boolean isStateBit(BoolExpr.Literal literal) { return literal.signal().equals(stateSignal); }
}
