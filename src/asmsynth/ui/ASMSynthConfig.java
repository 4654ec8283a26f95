package asmsynth.ui;

import asmsynth.encode.EncodingPolicy;
import asmsynth.util.VHDL;

/**
 * Data-Class to hold tool options.
 */
public class ASMSynthConfig {

  public EncodingPolicy encoding = EncodingPolicy.binary;
  public VHDL.ResetStyle reset_style = VHDL.ResetStyle.sync;

  /** Reject any two overlapping guards of a state, not only those with equal priority */
  public boolean require_disjoint_guards = false;
  /** Reject states that leave an output unbound instead of using its default */
  public boolean require_explicit_outputs = false;

  /** Functions with more variables than this are handled symbolically instead of by truth table */
  public int exhaustive_variable_limit = 16;

  /** Overrides the chart name as entity name if set */
  public String entity_name = null;

  public ASMSynthConfig copy() {
    ASMSynthConfig ret = new ASMSynthConfig();
    ret.encoding = encoding;
    ret.reset_style = reset_style;
    ret.require_disjoint_guards = require_disjoint_guards;
    ret.require_explicit_outputs = require_explicit_outputs;
    ret.exhaustive_variable_limit = exhaustive_variable_limit;
    ret.entity_name = entity_name;
    return ret;
  }
}
