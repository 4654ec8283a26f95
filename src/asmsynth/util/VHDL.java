package asmsynth.util;

import asmsynth.diag.CodeGenException;
import asmsynth.encode.StateEncoding;
import asmsynth.frontend.BoolExpr;
import asmsynth.frontend.Signal;
import asmsynth.minimize.SynthesizedLogic;
import asmsynth.table.StateTable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renders an encoded, simplified machine as one VHDL entity with a combinational process for the next-state and output
 * equations and a clocked state register.
 */
public class VHDL extends GenerateText {

  public enum ResetStyle {
    /** Reset sampled on the rising clock edge */
    sync,
    /** Reset acts immediately */
    async;

    public static ResetStyle parse(String text) {
      for (ResetStyle style : values())
        if (style.name().equalsIgnoreCase(text.trim()))
          return style;
      throw new IllegalArgumentException("Unknown reset style '" + text + "', expected sync or async");
    }
  }

  private static final Pattern identifier = Pattern.compile("[A-Za-z](_?[A-Za-z0-9])*");

  /** VHDL-2008 reserved words */
  private static final Set<String> reserved = Set.of(
      "abs", "access", "after", "alias", "all", "and", "architecture", "array", "assert", "assume", "assume_guarantee", "attribute",
      "begin", "block", "body", "buffer", "bus", "case", "component", "configuration", "constant", "context", "cover", "default",
      "disconnect", "downto", "else", "elsif", "end", "entity", "exit", "fairness", "file", "for", "force", "function", "generate",
      "generic", "group", "guarded", "if", "impure", "in", "inertial", "inout", "is", "label", "library", "linkage", "literal",
      "loop", "map", "mod", "nand", "new", "next", "nor", "not", "null", "of", "on", "open", "or", "others", "out", "package",
      "parameter", "port", "postponed", "procedure", "process", "property", "protected", "pure", "range", "record", "register",
      "reject", "release", "rem", "report", "restrict", "restrict_guarantee", "return", "rol", "ror", "select", "sequence",
      "severity", "shared", "signal", "sla", "sll", "sra", "srl", "strong", "subtype", "then", "to", "transport", "type",
      "unaffected", "units", "until", "use", "variable", "vmode", "vprop", "vunit", "wait", "when", "while", "with", "xnor", "xor");

  private final ResetStyle resetStyle;

  public VHDL(ResetStyle resetStyle) {
    this.resetStyle = resetStyle;
    // initialize dictionary
    dictionary.put(DictWords.module, "architecture");
    dictionary.put(DictWords.endmodule, "end architecture");
    dictionary.put(DictWords.wire, "signal");
    dictionary.put(DictWords.assign_eq, "<=");
    dictionary.put(DictWords.logical_or, "or");
    dictionary.put(DictWords.logical_and, "and");
    dictionary.put(DictWords.logical_not, "not");
    dictionary.put(DictWords.bitsselectRight, ")");
    dictionary.put(DictWords.bitsselectLeft, "(");
    dictionary.put(DictWords.bitsRange, "downto");
    dictionary.put(DictWords.in, "in");
    dictionary.put(DictWords.out, "out");
    dictionary.put(DictWords.comment, "--");
    dictionary.put(DictWords.False, "'0'");
    dictionary.put(DictWords.True, "'1'");
  }

  public ResetStyle getResetStyle() { return resetStyle; }

  @Override
  public String CreateBitString(String bits) {
    return "\"" + bits + "\"";
  }

  /** Generates text like: std_logic_vector(3 downto 0) */
  public String CreateType(int width) {
    if (width == 1)
      return "std_logic";
    return "std_logic_vector(" + (width - 1) + " " + GetDict(DictWords.bitsRange) + " 0)";
  }

  /**
   * Emits the complete design unit.
   * @throws CodeGenException if a name is not a usable VHDL identifier or an equation does not fit the declared ports
   */
  public String Generate(String entityName, StateTable table, SynthesizedLogic logic) throws CodeGenException {
    CheckIdentifiers(entityName, table);
    CheckEquations(table, logic);
    logger.debug("VHDL. Emitting entity '{}'", entityName);

    StateEncoding encoding = logic.getEncoding();
    LinkedHashMap<String, Integer> inputWidths = new LinkedHashMap<>();
    table.getInputs().forEach(sig -> inputWidths.put(sig.name, sig.width));

    StringBuilder ret = new StringBuilder();
    ret.append(CreateHeader(entityName, table, encoding));
    ret.append("library IEEE;\n");
    ret.append("use IEEE.STD_LOGIC_1164.ALL;\n\n");

    // Entity
    int pad = 8;
    for (Signal sig : table.getInputs())
      pad = Math.max(pad, sig.name.length());
    for (Signal sig : table.getOutputs())
      pad = Math.max(pad, sig.name.length());
    List<String> ports = new ArrayList<>();
    ports.add(CreatePort(clk, true, 1, pad));
    ports.add(CreatePort(reset, true, 1, pad));
    for (int i = 0; i < table.getInputs().size(); ++i) {
      Signal sig = table.getInputs().get(i);
      ports.add((i == 0 ? "\n-- Inputs\n" : "") + CreatePort(sig.name, true, sig.width, pad));
    }
    for (int i = 0; i < table.getOutputs().size(); ++i) {
      Signal sig = table.getOutputs().get(i);
      ports.add((i == 0 ? "\n-- Outputs\n" : "") + CreatePort(sig.name, false, sig.width, pad));
    }
    ret.append("entity " + entityName + " is\n");
    ret.append(tab + "port (\n");
    ret.append(AlignText(tab + tab, String.join(";\n", ports)) + "\n");
    ret.append(tab + ");\n");
    ret.append("end entity " + entityName + ";\n\n");

    // Architecture
    ret.append(GetDict(DictWords.module) + " Behavioral of " + entityName + " is\n\n");
    ret.append(tab + "-- State register and next state logic signals\n");
    ret.append(tab + GetDict(DictWords.wire) + " " + currentState + ", " + nextState + " : std_logic_vector(" + (encoding.getWidth() - 1) + " " +
               GetDict(DictWords.bitsRange) + " 0);\n\n");
    ret.append("begin\n\n");

    List<String> sensitivity = new ArrayList<>();
    sensitivity.add(currentState);
    inputWidths.keySet().forEach(sensitivity::add);
    StringBuilder comb = new StringBuilder();
    comb.append("-- Combinational logic for next state and outputs\n");
    comb.append("process (" + String.join(", ", sensitivity) + ")\n");
    comb.append("begin\n\n");
    comb.append(tab + "-- Next State Logic\n");
    for (int bit = 0; bit < encoding.getWidth(); ++bit)
      comb.append(tab + CreateAssign(nextState + "(" + bit + ")", logic.getNextState().get(bit), inputWidths));
    comb.append("\n" + tab + "-- Output Logic\n");
    if (table.getOutputs().isEmpty())
      comb.append(tab + "-- No outputs declared.\n");
    for (Signal sig : table.getOutputs()) {
      List<BoolExpr> bits = logic.getOutputs().get(sig.name);
      for (int bit = 0; bit < sig.width; ++bit)
        comb.append(tab + CreateAssign(CreateBitSelect(sig.name, bit, sig.width), bits.get(bit), inputWidths));
    }
    comb.append("end process;\n\n");
    ret.append(AlignText(tab, comb.toString()));

    ret.append(AlignText(tab, CreateStateRegister(encoding.bitsOf(table.getInitialState()))));
    ret.append("\n" + GetDict(DictWords.endmodule) + " Behavioral;\n");
    return ret.toString();
  }

  private String CreatePort(String name, boolean input, int width, int pad) {
    String dir = input ? GetDict(DictWords.in) + " " : GetDict(DictWords.out);
    return String.format("%-" + pad + "s : %s %s", name, dir, CreateType(width));
  }

  private String CreateAssign(String target, BoolExpr sop, Map<String, Integer> inputWidths) {
    return target + " " + GetDict(DictWords.assign_eq) + " " + CreateSOP(sop, inputWidths) + ";\n";
  }

  /**
   * Generates the clocked process that loads next_state and forces the reset code.
   */
  public String CreateStateRegister(String resetBits) {
    String resetValue = CreateBitString(resetBits);
    StringBuilder ret = new StringBuilder();
    ret.append("-- State Register (Sequential logic)\n");
    if (resetStyle == ResetStyle.async) {
      ret.append("process (" + clk + ", " + reset + ")\n");
      ret.append("begin\n");
      ret.append(tab + "if " + reset + " = '1' then\n");
      ret.append(tab + tab + currentState + " <= " + resetValue + "; -- Reset state\n");
      ret.append(tab + "elsif rising_edge(" + clk + ") then\n");
      ret.append(tab + tab + currentState + " <= " + nextState + ";\n");
      ret.append(tab + "end if;\n");
    } else {
      ret.append("process (" + clk + ")\n");
      ret.append("begin\n");
      ret.append(tab + "if rising_edge(" + clk + ") then\n");
      ret.append(tab + tab + "if " + reset + " = '1' then\n");
      ret.append(tab + tab + tab + currentState + " <= " + resetValue + "; -- Reset state\n");
      ret.append(tab + tab + "else\n");
      ret.append(tab + tab + tab + currentState + " <= " + nextState + ";\n");
      ret.append(tab + tab + "end if;\n");
      ret.append(tab + "end if;\n");
    }
    ret.append("end process;\n");
    return ret.toString();
  }

  private String CreateHeader(String entityName, StateTable table, StateEncoding encoding) {
    String c = GetDict(DictWords.comment);
    StringBuilder ret = new StringBuilder();
    ret.append(c + " Finite state machine '" + entityName + "', generated by ASMSynth.\n");
    ret.append(c + "\n");
    ret.append(c + " State encoding (" + encoding.getPolicy().serialName + ", " + encoding.getWidth() + " bit" +
               (encoding.getWidth() == 1 ? "" : "s") + "):\n");
    for (String state : encoding.getCodes().keySet())
      ret.append(c + "   " + state + " = " + CreateBitString(encoding.bitsOf(state)) + (state.equals(table.getInitialState()) ? " (reset)" : "") +
                 "\n");
    boolean merged = false;
    for (StateTable.Row row : table.getRows().values()) {
      if (row.members.size() < 2)
        continue;
      if (!merged)
        ret.append(c + " Merged equivalent states:\n");
      merged = true;
      ret.append(c + "   " + row.stateId + " <- " + String.join(", ", row.members.subList(1, row.members.size())) + "\n");
    }
    ret.append(c + " Transitions of a state are taken by priority (lower value first), then declaration order.\n");
    for (StateTable.PriorityOverlap overlap : table.getOverlaps())
      ret.append(c + "   In " + overlap.stateId() + ", " + overlap.winner() + " (priority " + overlap.winnerPriority() + ") overrides " +
                 overlap.loser() + " (priority " + overlap.loserPriority() + ") where both guards hold.\n");
    ret.append(c + " If no guard holds, the state is kept.\n\n");
    return ret.toString();
  }

  //// Checks

  private void CheckIdentifiers(String entityName, StateTable table) throws CodeGenException {
    HashMap<String, String> taken = new HashMap<>();
    for (String builtin : List.of(clk, reset, currentState, nextState))
      taken.put(builtin.toLowerCase(), builtin);
    CheckIdentifier(entityName, "entity");
    List<Signal> signals = new ArrayList<>(table.getInputs());
    signals.addAll(table.getOutputs());
    for (Signal sig : signals) {
      CheckIdentifier(sig.name, "signal");
      String clash = taken.putIfAbsent(sig.name.toLowerCase(), sig.name);
      if (clash != null)
        throw new CodeGenException("Signal name '" + sig.name + "' clashes with '" + clash + "' (VHDL names are case-insensitive)", sig.name);
    }
  }

  private static void CheckIdentifier(String name, String what) throws CodeGenException {
    if (name == null || !identifier.matcher(name).matches())
      throw new CodeGenException("'" + name + "' is not a legal VHDL " + what + " name", String.valueOf(name));
    if (reserved.contains(name.toLowerCase()))
      throw new CodeGenException("'" + name + "' is a reserved word in VHDL and cannot be used as " + what + " name", name);
  }

  private void CheckEquations(StateTable table, SynthesizedLogic logic) throws CodeGenException {
    HashMap<String, Integer> inputWidths = new HashMap<>();
    table.getInputs().forEach(sig -> inputWidths.put(sig.name, sig.width));
    int stateWidth = logic.getEncoding().getWidth();
    List<BoolExpr> all = new ArrayList<>(logic.getNextState());
    for (Signal sig : table.getOutputs()) {
      List<BoolExpr> bits = logic.getOutputs().get(sig.name);
      if (bits == null || bits.size() != sig.width)
        throw new CodeGenException("Output '" + sig.name + "' has " + (bits == null ? 0 : bits.size()) + " equations for " + sig.width + " bits",
                                   sig.name);
      all.addAll(bits);
    }
    for (String name : logic.getOutputs().keySet())
      if (table.getOutputs().stream().noneMatch(sig -> sig.name.equals(name)))
        throw new CodeGenException("Equation for undeclared output '" + name + "'", name);
    for (BoolExpr eq : all) {
      for (BoolExpr.Literal lit : eq.literals()) {
        int width = SynthesizedLogic.isStateBit(lit) ? stateWidth : inputWidths.getOrDefault(lit.signal(), 0);
        if (width == 0)
          throw new CodeGenException("Equation references undeclared input '" + lit.signal() + "'", lit.signal());
        if (lit.bit() < 0 || lit.bit() >= width)
          throw new CodeGenException("Bit " + lit.bit() + " of '" + lit.signal() + "' is out of range (width " + width + ")", lit.signal());
      }
    }
  }
}
