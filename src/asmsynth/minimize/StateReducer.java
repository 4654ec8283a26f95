package asmsynth.minimize;

import asmsynth.diag.MinimizationTimeoutException;
import asmsynth.logic.Bdd;
import asmsynth.table.StateTable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Merges behaviorally equivalent states by Moore-style partition refinement.
 * <p>
 * The initial partition groups states with identical output functions. Each round takes every block from a worklist and
 * splits it by the signature of its members: for every current block, the condition under which the member moves into it.
 * Conditions and output functions are compared as canonical BDDs, so two states agree iff they agree for every input
 * assignment. The loop is fused at state count + 1 rounds; hitting the fuse is an internal error.
 */
public class StateReducer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public StateTable reduce(StateTable table) throws MinimizationTimeoutException { return reduce(table, table.size() + 1); }

  /** @param roundFuse maximum number of refinement rounds; only lowered by tests */
  StateTable reduce(StateTable table, int roundFuse) throws MinimizationTimeoutException {
    List<String> order = new ArrayList<>(table.getRows().keySet());
    Bdd bdd = new Bdd();
    table.getInputBits().forEach(bdd::varOf);

    // Output signature and per-target transition conditions of every state
    HashMap<String, List<Integer>> outputSignature = new HashMap<>();
    HashMap<String, LinkedHashMap<String, Integer>> conditions = new HashMap<>();
    for (StateTable.Row row : table.getRows().values()) {
      List<Integer> outSig = new ArrayList<>();
      row.outputs.values().forEach(bits -> bits.forEach(bit -> outSig.add(bdd.build(bit))));
      outputSignature.put(row.stateId, outSig);
      LinkedHashMap<String, Integer> rowConditions = new LinkedHashMap<>();
      for (StateTable.Entry entry : row.entries)
        rowConditions.merge(entry.target, bdd.build(entry.selectCondition), bdd::or);
      rowConditions.merge(row.stateId, bdd.build(row.holdCondition), bdd::or);
      conditions.put(row.stateId, rowConditions);
    }

    LinkedHashMap<List<Integer>, List<String>> initialBlocks = new LinkedHashMap<>();
    for (String state : order)
      initialBlocks.computeIfAbsent(outputSignature.get(state), sig_ -> new ArrayList<>()).add(state);
    List<List<String>> blocks = new ArrayList<>(initialBlocks.values());

    int rounds = 0;
    while (true) {
      if (++rounds > roundFuse)
        throw new MinimizationTimeoutException(rounds - 1, table.size());
      HashMap<String, Integer> blockOf = indexBlocks(blocks);
      ArrayDeque<List<String>> worklist = new ArrayDeque<>(blocks);
      List<List<String>> refined = new ArrayList<>();
      boolean split = false;
      while (!worklist.isEmpty()) {
        List<String> block = worklist.poll();
        if (block.size() == 1) {
          refined.add(block);
          continue;
        }
        LinkedHashMap<Map<Integer, Integer>, List<String>> bySignature = new LinkedHashMap<>();
        for (String state : block) {
          TreeMap<Integer, Integer> signature = new TreeMap<>();
          conditions.get(state).forEach((target, cond) -> signature.merge(blockOf.get(target), cond, bdd::or));
          signature.values().removeIf(cond -> cond == Bdd.FALSE);
          bySignature.computeIfAbsent(signature, sig_ -> new ArrayList<>()).add(state);
        }
        if (bySignature.size() > 1)
          split = true;
        refined.addAll(bySignature.values());
      }
      blocks = refined;
      if (!split)
        break;
    }
    logger.debug("Minimizer. Partition stable after {} round(s): {}", rounds, blocks);

    if (blocks.size() == table.size())
      return table;

    blocks.sort(Comparator.comparingInt(block -> order.indexOf(block.get(0))));
    HashMap<String, String> representative = new HashMap<>();
    for (List<String> block : blocks)
      for (String state : block)
        representative.put(state, block.get(0));

    List<StateTable.Row> rows = new ArrayList<>();
    for (List<String> block : blocks) {
      StateTable.Row rep = table.getRow(block.get(0));
      List<StateTable.Entry> entries = rep.entries.stream().map(entry -> entry.withTarget(representative.get(entry.target))).toList();
      List<String> members = new ArrayList<>();
      for (String state : block)
        members.addAll(table.getRow(state).members);
      if (block.size() > 1)
        logger.info("Minimizer. Merged equivalent states {} into '{}'", block, rep.stateId);
      rows.add(new StateTable.Row(rep.stateId, entries, rep.holdCondition, rep.outputs, members));
    }
    List<StateTable.PriorityOverlap> overlaps =
        table.getOverlaps().stream().filter(overlap -> representative.get(overlap.stateId()).equals(overlap.stateId())).toList();
    return new StateTable(table.getName(), table.getInputs(), table.getOutputs(), rows, representative.get(table.getInitialState()),
                          overlaps, table.getWarnings());
  }

  private static HashMap<String, Integer> indexBlocks(List<List<String>> blocks) {
    HashMap<String, Integer> ret = new HashMap<>();
    for (int i = 0; i < blocks.size(); ++i)
      for (String state : blocks.get(i))
        ret.put(state, i);
    return ret;
  }
}
