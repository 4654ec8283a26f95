package asmsynth.encode;

import asmsynth.diag.EncodingException;
import asmsynth.table.StateTable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Assigns codes to the rows of a state table. Implementations must be deterministic: the same table always yields the same
 * encoding.
 */
public interface StateEncoder {

  StateEncoding encode(StateTable table) throws EncodingException;

  /**
   * Breadth-first discovery order from the initial state, following each row's transitions by rank.
   * Rows not reached this way (none, for a validated chart) are appended in table order.
   */
  public static List<String> discoveryOrder(StateTable table) {
    LinkedHashSet<String> seen = new LinkedHashSet<>();
    ArrayDeque<String> queue = new ArrayDeque<>();
    seen.add(table.getInitialState());
    queue.add(table.getInitialState());
    while (!queue.isEmpty()) {
      StateTable.Row row = table.getRow(queue.poll());
      for (StateTable.Entry entry : row.entries)
        if (seen.add(entry.target))
          queue.add(entry.target);
    }
    seen.addAll(table.getRows().keySet());
    return new ArrayList<>(seen);
  }

  /** Helper for encoders that derive the code from the discovery index. */
  public static LinkedHashMap<String, Long> byIndex(List<String> order, java.util.function.IntToLongFunction codeOfIndex) {
    LinkedHashMap<String, Long> codes = new LinkedHashMap<>();
    for (int i = 0; i < order.size(); ++i)
      codes.put(order.get(i), codeOfIndex.applyAsLong(i));
    return codes;
  }
}
