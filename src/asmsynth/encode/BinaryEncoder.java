package asmsynth.encode;

import asmsynth.table.StateTable;
import asmsynth.util.Log2;
import java.util.List;

/**
 * Sequential binary codes in discovery order, the initial state getting all zeros.
 */
public class BinaryEncoder implements StateEncoder {
  @Override
  public StateEncoding encode(StateTable table) {
    List<String> order = StateEncoder.discoveryOrder(table);
    return new StateEncoding(EncodingPolicy.binary, Log2.codeWidth(order.size()), StateEncoder.byIndex(order, i -> i));
  }
}
