package asmsynth.encode;

import asmsynth.table.StateTable;
import asmsynth.util.Log2;
import java.util.List;

/**
 * Reflected Gray code of the discovery index: states discovered one after another differ in one bit.
 */
public class GrayEncoder implements StateEncoder {
  @Override
  public StateEncoding encode(StateTable table) {
    List<String> order = StateEncoder.discoveryOrder(table);
    return new StateEncoding(EncodingPolicy.gray, Log2.codeWidth(order.size()), StateEncoder.byIndex(order, i -> i ^ (i >> 1)));
  }
}
