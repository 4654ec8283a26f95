package asmsynth.encode;

import asmsynth.diag.EncodingException;
import asmsynth.table.StateTable;
import java.util.List;

/**
 * One flip-flop per state; the i-th discovered state sets bit i.
 */
public class OneHotEncoder implements StateEncoder {
  @Override
  public StateEncoding encode(StateTable table) throws EncodingException {
    List<String> order = StateEncoder.discoveryOrder(table);
    if (order.size() > StateEncoding.maxWidth)
      throw new EncodingException("One-hot encoding of " + order.size() + " states needs " + order.size() +
                                  " state bits, at most " + StateEncoding.maxWidth + " are supported", order);
    return new StateEncoding(EncodingPolicy.onehot, order.size(), StateEncoder.byIndex(order, i -> 1L << i));
  }
}
