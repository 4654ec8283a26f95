package asmsynth.encode;

import asmsynth.TestCharts;
import asmsynth.drc.ChartDRC;
import asmsynth.frontend.ChartDescription;
import asmsynth.logic.EquivalenceChecker;
import asmsynth.table.StateTable;
import asmsynth.table.StateTableBuilder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class StateEncoderTest {

  private static StateTable table(ChartDescription desc) throws Exception {
    return new StateTableBuilder(false, new EquivalenceChecker(16)).build(new ChartDRC(desc, false).Build());
  }

  @Test
  void testBinary() throws Exception {
    StateEncoding encoding = EncodingPolicy.binary.createEncoder().encode(table(TestCharts.traffic()));
    Assertions.assertEquals(2, encoding.getWidth());
    Assertions.assertEquals(Map.of("MG", 0L, "MY", 1L, "SG", 2L, "SY", 3L), encoding.getCodes());
    Assertions.assertEquals("10", encoding.bitsOf("SG"));
    Assertions.assertEquals("binary{MG=00, MY=01, SG=10, SY=11}", encoding.toString());
  }

  @Test
  void testGray() throws Exception {
    StateEncoding encoding = EncodingPolicy.gray.createEncoder().encode(table(TestCharts.traffic()));
    Assertions.assertEquals(2, encoding.getWidth());
    Assertions.assertEquals(List.of(0L, 1L, 3L, 2L), List.copyOf(encoding.getCodes().values()));
    Assertions.assertEquals(EncodingPolicy.gray, encoding.getPolicy());
  }

  @Test
  void testOneHot() throws Exception {
    StateEncoding encoding = EncodingPolicy.onehot.createEncoder().encode(table(TestCharts.traffic()));
    Assertions.assertEquals(4, encoding.getWidth());
    Assertions.assertEquals(List.of(1L, 2L, 4L, 8L), List.copyOf(encoding.getCodes().values()));
    Assertions.assertEquals("1000", encoding.bitsOf("SY"));
    Assertions.assertTrue(encoding.isUsed(4));
    Assertions.assertFalse(encoding.isUsed(0));
  }

  @Test
  void testDiscoveryOrder() throws Exception {
    // Declared A, C, B but reached A, B, C; B tries C before A
    ChartDescription desc = new ChartDescription("order")
                                .input("x")
                                .state("A")
                                .state("C")
                                .state("B")
                                .transition("t_ab", "A", "B", "x", 0)
                                .transition("t_ba", "B", "A", "x", 1)
                                .transition("t_bc", "B", "C", "not x", 0)
                                .transition("t_ca", "C", "A", "", 0)
                                .initial("A");
    StateTable table = table(desc);
    Assertions.assertEquals(List.of("A", "B", "C"), StateEncoder.discoveryOrder(table));
    StateEncoding encoding = new BinaryEncoder().encode(table);
    Assertions.assertEquals(2L, encoding.codeOf("C"));
    Assertions.assertEquals(2, encoding.getWidth());
  }

  @Test
  void testSingleState() throws Exception {
    ChartDescription desc = new ChartDescription("one").state("ONLY").initial("ONLY");
    for (EncodingPolicy policy : EncodingPolicy.values()) {
      StateEncoding encoding = policy.createEncoder().encode(table(desc));
      Assertions.assertEquals(1, encoding.getWidth(), policy.serialName);
    }
    Assertions.assertEquals(0L, new GrayEncoder().encode(table(desc)).codeOf("ONLY"));
    Assertions.assertEquals(1L, new OneHotEncoder().encode(table(desc)).codeOf("ONLY"));
  }

  @Test
  void testParse() {
    Assertions.assertEquals(EncodingPolicy.onehot, EncodingPolicy.parse("One-Hot"));
    Assertions.assertEquals(EncodingPolicy.gray, EncodingPolicy.parse(" GRAY"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> EncodingPolicy.parse("johnson"));
  }

  @Test
  void testInvalidEncoding() {
    LinkedHashMap<String, Long> codes = new LinkedHashMap<>();
    codes.put("A", 1L);
    codes.put("B", 1L);
    Assertions.assertThrows(IllegalArgumentException.class, () -> new StateEncoding(EncodingPolicy.binary, 1, codes));
    codes.put("B", 2L);
    Assertions.assertThrows(IllegalArgumentException.class, () -> new StateEncoding(EncodingPolicy.binary, 1, codes));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new StateEncoding(EncodingPolicy.binary, 0, codes));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new StateEncoding(EncodingPolicy.binary, 2, codes).codeOf("Z"));
  }
}
