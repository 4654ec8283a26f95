package asmsynth;

import asmsynth.diag.Diagnostic;
import asmsynth.diag.DiagnosticKind;
import asmsynth.diag.Stage;
import asmsynth.drc.ChartDRC;
import asmsynth.encode.EncodingPolicy;
import asmsynth.encode.StateEncoding;
import asmsynth.frontend.BoolExpr;
import asmsynth.frontend.Chart;
import asmsynth.frontend.ChartDescription;
import asmsynth.frontend.Signal;
import asmsynth.minimize.SynthesizedLogic;
import asmsynth.table.StateTable;
import asmsynth.ui.ASMSynthConfig;
import asmsynth.util.VHDL;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ASMSynthTest {

  @Test
  void testTrafficGolden() {
    CompileResult result = new ASMSynth().compile(TestCharts.traffic());
    Assertions.assertTrue(result.isSuccess(), () -> result.toString());
    Assertions.assertEquals(4, result.getStateCount());
    Assertions.assertEquals(2, result.getEncodingWidth());
    StateEncoding encoding = result.getEncoding();
    Assertions.assertEquals("00", encoding.bitsOf("MG"));
    Assertions.assertEquals("01", encoding.bitsOf("MY"));
    Assertions.assertEquals("10", encoding.bitsOf("SG"));
    Assertions.assertEquals("11", encoding.bitsOf("SY"));

    String source = result.getSource().get();
    for (String line :
         List.of("next_state(0) <= (not current_state(1) and not current_state(0) and T1 and car) or "
                     + "(current_state(1) and not current_state(0) and T3) or (current_state(1) and not current_state(0) and not car) or "
                     + "(current_state(0) and not T2);",
                 "next_state(1) <= (not current_state(1) and current_state(0) and T2) or (current_state(1) and not current_state(0)) or "
                     + "(current_state(1) and not T2);",
                 "main_green <= not current_state(1) and not current_state(0);",
                 "main_yellow <= not current_state(1) and current_state(0);", "side_green <= current_state(1) and not current_state(0);",
                 "side_yellow <= current_state(1) and current_state(0);"))
      Assertions.assertTrue(source.contains("        " + line + "\n"), () -> "Missing '" + line + "' in\n" + source);
    Assertions.assertTrue(source.contains("entity traffic is"));
    Assertions.assertTrue(source.contains("signal current_state, next_state : std_logic_vector(1 downto 0);"));
    Assertions.assertTrue(source.contains("process (current_state, T1, T2, T3, car)"));
    Assertions.assertTrue(source.contains("current_state <= \"00\"; -- Reset state"));
    Assertions.assertTrue(source.endsWith("end architecture Behavioral;\n"));
  }

  @Test
  void testDeterministic() {
    String first = new ASMSynth().compile(TestCharts.traffic()).getSource().get();
    for (int i = 0; i < 3; ++i)
      Assertions.assertEquals(first, new ASMSynth().compile(TestCharts.traffic()).getSource().get());
  }

  @Test
  void testEntityName() {
    ASMSynthConfig cfg = new ASMSynthConfig();
    cfg.entity_name = "light_ctrl";
    CompileResult result = new ASMSynth(cfg).compile(TestCharts.traffic());
    Assertions.assertEquals("light_ctrl", result.getEntityName());
    Assertions.assertTrue(result.getSource().get().contains("entity light_ctrl is"));

    ChartDescription unnamed = TestCharts.traffic();
    unnamed.name = "";
    Assertions.assertEquals(ASMSynth.defaultEntityName, new ASMSynth().compile(unnamed).getEntityName());
  }

  @Test
  void testConfigIsCopied() {
    ASMSynthConfig cfg = new ASMSynthConfig();
    ASMSynth synth = new ASMSynth(cfg);
    cfg.encoding = EncodingPolicy.onehot;
    Assertions.assertEquals(2, synth.compile(TestCharts.traffic()).getEncodingWidth());
  }

  @Test
  void testNonDeterminismIsReported() {
    ChartDescription desc = TestCharts.traffic().transition("t_mg_sg", "MG", "SG", "car", 0);
    CompileResult result = new ASMSynth().compile(desc);
    Assertions.assertFalse(result.isSuccess());
    Assertions.assertTrue(result.getSource().isEmpty());
    Diagnostic diag = result.getDiagnostic().get();
    Assertions.assertEquals(Stage.table, diag.stage());
    Assertions.assertEquals(DiagnosticKind.NonDeterminismError, diag.kind());
    Assertions.assertEquals(List.of("MG", "t_mg_my", "t_mg_sg"), diag.entityIds());
  }

  @Test
  void testValidationFailure() {
    ChartDescription desc = TestCharts.traffic().transition("t_bad", "MG", "NOWHERE", "T9", 1);
    CompileResult result = new ASMSynth().compile(desc);
    Assertions.assertFalse(result.isSuccess());
    Assertions.assertTrue(result.getSource().isEmpty());
    Diagnostic diag = result.getDiagnostic().get();
    Assertions.assertEquals(Stage.validate, diag.stage());
    Assertions.assertEquals(DiagnosticKind.ValidationError, diag.kind());
    Assertions.assertTrue(diag.entityIds().contains("t_bad"));
    Assertions.assertThrows(IllegalStateException.class, () -> result.getStateCount());
  }

  @Test
  void testCodeGenFailure() {
    ChartDescription desc = TestCharts.traffic().input("signal");
    CompileResult result = new ASMSynth().compile(desc);
    Assertions.assertFalse(result.isSuccess());
    Assertions.assertEquals(DiagnosticKind.CodeGenError, result.getDiagnostic().get().kind());
    Assertions.assertEquals(Stage.emit, result.getDiagnostic().get().stage());
  }

  @Test
  void testUnreachablePruned() {
    ChartDescription desc = TestCharts.traffic().state("ORPHAN", "main_green=1").transition("t_orphan", "ORPHAN", "SY", "", 0);
    CompileResult pruned = new ASMSynth().compile(desc);
    CompileResult plain = new ASMSynth().compile(TestCharts.traffic());
    Assertions.assertTrue(pruned.isSuccess());
    Assertions.assertEquals(4, pruned.getStateCount());
    Assertions.assertEquals(1, pruned.getWarnings().size());
    Diagnostic warning = pruned.getWarnings().get(0);
    Assertions.assertEquals(DiagnosticKind.UnreachableStateWarning, warning.kind());
    Assertions.assertFalse(warning.isFatal());
    Assertions.assertEquals(List.of("ORPHAN"), warning.entityIds());
    Assertions.assertEquals(plain.getLogic().getNextState(), pruned.getLogic().getNextState());
    Assertions.assertEquals(plain.getLogic().getOutputs(), pruned.getLogic().getOutputs());
  }

  @Test
  void testEquivalentStatesMerged() {
    // RUN_B behaves exactly like RUN_A
    ChartDescription desc = new ChartDescription("merge")
                                .input("go")
                                .output("busy")
                                .state("IDLE")
                                .state("RUN_A", "busy=1")
                                .state("RUN_B", "busy=1")
                                .transition("start_a", "IDLE", "RUN_A", "go", 0)
                                .transition("start_b", "IDLE", "RUN_B", "not go", 1)
                                .transition("stop_a", "RUN_A", "IDLE", "not go", 0)
                                .transition("stop_b", "RUN_B", "IDLE", "not go", 0)
                                .initial("IDLE");
    CompileResult result = new ASMSynth().compile(desc);
    Assertions.assertTrue(result.isSuccess(), () -> result.toString());
    Assertions.assertEquals(2, result.getStateCount());
    Assertions.assertEquals(1, result.getEncodingWidth());
    Assertions.assertEquals(List.of("RUN_A", "RUN_B"), result.getTable().getRow("RUN_A").members);
    Assertions.assertTrue(result.getSource().get().contains("RUN_A <- RUN_B"));
    Assertions.assertTrue(result.getSource().get().contains("        busy <= current_state(0);\n"), () -> result.getSource().get());
  }

  @Test
  void testSingleStateMachine() {
    ChartDescription desc = new ChartDescription("one").input("a").output("y").state("ONLY", "y=a").initial("ONLY");
    CompileResult result = new ASMSynth().compile(desc);
    Assertions.assertTrue(result.isSuccess(), () -> result.toString());
    Assertions.assertEquals(1, result.getEncodingWidth());
    String source = result.getSource().get();
    Assertions.assertTrue(source.contains("next_state(0) <= '0';"), source);
    Assertions.assertTrue(source.contains("y <= a;"), source);
  }

  @Test
  void testMultiBitOutputsAndAsyncReset() {
    ASMSynthConfig cfg = new ASMSynthConfig();
    cfg.reset_style = VHDL.ResetStyle.async;
    ChartDescription desc = new ChartDescription("counter")
                                .input("en")
                                .signal("count", "output", 2, 0L)
                                .state("C0")
                                .state("C1", "count=1")
                                .state("C2", "count=0b10")
                                .state("C3", "count=0x3")
                                .transition("inc0", "C0", "C1", "en", 0)
                                .transition("inc1", "C1", "C2", "en", 0)
                                .transition("inc2", "C2", "C3", "en", 0)
                                .transition("inc3", "C3", "C0", "en", 0)
                                .initial("C0");
    CompileResult result = new ASMSynth(cfg).compile(desc);
    Assertions.assertTrue(result.isSuccess(), () -> result.toString());
    String source = result.getSource().get();
    Assertions.assertTrue(source.contains("count    : out std_logic_vector(1 downto 0)"), source);
    Assertions.assertTrue(source.contains("count(0) <= current_state(0);"), source);
    Assertions.assertTrue(source.contains("count(1) <= current_state(1);"), source);
    Assertions.assertTrue(source.contains("process (clk, reset)"), source);
    Assertions.assertTrue(source.contains("elsif rising_edge(clk) then"), source);
  }

  @Test
  void testOneHotRing() throws Exception {
    ASMSynthConfig cfg = new ASMSynthConfig();
    cfg.encoding = EncodingPolicy.onehot;
    Chart chart = new ChartDRC(TestCharts.ring(10, 4), false).Build();
    CompileResult result = new ASMSynth(cfg).compile(chart);
    Assertions.assertTrue(result.isSuccess(), () -> result.toString());
    Assertions.assertEquals(10, result.getEncodingWidth());
    checkAgainstChart(chart, result);
  }

  @Test
  void testOneHotTooWide() {
    ASMSynthConfig cfg = new ASMSynthConfig();
    cfg.encoding = EncodingPolicy.onehot;
    CompileResult result = new ASMSynth(cfg).compile(TestCharts.ring(StateEncoding.maxWidth + 1, 1));
    Assertions.assertFalse(result.isSuccess());
    Assertions.assertTrue(result.getSource().isEmpty());
    Diagnostic diag = result.getDiagnostic().get();
    Assertions.assertEquals(Stage.encode, diag.stage());
    Assertions.assertEquals(DiagnosticKind.EncodingError, diag.kind());
    Assertions.assertEquals(StateEncoding.maxWidth + 1, diag.entityIds().size());
    Assertions.assertEquals("R0", diag.entityIds().get(0));

    // Binary needs only 6 bits for the same chart
    Assertions.assertTrue(new ASMSynth().compile(TestCharts.ring(StateEncoding.maxWidth + 1, 1)).isSuccess());
  }

  @RepeatedTest(32)
  void testSemanticPreservation_random() {
    long seed = new Random().nextLong();
    try {
      testSemanticPreservation(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testSemanticPreservation with seed " + seed);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {1, 42, 1234, 68392, 5893163784830298700L, -6733423670758169604L})
  void testSemanticPreservation(long seed) {
    Random rand = new Random(seed);
    ChartDescription desc = TestCharts.random(rand);
    ASMSynthConfig cfg = new ASMSynthConfig();
    cfg.encoding = EncodingPolicy.values()[rand.nextInt(EncodingPolicy.values().length)];
    cfg.exhaustive_variable_limit = List.of(0, 4, 16).get(rand.nextInt(3));

    Chart chart;
    try {
      chart = new ChartDRC(desc, false).Build();
    } catch (Exception e) {
      throw new AssertionError("Random chart is invalid", e);
    }
    CompileResult result = new ASMSynth(cfg).compile(chart);
    Assertions.assertTrue(result.isSuccess(), () -> result.toString());
    checkAgainstChart(chart, result);
  }

  /** For every state and input assignment, the equations must reproduce the chart's next state and outputs. */
  static void checkAgainstChart(Chart chart, CompileResult result) {
    StateTable table = result.getTable();
    StateEncoding encoding = result.getEncoding();
    SynthesizedLogic logic = result.getLogic();
    List<BoolExpr.Literal> bits = TestCharts.inputBits(chart);
    for (String state : chart.getStates().keySet()) {
      long code = encoding.codeOf(table.rowFor(state).stateId);
      for (long vector = 0; vector < (1L << bits.size()); ++vector) {
        Predicate<BoolExpr.Literal> inputs = TestCharts.assignment(bits, vector);
        String expectedNext = table.rowFor(TestCharts.referenceNext(chart, state, inputs)).stateId;
        long vector_ = vector;
        Assertions.assertEquals(encoding.codeOf(expectedNext), TestCharts.nextCode(logic, code, inputs),
                                () -> "Next state of " + state + " for inputs " + vector_);
        for (Signal out : chart.getOutputs()) {
          for (int bit = 0; bit < out.width; ++bit) {
            int bit_ = bit;
            Assertions.assertEquals(TestCharts.referenceOutput(chart, state, out.name, bit, inputs),
                                    TestCharts.evaluate(logic.getOutputs().get(out.name).get(bit), code, inputs),
                                    () -> "Output " + out.name + "[" + bit_ + "] in " + state + " for inputs " + vector_);
          }
        }
      }
    }
  }
}
