package asmsynth;

import asmsynth.diag.ChartValidationException;
import asmsynth.diag.CompileException;
import asmsynth.diag.Diagnostic;
import asmsynth.diag.ValidationIssue;
import asmsynth.drc.ChartDRC;
import asmsynth.encode.StateEncoding;
import asmsynth.frontend.Chart;
import asmsynth.frontend.ChartDescription;
import asmsynth.logic.EquivalenceChecker;
import asmsynth.minimize.LogicMinimizer;
import asmsynth.minimize.StateReducer;
import asmsynth.minimize.SynthesizedLogic;
import asmsynth.table.StateTable;
import asmsynth.table.StateTableBuilder;
import asmsynth.ui.ASMSynthConfig;
import asmsynth.util.VHDL;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles charts to VHDL: validate, build the state table, merge equivalent states, encode, simplify the equations,
 * emit. The first failing stage ends the compilation with its diagnostic.
 * <p>
 * Instances only hold a private copy of their configuration and can be shared between threads.
 */
public class ASMSynth {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String defaultEntityName = "fsm";

  private final ASMSynthConfig cfg;

  public ASMSynth() { this(new ASMSynthConfig()); }

  public ASMSynth(ASMSynthConfig cfg) { this.cfg = cfg.copy(); }

  public CompileResult compile(ChartDescription description) {
    logger.debug("Stage validate. Chart '{}'", description.name);
    ChartDRC drc = new ChartDRC(description, cfg.require_explicit_outputs);
    Chart chart;
    try {
      chart = drc.Build();
    } catch (ChartValidationException e) {
      for (ValidationIssue issue : e.getIssues())
        logger.error("Validation. {}", issue);
      return CompileResult.failure(e.toDiagnostic(), List.of());
    }
    return compile(chart);
  }

  public CompileResult compile(Chart chart) {
    List<Diagnostic> warnings = new ArrayList<>(chart.getWarnings());
    String entityName = EntityName(chart);
    try {
      EquivalenceChecker checker = new EquivalenceChecker(cfg.exhaustive_variable_limit);

      logger.debug("Stage table. {} states", chart.getStates().size());
      StateTable table = new StateTableBuilder(cfg.require_disjoint_guards, checker).build(chart);

      logger.debug("Stage minimize. Reducing {} states", table.size());
      StateTable reduced = new StateReducer().reduce(table);

      logger.debug("Stage encode. {} states, policy {}", reduced.size(), cfg.encoding.serialName);
      StateEncoding encoding = cfg.encoding.createEncoder().encode(reduced);
      logger.debug("Encoding. {}", encoding);

      logger.debug("Stage minimize. Simplifying equations");
      SynthesizedLogic logic = new LogicMinimizer(checker).minimize(reduced, encoding);

      logger.debug("Stage emit. Entity '{}'", entityName);
      String source = new VHDL(cfg.reset_style).Generate(entityName, reduced, logic);

      logger.info("Compiled '{}': {} of {} states, {} state bit(s)", entityName, reduced.size(), table.size(), encoding.getWidth());
      return CompileResult.success(entityName, source, reduced, logic, warnings);
    } catch (CompileException e) {
      logger.error("Stage {}. {}", e.getStage(), e.getMessage());
      return CompileResult.failure(e.toDiagnostic(), warnings);
    }
  }

  private String EntityName(Chart chart) {
    if (cfg.entity_name != null && !cfg.entity_name.isEmpty())
      return cfg.entity_name;
    if (chart.getName() != null && !chart.getName().isEmpty())
      return chart.getName();
    return defaultEntityName;
  }
}
