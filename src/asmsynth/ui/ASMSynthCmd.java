package asmsynth.ui;

import asmsynth.ASMSynth;
import asmsynth.CompileResult;
import asmsynth.diag.Diagnostic;
import asmsynth.encode.EncodingPolicy;
import asmsynth.frontend.ChartDescription;
import asmsynth.frontend.ChartFormatException;
import asmsynth.frontend.ChartReader;
import asmsynth.util.FileWriter;
import asmsynth.util.VHDL;
import java.io.File;
import java.io.IOException;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class ASMSynthCmd {
  // logging
  protected static Logger logger = LogManager.getLogger();

  public static final int exitOk = 0;
  public static final int exitFailure = 1;

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp("asmsynth -c <chart.yaml> - compile a state machine chart to VHDL", options);
  };

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args));
  }

  static Options createOptions() {
    Options options = new Options();
    options.addOption(Option.builder("c")
                          .longOpt("chart")
                          .argName("chart.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML or JSON file describing the state machine")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("outdir")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory to write <entity>.vhd into; 'results' by default")
                          .build());
    options.addOption(Option.builder("e")
                          .longOpt("entity")
                          .argName("name")
                          .hasArg()
                          .required(false)
                          .desc("Entity name; defaults to the chart name, or '" + ASMSynth.defaultEntityName + "'")
                          .build());
    options.addOption(Option.builder()
                          .longOpt("encoding")
                          .argName("policy")
                          .hasArg()
                          .required(false)
                          .desc("State encoding: binary (default), gray or onehot")
                          .build());
    options.addOption(Option.builder()
                          .longOpt("reset")
                          .argName("style")
                          .hasArg()
                          .required(false)
                          .desc("Reset of the state register: sync (default) or async")
                          .build());
    options.addOption(Option.builder()
                          .longOpt("exhaustive-limit")
                          .argName("n")
                          .hasArg()
                          .required(false)
                          .desc("Largest variable count decided by truth table (0-30, default 16)")
                          .build());
    options.addOption(
        Option.builder().longOpt("strict-guards").required(false).desc("Reject overlapping guards even with different priorities").build());
    options.addOption(Option.builder().longOpt("strict-outputs").required(false).desc("Reject states that leave outputs unbound").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  /**
   * Parses the arguments, compiles the chart and writes the result.
   * @return process exit code
   */
  public static int run(String[] args) {
    Options options = createOptions();
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    ASMSynthConfig cfg = new ASMSynthConfig();
    String chartFileName;
    String outputDir;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelp(options);
        return exitOk;
      }
      if (!line.hasOption("c")) {
        System.err.println("Missing required option: c");
        printHelp(options);
        return exitFailure;
      }
      chartFileName = line.getOptionValue("c");
      outputDir = (line.hasOption("o") ? line.getOptionValue("o") : "results");
      cfg.entity_name = line.getOptionValue("e");
      if (line.hasOption("encoding"))
        cfg.encoding = EncodingPolicy.parse(line.getOptionValue("encoding"));
      if (line.hasOption("reset"))
        cfg.reset_style = VHDL.ResetStyle.parse(line.getOptionValue("reset"));
      if (line.hasOption("exhaustive-limit"))
        cfg.exhaustive_variable_limit = Integer.parseInt(line.getOptionValue("exhaustive-limit"));
      if (cfg.exhaustive_variable_limit < 0 || cfg.exhaustive_variable_limit > 30)
        throw new IllegalArgumentException("--exhaustive-limit must be in [0,30]");
      cfg.require_disjoint_guards = line.hasOption("strict-guards");
      cfg.require_explicit_outputs = line.hasOption("strict-outputs");

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException | IllegalArgumentException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp(options);
      return exitFailure;
    }

    ChartDescription description;
    try {
      description = ChartReader.read(new File(chartFileName));
    } catch (IOException e) {
      logger.error("Chart file {} could not be read: {}", chartFileName, e.getMessage());
      return exitFailure;
    } catch (ChartFormatException e) {
      logger.error("Chart file {}: {}", chartFileName, e.getMessage());
      return exitFailure;
    }

    CompileResult result = new ASMSynth(cfg).compile(description);
    for (Diagnostic warning : result.getWarnings())
      logger.warn("{}", warning);
    if (!result.isSuccess()) {
      logger.error("{}", result.getDiagnostic().get());
      return exitFailure;
    }

    FileWriter toFile = new FileWriter(outputDir);
    String fileName = result.getEntityName() + ".vhd";
    toFile.UpdateContent(fileName, result.getSource().get());
    try {
      toFile.WriteFiles();
    } catch (IOException e) {
      logger.error("Output could not be written: {}", e.getMessage());
      return exitFailure;
    }
    logger.info("Wrote {}", toFile.GetFile(fileName).getPath());
    return exitOk;
  }
}
