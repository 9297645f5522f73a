package wavemap.ui;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.error.YAMLException;
import wavemap.WaveMap;
import wavemap.mapping.MappingResult;
import wavemap.mapping.OutputTable;
import wavemap.mapping.OutputTableWriter;
import wavemap.mapping.Resolution;
import wavemap.mapping.TableMerger;
import wavemap.mapping.WaveformMappingException;
import wavemap.netlist.AnalysisIssue;
import wavemap.netlist.Connection;
import wavemap.netlist.FlattenedConnection;
import wavemap.netlist.MissingPortIssue;
import wavemap.netlist.SystemReport;
import wavemap.netlist.SystemReportIO;
import wavemap.netlist.WidthMismatch;
import wavemap.util.Vocabulary;

public class WaveMapCmd {
  // logging
  protected static Logger logger = null;

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILED = 1;
  public static final int EXIT_USAGE = -1;

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static int printHelp(Options options) {
    helper.printHelp("wavemap system <rtl files...> | map -m <metadata> -w <waveform.csv> | merge <dir>"
                         + " - map waveform values onto RTL signals",
                     options);
    return EXIT_USAGE;
  }

  // entrypoint
  public static void main(String[] args) {
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stdout")));
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args));
  }

  static Options createOptions() {
    Options options = new Options();
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("file or prefix")
                          .hasArg()
                          .required(false)
                          .desc("system: prefix of <prefix>_system.json; map: mapped CSV to write; merge: merged CSV to write")
                          .build());
    options.addOption(Option.builder("m")
                          .longOpt("metadata")
                          .argName("signals.json|signals.csv")
                          .hasArg()
                          .required(false)
                          .desc("map: classification of the signals to report")
                          .build());
    options.addOption(Option.builder("w")
                          .longOpt("waveform")
                          .argName("waveform.csv")
                          .hasArg()
                          .required(false)
                          .desc("map: sampled waveform table with a time_<unit> column")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("connectivity")
                          .argName("system.json")
                          .hasArg()
                          .required(false)
                          .desc("map: system report used to fill signals without own waveform column")
                          .build());
    options.addOption(Option.builder()
                          .longOpt("rtl-name")
                          .argName("module")
                          .hasArg()
                          .required(false)
                          .desc("map: name the output <module>_mapped.csv")
                          .build());
    options.addOption(Option.builder()
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file with tool options")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  /**
   * Runs one command.
   * @param args command line
   * @return process exit code
   */
  public static int run(String[] args) {
    if (logger == null)
      logger = LogManager.getLogger();
    Options options = createOptions();
    CommandLine line;
    try {
      line = new DefaultParser().parse(options, args);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      return printHelp(options);
    }
    if (line.hasOption("h") || line.getArgList().isEmpty())
      return printHelp(options);

    // set verbosity of printing
    Level logLvl = Level.INFO;
    if (line.hasOption("q"))
      logLvl = Level.OFF;
    if (line.hasOption("v"))
      logLvl = Level.DEBUG;
    if (line.hasOption("vv"))
      logLvl = Level.TRACE;
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

    WaveMapConfig cfg;
    Vocabulary vocabulary;
    try {
      cfg = line.hasOption("config") ? WaveMapConfig.load(Path.of(line.getOptionValue("config"))) : new WaveMapConfig();
      vocabulary = cfg.loadVocabulary();
    } catch (IOException | YAMLException | IllegalArgumentException e) {
      logger.error("Cannot read configuration: {}", e.getMessage());
      return EXIT_FAILED;
    }
    WaveMap waveMap = new WaveMap(cfg, vocabulary);

    String command = line.getArgList().get(0);
    List<String> operands = line.getArgList().subList(1, line.getArgList().size());
    try {
      switch (command) {
      case "system":
        if (operands.isEmpty()) {
          System.err.println("system: no RTL files given");
          return printHelp(options);
        }
        return runSystem(waveMap, operands, line.getOptionValue("o"));
      case "map":
        if (!line.hasOption("m") || !line.hasOption("w")) {
          System.err.println("map: metadata (-m) and waveform (-w) are required");
          return printHelp(options);
        }
        return runMap(waveMap, line);
      case "merge":
        if (operands.size() != 1) {
          System.err.println("merge: expected exactly one directory");
          return printHelp(options);
        }
        Path directory = Path.of(operands.get(0));
        Path output = line.hasOption("o") ? Path.of(line.getOptionValue("o")) : directory.resolve(TableMerger.MERGED_FILE);
        OutputTable merged = TableMerger.mergeDirectory(directory, output);
        logger.info("OK: {} ({} columns)", output, merged.getWidth());
        return EXIT_OK;
      default:
        System.err.println("Unknown command " + command);
        return printHelp(options);
      }
    } catch (IOException | WaveformMappingException e) {
      logger.error("{} failed: {}", command, e.getMessage());
      logger.debug("Stack trace:", e);
      return EXIT_FAILED;
    }
  }

  private static int runSystem(WaveMap waveMap, List<String> rtlFiles, String prefix) throws IOException {
    List<Path> files = new ArrayList<>();
    for (String file : rtlFiles)
      files.add(Path.of(file));
    SystemReport report = waveMap.analyzeSystem(files);

    report.getModules().forEach(
        (name, module) -> logger.info("Module {}: {} port(s), {} signal(s)", name, module.getPorts().size(), module.getSignals().size()));
    for (Connection connection : report.getDirectConnections())
      logger.debug(connection);
    for (FlattenedConnection link : report.getFlattenedConnections())
      logger.debug(link);
    for (MissingPortIssue issue : report.getMissingPorts())
      logger.info(issue);
    for (WidthMismatch mismatch : report.getWidthMismatches())
      logger.info(mismatch);
    for (AnalysisIssue issue : report.getIssues())
      logger.warn(issue);

    if (prefix == null)
      prefix = report.getTopModule() != null ? report.getTopModule() : "wavemap";
    Path output = Path.of(prefix + "_system.json");
    SystemReportIO.write(report, output);
    logger.info("OK: {}", output);
    return report.getModules().isEmpty() ? EXIT_FAILED : EXIT_OK;
  }

  private static int runMap(WaveMap waveMap, CommandLine line) throws IOException, WaveformMappingException {
    Path waveform = Path.of(line.getOptionValue("w"));
    Path output;
    if (line.hasOption("o"))
      output = Path.of(line.getOptionValue("o"));
    else if (line.hasOption("rtl-name"))
      output = Path.of(line.getOptionValue("rtl-name") + TableMerger.MAPPED_SUFFIX);
    else
      output = Path.of(baseName(waveform.getFileName().toString()) + TableMerger.MAPPED_SUFFIX);

    Path connectivity = null;
    if (line.hasOption("c")) {
      connectivity = Path.of(line.getOptionValue("c"));
      if (!Files.exists(connectivity)) {
        logger.warn("Connectivity file {} not found, mapping without it", connectivity);
        connectivity = null;
      }
    }
    MappingResult result = waveMap.mapWaveform(Path.of(line.getOptionValue("m")), waveform, connectivity);
    for (Resolution resolution : result.getSubstitutions())
      logger.info("Filled {}", resolution);
    OutputTableWriter.write(result.getTable(), output);
    logger.info("OK: {}", output);
    return EXIT_OK;
  }

  static String baseName(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
