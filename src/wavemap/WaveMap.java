package wavemap;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavemap.frontend.ModuleScanner;
import wavemap.frontend.RtlParseException;
import wavemap.frontend.RtlSource;
import wavemap.mapping.ConnectionMap;
import wavemap.mapping.ConnectionMapBuilder;
import wavemap.mapping.MappingResult;
import wavemap.mapping.MetadataLoader;
import wavemap.mapping.SignalMetadata;
import wavemap.mapping.TableAssembler;
import wavemap.mapping.WaveformLoader;
import wavemap.mapping.WaveformMappingException;
import wavemap.mapping.WaveformTable;
import wavemap.netlist.AnalysisIssue;
import wavemap.netlist.ConnectivityFlattener;
import wavemap.netlist.ConnectivityGraph;
import wavemap.netlist.ConnectivityGraphBuilder;
import wavemap.netlist.FlattenedConnection;
import wavemap.netlist.MissingPortIssue;
import wavemap.netlist.StructuralValidator;
import wavemap.netlist.SystemReport;
import wavemap.netlist.SystemReportIO;
import wavemap.netlist.WidthChecker;
import wavemap.netlist.WidthMismatch;
import wavemap.ui.WaveMapConfig;
import wavemap.util.Vocabulary;

/**
 * Entry point of both pipelines: system analysis of RTL files and mapping of waveform samples onto RTL signals.
 */
public class WaveMap {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final WaveMapConfig cfg;
  private final Vocabulary vocabulary;

  public WaveMap(WaveMapConfig cfg, Vocabulary vocabulary) {
    this.cfg = cfg;
    this.vocabulary = vocabulary;
  }

  public WaveMap() { this(new WaveMapConfig(), Vocabulary.getDefault()); }

  /**
   * Reads and analyzes RTL files. Unreadable files are reported in the result and skipped.
   * @param rtlFiles files in processing order
   * @return the system report
   */
  public SystemReport analyzeSystem(List<Path> rtlFiles) {
    List<RtlSource> sources = new ArrayList<>();
    List<AnalysisIssue> readIssues = new ArrayList<>();
    for (Path file : rtlFiles) {
      try {
        sources.add(RtlSource.read(file));
      } catch (IOException e) {
        logger.error("Cannot read {}: {}", file, e.getMessage());
        readIssues.add(new AnalysisIssue(AnalysisIssue.Kind.UNREADABLE_FILE, file.toString(), String.valueOf(e.getMessage())));
      }
    }
    return analyzeSources(sources, readIssues);
  }

  public SystemReport analyzeSources(List<RtlSource> sources) { return analyzeSources(sources, List.of()); }

  private SystemReport analyzeSources(List<RtlSource> sources, List<AnalysisIssue> readIssues) {
    ConnectivityGraph graph = new ConnectivityGraphBuilder(vocabulary, cfg.strict_port_blocks).build(sources);
    List<FlattenedConnection> flattened = ConnectivityFlattener.flatten(graph.getConnections(), cfg.flatten_passes);
    List<MissingPortIssue> missing = StructuralValidator.findMissingPorts(graph);

    ModuleScanner scanner = new ModuleScanner();
    WidthChecker widthChecker = new WidthChecker(vocabulary);
    List<WidthMismatch> mismatches = new ArrayList<>();
    List<AnalysisIssue> widthIssues = new ArrayList<>();
    for (RtlSource source : sources) {
      try {
        mismatches.addAll(widthChecker.check(source, scanner.findModuleName(source)));
      } catch (RtlParseException e) {
        logger.debug("No width check for {}: {}", source.getName(), e.getMessage());
      } catch (RuntimeException e) {
        logger.error("Width check of {} failed: {}", source.getName(), e.toString());
        logger.debug("Stack trace:", e);
        widthIssues.add(new AnalysisIssue(AnalysisIssue.Kind.WIDTH_CHECK_FAILED, source.getName(), e.toString()));
      }
    }

    Map<String, SystemReport.ModuleSummary> modules = new LinkedHashMap<>();
    graph.getModules().forEach((name, module) -> modules.put(name, SystemReport.ModuleSummary.of(module)));
    List<AnalysisIssue> issues = new ArrayList<>(readIssues);
    issues.addAll(graph.getIssues());
    issues.addAll(widthIssues);
    String top = graph.findTopModule().orElse(null);
    logger.info("Top module: {}; {} flattened link(s), {} instance(s) with missing ports, {} width mismatch(es)", top,
                flattened.size(), missing.size(), mismatches.size());
    return new SystemReport(top, modules, graph.getConnections(), flattened, missing, mismatches, issues);
  }

  /**
   * Maps sampled values onto the metadata signals.
   * @param metadata signals to report
   * @param waveform sampled values
   * @param report system analysis used to fill unobserved signals, null to use observed values only
   * @return the mapped table
   * @throws WaveformMappingException if neither the waveform header nor any sample has a time column
   */
  public MappingResult mapWaveform(SignalMetadata metadata, WaveformTable waveform, SystemReport report) throws WaveformMappingException {
    ConnectionMap connectionMap = report == null ? ConnectionMap.empty() : ConnectionMapBuilder.build(report, cfg.include_flattened);
    TableAssembler assembler = new TableAssembler(cfg.time_column_prefix, cfg.clock_label, cfg.default_label, vocabulary);
    MappingResult ret = assembler.assemble(metadata, waveform, connectionMap);
    for (AnalysisIssue issue : ret.getIssues())
      logger.warn(issue);
    return ret;
  }

  /**
   * File based variant of {@link #mapWaveform(SignalMetadata, WaveformTable, SystemReport)}.
   * @param systemReport system report JSON, may be null
   */
  public MappingResult mapWaveform(Path metadataFile, Path waveformFile, Path systemReport) throws IOException, WaveformMappingException {
    SignalMetadata metadata = new MetadataLoader(cfg.clock_label).load(metadataFile);
    WaveformTable waveform = WaveformLoader.load(waveformFile);
    SystemReport report = systemReport == null ? null : SystemReportIO.read(systemReport);
    return mapWaveform(metadata, waveform, report);
  }
}
