package wavemap.mapping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavemap.netlist.AnalysisIssue;
import wavemap.util.Vocabulary;

/**
 * Lays out the mapped table: time column, clock column, then every metadata signal in metadata order.
 * Values of signals without observation are taken from connected columns through the {@link ValueResolver}.
 */
public class TableAssembler {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String DEFAULT_TIME_PREFIX = "time_";
  public static final String DEFAULT_CLOCK_LABEL = "clock";
  public static final String DEFAULT_LABEL = "other";

  private final String timeColumnPrefix;
  private final String clockLabel;
  private final String defaultLabel;
  private final Vocabulary vocabulary;

  public TableAssembler(String timeColumnPrefix, String clockLabel, String defaultLabel, Vocabulary vocabulary) {
    this.timeColumnPrefix = timeColumnPrefix;
    this.clockLabel = clockLabel;
    this.defaultLabel = defaultLabel;
    this.vocabulary = vocabulary;
  }

  public TableAssembler() { this(DEFAULT_TIME_PREFIX, DEFAULT_CLOCK_LABEL, DEFAULT_LABEL, Vocabulary.getDefault()); }

  /**
   * Builds the mapped table.
   * @param metadata signals to report, with their labels
   * @param waveform sampled values
   * @param connectionMap wiring used to fill unobserved signals, may be empty
   * @return the table, the substitutions made and one issue per skipped row
   * @throws WaveformMappingException if neither the header nor any row has a time column
   */
  public MappingResult assemble(SignalMetadata metadata, WaveformTable waveform, ConnectionMap connectionMap)
      throws WaveformMappingException {
    Map<String, String> direct = WaveformSignalMatcher.directColumns(waveform.getColumns(), metadata.getSignals());
    String clock = findClock(metadata, WaveformSignalMatcher.matchColumns(waveform.getColumns(), metadata.getSignals()));
    ValueResolver resolver = new ValueResolver(connectionMap, vocabulary);

    List<String> others = new ArrayList<>(metadata.getSignals());
    if (clock != null)
      others.remove(clock);

    String timeColumn = findTimeColumn(waveform.getColumns());
    List<List<String>> rows = new ArrayList<>();
    List<Resolution> substitutions = new ArrayList<>();
    Set<String> substituted = new HashSet<>();
    List<AnalysisIssue> issues = new ArrayList<>();
    List<Map<String, String>> samples = waveform.getRows();
    for (int i = 0; i < samples.size(); ++i) {
      Map<String, String> sample = samples.get(i);
      Optional<String> rowTime = timeColumn != null && sample.containsKey(timeColumn) ? Optional.of(timeColumn)
                                                                                      : Optional.ofNullable(findTimeColumn(sample.keySet()));
      if (rowTime.isEmpty()) {
        logger.warn("Skipping sample {}: no {}* column", i + 1, timeColumnPrefix);
        issues.add(new AnalysisIssue(AnalysisIssue.Kind.MISSING_TIME_COLUMN, "row " + (i + 1), "no column starting with " + timeColumnPrefix));
        continue;
      }
      if (timeColumn == null)
        timeColumn = rowTime.get();

      List<String> row = new ArrayList<>();
      row.add(sample.get(rowTime.get()));
      if (clock != null)
        row.add(sample.getOrDefault(direct.get(clock), ""));
      for (String signal : others) {
        String column = direct.get(signal);
        String value = column == null ? "" : sample.getOrDefault(column, "");
        if (!connectionMap.isEmpty()) {
          Optional<Resolution> resolution = resolver.resolve(signal, value, sample);
          if (resolution.isPresent()) {
            value = resolution.get().getValue();
            if (substituted.add(signal)) {
              logger.info("Filled {} from {}", signal, resolution.get().getSourceColumn());
              substitutions.add(resolution.get());
            }
          }
        }
        row.add(value);
      }
      rows.add(row);
    }
    if (timeColumn == null)
      throw new WaveformMappingException("No column starting with " + timeColumnPrefix + " in the header or any sample");

    List<String> header = new ArrayList<>();
    List<String> classes = new ArrayList<>();
    header.add(timeColumn);
    classes.add("");
    if (clock != null) {
      header.add(clock);
      classes.add(clockLabel);
    }
    for (String signal : others) {
      header.add(signal);
      classes.add(metadata.getLabel(signal, defaultLabel));
    }
    logger.debug("Assembled {} row(s) of {} column(s), clock: {}", rows.size(), header.size(), clock);
    return new MappingResult(new OutputTable(classes, header, rows), substitutions, issues);
  }

  private String findTimeColumn(Collection<String> columns) {
    for (String column : columns) {
      if (column.startsWith(timeColumnPrefix))
        return column;
    }
    return null;
  }

  /** First clock signal, in waveform column order, that has a column of its own. */
  private static String findClock(SignalMetadata metadata, Map<String, String> columnToSignal) {
    for (String signal : columnToSignal.values()) {
      if (metadata.getClocks().contains(signal))
        return signal;
    }
    return null;
  }
}
