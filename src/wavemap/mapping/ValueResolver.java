package wavemap.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavemap.util.Vocabulary;

/**
 * Fills signals without an observed value from connected waveform columns, one row at a time.
 * <code>x</code> and <code>z</code> are values and are copied like any other; only absent values are replaced.
 */
public class ValueResolver {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** A located column. */
  public static class ColumnMatch {
    private final String column;
    private final MatchStrategy strategy;

    ColumnMatch(String column, MatchStrategy strategy) {
      this.column = column;
      this.strategy = strategy;
    }
    public String getColumn() { return column; }
    public MatchStrategy getStrategy() { return strategy; }
  }

  private final ConnectionMap connectionMap;
  private final Vocabulary vocabulary;

  public ValueResolver(ConnectionMap connectionMap, Vocabulary vocabulary) {
    this.connectionMap = connectionMap;
    this.vocabulary = vocabulary;
  }

  public ValueResolver(ConnectionMap connectionMap) { this(connectionMap, Vocabulary.getDefault()); }

  public boolean isEmpty(String value) { return vocabulary.isEmptyValue(value); }

  /**
   * Looks up a signal name among column headers with the strategies of {@link MatchStrategy}, first success wins.
   * @param name the connected name
   * @param headers column headers in table order
   * @return the first matching column, empty if no strategy matches
   */
  public static Optional<ColumnMatch> locate(String name, List<String> headers) {
    if (headers.contains(name))
      return Optional.of(new ColumnMatch(name, MatchStrategy.EXACT));
    String normalized = SignalNames.normalize(name);
    for (String header : headers) {
      if (SignalNames.normalize(header).equals(normalized))
        return Optional.of(new ColumnMatch(header, MatchStrategy.NORMALIZED));
    }
    String last = name.substring(name.lastIndexOf('.') + 1).toLowerCase();
    for (String header : headers) {
      if (SignalNames.lastComponent(header).equals(last))
        return Optional.of(new ColumnMatch(header, MatchStrategy.LAST_COMPONENT));
    }
    for (String header : headers) {
      if (header.endsWith("." + name) || header.endsWith("_" + name))
        return Optional.of(new ColumnMatch(header, MatchStrategy.SUFFIX));
    }
    return Optional.empty();
  }

  /**
   * Searches the connected names of a signal for one whose column holds a value in this row.
   * @param signal the signal without observed value
   * @param row the sampled row, column header to value
   * @return the substitution, empty if no connected column holds a value
   */
  public Optional<Resolution> findSubstitute(String signal, Map<String, String> row) {
    List<String> candidates = connectionMap.candidates(signal);
    if (candidates.isEmpty())
      return Optional.empty();
    List<String> headers = new ArrayList<>(row.keySet());
    for (String candidate : candidates) {
      Optional<ColumnMatch> match = locate(candidate, headers);
      if (match.isEmpty())
        continue;
      String value = row.get(match.get().getColumn());
      if (!isEmpty(value)) {
        logger.trace("{} filled from {} via {}", signal, match.get().getColumn(), match.get().getStrategy());
        return Optional.of(new Resolution(signal, match.get().getColumn(), match.get().getStrategy(), value));
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the observed value of a signal, or the value of a connected column if nothing was observed.
   * @param signal the signal
   * @param observed its directly matched value, null if it has no column
   * @param row the sampled row
   * @return the resolution if a connected value was used, empty if the observed value stands
   */
  public Optional<Resolution> resolve(String signal, String observed, Map<String, String> row) {
    if (!isEmpty(observed))
      return Optional.empty();
    return findSubstitute(signal, row);
  }
}
