package wavemap.mapping;

/**
 * A value copied into an unobserved signal from a connected waveform column.
 */
public class Resolution {
  private final String signal;
  private final String sourceColumn;
  private final MatchStrategy strategy;
  private final String value;

  public Resolution(String signal, String sourceColumn, MatchStrategy strategy, String value) {
    this.signal = signal;
    this.sourceColumn = sourceColumn;
    this.strategy = strategy;
    this.value = value;
  }

  /** The filled metadata signal. */
  public String getSignal() { return signal; }
  public String getSourceColumn() { return sourceColumn; }
  public MatchStrategy getStrategy() { return strategy; }
  public String getValue() { return value; }

  @Override
  public String toString() {
    return String.format("%s <- %s (%s)", signal, sourceColumn, strategy);
  }
}
