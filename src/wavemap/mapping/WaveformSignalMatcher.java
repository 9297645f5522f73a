package wavemap.mapping;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assigns waveform columns to metadata signals by name: normalized name first, then last component, then the last
 * two normalized components.
 */
public class WaveformSignalMatcher {
  private WaveformSignalMatcher() {}

  /**
   * @param columns waveform column headers
   * @param signals metadata signal names
   * @return waveform column to metadata signal, in column order; unmatched columns are left out
   */
  public static Map<String, String> matchColumns(Collection<String> columns, Collection<String> signals) {
    Map<String, String> byKey = new LinkedHashMap<>();
    for (String signal : signals) {
      byKey.put(SignalNames.normalize(signal), signal);
      byKey.put(signal.substring(signal.lastIndexOf('.') + 1).toLowerCase(), signal);
    }

    Map<String, String> ret = new LinkedHashMap<>();
    for (String column : columns) {
      String signal = byKey.get(SignalNames.normalize(column));
      if (signal == null)
        signal = byKey.get(SignalNames.lastComponent(column));
      if (signal == null) {
        String twoLevel = SignalNames.lastTwoComponents(column);
        if (twoLevel != null)
          signal = byKey.get(twoLevel);
      }
      if (signal != null)
        ret.put(column, signal);
    }
    return ret;
  }

  /**
   * @param columns waveform column headers
   * @param signals metadata signal names
   * @return metadata signal to the first waveform column matched to it
   */
  public static Map<String, String> directColumns(Collection<String> columns, Collection<String> signals) {
    Map<String, String> ret = new LinkedHashMap<>();
    matchColumns(columns, signals).forEach((column, signal) -> ret.putIfAbsent(signal, column));
    return ret;
  }
}
