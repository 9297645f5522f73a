package wavemap.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sampled waveform: column headers and one row per sample, each mapping header to raw value.
 * A row shorter than the header lacks the trailing columns.
 */
public class WaveformTable {
  private final List<String> columns;
  private final List<Map<String, String>> rows;

  public WaveformTable(List<String> columns, List<Map<String, String>> rows) {
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    List<Map<String, String>> copy = new ArrayList<>();
    for (Map<String, String> row : rows)
      copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
    this.rows = Collections.unmodifiableList(copy);
  }

  public List<String> getColumns() { return columns; }
  public List<Map<String, String>> getRows() { return rows; }
}
