package wavemap.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classification of the RTL signals to report: signal name to label, in file order.
 */
public class SignalMetadata {
  private final String module;
  private final Map<String, String> labels;
  private final List<String> clocks;

  /**
   * @param module module the signals belong to, may be null
   * @param labels signal to classification label
   * @param clockLabel label marking clock signals, compared case-insensitively
   */
  public SignalMetadata(String module, Map<String, String> labels, String clockLabel) {
    this.module = module;
    this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    List<String> clocks = new ArrayList<>();
    labels.forEach((signal, label) -> {
      if (label.equalsIgnoreCase(clockLabel))
        clocks.add(signal);
    });
    this.clocks = Collections.unmodifiableList(clocks);
  }

  public String getModule() { return module; }
  public Map<String, String> getLabels() { return labels; }
  public List<String> getSignals() { return new ArrayList<>(labels.keySet()); }
  /** Signals labeled as clock, in file order. */
  public List<String> getClocks() { return clocks; }

  public String getLabel(String signal, String defaultLabel) { return labels.getOrDefault(signal, defaultLabel); }
}
