package wavemap.netlist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import wavemap.frontend.ModuleDecl;

/**
 * Everything the system analysis found, in the form written to <code>&lt;prefix&gt;_system.json</code>.
 */
@JsonPropertyOrder({"top_module", "modules", "connections_direct", "connections_flattened", "missing_connectivity", "width_mismatches",
                    "issues"})
public class SystemReport {
  /** Ports and internal signals of one module. */
  @JsonPropertyOrder({"ports", "signals"})
  public static class ModuleSummary {
    @JsonProperty("ports") private final List<String> ports;
    @JsonProperty("signals") private final List<String> signals;

    @JsonCreator
    public ModuleSummary(@JsonProperty("ports") List<String> ports, @JsonProperty("signals") List<String> signals) {
      this.ports = ports == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(ports));
      this.signals = signals == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(signals));
    }

    public static ModuleSummary of(ModuleDecl module) {
      return new ModuleSummary(new ArrayList<>(module.getPorts()), new ArrayList<>(module.getSignals()));
    }

    public List<String> getPorts() { return ports; }
    public List<String> getSignals() { return signals; }
  }

  @JsonProperty("top_module") private final String topModule;
  @JsonProperty("modules") private final Map<String, ModuleSummary> modules;
  @JsonProperty("connections_direct") private final List<Connection> directConnections;
  @JsonProperty("connections_flattened") private final List<FlattenedConnection> flattenedConnections;
  @JsonProperty("missing_connectivity") private final List<MissingPortIssue> missingPorts;
  @JsonProperty("width_mismatches") private final List<WidthMismatch> widthMismatches;
  @JsonProperty("issues") private final List<AnalysisIssue> issues;

  @JsonCreator
  public SystemReport(@JsonProperty("top_module") String topModule, @JsonProperty("modules") Map<String, ModuleSummary> modules,
                      @JsonProperty("connections_direct") List<Connection> directConnections,
                      @JsonProperty("connections_flattened") List<FlattenedConnection> flattenedConnections,
                      @JsonProperty("missing_connectivity") List<MissingPortIssue> missingPorts,
                      @JsonProperty("width_mismatches") List<WidthMismatch> widthMismatches,
                      @JsonProperty("issues") List<AnalysisIssue> issues) {
    this.topModule = topModule;
    this.modules = modules == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(modules));
    this.directConnections = copy(directConnections);
    this.flattenedConnections = copy(flattenedConnections);
    this.missingPorts = copy(missingPorts);
    this.widthMismatches = copy(widthMismatches);
    this.issues = copy(issues);
  }

  private static <T> List<T> copy(List<T> list) {
    return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
  }

  /** Most likely top-level module, null if no module was found. */
  public String getTopModule() { return topModule; }
  public Map<String, ModuleSummary> getModules() { return modules; }
  public List<Connection> getDirectConnections() { return directConnections; }
  public List<FlattenedConnection> getFlattenedConnections() { return flattenedConnections; }
  public List<MissingPortIssue> getMissingPorts() { return missingPorts; }
  public List<WidthMismatch> getWidthMismatches() { return widthMismatches; }
  public List<AnalysisIssue> getIssues() { return issues; }
}
