package wavemap.netlist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ports of a submodule that no connection of an instance binds.
 */
@JsonPropertyOrder({"instance", "submodule", "missing_ports"})
public class MissingPortIssue {
  @JsonProperty("instance") private final String instance;
  @JsonProperty("submodule") private final String submodule;
  @JsonProperty("missing_ports") private final List<String> missingPorts;

  @JsonCreator
  public MissingPortIssue(@JsonProperty("instance") String instance, @JsonProperty("submodule") String submodule,
                          @JsonProperty("missing_ports") List<String> missingPorts) {
    this.instance = instance;
    this.submodule = submodule;
    this.missingPorts = Collections.unmodifiableList(new ArrayList<>(missingPorts));
  }

  public String getInstance() { return instance; }
  public String getSubmodule() { return submodule; }
  /** Unbound port names, sorted. */
  public List<String> getMissingPorts() { return missingPorts; }

  @Override
  public String toString() {
    return String.format("Instance %s (%s) is missing ports: %s", instance, submodule, String.join(", ", missingPorts));
  }
}
