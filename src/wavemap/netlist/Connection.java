package wavemap.netlist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/**
 * A single port binding: <code>parentModule</code> instantiates <code>childModule</code> as <code>instance</code> and binds
 * <code>childPort</code> to the parent-side expression <code>parentSignal</code>.
 */
@JsonPropertyOrder({"parent_module", "child_module", "instance", "child_port", "parent_signal"})
public class Connection {
  @JsonProperty("parent_module") private final String parentModule;
  @JsonProperty("child_module") private final String childModule;
  @JsonProperty("instance") private final String instance;
  @JsonProperty("child_port") private final String childPort;
  @JsonProperty("parent_signal") private final String parentSignal;

  @JsonCreator
  public Connection(@JsonProperty("parent_module") String parentModule, @JsonProperty("child_module") String childModule,
                    @JsonProperty("instance") String instance, @JsonProperty("child_port") String childPort,
                    @JsonProperty("parent_signal") String parentSignal) {
    this.parentModule = parentModule;
    this.childModule = childModule;
    this.instance = instance;
    this.childPort = childPort;
    this.parentSignal = parentSignal;
  }

  public String getParentModule() { return parentModule; }
  public String getChildModule() { return childModule; }
  public String getInstance() { return instance; }
  public String getChildPort() { return childPort; }
  /** The raw parent-side expression; may be an identifier, a slice, a concatenation or a constant. */
  public String getParentSignal() { return parentSignal; }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Connection other = (Connection)obj;
    return Objects.equals(parentModule, other.parentModule) && Objects.equals(childModule, other.childModule) &&
        Objects.equals(instance, other.instance) && Objects.equals(childPort, other.childPort) &&
        Objects.equals(parentSignal, other.parentSignal);
  }
  @Override
  public int hashCode() {
    return Objects.hash(parentModule, childModule, instance, childPort, parentSignal);
  }
  @Override
  public String toString() {
    return String.format("%s.%s -> %s (submodule: %s, parent: %s)", instance, childPort, parentSignal, childModule, parentModule);
  }
}
