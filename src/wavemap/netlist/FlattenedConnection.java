package wavemap.netlist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/**
 * A connection threaded through one intermediate instance:
 * <code>fromModule</code> binds <code>fromSignalExpr</code> to a port of <code>viaInstance</code> (a <code>viaModule</code>),
 * and inside <code>viaModule</code> that port reaches <code>toSignal</code> of <code>toInstance</code> (a <code>toModule</code>)
 * through the expression <code>innerExpr</code>.
 */
@JsonPropertyOrder({"from_module", "from_signal_expr", "to_module", "to_signal", "via_instance", "via_module", "to_instance",
                    "inner_expr"})
public class FlattenedConnection {
  @JsonProperty("from_module") private final String fromModule;
  @JsonProperty("from_signal_expr") private final String fromSignalExpr;
  @JsonProperty("to_module") private final String toModule;
  @JsonProperty("to_signal") private final String toSignal;
  @JsonProperty("via_instance") private final String viaInstance;
  @JsonProperty("via_module") private final String viaModule;
  @JsonProperty("to_instance") private final String toInstance;
  @JsonProperty("inner_expr") private final String innerExpr;

  @JsonCreator
  public FlattenedConnection(@JsonProperty("from_module") String fromModule, @JsonProperty("from_signal_expr") String fromSignalExpr,
                             @JsonProperty("to_module") String toModule, @JsonProperty("to_signal") String toSignal,
                             @JsonProperty("via_instance") String viaInstance, @JsonProperty("via_module") String viaModule,
                             @JsonProperty("to_instance") String toInstance, @JsonProperty("inner_expr") String innerExpr) {
    this.fromModule = fromModule;
    this.fromSignalExpr = fromSignalExpr;
    this.toModule = toModule;
    this.toSignal = toSignal;
    this.viaInstance = viaInstance;
    this.viaModule = viaModule;
    this.toInstance = toInstance;
    this.innerExpr = innerExpr;
  }

  public String getFromModule() { return fromModule; }
  public String getFromSignalExpr() { return fromSignalExpr; }
  public String getToModule() { return toModule; }
  public String getToSignal() { return toSignal; }
  public String getViaInstance() { return viaInstance; }
  public String getViaModule() { return viaModule; }
  public String getToInstance() { return toInstance; }
  public String getInnerExpr() { return innerExpr; }

  /**
   * Views this link as a direct connection from <code>fromModule</code> into <code>toModule</code>, with the hierarchical
   * instance path <code>viaInstance.toInstance</code> as instance name.
   * Feeding these back into {@link ConnectivityFlattener#flatten(java.util.List)} resolves one more hierarchy level.
   * @return the equivalent connection
   */
  public Connection asConnection() {
    String instancePath = (toInstance == null || toInstance.isEmpty()) ? viaInstance : viaInstance + "." + toInstance;
    return new Connection(fromModule, toModule, instancePath, toSignal, fromSignalExpr);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    FlattenedConnection other = (FlattenedConnection)obj;
    return Objects.equals(fromModule, other.fromModule) && Objects.equals(fromSignalExpr, other.fromSignalExpr) &&
        Objects.equals(toModule, other.toModule) && Objects.equals(toSignal, other.toSignal) &&
        Objects.equals(viaInstance, other.viaInstance) && Objects.equals(viaModule, other.viaModule) &&
        Objects.equals(toInstance, other.toInstance) && Objects.equals(innerExpr, other.innerExpr);
  }
  @Override
  public int hashCode() {
    return Objects.hash(fromModule, fromSignalExpr, toModule, toSignal, viaInstance, viaModule, toInstance, innerExpr);
  }
  @Override
  public String toString() {
    return String.format("%s.%s -> %s.%s (via %s [%s] using '%s')", fromModule, fromSignalExpr, toModule, toSignal, viaInstance,
                         viaModule, innerExpr);
  }
}
