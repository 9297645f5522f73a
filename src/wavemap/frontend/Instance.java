package wavemap.frontend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One instantiation site inside a parent module: <code>type instanceName ( .port(expression), ... );</code>.
 */
public class Instance {
  private final String parentModule;
  private final String moduleType;
  private final String name;
  private final Map<String, String> bindings;
  private final boolean terminated;

  /**
   * @param parentModule module whose body contains the instantiation
   * @param moduleType instantiated module type (the submodule)
   * @param name instance name
   * @param bindings child port to raw parent-side expression, in source order
   * @param terminated false iff the port-connection block ran to the end of input without a closing <code>);</code>
   */
  public Instance(String parentModule, String moduleType, String name, Map<String, String> bindings, boolean terminated) {
    this.parentModule = parentModule;
    this.moduleType = moduleType;
    this.name = name;
    this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    this.terminated = terminated;
  }

  public String getParentModule() { return parentModule; }
  public String getModuleType() { return moduleType; }
  public String getName() { return name; }
  public Map<String, String> getBindings() { return bindings; }
  public boolean isTerminated() { return terminated; }

  @Override
  public String toString() {
    return String.format("%s %s.%s%s", moduleType, parentModule, name, terminated ? "" : " (unterminated)");
  }
}
