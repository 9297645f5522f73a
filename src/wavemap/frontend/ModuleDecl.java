package wavemap.frontend;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Boundary and internal signals of one declared module.
 */
public class ModuleDecl {
  private final String name;
  private final Set<String> ports;
  private final Set<String> signals;

  /**
   * @param name module name
   * @param ports port names in declaration order
   * @param signals internally declared wire/reg/logic/bit names
   */
  public ModuleDecl(String name, Collection<String> ports, Collection<String> signals) {
    this.name = name;
    this.ports = Collections.unmodifiableSet(new LinkedHashSet<>(ports));
    this.signals = Collections.unmodifiableSet(new LinkedHashSet<>(signals));
  }

  public String getName() { return name; }
  public Set<String> getPorts() { return ports; }
  public Set<String> getSignals() { return signals; }

  @Override
  public String toString() {
    return name + " (ports: " + String.join(", ", ports) + "; signals: " + String.join(", ", signals) + ")";
  }
}
