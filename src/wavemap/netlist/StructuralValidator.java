package wavemap.netlist;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavemap.frontend.ModuleDecl;

/**
 * Connectivity check: reports instances that leave ports of their submodule unbound.
 * Instances of modules without a known declaration are not checked.
 */
public class StructuralValidator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private StructuralValidator() {}

  private static class BoundPorts {
    final String submodule;
    final Set<String> ports = new TreeSet<>();
    BoundPorts(String submodule) { this.submodule = submodule; }
  }

  public static List<MissingPortIssue> findMissingPorts(ConnectivityGraph graph) {
    return findMissingPorts(graph.getModules(), graph.getConnections());
  }

  /**
   * Compares the ports bound across all connections of each instance name with the ports its submodule declares.
   * @param modules known module declarations
   * @param connections direct connections
   * @return one issue per instance with unbound ports, in order of the instance's first connection
   */
  public static List<MissingPortIssue> findMissingPorts(Map<String, ModuleDecl> modules, List<Connection> connections) {
    Map<String, BoundPorts> byInstance = new LinkedHashMap<>();
    for (Connection connection : connections) {
      byInstance.computeIfAbsent(connection.getInstance(), instance -> new BoundPorts(connection.getChildModule()))
          .ports.add(connection.getChildPort());
    }

    List<MissingPortIssue> ret = new ArrayList<>();
    byInstance.forEach((instance, bound) -> {
      ModuleDecl submodule = modules.get(bound.submodule);
      if (submodule == null) {
        logger.debug("No declaration of {} known, not checking ports of {}", bound.submodule, instance);
        return;
      }
      Set<String> missing = new TreeSet<>(submodule.getPorts());
      missing.removeAll(bound.ports);
      if (!missing.isEmpty()) {
        MissingPortIssue issue = new MissingPortIssue(instance, bound.submodule, new ArrayList<>(missing));
        logger.warn(issue);
        ret.add(issue);
      }
    });
    return ret;
  }
}
