package wavemap.mapping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavemap.netlist.Connection;
import wavemap.netlist.FlattenedConnection;
import wavemap.netlist.SystemReport;

/**
 * Builds the {@link ConnectionMap} from port bindings.
 * Each binding relates the parent-side variants {signal, module.signal, signal without index} to the child-side
 * variants {port, instance.port, port without index}, in both directions.
 */
public class ConnectionMapBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private ConnectionMapBuilder() {}

  public static ConnectionMap build(List<Connection> connections) {
    Map<String, Set<String>> partners = new LinkedHashMap<>();
    for (Connection connection : connections) {
      String parentSignal = connection.getParentSignal();
      String childPort = connection.getChildPort();
      List<String> parentNames = List.of(parentSignal, connection.getParentModule() + "." + parentSignal,
                                         SignalNames.withoutIndex(parentSignal));
      List<String> childNames = List.of(childPort, connection.getInstance() + "." + childPort, SignalNames.withoutIndex(childPort));
      for (String parentName : parentNames) {
        for (String childName : childNames) {
          partners.computeIfAbsent(parentName, name -> new LinkedHashSet<>()).add(childName);
          partners.computeIfAbsent(childName, name -> new LinkedHashSet<>()).add(parentName);
        }
      }
    }
    logger.debug("Connection map: {} name variant(s) from {} connection(s)", partners.size(), connections.size());
    return new ConnectionMap(partners);
  }

  /**
   * Builds the map from a system report.
   * @param report the analysis result
   * @param includeFlattened also relate the ends of flattened links, with <code>via.to</code> as instance path
   * @return the map
   */
  public static ConnectionMap build(SystemReport report, boolean includeFlattened) {
    List<Connection> connections = new ArrayList<>(report.getDirectConnections());
    if (includeFlattened) {
      for (FlattenedConnection link : report.getFlattenedConnections())
        connections.add(link.asConnection());
    }
    return build(connections);
  }
}
