package wavemap.netlist;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavemap.frontend.RtlTokens;

/**
 * Derives links that cross one intermediate instance from direct connections.
 *
 * A connection C (parent P binds port p of instance i, a module M) is linked to every connection D inside M whose
 * parent-side expression mentions p. Each call resolves a single hierarchy level; deeper chains need further passes
 * over the direct connections plus the previous output ({@link #flatten(List, int)}).
 */
public class ConnectivityFlattener {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private ConnectivityFlattener() {}

  /**
   * One flattening pass.
   * @param connections direct connections (or direct connections plus earlier passes viewed as connections)
   * @return flattened links in the order of their originating connection
   */
  public static List<FlattenedConnection> flatten(List<Connection> connections) {
    Map<String, List<Connection>> byParent = new LinkedHashMap<>();
    for (Connection connection : connections)
      byParent.computeIfAbsent(connection.getParentModule(), parent -> new ArrayList<>()).add(connection);

    List<FlattenedConnection> ret = new ArrayList<>();
    for (List<Connection> parentConnections : byParent.values()) {
      for (Connection outer : parentConnections) {
        List<Connection> innerConnections = byParent.get(outer.getChildModule());
        if (innerConnections == null)
          continue;
        for (Connection inner : innerConnections) {
          if (RtlTokens.identifiers(inner.getParentSignal()).contains(outer.getChildPort())) {
            ret.add(new FlattenedConnection(outer.getParentModule(), outer.getParentSignal(), inner.getChildModule(), inner.getChildPort(),
                                            outer.getInstance(), outer.getChildModule(), inner.getInstance(), inner.getParentSignal()));
          }
        }
      }
    }
    return ret;
  }

  /**
   * Repeats {@link #flatten(List)} so that chains up to <code>passes + 1</code> instances deep are linked.
   * Each pass runs over the direct connections plus all links found so far; it stops early once a pass adds nothing.
   * @param direct direct connections
   * @param passes maximum number of passes, at least 1
   * @return distinct flattened links in order of discovery
   */
  public static List<FlattenedConnection> flatten(List<Connection> direct, int passes) {
    if (passes < 1)
      throw new IllegalArgumentException("passes must be at least 1");
    Set<FlattenedConnection> ret = new LinkedHashSet<>();
    List<Connection> input = direct;
    for (int pass = 1; pass <= passes; ++pass) {
      if (!ret.addAll(flatten(input)))
        break;
      logger.debug("Flattening pass {}: {} link(s) in total", pass, ret.size());
      input = new ArrayList<>(direct);
      for (FlattenedConnection link : ret)
        input.add(link.asConnection());
    }
    return new ArrayList<>(ret);
  }
}
