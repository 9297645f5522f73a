package wavemap.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import wavemap.frontend.Instance;
import wavemap.frontend.ModuleDecl;

/**
 * Modules and direct port connections of a set of RTL files, plus the defects found while reading them.
 */
public class ConnectivityGraph {
  private final Map<String, ModuleDecl> modules;
  private final List<Instance> instances;
  private final List<Connection> connections;
  private final List<AnalysisIssue> issues;

  public ConnectivityGraph(Map<String, ModuleDecl> modules, List<Instance> instances, List<Connection> connections,
                           List<AnalysisIssue> issues) {
    this.modules = Collections.unmodifiableMap(new LinkedHashMap<>(modules));
    this.instances = Collections.unmodifiableList(new ArrayList<>(instances));
    this.connections = Collections.unmodifiableList(new ArrayList<>(connections));
    this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
  }

  /** Module name to declaration, in order of first declaration. */
  public Map<String, ModuleDecl> getModules() { return modules; }
  public List<Instance> getInstances() { return instances; }
  /** All port bindings, in file and source order. */
  public List<Connection> getConnections() { return connections; }
  public List<AnalysisIssue> getIssues() { return issues; }

  /**
   * Guesses the top-level module. Modules that no other module instantiates are preferred; among those, names hinting
   * at a top level (top, dut, soc, tb) score highest, then modules owning more instances.
   * @return the most likely top module, empty if no module was found
   */
  public Optional<String> findTopModule() {
    Set<String> instantiated = new HashSet<>();
    for (Instance instance : instances) {
      if (!instance.getModuleType().equals(instance.getParentModule()))
        instantiated.add(instance.getModuleType());
    }
    List<String> candidates = new ArrayList<>();
    for (String name : modules.keySet()) {
      if (!instantiated.contains(name))
        candidates.add(name);
    }
    if (candidates.isEmpty())
      candidates.addAll(modules.keySet());

    String best = null;
    int bestScore = Integer.MIN_VALUE;
    for (String name : candidates) {
      int score = nameScore(name) + (int)instances.stream().filter(instance -> instance.getParentModule().equals(name)).count();
      if (score > bestScore) {
        best = name;
        bestScore = score;
      }
    }
    return Optional.ofNullable(best);
  }

  private static int nameScore(String moduleName) {
    String name = moduleName.toLowerCase();
    if (name.contains("top"))
      return 1000;
    if (name.contains("dut"))
      return 900;
    if (name.contains("soc"))
      return 800;
    if (name.contains("tb") || name.contains("testbench"))
      return 100;
    return 0;
  }
}
