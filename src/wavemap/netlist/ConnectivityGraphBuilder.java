package wavemap.netlist;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavemap.frontend.Instance;
import wavemap.frontend.InstanceExtractor;
import wavemap.frontend.ModuleDecl;
import wavemap.frontend.ModuleScanner;
import wavemap.frontend.RtlParseException;
import wavemap.frontend.RtlSource;
import wavemap.util.Vocabulary;

/**
 * Builds the connectivity graph of a set of RTL sources, one module per source.
 * Sources are processed in the given order; a source that cannot be analyzed is reported and skipped.
 */
public class ConnectivityGraphBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ModuleScanner moduleScanner = new ModuleScanner();
  private final InstanceExtractor instanceExtractor;
  private final boolean strictPortBlocks;

  /**
   * @param vocabulary naming vocabulary for the instance scan
   * @param strictPortBlocks if set, bindings of instances whose port block is not closed are dropped instead of kept
   */
  public ConnectivityGraphBuilder(Vocabulary vocabulary, boolean strictPortBlocks) {
    this.instanceExtractor = new InstanceExtractor(vocabulary);
    this.strictPortBlocks = strictPortBlocks;
  }

  public ConnectivityGraphBuilder() { this(Vocabulary.getDefault(), false); }

  public ConnectivityGraph build(List<RtlSource> sources) {
    Map<String, ModuleDecl> modules = new LinkedHashMap<>();
    List<Instance> instances = new ArrayList<>();
    List<Connection> connections = new ArrayList<>();
    List<AnalysisIssue> issues = new ArrayList<>();

    for (RtlSource source : sources) {
      ModuleDecl module;
      try {
        module = moduleScanner.scan(source);
      } catch (RtlParseException e) {
        logger.error("Skipping {}", e.getMessage());
        issues.add(new AnalysisIssue(AnalysisIssue.Kind.NO_MODULE, source.getName(), "no module declaration found"));
        continue;
      }
      String moduleName = module.getName();
      if (modules.put(moduleName, module) != null) {
        logger.warn("Module {} is declared again in {}, the later declaration replaces the earlier one", moduleName, source.getName());
        issues.add(new AnalysisIssue(AnalysisIssue.Kind.MODULE_REDECLARED, source.getName(),
                                     "module " + moduleName + " replaces an earlier declaration"));
      }

      for (Instance instance : instanceExtractor.extract(moduleName, source.getLines())) {
        instances.add(instance);
        if (!instance.isTerminated()) {
          issues.add(new AnalysisIssue(AnalysisIssue.Kind.UNTERMINATED_INSTANCE, moduleName + "." + instance.getName(),
                                       "port connections not closed by ');'" + (strictPortBlocks ? ", bindings dropped" : "")));
          if (strictPortBlocks)
            continue;
        }
        instance.getBindings().forEach(
            (port, expression) -> connections.add(new Connection(moduleName, instance.getModuleType(), instance.getName(), port, expression)));
      }
    }
    logger.info("Analyzed {} source(s): {} module(s), {} instance(s), {} connection(s)", sources.size(), modules.size(), instances.size(),
                connections.size());
    return new ConnectivityGraph(modules, instances, connections, issues);
  }
}
