package wavemap.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Symmetric index from a signal name variant to the name variants it is wired to.
 * If A lists B, B lists A. Built once by {@link ConnectionMapBuilder}, read-only afterwards.
 */
public class ConnectionMap {
  private final Map<String, Set<String>> partners;

  ConnectionMap(Map<String, Set<String>> partners) {
    Map<String, Set<String>> copy = new LinkedHashMap<>();
    partners.forEach((name, set) -> copy.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(set))));
    this.partners = Collections.unmodifiableMap(copy);
  }

  public static ConnectionMap empty() { return new ConnectionMap(Map.of()); }

  /**
   * @param name a signal name variant
   * @return connected name variants in insertion order, empty if the name is unknown
   */
  public List<String> candidates(String name) {
    Set<String> ret = partners.get(name);
    return ret == null ? List.of() : new ArrayList<>(ret);
  }

  public Set<String> keys() { return partners.keySet(); }
  public boolean isEmpty() { return partners.isEmpty(); }
  public int size() { return partners.size(); }
}
