package wavemap.util;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;

/**
 * Naming conventions shared by the RTL scanners and the value resolver: HDL keywords, FSM state labels and the
 * sample values that mean "nothing recorded".
 * Loaded from YAML so the word lists can be extended without touching the scanners.
 */
public class Vocabulary {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String DEFAULT_RESOURCE = "/wavemap/vocabulary.yaml";

  private static Vocabulary defaultVocabulary = null;

  private final Set<String> keywords;
  private final Set<String> fsmStates;
  private final Set<String> emptyMarkers;

  public Vocabulary(Set<String> keywords, Set<String> fsmStates, Set<String> emptyMarkers) {
    this.keywords = Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
    this.fsmStates = Collections.unmodifiableSet(new LinkedHashSet<>(fsmStates));
    this.emptyMarkers = Collections.unmodifiableSet(new LinkedHashSet<>(emptyMarkers));
  }

  /**
   * Returns the vocabulary bundled with WaveMap (resource {@value #DEFAULT_RESOURCE}).
   * @return the shared default vocabulary
   */
  public static synchronized Vocabulary getDefault() {
    if (defaultVocabulary == null) {
      try (InputStream in = Vocabulary.class.getResourceAsStream(DEFAULT_RESOURCE)) {
        if (in == null)
          throw new IllegalStateException("Missing vocabulary resource " + DEFAULT_RESOURCE);
        defaultVocabulary = load(in, DEFAULT_RESOURCE);
      } catch (IOException e) {
        throw new IllegalStateException("Cannot read vocabulary resource " + DEFAULT_RESOURCE, e);
      }
    }
    return defaultVocabulary;
  }

  /**
   * Reads a vocabulary file. Lists missing from the file fall back to the bundled defaults.
   * @param file the YAML file
   * @return the vocabulary
   * @throws IOException if the file cannot be read
   */
  public static Vocabulary load(Path file) throws IOException {
    try (InputStream in = new FileInputStream(file.toFile())) {
      return load(in, file.toString());
    }
  }

  private static Vocabulary load(InputStream in, String sourceName) {
    Yaml yaml = new Yaml();
    Object parsed = yaml.load(in);
    Map<?, ?> entries = (parsed instanceof Map) ? (Map<?, ?>)parsed : new LinkedHashMap<>();
    if (!(parsed instanceof Map))
      logger.warn("Vocabulary {} holds no mapping, using empty word lists", sourceName);
    boolean isDefault = DEFAULT_RESOURCE.equals(sourceName);
    Set<String> keywords = readList(entries, "keywords", isDefault ? null : getDefault().keywords, sourceName);
    Set<String> fsmStates = readList(entries, "fsm_states", isDefault ? null : getDefault().fsmStates, sourceName);
    Set<String> emptyMarkers = readList(entries, "empty_markers", isDefault ? null : getDefault().emptyMarkers, sourceName);
    logger.debug("Loaded vocabulary {}: {} keywords, {} FSM states, {} empty markers", sourceName, keywords.size(),
                 fsmStates.size(), emptyMarkers.size());
    return new Vocabulary(keywords, fsmStates, emptyMarkers);
  }

  private static Set<String> readList(Map<?, ?> entries, String key, Set<String> fallback, String sourceName) {
    Object value = entries.get(key);
    if (value == null)
      return fallback != null ? fallback : new LinkedHashSet<>();
    if (!(value instanceof List)) {
      logger.error("Vocabulary {}: '{}' must be a list, ignoring it", sourceName, key);
      return fallback != null ? fallback : new LinkedHashSet<>();
    }
    Set<String> words = new LinkedHashSet<>();
    for (Object word : (List<?>)value)
      words.add(word == null ? "" : word.toString());
    return words;
  }

  public Set<String> getKeywords() { return keywords; }
  public Set<String> getFsmStates() { return fsmStates; }
  public Set<String> getEmptyMarkers() { return emptyMarkers; }

  public boolean isKeyword(String word) { return keywords.contains(word); }
  public boolean isFsmState(String word) { return fsmStates.contains(word); }

  /**
   * Tests if a sampled value means "no data recorded". Unknown (x) and high-impedance (z) values are real values.
   * @param value the raw sample, may be null
   * @return true iff the value is absent
   */
  public boolean isEmptyValue(String value) {
    if (value == null)
      return true;
    String trimmed = value.trim();
    return trimmed.isEmpty() || emptyMarkers.contains(trimmed);
  }
}
