package wavemap.frontend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavemap.util.Vocabulary;

/**
 * Finds module instantiations in comment-stripped RTL lines, without parsing the language.
 *
 * Two shapes are recognized:
 * <ul>
 * <li><code>type [#(params)] name (</code> on one line,</li>
 * <li><code>type #(</code> with the parameter list spanning lines, closed by <code>) name (</code>.</li>
 * </ul>
 * From the line holding the instance name, lines are collected until one contains <code>);</code>.
 * The collected text is searched for <code>.port(expression)</code> bindings; expressions are kept verbatim.
 */
public class InstanceExtractor {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Pattern INLINE = Pattern.compile("^\\s*(\\w+)\\s*(?:#\\s*\\([^)]*\\))?\\s+([A-Za-z_]\\w*)\\s*\\(");
  private static final Pattern PARAM_OPEN = Pattern.compile("^\\s*(\\w+)\\s*#\\s*\\(");
  private static final Pattern NAME_AFTER_PARAMS = Pattern.compile("\\)\\s+([A-Za-z_]\\w*)\\s*\\(");
  private static final Pattern PORT_BINDING = Pattern.compile("\\.(\\w+)\\s*\\(\\s*([^)]+?)\\s*\\)");
  private static final String CLOSE = ");";

  private final Vocabulary vocabulary;

  public InstanceExtractor(Vocabulary vocabulary) { this.vocabulary = vocabulary; }

  public InstanceExtractor() { this(Vocabulary.getDefault()); }

  /** Port-connection block of one instance, as collected from the source lines. */
  private static class Block {
    final String text;
    final int lastLine;
    final boolean terminated;
    Block(String text, int lastLine, boolean terminated) {
      this.text = text;
      this.lastLine = lastLine;
      this.terminated = terminated;
    }
  }

  /**
   * Extracts all instances from the lines of one module.
   * @param parentModule module that owns the lines
   * @param lines comment-stripped, non-blank RTL lines
   * @return instances in source order
   */
  public List<Instance> extract(String parentModule, List<String> lines) {
    List<Instance> ret = new ArrayList<>();
    int i = 0;
    while (i < lines.size()) {
      String line = lines.get(i);

      Matcher inline = INLINE.matcher(line);
      if (inline.lookingAt() && isInstantiation(inline.group(1), inline.group(2))) {
        Block block = collectBlock(lines, i);
        ret.add(makeInstance(parentModule, inline.group(1), inline.group(2), block));
        i = block.lastLine + 1;
        continue;
      }

      Matcher paramOpen = PARAM_OPEN.matcher(line);
      if (paramOpen.lookingAt() && !vocabulary.isKeyword(paramOpen.group(1))) {
        String moduleType = paramOpen.group(1);
        // The parameter list holds no ';', so the search ends at the first line that has one.
        for (int j = i; j < lines.size(); ++j) {
          Matcher nameMatch = NAME_AFTER_PARAMS.matcher(lines.get(j));
          if (nameMatch.find() && !vocabulary.isKeyword(nameMatch.group(1))) {
            Block block = collectBlock(lines, j);
            ret.add(makeInstance(parentModule, moduleType, nameMatch.group(1), block));
            i = block.lastLine;
            break;
          }
          if (lines.get(j).contains(";")) {
            logger.debug("{}: no instance name found for parameterized {} opened at line {}", parentModule, moduleType, i + 1);
            break;
          }
        }
      }
      ++i;
    }
    return ret;
  }

  private boolean isInstantiation(String moduleType, String instanceName) {
    return !vocabulary.isKeyword(moduleType) && !vocabulary.isKeyword(instanceName);
  }

  private static Block collectBlock(List<String> lines, int start) {
    StringBuilder text = new StringBuilder(lines.get(start));
    if (lines.get(start).contains(CLOSE))
      return new Block(text.toString(), start, true);
    for (int i = start + 1; i < lines.size(); ++i) {
      text.append(' ').append(lines.get(i));
      if (lines.get(i).contains(CLOSE))
        return new Block(text.toString(), i, true);
    }
    return new Block(text.toString(), lines.size() - 1, false);
  }

  private static Instance makeInstance(String parentModule, String moduleType, String instanceName, Block block) {
    Matcher opening = Pattern.compile("(?<![\\w.])" + Pattern.quote(instanceName) + "\\s*\\(").matcher(block.text);
    String portBlock = opening.find() ? block.text.substring(opening.end()) : block.text;
    Map<String, String> bindings = new LinkedHashMap<>();
    Matcher binding = PORT_BINDING.matcher(portBlock);
    while (binding.find())
      bindings.put(binding.group(1), binding.group(2).trim());
    if (!block.terminated)
      logger.warn("{}: port connections of {} ({}) are not closed by '{}', keeping {} binding(s) found before end of input",
                  parentModule, instanceName, moduleType, CLOSE, bindings.size());
    logger.trace("{}: instance {} of {} with bindings {}", parentModule, instanceName, moduleType, bindings);
    return new Instance(parentModule, moduleType, instanceName, bindings, block.terminated);
  }
}
