package wavemap.frontend;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads the module name, port list and internal signal declarations of an RTL source by keyword-anchored matching.
 * Only the first module of a source is considered.
 */
public class ModuleScanner {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Pattern MODULE = Pattern.compile("^\\s*(?:macro)?module\\s+(\\w+)");
  private static final Pattern NET_DECLARATION = Pattern.compile("\\b(?:wire|reg|logic|bit)\\b");
  private static final Set<String> DIRECTIONS = Set.of("input", "output", "inout", "ref");
  private static final Set<String> DECLARATION_WORDS = Set.of("input", "output", "inout", "ref", "wire", "reg", "logic", "bit",
                                                              "signed", "unsigned", "var", "tri", "wand", "wor", "integer",
                                                              "supply0", "supply1");

  /**
   * Returns the name of the first module declared in the source.
   * @throws RtlParseException if the source declares no module
   */
  public String findModuleName(RtlSource source) throws RtlParseException {
    Matcher header = MODULE.matcher(source.getLines().get(findModuleLine(source)));
    header.lookingAt();
    return header.group(1);
  }

  /**
   * Scans the first module of a source.
   * @param source the prepared source
   * @return the module with its ports (declaration order) and internal signals
   * @throws RtlParseException if the source declares no module
   */
  public ModuleDecl scan(RtlSource source) throws RtlParseException {
    int moduleLine = findModuleLine(source);
    List<String> lines = source.getLines();
    String name = findModuleName(source);
    List<String> ports = scanPorts(String.join(" ", lines.subList(moduleLine, lines.size())));
    Set<String> signals = scanSignals(lines);
    ModuleDecl ret = new ModuleDecl(name, ports, signals);
    logger.debug("{}: found module {}", source.getName(), ret);
    return ret;
  }

  private static int findModuleLine(RtlSource source) throws RtlParseException {
    List<String> lines = source.getLines();
    for (int i = 0; i < lines.size(); ++i) {
      if (MODULE.matcher(lines.get(i)).lookingAt())
        return i;
    }
    throw new RtlParseException(source.getName(), "no module declaration found");
  }

  /** Port names from the header, ANSI (<code>input wire [7:0] a, b</code>) or non-ANSI (<code>(a, b)</code>) style. */
  static List<String> scanPorts(String text) {
    List<String> ret = new ArrayList<>();
    Matcher header = MODULE.matcher(text);
    if (!header.lookingAt())
      return ret;
    int pos = skipSpace(text, header.end());
    if (pos < text.length() && text.charAt(pos) == '#') {
      pos = skipSpace(text, pos + 1);
      if (pos < text.length() && text.charAt(pos) == '(') {
        int close = findClosing(text, pos);
        if (close < 0)
          return ret;
        pos = skipSpace(text, close + 1);
      }
    }
    if (pos >= text.length() || text.charAt(pos) != '(')
      return ret;
    int close = findClosing(text, pos);
    String portList = text.substring(pos + 1, close < 0 ? text.length() : close);
    for (String item : RtlTokens.splitTopLevel(portList)) {
      String declaration = RtlTokens.stripRanges(item);
      int assignment = declaration.indexOf('=');
      if (assignment >= 0)
        declaration = declaration.substring(0, assignment);
      List<String> names = RtlTokens.identifiers(declaration);
      names.removeIf(DECLARATION_WORDS::contains);
      if (!names.isEmpty())
        ret.add(names.get(names.size() - 1));
    }
    return ret;
  }

  /** Names declared with wire, reg, logic or bit anywhere in the source, including comma-separated lists. */
  static Set<String> scanSignals(List<String> lines) {
    Set<String> ret = new LinkedHashSet<>();
    for (String line : lines) {
      Matcher keyword = NET_DECLARATION.matcher(line);
      while (keyword.find()) {
        String rest = RtlTokens.stripRanges(line.substring(keyword.end()));
        rest = cutAt(cutAt(cutAt(rest, ';'), '='), ')');
        String[] items = rest.split(",");
        for (int i = 0; i < items.length; ++i) {
          List<String> words = RtlTokens.identifiers(items[i]);
          // 'output reg a, input b': the list of 'reg' ends where the next declaration starts
          if (i > 0 && words.stream().anyMatch(DIRECTIONS::contains))
            break;
          words.stream().filter(word -> !DECLARATION_WORDS.contains(word)).findFirst().ifPresent(ret::add);
        }
      }
    }
    return ret;
  }

  private static String cutAt(String text, char stop) {
    int index = text.indexOf(stop);
    return index < 0 ? text : text.substring(0, index);
  }

  private static int skipSpace(String text, int pos) {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
      ++pos;
    return pos;
  }

  /** Index of the parenthesis closing the one at <code>open</code>, or -1 if the text ends first. */
  private static int findClosing(String text, int open) {
    int depth = 0;
    for (int i = open; i < text.length(); ++i) {
      if (text.charAt(i) == '(')
        ++depth;
      else if (text.charAt(i) == ')' && --depth == 0)
        return i;
    }
    return -1;
  }
}
