package wavemap.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifier-level tokenizing of RTL expressions and declarations.
 * Only identifiers, ranges and sized literals are recognized; everything else is treated as separator.
 */
public class RtlTokens {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");
  private static final Pattern SIZED_LITERAL = Pattern.compile("\\d*\\s*'[sS]?[bBoOdDhH]\\s*[0-9a-fA-FxXzZ_?]+");
  private static final Pattern RANGE = Pattern.compile("\\[[^\\]]*\\]");

  private RtlTokens() {}

  /**
   * Splits an expression such as <code>{a, b[3:0], 4'hF}</code> into its identifiers (<code>a</code>, <code>b</code>).
   * Identifiers inside bit selects are kept, digits of sized literals are not.
   * @param expression the expression text
   * @return identifiers in order of appearance, duplicates kept
   */
  public static List<String> identifiers(String expression) {
    List<String> ret = new ArrayList<>();
    Matcher matcher = IDENTIFIER.matcher(SIZED_LITERAL.matcher(expression).replaceAll(" "));
    while (matcher.find())
      ret.add(matcher.group());
    return ret;
  }

  /** Removes all bracketed ranges and indices, e.g. <code>reg [7:0] mem [0:3]</code> gives <code>reg  mem </code>. */
  public static String stripRanges(String text) { return RANGE.matcher(text).replaceAll(" "); }

  /**
   * Removes an array index suffix the way signal names are compared: everything from the first '[' on.
   * @param name a signal name such as <code>data[7:0]</code>
   * @return the name without index, e.g. <code>data</code>
   */
  public static String stripIndex(String name) {
    int bracket = name.indexOf('[');
    return bracket < 0 ? name : name.substring(0, bracket);
  }

  /**
   * Splits text at commas that are not nested inside (), [] or {}.
   * @param text the text to split
   * @return the pieces, untrimmed
   */
  public static List<String> splitTopLevel(String text) {
    List<String> ret = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < text.length(); ++i) {
      char c = text.charAt(i);
      if (c == '(' || c == '[' || c == '{')
        ++depth;
      else if ((c == ')' || c == ']' || c == '}') && depth > 0)
        --depth;
      else if (c == ',' && depth == 0) {
        ret.add(text.substring(start, i));
        start = i + 1;
      }
    }
    ret.add(text.substring(start));
    return ret;
  }
}
