package wavemap.netlist;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavemap.frontend.RtlSource;
import wavemap.frontend.RtlTokens;
import wavemap.util.Vocabulary;

/**
 * Naive bit width check of assignments within one module.
 * Widths come from declaration ranges only; expressions are not evaluated, so only plain
 * <code>lhs = rhs</code> and <code>lhs &lt;= rhs</code> with an identifier or slice on the right are compared.
 */
public class WidthChecker {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Pattern DECLARATION_LINE = Pattern.compile("^\\s*(?:input|output|inout|reg|wire|logic|parameter|localparam)\\b");
  private static final Pattern NUMERIC_RANGE = Pattern.compile("\\[\\s*(\\d+)\\s*:\\s*(\\d+)\\s*\\]");
  private static final Pattern SYMBOLIC_RANGE = Pattern.compile("\\[\\s*([A-Za-z_]\\w*)(?:\\s*-\\s*1)?\\s*:\\s*0\\s*\\]");
  private static final Pattern ASSIGNMENT = Pattern.compile("(\\w+)\\s*(?:<=|=)\\s*([\\w\\[\\]:]+)");
  private static final Pattern NUMBER = Pattern.compile("\\d+");
  private static final Pattern BASED_NUMBER = Pattern.compile("\\d+'[bhdo][0-9a-fA-F]+");
  private static final Set<String> DECLARATION_WORDS = Set.of("input", "output", "inout", "reg", "wire", "logic", "parameter",
                                                              "localparam", "signed", "unsigned", "integer");

  /** A width that is either a bit count or the name of a parameter. */
  static class BitWidth {
    private final int bits;
    private final String symbol;

    private BitWidth(int bits, String symbol) {
      this.bits = bits;
      this.symbol = symbol;
    }
    static BitWidth numeric(int bits) { return new BitWidth(bits, null); }
    static BitWidth symbolic(String symbol) { return new BitWidth(0, symbol); }

    boolean isNumeric() { return symbol == null; }
    int getBits() { return bits; }
    String getSymbol() { return symbol; }

    @Override
    public String toString() {
      return isNumeric() ? Integer.toString(bits) : symbol;
    }
  }

  private final Vocabulary vocabulary;

  public WidthChecker(Vocabulary vocabulary) { this.vocabulary = vocabulary; }

  public WidthChecker() { this(Vocabulary.getDefault()); }

  /**
   * Compares the widths of both sides of every assignment in a source.
   * @param source the module source
   * @param moduleName name reported with each mismatch
   * @return mismatches in source order
   */
  public List<WidthMismatch> check(RtlSource source, String moduleName) {
    Map<String, BitWidth> declared = declaredWidths(source.getLines());
    List<WidthMismatch> ret = new ArrayList<>();
    Matcher assignment = ASSIGNMENT.matcher(String.join(" ", source.getLines()));
    while (assignment.find()) {
      String lhs = assignment.group(1);
      String rhs = assignment.group(2);
      if (isSkipped(lhs) || isSkipped(RtlTokens.stripIndex(rhs)))
        continue;
      BitWidth lhsWidth = declared.getOrDefault(lhs, BitWidth.numeric(1));
      BitWidth rhsWidth = rangeWidth(rhs);
      if (rhsWidth == null)
        rhsWidth = declared.getOrDefault(rhs, BitWidth.numeric(1));
      if (lhsWidth.isNumeric() && rhsWidth.isNumeric() && lhsWidth.getBits() != rhsWidth.getBits()) {
        WidthMismatch mismatch = new WidthMismatch(moduleName, lhs, lhsWidth.getBits(), rhs, rhsWidth.getBits());
        logger.warn(mismatch);
        ret.add(mismatch);
      } else {
        logger.trace("{}: {} ({}) = {} ({})", moduleName, lhs, lhsWidth, rhs, rhsWidth);
      }
    }
    return ret;
  }

  /** Declared width of every name on a declaration line; a line without range declares width 1. */
  static Map<String, BitWidth> declaredWidths(List<String> lines) {
    Map<String, BitWidth> ret = new HashMap<>();
    for (String line : lines) {
      if (!DECLARATION_LINE.matcher(line).lookingAt())
        continue;
      BitWidth width = rangeWidth(line);
      if (width == null)
        width = BitWidth.numeric(1);
      String names = RtlTokens.stripRanges(line);
      int assignment = names.indexOf('=');
      if (assignment >= 0)
        names = names.substring(0, assignment);
      for (String name : RtlTokens.identifiers(names)) {
        if (!DECLARATION_WORDS.contains(name))
          ret.put(name, width);
      }
    }
    return ret;
  }

  /** Width given by the first range in the text, null if there is none. */
  static BitWidth rangeWidth(String text) {
    Matcher numeric = NUMERIC_RANGE.matcher(text);
    if (numeric.find()) {
      Integer bits = boundedWidth(numeric.group(1), numeric.group(2));
      if (bits == null) {
        logger.debug("Range {} exceeds the supported width, treating it as symbolic", numeric.group());
        return BitWidth.symbolic(numeric.group());
      }
      return BitWidth.numeric(bits);
    }
    Matcher symbolic = SYMBOLIC_RANGE.matcher(text);
    if (symbolic.find())
      return BitWidth.symbolic(symbolic.group(1));
    return null;
  }

  /** Width of <code>[msb:lsb]</code>, null if it does not fit an int. */
  private static Integer boundedWidth(String msb, String lsb) {
    // more than 18 digits may overflow a long
    if (msb.length() > 18 || lsb.length() > 18)
      return null;
    long width = Math.abs(Long.parseLong(msb) - Long.parseLong(lsb)) + 1;
    return width > Integer.MAX_VALUE ? null : (int)width;
  }

  private boolean isSkipped(String operand) {
    return NUMBER.matcher(operand).matches() || BASED_NUMBER.matcher(operand).matches() || vocabulary.isKeyword(operand) ||
        vocabulary.isFsmState(operand);
  }
}
