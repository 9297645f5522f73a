package wavemap.mapping;

import java.util.regex.Pattern;
import wavemap.frontend.RtlTokens;

/**
 * Reconciles differently scoped names of the same signal, e.g. the waveform's <code>soc_tb.dut.u_uart.tx_busy</code>
 * and the RTL's <code>u_uart.tx_busy</code>.
 */
public class SignalNames {
  private static final Pattern DUT_SCOPE = Pattern.compile("^[^.]*\\.dut\\.");
  private static final Pattern TB_SCOPE = Pattern.compile("^[^.]*\\.tb\\.");
  private static final Pattern TOP_SCOPE = Pattern.compile("^top\\.");
  private static final Pattern INDEX = Pattern.compile("\\[.*?\\]");

  private SignalNames() {}

  /**
   * Drops the testbench scope (<code>&lt;tb&gt;.dut.</code>, <code>&lt;x&gt;.tb.</code>, <code>top.</code>),
   * all array indices, and lowercases.
   * @param name a hierarchical signal name
   * @return the normalized name, e.g. <code>uart_busy</code> for <code>soc_tb.dut.uart_busy</code>
   */
  public static String normalize(String name) {
    String ret = DUT_SCOPE.matcher(name).replaceFirst("");
    ret = TB_SCOPE.matcher(ret).replaceFirst("");
    ret = TOP_SCOPE.matcher(ret).replaceFirst("");
    ret = INDEX.matcher(ret).replaceAll("");
    return ret.toLowerCase();
  }

  /** Text after the last dot, without array indices, lowercased. */
  public static String lastComponent(String name) {
    String last = name.substring(name.lastIndexOf('.') + 1);
    return INDEX.matcher(last).replaceAll("").toLowerCase();
  }

  /**
   * The last two components of the normalized name, e.g. <code>u_uart.tx_busy</code>.
   * @return the two-level name, null if the normalized name has no dot
   */
  public static String lastTwoComponents(String name) {
    String normalized = normalize(name);
    int last = normalized.lastIndexOf('.');
    if (last < 0)
      return null;
    int previous = normalized.lastIndexOf('.', last - 1);
    return normalized.substring(previous + 1);
  }

  /** Tests if two names probably denote the same signal. */
  public static boolean identityEquivalent(String a, String b) {
    if (normalize(a).equals(normalize(b)) || lastComponent(a).equals(lastComponent(b)))
      return true;
    String twoA = lastTwoComponents(a);
    return twoA != null && twoA.equals(lastTwoComponents(b));
  }

  /** The name without array index, as used for connection map keys. */
  public static String withoutIndex(String name) { return RtlTokens.stripIndex(name); }
}
