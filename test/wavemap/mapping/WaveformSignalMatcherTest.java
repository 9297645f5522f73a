package wavemap.mapping;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class WaveformSignalMatcherTest {

  @Test
  void testMatchLevels() {
    List<String> columns = List.of("time_ns", "soc_tb.dut.clk", "soc_tb.dut.u_uart.tx_busy", "tb.dut.core.u_alu.res[31:0]", "noise");
    Map<String, String> matched = WaveformSignalMatcher.matchColumns(columns, List.of("clk", "tx_busy", "u_alu.res"));
    Assertions.assertEquals(Map.of("soc_tb.dut.clk", "clk", "soc_tb.dut.u_uart.tx_busy", "tx_busy", "tb.dut.core.u_alu.res[31:0]", "u_alu.res"),
                            matched);
  }

  @Test
  void testFirstColumnIsDirect() {
    Map<String, String> direct = WaveformSignalMatcher.directColumns(List.of("time_ps", "a.dut.busy", "b.dut.x.busy"), List.of("busy"));
    Assertions.assertEquals(Map.of("busy", "a.dut.busy"), direct);
  }
}
