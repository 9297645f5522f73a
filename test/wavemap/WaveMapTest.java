package wavemap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import wavemap.frontend.RtlSource;
import wavemap.mapping.MappingResult;
import wavemap.mapping.SignalMetadata;
import wavemap.mapping.WaveformMappingException;
import wavemap.mapping.WaveformTable;
import wavemap.netlist.SystemReport;

class WaveMapTest {
  private static final String SOC = "module soc_top (\n"
                                    + "  input wire clk\n"
                                    + ");\n"
                                    + "  wire uart_busy;\n"
                                    + "  uart_tx u_uart (\n"
                                    + "    .clk(clk),\n"
                                    + "    .tx_busy(uart_busy)\n"
                                    + "  );\n"
                                    + "endmodule\n";
  private static final String UART = "module uart_tx (input wire clk, output reg tx_busy);\nendmodule\n";

  @Test
  void testUartBusyFilledFromChildPort() throws WaveformMappingException {
    WaveMap waveMap = new WaveMap();
    SystemReport report = waveMap.analyzeSources(List.of(RtlSource.fromText("soc_top.v", SOC), RtlSource.fromText("uart_tx.v", UART)));
    Assertions.assertEquals("soc_top", report.getTopModule());

    Map<String, String> labels = new LinkedHashMap<>();
    labels.put("clk", "clock");
    labels.put("uart_busy", "status");
    SignalMetadata metadata = new SignalMetadata("soc_top", labels, "clock");
    Map<String, String> sample = new LinkedHashMap<>();
    sample.put("time_ps", "1000");
    sample.put("soc_tb.dut.clk", "1");
    sample.put("soc_tb.dut.u_uart.tx_busy", "1");
    WaveformTable waveform = new WaveformTable(List.copyOf(sample.keySet()), List.of(sample));

    MappingResult result = waveMap.mapWaveform(metadata, waveform, report);
    Assertions.assertEquals(List.of("time_ps", "clk", "uart_busy"), result.getTable().getHeader());
    Assertions.assertEquals(List.of("1"), result.getTable().column("uart_busy"));
    Assertions.assertEquals("soc_tb.dut.u_uart.tx_busy", result.getSubstitutions().get(0).getSourceColumn());

    MappingResult unconnected = waveMap.mapWaveform(metadata, waveform, null);
    Assertions.assertEquals(List.of(""), unconnected.getTable().column("uart_busy"));
  }

  @Test
  void testOversizedRangeDoesNotStopAnalysis() {
    String big = "module big;\n  reg [99999999999:0] r;\n  wire [3:0] n;\n  assign n = r;\nendmodule\n";
    String ok = "module ok;\n  reg [7:0] a;\n  wire [3:0] b;\n  assign b = a;\nendmodule\n";
    SystemReport report = new WaveMap().analyzeSources(List.of(RtlSource.fromText("big.v", big), RtlSource.fromText("ok.v", ok)));
    Assertions.assertTrue(report.getModules().containsKey("big"));
    Assertions.assertTrue(report.getModules().containsKey("ok"));
    Assertions.assertEquals(1, report.getWidthMismatches().size());
    Assertions.assertEquals("ok", report.getWidthMismatches().get(0).getModule());
  }
}
