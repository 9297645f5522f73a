package wavemap.ui;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WaveMapCmdTest {

  @Test
  void testSystemMapMerge(@TempDir Path dir) throws IOException {
    Path soc = dir.resolve("soc_top.v");
    Files.writeString(soc, "module soc_top (input clk);\n  uart_tx u_uart (\n    .clk(clk),\n    .tx_busy(uart_busy)\n  );\nendmodule\n");
    Path uart = dir.resolve("uart_tx.v");
    Files.writeString(uart, "module uart_tx (input clk, output tx_busy);\nendmodule\n");
    String prefix = dir.resolve("soc").toString();
    Assertions.assertEquals(WaveMapCmd.EXIT_OK, WaveMapCmd.run(new String[] {"system", soc.toString(), uart.toString(), "-o", prefix, "-q"}));
    Path system = dir.resolve("soc_system.json");
    Assertions.assertTrue(Files.exists(system));

    Path metadata = dir.resolve("signals.json");
    Files.writeString(metadata, "{\"module\": \"soc_top\", \"signals\": {\"clk\": \"clock\", \"uart_busy\": \"status\"}}");
    Path waveform = dir.resolve("soc_wave.csv");
    Files.writeString(waveform, "time_ps,soc_tb.dut.clk,soc_tb.dut.u_uart.tx_busy\n0,0,0\n5,1,1\n");
    Path mapped = dir.resolve("soc_top_mapped.csv");
    Assertions.assertEquals(WaveMapCmd.EXIT_OK, WaveMapCmd.run(new String[] {"map", "-m", metadata.toString(), "-w", waveform.toString(),
                                                                             "-c", system.toString(), "-o", mapped.toString(), "-q"}));
    List<String> lines = Files.readAllLines(mapped);
    Assertions.assertEquals(List.of("\"\",clock,status", "time_ps,clk,uart_busy", "0,0,0", "5,1,1"), lines);

    Path second = dir.resolve("uart_mapped.csv");
    Files.writeString(second, ",status\ntime_ps,tx_busy\n0,0\n5,1\n");
    Assertions.assertEquals(WaveMapCmd.EXIT_OK, WaveMapCmd.run(new String[] {"merge", dir.toString(), "-q"}));
    Assertions.assertEquals("time_ps,clk,uart_busy,tx_busy", Files.readAllLines(dir.resolve("all_mapped_values.csv")).get(1));
  }

  @Test
  void testUsageErrors() {
    Assertions.assertEquals(WaveMapCmd.EXIT_USAGE, WaveMapCmd.run(new String[] {}));
    Assertions.assertEquals(WaveMapCmd.EXIT_USAGE, WaveMapCmd.run(new String[] {"unknown", "-q"}));
    Assertions.assertEquals(WaveMapCmd.EXIT_USAGE, WaveMapCmd.run(new String[] {"map", "-w", "wave.csv", "-q"}));
    Assertions.assertEquals(WaveMapCmd.EXIT_USAGE, WaveMapCmd.run(new String[] {"system", "--nonsense"}));
  }

  @Test
  void testFailedOperation(@TempDir Path dir) throws IOException {
    Path metadata = dir.resolve("signals.txt");
    Files.writeString(metadata, "clk clock\n");
    Path waveform = dir.resolve("wave.csv");
    Files.writeString(waveform, "time_ps,clk\n0,0\n");
    Assertions.assertEquals(WaveMapCmd.EXIT_FAILED,
                            WaveMapCmd.run(new String[] {"map", "-m", metadata.toString(), "-w", waveform.toString(), "-q"}));
    Assertions.assertEquals(WaveMapCmd.EXIT_FAILED, WaveMapCmd.run(new String[] {"merge", dir.toString(), "-q"}));
  }

  @Test
  void testInvalidConfiguration(@TempDir Path dir) throws IOException {
    Path config = dir.resolve("wavemap.yaml");
    Files.writeString(config, "flatten_passes: 0\n");
    Path rtl = dir.resolve("top.v");
    Files.writeString(rtl, "module top;\nendmodule\n");
    Assertions.assertEquals(WaveMapCmd.EXIT_FAILED, WaveMapCmd.run(new String[] {"system", rtl.toString(), "--config", config.toString(), "-q"}));
    Files.writeString(config, "strict_port_blocks: [true\n");
    Assertions.assertEquals(WaveMapCmd.EXIT_FAILED, WaveMapCmd.run(new String[] {"system", rtl.toString(), "--config", config.toString(), "-q"}));
  }

  @Test
  void testBaseName() {
    Assertions.assertEquals("soc_wave", WaveMapCmd.baseName("soc_wave.csv"));
    Assertions.assertEquals("trace", WaveMapCmd.baseName("trace"));
  }
}
