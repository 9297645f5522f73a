package wavemap.mapping;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TableMergerTest {
  private static final OutputTable UART = new OutputTable(List.of("", "clock", "status"), List.of("time_ps", "clk", "tx_busy"),
                                                          List.of(List.of("0", "0", "0"), List.of("5", "1", "1")));
  private static final OutputTable ALU = new OutputTable(List.of("", "clock", "data"), List.of("time_ps", "clk", "res"),
                                                         List.of(List.of("0", "0", "7"), List.of("5", "1", "8"), List.of("10", "0", "9")));

  @Test
  void testMergeDropsKnownColumns() throws WaveformMappingException {
    OutputTable merged = TableMerger.merge(List.of(UART, ALU));
    Assertions.assertEquals(List.of("time_ps", "clk", "tx_busy", "res"), merged.getHeader());
    Assertions.assertEquals(List.of("", "clock", "status", "data"), merged.getClasses());
    Assertions.assertEquals(List.of(List.of("0", "0", "0", "7"), List.of("5", "1", "1", "8"), List.of("", "", "", "9")), merged.getRows());
  }

  @Test
  void testNeedsTwoTables() {
    Assertions.assertThrows(WaveformMappingException.class, () -> TableMerger.merge(List.of(UART)));
  }

  @Test
  void testMergeDirectory(@TempDir Path dir) throws IOException, WaveformMappingException {
    OutputTableWriter.write(ALU, dir.resolve("alu_mapped.csv"));
    OutputTableWriter.write(UART, dir.resolve("uart_mapped.csv"));
    Files.writeString(dir.resolve("notes.csv"), "ignored\n");
    Files.writeString(dir.resolve("short_mapped.csv"), ",other\ntime_ps,irq\n0\n");

    Path output = dir.resolve(TableMerger.MERGED_FILE);
    OutputTable merged = TableMerger.mergeDirectory(dir, output);
    Assertions.assertEquals(List.of("time_ps", "clk", "res", "irq", "tx_busy"), merged.getHeader());
    Assertions.assertEquals(List.of("0", "0", "7", "", "0"), merged.getRows().get(0));

    OutputTable reread = TableMerger.read(output);
    Assertions.assertEquals(merged.getHeader(), reread.getHeader());
    Assertions.assertEquals(merged.getRows(), reread.getRows());
  }
}
