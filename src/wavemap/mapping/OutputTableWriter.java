package wavemap.mapping;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes mapped tables as CSV: classification row, header row, data rows.
 */
public class OutputTableWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private OutputTableWriter() {}

  public static void write(OutputTable table, Path file) throws IOException {
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      write(table, writer);
    }
    logger.info("Wrote {} row(s) to {}", table.getRows().size(), file);
  }

  public static void write(OutputTable table, Writer writer) throws IOException {
    CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT);
    printer.printRecord(table.getClasses());
    printer.printRecord(table.getHeader());
    for (List<String> row : table.getRows())
      printer.printRecord(row);
    printer.flush();
  }
}
