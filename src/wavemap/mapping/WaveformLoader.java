package wavemap.mapping;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads a sampled waveform CSV: a header row, then one row per sample.
 */
public class WaveformLoader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
      .setAllowMissingColumnNames(true).setIgnoreEmptyLines(true).build();

  private WaveformLoader() {}

  public static WaveformTable load(Path file) throws IOException {
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      WaveformTable ret = load(reader);
      logger.info("Read {} sample(s) of {} column(s) from {}", ret.getRows().size(), ret.getColumns().size(), file);
      return ret;
    }
  }

  public static WaveformTable load(Reader reader) throws IOException {
    try (CSVParser parser = CSVParser.parse(reader, FORMAT)) {
      List<String> columns = parser.getHeaderNames();
      List<Map<String, String>> rows = new ArrayList<>();
      for (CSVRecord record : parser) {
        Map<String, String> row = new LinkedHashMap<>();
        for (String column : columns) {
          if (record.isSet(column))
            row.put(column, record.get(column));
        }
        rows.add(row);
      }
      return new WaveformTable(columns, rows);
    }
  }
}
