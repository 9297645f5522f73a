package wavemap.mapping;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Combines mapped tables of several modules side by side, rows aligned by index.
 * A column whose header is already present is taken from the first table that has it.
 */
public class TableMerger {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String MAPPED_SUFFIX = "_mapped.csv";
  public static final String MERGED_FILE = "all_mapped_values.csv";

  private TableMerger() {}

  /**
   * @param tables at least two tables
   * @return the merged table; shorter tables contribute empty cells
   * @throws WaveformMappingException if fewer than two tables are given
   */
  public static OutputTable merge(List<OutputTable> tables) throws WaveformMappingException {
    if (tables.size() < 2)
      throw new WaveformMappingException("Merging needs at least 2 mapped tables, got " + tables.size());
    OutputTable ret = tables.get(0);
    for (OutputTable table : tables.subList(1, tables.size()))
      ret = merge(ret, table);
    return ret;
  }

  static OutputTable merge(OutputTable first, OutputTable second) {
    List<Integer> keep = new ArrayList<>();
    for (int j = 0; j < second.getWidth(); ++j) {
      if (!first.getHeader().contains(second.getHeader().get(j)))
        keep.add(j);
    }
    List<String> classes = new ArrayList<>(first.getClasses());
    List<String> header = new ArrayList<>(first.getHeader());
    for (int j : keep) {
      classes.add(second.getClasses().get(j));
      header.add(second.getHeader().get(j));
    }
    List<List<String>> rows = new ArrayList<>();
    int rowCount = Math.max(first.getRows().size(), second.getRows().size());
    for (int i = 0; i < rowCount; ++i) {
      List<String> row = new ArrayList<>(i < first.getRows().size() ? first.getRows().get(i) : pad(List.of(), first.getWidth()));
      List<String> other = i < second.getRows().size() ? second.getRows().get(i) : pad(List.of(), second.getWidth());
      for (int j : keep)
        row.add(other.get(j));
      rows.add(row);
    }
    return new OutputTable(classes, header, rows);
  }

  /**
   * Reads a mapped CSV. Rows are padded or truncated to the header's length.
   * @throws WaveformMappingException if the file lacks the classification or header row
   */
  public static OutputTable read(Path file) throws IOException, WaveformMappingException {
    List<List<String>> records = new ArrayList<>();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8); CSVParser parser = CSVParser.parse(reader, CSVFormat.DEFAULT)) {
      for (CSVRecord record : parser)
        records.add(record.toList());
    }
    if (records.size() < 2)
      throw new WaveformMappingException(file + ": expected a classification row and a header row");
    List<String> header = records.get(1);
    List<List<String>> rows = new ArrayList<>();
    for (List<String> record : records.subList(2, records.size()))
      rows.add(pad(record, header.size()));
    return new OutputTable(pad(records.get(0), header.size()), header, rows);
  }

  /**
   * Merges every <code>*_mapped.csv</code> of a directory, sorted by file name.
   * @param directory directory holding the mapped tables
   * @param output file to write, typically {@value #MERGED_FILE} in the directory
   * @return the merged table
   */
  public static OutputTable mergeDirectory(Path directory, Path output) throws IOException, WaveformMappingException {
    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + MAPPED_SUFFIX)) {
      for (Path file : stream) {
        if (!file.getFileName().toString().equals(MERGED_FILE))
          files.add(file);
      }
    }
    files.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
    logger.info("Merging {} mapped table(s) from {}", files.size(), directory);
    List<OutputTable> tables = new ArrayList<>();
    for (Path file : files) {
      logger.debug("Reading {}", file);
      tables.add(read(file));
    }
    OutputTable ret = merge(tables);
    OutputTableWriter.write(ret, output);
    return ret;
  }

  private static List<String> pad(List<String> row, int length) {
    List<String> ret = new ArrayList<>(row.subList(0, Math.min(row.size(), length)));
    while (ret.size() < length)
      ret.add("");
    return ret;
  }
}
