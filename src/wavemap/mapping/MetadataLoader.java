package wavemap.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavemap.util.Json;

/**
 * Reads signal classifications from JSON (<code>{"module": ..., "signals": {name: label}}</code>)
 * or CSV (a <code>module: name</code> line, then a header with a signal and a class column).
 */
public class MetadataLoader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final String MODULE_PREFIX = "module:";

  private final String clockLabel;

  public MetadataLoader(String clockLabel) { this.clockLabel = clockLabel; }

  public MetadataLoader() { this("clock"); }

  /**
   * Reads a metadata file, the format is chosen by extension.
   * @throws WaveformMappingException if the file is neither .csv nor .json or lacks the expected columns
   */
  public SignalMetadata load(Path file) throws IOException, WaveformMappingException {
    String name = file.getFileName().toString().toLowerCase();
    SignalMetadata ret;
    if (name.endsWith(".csv"))
      ret = loadCsv(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    else if (name.endsWith(".json"))
      ret = loadJson(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    else
      throw new WaveformMappingException("Expected metadata as CSV or JSON: " + file);
    logger.info("Read {} signal(s) from {} ({} clock(s))", ret.getLabels().size(), file, ret.getClocks().size());
    return ret;
  }

  SignalMetadata loadJson(String text, String sourceName) throws IOException, WaveformMappingException {
    JsonNode root = Json.getMapper().readTree(text);
    if (root == null || !root.isObject())
      throw new WaveformMappingException(sourceName + ": metadata must be a JSON object");
    Map<String, String> labels = new LinkedHashMap<>();
    JsonNode signals = root.path("signals");
    Iterator<Map.Entry<String, JsonNode>> fields = signals.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      labels.put(field.getKey(), field.getValue().asText());
    }
    String module = root.hasNonNull("module") ? root.get("module").asText() : null;
    return new SignalMetadata(module, labels, clockLabel);
  }

  SignalMetadata loadCsv(String text, String sourceName) throws IOException, WaveformMappingException {
    String module = null;
    String table = text;
    int firstBreak = text.indexOf('\n');
    String firstLine = (firstBreak < 0 ? text : text.substring(0, firstBreak)).trim();
    if (firstLine.toLowerCase().startsWith(MODULE_PREFIX)) {
      module = firstLine.substring(MODULE_PREFIX.length()).trim();
      table = firstBreak < 0 ? "" : text.substring(firstBreak + 1);
    }

    CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).setAllowMissingColumnNames(true)
        .setIgnoreEmptyLines(true).build();
    Map<String, String> labels = new LinkedHashMap<>();
    try (Reader reader = new StringReader(table); CSVParser parser = CSVParser.parse(reader, format)) {
      List<String> headers = parser.getHeaderNames();
      String signalColumn = findColumn(headers, "signal")
          .orElseThrow(() -> new WaveformMappingException(sourceName + ": no signal column in " + headers));
      String classColumn = findColumn(headers, "class")
          .orElseThrow(() -> new WaveformMappingException(sourceName + ": no class column in " + headers));
      for (CSVRecord record : parser) {
        if (!record.isSet(signalColumn)) {
          logger.warn("{}: skipping incomplete line {}", sourceName, record.getRecordNumber() + 1);
          continue;
        }
        String label = record.isSet(classColumn) ? record.get(classColumn).trim() : "";
        labels.put(record.get(signalColumn).trim(), label);
      }
    }
    return new SignalMetadata(module, labels, clockLabel);
  }

  private static Optional<String> findColumn(List<String> headers, String part) {
    return headers.stream().filter(header -> header.toLowerCase().contains(part)).findFirst();
  }
}
