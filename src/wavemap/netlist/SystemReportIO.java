package wavemap.netlist;

import java.io.IOException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavemap.util.Json;

/**
 * Reads and writes system reports as JSON.
 */
public class SystemReportIO {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private SystemReportIO() {}

  public static void write(SystemReport report, Path file) throws IOException {
    Json.getMapper().writeValue(file.toFile(), report);
    logger.info("Wrote system report {}", file);
  }

  public static SystemReport read(Path file) throws IOException {
    SystemReport ret = Json.getMapper().readValue(file.toFile(), SystemReport.class);
    logger.debug("Read system report {}: {} module(s), {} direct connection(s)", file, ret.getModules().size(),
                 ret.getDirectConnections().size());
    return ret;
  }
}
