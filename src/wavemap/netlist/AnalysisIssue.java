package wavemap.netlist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A defect found while reading inputs. Issues never stop a run; they are collected in the result so the caller can
 * decide how severe they are.
 */
@JsonPropertyOrder({"kind", "source", "message"})
public class AnalysisIssue {
  public static enum Kind {
    /** An input file could not be read */
    UNREADABLE_FILE,
    /** An RTL file declares no module */
    NO_MODULE,
    /** A port-connection block reaches the end of input without its closing ');' */
    UNTERMINATED_INSTANCE,
    /** A module name is declared again by a later file, which replaces the earlier declaration */
    MODULE_REDECLARED,
    /** The width check of a file failed; the file's connectivity is still reported */
    WIDTH_CHECK_FAILED,
    /** A sampled row has no time column */
    MISSING_TIME_COLUMN
  }

  @JsonProperty("kind") private final Kind kind;
  @JsonProperty("source") private final String source;
  @JsonProperty("message") private final String message;

  @JsonCreator
  public AnalysisIssue(@JsonProperty("kind") Kind kind, @JsonProperty("source") String source, @JsonProperty("message") String message) {
    this.kind = kind;
    this.source = source;
    this.message = message;
  }

  public Kind getKind() { return kind; }
  /** File, module or row the issue refers to. */
  public String getSource() { return source; }
  public String getMessage() { return message; }

  @Override
  public String toString() {
    return String.format("%s [%s]: %s", kind, source, message);
  }
}
