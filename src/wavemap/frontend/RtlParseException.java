package wavemap.frontend;

/**
 * Thrown when an RTL source lacks a construct that an operation cannot do without, e.g. a module declaration.
 */
public class RtlParseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String sourceName;

  public RtlParseException(String sourceName, String message) {
    super(sourceName + ": " + message);
    this.sourceName = sourceName;
  }

  /** Returns the name of the source (usually a file path) that could not be analyzed. */
  public String getSourceName() { return sourceName; }
}
