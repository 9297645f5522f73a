package wavemap.mapping;

/**
 * Thrown if waveform, metadata or mapped tables cannot be brought into the expected shape.
 */
public class WaveformMappingException extends Exception {
  private static final long serialVersionUID = 1L;

  public WaveformMappingException(String message) { super(message); }
  public WaveformMappingException(String message, Throwable cause) { super(message, cause); }
}
