package wavemap.mapping;

/**
 * How a connected signal name was located among the waveform columns, tried in declaration order.
 */
public enum MatchStrategy {
  /** The column header equals the name */
  EXACT,
  /** Header and name are equal after {@link SignalNames#normalize(String)} */
  NORMALIZED,
  /** Header and name end in the same component */
  LAST_COMPONENT,
  /** The header ends in <code>.name</code> or <code>_name</code> */
  SUFFIX
}
