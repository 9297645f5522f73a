package wavemap.netlist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * An assignment whose sides have different numeric bit widths.
 */
@JsonPropertyOrder({"module", "lhs", "lhs_width", "rhs", "rhs_width"})
public class WidthMismatch {
  @JsonProperty("module") private final String module;
  @JsonProperty("lhs") private final String lhs;
  @JsonProperty("lhs_width") private final int lhsWidth;
  @JsonProperty("rhs") private final String rhs;
  @JsonProperty("rhs_width") private final int rhsWidth;

  @JsonCreator
  public WidthMismatch(@JsonProperty("module") String module, @JsonProperty("lhs") String lhs, @JsonProperty("lhs_width") int lhsWidth,
                       @JsonProperty("rhs") String rhs, @JsonProperty("rhs_width") int rhsWidth) {
    this.module = module;
    this.lhs = lhs;
    this.lhsWidth = lhsWidth;
    this.rhs = rhs;
    this.rhsWidth = rhsWidth;
  }

  public String getModule() { return module; }
  public String getLhs() { return lhs; }
  public int getLhsWidth() { return lhsWidth; }
  public String getRhs() { return rhs; }
  public int getRhsWidth() { return rhsWidth; }

  @Override
  public String toString() {
    return String.format("%s: %s expects width %d, connected to %s (width %d)", module, lhs, lhsWidth, rhs, rhsWidth);
  }
}
