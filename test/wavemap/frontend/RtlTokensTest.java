package wavemap.frontend;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RtlTokensTest {

  @Test
  void testIdentifiers() {
    Assertions.assertEquals(List.of("a", "b", "idx"), RtlTokens.identifiers("{a, b[idx], 4'hF, 8'b1010_x}"));
    Assertions.assertEquals(List.of("uart_busy"), RtlTokens.identifiers("uart_busy"));
    Assertions.assertEquals(List.of(), RtlTokens.identifiers("1'b0"));
  }

  @Test
  void testSplitTopLevel() {
    Assertions.assertEquals(List.of("input a", " input [7:0] b", " output {c, d}"),
                            RtlTokens.splitTopLevel("input a, input [7:0] b, output {c, d}"));
  }

  @Test
  void testStripIndex() {
    Assertions.assertEquals("data", RtlTokens.stripIndex("data[7:0]"));
    Assertions.assertEquals("data", RtlTokens.stripIndex("data"));
  }
}
