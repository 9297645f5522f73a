package wavemap.frontend;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RtlSourceTest {

  @Test
  void testCommentsAndBlankLinesRemoved() {
    RtlSource source = RtlSource.fromText("a.v", "module a; // trailing\n\n  /* block\n comment */ wire x;\r\n   \nendmodule\n");
    Assertions.assertEquals(List.of("module a;", "    wire x;", "endmodule"), source.getLines());
    Assertions.assertEquals("a.v", source.getName());
  }

  @Test
  void testBlockCommentSeparatesTokens() {
    Assertions.assertEquals("wire a ;", RtlSource.stripComments("wire a/*x*/;").replace("  ", " "));
    Assertions.assertEquals("a b", RtlSource.stripComments("a/* */b"));
  }
}
