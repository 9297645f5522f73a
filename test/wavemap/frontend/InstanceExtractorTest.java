package wavemap.frontend;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class InstanceExtractorTest {
  private final InstanceExtractor extractor = new InstanceExtractor();

  private List<Instance> extract(String text) { return extractor.extract("top", RtlSource.fromText("top.v", text).getLines()); }

  @Test
  void testMultiLineInstance() {
    List<Instance> instances = extract("module top (input clk);\n"
                                       + "  uart_tx u_uart (\n"
                                       + "    .clk(clk),\n"
                                       + "    .tx_busy( uart_busy ),\n"
                                       + "    .data({a, b[3:0]})\n"
                                       + "  );\n"
                                       + "endmodule\n");
    Assertions.assertEquals(1, instances.size());
    Instance uart = instances.get(0);
    Assertions.assertEquals("top", uart.getParentModule());
    Assertions.assertEquals("uart_tx", uart.getModuleType());
    Assertions.assertEquals("u_uart", uart.getName());
    Assertions.assertTrue(uart.isTerminated());
    Assertions.assertEquals(List.of("clk", "tx_busy", "data"), List.copyOf(uart.getBindings().keySet()));
    Assertions.assertEquals("uart_busy", uart.getBindings().get("tx_busy"));
    Assertions.assertEquals("{a, b[3:0]}", uart.getBindings().get("data"));
  }

  @Test
  void testParameterizedInstance() {
    List<Instance> instances = extract("fifo #(\n"
                                       + "  .DEPTH(4),\n"
                                       + "  .WIDTH(8)\n"
                                       + ") u_fifo (\n"
                                       + "  .din(wdata),\n"
                                       + "  .dout(rdata)\n"
                                       + ");\n");
    Assertions.assertEquals(1, instances.size());
    Assertions.assertEquals("fifo", instances.get(0).getModuleType());
    Assertions.assertEquals("u_fifo", instances.get(0).getName());
    Assertions.assertEquals(Map.of("din", "wdata", "dout", "rdata"), instances.get(0).getBindings());
  }

  @Test
  void testSingleLineInstancesEndOnTheirLine() {
    List<Instance> instances = extract("sub u1 (.a(x), .b(y));\nsub u2 (.a(z));\nfifo #(.D(4)) u3 (.a(w));\n");
    Assertions.assertEquals(3, instances.size());
    Assertions.assertEquals("u1", instances.get(0).getName());
    Assertions.assertEquals("x", instances.get(0).getBindings().get("a"));
    Assertions.assertEquals(Map.of("a", "z"), instances.get(1).getBindings());
    Assertions.assertEquals("u3", instances.get(2).getName());
    Assertions.assertEquals(Map.of("a", "w"), instances.get(2).getBindings());
  }

  @Test
  void testKeywordLinesAreNotInstances() {
    List<Instance> instances = extract("module top (input a, output b);\n"
                                       + "  always @(posedge clk) begin\n"
                                       + "    if (a) begin\n"
                                       + "    end\n"
                                       + "  end\n"
                                       + "  assign b = f(a);\n"
                                       + "  wire w (a);\n"
                                       + "endmodule\n");
    Assertions.assertTrue(instances.isEmpty(), instances.toString());
  }

  @Test
  void testEmptyBindingBindsNothing() {
    List<Instance> instances = extract("sub u_s (.a(x), .b(), .c(1'b0));\n");
    Assertions.assertEquals(Map.of("a", "x", "c", "1'b0"), instances.get(0).getBindings());
  }

  @Test
  void testUnterminatedBlockKeepsBindings() {
    List<Instance> instances = extract("sub u_s (\n  .a(x),\n  .b(y)\n");
    Assertions.assertEquals(1, instances.size());
    Assertions.assertFalse(instances.get(0).isTerminated());
    Assertions.assertEquals(Map.of("a", "x", "b", "y"), instances.get(0).getBindings());
  }

  @Test
  void testParameterOpenerWithoutName() {
    Assertions.assertTrue(extract("fifo #(\n  .D(4)\n);\n").isEmpty());
  }

  @Test
  void testInstanceNamedLikeParameter() {
    List<Instance> instances = extract("sub #(.N(2), .M(3)) N (.a(x));\n");
    Assertions.assertEquals(1, instances.size());
    Assertions.assertEquals("N", instances.get(0).getName());
    Assertions.assertEquals(Map.of("a", "x"), instances.get(0).getBindings());
  }
}
