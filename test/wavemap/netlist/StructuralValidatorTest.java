package wavemap.netlist;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import wavemap.frontend.ModuleDecl;

class StructuralValidatorTest {

  @Test
  void testTwoOfThreePortsBound() {
    List<MissingPortIssue> issues = StructuralValidator.findMissingPorts(NetlistFixtures.graph());
    Assertions.assertEquals(1, issues.size());
    Assertions.assertEquals("u_shift", issues.get(0).getInstance());
    Assertions.assertEquals("shifter", issues.get(0).getSubmodule());
    Assertions.assertEquals(List.of("load"), issues.get(0).getMissingPorts());
  }

  @Test
  void testMissingPortsSorted() {
    Map<String, ModuleDecl> modules = Map.of("alu", new ModuleDecl("alu", List.of("op", "b", "a", "y"), List.of()));
    List<Connection> connections = List.of(new Connection("top", "alu", "u_alu", "y", "res"));
    Assertions.assertEquals(List.of("a", "b", "op"), StructuralValidator.findMissingPorts(modules, connections).get(0).getMissingPorts());
  }

  @Test
  void testUnknownSubmoduleNotChecked() {
    List<Connection> connections = List.of(new Connection("top", "vendor_ip", "u_ip", "a", "x"));
    Assertions.assertTrue(StructuralValidator.findMissingPorts(Map.of(), connections).isEmpty());
  }
}
