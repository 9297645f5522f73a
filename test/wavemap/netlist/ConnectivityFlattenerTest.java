package wavemap.netlist;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ConnectivityFlattenerTest {
  private static final List<Connection> CHAIN = List.of(new Connection("top", "mid", "u_mid", "x", "sig"),
                                                        new Connection("mid", "leaf", "u_leaf", "y", "x"),
                                                        new Connection("leaf", "cell", "u_cell", "z", "y"));

  @Test
  void testOneLevel() {
    List<FlattenedConnection> links = ConnectivityFlattener.flatten(NetlistFixtures.graph().getConnections());
    Assertions.assertEquals(List.of(new FlattenedConnection("soc_top", "clk", "shifter", "clk", "u_uart", "uart", "u_shift", "clk")),
                            links);
  }

  @Test
  void testEmpty() {
    Assertions.assertTrue(ConnectivityFlattener.flatten(List.of()).isEmpty());
    Assertions.assertTrue(ConnectivityFlattener.flatten(List.of(), 3).isEmpty());
  }

  @Test
  void testLinksFollowDirectConnectionPairs() {
    for (FlattenedConnection link : ConnectivityFlattener.flatten(CHAIN)) {
      Assertions.assertTrue(CHAIN.stream().anyMatch(c -> c.getParentModule().equals(link.getFromModule()) &&
                                                         c.getInstance().equals(link.getViaInstance()) &&
                                                         c.getChildModule().equals(link.getViaModule())));
      Assertions.assertTrue(CHAIN.stream().anyMatch(c -> c.getParentModule().equals(link.getViaModule()) &&
                                                         c.getInstance().equals(link.getToInstance()) &&
                                                         c.getChildModule().equals(link.getToModule())));
    }
  }

  @Test
  void testExpressionOperands() {
    List<Connection> connections = List.of(new Connection("top", "mid", "u_mid", "a", "s"),
                                           new Connection("mid", "leaf", "u_leaf", "bus", "{a, b[1:0]}"),
                                           new Connection("mid", "leaf", "u_leaf2", "other", "aa"));
    List<FlattenedConnection> links = ConnectivityFlattener.flatten(connections);
    Assertions.assertEquals(1, links.size());
    Assertions.assertEquals("{a, b[1:0]}", links.get(0).getInnerExpr());
    Assertions.assertEquals("u_leaf", links.get(0).getToInstance());
  }

  @Test
  void testRepeatedPassesReachDeeperLevels() {
    Assertions.assertEquals(2, ConnectivityFlattener.flatten(CHAIN, 1).size());
    List<FlattenedConnection> deep = ConnectivityFlattener.flatten(CHAIN, 5);
    Assertions.assertEquals(4, deep.size());
    Assertions.assertTrue(deep.stream().anyMatch(link -> link.getFromModule().equals("top") && link.getToModule().equals("cell") &&
                                                         link.getToSignal().equals("z")));
    Assertions.assertEquals("u_mid.u_leaf", deep.get(0).asConnection().getInstance());
  }
}
