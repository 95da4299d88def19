//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.model;

import com.google.common.base.Joiner;
import java.util.List;
import org.junit.*;
import static org.junit.Assert.*;

public class IndexingFactNodeTest {

  @Test public void testBuilder () {
    IndexingFactNode root = IndexingFactNode.builder(IndexingFactType.FILE)
      .child(IndexingFactNode.builder(IndexingFactType.MODULE)
             .anchor("foo", 7)
             .child(IndexingFactNode.builder(IndexingFactType.VARIABLE_DEFINITION).anchor("x", 19)))
      .build();

    assertEquals(1, root.children.size());
    IndexingFactNode foo = root.children.get(0);
    assertEquals(new Anchor("foo", 7, 10), foo.anchor(0));
    assertNull(foo.anchor(1));
    assertEquals(IndexingFactType.VARIABLE_DEFINITION, foo.children.get(0).type);

    assertEquals(Joiner.on("\n").join("FILE",
                                      "  MODULE {foo @7-10}",
                                      "    VARIABLE_DEFINITION {x @19-20}",
                                      ""), root.toString());
  }

  @Test public void testChildrenInOrder () {
    List<IndexingFactNode> ports = List.of(
      IndexingFactNode.builder(IndexingFactType.VARIABLE_DEFINITION).anchor("a", 11).build(),
      IndexingFactNode.builder(IndexingFactType.VARIABLE_DEFINITION).anchor("b", 14).build());
    IndexingFactNode mod = IndexingFactNode.builder(IndexingFactType.MODULE)
      .anchor("m", 7)
      .children(ports)
      .child(IndexingFactNode.builder(IndexingFactType.VARIABLE_REFERENCE).anchor("a", 20))
      .build();

    assertEquals(3, mod.children.size());
    assertEquals(ports, mod.children.subList(0, 2));
    assertEquals(IndexingFactType.VARIABLE_REFERENCE, mod.children.get(2).type);
  }

  @Test public void testAnchorCoversUtf8Bytes () {
    // "µ" is one char but two bytes in UTF-8
    Anchor mu = Anchor.of("\u00b5s", 4);
    assertEquals(4, mu.startLocation);
    assertEquals(7, mu.endLocation);
    assertEquals(new Anchor("foo", 3, 6), Anchor.of("foo", 3));
  }

  @Test(expected=UnsupportedOperationException.class)
  public void testImmutable () {
    IndexingFactNode.builder(IndexingFactType.FILE).build().children.add(
      IndexingFactNode.builder(IndexingFactType.FILE).build());
  }

  @Test(expected=IllegalArgumentException.class)
  public void testInvertedAnchor () {
    new Anchor("x", 5, 4);
  }
}
