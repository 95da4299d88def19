//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import org.junit.*;
import verikythe.model.*;
import static org.junit.Assert.*;

public class VNameContextTest {

  @Test public void testPushPop () {
    VName file = new VName(Signature.ROOT, "", "", "a.sv", "");
    VName foo = new VName(Signature.of("foo", SignatureKind.MODULE), "", "", "a.sv", "verilog");
    VNameContext context = new VNameContext();
    context.push(file);
    context.push(foo);
    assertEquals(2, context.size());
    assertEquals(foo, context.top());
    assertEquals(foo, context.pop());
    assertEquals(file, context.top());
    assertEquals(file, context.pop());
    assertTrue(context.isEmpty());
  }

  @Test(expected=IllegalStateException.class)
  public void testTopOfEmpty () {
    new VNameContext().top();
  }

  @Test(expected=IllegalStateException.class)
  public void testPopOfEmpty () {
    new VNameContext().pop();
  }
}
