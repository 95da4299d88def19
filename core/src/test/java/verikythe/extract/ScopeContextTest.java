//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import java.util.List;
import java.util.Optional;
import org.junit.*;
import verikythe.model.*;
import static org.junit.Assert.*;

public class ScopeContextTest {

  private static VName def (Signature sig) {
    return new VName(sig, "", "", "a.sv", "verilog");
  }

  private static final Signature FOO = Signature.of("foo", SignatureKind.MODULE);
  private static final Signature BAR = Signature.of("bar", SignatureKind.MODULE);

  @Test public void testSearchOrder () {
    ScopeContext scopes = new ScopeContext();
    VName fooMod = def(FOO), barMod = def(BAR);
    VName fooX = def(FOO.plus("x", SignatureKind.VARIABLE));
    VName barX = def(BAR.plus("x", SignatureKind.VARIABLE));
    VName barX2 = def(BAR.plus("x", SignatureKind.VARIABLE).plus("x", SignatureKind.VARIABLE));

    scopes.pushScope();
    scopes.currentScope().add(fooX);
    scopes.currentScope().add(fooMod);
    scopes.pushScope();
    scopes.currentScope().add(barX);
    scopes.currentScope().add(barMod);
    scopes.currentScope().add(barX2);

    // innermost scope, newest definition first
    assertEquals(Optional.of(barX2), scopes.searchForDefinition("x", SignatureKind.VARIABLE));
    // falls back to enclosing scopes
    assertEquals(Optional.of(fooMod), scopes.searchForDefinition("foo", SignatureKind.MODULE));
    assertEquals(Optional.empty(), scopes.searchForDefinition("x", SignatureKind.MODULE));

    List<VName> popped = scopes.popScope();
    assertEquals(List.of(barX, barMod, barX2), popped);
    assertEquals(Optional.of(fooX), scopes.searchForDefinition("x", SignatureKind.VARIABLE));
    assertEquals(Optional.empty(), scopes.searchForDefinition("bar", SignatureKind.MODULE));
  }

  @Test public void testPrefixSearchAgreesWithTypedSearch () {
    ScopeContext scopes = new ScopeContext();
    scopes.pushScope();
    scopes.currentScope().add(def(FOO));
    scopes.currentScope().add(def(FOO.plus("data", SignatureKind.VARIABLE)));
    scopes.currentScope().add(def(BAR.plus("data_in", SignatureKind.VARIABLE)));
    scopes.pushScope();
    scopes.currentScope().add(def(BAR));

    assertEquals(scopes.searchForDefinition("foo", SignatureKind.MODULE),
                 scopes.searchForDefinition("foo#module"));
    assertEquals(scopes.searchForDefinition("data", SignatureKind.VARIABLE),
                 scopes.searchForDefinition("data#variable"));
    assertEquals(scopes.searchForDefinition("bar", SignatureKind.MODULE),
                 scopes.searchForDefinition("bar#module"));
    assertFalse(scopes.searchForDefinition("baz#module").isPresent());
  }

  @Test public void testEmptyScopes () {
    ScopeContext scopes = new ScopeContext();
    assertTrue(scopes.isEmpty());
    assertFalse(scopes.searchForDefinition("x", SignatureKind.VARIABLE).isPresent());
    scopes.pushScope();
    scopes.pushScope();
    assertEquals(2, scopes.depth());
    assertFalse(scopes.searchForDefinition("x", SignatureKind.VARIABLE).isPresent());
  }

  @Test(expected=IllegalStateException.class)
  public void testPopEmpty () {
    new ScopeContext().popScope();
  }

  @Test(expected=IllegalStateException.class)
  public void testCurrentOfEmpty () {
    new ScopeContext().currentScope();
  }
}
