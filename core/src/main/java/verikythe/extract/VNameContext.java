//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.Deque;
import verikythe.model.VName;

/**
 * The VNames of the scopes enclosing the node being visited, innermost on top. Used to make
 * signatures relative to their enclosing scopes:
 *
 * <pre>{@code
 * module foo;
 *   wire x;    // x#variable#foo#module
 * endmodule
 * module bar;
 *   wire x;    // x#variable#bar#module
 * endmodule
 * }</pre>
 */
public class VNameContext {

  public void push (VName vname) {
    _stack.push(Preconditions.checkNotNull(vname, "vname"));
  }

  public VName pop () {
    Preconditions.checkState(!_stack.isEmpty(), "Pop of empty VName context.");
    return _stack.pop();
  }

  /** Returns the VName of the innermost enclosing scope. */
  public VName top () {
    Preconditions.checkState(!_stack.isEmpty(), "No enclosing VName.");
    return _stack.peek();
  }

  public boolean isEmpty () {
    return _stack.isEmpty();
  }

  public int size () {
    return _stack.size();
  }

  private final Deque<VName> _stack = new ArrayDeque<>();
}
