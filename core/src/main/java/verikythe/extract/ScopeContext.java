//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Optional;
import java.util.function.Predicate;
import verikythe.model.SignatureKind;
import verikythe.model.VName;

/**
 * The scopes visible from the node being visited, innermost on top. Each scope holds the VNames
 * of the definitions made directly within it, in the order they were made.
 *
 * <p>A scope is filled while its own subtree is visited. Only once that is complete are its
 * definitions handed to the enclosing scope, so references are resolved against what has been
 * defined so far in the current scope and in the scopes that enclose it.</p>
 */
public class ScopeContext {

  /** Opens a new, empty scope. */
  public void pushScope () {
    _scopes.push(new ArrayList<>());
  }

  /** Returns the definitions of the innermost scope, to which new definitions are appended. */
  public List<VName> currentScope () {
    Preconditions.checkState(!_scopes.isEmpty(), "No open scope.");
    return _scopes.peek();
  }

  /** Closes the innermost scope and returns its definitions. */
  public List<VName> popScope () {
    Preconditions.checkState(!_scopes.isEmpty(), "Pop of empty scope context.");
    return _scopes.pop();
  }

  public boolean isEmpty () {
    return _scopes.isEmpty();
  }

  public int depth () {
    return _scopes.size();
  }

  /**
   * Finds the definition of {@code name} of kind {@code kind}. Scopes are searched innermost
   * first, and each scope from its newest definition to its oldest, so the first match is the
   * nearest and most recent one.
   */
  public Optional<VName> searchForDefinition (String name, SignatureKind kind) {
    return search(vn -> vn.signature.matches(name, kind));
  }

  /**
   * Finds the first definition, in the same order as {@link #searchForDefinition(String,
   * SignatureKind)}, whose rendered signature starts with {@code prefix}. Given
   * {@code "bar#module"} this returns the VName of module {@code bar}.
   */
  public Optional<VName> searchForDefinition (String prefix) {
    return search(vn -> vn.signature.startsWith(prefix));
  }

  private Optional<VName> search (Predicate<VName> pred) {
    for (List<VName> scope : _scopes) {
      for (ListIterator<VName> it = scope.listIterator(scope.size()); it.hasPrevious(); ) {
        VName vname = it.previous();
        if (pred.test(vname)) return Optional.of(vname);
      }
    }
    return Optional.empty();
  }

  // ArrayDeque iterates from the most recently pushed element
  private final Deque<List<VName>> _scopes = new ArrayDeque<>();
}
