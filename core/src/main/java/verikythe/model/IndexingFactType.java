//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.model;

/**
 * Denotes the different kinds of node that appear in an indexing facts tree. Each kind either
 * opens a scope, defines a name, or refers to a name defined elsewhere.
 */
public enum IndexingFactType {

  /** A source file. Always the root of a tree. */
  FILE(Role.SCOPE, 0),

  /** A module declaration: {@code module foo; ... endmodule : foo}. */
  MODULE(Role.SCOPE, 1),

  /** A package declaration. */
  PACKAGE(Role.SCOPE, 1),

  /** A class declaration. */
  CLASS(Role.SCOPE, 1),

  /** A function or task declaration. */
  FUNCTION_OR_TASK(Role.SCOPE, 1),

  /** An instantiation of a module: {@code foo f1(...);}. Anchors are type then instance name. */
  MODULE_INSTANCE(Role.SCOPE, 2),

  /** A variable whose type is a class: {@code my_class c1;}. Anchors are type then name. */
  CLASS_INSTANCE(Role.SCOPE, 2),

  /** A net, variable or port declaration. */
  VARIABLE_DEFINITION(Role.DEFINITION, 1),

  /** A {@code `define} macro. */
  MACRO(Role.DEFINITION, 1),

  /** A use of a variable by name. */
  VARIABLE_REFERENCE(Role.REFERENCE, 1),

  /** A call of a function or task. */
  FUNCTION_CALL(Role.REFERENCE, 1),

  /** A use of a {@code `define} macro. */
  MACRO_CALL(Role.REFERENCE, 1);

  /** How a kind of node participates in name resolution. */
  public enum Role {
    /** Opens a scope that holds the definitions nested within it. */
    SCOPE,
    /** Adds a definition to the enclosing scope. */
    DEFINITION,
    /** Refers to a definition by name. */
    REFERENCE;
  }

  /** The resolution role of nodes of this kind. */
  public final Role role;

  /** The minimum number of anchors a node of this kind must carry. */
  public final int requiredAnchors;

  private IndexingFactType (Role role, int requiredAnchors) {
    this.role = role;
    this.requiredAnchors = requiredAnchors;
  }
}
