//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.model;

/**
 * Values of the {@link FactName#NODE_KIND}, {@link FactName#SUBKIND} and
 * {@link FactName#COMPLETE} facts.
 */
public final class NodeKind {

  public static final String FILE = "file";
  public static final String ANCHOR = "anchor";
  public static final String RECORD = "record";
  public static final String PACKAGE = "package";
  public static final String FUNCTION = "function";
  public static final String VARIABLE = "variable";
  public static final String MACRO = "macro";

  public static final String SUBKIND_MODULE = "module";
  public static final String SUBKIND_CLASS = "class";

  public static final String COMPLETE_DEFINITION = "definition";

  private NodeKind () {} // constants only
}
