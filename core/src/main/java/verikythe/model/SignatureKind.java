//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.model;

/**
 * The kinds of named entity a {@link Signature} component may denote. The tag of each kind is
 * what appears in a rendered signature, as in {@code foo#module}.
 */
public enum SignatureKind {

  MODULE("module"),
  PACKAGE("package"),
  CLASS("class"),
  FUNCTION("function"),
  VARIABLE("variable"),
  MACRO("macro");

  /** The tag used for this kind in rendered signatures. */
  public final String tag;

  private SignatureKind (String tag) {
    this.tag = tag;
  }
}
