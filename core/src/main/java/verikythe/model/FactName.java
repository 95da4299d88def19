//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.model;

/**
 * The Kythe fact names emitted by the extractor. See
 * https://kythe.io/docs/schema/ for their meaning.
 */
public enum FactName {

  NODE_KIND("/kythe/node/kind"),
  SUBKIND("/kythe/subkind"),
  COMPLETE("/kythe/complete"),
  TEXT("/kythe/text"),
  LOC_START("/kythe/loc/start"),
  LOC_END("/kythe/loc/end");

  /** The name as it appears in the Kythe schema. */
  public final String value;

  private FactName (String value) {
    this.value = value;
  }

  @Override public String toString () {
    return value;
  }
}
