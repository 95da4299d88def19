//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.model;

/**
 * The Kythe edge kinds emitted by the extractor.
 */
public enum EdgeKind {

  /** From an anchor to the entity whose name the anchor binds. */
  DEFINES_BINDING("/kythe/edge/defines/binding"),

  /** From an anchor to the entity it refers to. */
  REF("/kythe/edge/ref"),

  /** From an anchor to the function or task it calls. */
  REF_CALL("/kythe/edge/ref/call"),

  /** From an anchor to the macro it expands. */
  REF_EXPANDS("/kythe/edge/ref/expands"),

  /** From an entity to the entity that encloses it. */
  CHILD_OF("/kythe/edge/childof"),

  /** From an instance to its module or class. */
  TYPED("/kythe/edge/typed");

  /** The edge kind as it appears in the Kythe schema. */
  public final String value;

  private EdgeKind (String value) {
    this.value = value;
  }

  @Override public String toString () {
    return value;
  }
}
