//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import verikythe.model.IndexingFactNode;

/**
 * Thrown when an indexing facts tree violates the structure the extractor relies on. The run is
 * aborted; no attempt is made to emit facts for the rest of the tree.
 */
public class MalformedTreeException extends IllegalStateException {

  /** The node at which the violation was detected. */
  public final transient IndexingFactNode node;

  public MalformedTreeException (String message, IndexingFactNode node) {
    super(message + " [node=" + node.type + ", anchors=" + node.anchors + "]");
    this.node = node;
  }

  private static final long serialVersionUID = 1L;
}
