//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import verikythe.model.*;

/**
 * The sink via which the extractor emits Kythe facts and edges while traversing an indexing facts
 * tree. Calls arrive in traversal order and implementations must preserve that order. Emitters
 * do no validation; the extractor is responsible for the shape of the graph.
 */
public abstract class FactEmitter {

  /** Emits the fact {@code name} = {@code value} about {@code source}. */
  public abstract void emitFact (VName source, FactName name, String value);

  /** Emits an edge of kind {@code kind} from {@code source} to {@code target}. */
  public abstract void emitEdge (VName source, EdgeKind kind, VName target);

  /** Flushes anything buffered to the underlying sink. Called once at the end of a run. */
  public void flush () {
    // nada
  }
}
