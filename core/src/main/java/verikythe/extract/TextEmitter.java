//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import verikythe.model.*;

/**
 * A {@code FactEmitter} that emits a simple text representation of the facts, one per line:
 * {@code source name value} for facts and {@code source kind target} for edges. VNames are
 * written as their signatures, with file VNames written as their path. Values are written
 * verbatim, except that backslashes and line breaks ({@code \n}, {@code \r}) are escaped so
 * that each entry stays on one line.
 */
public class TextEmitter extends FactEmitter {

  public TextEmitter (PrintWriter out) {
    _out = out;
  }

  @Override public void emitFact (VName source, FactName name, String value) {
    emit(source, name.value, value.replace("\\", "\\\\").replace("\n", "\\n")
         .replace("\r", "\\r"));
  }

  @Override public void emitEdge (VName source, EdgeKind kind, VName target) {
    emit(source, kind.value, label(target));
  }

  /** Flushes the underlying writer.
    * @throws UncheckedIOException if any write to it has failed. */
  @Override public void flush () {
    _out.flush();
    if (_out.checkError()) throw new UncheckedIOException(new IOException("Failed writing facts"));
  }

  private void emit (VName source, String key, String value) {
    PrintWriter out = _out;
    out.print(label(source));
    out.print(" ");
    out.print(key);
    out.print(" ");
    out.println(value);
  }

  private static String label (VName vname) {
    return vname.signature.isRoot() ? vname.path : vname.signature.toString();
  }

  private final PrintWriter _out;
}
