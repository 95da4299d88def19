//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.io.BaseEncoding;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import verikythe.model.*;

/**
 * A {@code FactEmitter} that writes each fact or edge as a Kythe JSON entry, one per line:
 *
 * <pre>{@code
 * {"source":{...},"fact_name":"/kythe/node/kind","fact_value":"ZmlsZQ=="}
 * {"source":{...},"edge_kind":"/kythe/edge/childof","target":{...},"fact_name":"/"}
 * }</pre>
 *
 * Fact values are base64 encoded, as the Kythe entry stream format requires.
 */
public class JsonEntryEmitter extends FactEmitter {

  public JsonEntryEmitter (PrintWriter out) {
    _out = out;
  }

  @Override public void emitFact (VName source, FactName name, String value) {
    ObjectNode entry = _mapper.createObjectNode();
    entry.set("source", toJson(source));
    entry.put("fact_name", name.value);
    entry.put("fact_value", BASE64.encode(value.getBytes(StandardCharsets.UTF_8)));
    write(entry);
  }

  @Override public void emitEdge (VName source, EdgeKind kind, VName target) {
    ObjectNode entry = _mapper.createObjectNode();
    entry.set("source", toJson(source));
    entry.put("edge_kind", kind.value);
    entry.set("target", toJson(target));
    entry.put("fact_name", "/");
    write(entry);
  }

  /** Flushes the underlying writer.
    * @throws UncheckedIOException if any write to it has failed. */
  @Override public void flush () {
    _out.flush();
    if (_out.checkError()) throw new UncheckedIOException(new IOException("Failed writing facts"));
  }

  protected ObjectNode toJson (VName vname) {
    ObjectNode node = _mapper.createObjectNode();
    node.put("signature", vname.signature.toString());
    node.put("path", vname.path);
    node.put("language", vname.language);
    node.put("root", vname.root);
    node.put("corpus", vname.corpus);
    return node;
  }

  private void write (ObjectNode entry) {
    try {
      _out.println(_mapper.writeValueAsString(entry));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static final BaseEncoding BASE64 = BaseEncoding.base64();

  private final ObjectMapper _mapper = new ObjectMapper();
  private final PrintWriter _out;
}
