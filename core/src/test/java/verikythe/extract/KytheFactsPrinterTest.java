//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import org.junit.*;
import verikythe.model.*;
import static org.junit.Assert.*;

public class KytheFactsPrinterTest {

  /*@Test*/ public void testDump () {
    System.out.println(KytheFactsPrinter.print(KytheFactsExtractorTest.testaTree(), "foo.sv"));
  }

  @Test public void testOneEntryPerLine () throws IOException {
    String facts = KytheFactsPrinter.print(KytheFactsExtractorTest.testaTree(), "foo.sv");
    EntryCollector expect = new EntryCollector();
    new KytheFactsExtractor("foo.sv", expect).visit(KytheFactsExtractorTest.testaTree());

    String[] lines = facts.split("\\R");
    assertEquals(expect.entries().size(), lines.length);
    ObjectMapper mapper = new ObjectMapper();
    for (int ii = 0; ii < lines.length; ii++) {
      JsonNode entry = mapper.readTree(lines[ii]);
      Entry ex = expect.entries().get(ii);
      assertEquals(ex.source.signature.toString(), entry.get("source").get("signature").asText());
      assertEquals("foo.sv", entry.get("source").get("path").asText());
      if (ex.isEdge()) assertEquals(ex.edgeKind.value, entry.get("edge_kind").asText());
      else assertEquals(ex.factName.value, entry.get("fact_name").asText());
    }
  }

  @Test public void testDeterministic () {
    FactsConfig config = FactsConfig.DEFAULT.withCorpus("soc");
    String first = KytheFactsPrinter.print(KytheFactsExtractorTest.testaTree(), "foo.sv", config);
    String second = KytheFactsPrinter.print(KytheFactsExtractorTest.testaTree(), "foo.sv", config);
    assertEquals(first, second);
  }

  @Test public void testEmptyFile () throws IOException {
    String facts = KytheFactsPrinter.print(
      IndexingFactNode.builder(IndexingFactType.FILE).build(), "empty.sv");
    JsonNode entry = new ObjectMapper().readTree(facts);
    assertEquals("empty.sv", entry.get("source").get("path").asText());
    assertEquals("/kythe/node/kind", entry.get("fact_name").asText());
    assertEquals("ZmlsZQ==", entry.get("fact_value").asText());
  }

  @Test(expected=MalformedTreeException.class)
  public void testMalformed () {
    KytheFactsPrinter.print(IndexingFactNode.builder(IndexingFactType.MODULE).build(), "x.sv");
  }

  @Test(expected=UncheckedIOException.class)
  public void testWriteFailureIsReported () {
    KytheFactsPrinter.printTo(KytheFactsExtractorTest.testaTree(), "foo.sv", FactsConfig.DEFAULT,
                              new PrintWriter(new FullDiskWriter()));
  }

  /** A writer whose every operation fails, as when the output device is full. */
  static class FullDiskWriter extends Writer {
    @Override public void write (char[] buf, int off, int len) throws IOException {
      throw new IOException("disk full");
    }
    @Override public void flush () throws IOException {
      throw new IOException("disk full");
    }
    @Override public void close () {}
  }
}
