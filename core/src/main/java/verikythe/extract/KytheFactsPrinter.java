//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import java.io.PrintWriter;
import java.io.StringWriter;
import verikythe.model.IndexingFactNode;

/**
 * Renders all of the Kythe facts of one indexing facts tree as Kythe JSON entries, one per line.
 * This is the usual entry point for drivers that index a file at a time.
 */
public class KytheFactsPrinter {

  /** Returns the facts of {@code root}, which was extracted from {@code filePath}. */
  public static String print (IndexingFactNode root, String filePath) {
    return print(root, filePath, FactsConfig.DEFAULT);
  }

  /** Returns the facts of {@code root}, which was extracted from {@code filePath}. */
  public static String print (IndexingFactNode root, String filePath, FactsConfig config) {
    StringWriter out = new StringWriter();
    printTo(root, filePath, config, new PrintWriter(out));
    return out.toString();
  }

  /** Writes the facts of {@code root}, which was extracted from {@code filePath}, to {@code out}.
    * @throws MalformedTreeException if {@code root} is not a well formed tree. */
  public static void printTo (IndexingFactNode root, String filePath, FactsConfig config,
                              PrintWriter out) {
    new KytheFactsExtractor(filePath, new JsonEntryEmitter(out), config).visit(root);
  }

  private KytheFactsPrinter () {} // static methods only
}
