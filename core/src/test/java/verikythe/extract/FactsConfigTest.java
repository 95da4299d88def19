//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.junit.*;
import static org.junit.Assert.*;

public class FactsConfigTest {

  @Test public void testDefaults () {
    FactsConfig config = FactsConfig.fromProperties(new Properties());
    assertEquals("", config.corpus);
    assertEquals("", config.root);
    assertEquals("verilog", config.language);
    assertTrue(config.mergeClosedScopes);
  }

  @Test public void testFromResource () throws IOException {
    Properties props = new Properties();
    try (InputStream in = getClass().getResourceAsStream("/facts-test.properties")) {
      assertNotNull(in);
      props.load(in);
    }
    FactsConfig config = FactsConfig.fromProperties(props);
    assertEquals("github.com/example/soc", config.corpus);
    assertEquals("rtl", config.root);
    assertEquals("verilog", config.language);
    assertFalse(config.mergeClosedScopes);
  }

  @Test public void testRefinement () {
    FactsConfig config = FactsConfig.DEFAULT.withCorpus("c").withLanguage("sv");
    assertEquals("c", config.corpus);
    assertEquals("sv", config.language);
    assertEquals("", FactsConfig.DEFAULT.corpus);
    assertFalse(config.withMergeClosedScopes(false).mergeClosedScopes);
    assertTrue(config.mergeClosedScopes);
  }
}
