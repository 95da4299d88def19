//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import com.google.common.base.Preconditions;
import java.util.Properties;

/**
 * Configures an extraction run. Instances are immutable; the {@code with} methods return refined
 * copies.
 */
public final class FactsConfig {

  /** The property key for {@link #corpus}. */
  public static final String CORPUS_KEY = "verikythe.corpus";
  /** The property key for {@link #root}. */
  public static final String ROOT_KEY = "verikythe.root";
  /** The property key for {@link #language}. */
  public static final String LANGUAGE_KEY = "verikythe.language";
  /** The property key for {@link #mergeClosedScopes}. */
  public static final String MERGE_KEY = "verikythe.mergeClosedScopes";

  /** The default configuration. */
  public static final FactsConfig DEFAULT = new FactsConfig("", "", "verilog", true);

  /** The corpus stamped onto every emitted VName. */
  public final String corpus;

  /** The root stamped onto every emitted VName. */
  public final String root;

  /** The language stamped onto every non-file VName. */
  public final String language;

  /** Whether the definitions of a closed scope become visible in its parent scope. When false,
    * only the closed scope's own VName is added to the parent. */
  public final boolean mergeClosedScopes;

  /**
   * Creates a config from {@code props}. Keys that are absent keep their {@link #DEFAULT} value.
   */
  public static FactsConfig fromProperties (Properties props) {
    FactsConfig d = DEFAULT;
    String merge = props.getProperty(MERGE_KEY);
    return new FactsConfig(props.getProperty(CORPUS_KEY, d.corpus),
                           props.getProperty(ROOT_KEY, d.root),
                           props.getProperty(LANGUAGE_KEY, d.language),
                           (merge == null) ? d.mergeClosedScopes :
                           Boolean.parseBoolean(merge.trim()));
  }

  public FactsConfig withCorpus (String corpus) {
    return new FactsConfig(corpus, root, language, mergeClosedScopes);
  }
  public FactsConfig withRoot (String root) {
    return new FactsConfig(corpus, root, language, mergeClosedScopes);
  }
  public FactsConfig withLanguage (String language) {
    return new FactsConfig(corpus, root, language, mergeClosedScopes);
  }
  public FactsConfig withMergeClosedScopes (boolean mergeClosedScopes) {
    return new FactsConfig(corpus, root, language, mergeClosedScopes);
  }

  @Override public String toString () {
    return String.format("FactsConfig(corpus=%s, root=%s, language=%s, merge=%s)",
                         corpus, root, language, mergeClosedScopes);
  }

  private FactsConfig (String corpus, String root, String language, boolean mergeClosedScopes) {
    this.corpus = Preconditions.checkNotNull(corpus, "corpus");
    this.root = Preconditions.checkNotNull(root, "root");
    this.language = Preconditions.checkNotNull(language, "language");
    this.mergeClosedScopes = mergeClosedScopes;
  }
}
