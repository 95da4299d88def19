//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.model;

import com.google.common.base.Preconditions;

/**
 * Uniquely identifies a node in the Kythe graph: a file, an anchor, or a named entity. VNames are
 * immutable values; the extractor copies them freely onto its stacks.
 */
public final class VName {

  /** Identifies the entity within its corpus, root and path. */
  public final Signature signature;

  /** The corpus of code to which the entity belongs. */
  public final String corpus;

  /** The root of the path within the corpus. */
  public final String root;

  /** The path of the file in which the entity occurs. */
  public final String path;

  /** The source language of the entity. Empty for files. */
  public final String language;

  public VName (Signature signature, String corpus, String root, String path, String language) {
    this.signature = Preconditions.checkNotNull(signature, "signature");
    this.corpus = Preconditions.checkNotNull(corpus, "corpus");
    this.root = Preconditions.checkNotNull(root, "root");
    this.path = Preconditions.checkNotNull(path, "path");
    this.language = Preconditions.checkNotNull(language, "language");
  }

  @Override public int hashCode () {
    return signature.hashCode() ^ path.hashCode() ^ corpus.hashCode();
  }

  @Override public boolean equals (Object other) {
    if (!(other instanceof VName)) return false;
    VName ov = (VName)other;
    return (signature.equals(ov.signature) && corpus.equals(ov.corpus) &&
            root.equals(ov.root) && path.equals(ov.path) && language.equals(ov.language));
  }

  @Override public String toString () {
    return "[" + corpus + "/" + root + "/" + path + "/" + language + "]" + signature;
  }
}
