//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.model;

import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * The signature of a VName. A signature is a chain of (name, kind) components, innermost first,
 * which makes it unique relative to all of its enclosing scopes. A variable {@code x} in module
 * {@code foo} renders as {@code x#variable#foo#module}, and so never collides with {@code x} in
 * module {@code bar}.
 *
 * <p>Anchor signatures are not scoped; they render as {@code @start:end}.</p>
 */
public final class Signature {

  /** The empty signature, used by file VNames and as the parent of top-level signatures. */
  public static final Signature ROOT = new Signature(null, "", null);

  /** The signature that encloses this one. Null only for {@link #ROOT} and anchor signatures. */
  public final Signature parent;

  /** The local name of this component. */
  public final String name;

  /** The kind of this component, or null for {@link #ROOT} and anchor signatures. */
  public final SignatureKind kind;

  /** Returns a top-level signature for {@code name} of kind {@code kind}. */
  public static Signature of (String name, SignatureKind kind) {
    return ROOT.plus(name, kind);
  }

  /** Returns the signature of an anchor that covers {@code anchor}'s span. */
  public static Signature anchor (Anchor anchor) {
    return new Signature(null, "@" + anchor.startLocation + ":" + anchor.endLocation, null);
  }

  /** Returns a signature with {@code this} as its parent and {@code name}, {@code kind} as its
    * innermost component. */
  public Signature plus (String name, SignatureKind kind) {
    return new Signature(this, name, Preconditions.checkNotNull(kind, "kind"));
  }

  /** Returns a copy of this signature's innermost component, relative to {@code parent}. */
  public Signature relativeTo (Signature parent) {
    Preconditions.checkState(kind != null, "Cannot rescope %s", this);
    return parent.plus(name, kind);
  }

  /** Returns true if this signature's innermost component has the given name and kind. This is
    * the lookup key used when resolving references. */
  public boolean matches (String name, SignatureKind kind) {
    return this.kind == kind && this.name.equals(name);
  }

  /** Returns true if the rendered form of this signature starts with {@code prefix}. */
  public boolean startsWith (String prefix) {
    return toString().startsWith(prefix);
  }

  /** Returns true if this is the empty signature. */
  public boolean isRoot () {
    return this == ROOT;
  }

  @Override public int hashCode () {
    return name.hashCode() ^ Objects.hashCode(kind) ^ (parent == null ? 13 : parent.hashCode());
  }

  @Override public boolean equals (Object other) {
    return (other instanceof Signature) && equals((Signature)other);
  }

  @Override public String toString () {
    StringBuilder sb = new StringBuilder();
    toString(sb);
    return sb.toString();
  }

  private void toString (StringBuilder sb) {
    sb.append(name);
    if (kind != null) sb.append('#').append(kind.tag);
    if (parent != null && !parent.isRoot()) {
      sb.append('#');
      parent.toString(sb);
    }
  }

  private boolean equals (Signature other) {
    return (name.equals(other.name) && kind == other.kind &&
            (parent == other.parent || (parent != null && parent.equals(other.parent))));
  }

  private Signature (Signature parent, String name, SignatureKind kind) {
    this.parent = parent;
    this.name = Preconditions.checkNotNull(name, "name");
    this.kind = kind;
  }
}
