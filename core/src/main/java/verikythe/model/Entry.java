//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.model;

import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * A single emitted statement: either a fact ({@code source}, {@code factName}, {@code factValue})
 * or an edge ({@code source}, {@code edgeKind}, {@code target}).
 */
public final class Entry {

  public final VName source;
  public final EdgeKind edgeKind;
  public final VName target;
  public final FactName factName;
  public final String factValue;

  public static Entry fact (VName source, FactName name, String value) {
    return new Entry(source, null, null, Preconditions.checkNotNull(name, "name"),
                     Preconditions.checkNotNull(value, "value"));
  }

  public static Entry edge (VName source, EdgeKind kind, VName target) {
    return new Entry(source, Preconditions.checkNotNull(kind, "kind"),
                     Preconditions.checkNotNull(target, "target"), null, null);
  }

  /** Returns true if this entry is an edge, false if it is a fact. */
  public boolean isEdge () {
    return edgeKind != null;
  }

  @Override public int hashCode () {
    return source.hashCode() ^ Objects.hash(edgeKind, target, factName, factValue);
  }

  @Override public boolean equals (Object other) {
    if (!(other instanceof Entry)) return false;
    Entry oe = (Entry)other;
    return (source.equals(oe.source) && edgeKind == oe.edgeKind &&
            Objects.equals(target, oe.target) && factName == oe.factName &&
            Objects.equals(factValue, oe.factValue));
  }

  @Override public String toString () {
    return isEdge() ? (source.signature + " " + edgeKind + " " + target.signature) :
      (source.signature + " " + factName + " " + factValue);
  }

  private Entry (VName source, EdgeKind edgeKind, VName target, FactName factName,
                 String factValue) {
    this.source = Preconditions.checkNotNull(source, "source");
    this.edgeKind = edgeKind;
    this.target = target;
    this.factName = factName;
    this.factValue = factValue;
  }
}
