//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.model;

import com.google.common.base.Preconditions;
import com.google.common.base.Utf8;

/**
 * A span of source text, identified by its byte offsets and carrying the literal text it covers.
 * Anchors tie emitted facts back to the place in the source from which they originate.
 */
public final class Anchor {

  /** The literal source text covered by this anchor. */
  public final String value;

  /** The byte offset at which this anchor starts. */
  public final int startLocation;

  /** The byte offset just past the end of this anchor. */
  public final int endLocation;

  /** Creates an anchor for {@code value} which starts at {@code startLocation} and covers
    * exactly the UTF-8 bytes of {@code value}. */
  public static Anchor of (String value, int startLocation) {
    return new Anchor(value, startLocation, startLocation + Utf8.encodedLength(value));
  }

  public Anchor (String value, int startLocation, int endLocation) {
    Preconditions.checkNotNull(value, "value");
    Preconditions.checkArgument(startLocation >= 0, "Negative start: %s", startLocation);
    Preconditions.checkArgument(endLocation >= startLocation,
                                "End %s precedes start %s", endLocation, startLocation);
    this.value = value;
    this.startLocation = startLocation;
    this.endLocation = endLocation;
  }

  @Override public int hashCode () {
    return value.hashCode() ^ (startLocation * 31) ^ endLocation;
  }

  @Override public boolean equals (Object other) {
    if (!(other instanceof Anchor)) return false;
    Anchor oa = (Anchor)other;
    return (value.equals(oa.value) && startLocation == oa.startLocation &&
            endLocation == oa.endLocation);
  }

  @Override public String toString () {
    return "{" + value + " @" + startLocation + "-" + endLocation + "}";
  }
}
