//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A node in an indexing facts tree. Trees are built by an upstream analyzer from a Verilog syntax
 * tree and are never mutated once built.
 */
public final class IndexingFactNode {

  /** Incrementally assembles a node. */
  public static final class Builder {

    public Builder anchor (Anchor anchor) {
      _anchors.add(anchor);
      return this;
    }

    public Builder anchor (String value, int startLocation) {
      return anchor(Anchor.of(value, startLocation));
    }

    public Builder child (IndexingFactNode child) {
      _children.add(child);
      return this;
    }

    public Builder child (Builder child) {
      return child(child.build());
    }

    public Builder children (Iterable<IndexingFactNode> children) {
      _children.addAll(children);
      return this;
    }

    public IndexingFactNode build () {
      return new IndexingFactNode(_type, _anchors.build(), _children.build());
    }

    private Builder (IndexingFactType type) {
      _type = Preconditions.checkNotNull(type, "type");
    }

    private final IndexingFactType _type;
    private final ImmutableList.Builder<Anchor> _anchors = ImmutableList.builder();
    private final ImmutableList.Builder<IndexingFactNode> _children = ImmutableList.builder();
  }

  /** The kind of this node. */
  public final IndexingFactType type;

  /** The anchors of this node, in the order fixed by its {@link #type}. */
  public final List<Anchor> anchors;

  /** The children of this node, in source order. */
  public final List<IndexingFactNode> children;

  /** Returns a builder for a node of kind {@code type}. */
  public static Builder builder (IndexingFactType type) {
    return new Builder(type);
  }

  public IndexingFactNode (IndexingFactType type, List<Anchor> anchors,
                           List<IndexingFactNode> children) {
    this.type = Preconditions.checkNotNull(type, "type");
    this.anchors = ImmutableList.copyOf(anchors);
    this.children = ImmutableList.copyOf(children);
  }

  /** Returns the anchor at {@code index}, or null if this node has too few anchors. */
  public Anchor anchor (int index) {
    return index < anchors.size() ? anchors.get(index) : null;
  }

  @Override public String toString () {
    StringBuilder sb = new StringBuilder();
    toString(sb, 0);
    return sb.toString();
  }

  private void toString (StringBuilder sb, int indent) {
    for (int ii = 0; ii < indent; ii++) sb.append("  ");
    sb.append(type);
    for (Anchor anchor : anchors) sb.append(" ").append(anchor);
    sb.append("\n");
    for (IndexingFactNode child : children) child.toString(sb, indent + 1);
  }
}
