//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import verikythe.model.*;

/**
 * A {@code FactEmitter} that retains everything emitted to it, in order, for callers that want to
 * process the facts of a whole run at once.
 */
public class EntryCollector extends FactEmitter {

  @Override public void emitFact (VName source, FactName name, String value) {
    _entries.add(Entry.fact(source, name, value));
  }

  @Override public void emitEdge (VName source, EdgeKind kind, VName target) {
    _entries.add(Entry.edge(source, kind, target));
  }

  /** Returns all collected entries, in emission order. */
  public List<Entry> entries () {
    return Collections.unmodifiableList(_entries);
  }

  /** Returns the collected facts named {@code name}, in emission order. */
  public List<Entry> facts (FactName name) {
    return _entries.stream().filter(e -> e.factName == name).collect(Collectors.toList());
  }

  /** Returns the collected edges of kind {@code kind}, in emission order. */
  public List<Entry> edges (EdgeKind kind) {
    return _entries.stream().filter(e -> e.edgeKind == kind).collect(Collectors.toList());
  }

  /** Returns the collected entries whose source is {@code source}, in emission order. */
  public List<Entry> entriesFor (VName source) {
    return _entries.stream().filter(e -> e.source.equals(source)).collect(Collectors.toList());
  }

  /** Returns the value of fact {@code name} about {@code source}, if one was emitted. */
  public Optional<String> factValue (VName source, FactName name) {
    for (Entry entry : _entries) {
      if (entry.factName == name && entry.source.equals(source)) {
        return Optional.of(entry.factValue);
      }
    }
    return Optional.empty();
  }

  /** Returns the targets of the {@code kind} edges from {@code source}, in emission order. */
  public List<VName> targets (VName source, EdgeKind kind) {
    ImmutableList.Builder<VName> targets = ImmutableList.builder();
    for (Entry entry : _entries) {
      if (entry.edgeKind == kind && entry.source.equals(source)) targets.add(entry.target);
    }
    return targets.build();
  }

  public int factCount () {
    return (int)_entries.stream().filter(e -> !e.isEdge()).count();
  }

  public int edgeCount () {
    return (int)_entries.stream().filter(Entry::isEdge).count();
  }

  private final List<Entry> _entries = new ArrayList<>();
}
