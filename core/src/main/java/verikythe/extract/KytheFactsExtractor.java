//
// Verikythe - Kythe cross-reference facts for Verilog
// https://www.apache.org/licenses/LICENSE-2.0

package verikythe.extract;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import verikythe.model.*;

/**
 * Traverses an indexing facts tree and emits the Kythe facts and edges that describe it. The
 * extractor keeps two stacks while it walks the tree depth first: the VNames of the enclosing
 * scopes, used to make signatures unique, and the definitions visible from the current node, used
 * to resolve references.
 *
 * <p>An extractor handles exactly one file; create a new one for each tree.</p>
 */
public class KytheFactsExtractor {

  /** Creates the base signature for a module named {@code name}. */
  public static Signature moduleSignature (String name) {
    return Signature.of(name, SignatureKind.MODULE);
  }

  /** Creates the base signature for a package named {@code name}. */
  public static Signature packageSignature (String name) {
    return Signature.of(name, SignatureKind.PACKAGE);
  }

  /** Creates the base signature for a class named {@code name}. */
  public static Signature classSignature (String name) {
    return Signature.of(name, SignatureKind.CLASS);
  }

  /** Creates the base signature for a function or task named {@code name}. */
  public static Signature functionSignature (String name) {
    return Signature.of(name, SignatureKind.FUNCTION);
  }

  /** Creates the base signature for a variable, port or instance named {@code name}. */
  public static Signature variableSignature (String name) {
    return Signature.of(name, SignatureKind.VARIABLE);
  }

  /** Creates the base signature for a macro named {@code name}. */
  public static Signature macroSignature (String name) {
    return Signature.of(name, SignatureKind.MACRO);
  }

  public KytheFactsExtractor (String filePath, FactEmitter emitter) {
    this(filePath, emitter, FactsConfig.DEFAULT);
  }

  public KytheFactsExtractor (String filePath, FactEmitter emitter, FactsConfig config) {
    _filePath = Preconditions.checkNotNull(filePath, "filePath");
    _emitter = Preconditions.checkNotNull(emitter, "emitter");
    _config = Preconditions.checkNotNull(config, "config");
  }

  /**
   * Extracts the facts of the tree rooted at {@code root}, which must be a file node.
   * @throws MalformedTreeException if the tree does not have the expected structure.
   */
  public void visit (IndexingFactNode root) {
    Preconditions.checkState(!_visited, "Extractor already used for %s", _filePath);
    _visited = true;
    if (root.type != IndexingFactType.FILE) {
      throw new MalformedTreeException("Root of tree is not a file", root);
    }
    log.debug("Extracting facts [file={}, config={}]", _filePath, _config);

    VName file = extractFileFact(root);
    _vnames.push(file);
    _scopes.pushScope();
    visitChildren(root);
    _scopes.popScope();
    _vnames.pop();
    _emitter.flush();

    log.debug("Extracted facts [file={}, facts={}, edges={}, unresolved={}]",
              _filePath, _facts, _edges, _unresolved);
  }

  /** Returns the VName of the file being indexed. */
  public VName fileVName () {
    return new VName(Signature.ROOT, _config.corpus, _config.root, _filePath, "");
  }

  /** Returns {@code base} made relative to the innermost enclosing scope. */
  public Signature scopeRelativeSignature (Signature base) {
    return base.relativeTo(_vnames.top().signature);
  }

  protected void visitNode (IndexingFactNode node) {
    if (node.anchors.size() < node.type.requiredAnchors) {
      throw new MalformedTreeException(
        "Expected at least " + node.type.requiredAnchors + " anchors", node);
    }
    if (node.type == IndexingFactType.FILE) {
      throw new MalformedTreeException("File node below the root", node);
    }
    switch (node.type.role) {
    case SCOPE:
      visitScope(node, extractScopeFact(node));
      break;
    case DEFINITION:
      visitDefinition(node, extractDefinitionFact(node));
      break;
    case REFERENCE:
      extractReferenceFact(node);
      visitChildren(node);
      break;
    default:
      throw new MalformedTreeException("Unsupported node role", node);
    }
  }

  /** Emits the facts of a scope opening node and returns its VName. */
  protected VName extractScopeFact (IndexingFactNode node) {
    switch (node.type) {
    case MODULE: return extractModuleFact(node);
    case PACKAGE: return extractPackageFact(node);
    case CLASS: return extractClassFact(node);
    case FUNCTION_OR_TASK: return extractFunctionFact(node);
    case MODULE_INSTANCE: return extractInstanceFact(node, SignatureKind.MODULE);
    case CLASS_INSTANCE: return extractInstanceFact(node, SignatureKind.CLASS);
    default: throw new MalformedTreeException("Unsupported scope kind", node);
    }
  }

  /** Emits the facts of a plain definition and returns its VName. */
  protected VName extractDefinitionFact (IndexingFactNode node) {
    switch (node.type) {
    case VARIABLE_DEFINITION: return extractVariableDefinitionFact(node);
    case MACRO: return extractMacroFact(node);
    default: throw new MalformedTreeException("Unsupported definition kind", node);
    }
  }

  /** Emits the facts of a reference and returns its anchor's VName. */
  protected VName extractReferenceFact (IndexingFactNode node) {
    switch (node.type) {
    case VARIABLE_REFERENCE:
      return extractReferenceFact(node, SignatureKind.VARIABLE, EdgeKind.REF);
    case FUNCTION_CALL:
      return extractReferenceFact(node, SignatureKind.FUNCTION, EdgeKind.REF_CALL);
    case MACRO_CALL:
      return extractReferenceFact(node, SignatureKind.MACRO, EdgeKind.REF_EXPANDS);
    default: throw new MalformedTreeException("Unsupported reference kind", node);
    }
  }

  // the definitions of a scope only become visible to its parent once the whole scope is visited
  private void visitScope (IndexingFactNode node, VName vname) {
    _vnames.push(vname);
    _scopes.pushScope();
    visitChildren(node);
    List<VName> defs = _scopes.popScope();
    _vnames.pop();

    List<VName> parent = _scopes.currentScope();
    if (_config.mergeClosedScopes) parent.addAll(defs);
    parent.add(vname);
    emitEdge(vname, EdgeKind.CHILD_OF, _vnames.top());
  }

  private void visitDefinition (IndexingFactNode node, VName vname) {
    _scopes.currentScope().add(vname);
    emitEdge(vname, EdgeKind.CHILD_OF, _vnames.top());
    visitChildren(node);
  }

  private void visitChildren (IndexingFactNode node) {
    for (IndexingFactNode child : node.children) visitNode(child);
  }

  protected VName extractFileFact (IndexingFactNode node) {
    VName file = fileVName();
    emitFact(file, FactName.NODE_KIND, NodeKind.FILE);
    // anchor 0 is the path as written by the analyzer, anchor 1 the full text of the file
    Anchor text = node.anchor(1);
    if (text != null) emitFact(file, FactName.TEXT, text.value);
    return file;
  }

  protected VName extractModuleFact (IndexingFactNode node) {
    Anchor name = node.anchor(0);
    VName module = vname(scopeRelativeSignature(moduleSignature(name.value)));
    emitFact(module, FactName.NODE_KIND, NodeKind.RECORD);
    emitFact(module, FactName.SUBKIND, NodeKind.SUBKIND_MODULE);
    emitFact(module, FactName.COMPLETE, NodeKind.COMPLETE_DEFINITION);
    emitEdge(extractAnchor(name), EdgeKind.DEFINES_BINDING, module);
    extractEndLabel(node, module);
    return module;
  }

  protected VName extractPackageFact (IndexingFactNode node) {
    Anchor name = node.anchor(0);
    VName pkg = vname(scopeRelativeSignature(packageSignature(name.value)));
    emitFact(pkg, FactName.NODE_KIND, NodeKind.PACKAGE);
    emitEdge(extractAnchor(name), EdgeKind.DEFINES_BINDING, pkg);
    extractEndLabel(node, pkg);
    return pkg;
  }

  protected VName extractClassFact (IndexingFactNode node) {
    Anchor name = node.anchor(0);
    VName clazz = vname(scopeRelativeSignature(classSignature(name.value)));
    emitFact(clazz, FactName.NODE_KIND, NodeKind.RECORD);
    emitFact(clazz, FactName.SUBKIND, NodeKind.SUBKIND_CLASS);
    emitFact(clazz, FactName.COMPLETE, NodeKind.COMPLETE_DEFINITION);
    emitEdge(extractAnchor(name), EdgeKind.DEFINES_BINDING, clazz);
    extractEndLabel(node, clazz);
    return clazz;
  }

  protected VName extractFunctionFact (IndexingFactNode node) {
    Anchor name = node.anchor(0);
    VName func = vname(scopeRelativeSignature(functionSignature(name.value)));
    emitFact(func, FactName.NODE_KIND, NodeKind.FUNCTION);
    emitFact(func, FactName.COMPLETE, NodeKind.COMPLETE_DEFINITION);
    emitEdge(extractAnchor(name), EdgeKind.DEFINES_BINDING, func);
    return func;
  }

  /** Module and class instances: anchor 0 names the type, anchor 1 the instance. */
  protected VName extractInstanceFact (IndexingFactNode node, SignatureKind typeKind) {
    Anchor type = node.anchor(0), name = node.anchor(1);
    VName instance = vname(scopeRelativeSignature(variableSignature(name.value)));
    VName typeAnchor = extractAnchor(type);
    VName nameAnchor = extractAnchor(name);

    emitFact(instance, FactName.NODE_KIND, NodeKind.VARIABLE);
    emitFact(instance, FactName.COMPLETE, NodeKind.COMPLETE_DEFINITION);
    Optional<VName> typeDef = resolve(type, typeKind);
    if (typeDef.isPresent()) {
      emitEdge(typeAnchor, EdgeKind.REF, typeDef.get());
      emitEdge(instance, EdgeKind.TYPED, typeDef.get());
    }
    emitEdge(nameAnchor, EdgeKind.DEFINES_BINDING, instance);
    return instance;
  }

  protected VName extractVariableDefinitionFact (IndexingFactNode node) {
    Anchor name = node.anchor(0);
    VName var = vname(scopeRelativeSignature(variableSignature(name.value)));
    emitFact(var, FactName.NODE_KIND, NodeKind.VARIABLE);
    emitFact(var, FactName.COMPLETE, NodeKind.COMPLETE_DEFINITION);
    emitEdge(extractAnchor(name), EdgeKind.DEFINES_BINDING, var);
    return var;
  }

  protected VName extractMacroFact (IndexingFactNode node) {
    Anchor name = node.anchor(0);
    VName macro = vname(scopeRelativeSignature(macroSignature(name.value)));
    emitFact(macro, FactName.NODE_KIND, NodeKind.MACRO);
    emitEdge(extractAnchor(name), EdgeKind.DEFINES_BINDING, macro);
    return macro;
  }

  /** Emits the anchor of a reference and, if its definition is visible, the edge to it. */
  protected VName extractReferenceFact (IndexingFactNode node, SignatureKind kind,
                                        EdgeKind edge) {
    Anchor name = node.anchor(0);
    VName anchor = extractAnchor(name);
    Optional<VName> def = resolve(name, kind);
    if (def.isPresent()) emitEdge(anchor, edge, def.get());
    return anchor;
  }

  /** Emits a ref from the optional end label ({@code endmodule : foo}) of a scope to it. */
  private void extractEndLabel (IndexingFactNode node, VName vname) {
    Anchor label = node.anchor(1);
    if (label != null) emitEdge(extractAnchor(label), EdgeKind.REF, vname);
  }

  /** Emits the facts of the anchor {@code anchor} and returns its VName. */
  protected VName extractAnchor (Anchor anchor) {
    VName vname = new VName(Signature.anchor(anchor), _config.corpus, _config.root, _filePath,
                            _config.language);
    emitFact(vname, FactName.NODE_KIND, NodeKind.ANCHOR);
    emitFact(vname, FactName.LOC_START, String.valueOf(anchor.startLocation));
    emitFact(vname, FactName.LOC_END, String.valueOf(anchor.endLocation));
    emitFact(vname, FactName.TEXT, anchor.value);
    return vname;
  }

  private Optional<VName> resolve (Anchor name, SignatureKind kind) {
    Optional<VName> def = _scopes.searchForDefinition(name.value, kind);
    if (!def.isPresent()) {
      _unresolved++;
      log.debug("Unresolved {} reference [file={}, name={}, at={}]",
                kind.tag, _filePath, name.value, name.startLocation);
    }
    return def;
  }

  private VName vname (Signature signature) {
    return new VName(signature, _config.corpus, _config.root, _filePath, _config.language);
  }

  private void emitFact (VName source, FactName name, String value) {
    _facts++;
    _emitter.emitFact(source, name, value);
  }

  private void emitEdge (VName source, EdgeKind kind, VName target) {
    _edges++;
    _emitter.emitEdge(source, kind, target);
  }

  private final String _filePath;
  private final FactEmitter _emitter;
  private final FactsConfig _config;

  private final VNameContext _vnames = new VNameContext();
  private final ScopeContext _scopes = new ScopeContext();

  private boolean _visited;
  private int _facts, _edges, _unresolved;

  private static final Logger log = LoggerFactory.getLogger(KytheFactsExtractor.class);
}
