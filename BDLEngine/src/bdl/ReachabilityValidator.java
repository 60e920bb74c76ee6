package bdl;

import java.util.Collection;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;

/**
 * Reports nodes that no static path from the start node reaches, across all loaded documents.
 *
 * <p>Destinations computed from variables cannot be followed statically, so if any exist the
 * check is skipped and nothing is reported.
 */
public class ReachabilityValidator extends ErrorCollectingValidator {

  private final ImmutableList<Document> documents;
  private final String start;

  private final MutableGraph<String> graph = GraphBuilder.directed().allowsSelfLoops(true).build();
  private boolean hasDynamicEdges = false;

  private Document currentDocument = null;
  private Node currentNode = null;

  public ReachabilityValidator(Collection<Document> documents, String entryFile, String startNode) {
    this.documents = ImmutableList.copyOf(documents);
    this.start = id(entryFile, startNode);
  }

  private static String id(String file, String node) {
    return file + ":" + node;
  }

  public ImmutableList<BdlException> computeErrors() {
    documents.forEach(d -> d.accept(this, null));
    if (hasDynamicEdges || !graph.nodes().contains(start)) return errors();

    Set<String> reachable = Graphs.reachableNodes(graph, start);
    for (Document document : documents) {
      for (Node node : document.nodeList()) {
        if (!reachable.contains(id(document.name(), node.name()))) {
          logError(
              node.pos(), String.format("node '%s' is unreachable from %s", node.name(), start));
        }
      }
    }
    return errors();
  }

  @Override
  public void visitImpl(Document document) {
    currentDocument = document;
    super.visitImpl(document);
  }

  @Override
  public void visitImpl(Node node) {
    currentNode = node;
    graph.addNode(id(currentDocument.name(), node.name()));
    super.visitImpl(node);
  }

  private void addEdge(String file, String node) {
    graph.putEdge(id(currentDocument.name(), currentNode.name()), id(file, node));
  }

  @Override
  public void visitImpl(Destination.NodeRef ref) {
    addEdge(currentDocument.name(), ref.name());
  }

  @Override
  public void visitImpl(Destination.FileTransfer transfer) {
    if (transfer.isLiteral()) {
      addEdge(transfer.file(), transfer.node());
    } else {
      hasDynamicEdges = true;
    }
  }

  @Override
  public void visitImpl(Destination.Dynamic dynamic) {
    hasDynamicEdges = true;
  }
}
