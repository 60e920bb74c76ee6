package bdl;

import java.util.Optional;
import java.util.function.Function;

/**
 * Checks literal destinations: node references must name a node of the document, and file
 * transfers must target the document itself or a declared dependency that has the node.
 */
class DestinationValidator extends ErrorCollectingValidator {

  private final Document document;
  private final Function<String, Optional<Document>> loadedDocuments;

  public DestinationValidator(
      Document document, Function<String, Optional<Document>> loadedDocuments) {
    this.document = document;
    this.loadedDocuments = loadedDocuments;
  }

  @Override
  public void visitImpl(Destination.NodeRef ref) {
    if (!document.node(ref.name()).isPresent())
      logError(ref.pos(), String.format("no node '%s' in %s", ref.name(), document.name()));
  }

  @Override
  public void visitImpl(Destination.FileTransfer transfer) {
    // Interpolated transfers are only known at run time.
    if (!transfer.isLiteral()) return;

    Optional<Document> target;
    if (transfer.file().equals(document.name())) {
      target = Optional.of(document);
    } else if (document.requires(transfer.file())) {
      target = loadedDocuments.apply(transfer.file());
    } else {
      logError(
          transfer.pos(),
          String.format(
              "undeclared dependency: %s is not in the Required list of %s",
              transfer.file(),
              document.name()));
      return;
    }

    if (target.isPresent() && !target.get().node(transfer.node()).isPresent()) {
      logError(
          transfer.pos(), String.format("no node '%s' in %s", transfer.node(), transfer.file()));
    }
  }
}
