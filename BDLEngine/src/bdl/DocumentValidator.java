package bdl;

import java.util.Optional;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Static checks over one loaded document. Findings are diagnostics: they never prevent a
 * document from loading.
 */
public class DocumentValidator extends ErrorCollectingValidator {

  private final Document document;
  private final String entryFile;
  private final Function<String, Optional<Document>> loadedDocuments;

  /**
   * @param loadedDocuments looks up other documents that are already loaded; documents it does
   *     not know are not checked against
   */
  public DocumentValidator(
      Document document,
      String entryFile,
      Function<String, Optional<Document>> loadedDocuments) {
    this.document = document;
    this.entryFile = entryFile;
    this.loadedDocuments = loadedDocuments;
  }

  public ImmutableList<BdlException> computeErrors() {
    accept(new DestinationValidator(document, loadedDocuments));
    accept(new VariableReferenceValidator(document, globals()));
    return errors();
  }

  private ImmutableSet<String> globals() {
    Optional<Document> entry =
        document.name().equals(entryFile)
            ? Optional.of(document)
            : loadedDocuments.apply(entryFile);
    return entry.map(d -> d.globalDefaults().keySet()).orElse(ImmutableSet.of());
  }

  private void accept(ErrorCollectingValidator visitor) {
    document.accept(visitor, null);
    takeErrors(visitor);
  }
}
