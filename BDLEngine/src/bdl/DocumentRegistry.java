package bdl;

import java.io.IOException;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.util.concurrent.Striped;

/**
 * Loads documents by file name and caches them.
 *
 * <p>A document is published only once every file in its {@code Required} list has loaded too.
 * Files that require each other are fine: a file already being loaded on the current path is
 * not loaded again. Parsing a given file name is serialized, so concurrent sessions never parse
 * the same file twice. Published documents are immutable and may be shared by any number of
 * sessions.
 */
public final class DocumentRegistry {
  private static final Logger logger = LoggerFactory.getLogger(DocumentRegistry.class);

  private final ScriptSource source;
  private final String entryFile;
  private final String startNode;

  // Parsed, dependencies not necessarily loaded.
  private final ConcurrentMap<String, Document> parsed = new ConcurrentHashMap<>();
  // Parsed, with all dependencies loaded.
  private final ConcurrentMap<String, Document> loaded = new ConcurrentHashMap<>();
  private final Striped<Lock> parseLocks = Striped.lock(16);

  public DocumentRegistry(ScriptSource source, String entryFile) {
    this(source, entryFile, EngineConfig.defaults().startNode());
  }

  public DocumentRegistry(ScriptSource source, String entryFile, String startNode) {
    this.source = source;
    this.entryFile = entryFile;
    this.startNode = startNode;
  }

  public String entryFile() {
    return entryFile;
  }

  /**
   * Returns the document for {@code fileName}, loading it and, recursively, its required files
   * on first use.
   *
   * @throws ParseException if {@code fileName} is malformed
   * @throws ReferenceException {@code UNKNOWN_FILE} if it cannot be read, {@code
   *     MISSING_DEPENDENCY} if a required file fails to load
   */
  public Document load(String fileName) throws ParseException, ReferenceException {
    Document document = loaded.get(fileName);
    if (document != null) return document;

    return load(fileName, new HashSet<>());
  }

  private Document load(String fileName, Set<String> visiting)
      throws ParseException, ReferenceException {
    Document document = loaded.get(fileName);
    if (document != null) return document;

    document = parse(fileName);
    if (!visiting.add(fileName)) return document;

    for (String dependency : document.metadata().required()) {
      try {
        load(dependency, visiting);
      } catch (BdlException ex) {
        throw new ReferenceException(
            ReferenceException.Kind.MISSING_DEPENDENCY,
            Pos.startOf(fileName),
            String.format("required file %s could not be loaded: %s", dependency, ex.getMessage()),
            ex);
      }
    }

    if (loaded.putIfAbsent(fileName, document) == null) {
      logger.debug("loaded {} ({} nodes)", fileName, document.nodes().size());
      for (BdlException diagnostic :
          new DocumentValidator(document, entryFile, this::loaded).computeErrors()) {
        logger.warn(diagnostic.getMessage());
      }
    }
    return loaded.get(fileName);
  }

  private Document parse(String fileName) throws ParseException, ReferenceException {
    Document document = parsed.get(fileName);
    if (document != null) return document;

    Lock lock = parseLocks.get(fileName);
    lock.lock();
    try {
      document = parsed.get(fileName);
      if (document != null) return document;

      String text;
      try {
        text = source.read(fileName);
      } catch (IOException ex) {
        throw new ReferenceException(
            ReferenceException.Kind.UNKNOWN_FILE,
            Pos.startOf(fileName),
            String.format("cannot read %s from %s: %s", fileName, source, ex.getMessage()),
            ex);
      }

      document = ScriptParser.parse(text, fileName, fileName.equals(entryFile));
      parsed.put(fileName, document);
      return document;
    } finally {
      lock.unlock();
    }
  }

  /** Returns {@code fileName} if it has already been loaded. */
  public Optional<Document> loaded(String fileName) {
    return Optional.ofNullable(loaded.get(fileName));
  }

  /**
   * Like {@link #load}, for navigation: any failure to load is reported as {@code
   * UNKNOWN_FILE}.
   */
  public Document document(String fileName) throws ReferenceException {
    try {
      return load(fileName);
    } catch (ReferenceException ex) {
      if (ex.kind() == ReferenceException.Kind.UNKNOWN_FILE) throw ex;
      throw unknownFile(fileName, ex);
    } catch (ParseException ex) {
      throw unknownFile(fileName, ex);
    }
  }

  private static ReferenceException unknownFile(String fileName, BdlException cause) {
    return new ReferenceException(
        ReferenceException.Kind.UNKNOWN_FILE,
        cause.pos(),
        String.format("cannot load %s: %s", fileName, cause.errorMsg()),
        cause);
  }

  /** Returns node {@code nodeName} of {@code fileName}. */
  public Node resolve(String fileName, String nodeName) throws ReferenceException {
    Document document = document(fileName);
    Optional<Node> node = document.node(nodeName);
    if (!node.isPresent()) {
      throw new ReferenceException(
          ReferenceException.Kind.UNKNOWN_NODE,
          Pos.startOf(fileName),
          String.format("no node '%s' in %s", nodeName, fileName));
    }
    return node.get();
  }

  /** The loaded documents, by name. */
  public ImmutableSortedMap<String, Document> documents() {
    return ImmutableSortedMap.copyOf(loaded);
  }

  /**
   * Runs the static checks over every loaded document, including reachability from the start
   * node of the entry file.
   */
  public ImmutableList<BdlException> validate() {
    ImmutableList.Builder<BdlException> errors = ImmutableList.builder();
    ImmutableSortedMap<String, Document> documents = documents();
    for (Document document : documents.values()) {
      errors.addAll(new DocumentValidator(document, entryFile, this::loaded).computeErrors());
    }
    errors.addAll(
        new ReachabilityValidator(documents.values(), entryFile, startNode).computeErrors());
    return errors.build();
  }
}
