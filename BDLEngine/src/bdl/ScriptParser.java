package bdl;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** Parses script text into a {@link Document}. */
public final class ScriptParser {
  private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_]+");
  private static final String ARROW = "->";
  private static final String EXIT = "{exit}";
  private static final String SCRIPT_EXTENSION = ".bdl";
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final ImmutableList<String> REQUIRED_KEYS =
      ImmutableList.of("topic", "description", "author", "version");

  private final String file;
  private final boolean isEntry;

  private final Map<String, Lexer.Line> metadataLines = new LinkedHashMap<>();
  private boolean metadataFinished = false;
  private Metadata metadata = null;

  private Optional<ImmutableMap<String, Value>> globals = Optional.empty();
  private Optional<ImmutableMap<String, Value>> locals = Optional.empty();
  private final Map<String, Node> nodes = new LinkedHashMap<>();
  private NodeBuilder current = null;

  private ScriptParser(String file, boolean isEntry) {
    this.file = file;
    this.isEntry = isEntry;
  }

  /**
   * Parses {@code text}, the content of {@code fileName}. Only the entry file may declare
   * {@code $global_vars}.
   */
  public static Document parse(String text, String fileName, boolean isEntry)
      throws ParseException {
    ScriptParser parser = new ScriptParser(fileName, isEntry);
    for (Lexer.Line line : new Lexer(fileName, text).tokenize()) {
      parser.consume(line);
    }
    return parser.build();
  }

  private void consume(Lexer.Line line) throws ParseException {
    if (line.kind() == Lexer.Kind.METADATA) {
      String key = line.text().substring(0, line.text().indexOf(':')).trim();
      metadataLines.put(key.toLowerCase(Locale.ROOT), line);
      return;
    }
    finishMetadata();

    switch (line.kind()) {
      case GLOBAL_DECLARATION:
        {
          if (!isEntry) {
            throw new ParseException(
                ParseException.Kind.GLOBAL_OUTSIDE_ENTRY,
                line.pos(),
                "$global_vars can only be declared in the entry file");
          }
          if (globals.isPresent()) throw duplicateBlock(line, "$global_vars");
          globals = Optional.of(DeclarationParser.parse(line.text(), line.pos()));
          break;
        }
      case LOCAL_DECLARATION:
        {
          if (locals.isPresent()) throw duplicateBlock(line, "$local_vars");
          locals = Optional.of(DeclarationParser.parse(line.text(), line.pos()));
          break;
        }
      case NODE:
        {
          startNode(line);
          break;
        }
      case TEXT:
        {
          openNode(line).consumeText(line);
          break;
        }
      case CALL:
        {
          openNode(line).consumeContent(parseCall(line.text(), line.pos()));
          break;
        }
      case OPTION:
        {
          openNode(line).consumeBranch(parseOption(line.text(), line.pos()));
          break;
        }
      case CONDITION:
        {
          openNode(line).consumeBranch(parseCondition(line.text(), line.pos()));
          break;
        }
      case JUMP:
        {
          NodeBuilder node = openNode(line);
          String target = line.text().substring(ARROW.length()).trim();
          node.consumeBranch(new Branch.Jump(parseDestination(target, line.pos()), line.pos()));
          break;
        }
      default:
        throw new AssertionError(line.kind());
    }
  }

  private Document build() throws ParseException {
    finishMetadata();
    closeNode();

    return Document.create(
        file,
        metadata,
        isEntry,
        locals.orElse(ImmutableMap.of()),
        globals.orElse(ImmutableMap.of()),
        nodes);
  }

  private void finishMetadata() throws ParseException {
    if (metadataFinished) return;
    metadataFinished = true;

    List<String> missing = new ArrayList<>();
    for (String key : REQUIRED_KEYS) {
      if (!metadataLines.containsKey(key) || metadataValue(key).isEmpty()) missing.add(key);
    }
    if (!missing.isEmpty()) {
      throw new ParseException(
          ParseException.Kind.MISSING_METADATA,
          Pos.startOf(file),
          "missing required metadata: " + Joiner.on(", ").join(missing));
    }

    ImmutableList<String> required = ImmutableList.of();
    if (metadataLines.containsKey("required")) {
      required = parseRequired(metadataValue("required"), metadataLines.get("required").pos());
    }
    metadata =
        Metadata.create(
            metadataValue("topic"),
            metadataValue("description"),
            metadataValue("author"),
            metadataValue("version"),
            required);
  }

  private String metadataValue(String key) {
    String text = metadataLines.get(key).text();
    return text.substring(text.indexOf(':') + 1).trim();
  }

  private static ImmutableList<String> parseRequired(String value, Pos pos)
      throws ParseException {
    Set<String> seen = new HashSet<>();
    for (String dependency : LIST_SPLITTER.split(value)) {
      if (!dependency.endsWith(SCRIPT_EXTENSION)) {
        throw new ParseException(
            ParseException.Kind.INVALID_DEPENDENCY,
            pos,
            String.format("invalid dependency file extension: %s", dependency));
      }
      if (!seen.add(dependency)) {
        throw new ParseException(
            ParseException.Kind.INVALID_DEPENDENCY,
            pos,
            String.format("duplicate dependency: %s", dependency));
      }
    }
    return ImmutableList.copyOf(LIST_SPLITTER.split(value));
  }

  private ParseException duplicateBlock(Lexer.Line line, String block) {
    return new ParseException(
        ParseException.Kind.DUPLICATE_DECLARATION_BLOCK,
        line.pos(),
        String.format("duplicate %s declaration", block));
  }

  private void startNode(Lexer.Line line) throws ParseException {
    closeNode();

    String name = line.text().substring(1).trim();
    if (!NAME.matcher(name).matches()) {
      throw new ParseException(
          ParseException.Kind.INVALID_NODE_NAME,
          line.pos().addColumns(1),
          String.format("invalid node name '%s': only letters, digits and '_' are allowed", name));
    }
    if (nodes.containsKey(name)) {
      throw new ParseException(
          ParseException.Kind.DUPLICATE_NODE,
          line.pos(),
          String.format(
              "duplicate node '%s', previously declared at %s", name, nodes.get(name).pos()));
    }
    current = new NodeBuilder(name, line.pos());
  }

  private NodeBuilder openNode(Lexer.Line line) throws ParseException {
    if (current == null) {
      throw new ParseException(
          ParseException.Kind.STRAY_CONTENT,
          line.pos(),
          "content is not associated with a @node");
    }
    return current;
  }

  private void closeNode() {
    if (current == null) return;

    Node node = current.build();
    nodes.put(node.name(), node);
    current = null;
  }

  static ContentElement.Call parseCall(String text, Pos pos) throws ParseException {
    int close = text.indexOf('}');
    if (close < 0) throw malformedCall(pos, "unterminated function name");

    String function = text.substring(2, close).trim();
    if (!NAME.matcher(function).matches()) {
      throw malformedCall(pos, String.format("invalid function name '%s'", function));
    }

    String rest = text.substring(close + 1).trim();
    if (!rest.startsWith(":")) {
      throw malformedCall(pos, String.format("expected ':' after !{%s}", function));
    }
    rest = rest.substring(1).trim();

    ImmutableList.Builder<String> bindings = ImmutableList.builder();
    while (!rest.isEmpty()) {
      if (!rest.startsWith("~{")) {
        throw malformedCall(pos, String.format("expected ~{name}, got '%s'", rest));
      }
      int end = rest.indexOf('}');
      if (end < 0) throw malformedCall(pos, "unterminated binding");

      String binding = rest.substring(2, end).trim();
      if (!NAME.matcher(binding).matches()) {
        throw malformedCall(pos, String.format("invalid binding name '%s'", binding));
      }
      bindings.add(binding);
      rest = rest.substring(end + 1).trim();
      if (rest.startsWith(",")) rest = rest.substring(1).trim();
    }

    ImmutableList<String> names = bindings.build();
    if (names.isEmpty()) {
      throw malformedCall(pos, String.format("!{%s} needs at least one ~{binding}", function));
    }
    return ContentElement.call(function, names, pos);
  }

  private static ParseException malformedCall(Pos pos, String msg) {
    return new ParseException(ParseException.Kind.MALFORMED_CALL, pos, msg);
  }

  static Branch.Option parseOption(String text, Pos pos) throws ParseException {
    int close = text.indexOf('}');
    if (close < 0) throw malformedBranch(pos, "unterminated keyword list");

    ImmutableSet<String> keywords =
        LIST_SPLITTER
            .splitToStream(text.substring(1, close))
            .map(k -> k.toLowerCase(Locale.ROOT))
            .collect(ImmutableSet.toImmutableSet());
    if (keywords.isEmpty()) throw malformedBranch(pos, "an option needs at least one keyword");

    return new Branch.Option(keywords, parseTarget(text.substring(close + 1), pos), pos);
  }

  static Branch.Condition parseCondition(String text, Pos pos) throws ParseException {
    int close = text.indexOf('}');
    if (close < 0) throw malformedBranch(pos, "unterminated condition");

    String variable = text.substring(2, close).trim();
    if (!NAME.matcher(variable).matches()) {
      throw malformedBranch(pos, String.format("invalid condition variable '%s'", variable));
    }
    return new Branch.Condition(variable, parseTarget(text.substring(close + 1), pos), pos);
  }

  // Parses "-> destination".
  private static Destination parseTarget(String text, Pos pos) throws ParseException {
    String rest = text.trim();
    if (!rest.startsWith(ARROW)) throw malformedBranch(pos, "expected '->' and a destination");
    return parseDestination(rest.substring(ARROW.length()).trim(), pos);
  }

  /**
   * Parses a destination: {@code node}, {@code @node}, {@code [file:node]} (either side may use
   * {@code ${var}}), {@code {exit}} or {@code ${var}}.
   */
  public static Destination parseDestination(String raw, Pos pos) throws ParseException {
    if (raw.isEmpty()) throw malformedBranch(pos, "missing destination");

    if (raw.equals(EXIT)) {
      return Destination.exit(pos);
    } else if (raw.startsWith("[")) {
      if (!raw.endsWith("]")) throw malformedBranch(pos, "unterminated file transfer: " + raw);

      String inner = raw.substring(1, raw.length() - 1);
      int colon = inner.indexOf(':');
      if (colon < 0) throw malformedBranch(pos, "expected [file:node], got " + raw);

      String targetFile = inner.substring(0, colon).trim();
      String targetNode = inner.substring(colon + 1).trim();
      if (targetFile.isEmpty() || targetNode.isEmpty()) {
        throw malformedBranch(pos, "expected [file:node], got " + raw);
      }
      if (!Interpolation.hasTokens(targetNode) && !NAME.matcher(targetNode).matches()) {
        throw malformedBranch(pos, String.format("invalid node name '%s'", targetNode));
      }
      return Destination.fileTransfer(targetFile, targetNode, pos);
    }

    ImmutableSet<String> variables = Interpolation.variableNames(raw);
    if (variables.size() == 1 && raw.equals("${" + variables.iterator().next() + "}")) {
      return Destination.dynamic(variables.iterator().next(), pos);
    }

    String node = raw.startsWith("@") ? raw.substring(1).trim() : raw;
    if (!NAME.matcher(node).matches()) {
      throw malformedBranch(pos, String.format("invalid destination '%s'", raw));
    }
    return Destination.node(node, pos);
  }

  /**
   * Parses a destination held in a variable or configuration value, where a file transfer may
   * also be written without brackets as {@code file:node}.
   */
  public static Destination parseReference(String reference, Pos pos) throws ParseException {
    String raw = reference.trim();
    if (raw.indexOf(':') >= 0 && !raw.startsWith("[")) raw = "[" + raw + "]";
    return parseDestination(raw, pos);
  }

  private static ParseException malformedBranch(Pos pos, String msg) {
    return new ParseException(ParseException.Kind.MALFORMED_BRANCH, pos, msg);
  }

  private static final class NodeBuilder {
    private final String name;
    private final Pos pos;
    private final List<ContentElement> content = new ArrayList<>();
    private final List<Branch> branches = new ArrayList<>();

    private final List<String> textLines = new ArrayList<>();
    private Pos textPos = null;

    private NodeBuilder(String name, Pos pos) {
      this.name = name;
      this.pos = pos;
    }

    void consumeText(Lexer.Line line) {
      if (textLines.isEmpty()) textPos = line.pos();
      textLines.add(line.text());
    }

    void consumeContent(ContentElement element) {
      flushText();
      content.add(element);
    }

    void consumeBranch(Branch branch) {
      flushText();
      branches.add(branch);
    }

    private void flushText() {
      if (textLines.isEmpty()) return;

      content.add(ContentElement.text(String.join("\n", textLines), textPos));
      textLines.clear();
      textPos = null;
    }

    Node build() {
      flushText();
      return new Node(name, pos, content, branches);
    }
  }
}
