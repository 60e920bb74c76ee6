package bdl;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

public class ScriptParserTest {

  private static final String HEADER =
      String.join(
          "\n", "# Topic: Test", "# Description: A test", "# Author: Tester", "# Version: 1.0", "");

  private static String script(String... lines) {
    return HEADER + Arrays.asList(lines).stream().collect(Collectors.joining("\n"));
  }

  private static Document parse(String... lines) throws ParseException {
    return ScriptParser.parse(script(lines), "test.bdl", true);
  }

  private static Document parseDependency(String... lines) throws ParseException {
    return ScriptParser.parse(script(lines), "test.bdl", false);
  }

  private static ParseException assertErrors(
      ParseException.Kind kind, String errorSubstr, String... lines) {
    ParseException ex = assertThrows(ParseException.class, () -> parse(lines));
    assertThat(ex.kind()).isEqualTo(kind);
    assertThat(ex).hasMessageThat().contains(errorSubstr);
    return ex;
  }

  @Test
  public void metadata() throws ParseException {
    Document document =
        ScriptParser.parse(
            String.join(
                "\n",
                "# topic: Passwords",
                "# DESCRIPTION: Strong passwords",
                "# Author: Team",
                "# Version: 2.1",
                "# Required: a.bdl, b.bdl",
                "# Reviewed: yes",
                "@start"),
            "pw.bdl",
            false);

    assertThat(document.name()).isEqualTo("pw.bdl");
    assertThat(document.metadata())
        .isEqualTo(
            Metadata.create(
                "Passwords",
                "Strong passwords",
                "Team",
                "2.1",
                ImmutableList.of("a.bdl", "b.bdl")));
    assertThat(document.requires("b.bdl")).isTrue();
    assertThat(document.requires("c.bdl")).isFalse();
  }

  @Test
  public void missingMetadata() {
    ParseException ex =
        assertThrows(
            ParseException.class,
            () -> ScriptParser.parse("# Topic: x\n# Author: y\n@start\n", "m.bdl", true));
    assertThat(ex.kind()).isEqualTo(ParseException.Kind.MISSING_METADATA);
    assertThat(ex).hasMessageThat().contains("description, version");
    assertThat(ex.pos()).isEqualTo(Pos.startOf("m.bdl"));

    ex = assertThrows(ParseException.class, () -> ScriptParser.parse("", "empty.bdl", true));
    assertThat(ex.kind()).isEqualTo(ParseException.Kind.MISSING_METADATA);
  }

  @Test
  public void invalidDependencies() {
    assertErrors(
        ParseException.Kind.INVALID_DEPENDENCY, "extension: notes.txt", "# Required: notes.txt");
    assertErrors(
        ParseException.Kind.INVALID_DEPENDENCY, "duplicate dependency", "# Required: a.bdl, a.bdl");
  }

  @Test
  public void declarations() throws ParseException {
    Document document =
        parse(
            "$global_vars: {",
            "  user_name: \"\",",
            "  completed_modules: {}",
            "}",
            "$local_vars: { attempts: 0 }",
            "@start");

    assertThat(document.declaresGlobal()).isTrue();
    assertThat(document.globalDefaults().keySet())
        .containsExactly("user_name", "completed_modules")
        .inOrder();
    assertThat(document.localDefaults()).containsExactly("attempts", Value.of(0));
  }

  @Test
  public void globalsOutsideEntry() throws ParseException {
    String[] lines = {"$global_vars: { score: 0 }", "@start"};

    ParseException ex = assertThrows(ParseException.class, () -> parseDependency(lines));
    assertThat(ex.kind()).isEqualTo(ParseException.Kind.GLOBAL_OUTSIDE_ENTRY);
    assertThat(parse(lines).globalDefaults()).containsExactly("score", Value.of(0));
    assertThat(parseDependency("$local_vars: { score: 0 }").declaresGlobal()).isFalse();
  }

  @Test
  public void duplicateDeclarations() {
    assertErrors(
        ParseException.Kind.DUPLICATE_VARIABLE, "'a'", "$local_vars: {", "  a: 1,", "  a: 2", "}");
    assertErrors(
        ParseException.Kind.DUPLICATE_DECLARATION_BLOCK,
        "$local_vars",
        "$local_vars: { a: 1 }",
        "$local_vars: { b: 1 }");
  }

  @Test
  public void nodes() throws ParseException {
    Document document =
        parse(
            "@start",
            "Line one ${name}",
            "# a comment inside a node",
            "Line two",
            "!{getUserInput} : ~{input}",
            "After the call",
            "{yes, Y } -> next",
            "?{done} -> {exit}",
            "@next",
            "-> start");

    assertThat(document.nodes().keySet()).containsExactly("start", "next").inOrder();

    Node start = document.node("start").get();
    assertThat(start.content()).hasSize(3);
    assertThat(start.content().get(0).<ContentElement.Text>cast().raw())
        .isEqualTo("Line one ${name}\nLine two");
    ContentElement.Call call = start.content().get(1).cast();
    assertThat(call.function()).isEqualTo("getUserInput");
    assertThat(call.bindings()).containsExactly("input");
    assertThat(start.content().get(2).<ContentElement.Text>cast().raw())
        .isEqualTo("After the call");

    assertThat(start.branches()).hasSize(2);
    Branch.Option option = start.branches().get(0).cast();
    assertThat(option.keywords()).containsExactly("yes", "y");
    assertThat(option.destination()).isEqualTo(Destination.node("next", option.pos()));
    Branch.Condition condition = start.branches().get(1).cast();
    assertThat(condition.variable()).isEqualTo("done");
    assertThat(condition.destination().type()).isEqualTo(Destination.Type.EXIT);
    assertThat(start.hasOptions()).isTrue();

    Node next = document.node("next").get();
    assertThat(next.content()).isEmpty();
    assertThat(next.branches()).hasSize(1);
    assertThat(next.branches().get(0).type()).isEqualTo(Branch.Type.JUMP);
    assertThat(next.hasOptions()).isFalse();
  }

  @Test
  public void invalidNodeNames() {
    assertErrors(ParseException.Kind.INVALID_NODE_NAME, "'bad name'", "@bad name");
    assertErrors(ParseException.Kind.INVALID_NODE_NAME, "''", "@");
    assertErrors(ParseException.Kind.INVALID_NODE_NAME, "'a-b'", "@a-b");
  }

  @Test
  public void duplicateNode() {
    ParseException ex =
        assertErrors(ParseException.Kind.DUPLICATE_NODE, "'node1'", "@node1", "@node2", "@node1");
    assertThat(ex.pos().lineNumber()).isEqualTo(6);
  }

  @Test
  public void strayContent() {
    assertErrors(ParseException.Kind.STRAY_CONTENT, "@node", "Hello");
    assertErrors(ParseException.Kind.STRAY_CONTENT, "@node", "-> start");
  }

  @Test
  public void calls() throws ParseException {
    Document document =
        parse("@start", "!{analyzePassword}:~{feedback}  ~{next}, ~{extra}");

    ContentElement.Call call = document.node("start").get().content().get(0).cast();
    assertThat(call.function()).isEqualTo("analyzePassword");
    assertThat(call.bindings()).containsExactly("feedback", "next", "extra").inOrder();
  }

  @Test
  public void malformedCalls() {
    assertErrors(ParseException.Kind.MALFORMED_CALL, "at least one", "@s", "!{f} :");
    assertErrors(ParseException.Kind.MALFORMED_CALL, "expected ':'", "@s", "!{f} ~{a}");
    assertErrors(ParseException.Kind.MALFORMED_CALL, "unterminated", "@s", "!{f : ~a");
    assertErrors(ParseException.Kind.MALFORMED_CALL, "expected ~{name}", "@s", "!{f} : a");
    assertErrors(ParseException.Kind.MALFORMED_CALL, "invalid function", "@s", "!{} : ~{a}");
  }

  @Test
  public void destinations() throws ParseException {
    Document document =
        parse(
            "@start",
            "{a} -> next",
            "{b} -> @next",
            "{c} -> [other.bdl:start]",
            "{d} -> [${file}:${node}]",
            "{e} -> {exit}",
            "{f} -> ${next}",
            "@next");

    ImmutableList<Destination> destinations =
        document.node("start").get().branches().stream()
            .map(Branch::destination)
            .collect(ImmutableList.toImmutableList());

    assertThat(destinations.get(0).<Destination.NodeRef>cast().name()).isEqualTo("next");
    assertThat(destinations.get(1).<Destination.NodeRef>cast().name()).isEqualTo("next");

    Destination.FileTransfer literal = destinations.get(2).cast();
    assertThat(literal.file()).isEqualTo("other.bdl");
    assertThat(literal.node()).isEqualTo("start");
    assertThat(literal.isLiteral()).isTrue();

    Destination.FileTransfer interpolated = destinations.get(3).cast();
    assertThat(interpolated.file()).isEqualTo("${file}");
    assertThat(interpolated.isLiteral()).isFalse();

    assertThat(destinations.get(4).type()).isEqualTo(Destination.Type.EXIT);
    assertThat(destinations.get(5).<Destination.Dynamic>cast().variable()).isEqualTo("next");
  }

  @Test
  public void malformedBranches() {
    assertErrors(ParseException.Kind.MALFORMED_BRANCH, "'->'", "@s", "{yes} next");
    assertErrors(ParseException.Kind.MALFORMED_BRANCH, "missing destination", "@s", "{yes} ->");
    assertErrors(ParseException.Kind.MALFORMED_BRANCH, "at least one keyword", "@s", "{ , } -> s");
    assertErrors(ParseException.Kind.MALFORMED_BRANCH, "[file:node]", "@s", "{yes} -> [a.bdl]");
    assertErrors(ParseException.Kind.MALFORMED_BRANCH, "unterminated", "@s", "{yes} -> [a.bdl:s");
    assertErrors(ParseException.Kind.MALFORMED_BRANCH, "invalid destination", "@s", "-> two words");
    assertErrors(ParseException.Kind.MALFORMED_BRANCH, "condition variable", "@s", "?{} -> s");
  }

  @Test
  public void parseReference() throws ParseException {
    Pos pos = Pos.internal();
    assertThat(ScriptParser.parseReference("main.bdl:start", pos))
        .isEqualTo(Destination.fileTransfer("main.bdl", "start", pos));
    assertThat(ScriptParser.parseReference(" [main.bdl:start] ", pos))
        .isEqualTo(Destination.fileTransfer("main.bdl", "start", pos));
    assertThat(ScriptParser.parseReference("intro", pos)).isEqualTo(Destination.node("intro", pos));
    assertThat(ScriptParser.parseReference("{exit}", pos).type())
        .isEqualTo(Destination.Type.EXIT);
  }

  @Test
  public void parsingIsDeterministic() throws ParseException {
    String[] lines = {
      "$global_vars: { name: \"x\" }", "@start", "Hi ${name}", "{go} -> [b.bdl:s]", "-> start"
    };

    assertThat(parse(lines)).isEqualTo(parse(lines));
  }

  @Test
  public void keywordsAreCaseFolded() throws ParseException {
    Document document = parse("@s", "{Password, PASSWORDS ,security} -> s");
    Branch.Option option = document.node("s").get().branches().get(0).cast();

    assertThat(option.keywords()).isEqualTo(ImmutableSet.of("password", "passwords", "security"));
    assertThat(option.matches("password")).isTrue();
    assertThat(option.matches("passwordish")).isFalse();
  }
}
