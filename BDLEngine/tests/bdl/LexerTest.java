package bdl;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class LexerTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private ImmutableList<Lexer.Line> tokenize() throws ParseException {
    return new Lexer("test.bdl", file.toString()).tokenize();
  }

  private static void assertLine(Lexer.Line line, Lexer.Kind kind, String text) {
    assertThat(line.kind()).isEqualTo(kind);
    assertThat(line.text()).isEqualTo(text);
  }

  @Test
  public void emptyFile() throws ParseException {
    assertThat(tokenize()).isEmpty();
  }

  @Test
  public void header() throws ParseException {
    println("");
    println("# Topic: Passwords");
    println("# just a comment");
    println("#Author:Someone");
    println("@start");

    ImmutableList<Lexer.Line> lines = tokenize();

    assertThat(lines).hasSize(3);
    assertLine(lines.get(0), Lexer.Kind.METADATA, "Topic: Passwords");
    assertLine(lines.get(1), Lexer.Kind.METADATA, "Author:Someone");
    assertLine(lines.get(2), Lexer.Kind.NODE, "@start");
    assertThat(lines.get(1).pos()).isEqualTo(Pos.create("test.bdl", 3, 0));
  }

  @Test
  public void headerEndsAtFirstOtherLine() throws ParseException {
    println("# Topic: Passwords");
    println("@start");
    println("# Version: 2");

    ImmutableList<Lexer.Line> lines = tokenize();

    assertThat(lines).hasSize(2);
    assertThat(lines.get(1).kind()).isEqualTo(Lexer.Kind.NODE);
  }

  @Test
  public void classifiesLines() throws ParseException {
    println("@start");
    println("  Hello ${name}  ");
    println("");
    println("!{getUserInput} : ~{input}");
    println("{yes, no} -> next");
    println("?{done} -> {exit}");
    println("-> ${next}");
    println("# skipped");

    ImmutableList<Lexer.Line> lines = tokenize();

    assertThat(lines).hasSize(6);
    assertLine(lines.get(0), Lexer.Kind.NODE, "@start");
    assertLine(lines.get(1), Lexer.Kind.TEXT, "Hello ${name}");
    assertLine(lines.get(2), Lexer.Kind.CALL, "!{getUserInput} : ~{input}");
    assertLine(lines.get(3), Lexer.Kind.OPTION, "{yes, no} -> next");
    assertLine(lines.get(4), Lexer.Kind.CONDITION, "?{done} -> {exit}");
    assertLine(lines.get(5), Lexer.Kind.JUMP, "-> ${next}");
    assertThat(lines.get(1).pos()).isEqualTo(Pos.create("test.bdl", 1, 2));
  }

  @Test
  public void declarationBlock() throws ParseException {
    println("$global_vars: {");
    println("  name: \"a } b\",");
    println("  # comment");
    println("  nested: { x: 1 }");
    println("}");
    println("@start");

    ImmutableList<Lexer.Line> lines = tokenize();

    assertThat(lines).hasSize(2);
    assertThat(lines.get(0).kind()).isEqualTo(Lexer.Kind.GLOBAL_DECLARATION);
    assertThat(lines.get(0).text()).isEqualTo("{\n  name: \"a } b\",\n\n  nested: { x: 1 }\n}");
    assertLine(lines.get(1), Lexer.Kind.NODE, "@start");
    assertThat(lines.get(1).pos().lineNumber()).isEqualTo(5);
  }

  @Test
  public void singleLineDeclarationBlock() throws ParseException {
    println("$local_vars: { attempts: 0 }");

    ImmutableList<Lexer.Line> lines = tokenize();

    assertThat(lines).hasSize(1);
    assertLine(lines.get(0), Lexer.Kind.LOCAL_DECLARATION, "{ attempts: 0 }");
  }

  @Test
  public void malformedDeclarationBlocks() {
    println("$local_vars: attempts");
    ParseException ex = assertThrows(ParseException.class, this::tokenize);
    assertThat(ex.kind()).isEqualTo(ParseException.Kind.MALFORMED_DECLARATION);

    file = new StringBuilder();
    println("$local_vars: {");
    println("  attempts: 0");
    ex = assertThrows(ParseException.class, this::tokenize);
    assertThat(ex.kind()).isEqualTo(ParseException.Kind.MALFORMED_DECLARATION);
    assertThat(ex).hasMessageThat().contains("unterminated");

    file = new StringBuilder();
    println("$local_vars: { a: 1 } trailing");
    ex = assertThrows(ParseException.class, this::tokenize);
    assertThat(ex.kind()).isEqualTo(ParseException.Kind.MALFORMED_DECLARATION);
  }

  @Test
  public void windowsLineEndings() throws ParseException {
    file.append("@start\r\nHello\r\n");

    ImmutableList<Lexer.Line> lines = tokenize();

    assertThat(lines).hasSize(2);
    assertLine(lines.get(1), Lexer.Kind.TEXT, "Hello");
  }
}
