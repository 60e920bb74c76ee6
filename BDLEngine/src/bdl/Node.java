package bdl;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import bdl.processor.ScriptChild;
import bdl.processor.ScriptNode;

/** A named unit of content and branches; the unit of navigation. */
@ScriptNode
public final class Node implements Node_ScriptNode {
  private final String name;
  private final Pos pos;
  private final ImmutableList<ContentElement> content;
  private final ImmutableList<Branch> branches;

  public Node(String name, Pos pos, List<ContentElement> content, List<Branch> branches) {
    this.name = name;
    this.pos = pos;
    this.content = ImmutableList.copyOf(content);
    this.branches = ImmutableList.copyOf(branches);
  }

  public String name() {
    return name;
  }

  public Pos pos() {
    return pos;
  }

  @ScriptChild
  @Override
  public ImmutableList<ContentElement> content() {
    return content;
  }

  @ScriptChild
  @Override
  public ImmutableList<Branch> branches() {
    return branches;
  }

  public boolean hasOptions() {
    return branches.stream().anyMatch(b -> b.type() == Branch.Type.OPTION);
  }

  /**
   * Whether a line of input can move a session on from this node: it has options, or calls that
   * may read the input ahead of branches that may then fire.
   */
  public boolean acceptsInput() {
    return hasOptions()
        || (!branches.isEmpty()
            && content.stream().anyMatch(c -> c.type() == ContentElement.Type.CALL));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Node)) return false;

    Node that = (Node) o;
    return name.equals(that.name)
        && pos.equals(that.pos)
        && content.equals(that.content)
        && branches.equals(that.branches);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, pos, content, branches);
  }

  @Override
  public String toString() {
    return "@" + name;
  }
}
