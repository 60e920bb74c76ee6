package bdl;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * Checks that conditions and dynamic destinations read variables that are declared, either as
 * locals of the document or as globals of the entry file, or bound by a call in the document.
 */
class VariableReferenceValidator extends ErrorCollectingValidator {
  private static final class BindingAccumulator
      extends DefaultScriptVisitor<ImmutableSet.Builder<String>> {
    @Override
    public ImmutableSet.Builder<String> visit(
        ContentElement.Call call, ImmutableSet.Builder<String> value) {
      return value.addAll(call.bindings());
    }
  }

  private final ImmutableSet<String> known;

  public VariableReferenceValidator(Document document, Set<String> globals) {
    this.known =
        document
            .accept(new BindingAccumulator(), ImmutableSet.<String>builder())
            .addAll(document.localDefaults().keySet())
            .addAll(globals)
            .build();
  }

  @Override
  public void visitImpl(Branch.Condition condition) {
    if (!known.contains(condition.variable()))
      logError(condition.pos(), "undeclared condition variable: " + condition.variable());
    super.visitImpl(condition);
  }

  @Override
  public void visitImpl(Destination.Dynamic dynamic) {
    if (!known.contains(dynamic.variable()))
      logError(dynamic.pos(), "undeclared destination variable: " + dynamic.variable());
  }
}
