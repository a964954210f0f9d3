package xlf;

import java.util.Optional;

/**
 * Checks every call in a tree against a {@link FunctionCatalogue}: the function must exist and,
 * unless it interprets its own arguments, receive an argument count its signature allows. Omitted
 * arguments still occupy a position and are counted.
 */
public final class CallArityValidator extends ErrorCollectingValidator {
  private final FunctionCatalogue catalogue;

  public CallArityValidator(FunctionCatalogue catalogue) {
    this.catalogue = catalogue;
  }

  public static CallArityValidator validate(SyntaxNode root, FunctionCatalogue catalogue) {
    CallArityValidator validator = new CallArityValidator(catalogue);
    root.accept(validator, null);
    return validator;
  }

  @Override
  public void visitImpl(SyntaxNode.Call node) {
    Optional<FunctionSignature> signature = catalogue.lookup(node.kind());
    if (!signature.isPresent()) {
      logError(node, String.format("unknown function %s", node.kind()));
    } else if (!signature.get().customArgumentHandling()) {
      checkArity(node, signature.get());
    }

    super.visitImpl(node);
  }

  private void checkArity(SyntaxNode.Call node, FunctionSignature signature) {
    int count = node.arguments().size();
    if (count < signature.requiredArgumentCount()) {
      logError(
          node,
          String.format(
              "%s expects at least %d argument(s) but got %d: %s",
              node.kind(), signature.requiredArgumentCount(), count, signature.usage()));
    } else if (!signature.acceptsUnboundedArguments() && count > signature.parameters().size()) {
      logError(
          node,
          String.format(
              "%s expects at most %d argument(s) but got %d: %s",
              node.kind(), signature.parameters().size(), count, signature.usage()));
    }
  }
}
