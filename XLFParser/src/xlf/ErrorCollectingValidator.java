package xlf;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

abstract class ErrorCollectingValidator extends VoidSyntaxVisitor {
  private final List<ValidationException> errors = new ArrayList<>();

  public ImmutableList<ValidationException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(SyntaxNode node, String msg) {
    logError(new ValidationException(node, msg));
  }

  protected void logError(ValidationException ex) {
    errors.add(ex);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public void printErrors() {
    errors.stream().forEach(ValidationException::print);
  }
}
