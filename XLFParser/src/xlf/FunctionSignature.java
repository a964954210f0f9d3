package xlf;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class FunctionSignature {

  @AutoValue
  public abstract static class Parameter {
    public abstract String name();

    public abstract boolean required();

    /** Whether this parameter may repeat. */
    public abstract boolean variadic();

    public abstract Optional<Object> defaultValue();

    public static Parameter create(
        String name, boolean required, boolean variadic, Optional<Object> defaultValue) {
      return new AutoValue_FunctionSignature_Parameter(name, required, variadic, defaultValue);
    }

    @Override
    public final String toString() {
      return (required() ? name() : "[" + name() + "]") + (variadic() ? "..." : "");
    }
  }

  public abstract String name();

  public abstract String description();

  public abstract String returnType();

  public abstract ImmutableList<Parameter> parameters();

  /** Arguments are interpreted by the function itself, as with LET and LAMBDA. */
  public abstract boolean customArgumentHandling();

  /** The whole argument list may repeat. */
  public abstract boolean variadic();

  public static FunctionSignature create(
      String name,
      String description,
      String returnType,
      List<Parameter> parameters,
      boolean customArgumentHandling,
      boolean variadic) {
    return new AutoValue_FunctionSignature(
        name.toUpperCase(Locale.ROOT),
        description,
        returnType,
        ImmutableList.copyOf(parameters),
        customArgumentHandling,
        variadic);
  }

  @Memoized
  public int requiredArgumentCount() {
    return (int) parameters().stream().filter(Parameter::required).count();
  }

  /** Whether any number of trailing arguments is accepted. */
  @Memoized
  public boolean acceptsUnboundedArguments() {
    return variadic() || parameters().stream().anyMatch(Parameter::variadic);
  }

  /** {@code NAME(a, b, [c])}. */
  public String usage() {
    StringBuilder sb = new StringBuilder(name()).append('(');
    for (int i = 0; i < parameters().size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(parameters().get(i));
    }
    return sb.append(')').toString();
  }
}
