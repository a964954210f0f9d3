package xlf;

import java.io.PrintStream;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.ForOverride;

@AutoValue
public abstract class ParseOptions {
  public static final int DEFAULT_MAX_NESTING_DEPTH = 512;

  /** Whether to print the token stream of every parse to {@link #debugOut()}. */
  public abstract boolean debugTokens();

  public abstract PrintStream debugOut();

  /** The deepest expression nesting the parser accepts. */
  public abstract int maxNestingDepth();

  public abstract Builder toBuilder();

  public static ParseOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_ParseOptions.Builder()
        .setDebugTokens(false)
        .setDebugOut(System.err)
        .setMaxNestingDepth(DEFAULT_MAX_NESTING_DEPTH);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setDebugTokens(boolean debugTokens);

    public abstract Builder setDebugOut(PrintStream debugOut);

    public abstract Builder setMaxNestingDepth(int maxNestingDepth);

    @ForOverride
    abstract ParseOptions autoBuild();

    public final ParseOptions build() {
      ParseOptions options = autoBuild();
      Preconditions.checkArgument(
          options.maxNestingDepth() > 0,
          "maxNestingDepth must be positive: %s",
          options.maxNestingDepth());
      return options;
    }
  }
}
