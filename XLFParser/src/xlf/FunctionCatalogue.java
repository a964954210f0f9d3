package xlf;

import java.util.Optional;

import com.google.common.collect.ImmutableSortedSet;

/** Read-only metadata about worksheet functions, keyed by upper-cased name. */
public interface FunctionCatalogue {
  Optional<FunctionSignature> lookup(String name);

  ImmutableSortedSet<String> names();
}
