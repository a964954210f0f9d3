package xlf;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

/** The worksheet functions described by the bundled {@code functions.json} resource. */
public final class BuiltinFunctionCatalogue implements FunctionCatalogue {
  static final String RESOURCE = "functions.json";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final class Holder {
    private static final BuiltinFunctionCatalogue INSTANCE = load();
  }

  private final ImmutableSortedMap<String, FunctionSignature> signatures;

  private BuiltinFunctionCatalogue(ImmutableSortedMap<String, FunctionSignature> signatures) {
    this.signatures = signatures;
  }

  public static BuiltinFunctionCatalogue instance() {
    return Holder.INSTANCE;
  }

  @Override
  public Optional<FunctionSignature> lookup(String name) {
    return Optional.ofNullable(signatures.get(name.toUpperCase(Locale.ROOT)));
  }

  @Override
  public ImmutableSortedSet<String> names() {
    return signatures.keySet();
  }

  private static BuiltinFunctionCatalogue load() {
    try (InputStream in = BuiltinFunctionCatalogue.class.getResourceAsStream(RESOURCE)) {
      Verify.verifyNotNull(in, "missing resource %s", RESOURCE);
      return fromJson(MAPPER.readTree(in));
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to read " + RESOURCE, ex);
    }
  }

  /** Builds a catalogue from a JSON array of function descriptions. */
  static BuiltinFunctionCatalogue fromJson(JsonNode root) throws IOException {
    Verify.verify(root.isArray(), "expected a JSON array of functions");
    ImmutableSortedMap.Builder<String, FunctionSignature> signatures =
        ImmutableSortedMap.naturalOrder();
    for (JsonNode function : root) {
      FunctionSignature signature = parseSignature(function);
      signatures.put(signature.name(), signature);
    }
    return new BuiltinFunctionCatalogue(signatures.build());
  }

  private static FunctionSignature parseSignature(JsonNode function) throws IOException {
    ImmutableList.Builder<FunctionSignature.Parameter> parameters = ImmutableList.builder();
    for (JsonNode parameter : function.path("parameters")) {
      JsonNode defaultValue = parameter.path("defaultValue");
      parameters.add(
          FunctionSignature.Parameter.create(
              requiredText(parameter, "name"),
              parameter.path("required").asBoolean(false),
              parameter.path("variadic").asBoolean(false),
              defaultValue.isMissingNode()
                  ? Optional.empty()
                  : Optional.of(MAPPER.treeToValue(defaultValue, Object.class))));
    }
    return FunctionSignature.create(
        requiredText(function, "name"),
        function.path("description").asText(""),
        function.path("returnType").asText("Any"),
        parameters.build(),
        function.path("customArgumentHandling").asBoolean(false),
        function.path("variadic").asBoolean(false));
  }

  private static String requiredText(JsonNode node, String field) throws IOException {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      throw new IOException(String.format("missing string field '%s' in %s", field, node));
    }
    return value.asText();
  }
}
