package xlf;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders a syntax tree as JSON. Each node becomes {@code {"kind", "literalValue"?, "label"?,
 * "span": {"start", "end"}, "children"?}}; {@code children} is left out for nodes without any.
 */
public final class SyntaxTreeJson {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private SyntaxTreeJson() {}

  public static ObjectNode toJson(SyntaxNode root) {
    ArrayNode holder = MAPPER.createArrayNode();
    root.accept(new Writer(), holder);
    return (ObjectNode) holder.get(0);
  }

  public static String toJsonString(SyntaxNode root) throws JsonProcessingException {
    return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(root));
  }

  // Appends one object per visited node to the array passed in.
  private static final class Writer extends DefaultSyntaxVisitor<ArrayNode> {
    @Override
    protected ArrayNode visitDefault(SyntaxNodeInterface node, ArrayNode siblings) {
      SyntaxNode syntaxNode = (SyntaxNode) node;
      ObjectNode json = siblings.addObject();
      json.put("kind", syntaxNode.kind());
      syntaxNode.literalValue().ifPresent(v -> json.set("literalValue", MAPPER.valueToTree(v)));
      syntaxNode.label().ifPresent(label -> json.put("label", label));

      ObjectNode span = json.putObject("span");
      span.put("start", syntaxNode.span().start());
      span.put("end", syntaxNode.span().end());

      if (!syntaxNode.children().isEmpty()) {
        syntaxNode.visitChildren(this, json.putArray("children"));
      }
      return siblings;
    }
  }
}
