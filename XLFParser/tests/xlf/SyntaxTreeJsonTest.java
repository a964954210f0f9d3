package xlf;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class SyntaxTreeJsonTest {

  private static ObjectNode json(String formula) throws FormulaException {
    return SyntaxTreeJson.toJson(new FormulaParser().parse(formula));
  }

  @Test
  public void binaryExpression() throws FormulaException {
    ObjectNode root = json("1+2");

    assertThat(root.get("kind").asText()).isEqualTo("+");
    assertThat(root.has("literalValue")).isFalse();
    assertThat(root.get("span").get("start").asInt()).isEqualTo(0);
    assertThat(root.get("span").get("end").asInt()).isEqualTo(3);
    assertThat(root.get("children").size()).isEqualTo(2);

    JsonNode left = root.get("children").get(0);
    assertThat(left.get("kind").asText()).isEqualTo("NUMBER");
    assertThat(left.get("literalValue").asDouble()).isEqualTo(1.0);
    assertThat(left.has("children")).isFalse();
    assertThat(left.has("label")).isFalse();
  }

  @Test
  public void literalValuesKeepTheirJsonType() throws FormulaException {
    ObjectNode root = json("IF(TRUE,\"a\"\"b\",25%)");

    assertThat(root.get("children").get(0).get("literalValue").isBoolean()).isTrue();
    assertThat(root.get("children").get(1).get("literalValue").asText()).isEqualTo("a\"b");
    assertThat(root.get("children").get(2).get("literalValue").asDouble()).isEqualTo(0.25);
  }

  @Test
  public void labelsAreWritten() throws FormulaException {
    ObjectNode root = json("FILTER(A1:A3,B1:B3>0)");

    JsonNode array = root.get("children").get(0);
    assertThat(array.get("kind").asText()).isEqualTo("array");
    assertThat(array.get("label").asText()).isEqualTo("array");
    assertThat(array.get("children").get(0).get("kind").asText()).isEqualTo("Range");
  }

  @Test
  public void unprunedEmptyChildListIsOmitted() throws FormulaException {
    FormulaParser parser = new FormulaParser();
    SyntaxNode raw = parser.parseTokens(parser.tokenize("NOW()"));

    assertThat(raw.hasChildList()).isTrue();
    assertThat(SyntaxTreeJson.toJson(raw).has("children")).isFalse();
  }

  @Test
  public void stringFormRoundTripsThroughJackson()
      throws FormulaException, JsonProcessingException {
    SyntaxNode root = new FormulaParser().parse("SUM(A1,-1)");

    JsonNode reread = new ObjectMapper().readTree(SyntaxTreeJson.toJsonString(root));

    assertThat(reread).isEqualTo(SyntaxTreeJson.toJson(root));
  }
}
