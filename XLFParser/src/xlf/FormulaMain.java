package xlf;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Parses one formula and prints its syntax tree as JSON. */
public class FormulaMain {

  public static void main(String[] args) throws IOException {
    boolean debug = false;
    boolean validate = false;
    List<String> positional = new ArrayList<>();
    for (String arg : args) {
      switch (arg) {
        case "--debug":
          debug = true;
          break;
        case "--validate":
          validate = true;
          break;
        default:
          positional.add(arg);
      }
    }

    if (positional.size() != 1) {
      System.err.println("Usage: $FORMULA_MAIN formula [--debug] [--validate]");
      System.exit(1);
    }

    FormulaParser parser =
        new FormulaParser(ParseOptions.builder().setDebugTokens(debug).build());
    SyntaxNode tree;
    try {
      tree = parser.parse(positional.get(0));
    } catch (FormulaException ex) {
      ex.print();
      System.exit(1);
      return;
    }

    System.out.println(SyntaxTreeJson.toJsonString(tree));

    if (validate) {
      CallArityValidator validator =
          CallArityValidator.validate(tree, BuiltinFunctionCatalogue.instance());
      if (validator.hasErrors()) {
        validator.printErrors();
        System.out.println("Validation failed.  See errors above.");
        System.exit(1);
      }
    }
  }
}
