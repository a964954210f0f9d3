package xlf;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Binding powers and handlers for the Pratt parser, keyed by operator text or token kind name
 * (see {@link Tokenizer.Token#ruleKey()}). Immutable; one instance may serve any number of
 * concurrent parses.
 */
public final class PrecedenceTable {
  /** How a token begins an expression. */
  public enum Prefix {
    ATOM,
    SIGN,
    GROUP,
    IDENTIFIER;
  }

  /** How a token continues an expression after a complete left operand. */
  public enum Infix {
    LEFT,
    RIGHT,
    RANGE,
    POSTFIX;
  }

  @AutoValue
  public abstract static class Rule {
    public abstract int bindingPower();

    public abstract Optional<Prefix> prefix();

    public abstract Optional<Infix> infix();

    public static Rule create(int bindingPower, Optional<Prefix> prefix, Optional<Infix> infix) {
      Preconditions.checkArgument(bindingPower >= 0, "negative binding power: %s", bindingPower);
      return new AutoValue_PrecedenceTable_Rule(bindingPower, prefix, infix);
    }

    public static Rule prefix(int bindingPower, Prefix prefix) {
      return create(bindingPower, Optional.of(prefix), Optional.empty());
    }

    public static Rule infix(int bindingPower, Infix infix) {
      return create(bindingPower, Optional.empty(), Optional.of(infix));
    }

    public static Rule both(int bindingPower, Prefix prefix, Infix infix) {
      return create(bindingPower, Optional.of(prefix), Optional.of(infix));
    }

    public static Rule sentinel() {
      return create(0, Optional.empty(), Optional.empty());
    }
  }

  /** Binding power of the operand of a prefix sign: tighter than every infix except {@code ^}. */
  static final int PREFIX_OPERAND_POWER = 70;

  private static final PrecedenceTable DEFAULTS =
      builder()
          // Atoms
          .put("NUMBER", Rule.prefix(0, Prefix.ATOM))
          .put("PERCENTAGE", Rule.prefix(0, Prefix.ATOM))
          .put("LITERAL", Rule.prefix(0, Prefix.ATOM))
          .put("BOOLEAN", Rule.prefix(0, Prefix.ATOM))
          .put("ERROR", Rule.prefix(0, Prefix.ATOM))
          .put("DYNAMIC_ERROR", Rule.prefix(0, Prefix.ATOM))
          .put("CELL", Rule.prefix(0, Prefix.ATOM))
          .put("RANGE", Rule.prefix(0, Prefix.ATOM))
          .put("NAMED_RANGE", Rule.prefix(0, Prefix.ATOM))
          .put("ARRAY", Rule.prefix(0, Prefix.ATOM))
          // Operators
          .put("+", Rule.both(50, Prefix.SIGN, Infix.LEFT))
          .put("-", Rule.both(50, Prefix.SIGN, Infix.LEFT))
          .put("%", Rule.infix(80, Infix.POSTFIX))
          .put("^", Rule.infix(70, Infix.RIGHT))
          .put("*", Rule.infix(60, Infix.LEFT))
          .put("/", Rule.infix(60, Infix.LEFT))
          .put(":", Rule.infix(40, Infix.RANGE))
          .put("&", Rule.infix(30, Infix.LEFT))
          .put("=", Rule.infix(30, Infix.LEFT))
          .put("<", Rule.infix(30, Infix.LEFT))
          .put(">", Rule.infix(30, Infix.LEFT))
          .put(">=", Rule.infix(30, Infix.LEFT))
          .put("<=", Rule.infix(30, Infix.LEFT))
          .put("<>", Rule.infix(30, Infix.LEFT))
          // Grouping and calls
          .put("LPAREN", Rule.prefix(0, Prefix.GROUP))
          .put("IDENT", Rule.prefix(0, Prefix.IDENTIFIER))
          // Sentinels
          .put("COMMA", Rule.sentinel())
          .put("RPAREN", Rule.sentinel())
          .put("EOF", Rule.sentinel())
          .build();

  private final ImmutableMap<String, Rule> rules;

  private PrecedenceTable(ImmutableMap<String, Rule> rules) {
    this.rules = rules;
  }

  public static PrecedenceTable defaults() {
    return DEFAULTS;
  }

  public Optional<Rule> lookup(Tokenizer.Token token) {
    return Optional.ofNullable(rules.get(token.ruleKey()));
  }

  public ImmutableMap<String, Rule> rules() {
    return rules;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A builder seeded with this table's rules, for deriving variants. */
  public Builder toBuilder() {
    Builder builder = new Builder();
    rules.forEach(builder::put);
    return builder;
  }

  public static final class Builder {
    private final Map<String, Rule> rules = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String key, Rule rule) {
      rules.put(Preconditions.checkNotNull(key), Preconditions.checkNotNull(rule));
      return this;
    }

    public Builder remove(String key) {
      rules.remove(key);
      return this;
    }

    public PrecedenceTable build() {
      return new PrecedenceTable(ImmutableMap.copyOf(rules));
    }
  }
}
