/* Keymeta © 2025 — MIT */
package dev.keymeta.api;

import dev.keymeta.util.MetaCasts;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Comparators accepted by {@code findObjectsByValue}.
 *
 * <p>Stored values are compared through their text form ({@link MetaCasts#toText}). Equality and
 * {@link #LIKE} work on text; the ordering comparators compare numerically when the operand is
 * numeric, skipping non-numeric rows, and lexicographically otherwise.
 */
public enum Comparison {
  EQ("="),
  NE("!="),
  GT(">"),
  LT("<"),
  GE(">="),
  LE("<="),
  LIKE("LIKE");

  private final String symbol;

  Comparison(String symbol) {
    this.symbol = symbol;
  }

  /**
   * SQL operator for this comparator.
   *
   * @return operator text
   */
  public String symbol() {
    return symbol;
  }

  /**
   * Whether this comparator orders values.
   *
   * @return {@code true} for {@code > < >= <=}
   */
  public boolean isOrdering() {
    return this == GT || this == LT || this == GE || this == LE;
  }

  /**
   * Parses an operator symbol. Unknown symbols fall back to {@link #EQ}.
   *
   * @param raw operator such as {@code "<>"} or {@code "like"}
   * @return comparator
   */
  public static Comparison from(String raw) {
    if (raw == null) {
      return EQ;
    }
    return switch (raw.trim().toUpperCase(Locale.ROOT)) {
      case "!=", "<>" -> NE;
      case ">" -> GT;
      case "<" -> LT;
      case ">=" -> GE;
      case "<=" -> LE;
      case "LIKE" -> LIKE;
      default -> EQ;
    };
  }

  /**
   * Evaluates {@code stored <op> operand}.
   *
   * @param stored stored value
   * @param operand caller-supplied operand
   * @return {@code true} when the row matches
   */
  public boolean matches(MetaValue stored, MetaValue operand) {
    String text = MetaCasts.toText(stored);
    String wanted = MetaCasts.toText(operand);
    switch (this) {
      case EQ:
        return text.equals(wanted);
      case NE:
        return !text.equals(wanted);
      case LIKE:
        return text.contains(wanted);
      default:
        break;
    }
    int order;
    OptionalDouble right = MetaCasts.numeric(operand);
    if (right.isPresent()) {
      OptionalDouble left = MetaCasts.numeric(MetaValue.of(text));
      if (left.isEmpty()) {
        return false;
      }
      order = Double.compare(left.getAsDouble(), right.getAsDouble());
    } else {
      order = text.compareTo(wanted);
    }
    return switch (this) {
      case GT -> order > 0;
      case LT -> order < 0;
      case GE -> order >= 0;
      default -> order <= 0;
    };
  }
}
