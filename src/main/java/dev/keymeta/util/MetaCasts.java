/* Keymeta © 2025 — MIT */
package dev.keymeta.util;

import dev.keymeta.api.CastKind;
import dev.keymeta.api.MetaValue;
import dev.keymeta.api.MetaValue.BoolValue;
import dev.keymeta.api.MetaValue.FloatValue;
import dev.keymeta.api.MetaValue.IntValue;
import dev.keymeta.api.MetaValue.ListValue;
import dev.keymeta.api.MetaValue.MapValue;
import dev.keymeta.api.MetaValue.StringValue;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Permissive coercion of {@link MetaValue}s to the {@link CastKind} targets.
 *
 * <p>Rules follow a dynamic language's cast semantics: non-numeric strings become {@code 0},
 * anything non-empty is {@code true}, scalars are wrapped when a list is requested. A {@code null}
 * argument means "absent" and coerces to the kind's zero value.
 */
public final class MetaCasts {
  private static final String NUMBER = "[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?";
  private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(" + NUMBER + ")");
  private static final Pattern WHOLE_NUMBER = Pattern.compile("\\s*" + NUMBER + "\\s*");
  private static final Pattern DIGITS = Pattern.compile("[+-]?\\d+");

  private MetaCasts() {}

  /**
   * Coerces {@code value} to {@code kind}.
   *
   * @param value source value, {@code null} when absent
   * @param kind cast target
   * @return coerced value, never {@code null}
   */
  public static MetaValue cast(MetaValue value, CastKind kind) {
    Objects.requireNonNull(kind, "kind");
    return switch (kind) {
      case INT -> MetaValue.of(toLong(value));
      case FLOAT -> MetaValue.of(toDouble(value));
      case BOOL -> MetaValue.of(toBool(value));
      case STRING -> MetaValue.of(toText(value));
      case LIST -> toList(value);
    };
  }

  public static long toLong(MetaValue value) {
    if (value == null) {
      return 0L;
    }
    if (value instanceof IntValue i) {
      return i.value();
    }
    if (value instanceof FloatValue f) {
      return (long) f.value();
    }
    if (value instanceof BoolValue b) {
      return b.value() ? 1L : 0L;
    }
    if (value instanceof StringValue s) {
      String prefix = leadingNumber(s.value());
      if (prefix == null) {
        return 0L;
      }
      if (DIGITS.matcher(prefix).matches()) {
        try {
          return Long.parseLong(prefix);
        } catch (NumberFormatException overflow) {
          return (long) Double.parseDouble(prefix);
        }
      }
      return (long) Double.parseDouble(prefix);
    }
    return containerSize(value) == 0 ? 0L : 1L;
  }

  public static double toDouble(MetaValue value) {
    if (value == null) {
      return 0.0d;
    }
    if (value instanceof IntValue i) {
      return i.value();
    }
    if (value instanceof FloatValue f) {
      return f.value();
    }
    if (value instanceof BoolValue b) {
      return b.value() ? 1.0d : 0.0d;
    }
    if (value instanceof StringValue s) {
      String prefix = leadingNumber(s.value());
      return prefix == null ? 0.0d : Double.parseDouble(prefix);
    }
    return containerSize(value) == 0 ? 0.0d : 1.0d;
  }

  public static boolean toBool(MetaValue value) {
    if (value == null) {
      return false;
    }
    if (value instanceof IntValue i) {
      return i.value() != 0L;
    }
    if (value instanceof FloatValue f) {
      return f.value() != 0.0d;
    }
    if (value instanceof BoolValue b) {
      return b.value();
    }
    if (value instanceof StringValue s) {
      return !s.value().isEmpty() && !"0".equals(s.value());
    }
    return containerSize(value) > 0;
  }

  /**
   * Text form of a value. This is also the form stores compare against in {@code findIds}.
   *
   * @param value value, {@code null} when absent
   * @return text form; containers render as canonical JSON
   */
  public static String toText(MetaValue value) {
    if (value == null) {
      return "";
    }
    if (value instanceof IntValue i) {
      return Long.toString(i.value());
    }
    if (value instanceof FloatValue f) {
      return formatDouble(f.value());
    }
    if (value instanceof BoolValue b) {
      return b.value() ? "1" : "";
    }
    if (value instanceof StringValue s) {
      return s.value();
    }
    return MetaCodec.canonical(value);
  }

  public static MetaValue toList(MetaValue value) {
    if (value == null) {
      return ListValue.EMPTY;
    }
    if (value.isContainer()) {
      return value;
    }
    return MetaValue.list(value);
  }

  /**
   * Whether a value is numeric: an integer, a float, or a string holding a complete number
   * (surrounding whitespace allowed).
   *
   * @param value value, {@code null} when absent
   * @return {@code true} when numeric
   */
  public static boolean isNumeric(MetaValue value) {
    if (value instanceof IntValue || value instanceof FloatValue) {
      return true;
    }
    return value instanceof StringValue s && WHOLE_NUMBER.matcher(s.value()).matches();
  }

  /**
   * Numeric reading of a value.
   *
   * @param value value, {@code null} when absent
   * @return the number, or empty when the value is not {@linkplain #isNumeric numeric}
   */
  public static OptionalDouble numeric(MetaValue value) {
    if (!isNumeric(value)) {
      return OptionalDouble.empty();
    }
    if (value instanceof StringValue s) {
      return OptionalDouble.of(Double.parseDouble(s.value().trim()));
    }
    return OptionalDouble.of(toDouble(value));
  }

  static String formatDouble(double d) {
    if (Double.isNaN(d)) {
      return "NAN";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "INF" : "-INF";
    }
    if (d == Math.rint(d) && Math.abs(d) < 1e15) {
      return Long.toString((long) d);
    }
    return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
  }

  private static String leadingNumber(String raw) {
    Matcher m = LEADING_NUMBER.matcher(raw);
    return m.find() ? m.group(1) : null;
  }

  private static int containerSize(MetaValue value) {
    if (value instanceof ListValue l) {
      return l.size();
    }
    if (value instanceof MapValue m) {
      return m.size();
    }
    return 0;
  }
}
