package quantmark.circuit;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Angle carried by a rotation or phase gate.
 *
 * <p>Either a fixed numeric value or a symbolic name left unbound for later optimization. Exactly
 * one of {@code value} and {@code symbol} is non-null. Symbols follow {@link #SYMBOL_REGEX}, which
 * never overlaps {@link #NUMBER_REGEX}, so a printed parameter always reads back as what it was.
 */
public record GateParameter(Double value, String symbol) {
  /** Printed shape of a numeric angle. */
  public static final String NUMBER_REGEX =
      "[-+]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][-+]?\\d+)?";

  /** Printed shape of a symbolic parameter name. */
  public static final String SYMBOL_REGEX = "[A-Za-z_][A-Za-z0-9_]*";

  private static final Pattern SYMBOL = Pattern.compile(SYMBOL_REGEX);

  public GateParameter {
    if ((value == null) == (symbol == null)) {
      throw new IllegalArgumentException("Exactly one of value and symbol must be set");
    }
    if (value != null && !Double.isFinite(value)) {
      throw new IllegalArgumentException("Numeric angle must be finite: " + value);
    }
    if (symbol != null && !SYMBOL.matcher(symbol).matches()) {
      throw new IllegalArgumentException("Invalid symbolic parameter name: '" + symbol + "'");
    }
  }

  public static GateParameter numeric(double value) {
    return new GateParameter(value, null);
  }

  public static GateParameter symbolic(String name) {
    return new GateParameter(null, Objects.requireNonNull(name, "name"));
  }

  public boolean isSymbolic() {
    return symbol != null;
  }

  @Override
  public String toString() {
    return isSymbolic() ? symbol : String.valueOf(value);
  }
}
