package quantmark.grammar;

import com.google.common.primitives.Doubles;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import quantmark.circuit.Circuit;

/**
 * Whole-circuit grammar: the {@code circuit:} header followed by zero or more gates of any {@link
 * GateGrammar} family, each preceded by whitespace. Only whitespace may separate gates.
 */
public final class CircuitGrammar {
  private static final String HEADER_REGEX = Pattern.quote(Circuit.HEADER);
  private static final String CIRCUIT_REGEX =
      HEADER_REGEX + "(?:\\s+" + GateGrammar.anyGateRegex() + ")*\\s*";

  private static final Pattern CIRCUIT = Pattern.compile(CIRCUIT_REGEX);
  private static final Pattern HEADER = Pattern.compile(HEADER_REGEX);
  private static final Pattern NUMERIC_PARAMETER =
      Pattern.compile("parameter=(" + GateGrammar.Fragments.NUMBER + ")\\)");
  private static final Pattern NEXT_GATE =
      Pattern.compile("\\s+(" + GateGrammar.anyGateRegex() + ")");

  private CircuitGrammar() {}

  /** Regex source of the complete circuit grammar. */
  public static String circuitRegex() {
    return CIRCUIT_REGEX;
  }

  /** Compiled form of {@link #circuitRegex()}. */
  public static Pattern pattern() {
    return CIRCUIT;
  }

  /**
   * Returns whether {@code text} is a complete, well-formed circuit whose numeric parameters fit a
   * double. Never throws.
   *
   * <p>A header without gates is deliberately well-formed: parsing it yields no circuit rather than
   * a syntax error, and this method answers {@code true} exactly when parsing raises no syntax or
   * field error.
   */
  public static boolean validate(String text) {
    return text != null && CIRCUIT.matcher(text).matches() && numericParametersFinite(text);
  }

  private static boolean numericParametersFinite(String text) {
    Matcher parameter = NUMERIC_PARAMETER.matcher(text);
    while (parameter.find()) {
      Double value = Doubles.tryParse(parameter.group(1));
      if (value == null || !Double.isFinite(value)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Splits a validated circuit into its gate substrings, in printed order. The caller must have
   * checked {@link #validate(String)} first; the result for other input is unspecified.
   */
  public static List<String> gateOccurrences(String text) {
    Matcher header = HEADER.matcher(text);
    if (!header.lookingAt()) {
      return List.of();
    }
    List<String> gates = new ArrayList<>();
    Matcher gate = NEXT_GATE.matcher(text);
    int position = header.end();
    while (position < text.length()) {
      gate.region(position, text.length());
      if (!gate.lookingAt()) {
        break;
      }
      gates.add(gate.group(1));
      position = gate.end();
    }
    return gates;
  }
}
